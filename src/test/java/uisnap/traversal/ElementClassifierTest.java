package uisnap.traversal;

import org.testng.annotations.Test;
import uisnap.model.Element;
import uisnap.provider.NodePoint;
import uisnap.provider.NodeSize;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link ElementClassifier}.
 */
public class ElementClassifierTest {

    private final ElementClassifier classifier = new ElementClassifier(FilterPolicy.defaults());
    private final ElementClassifier visibleOnly =
            new ElementClassifier(FilterPolicy.defaults().withOnlyVisible(true));

    // ── Acceptance rule ───────────────────────────────────────────────────

    @Test
    public void groupWithoutText_excluded() {
        ClassifiedOutcome outcome = classifier.classify(record("AXGroup", List.of(), point(0, 0), size(10, 10)));

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.isNonInteractable()).isTrue();
        assertThat(outcome.hasText()).isFalse();
        assertThat(outcome.exclusionReasons()).containsExactly("non-interactable role 'AXGroup'", "no text");
    }

    @Test
    public void staticTextWithText_accepted() {
        ClassifiedOutcome outcome = classifier.classify(record("AXStaticText", List.of("Total"), null, null));

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getElement()).isEqualTo(Element.of("AXStaticText", "Total"));
        assertThat(outcome.exclusionReasons()).isEmpty();
    }

    @Test
    public void buttonWithoutText_accepted() {
        ClassifiedOutcome outcome = classifier.classify(record("AXButton", List.of(), null, null));

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getElement().getText()).isNull();
    }

    @Test
    public void missingRole_treatedAsUnknown() {
        ClassifiedOutcome outcome = classifier.classify(record(null, List.of(), null, null));

        assertThat(outcome.getElement().getRole()).isEqualTo("AXUnknown");
        assertThat(outcome.isAccepted()).isFalse();
    }

    // ── Visibility ────────────────────────────────────────────────────────

    @Test
    public void onlyVisible_dropsInvisible() {
        ClassifiedOutcome outcome = visibleOnly.classify(record("AXButton", List.of("OK"), null, null));

        assertThat(outcome.isAccepted()).isFalse();
        assertThat(outcome.exclusionReasons()).containsExactly("not visible");
    }

    @Test
    public void oneDimensionPositive_isVisible() {
        ClassifiedOutcome outcome = visibleOnly.classify(
                record("AXSplitter", List.of("divider"), point(100, 0), size(0, 400)));

        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getElement()).isEqualTo(
                new Element("AXSplitter", "divider", 100.0, 0.0, null, 400.0));
    }

    @Test
    public void zeroSize_notVisible_noCoordinates() {
        ClassifiedOutcome outcome = classifier.classify(
                record("AXButton", List.of("hidden"), point(5, 5), size(0, 0)));

        assertThat(outcome.isGeometricallyVisible()).isFalse();
        assertThat(outcome.isAccepted()).isTrue();
        assertThat(outcome.getElement().hasPosition()).isFalse();
        assertThat(outcome.getElement().getWidth()).isNull();
    }

    @Test
    public void positionWithoutSize_notVisible() {
        ClassifiedOutcome outcome = classifier.classify(record("AXButton", List.of(), point(5, 5), null));

        assertThat(outcome.isGeometricallyVisible()).isFalse();
        assertThat(outcome.getElement().getX()).isNull();
    }

    // ── Text and role ─────────────────────────────────────────────────────

    @Test
    public void joinText() {
        assertThat(ElementClassifier.joinText(record("AXButton", List.of(" Save", "save document "), null, null)))
                .isEqualTo("Save save document");
        assertThat(ElementClassifier.joinText(record("AXButton", List.of(), null, null))).isNull();
    }

    @Test
    public void displayRole() {
        assertThat(ElementClassifier.displayRole("AXButton", "close button")).isEqualTo("AXButton (close button)");
        assertThat(ElementClassifier.displayRole("AXButton", "Button")).isEqualTo("AXButton");
        assertThat(ElementClassifier.displayRole("AXButton", "")).isEqualTo("AXButton");
        assertThat(ElementClassifier.displayRole("AXButton", null)).isEqualTo("AXButton");
        assertThat(ElementClassifier.displayRole("CustomRole", "CustomRole")).isEqualTo("CustomRole");
    }

    @Test
    public void annotatedGroup_stillNonInteractable() {
        ClassifiedOutcome outcome = classifier.classify(
                new RawNodeRecord("AXGroup", "tab group", List.of(), null, null, 1));

        assertThat(outcome.isNonInteractable()).isTrue();
        assertThat(outcome.getElement().getRole()).isEqualTo("AXGroup (tab group)");
    }

    @Test
    public void customPolicy_extraRole() {
        FilterPolicy policy = FilterPolicy.builder().nonInteractableRole("AXImage").build();

        ClassifiedOutcome outcome = new ElementClassifier(policy)
                .classify(record("AXImage", List.of(), point(0, 0), size(16, 16)));

        assertThat(outcome.isAccepted()).isFalse();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    static RawNodeRecord record(String role, List<String> text, NodePoint position, NodeSize size) {
        return new RawNodeRecord(role, null, text, position, size, 0);
    }

    static NodePoint point(double x, double y) {
        return new NodePoint(x, y);
    }

    static NodeSize size(double width, double height) {
        return new NodeSize(width, height);
    }
}
