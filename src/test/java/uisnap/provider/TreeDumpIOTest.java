package uisnap.provider;

import org.testng.annotations.Test;

import java.io.IOException;
import java.net.URISyntaxException;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link TreeDumpIO} linking and validation.
 */
public class TreeDumpIOTest {

    @Test
    public void read_linksRelations() throws Exception {
        RecordedNode app = TreeDumpIO.read(resource("/trees/calculator.json"));

        assertThat(app.getId()).isEqualTo("app");
        assertThat(app.getWindows()).hasSize(1);
        RecordedNode window = app.getWindows().get(0);
        assertThat(app.getMainWindow()).isSameAs(window);
        assertThat(window.getAttributes()).containsEntry("AXTitle", "Calculator");
        assertThat(window.getPosition().getY()).isEqualTo(25.0);
        assertThat(window.getSize().getWidth()).isEqualTo(230.0);
        assertThat(window.getChildren()).extracting(RecordedNode::getId)
                .containsExactly("close", "display", "keypad");
        assertThat(window.getChildren().get(0).getRoleDescription()).isEqualTo("close button");
    }

    @Test
    public void read_cycleWithImplicitRoot() throws Exception {
        RecordedNode app = TreeDumpIO.read(resource("/trees/cycle.json"));

        assertThat(app.getId()).isEqualTo("app");
        RecordedNode button = app.getWindows().get(0).getChildren().get(0);
        assertThat(button.getChildren()).containsExactly(app.getWindows().get(0), app);
    }

    @Test
    public void fromJson_noNodes_throws() {
        assertThatThrownBy(() -> TreeDumpIO.fromJson("{\"nodes\":[]}"))
                .isInstanceOf(TreeDumpIO.MalformedTreeException.class)
                .hasMessageContaining("no nodes");
    }

    @Test
    public void fromJson_duplicateId_throws() {
        String json = "{\"nodes\":[{\"id\":\"a\",\"role\":\"AXButton\"},{\"id\":\"a\",\"role\":\"AXWindow\"}]}";

        assertThatThrownBy(() -> TreeDumpIO.fromJson(json))
                .isInstanceOf(TreeDumpIO.MalformedTreeException.class)
                .hasMessageContaining("Duplicate node id: a");
    }

    @Test
    public void fromJson_missingId_throws() {
        assertThatThrownBy(() -> TreeDumpIO.fromJson("{\"nodes\":[{\"role\":\"AXButton\"}]}"))
                .isInstanceOf(TreeDumpIO.MalformedTreeException.class);
    }

    @Test
    public void fromJson_danglingReference_throws() {
        String json = "{\"nodes\":[{\"id\":\"a\",\"role\":\"AXGroup\",\"children\":[\"ghost\"]}]}";

        assertThatThrownBy(() -> TreeDumpIO.fromJson(json))
                .isInstanceOf(TreeDumpIO.MalformedTreeException.class)
                .hasMessageContaining("'ghost'");
    }

    @Test
    public void fromJson_nullLists() throws IOException {
        RecordedNode node = TreeDumpIO.fromJson(
                "{\"nodes\":[{\"id\":\"a\",\"role\":null,\"attributes\":null,\"children\":null,\"windows\":null}]}");

        assertThat(node.getRole()).isNull();
        assertThat(node.getChildren()).isEmpty();
        assertThat(node.getAttributes()).isEmpty();
    }

    @Test
    public void recordedTreeProvider_readsNodeAttributes() {
        RecordedNode child = RecordedNode.of("c", "AXButton");
        RecordedNode node = RecordedNode.of("n", "AXWindow")
                .roleDescription("standard window")
                .attribute("AXTitle", "Main")
                .bounds(1, 2, 3, 4)
                .child(child);
        RecordedTreeProvider provider = RecordedTreeProvider.INSTANCE;

        assertThat(provider.role(node)).isEqualTo("AXWindow");
        assertThat(provider.roleDescription(node)).isEqualTo("standard window");
        assertThat(provider.stringAttribute(node, "AXTitle")).isEqualTo("Main");
        assertThat(provider.stringAttribute(node, "AXValue")).isNull();
        assertThat(provider.position(node).getX()).isEqualTo(1.0);
        assertThat(provider.size(node).getHeight()).isEqualTo(4.0);
        assertThat(provider.children(node)).containsExactly(child);
        assertThat(provider.windows(node)).isEmpty();
        assertThat(provider.mainWindow(node)).isNull();
    }

    static Path resource(String name) throws URISyntaxException {
        return Path.of(TreeDumpIOTest.class.getResource(name).toURI());
    }
}
