package uisnap.action;

import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;
import uisnap.diff.DiffEngine;
import uisnap.diff.DiffStrategy;
import uisnap.model.Element;
import uisnap.provider.RecordedNode;
import uisnap.provider.RecordedTreeProvider;
import uisnap.traversal.FilterPolicy;
import uisnap.traversal.InvalidRootException;
import uisnap.traversal.SnapshotConfig;
import uisnap.traversal.TreeTraverser;

import java.io.IOException;
import java.util.Properties;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link ActionDiffCoordinator}.
 */
public class ActionDiffCoordinatorTest {

    private RecordedNode window;
    private RecordedNode display;
    private ActionDiffCoordinator<RecordedNode> coordinator;

    @Mock
    private TreeTraverser<RecordedNode> mockTraverser;

    private AutoCloseable mocks;

    @BeforeMethod
    public void setUp() {
        mocks = MockitoAnnotations.openMocks(this);
        display = RecordedNode.of("display", "AXStaticText").attribute("AXValue", "2").bounds(10, 60, 210, 50);
        window = RecordedNode.of("win", "AXWindow").attribute("AXTitle", "Calculator")
                .bounds(0, 25, 230, 410).child(display);
        TreeTraverser<RecordedNode> traverser =
                new TreeTraverser<>(RecordedTreeProvider.INSTANCE, FilterPolicy.defaults());
        coordinator = new ActionDiffCoordinator<>(traverser, new DiffEngine(), DiffStrategy.FINE, 5.0, 0);
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() throws Exception {
        mocks.close();
    }

    @Test
    public void perform_reportsChange() {
        ActionDiffResult result = coordinator.perform(() -> window, "Calculator",
                () -> display.attribute("AXValue", "23"));

        assertThat(result.isComplete()).isTrue();
        assertThat(result.getBefore().getLabel()).isEqualTo("Calculator (before)");
        assertThat(result.getAfter().getLabel()).isEqualTo("Calculator (after)");
        assertThat(result.getDiff().getModified()).hasSize(1);
        assertThat(result.getDiff().getModified().get(0).getChanges().get(0).describe())
                .isEqualTo("text: \"2\" -> \"23\" (+\"3\")");
    }

    @Test
    public void perform_nodeAdded() {
        RecordedNode sheet = RecordedNode.of("sheet", "AXSheet").attribute("AXTitle", "Error").bounds(20, 60, 190, 100);

        ActionDiffResult result = coordinator.perform(() -> window, "Calculator", () -> window.child(sheet));

        assertThat(result.getDiff().getAdded()).containsExactly(
                new Element("AXSheet", "Error", 20.0, 60.0, 190.0, 100.0));
        assertThat(result.getDiff().getRemoved()).isEmpty();
    }

    @Test
    public void perform_actionFails() {
        ActionDiffResult result = coordinator.perform(() -> window, "Calculator", () -> {
            throw new IOException("input device unavailable");
        });

        assertThat(result.getActionError()).isEqualTo("input device unavailable");
        assertThat(result.getBefore()).isNotNull();
        assertThat(result.getAfter()).isNotNull();
        assertThat(result.getDiff().isEmpty()).isTrue();
        assertThat(result.isComplete()).isFalse();
    }

    @Test
    public void perform_beforeCaptureFails() {
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger actions = new AtomicInteger();

        ActionDiffResult result = coordinator.perform(
                () -> calls.getAndIncrement() == 0 ? null : window, "Calculator", actions::incrementAndGet);

        assertThat(actions.get()).isEqualTo(1);
        assertThat(result.getBefore()).isNull();
        assertThat(result.getBeforeError()).contains("root handle is null");
        assertThat(result.getAfter()).isNotNull();
        assertThat(result.getDiff()).isNull();
    }

    @Test
    public void perform_traverserThrows() {
        when(mockTraverser.traverse(any(), anyString()))
                .thenThrow(new InvalidRootException("application quit"));
        DiffEngine diffEngine = mock(DiffEngine.class);
        ActionDiffCoordinator<RecordedNode> failing =
                new ActionDiffCoordinator<>(mockTraverser, diffEngine, DiffStrategy.COARSE, 5.0, 0);

        ActionDiffResult result = failing.perform(() -> window, "gone", () -> { });

        assertThat(result.getBeforeError()).isEqualTo("application quit");
        assertThat(result.getAfterError()).isEqualTo("application quit");
        assertThat(result.getActionError()).isNull();
        verify(diffEngine, never()).diff(any(), any(), any(), anyDouble());
    }

    @Test
    public void configConstructor() {
        Properties p = new Properties();
        p.setProperty("diff.strategy", "coarse");
        p.setProperty("action.delay.ms", "0");
        ActionDiffCoordinator<RecordedNode> configured = new ActionDiffCoordinator<>(
                new TreeTraverser<>(RecordedTreeProvider.INSTANCE, FilterPolicy.defaults()),
                SnapshotConfig.of(p));

        ActionDiffResult result = configured.perform(() -> window, "Calculator",
                () -> display.attribute("AXValue", "23"));

        assertThat(result.getDiff().getStrategy()).isEqualTo("coarse");
        assertThat(result.getDiff().getAdded()).hasSize(1);
        assertThat(result.getDiff().getRemoved()).hasSize(1);
    }

    @Test
    public void configConstructor_negativeToleranceUsesDefault() {
        Properties p = new Properties();
        p.setProperty("diff.strategy", "fine");
        p.setProperty("diff.position.tolerance", "-1");
        p.setProperty("diff.attribute.tolerance", "-1");
        p.setProperty("action.delay.ms", "0");
        ActionDiffCoordinator<RecordedNode> configured = new ActionDiffCoordinator<>(
                new TreeTraverser<>(RecordedTreeProvider.INSTANCE, FilterPolicy.defaults()),
                SnapshotConfig.of(p));

        ActionDiffResult result = configured.perform(() -> window, "Calculator",
                () -> display.attribute("AXValue", "23"));

        assertThat(result.getBefore()).isNotNull();
        assertThat(result.getAfter()).isNotNull();
        assertThat(result.getDiff().getStrategy()).isEqualTo("fine");
        assertThat(result.getDiff().getModified()).hasSize(1);
    }

    @Test
    public void constructor_rejectsNegativeTolerance() {
        assertThatThrownBy(() -> new ActionDiffCoordinator<>(mockTraverser, new DiffEngine(), DiffStrategy.FINE, -1.0, 0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
