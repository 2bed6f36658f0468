package uisnap.action;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uisnap.diff.DiffEngine;
import uisnap.diff.DiffStrategy;
import uisnap.model.Snapshot;
import uisnap.model.TraversalDiff;
import uisnap.traversal.SnapshotConfig;
import uisnap.traversal.TreeTraverser;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Captures the UI, runs an action, lets the UI settle, captures again and diffs the two.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * ActionDiffCoordinator<RecordedNode> coordinator = new ActionDiffCoordinator<>(traverser, new SnapshotConfig());
 * ActionDiffResult result = coordinator.perform(appRoot::get, "Calculator", () -> input.type("2*3="));
 * result.getDiff().getAdded().forEach(System.out::println);
 * }</pre>
 *
 * <p>The root is fetched from {@code rootSupplier} separately for each capture, since a
 * handle is only guaranteed valid within one traversal. The action still runs when the
 * first capture fails; the diff is skipped when either capture failed.
 *
 * @param <H> node handle type
 */
public class ActionDiffCoordinator<H> {

    private static final Logger log = LoggerFactory.getLogger(ActionDiffCoordinator.class);

    private final TreeTraverser<H> traverser;
    private final DiffEngine diffEngine;
    private final DiffStrategy strategy;
    private final double positionTolerance;
    private final long settleDelayMs;

    public ActionDiffCoordinator(TreeTraverser<H> traverser, DiffEngine diffEngine,
                                 DiffStrategy strategy, double positionTolerance, long settleDelayMs) {
        if (!(positionTolerance >= 0)) {
            throw new IllegalArgumentException("positionTolerance must be >= 0, got " + positionTolerance);
        }
        this.traverser         = Objects.requireNonNull(traverser, "traverser");
        this.diffEngine        = Objects.requireNonNull(diffEngine, "diffEngine");
        this.strategy          = Objects.requireNonNull(strategy, "strategy");
        this.positionTolerance = positionTolerance;
        this.settleDelayMs     = Math.max(0, settleDelayMs);
    }

    public ActionDiffCoordinator(TreeTraverser<H> traverser, SnapshotConfig config) {
        this(traverser, new DiffEngine(config.getAttributeTolerance()),
                DiffStrategy.fromName(config.getDiffStrategy()),
                config.getPositionTolerance(), config.getActionDelayMs());
    }

    /**
     * Runs {@code action} between two captures of the graph under {@code rootSupplier}.
     *
     * @param rootSupplier yields a fresh root handle for each capture
     * @param label        label given to both snapshots (suffixed with before/after)
     * @param action       the UI change to observe
     */
    public ActionDiffResult perform(Supplier<H> rootSupplier, String label, UiAction action) {
        ActionDiffResult result = new ActionDiffResult();

        log.info("[{}] capturing UI before action", label);
        Snapshot before = capture(rootSupplier, label + " (before)", result::setBeforeError);
        result.setBefore(before);

        try {
            action.perform();
            log.info("[{}] action completed", label);
        } catch (Exception e) {
            log.error("[{}] action failed: {}", label, e.getMessage(), e);
            result.setActionError(describe(e));
        }

        settle();

        log.info("[{}] capturing UI after action", label);
        Snapshot after = capture(rootSupplier, label + " (after)", result::setAfterError);
        result.setAfter(after);

        if (before != null && after != null) {
            TraversalDiff diff = diffEngine.diff(before, after, strategy, positionTolerance);
            result.setDiff(diff);
            log.info("[{}] {} diff: added={}, removed={}, modified={}", label, strategy.label(),
                    diff.getAdded().size(), diff.getRemoved().size(), diff.getModified().size());
        } else {
            log.warn("[{}] cannot calculate diff because one or both traversals failed", label);
        }
        return result;
    }

    private Snapshot capture(Supplier<H> rootSupplier, String label, Consumer<String> onError) {
        try {
            return traverser.traverse(rootSupplier.get(), label);
        } catch (RuntimeException e) {
            log.error("Traversal '{}' failed: {}", label, e.getMessage(), e);
            onError.accept(describe(e));
            return null;
        }
    }

    private void settle() {
        if (settleDelayMs == 0) return;
        log.debug("Waiting {} ms for the UI to settle", settleDelayMs);
        try {
            Thread.sleep(settleDelayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Settle delay interrupted");
        }
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }
}
