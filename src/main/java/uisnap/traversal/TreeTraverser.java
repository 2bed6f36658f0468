package uisnap.traversal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uisnap.model.Snapshot;
import uisnap.provider.NodeProvider;

import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Turns the element graph under a root handle into a {@link Snapshot}:
 * walk, classify every visited node, then sort and freeze the accepted elements.
 *
 * <h3>Usage</h3>
 * <pre>{@code
 * TreeTraverser<RecordedNode> traverser =
 *         new TreeTraverser<>(RecordedTreeProvider.INSTANCE, new SnapshotConfig());
 * Snapshot snapshot = traverser.traverse(root, "Calculator", true);
 * }</pre>
 *
 * <p>Traversal reads node attributes and nothing else. Running it twice against an
 * unchanged graph yields identical element lists. Instances hold no per-traversal state
 * and may be reused.
 *
 * @param <H> node handle type
 */
public class TreeTraverser<H> {

    private static final Logger log = LoggerFactory.getLogger(TreeTraverser.class);

    private final NodeProvider<H> provider;
    private final FilterPolicy policy;
    private final int maxDepth;

    public TreeTraverser(NodeProvider<H> provider, FilterPolicy policy, int maxDepth) {
        this.provider = Objects.requireNonNull(provider, "provider");
        this.policy   = Objects.requireNonNull(policy, "policy");
        this.maxDepth = maxDepth;
    }

    public TreeTraverser(NodeProvider<H> provider, FilterPolicy policy) {
        this(provider, policy, TreeWalker.DEFAULT_MAX_DEPTH);
    }

    public TreeTraverser(NodeProvider<H> provider, SnapshotConfig config) {
        this(provider, config.toFilterPolicy(), config.getMaxDepth());
    }

    public FilterPolicy getPolicy() {
        return policy;
    }

    /** Traverses with this traverser's policy, overriding only its visibility setting. */
    public Snapshot traverse(H root, boolean onlyVisible) {
        return traverse(root, String.valueOf(root), policy.withOnlyVisible(onlyVisible));
    }

    public Snapshot traverse(H root, String label, boolean onlyVisible) {
        return traverse(root, label, policy.withOnlyVisible(onlyVisible));
    }

    /** Traverses with this traverser's policy unchanged. */
    public Snapshot traverse(H root, String label) {
        return traverse(root, label, policy);
    }

    /**
     * Captures one snapshot.
     *
     * @throws InvalidRootException if {@code root} is null
     */
    public Snapshot traverse(H root, String label, FilterPolicy filterPolicy) {
        if (root == null) {
            throw new InvalidRootException("Cannot traverse '" + label + "': root handle is null");
        }
        log.info("Starting traversal of '{}' (visible only: {})", label, filterPolicy.isOnlyVisible());
        long start = System.nanoTime();
        long step = start;

        TreeWalker<H> walker = new TreeWalker<>(provider,
                TextExtractor.attributes(filterPolicy.getTextAttributes()), maxDepth);
        WalkResult walk = walker.walk(root);
        step = logStep(step, "walking element tree (" + walk.getVisitedCount() + " nodes visited)");
        if (walk.getDepthLimitedCount() > 0) {
            log.warn("{} node(s) of '{}' lie beyond depth {} and were skipped",
                    walk.getDepthLimitedCount(), label, maxDepth);
        }

        ElementClassifier classifier = new ElementClassifier(filterPolicy);
        SnapshotAccumulator accumulator = new SnapshotAccumulator();
        for (RawNodeRecord record : walk.getRecords()) {
            accumulator.add(classifier.classify(record));
        }
        step = logStep(step, "classifying nodes (" + accumulator.getCollectedCount() + " elements collected)");

        Snapshot snapshot = accumulator.toSnapshot(label, walk.getRoleCounts(),
                Duration.ofNanos(System.nanoTime() - start));
        logStep(step, "sorting " + snapshot.size() + " elements");
        log.info("Total traversal time for '{}': {} seconds", label, snapshot.getProcessingTimeSeconds());
        return snapshot;
    }

    /** Logs the duration of the step just completed and returns the new step start. */
    private static long logStep(long stepStart, String description) {
        long now = System.nanoTime();
        if (log.isInfoEnabled()) {
            log.info("[{}s] finished '{}'",
                    String.format(Locale.ROOT, "%.3f", (now - stepStart) / 1_000_000_000.0), description);
        }
        return now;
    }
}
