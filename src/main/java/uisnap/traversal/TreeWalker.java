package uisnap.traversal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uisnap.provider.NodeProvider;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Depth-first walk over a possibly cyclic element graph.
 *
 * <p>After a node is recorded its relations are followed in a fixed order: every window,
 * then the main window, then the ordinary children. A handle already seen during the same
 * walk is skipped without being recorded again, and branches stop silently below
 * {@link #getMaxDepth()} (the root is depth 0).
 *
 * <p>Each call to {@link #walk(Object)} owns a fresh visited set that is dropped when the
 * call returns; handle equality is only meaningful within one walk.
 *
 * @param <H> node handle type
 */
public class TreeWalker<H> {

    private static final Logger log = LoggerFactory.getLogger(TreeWalker.class);

    /** Default depth ceiling. */
    public static final int DEFAULT_MAX_DEPTH = 100;

    private final NodeProvider<H> provider;
    private final List<TextExtractor<H>> textExtractors;
    private final int maxDepth;

    public TreeWalker(NodeProvider<H> provider, List<TextExtractor<H>> textExtractors, int maxDepth) {
        if (maxDepth < 0) {
            throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        }
        this.provider       = Objects.requireNonNull(provider, "provider");
        this.textExtractors = List.copyOf(textExtractors);
        this.maxDepth       = maxDepth;
    }

    /** Walker reading the policy's text attributes, with the default depth ceiling. */
    public TreeWalker(NodeProvider<H> provider, FilterPolicy policy) {
        this(provider, TextExtractor.attributes(policy.getTextAttributes()), DEFAULT_MAX_DEPTH);
    }

    public int getMaxDepth() {
        return maxDepth;
    }

    /**
     * Walks the graph reachable from {@code root}.
     *
     * @throws InvalidRootException if {@code root} is null
     */
    public WalkResult walk(H root) {
        if (root == null) {
            throw new InvalidRootException("Traversal root handle is null");
        }
        Walk walk = new Walk();
        walk.run(root);
        log.debug("Walk finished: {} nodes visited, {} beyond depth {}, deepest level {}",
                walk.records.size(), walk.depthLimited, maxDepth, walk.deepest);
        return new WalkResult(walk.records, walk.roleCounts, walk.depthLimited, walk.deepest);
    }

    /** State of a single walk. */
    private final class Walk {

        private final Set<H> visited = new HashSet<>();
        private final List<RawNodeRecord> records = new ArrayList<>();
        private final Map<String, Integer> roleCounts = new LinkedHashMap<>();
        private int depthLimited;
        private int deepest;

        /** Preorder over an explicit stack, so deep chains cannot exhaust the thread stack. */
        void run(H root) {
            Deque<Frame<H>> stack = new ArrayDeque<>();
            stack.push(new Frame<>(root, 0));
            while (!stack.isEmpty()) {
                Frame<H> frame = stack.pop();
                H node = frame.node();
                int depth = frame.depth();
                if (visited.contains(node)) {
                    continue;
                }
                if (depth > maxDepth) {
                    depthLimited++;
                    continue;
                }
                visited.add(node);
                deepest = Math.max(deepest, depth);

                RawNodeRecord record = read(node, depth);
                records.add(record);
                roleCounts.merge(record.getRole(), 1, Integer::sum);

                // windows, main window, children; pushed in reverse so they pop in that order
                List<H> next = new ArrayList<>(safe(provider.windows(node)));
                H mainWindow = provider.mainWindow(node);
                if (mainWindow != null) {
                    next.add(mainWindow);
                }
                next.addAll(safe(provider.children(node)));
                for (int i = next.size() - 1; i >= 0; i--) {
                    H n = next.get(i);
                    if (n != null && !visited.contains(n)) {
                        stack.push(new Frame<>(n, depth + 1));
                    }
                }
            }
        }

        private RawNodeRecord read(H node, int depth) {
            List<String> textParts = new ArrayList<>();
            for (TextExtractor<H> extractor : textExtractors) {
                String value = extractor.extract(provider, node);
                if (value != null && !value.isBlank()) {
                    textParts.add(value);
                }
            }
            RawNodeRecord record = new RawNodeRecord(
                    provider.role(node), provider.roleDescription(node), textParts,
                    provider.position(node), provider.size(node), depth);
            log.trace("visit {}", record);
            return record;
        }
    }

    private record Frame<H>(H node, int depth) {}

    private static <T> List<T> safe(List<T> list) {
        return list != null ? list : List.of();
    }
}
