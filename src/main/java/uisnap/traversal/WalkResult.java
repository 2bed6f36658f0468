package uisnap.traversal;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Output of {@link TreeWalker#walk}: visited-node records in visiting order plus the
 * counters the walk itself keeps.
 */
public final class WalkResult {

    private final List<RawNodeRecord> records;
    private final Map<String, Integer> roleCounts;
    private final int depthLimitedCount;
    private final int maxDepthReached;

    WalkResult(List<RawNodeRecord> records, Map<String, Integer> roleCounts,
               int depthLimitedCount, int maxDepthReached) {
        this.records           = List.copyOf(records);
        this.roleCounts        = Collections.unmodifiableMap(new LinkedHashMap<>(roleCounts));
        this.depthLimitedCount = depthLimitedCount;
        this.maxDepthReached   = maxDepthReached;
    }

    public List<RawNodeRecord> getRecords()         { return records; }
    /** Raw role to number of visited nodes with that role. */
    public Map<String, Integer> getRoleCounts()     { return roleCounts; }
    /** Nodes not entered because they lay beyond the depth ceiling. */
    public int getDepthLimitedCount()               { return depthLimitedCount; }
    public int getMaxDepthReached()                 { return maxDepthReached; }

    public int getVisitedCount() {
        return records.size();
    }
}
