package uisnap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate counters produced by one traversal.
 *
 * <p>{@code count == withTextCount + withoutTextCount}. Nodes skipped because they were
 * already visited or lay beyond the depth ceiling appear in no counter; every visited node
 * contributes to {@link #getRoleCounts()} whatever the filter decides.
 *
 * <p>{@code excludedNonInteractable} and {@code excludedNoText} may both count the same
 * excluded node; they are independent reasons, not a partition of {@code excludedCount}.
 */
public final class TraversalStatistics {

    @JsonProperty("count")
    private final int count;

    @JsonProperty("excluded_count")
    private final int excludedCount;

    @JsonProperty("excluded_non_interactable")
    private final int excludedNonInteractable;

    @JsonProperty("excluded_no_text")
    private final int excludedNoText;

    @JsonProperty("with_text_count")
    private final int withTextCount;

    @JsonProperty("without_text_count")
    private final int withoutTextCount;

    @JsonProperty("visible_elements_count")
    private final int visibleElementsCount;

    @JsonProperty("role_counts")
    private final Map<String, Integer> roleCounts;

    @JsonCreator
    public TraversalStatistics(@JsonProperty("count")                     int count,
                               @JsonProperty("excluded_count")            int excludedCount,
                               @JsonProperty("excluded_non_interactable") int excludedNonInteractable,
                               @JsonProperty("excluded_no_text")          int excludedNoText,
                               @JsonProperty("with_text_count")           int withTextCount,
                               @JsonProperty("without_text_count")        int withoutTextCount,
                               @JsonProperty("visible_elements_count")    int visibleElementsCount,
                               @JsonProperty("role_counts")               Map<String, Integer> roleCounts) {
        this.count                   = count;
        this.excludedCount           = excludedCount;
        this.excludedNonInteractable = excludedNonInteractable;
        this.excludedNoText          = excludedNoText;
        this.withTextCount           = withTextCount;
        this.withoutTextCount        = withoutTextCount;
        this.visibleElementsCount    = visibleElementsCount;
        // sorted so serialized output is reproducible
        this.roleCounts = roleCounts != null
                ? Collections.unmodifiableMap(new TreeMap<>(roleCounts))
                : Map.of();
    }

    /** Statistics of a traversal that saw nothing. */
    public static TraversalStatistics empty() {
        return new TraversalStatistics(0, 0, 0, 0, 0, 0, 0, Map.of());
    }

    public int                  getCount()                   { return count; }
    public int                  getExcludedCount()           { return excludedCount; }
    public int                  getExcludedNonInteractable() { return excludedNonInteractable; }
    public int                  getExcludedNoText()          { return excludedNoText; }
    public int                  getWithTextCount()           { return withTextCount; }
    public int                  getWithoutTextCount()        { return withoutTextCount; }
    public int                  getVisibleElementsCount()    { return visibleElementsCount; }
    public Map<String, Integer> getRoleCounts()              { return roleCounts; }

    @Override
    public String toString() {
        return String.format("TraversalStatistics{count=%d, excluded=%d, withText=%d, withoutText=%d, visible=%d, roles=%d}",
                count, excludedCount, withTextCount, withoutTextCount, visibleElementsCount, roleCounts.size());
    }
}
