package uisnap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * Difference between two snapshots. The coarse strategy never fills {@link #getModified()};
 * an element whose attributes changed shows up there as one removal plus one addition.
 *
 * <p>Holds no reference back to the snapshots it was computed from.
 */
public final class TraversalDiff {

    @JsonProperty("strategy")
    private final String strategy;

    @JsonProperty("added")
    private final List<Element> added;

    @JsonProperty("removed")
    private final List<Element> removed;

    @JsonProperty("modified")
    private final List<ModifiedElement> modified;

    @JsonCreator
    public TraversalDiff(@JsonProperty("strategy") String strategy,
                         @JsonProperty("added")    List<Element> added,
                         @JsonProperty("removed")  List<Element> removed,
                         @JsonProperty("modified") List<ModifiedElement> modified) {
        this.strategy = strategy;
        this.added    = added != null ? List.copyOf(added) : List.of();
        this.removed  = removed != null ? List.copyOf(removed) : List.of();
        this.modified = modified != null ? List.copyOf(modified) : List.of();
    }

    public String                getStrategy() { return strategy; }
    public List<Element>         getAdded()    { return added; }
    public List<Element>         getRemoved()  { return removed; }
    public List<ModifiedElement> getModified() { return modified; }

    /** True when nothing was added, removed or modified. */
    @JsonIgnore
    public boolean isEmpty() {
        return added.isEmpty() && removed.isEmpty() && modified.isEmpty();
    }

    /** Returns a human-readable summary listing every change. */
    public String summary() {
        StringBuilder sb = new StringBuilder(String.format(
                "Traversal diff (%s): added: %d | removed: %d | modified: %d",
                strategy, added.size(), removed.size(), modified.size()));
        added.forEach(e -> sb.append("\n  + ").append(e));
        removed.forEach(e -> sb.append("\n  - ").append(e));
        modified.forEach(m -> sb.append("\n  ~ ").append(m));
        return sb.toString();
    }

    @Override
    public String toString() {
        return String.format("TraversalDiff{strategy=%s, added=%d, removed=%d, modified=%d}",
                strategy, added.size(), removed.size(), modified.size());
    }
}
