package uisnap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.stream.Collectors;

/** A before/after element pair matched by the fine diff, with the attributes that changed. */
public final class ModifiedElement {

    @JsonProperty("before")
    private final Element before;

    @JsonProperty("after")
    private final Element after;

    @JsonProperty("changes")
    private final List<AttributeChange> changes;

    @JsonCreator
    public ModifiedElement(@JsonProperty("before")  Element before,
                           @JsonProperty("after")   Element after,
                           @JsonProperty("changes") List<AttributeChange> changes) {
        this.before  = before;
        this.after   = after;
        this.changes = changes != null ? List.copyOf(changes) : List.of();
    }

    public Element               getBefore()  { return before; }
    public Element               getAfter()   { return after; }
    public List<AttributeChange> getChanges() { return changes; }

    @Override
    public String toString() {
        return String.format("%s [%s]", before.getRole(),
                changes.stream().map(AttributeChange::describe).collect(Collectors.joining("; ")));
    }
}
