package uisnap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/** A change of one geometric attribute ({@code x}, {@code y}, {@code width} or {@code height}). */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NumericChange extends AttributeChange {

    @JsonProperty("attribute")
    private final String attribute;

    @JsonProperty("before")
    private final Double before;

    @JsonProperty("after")
    private final Double after;

    @JsonCreator
    public NumericChange(@JsonProperty("attribute") String attribute,
                         @JsonProperty("before")    Double before,
                         @JsonProperty("after")     Double after) {
        this.attribute = Objects.requireNonNull(attribute, "attribute");
        this.before    = before;
        this.after     = after;
    }

    @Override
    public String getAttribute() { return attribute; }

    public Double getBefore() { return before; }
    public Double getAfter()  { return after; }

    @Override
    public String describe() {
        return attribute + ": " + before + " -> " + after;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof NumericChange)) return false;
        NumericChange other = (NumericChange) o;
        return attribute.equals(other.attribute)
                && Objects.equals(before, other.before) && Objects.equals(after, other.after);
    }

    @Override
    public int hashCode() {
        return Objects.hash(attribute, before, after);
    }
}
