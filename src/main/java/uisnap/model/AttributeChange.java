package uisnap.model;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * One attribute that differs between a matched before/after element pair.
 * Either a {@link TextChange} or a {@link NumericChange}.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, property = "kind")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TextChange.class,    name = "text"),
        @JsonSubTypes.Type(value = NumericChange.class, name = "numeric")
})
public abstract class AttributeChange {

    /** Name of the changed attribute: {@code text}, {@code x}, {@code y}, {@code width} or {@code height}. */
    public abstract String getAttribute();

    /** Short human-readable description, e.g. {@code x: 10.0 -> 12.5}. */
    public abstract String describe();

    @Override
    public String toString() {
        return describe();
    }
}
