package uisnap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * One reported UI node after filtering.
 *
 * <p>Equality covers all six attributes, so two elements with the same role, text and
 * geometry are indistinguishable. Snapshots rely on this for deduplication and the
 * coarse diff relies on it for set subtraction.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Element {

    /** Raw role, optionally annotated with its description, e.g. {@code "AXButton (close button)"}. */
    @JsonProperty("role")
    private final String role;

    @JsonProperty("text")
    private final String text;

    @JsonProperty("x")
    private final Double x;

    @JsonProperty("y")
    private final Double y;

    @JsonProperty("width")
    private final Double width;

    @JsonProperty("height")
    private final Double height;

    @JsonCreator
    public Element(@JsonProperty("role")   String role,
                   @JsonProperty("text")   String text,
                   @JsonProperty("x")      Double x,
                   @JsonProperty("y")      Double y,
                   @JsonProperty("width")  Double width,
                   @JsonProperty("height") Double height) {
        this.role   = Objects.requireNonNull(role, "role");
        this.text   = text;
        this.x      = unsigned(x);
        this.y      = unsigned(y);
        this.width  = unsigned(width);
        this.height = unsigned(height);
    }

    /** Element with a role and text but no geometry. */
    public static Element of(String role, String text) {
        return new Element(role, text, null, null, null, null);
    }

    public String getRole()   { return role; }
    public String getText()   { return text; }
    public Double getX()      { return x; }
    public Double getY()      { return y; }
    public Double getWidth()  { return width; }
    public Double getHeight() { return height; }

    /** True when both coordinates are known. */
    public boolean hasPosition() {
        return x != null && y != null;
    }

    /** True when text is present and not empty. */
    public boolean hasText() {
        return text != null && !text.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Element)) return false;
        Element other = (Element) o;
        return role.equals(other.role)
                && Objects.equals(text, other.text)
                && Objects.equals(x, other.x)
                && Objects.equals(y, other.y)
                && Objects.equals(width, other.width)
                && Objects.equals(height, other.height);
    }

    @Override
    public int hashCode() {
        return Objects.hash(role, text, x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format("Element{role='%s', text='%s', pos=(%s, %s), size=(%s x %s)}",
                role, text, x, y, width, height);
    }

    /** Folds -0.0 into 0.0 so both compare and hash alike. */
    private static Double unsigned(Double value) {
        return value != null && value == 0.0 ? Double.valueOf(0.0) : value;
    }
}
