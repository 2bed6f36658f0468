package uisnap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Objects;

/**
 * A change of an element's text.
 *
 * <p>When one value is a prefix or suffix of the other the delta is recorded as well:
 * typing {@code "12"} into a field showing {@code "1"} yields {@code addedText = "2"},
 * deleting back yields {@code removedText = "2"}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class TextChange extends AttributeChange {

    @JsonProperty("before")
    private final String before;

    @JsonProperty("after")
    private final String after;

    @JsonProperty("addedText")
    private final String addedText;

    @JsonProperty("removedText")
    private final String removedText;

    @JsonCreator
    public TextChange(@JsonProperty("before")      String before,
                      @JsonProperty("after")       String after,
                      @JsonProperty("addedText")   String addedText,
                      @JsonProperty("removedText") String removedText) {
        this.before      = before;
        this.after       = after;
        this.addedText   = addedText;
        this.removedText = removedText;
    }

    /** Builds a change from two text values, deriving the prefix/suffix delta when there is one. */
    public static TextChange between(String before, String after) {
        String b = before != null ? before : "";
        String a = after != null ? after : "";
        String added = null;
        String removed = null;
        if (a.length() > b.length()) {
            if (a.startsWith(b))    added = a.substring(b.length());
            else if (a.endsWith(b)) added = a.substring(0, a.length() - b.length());
        } else if (b.length() > a.length()) {
            if (b.startsWith(a))    removed = b.substring(a.length());
            else if (b.endsWith(a)) removed = b.substring(0, b.length() - a.length());
        }
        return new TextChange(before, after, added, removed);
    }

    @Override
    @JsonIgnore
    public String getAttribute() { return "text"; }

    public String getBefore()      { return before; }
    public String getAfter()       { return after; }
    public String getAddedText()   { return addedText; }
    public String getRemovedText() { return removedText; }

    @Override
    public String describe() {
        StringBuilder sb = new StringBuilder("text: ")
                .append(quote(before)).append(" -> ").append(quote(after));
        if (addedText != null)   sb.append(" (+").append(quote(addedText)).append(')');
        if (removedText != null) sb.append(" (-").append(quote(removedText)).append(')');
        return sb.toString();
    }

    private static String quote(String s) {
        return s == null ? "nil" : '"' + s + '"';
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TextChange)) return false;
        TextChange other = (TextChange) o;
        return Objects.equals(before, other.before) && Objects.equals(after, other.after)
                && Objects.equals(addedText, other.addedText)
                && Objects.equals(removedText, other.removedText);
    }

    @Override
    public int hashCode() {
        return Objects.hash(before, after, addedText, removedText);
    }
}
