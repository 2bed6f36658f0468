package uisnap.traversal;

import uisnap.model.Element;

import java.util.ArrayList;
import java.util.List;

/**
 * Filter decision for one {@link RawNodeRecord}. The resolved {@link Element} is present
 * whether or not the node was accepted, so callers can log what was dropped.
 */
public final class ClassifiedOutcome {

    private final Element element;
    private final boolean accepted;
    private final boolean hasText;
    private final boolean nonInteractable;
    private final boolean geometricallyVisible;
    private final boolean onlyVisible;

    ClassifiedOutcome(Element element, boolean accepted, boolean hasText,
                      boolean nonInteractable, boolean geometricallyVisible, boolean onlyVisible) {
        this.element              = element;
        this.accepted             = accepted;
        this.hasText              = hasText;
        this.nonInteractable      = nonInteractable;
        this.geometricallyVisible = geometricallyVisible;
        this.onlyVisible          = onlyVisible;
    }

    public Element getElement()             { return element; }
    public boolean isAccepted()             { return accepted; }
    public boolean hasText()                { return hasText; }
    public boolean isNonInteractable()      { return nonInteractable; }
    public boolean isGeometricallyVisible() { return geometricallyVisible; }

    /** Why the node was excluded; empty for accepted nodes. */
    public List<String> exclusionReasons() {
        List<String> reasons = new ArrayList<>();
        if (accepted) return reasons;
        boolean passesRoleFilter = !nonInteractable || hasText;
        if (!passesRoleFilter) {
            reasons.add("non-interactable role '" + element.getRole() + "'");
            reasons.add("no text");
        } else if (onlyVisible && !geometricallyVisible) {
            reasons.add("not visible");
        }
        return reasons;
    }

    @Override
    public String toString() {
        return (accepted ? "accept " : "exclude ") + element
                + (accepted ? "" : " " + exclusionReasons());
    }
}
