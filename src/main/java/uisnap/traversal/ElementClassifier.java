package uisnap.traversal;

import uisnap.model.Element;
import uisnap.provider.NodePoint;
import uisnap.provider.NodeSize;

import java.util.Objects;

/**
 * Applies a {@link FilterPolicy} to raw node records.
 *
 * <p>Geometry: a node is geometrically visible when it has a position and a size with at
 * least one positive dimension. Only then are coordinates reported, and a zero dimension
 * is reported as absent rather than 0.
 *
 * <p>Text: the non-blank text parts joined by a single space and trimmed; empty means none.
 *
 * <p>Role: annotated with the role description, {@code "AXButton (close button)"}, when the
 * description is non-empty and differs from the role minus its {@code AX} prefix.
 */
public class ElementClassifier {

    private final FilterPolicy policy;

    public ElementClassifier(FilterPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public FilterPolicy getPolicy() {
        return policy;
    }

    public ClassifiedOutcome classify(RawNodeRecord record) {
        String role = record.getRole();
        String text = joinText(record);
        boolean hasText = text != null;
        boolean nonInteractable = policy.isNonInteractable(role);

        NodePoint p = record.getPosition();
        NodeSize s = record.getSize();
        boolean visible = p != null && s != null && s.hasPositiveDimension();

        Double x = null, y = null, width = null, height = null;
        if (visible) {
            x      = p.getX();
            y      = p.getY();
            width  = s.getWidth() > 0 ? s.getWidth() : null;
            height = s.getHeight() > 0 ? s.getHeight() : null;
        }

        Element element = new Element(displayRole(role, record.getRoleDescription()), text, x, y, width, height);
        boolean passesRoleFilter = !nonInteractable || hasText;
        boolean accepted = passesRoleFilter && (!policy.isOnlyVisible() || visible);
        return new ClassifiedOutcome(element, accepted, hasText, nonInteractable, visible, policy.isOnlyVisible());
    }

    static String joinText(RawNodeRecord record) {
        if (record.getTextParts().isEmpty()) return null;
        String joined = String.join(" ", record.getTextParts()).trim();
        return joined.isEmpty() ? null : joined;
    }

    static String displayRole(String role, String description) {
        if (description == null || description.isEmpty()) return role;
        String bare = role.startsWith("AX") ? role.substring(2) : role;
        return description.equals(bare) ? role : role + " (" + description + ")";
    }
}
