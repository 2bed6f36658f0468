package uisnap.traversal;

import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Decides which visited nodes are interesting enough to report.
 *
 * <p>A node is accepted when its role is interactable or it carries text, and, if
 * {@link #isOnlyVisible()} is set, it is geometrically visible. Immutable; use
 * {@link #defaults()} or {@link #builder()}.
 */
public final class FilterPolicy {

    /** Container, decoration and layout roles that are dropped unless they carry text. */
    public static final Set<String> DEFAULT_NON_INTERACTABLE_ROLES = Set.of(
            "AXGroup", "AXStaticText", "AXUnknown", "AXSeparator",
            "AXHeading", "AXLayoutArea", "AXHelpTag", "AXGrowArea",
            "AXOutline", "AXScrollArea", "AXSplitGroup", "AXSplitter",
            "AXToolbar", "AXDisclosureTriangle");

    /** Text-bearing attributes in the order their values are concatenated. */
    public static final List<String> DEFAULT_TEXT_ATTRIBUTES = List.of(
            "AXValue", "AXTitle", "AXDescription", "AXLabel", "AXHelp");

    private final Set<String>  nonInteractableRoles;
    private final List<String> textAttributes;
    private final boolean      onlyVisible;

    private FilterPolicy(Builder b) {
        this.nonInteractableRoles = Set.copyOf(b.nonInteractableRoles);
        this.textAttributes       = List.copyOf(b.textAttributes);
        this.onlyVisible          = b.onlyVisible;
    }

    public static FilterPolicy defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Copy of this policy with a different visibility setting. */
    public FilterPolicy withOnlyVisible(boolean visibleOnly) {
        if (visibleOnly == onlyVisible) return this;
        return toBuilder().onlyVisible(visibleOnly).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .nonInteractableRoles(nonInteractableRoles)
                .textAttributes(textAttributes)
                .onlyVisible(onlyVisible);
    }

    public Set<String>  getNonInteractableRoles() { return nonInteractableRoles; }
    public List<String> getTextAttributes()       { return textAttributes; }
    public boolean      isOnlyVisible()           { return onlyVisible; }

    public boolean isNonInteractable(String role) {
        return nonInteractableRoles.contains(role);
    }

    @Override
    public String toString() {
        return String.format("FilterPolicy{nonInteractable=%d roles, text=%s, onlyVisible=%s}",
                nonInteractableRoles.size(), textAttributes, onlyVisible);
    }

    // ── Builder ───────────────────────────────────────────────────────────

    public static final class Builder {

        private Set<String>  nonInteractableRoles = new LinkedHashSet<>(DEFAULT_NON_INTERACTABLE_ROLES);
        private List<String> textAttributes       = DEFAULT_TEXT_ATTRIBUTES;
        private boolean      onlyVisible          = false;

        private Builder() {}

        /** Replaces the non-interactable role set. */
        public Builder nonInteractableRoles(Collection<String> roles) {
            this.nonInteractableRoles = new LinkedHashSet<>(roles);
            return this;
        }

        /** Adds one role to the non-interactable set. */
        public Builder nonInteractableRole(String role) {
            this.nonInteractableRoles.add(role);
            return this;
        }

        /** Replaces the ordered list of text-bearing attributes. */
        public Builder textAttributes(List<String> attributes) {
            this.textAttributes = List.copyOf(attributes);
            return this;
        }

        public Builder onlyVisible(boolean onlyVisible) {
            this.onlyVisible = onlyVisible;
            return this;
        }

        public FilterPolicy build() {
            return new FilterPolicy(this);
        }
    }
}
