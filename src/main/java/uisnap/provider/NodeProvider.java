package uisnap.provider;

import java.util.List;

/**
 * Read-only access to the nodes of an externally owned UI element graph.
 *
 * <p>Implementations wrap whatever the platform hands out (an accessibility element
 * reference, a recorded tree, a test fixture). They perform no traversal of their own.
 * Handles of type {@code H} must implement {@code equals}/{@code hashCode} by node
 * identity, stable for the duration of one traversal; two handles to the same node must
 * be equal even if obtained through different relations.
 *
 * <p>Every accessor returns {@code null} (or an empty list) when the node does not
 * expose the attribute. Accessors must not throw for unsupported attributes.
 *
 * @param <H> node handle type
 */
public interface NodeProvider<H> {

    /** Raw role name, e.g. {@code AXButton}; {@code null} if the node reports none. */
    String role(H node);

    /** Localized role description, e.g. {@code "button"}; may be null. */
    String roleDescription(H node);

    /**
     * Value of a named string attribute such as {@code AXTitle} or {@code AXValue}.
     * Returns null when the attribute is missing or not a string.
     */
    String stringAttribute(H node, String attribute);

    /** Top-left screen position, or null. */
    NodePoint position(H node);

    /** On-screen size, or null. */
    NodeSize size(H node);

    /** Ordered windows of the node (usually only the application root has any). */
    List<H> windows(H node);

    /** The node's main window, or null. */
    H mainWindow(H node);

    /** Ordered ordinary children. */
    List<H> children(H node);
}
