package uisnap.traversal;

import uisnap.provider.NodePoint;
import uisnap.provider.NodeSize;

import java.util.List;

/**
 * Attributes of one visited node as read from the provider, before any filtering.
 */
public final class RawNodeRecord {

    /** Role reported for nodes that expose none. */
    public static final String UNKNOWN_ROLE = "AXUnknown";

    private final String       role;
    private final String       roleDescription;
    private final List<String> textParts;
    private final NodePoint    position;
    private final NodeSize     size;
    private final int          depth;

    public RawNodeRecord(String role, String roleDescription, List<String> textParts,
                         NodePoint position, NodeSize size, int depth) {
        this.role            = role != null ? role : UNKNOWN_ROLE;
        this.roleDescription = roleDescription;
        this.textParts       = textParts != null ? List.copyOf(textParts) : List.of();
        this.position        = position;
        this.size            = size;
        this.depth           = depth;
    }

    public String       getRole()            { return role; }
    public String       getRoleDescription() { return roleDescription; }
    /** Non-blank text values in extractor order. */
    public List<String> getTextParts()       { return textParts; }
    public NodePoint    getPosition()        { return position; }
    public NodeSize     getSize()            { return size; }
    public int          getDepth()           { return depth; }

    @Override
    public String toString() {
        return String.format("RawNodeRecord{role='%s', depth=%d, text=%s, %s, %s}",
                role, depth, textParts, position, size);
    }
}
