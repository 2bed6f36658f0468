package uisnap.provider;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A node of a recorded (or hand-built) element graph.
 *
 * <p>Equality is object identity, which is what the walker's cycle guard needs: the
 * same instance reached through two relations is one node, while two distinct nodes with
 * identical attributes stay distinct. Relations may point anywhere in the graph,
 * including back at an ancestor.
 *
 * <pre>{@code
 * RecordedNode window = RecordedNode.of("win", "AXWindow").attribute("AXTitle", "Calculator");
 * RecordedNode app = RecordedNode.of("app", "AXApplication").window(window).mainWindow(window);
 * }</pre>
 */
public final class RecordedNode {

    private final String id;
    private final String role;
    private String roleDescription;
    private final Map<String, String> attributes = new LinkedHashMap<>();
    private NodePoint position;
    private NodeSize size;
    private final List<RecordedNode> windows = new ArrayList<>();
    private RecordedNode mainWindow;
    private final List<RecordedNode> children = new ArrayList<>();

    private RecordedNode(String id, String role) {
        this.id   = id;
        this.role = role;
    }

    /** Creates a node; {@code role} may be null to model a node that reports no role. */
    public static RecordedNode of(String id, String role) {
        return new RecordedNode(id, role);
    }

    // ── Fluent construction ───────────────────────────────────────────────

    public RecordedNode roleDescription(String description) {
        this.roleDescription = description;
        return this;
    }

    public RecordedNode attribute(String name, String value) {
        attributes.put(name, value);
        return this;
    }

    public RecordedNode at(double x, double y) {
        this.position = new NodePoint(x, y);
        return this;
    }

    public RecordedNode size(double width, double height) {
        this.size = new NodeSize(width, height);
        return this;
    }

    /** Sets position and size in one call. */
    public RecordedNode bounds(double x, double y, double width, double height) {
        return at(x, y).size(width, height);
    }

    public RecordedNode window(RecordedNode window) {
        windows.add(window);
        return this;
    }

    public RecordedNode mainWindow(RecordedNode window) {
        this.mainWindow = window;
        return this;
    }

    public RecordedNode child(RecordedNode child) {
        children.add(child);
        return this;
    }

    public RecordedNode children(RecordedNode... nodes) {
        Collections.addAll(children, nodes);
        return this;
    }

    // ── Accessors ─────────────────────────────────────────────────────────

    public String              getId()              { return id; }
    public String              getRole()            { return role; }
    public String              getRoleDescription() { return roleDescription; }
    public Map<String, String> getAttributes()      { return Collections.unmodifiableMap(attributes); }
    public NodePoint           getPosition()        { return position; }
    public NodeSize            getSize()            { return size; }
    public List<RecordedNode>  getWindows()         { return Collections.unmodifiableList(windows); }
    public RecordedNode        getMainWindow()      { return mainWindow; }
    public List<RecordedNode>  getChildren()        { return Collections.unmodifiableList(children); }

    @Override
    public String toString() {
        return "RecordedNode{id='" + id + "', role='" + role + "'}";
    }
}
