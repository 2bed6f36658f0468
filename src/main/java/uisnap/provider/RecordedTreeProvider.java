package uisnap.provider;

import java.util.List;

/** {@link NodeProvider} over {@link RecordedNode} graphs. Stateless; one instance serves any graph. */
public class RecordedTreeProvider implements NodeProvider<RecordedNode> {

    public static final RecordedTreeProvider INSTANCE = new RecordedTreeProvider();

    @Override public String role(RecordedNode node)            { return node.getRole(); }
    @Override public String roleDescription(RecordedNode node) { return node.getRoleDescription(); }
    @Override public NodePoint position(RecordedNode node)     { return node.getPosition(); }
    @Override public NodeSize size(RecordedNode node)          { return node.getSize(); }
    @Override public List<RecordedNode> windows(RecordedNode node)  { return node.getWindows(); }
    @Override public RecordedNode mainWindow(RecordedNode node)     { return node.getMainWindow(); }
    @Override public List<RecordedNode> children(RecordedNode node) { return node.getChildren(); }

    @Override
    public String stringAttribute(RecordedNode node, String attribute) {
        return node.getAttributes().get(attribute);
    }
}
