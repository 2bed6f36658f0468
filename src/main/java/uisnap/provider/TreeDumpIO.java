package uisnap.provider;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Loads a recorded element graph from JSON and returns its root {@link RecordedNode}.
 *
 * <p>Nodes are listed flat and refer to one another by id, so any graph shape can be
 * expressed, cycles included:
 * <pre>{@code
 * {
 *   "root": "app",
 *   "nodes": [
 *     { "id": "app", "role": "AXApplication", "windows": ["win"], "mainWindow": "win" },
 *     { "id": "win", "role": "AXWindow", "attributes": { "AXTitle": "Calculator" },
 *       "position": { "x": 0, "y": 25 }, "size": { "width": 230, "height": 410 },
 *       "children": ["btn"] },
 *     { "id": "btn", "role": "AXButton", "attributes": { "AXDescription": "7" },
 *       "position": { "x": 10, "y": 120 }, "size": { "width": 50, "height": 40 } }
 *   ]
 * }
 * }</pre>
 */
public class TreeDumpIO {

    private static final Logger log = LoggerFactory.getLogger(TreeDumpIO.class);

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private TreeDumpIO() {}

    /**
     * Reads a tree dump file and links its nodes.
     *
     * @throws IOException            if the file cannot be read or parsed
     * @throws MalformedTreeException if ids are missing, duplicated or dangling
     */
    public static RecordedNode read(Path path) throws IOException {
        log.debug("Reading tree dump from: {}", path);
        RecordedNode root = fromJson(Files.readString(path));
        log.info("Loaded tree dump rooted at '{}' from {}", root.getId(), path);
        return root;
    }

    /** Parses and links a tree dump held in a string. */
    public static RecordedNode fromJson(String json) throws IOException {
        return link(MAPPER.readValue(json, TreeDump.class));
    }

    static RecordedNode link(TreeDump dump) {
        if (dump.nodes == null || dump.nodes.isEmpty()) {
            throw new MalformedTreeException("Tree dump contains no nodes");
        }
        Map<String, RecordedNode> byId = new HashMap<>();
        for (NodeEntry entry : dump.nodes) {
            if (entry.id == null || entry.id.isBlank()) {
                throw new MalformedTreeException("Tree dump node without id (role: " + entry.role + ")");
            }
            RecordedNode node = RecordedNode.of(entry.id, entry.role).roleDescription(entry.roleDescription);
            if (entry.attributes != null) entry.attributes.forEach(node::attribute);
            if (entry.position != null) node.at(entry.position.getX(), entry.position.getY());
            if (entry.size != null)     node.size(entry.size.getWidth(), entry.size.getHeight());
            if (byId.put(entry.id, node) != null) {
                throw new MalformedTreeException("Duplicate node id: " + entry.id);
            }
        }
        for (NodeEntry entry : dump.nodes) {
            RecordedNode node = byId.get(entry.id);
            if (entry.windows != null) {
                entry.windows.forEach(id -> node.window(resolve(byId, id, entry.id)));
            }
            if (entry.mainWindow != null) {
                node.mainWindow(resolve(byId, entry.mainWindow, entry.id));
            }
            if (entry.children != null) {
                entry.children.forEach(id -> node.child(resolve(byId, id, entry.id)));
            }
        }
        String rootId = dump.root != null ? dump.root : dump.nodes.get(0).id;
        return resolve(byId, rootId, "root");
    }

    private static RecordedNode resolve(Map<String, RecordedNode> byId, String id, String referencedFrom) {
        RecordedNode node = byId.get(id);
        if (node == null) {
            throw new MalformedTreeException("Unknown node id '" + id + "' referenced from '" + referencedFrom + "'");
        }
        return node;
    }

    // ── JSON shape ────────────────────────────────────────────────────────

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class TreeDump {
        @JsonProperty("root")
        String root;

        @JsonProperty("nodes")
        List<NodeEntry> nodes = new ArrayList<>();
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    static class NodeEntry {
        @JsonProperty("id")              String id;
        @JsonProperty("role")            String role;
        @JsonProperty("roleDescription") String roleDescription;
        @JsonProperty("attributes")      Map<String, String> attributes = new LinkedHashMap<>();
        @JsonProperty("position")        NodePoint position;
        @JsonProperty("size")            NodeSize size;
        @JsonProperty("windows")         List<String> windows = new ArrayList<>();
        @JsonProperty("mainWindow")      String mainWindow;
        @JsonProperty("children")        List<String> children = new ArrayList<>();
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class MalformedTreeException extends RuntimeException {
        public MalformedTreeException(String msg) { super(msg); }
    }
}
