package uisnap.model;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import com.networknt.schema.JsonSchema;
import com.networknt.schema.JsonSchemaFactory;
import com.networknt.schema.SpecVersion;
import com.networknt.schema.ValidationMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * Reads and writes {@link Snapshot} and {@link TraversalDiff} objects as JSON.
 *
 * <p>On read: validates snapshot JSON against {@code snapshot-schema.json} before
 * deserializing, and rejects snapshots with unsupported schema versions.
 *
 * <p>On write: pretty-prints for human readability. {@link #toCanonicalJson(Object)}
 * additionally sorts every object's keys, for golden-file comparisons.
 */
public class SnapshotIO {

    private static final Logger log = LoggerFactory.getLogger(SnapshotIO.class);
    private static final String SCHEMA_RESOURCE = "/snapshot-schema.json";

    /** Singleton ObjectMapper, thread-safe after configuration. */
    private static final ObjectMapper MAPPER;

    /** Same configuration with alphabetically sorted properties and map keys. */
    private static final ObjectMapper CANONICAL_MAPPER;

    static {
        MAPPER = new ObjectMapper()
                .registerModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT);

        CANONICAL_MAPPER = JsonMapper.builder()
                .addModule(new JavaTimeModule())
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
                .enable(MapperFeature.SORT_PROPERTIES_ALPHABETICALLY)
                .disable(MapperFeature.SORT_CREATOR_PROPERTIES_FIRST)
                .build();
    }

    /** Loaded once from classpath; null if schema resource is missing. */
    private static volatile JsonSchema JSON_SCHEMA = null;

    private SnapshotIO() {}

    // ── Snapshots ─────────────────────────────────────────────────────────

    /**
     * Reads a {@link Snapshot} from a JSON file.
     *
     * @param path path to the snapshot JSON file
     * @return the deserialized snapshot
     * @throws IOException            if the file cannot be read or parsed
     * @throws SchemaValidationException if the JSON does not match the snapshot schema
     * @throws SchemaVersionException if the schema version is not supported
     */
    public static Snapshot readSnapshot(Path path) throws IOException {
        log.debug("Reading snapshot from: {}", path);
        String json = Files.readString(path);
        validateSchema(json, path.toString());
        Snapshot snapshot = MAPPER.readValue(json, Snapshot.class);
        if (!snapshot.isVersionSupported()) {
            throw new SchemaVersionException(
                    "Unsupported schema version: " + snapshot.getSchemaVersion()
                    + " (expected: " + Snapshot.CURRENT_SCHEMA_VERSION + ")");
        }
        log.info("Loaded snapshot '{}' with {} elements from {}", snapshot.getLabel(),
                snapshot.size(), path);
        return snapshot;
    }

    /**
     * Writes a {@link Snapshot} to a JSON file (pretty-printed).
     *
     * @param snapshot the snapshot to serialize
     * @param path     the destination file path (parent directories are created)
     * @throws IOException if the file cannot be written
     */
    public static void writeSnapshot(Snapshot snapshot, Path path) throws IOException {
        createParent(path);
        MAPPER.writeValue(path.toFile(), snapshot);
        log.info("Wrote snapshot '{}' ({} elements) to {}", snapshot.getLabel(), snapshot.size(), path);
    }

    /**
     * Deserializes a {@link Snapshot} from a JSON string (no schema validation).
     * Use {@link #readSnapshot(Path)} for validated loading from files.
     */
    public static Snapshot snapshotFromJson(String json) throws IOException {
        return MAPPER.readValue(json, Snapshot.class);
    }

    // ── Diffs ─────────────────────────────────────────────────────────────

    /** Writes a {@link TraversalDiff} to a JSON file (pretty-printed). */
    public static void writeDiff(TraversalDiff diff, Path path) throws IOException {
        createParent(path);
        MAPPER.writeValue(path.toFile(), diff);
        log.info("Wrote diff ({} added, {} removed, {} modified) to {}",
                diff.getAdded().size(), diff.getRemoved().size(), diff.getModified().size(), path);
    }

    /** Reads a {@link TraversalDiff} from a JSON file. */
    public static TraversalDiff readDiff(Path path) throws IOException {
        return MAPPER.readValue(Files.readString(path), TraversalDiff.class);
    }

    /** Deserializes a {@link TraversalDiff} from a JSON string. */
    public static TraversalDiff diffFromJson(String json) throws IOException {
        return MAPPER.readValue(json, TraversalDiff.class);
    }

    // ── Generic ───────────────────────────────────────────────────────────

    /** Serializes a snapshot, diff or any model object to pretty-printed JSON. */
    public static String toJson(Object value) throws IOException {
        return MAPPER.writeValueAsString(value);
    }

    /** Serializes with sorted keys so equal values always produce identical text. */
    public static String toCanonicalJson(Object value) throws IOException {
        return CANONICAL_MAPPER.writeValueAsString(value);
    }

    /** Returns the shared ObjectMapper (for use in tests and other modules). */
    public static ObjectMapper getMapper() { return MAPPER; }

    private static void createParent(Path path) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
    }

    // ── Schema validation ─────────────────────────────────────────────────

    private static void validateSchema(String json, String source) {
        JsonSchema schema = getSchema();
        if (schema == null) {
            log.warn("snapshot-schema.json not found on classpath, skipping schema validation");
            return;
        }
        try {
            Set<ValidationMessage> errors = schema.validate(MAPPER.readTree(json));
            if (!errors.isEmpty()) {
                StringBuilder sb = new StringBuilder("Schema validation failed for ").append(source).append(":\n");
                errors.forEach(e -> sb.append("  ").append(e.getMessage()).append("\n"));
                throw new SchemaValidationException(sb.toString());
            }
        } catch (IOException e) {
            log.warn("Could not parse JSON for schema validation: {}", e.getMessage());
        }
    }

    private static JsonSchema getSchema() {
        if (JSON_SCHEMA == null) {
            synchronized (SnapshotIO.class) {
                if (JSON_SCHEMA == null) {
                    try (InputStream is = SnapshotIO.class.getResourceAsStream(SCHEMA_RESOURCE)) {
                        if (is == null) {
                            log.warn("Schema resource not found: {}", SCHEMA_RESOURCE);
                            return null;
                        }
                        JsonSchemaFactory factory = JsonSchemaFactory.getInstance(SpecVersion.VersionFlag.V7);
                        JSON_SCHEMA = factory.getSchema(is);
                        log.debug("JSON schema loaded from classpath: {}", SCHEMA_RESOURCE);
                    } catch (IOException e) {
                        log.warn("Failed to load schema: {}", e.getMessage());
                    }
                }
            }
        }
        return JSON_SCHEMA;
    }

    // ── Exceptions ────────────────────────────────────────────────────────

    public static class SchemaVersionException extends RuntimeException {
        public SchemaVersionException(String msg) { super(msg); }
    }

    public static class SchemaValidationException extends RuntimeException {
        public SchemaValidationException(String msg) { super(msg); }
    }
}
