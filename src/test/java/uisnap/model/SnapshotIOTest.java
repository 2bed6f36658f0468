package uisnap.model;

import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.*;

/**
 * Serialization tests for SnapshotIO: round-trips, schema validation and canonical output.
 */
public class SnapshotIOTest {

    private Path tmpDir;

    @BeforeMethod
    public void setUp() throws IOException {
        tmpDir = Files.createTempDirectory("uisnap-io-");
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() throws IOException {
        try (var files = Files.walk(tmpDir)) {
            files.sorted((a, b) -> b.compareTo(a)).forEach(p -> p.toFile().delete());
        }
    }

    // ── Round-trip ────────────────────────────────────────────────────────

    @Test
    public void roundTrip_snapshot() throws IOException {
        Snapshot original = buildSnapshot();
        Path file = tmpDir.resolve("nested/dir/snapshot.json");

        SnapshotIO.writeSnapshot(original, file);
        Snapshot loaded = SnapshotIO.readSnapshot(file);

        assertThat(loaded.getSchemaVersion()).isEqualTo(Snapshot.CURRENT_SCHEMA_VERSION);
        assertThat(loaded.getLabel()).isEqualTo("Calculator");
        assertThat(loaded.getElements()).containsExactlyElementsOf(original.getElements());
        assertThat(loaded.getCaptureDuration()).isEqualTo(Duration.ofMillis(1250));
        assertThat(loaded.getStats().getCount()).isEqualTo(2);
        assertThat(loaded.getStats().getExcludedNoText()).isEqualTo(3);
        assertThat(loaded.getStats().getRoleCounts()).containsEntry("AXGroup", 3);
    }

    @Test
    public void toJson_usesSnakeCaseStatistics() throws IOException {
        String json = SnapshotIO.toJson(buildSnapshot());

        assertThat(json)
                .contains("\"excluded_non_interactable\"")
                .contains("\"visible_elements_count\"")
                .contains("\"role_counts\"")
                .contains("\"processing_time_seconds\" : \"1.25\"");
    }

    @Test
    public void toJson_omitsMissingAttributes() throws IOException {
        String json = SnapshotIO.toJson(Element.of("AXMenuItem", "Quit"));

        assertThat(json).doesNotContain("\"x\"").doesNotContain("null");
    }

    @Test
    public void roundTrip_fineDiff() throws IOException {
        Element before = new Element("AXTextField", "1", 10.0, 10.0, 100.0, 20.0);
        Element after  = new Element("AXTextField", "12", 10.0, 12.0, 100.0, 20.0);
        TraversalDiff diff = new TraversalDiff("fine",
                List.of(Element.of("AXButton", "Undo")), List.of(),
                List.of(new ModifiedElement(before, after, List.of(
                        TextChange.between("1", "12"),
                        new NumericChange("y", 10.0, 12.0)))));
        Path file = tmpDir.resolve("diff.json");

        SnapshotIO.writeDiff(diff, file);
        TraversalDiff loaded = SnapshotIO.readDiff(file);

        assertThat(loaded.getStrategy()).isEqualTo("fine");
        assertThat(loaded.getAdded()).containsExactly(Element.of("AXButton", "Undo"));
        assertThat(loaded.getModified()).hasSize(1);
        ModifiedElement modified = loaded.getModified().get(0);
        assertThat(modified.getBefore()).isEqualTo(before);
        assertThat(modified.getAfter()).isEqualTo(after);
        assertThat(modified.getChanges()).containsExactly(
                new TextChange("1", "12", "2", null),
                new NumericChange("y", 10.0, 12.0));
    }

    // ── Validation ────────────────────────────────────────────────────────

    @Test
    public void read_unsupportedVersion_throws() throws IOException {
        Path file = tmpDir.resolve("future.json");
        Files.writeString(file, "{\"schemaVersion\":\"9.0\",\"elements\":[]}");

        assertThatThrownBy(() -> SnapshotIO.readSnapshot(file))
                .isInstanceOf(SnapshotIO.SchemaVersionException.class)
                .hasMessageContaining("9.0");
    }

    @Test
    public void read_missingElements_failsSchema() throws IOException {
        Path file = tmpDir.resolve("bad.json");
        Files.writeString(file, "{\"schemaVersion\":\"1.0\",\"label\":\"x\"}");

        assertThatThrownBy(() -> SnapshotIO.readSnapshot(file))
                .isInstanceOf(SnapshotIO.SchemaValidationException.class);
    }

    @Test
    public void read_zeroWidth_failsSchema() throws IOException {
        Path file = tmpDir.resolve("zero.json");
        Files.writeString(file, "{\"schemaVersion\":\"1.0\",\"elements\":["
                + "{\"role\":\"AXButton\",\"x\":1,\"y\":1,\"width\":0,\"height\":10}]}");

        assertThatThrownBy(() -> SnapshotIO.readSnapshot(file))
                .isInstanceOf(SnapshotIO.SchemaValidationException.class);
    }

    @Test
    public void read_unknownElementAttribute_failsSchema() throws IOException {
        Path file = tmpDir.resolve("extra.json");
        Files.writeString(file, "{\"schemaVersion\":\"1.0\",\"elements\":["
                + "{\"role\":\"AXButton\",\"identifier\":\"ok-button\"}]}");

        assertThatThrownBy(() -> SnapshotIO.readSnapshot(file))
                .isInstanceOf(SnapshotIO.SchemaValidationException.class);
    }

    @Test
    public void fromJson_fillsDefaults() throws IOException {
        Snapshot snapshot = SnapshotIO.snapshotFromJson("{\"elements\":[{\"role\":\"AXButton\"}]}");

        assertThat(snapshot.getSchemaVersion()).isEqualTo(Snapshot.CURRENT_SCHEMA_VERSION);
        assertThat(snapshot.getLabel()).isEmpty();
        assertThat(snapshot.getStats().getCount()).isZero();
        assertThat(snapshot.getCaptureDuration()).isEqualTo(Duration.ZERO);
    }

    // ── Canonical output ──────────────────────────────────────────────────

    @Test
    public void canonicalJson_sortsKeys() throws IOException {
        String json = SnapshotIO.toCanonicalJson(new Element("AXButton", "OK", 1.0, 2.0, 3.0, 4.0));

        assertThat(json.indexOf("\"height\"")).isLessThan(json.indexOf("\"role\""));
        assertThat(json.indexOf("\"role\"")).isLessThan(json.indexOf("\"text\""));
        assertThat(json.indexOf("\"width\"")).isLessThan(json.indexOf("\"x\""));
    }

    @Test
    public void canonicalJson_equalValuesGiveIdenticalText() throws IOException {
        assertThat(SnapshotIO.toCanonicalJson(buildSnapshot()))
                .isEqualTo(SnapshotIO.toCanonicalJson(buildSnapshot()));
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private static Snapshot buildSnapshot() {
        List<Element> elements = List.of(
                new Element("AXButton", "7", 10.0, 120.0, 50.0, 40.0),
                new Element("AXButton (close button)", null, 7.0, 3.0, 14.0, 16.0));
        TraversalStatistics stats = new TraversalStatistics(2, 3, 3, 3, 1, 1, 4,
                Map.of("AXGroup", 3, "AXButton", 2));
        return new Snapshot("Calculator", elements, stats, Duration.ofMillis(1250));
    }
}
