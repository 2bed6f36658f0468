package uisnap.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Duration;
import java.util.List;
import java.util.Locale;

/**
 * The output of one traversal: elements in reading order, statistics, a label and
 * the time the capture took. Immutable.
 *
 * <p>Maps 1:1 to the root object defined in {@code snapshot-schema.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class Snapshot {

    /** Current schema version (must match snapshot-schema.json). */
    public static final String CURRENT_SCHEMA_VERSION = "1.0";

    @JsonProperty("schemaVersion")
    private final String schemaVersion;

    @JsonProperty("label")
    private final String label;

    @JsonProperty("elements")
    private final List<Element> elements;

    @JsonProperty("stats")
    private final TraversalStatistics stats;

    @JsonProperty("capture_duration")
    private final Duration captureDuration;

    @JsonCreator
    public Snapshot(@JsonProperty("schemaVersion")    String schemaVersion,
                    @JsonProperty("label")            String label,
                    @JsonProperty("elements")         List<Element> elements,
                    @JsonProperty("stats")            TraversalStatistics stats,
                    @JsonProperty("capture_duration") Duration captureDuration) {
        this.schemaVersion   = schemaVersion != null ? schemaVersion : CURRENT_SCHEMA_VERSION;
        this.label           = label != null ? label : "";
        this.elements        = elements != null ? List.copyOf(elements) : List.of();
        this.stats           = stats != null ? stats : TraversalStatistics.empty();
        this.captureDuration = captureDuration != null ? captureDuration : Duration.ZERO;
    }

    public Snapshot(String label, List<Element> elements, TraversalStatistics stats, Duration captureDuration) {
        this(CURRENT_SCHEMA_VERSION, label, elements, stats, captureDuration);
    }

    /** Snapshot holding exactly {@code elements}, with empty statistics. Handy for diff callers. */
    public static Snapshot of(String label, List<Element> elements) {
        return new Snapshot(label, elements, TraversalStatistics.empty(), Duration.ZERO);
    }

    public String              getSchemaVersion()   { return schemaVersion; }
    public String              getLabel()           { return label; }
    public List<Element>       getElements()        { return elements; }
    public TraversalStatistics getStats()           { return stats; }
    public Duration            getCaptureDuration() { return captureDuration; }

    /** Capture time in seconds with two decimals, the form the traversal log reports. */
    @JsonProperty(value = "processing_time_seconds", access = JsonProperty.Access.READ_ONLY)
    public String getProcessingTimeSeconds() {
        return String.format(Locale.ROOT, "%.2f", captureDuration.toNanos() / 1_000_000_000.0);
    }

    @JsonIgnore
    public boolean isVersionSupported() {
        return CURRENT_SCHEMA_VERSION.equals(schemaVersion);
    }

    @JsonIgnore
    public int size() {
        return elements.size();
    }

    @Override
    public String toString() {
        return String.format("Snapshot{label='%s', elements=%d, took=%ss}",
                label, elements.size(), getProcessingTimeSeconds());
    }
}
