package uisnap.traversal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.Arrays;
import java.util.List;
import java.util.Properties;
import java.util.stream.Collectors;

/**
 * Reads {@code uisnap.properties} from the classpath and exposes typed traversal and
 * diff settings with sensible defaults.
 *
 * <p>All values can be overridden by placing a {@code uisnap.local.properties}
 * file on the classpath (higher priority, not committed to VCS).
 */
public class SnapshotConfig {

    private static final Logger log = LoggerFactory.getLogger(SnapshotConfig.class);

    private static final String CONFIG_FILE       = "uisnap.properties";
    private static final String CONFIG_LOCAL_FILE = "uisnap.local.properties";

    // Property keys
    private static final String KEY_MAX_DEPTH          = "traversal.max.depth";
    private static final String KEY_ONLY_VISIBLE       = "traversal.only.visible";
    private static final String KEY_NON_INTERACTABLE   = "filter.non.interactable.roles";
    private static final String KEY_TEXT_ATTRIBUTES    = "filter.text.attributes";
    private static final String KEY_POSITION_TOLERANCE = "diff.position.tolerance";
    private static final String KEY_ATTRIBUTE_TOLERANCE = "diff.attribute.tolerance";
    private static final String KEY_DIFF_STRATEGY      = "diff.strategy";
    private static final String KEY_ACTION_DELAY       = "action.delay.ms";

    // Defaults
    private static final int     DEFAULT_MAX_DEPTH           = TreeWalker.DEFAULT_MAX_DEPTH;
    private static final boolean DEFAULT_ONLY_VISIBLE        = false;
    private static final double  DEFAULT_POSITION_TOLERANCE  = 5.0;
    private static final double  DEFAULT_ATTRIBUTE_TOLERANCE = 0.01;
    private static final String  DEFAULT_DIFF_STRATEGY       = "coarse";
    private static final long    DEFAULT_ACTION_DELAY        = 200L;

    private final Properties props;

    /**
     * Loads configuration from the classpath.
     * {@code uisnap.local.properties} values override {@code uisnap.properties}.
     *
     * @throws UiSnapException if the base uisnap.properties cannot be loaded
     */
    public SnapshotConfig() {
        props = new Properties();

        // Load base config (required)
        try (InputStream base = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_FILE)) {
            if (base == null) {
                throw new IOException("Classpath resource not found: " + CONFIG_FILE);
            }
            props.load(base);
            log.debug("Loaded base config from {}", CONFIG_FILE);
        } catch (IOException e) {
            throw new UiSnapException("Cannot load " + CONFIG_FILE, e);
        }

        // Load local overrides (optional)
        try (InputStream local = getClass().getClassLoader()
                .getResourceAsStream(CONFIG_LOCAL_FILE)) {
            if (local != null) {
                props.load(local);
                log.debug("Applied local overrides from {}", CONFIG_LOCAL_FILE);
            }
        } catch (IOException e) {
            log.warn("Failed to read {}, using base config only: {}", CONFIG_LOCAL_FILE, e.getMessage());
        }
    }

    /**
     * Package-private constructor for tests; accepts an already-populated
     * {@link Properties} instance.
     */
    SnapshotConfig(Properties props) {
        this.props = props;
    }

    /** Config built from explicit properties; missing keys take their defaults. */
    public static SnapshotConfig of(Properties props) {
        return new SnapshotConfig(props);
    }

    // ── Accessors ──────────────────────────────────────────────────────────

    /** Depth ceiling of the tree walk (default: 100). Negative values fall back to the default. */
    public int getMaxDepth() {
        int depth = getInt(KEY_MAX_DEPTH, DEFAULT_MAX_DEPTH);
        if (depth < 0) {
            log.warn("Negative value for '{}': {}, using default {}", KEY_MAX_DEPTH, depth, DEFAULT_MAX_DEPTH);
            return DEFAULT_MAX_DEPTH;
        }
        return depth;
    }

    /** Whether only geometrically visible nodes are collected (default: false). */
    public boolean isOnlyVisible() {
        return getBool(KEY_ONLY_VISIBLE, DEFAULT_ONLY_VISIBLE);
    }

    /** Non-interactable roles (default: {@link FilterPolicy#DEFAULT_NON_INTERACTABLE_ROLES}). */
    public List<String> getNonInteractableRoles() {
        return getList(KEY_NON_INTERACTABLE, List.copyOf(FilterPolicy.DEFAULT_NON_INTERACTABLE_ROLES));
    }

    /** Ordered text-bearing attributes (default: {@link FilterPolicy#DEFAULT_TEXT_ATTRIBUTES}). */
    public List<String> getTextAttributes() {
        return getList(KEY_TEXT_ATTRIBUTES, FilterPolicy.DEFAULT_TEXT_ATTRIBUTES);
    }

    /** Maximum point distance for the fine diff to pair two elements (default: 5.0). */
    public double getPositionTolerance() {
        return getTolerance(KEY_POSITION_TOLERANCE, DEFAULT_POSITION_TOLERANCE);
    }

    /** Absolute difference below which two numeric attributes count as equal (default: 0.01). */
    public double getAttributeTolerance() {
        return getTolerance(KEY_ATTRIBUTE_TOLERANCE, DEFAULT_ATTRIBUTE_TOLERANCE);
    }

    /** Diff strategy name, {@code coarse} or {@code fine} (default: coarse). */
    public String getDiffStrategy() {
        return props.getProperty(KEY_DIFF_STRATEGY, DEFAULT_DIFF_STRATEGY).trim();
    }

    /** Settle delay between an action and the following capture in milliseconds (default: 200). */
    public long getActionDelayMs() {
        return getLong(KEY_ACTION_DELAY, DEFAULT_ACTION_DELAY);
    }

    /** Filter policy assembled from the filter keys. */
    public FilterPolicy toFilterPolicy() {
        return FilterPolicy.builder()
                .nonInteractableRoles(getNonInteractableRoles())
                .textAttributes(getTextAttributes())
                .onlyVisible(isOnlyVisible())
                .build();
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    private int getInt(String key, int defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid integer for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private long getLong(String key, long defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Long.parseLong(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid long for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private double getTolerance(String key, double defaultValue) {
        double value = getDouble(key, defaultValue);
        if (!(value >= 0) || Double.isInfinite(value)) {
            log.warn("Negative or non-finite value for '{}': {}, using default {}", key, value, defaultValue);
            return defaultValue;
        }
        return value;
    }

    private double getDouble(String key, double defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            log.warn("Invalid number for key '{}': '{}', using default {}", key, raw, defaultValue);
            return defaultValue;
        }
    }

    private boolean getBool(String key, boolean defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Boolean.parseBoolean(raw.trim());
    }

    private List<String> getList(String key, List<String> defaultValue) {
        String raw = props.getProperty(key);
        if (raw == null || raw.isBlank()) return defaultValue;
        return Arrays.stream(raw.split(","))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toList());
    }
}
