package uisnap.diff;

import java.util.Locale;

/**
 * How two snapshots are reconciled.
 */
public enum DiffStrategy {

    /** Set difference under full attribute equality. Reports only added and removed elements. */
    COARSE,

    /** Role plus position (or text) matching within a tolerance. Also reports modified elements. */
    FINE;

    /** Parses {@code coarse}/{@code fine}, case-insensitively. */
    public static DiffStrategy fromName(String name) {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Diff strategy name is empty");
        }
        try {
            return valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown diff strategy '" + name + "' (expected coarse or fine)", e);
        }
    }

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
