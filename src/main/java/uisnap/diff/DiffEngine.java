package uisnap.diff;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uisnap.model.AttributeChange;
import uisnap.model.Element;
import uisnap.model.ElementOrdering;
import uisnap.model.ModifiedElement;
import uisnap.model.NumericChange;
import uisnap.model.Snapshot;
import uisnap.model.TextChange;
import uisnap.model.TraversalDiff;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Computes the difference between a snapshot taken before and one taken after some UI change.
 *
 * <p>Two strategies are offered because elements carry no stable identity:
 * <ol>
 *   <li><b>Coarse</b>: plain set difference. Any attribute change at all turns an element
 *       into one removal plus one addition. Cheap.</li>
 *   <li><b>Fine</b>: each {@code before} element is paired with the closest unclaimed
 *       {@code after} element of the same role within {@code positionTolerance} points.
 *       Elements without a position fall back to pairing on identical non-empty text.
 *       Paired elements whose text, x, y, width or height differ are reported as modified.
 *       Quadratic in snapshot size; meant for UI snapshots of up to a few hundred elements.</li>
 * </ol>
 *
 * <p>Both are deterministic and never fail. Callers must supply both snapshots.
 */
public class DiffEngine {

    private static final Logger log = LoggerFactory.getLogger(DiffEngine.class);

    /** Default maximum distance, in points, between paired elements. */
    public static final double DEFAULT_POSITION_TOLERANCE = 5.0;

    /** Default absolute tolerance when comparing numeric attributes. */
    public static final double DEFAULT_ATTRIBUTE_TOLERANCE = 0.01;

    private final double attributeTolerance;

    public DiffEngine() {
        this(DEFAULT_ATTRIBUTE_TOLERANCE);
    }

    public DiffEngine(double attributeTolerance) {
        if (attributeTolerance < 0) {
            throw new IllegalArgumentException("attributeTolerance must be >= 0, got " + attributeTolerance);
        }
        this.attributeTolerance = attributeTolerance;
    }

    /** Dispatches to {@link #diffCoarse} or {@link #diffFine}. */
    public TraversalDiff diff(Snapshot before, Snapshot after, DiffStrategy strategy, double positionTolerance) {
        return strategy == DiffStrategy.FINE
                ? diffFine(before, after, positionTolerance)
                : diffCoarse(before, after);
    }

    // ── Coarse ────────────────────────────────────────────────────────────

    public TraversalDiff diffCoarse(Snapshot before, Snapshot after) {
        return diffCoarse(elementsOf(before, "before"), elementsOf(after, "after"));
    }

    /**
     * Set difference of two element lists. Results are deduplicated and in reading order;
     * {@code modified} is always empty.
     */
    public TraversalDiff diffCoarse(List<Element> before, List<Element> after) {
        log.debug("Coarse diff between {} (before) and {} (after) elements", before.size(), after.size());
        Set<Element> beforeSet = new LinkedHashSet<>(before);
        Set<Element> afterSet  = new LinkedHashSet<>(after);

        Set<Element> added = new LinkedHashSet<>(afterSet);
        added.removeAll(beforeSet);
        Set<Element> removed = new LinkedHashSet<>(beforeSet);
        removed.removeAll(afterSet);

        log.debug("Coarse diff: {} added, {} removed", added.size(), removed.size());
        return new TraversalDiff(DiffStrategy.COARSE.label(),
                ElementOrdering.sorted(added), ElementOrdering.sorted(removed), List.of());
    }

    // ── Fine ──────────────────────────────────────────────────────────────

    public TraversalDiff diffFine(Snapshot before, Snapshot after) {
        return diffFine(before, after, DEFAULT_POSITION_TOLERANCE);
    }

    public TraversalDiff diffFine(Snapshot before, Snapshot after, double positionTolerance) {
        return diffFine(elementsOf(before, "before"), elementsOf(after, "after"), positionTolerance);
    }

    /**
     * Greedy pairing of {@code before} against {@code after}.
     * {@code removed} and {@code modified} follow {@code before} order, {@code added}
     * follows {@code after} order.
     */
    public TraversalDiff diffFine(List<Element> before, List<Element> after, double positionTolerance) {
        if (positionTolerance < 0) {
            throw new IllegalArgumentException("positionTolerance must be >= 0, got " + positionTolerance);
        }
        log.debug("Fine diff between {} (before) and {} (after) elements, tolerance {}",
                before.size(), after.size(), positionTolerance);
        double maxDistanceSq = positionTolerance * positionTolerance;
        boolean[] claimed = new boolean[after.size()];

        List<Element> removed = new ArrayList<>();
        List<ModifiedElement> modified = new ArrayList<>();

        for (Element b : before) {
            int match = findMatch(b, after, claimed, maxDistanceSq);
            if (match < 0) {
                removed.add(b);
                continue;
            }
            claimed[match] = true;
            Element a = after.get(match);
            List<AttributeChange> changes = compare(b, a);
            if (!changes.isEmpty()) {
                modified.add(new ModifiedElement(b, a, changes));
            }
        }

        List<Element> added = new ArrayList<>();
        for (int i = 0; i < after.size(); i++) {
            if (!claimed[i]) added.add(after.get(i));
        }

        log.debug("Fine diff: {} added, {} removed, {} modified", added.size(), removed.size(), modified.size());
        return new TraversalDiff(DiffStrategy.FINE.label(), added, removed, modified);
    }

    /**
     * Index of the best unclaimed candidate for {@code b}, or -1.
     * A positional match always beats a text match; among positional matches the
     * nearest wins and the first one seen wins ties.
     */
    private static int findMatch(Element b, List<Element> after, boolean[] claimed, double maxDistanceSq) {
        int bestPositional = -1;
        double bestDistanceSq = Double.MAX_VALUE;
        int textMatch = -1;

        for (int i = 0; i < after.size(); i++) {
            Element a = after.get(i);
            if (claimed[i] || !b.getRole().equals(a.getRole())) {
                continue;
            }
            if (b.hasPosition() && a.hasPosition()) {
                double dx = b.getX() - a.getX();
                double dy = b.getY() - a.getY();
                double distanceSq = dx * dx + dy * dy;
                if (distanceSq <= maxDistanceSq && distanceSq < bestDistanceSq) {
                    bestDistanceSq = distanceSq;
                    bestPositional = i;
                }
            } else if (textMatch < 0 && b.hasText() && b.getText().equals(a.getText())) {
                textMatch = i;
            }
        }
        return bestPositional >= 0 ? bestPositional : textMatch;
    }

    private List<AttributeChange> compare(Element b, Element a) {
        List<AttributeChange> changes = new ArrayList<>();
        if (!Objects.equals(b.getText(), a.getText())) {
            changes.add(TextChange.between(b.getText(), a.getText()));
        }
        addIfChanged(changes, "x",      b.getX(),      a.getX());
        addIfChanged(changes, "y",      b.getY(),      a.getY());
        addIfChanged(changes, "width",  b.getWidth(),  a.getWidth());
        addIfChanged(changes, "height", b.getHeight(), a.getHeight());
        return changes;
    }

    private void addIfChanged(List<AttributeChange> changes, String attribute, Double before, Double after) {
        if (!nearlyEqual(before, after)) {
            changes.add(new NumericChange(attribute, before, after));
        }
    }

    /** Absent equals absent; present values are equal when closer than the attribute tolerance. */
    boolean nearlyEqual(Double d1, Double d2) {
        if (d1 == null || d2 == null) return d1 == d2;
        return d1.doubleValue() == d2.doubleValue() || Math.abs(d1 - d2) < attributeTolerance;
    }

    private static List<Element> elementsOf(Snapshot snapshot, String which) {
        return Objects.requireNonNull(snapshot, which + " snapshot is required").getElements();
    }
}
