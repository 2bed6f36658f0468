package uisnap.traversal;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uisnap.model.Element;
import uisnap.model.ElementOrdering;
import uisnap.model.Snapshot;
import uisnap.model.TraversalStatistics;

import java.time.Duration;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Collects classified outcomes of one traversal and assembles the final {@link Snapshot}.
 *
 * <p>Accepted elements go into an insertion-ordered set, so an attribute-identical element
 * is stored and counted once. Rejected nodes bump {@code excluded_count} plus each reason
 * that held: a non-interactable node without text counts towards both
 * {@code excluded_non_interactable} and {@code excluded_no_text}.
 *
 * <p>Not thread-safe; one accumulator per traversal.
 */
public class SnapshotAccumulator {

    private static final Logger log = LoggerFactory.getLogger(SnapshotAccumulator.class);

    private final Set<Element> collected = new LinkedHashSet<>();
    private int excludedCount;
    private int excludedNonInteractable;
    private int excludedNoText;
    private int withTextCount;
    private int withoutTextCount;
    private int visibleCount;
    private int duplicateCount;

    public void add(ClassifiedOutcome outcome) {
        if (outcome.isGeometricallyVisible()) {
            visibleCount++;
        }
        if (outcome.isAccepted()) {
            if (collected.add(outcome.getElement())) {
                if (outcome.hasText()) withTextCount++;
                else                   withoutTextCount++;
                log.trace("+ collect {}", outcome.getElement());
            } else {
                duplicateCount++;
                log.trace("= skip duplicate {}", outcome.getElement());
            }
        } else {
            excludedCount++;
            if (outcome.isNonInteractable()) excludedNonInteractable++;
            if (!outcome.hasText())          excludedNoText++;
            log.trace("- {}", outcome);
        }
    }

    public int getCollectedCount() { return collected.size(); }
    public int getDuplicateCount() { return duplicateCount; }

    /**
     * Sorts the collected elements into reading order and freezes everything into a snapshot.
     *
     * @param roleCounts per-role visit counts kept by the walker
     */
    public Snapshot toSnapshot(String label, Map<String, Integer> roleCounts, Duration captureDuration) {
        List<Element> sorted = ElementOrdering.sorted(collected);
        TraversalStatistics stats = new TraversalStatistics(
                sorted.size(), excludedCount, excludedNonInteractable, excludedNoText,
                withTextCount, withoutTextCount, visibleCount, roleCounts);
        return new Snapshot(label, sorted, stats, captureDuration);
    }
}
