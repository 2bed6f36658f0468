package uisnap.model;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Reading-order comparator shared by snapshot assembly and the diff engine:
 * top to bottom, then left to right. Missing coordinates sort last.
 */
public final class ElementOrdering {

    /** Comparator over {@code (y, x)} treating a missing coordinate as +infinity. */
    public static final Comparator<Element> READING_ORDER =
            Comparator.comparingDouble((Element e) -> orLast(e.getY()))
                      .thenComparingDouble(e -> orLast(e.getX()));

    private ElementOrdering() {}

    /** Returns a new list holding {@code elements} in reading order. */
    public static List<Element> sorted(Collection<Element> elements) {
        return elements.stream().sorted(READING_ORDER).collect(Collectors.toList());
    }

    private static double orLast(Double coordinate) {
        return coordinate != null ? coordinate : Double.POSITIVE_INFINITY;
    }
}
