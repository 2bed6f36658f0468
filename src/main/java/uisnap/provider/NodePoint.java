package uisnap.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Screen position of a node's top-left corner (top-left origin).
 */
public final class NodePoint {

    @JsonProperty("x")
    private final double x;

    @JsonProperty("y")
    private final double y;

    @JsonCreator
    public NodePoint(@JsonProperty("x") double x, @JsonProperty("y") double y) {
        this.x = x;
        this.y = y;
    }

    public double getX() { return x; }
    public double getY() { return y; }

    @Override
    public String toString() {
        return String.format("NodePoint{x=%.1f, y=%.1f}", x, y);
    }
}
