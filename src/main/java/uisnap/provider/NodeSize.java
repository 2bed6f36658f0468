package uisnap.provider;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * On-screen size of a node. Either dimension may be zero for collapsed or hidden nodes.
 */
public final class NodeSize {

    @JsonProperty("width")
    private final double width;

    @JsonProperty("height")
    private final double height;

    @JsonCreator
    public NodeSize(@JsonProperty("width") double width, @JsonProperty("height") double height) {
        this.width  = width;
        this.height = height;
    }

    public double getWidth()  { return width; }
    public double getHeight() { return height; }

    /** True when at least one dimension is positive. */
    public boolean hasPositiveDimension() {
        return width > 0 || height > 0;
    }

    @Override
    public String toString() {
        return String.format("NodeSize{w=%.1f, h=%.1f}", width, height);
    }
}
