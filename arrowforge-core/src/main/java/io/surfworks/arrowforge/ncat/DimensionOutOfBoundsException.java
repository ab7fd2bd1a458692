package io.surfworks.arrowforge.ncat;

/**
 * Exception thrown when a generator, relation or cell is registered at a
 * dimension outside the structure's range.
 */
public class DimensionOutOfBoundsException extends RuntimeException {

    private final int dimension;
    private final int min;
    private final int max;

    public DimensionOutOfBoundsException(int dimension, int min, int max) {
        super(String.format("Dimension %d out of bounds [%d, %d]", dimension, min, max));
        this.dimension = dimension;
        this.min = min;
        this.max = max;
    }

    public int getDimension() {
        return dimension;
    }

    public int getMin() {
        return min;
    }

    public int getMax() {
        return max;
    }
}
