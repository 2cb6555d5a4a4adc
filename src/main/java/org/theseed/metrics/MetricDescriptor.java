/**
 *
 */
package org.theseed.metrics;

/**
 * This object describes how to read a metric's value:  whether it should be minimized or maximized, the range
 * of values it can take, and the best achievable value, if there is one.  Descriptors are read-only reference
 * data.
 *
 */
public class MetricDescriptor {

    /** direction of optimization */
    public static enum Direction {
        MIN, MAX;
    }

    // FIELDS
    /** direction of optimization */
    private final Direction direction;
    /** displayable value range */
    private final String range;
    /** best value, or NaN if there is no best value */
    private final double best;

    /** best-value string for metrics with no best value */
    public static final String NO_BEST = "no best";

    /**
     * Construct a descriptor for a metric with a best value.
     *
     * @param direction		direction of optimization
     * @param range			displayable value range
     * @param best			best achievable value
     */
    public MetricDescriptor(Direction direction, String range, double best) {
        this.direction = direction;
        this.range = range;
        this.best = best;
    }

    /**
     * Construct a descriptor for a metric with no best value.
     *
     * @param direction		direction of optimization
     * @param range			displayable value range
     */
    public MetricDescriptor(Direction direction, String range) {
        this(direction, range, Double.NaN);
    }

    /**
     * @return the direction of optimization
     */
    public Direction getDirection() {
        return this.direction;
    }

    /**
     * @return the displayable value range
     */
    public String getRange() {
        return this.range;
    }

    /**
     * @return TRUE if the metric has a best achievable value
     */
    public boolean hasBest() {
        return ! Double.isNaN(this.best);
    }

    /**
     * @return the best achievable value, or NaN if there is none
     */
    public double getBest() {
        return this.best;
    }

    /**
     * @return the best achievable value as a string
     */
    public String getBestString() {
        String retVal = NO_BEST;
        if (this.hasBest())
            retVal = (this.best == Math.rint(this.best) ? Long.toString((long) this.best) : Double.toString(this.best));
        return retVal;
    }

    /**
     * @return TRUE if the first value is better than the second according to this metric
     *
     * @param v1	first value
     * @param v2	second value
     */
    public boolean isBetter(double v1, double v2) {
        return (this.direction == Direction.MIN ? v1 < v2 : v1 > v2);
    }

    @Override
    public String toString() {
        return "{type=" + this.direction.name().toLowerCase() + ", range=" + this.range + ", best=" + this.getBestString() + "}";
    }

}
