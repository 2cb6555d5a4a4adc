/**
 *
 */
package org.theseed.metrics;

import java.util.Arrays;

import org.apache.commons.lang3.StringUtils;

/**
 * This object describes how the per-column scores of a multi-output evaluation are reduced.  The
 * raw-values policy returns the per-column vector unchanged.  The uniform-average policy returns the
 * unweighted mean.  The weighted policy returns the weighted sum divided by the weight total.
 *
 */
public class MultiOutput {

    /** policy type */
    public static enum Type {
        /** return one score per column */
        RAW_VALUES,
        /** return the mean of the column scores */
        UNIFORM_AVERAGE,
        /** return the weighted mean of the column scores */
        WEIGHTED;
    }

    // FIELDS
    /** type of reduction */
    private final Type type;
    /** column weights (weighted policy only) */
    private final double[] weights;

    /** raw-values policy */
    public static final MultiOutput RAW_VALUES = new MultiOutput(Type.RAW_VALUES, null);
    /** uniform-average policy */
    public static final MultiOutput UNIFORM_AVERAGE = new MultiOutput(Type.UNIFORM_AVERAGE, null);

    /**
     * Construct a multi-output policy.
     *
     * @param type		type of reduction
     * @param weights	column weights, or NULL if the type is unweighted
     */
    private MultiOutput(Type type, double[] weights) {
        this.type = type;
        this.weights = weights;
    }

    /**
     * @return a weighted policy for the specified column weights
     *
     * @param weights	one weight per output column
     */
    public static MultiOutput weighted(double... weights) {
        if (weights == null || weights.length == 0)
            throw new IllegalArgumentException("A weighted multi-output policy needs at least one weight.");
        return new MultiOutput(Type.WEIGHTED, weights.clone());
    }

    /**
     * Parse a policy string.  The string can be "raw_values", "uniform_average", or a comma-delimited list
     * of column weights.
     *
     * @param string	string to parse
     *
     * @return the policy described by the string
     */
    public static MultiOutput parse(String string) {
        MultiOutput retVal;
        String normal = StringUtils.trimToEmpty(string).toLowerCase();
        switch (normal) {
        case "" :
        case "raw_values" :
        case "raw" :
            retVal = RAW_VALUES;
            break;
        case "uniform_average" :
        case "mean" :
            retVal = UNIFORM_AVERAGE;
            break;
        default :
            String[] parts = StringUtils.split(normal, ',');
            double[] weights = new double[parts.length];
            for (int i = 0; i < parts.length; i++) {
                try {
                    weights[i] = Double.parseDouble(parts[i].trim());
                } catch (NumberFormatException e) {
                    throw new IllegalArgumentException("Invalid multi-output policy \"" + string + "\".", e);
                }
            }
            retVal = weighted(weights);
        }
        return retVal;
    }

    /**
     * @return the reduction type
     */
    public Type getType() {
        return this.type;
    }

    /**
     * @return a copy of the column weights, or NULL if this policy is unweighted
     */
    public double[] getWeights() {
        return (this.weights == null ? null : this.weights.clone());
    }

    /**
     * Reduce a vector of per-column scores according to this policy.  The result is unrounded.
     *
     * @param scores	per-column scores
     *
     * @return the reduced scores (a vector for raw values, else a single value)
     *
     * @throws ShapeException if the weight count does not match the column count
     */
    public double[] reduce(double[] scores) {
        double[] retVal;
        switch (this.type) {
        case UNIFORM_AVERAGE :
            retVal = new double[] { Arrays.stream(scores).average().orElse(Double.NaN) };
            break;
        case WEIGHTED :
            if (this.weights.length != scores.length)
                throw new ShapeException("There are " + this.weights.length + " multi-output weights but "
                        + scores.length + " output columns.");
            double sum = 0.0;
            double total = 0.0;
            for (int i = 0; i < scores.length; i++) {
                sum += scores[i] * this.weights[i];
                total += this.weights[i];
            }
            retVal = new double[] { sum / total };
            break;
        default :
            retVal = scores.clone();
        }
        return retVal;
    }

    @Override
    public String toString() {
        String retVal;
        if (this.type == Type.WEIGHTED)
            retVal = Arrays.toString(this.weights);
        else
            retVal = this.type.name().toLowerCase();
        return retVal;
    }

}
