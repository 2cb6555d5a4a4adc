/**
 *
 */
package org.theseed.metrics;

import java.math.RoundingMode;

import org.apache.commons.math3.util.Precision;

/**
 * This class reduces per-column metric scores to a final result and performs the rounding.  Rounding is
 * always half-to-even at a fixed number of fractional digits, and it is always the last step of a metric.
 * Non-finite values are passed through unchanged.
 *
 */
public class Aggregator {

    /**
     * Round a value.
     *
     * @param value		value to round
     * @param decimal	number of fractional digits to keep
     *
     * @return the rounded value
     */
    public static double round(double value, int decimal) {
        double retVal = value;
        if (Double.isFinite(value))
            retVal = Precision.round(value, decimal, RoundingMode.HALF_EVEN.ordinal());
        return retVal;
    }

    /**
     * Round all the values in an array.
     *
     * @param values	array of values to round
     * @param decimal	number of fractional digits to keep
     *
     * @return a new array containing the rounded values
     */
    public static double[] round(double[] values, int decimal) {
        double[] retVal = new double[values.length];
        for (int i = 0; i < values.length; i++)
            retVal[i] = round(values[i], decimal);
        return retVal;
    }

    /**
     * Produce the final result from a set of per-column scores.  If the data had a single column, the
     * result is a scalar; otherwise, the multi-output policy determines the shape.
     *
     * @param scores			per-column scores
     * @param singleColumn		TRUE if the input data had only one column
     * @param mode				multi-output policy
     * @param decimal			number of fractional digits to keep
     *
     * @return the rounded result
     */
    public static MetricResult aggregate(double[] scores, boolean singleColumn, MultiOutput mode, int decimal) {
        MetricResult retVal;
        if (singleColumn)
            retVal = MetricResult.of(round(scores[0], decimal));
        else if (mode.getType() == MultiOutput.Type.RAW_VALUES)
            retVal = MetricResult.ofVector(round(scores, decimal));
        else
            retVal = MetricResult.of(round(mode.reduce(scores)[0], decimal));
        return retVal;
    }

    /**
     * Produce the final result for a per-sample metric.  Per-sample values are rounded but never reduced.
     *
     * @param columns		per-sample values for each output column
     * @param decimal		number of fractional digits to keep
     *
     * @return the rounded result
     */
    public static MetricResult samples(double[][] columns, int decimal) {
        double[][] rounded = new double[columns.length][];
        for (int i = 0; i < columns.length; i++)
            rounded[i] = round(columns[i], decimal);
        return MetricResult.ofSamples(rounded);
    }

}
