/**
 *
 */
package org.theseed.metrics.regression;

import java.util.Arrays;

import org.apache.commons.math3.stat.StatUtils;
import org.theseed.metrics.UndefinedMetricException;

/**
 * This object converts a truth column and a prediction column into two discrete probability distributions over
 * a shared set of bins.  The truth values are divided into K-1 equal-width bins, where K is the number of
 * distinct truth values.  The outer bin edges are then widened to cover the prediction values as well, and the
 * predictions are counted into the same bins.  Each count array is divided by its sample count.
 *
 * A bin includes its left edge; the last bin also includes its right edge.
 *
 */
public class ProbabilityHistogram {

    // FIELDS
    /** truth probability for each bin */
    private final double[] trueProbs;
    /** prediction probability for each bin */
    private final double[] predProbs;
    /** bin edges (after widening) */
    private final double[] edges;

    /**
     * Build the histograms for a truth column and a prediction column.
     *
     * @param yTrue		truth values
     * @param yPred		predicted values
     *
     * @throws UndefinedMetricException if the truth values have fewer than two distinct values
     */
    public ProbabilityHistogram(double[] yTrue, double[] yPred) {
        int distinct = (int) Arrays.stream(yTrue).distinct().count();
        int bins = distinct - 1;
        if (bins < 1)
            throw new UndefinedMetricException("Histogram metrics need at least two distinct y_true values.");
        double lo = StatUtils.min(yTrue);
        double hi = StatUtils.max(yTrue);
        this.edges = new double[bins + 1];
        double step = (hi - lo) / bins;
        for (int i = 0; i < bins; i++)
            this.edges[i] = lo + i * step;
        this.edges[bins] = hi;
        this.trueProbs = countBins(yTrue, this.edges);
        scale(this.trueProbs, yTrue.length);
        // Widen the outer edges to cover both arrays.
        this.edges[0] = Math.min(lo, StatUtils.min(yPred));
        this.edges[bins] = Math.max(hi, StatUtils.max(yPred));
        this.predProbs = countBins(yPred, this.edges);
        scale(this.predProbs, yPred.length);
    }

    /**
     * Count values into bins.
     *
     * @param values	values to count
     * @param edges		bin edges, in ascending order
     *
     * @return an array of counts, one per bin
     */
    protected static double[] countBins(double[] values, double[] edges) {
        int bins = edges.length - 1;
        double[] retVal = new double[bins];
        for (double v : values) {
            if (v >= edges[0] && v <= edges[bins]) {
                int idx = Arrays.binarySearch(edges, v);
                // A miss returns the insertion point; the bin is the edge just below it.
                if (idx < 0)
                    idx = -idx - 2;
                if (idx >= bins) idx = bins - 1;
                retVal[idx]++;
            }
        }
        return retVal;
    }

    /**
     * Divide all the elements of an array by a constant.
     *
     * @param counts	array to scale
     * @param n			divisor
     */
    private static void scale(double[] counts, int n) {
        for (int i = 0; i < counts.length; i++)
            counts[i] /= n;
    }

    /**
     * @return the truth probability for each bin
     */
    public double[] getTrueProbs() {
        return this.trueProbs;
    }

    /**
     * @return the prediction probability for each bin
     */
    public double[] getPredProbs() {
        return this.predProbs;
    }

    /**
     * @return the number of bins
     */
    public int size() {
        return this.trueProbs.length;
    }

    /**
     * @return the bin edges used for the predictions
     */
    public double[] getEdges() {
        return this.edges.clone();
    }

}
