/**
 *
 */
package org.theseed.metrics.regression;

import java.util.Comparator;
import java.util.stream.IntStream;

import org.apache.commons.math3.stat.StatUtils;
import org.apache.commons.math3.stat.correlation.PearsonsCorrelation;

/**
 * This class contains the regression formulas.  Each formula scores a single column of truth values against
 * the matching column of predictions.  The columns have already been filtered, so the formulas do not guard
 * against division by zero:  an undefined quotient produces NaN or an infinity.
 *
 */
public class RegressionFormulas {

    /** smallest probability allowed inside a logarithm */
    public static final double LOG_EPSILON = 1e-10;

    /**
     * @return the mean of the absolute differences
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double meanAbsoluteError(double[] t, double[] p) {
        double sum = 0.0;
        for (int i = 0; i < t.length; i++)
            sum += Math.abs(p[i] - t[i]);
        return sum / t.length;
    }

    /**
     * @return the mean of the squared differences
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double meanSquaredError(double[] t, double[] p) {
        return sumSquaredError(t, p) / t.length;
    }

    /**
     * @return the sum of the squared differences
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double sumSquaredError(double[] t, double[] p) {
        double sum = 0.0;
        for (int i = 0; i < t.length; i++) {
            double d = p[i] - t[i];
            sum += d * d;
        }
        return sum;
    }

    /**
     * @return the array of differences (a - b)
     *
     * @param a		minuend values
     * @param b		subtrahend values
     */
    public static double[] difference(double[] a, double[] b) {
        return IntStream.range(0, a.length).mapToDouble(i -> a[i] - b[i]).toArray();
    }

    /**
     * @return one minus the ratio of the residual variance to the truth variance
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double explainedVariance(double[] t, double[] p) {
        return 1.0 - StatUtils.populationVariance(difference(t, p)) / StatUtils.populationVariance(t);
    }

    /**
     * @return the maximum absolute difference
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double maxError(double[] t, double[] p) {
        double retVal = 0.0;
        for (int i = 0; i < t.length; i++)
            retVal = Math.max(retVal, Math.abs(t[i] - p[i]));
        return retVal;
    }

    /**
     * @return the median absolute difference
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double medianAbsoluteError(double[] t, double[] p) {
        double[] abs = IntStream.range(0, t.length).mapToDouble(i -> Math.abs(t[i] - p[i])).toArray();
        return StatUtils.percentile(abs, 50.0);
    }

    /**
     * @return the Nash-Sutcliffe efficiency (also the coefficient of determination)
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double nashSutcliffe(double[] t, double[] p) {
        double m = StatUtils.mean(t);
        double total = 0.0;
        for (double v : t)
            total += (v - m) * (v - m);
        return 1.0 - sumSquaredError(t, p) / total;
    }

    /**
     * @return the Willmott index of agreement
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double willmott(double[] t, double[] p) {
        double m = StatUtils.mean(t);
        double denom = 0.0;
        for (int i = 0; i < t.length; i++) {
            double d = Math.abs(p[i] - m) + Math.abs(t[i] - m);
            denom += d * d;
        }
        return 1.0 - sumSquaredError(t, p) / denom;
    }

    /**
     * @return the Pearson correlation coefficient between the truth and the predictions
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double pearson(double[] t, double[] p) {
        return correlation(t, p);
    }

    /**
     * @return the Pearson correlation of two equal-length series, or NaN if there are fewer than two values
     *
     * @param a		first series
     * @param b		second series
     */
    private static double correlation(double[] a, double[] b) {
        double retVal = Double.NaN;
        if (a.length >= 2)
            retVal = new PearsonsCorrelation().correlation(a, b);
        return retVal;
    }

    /**
     * @return the Kling-Gupta efficiency
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double klingGupta(double[] t, double[] p) {
        double r = pearson(t, p);
        double meanT = StatUtils.mean(t);
        double meanP = StatUtils.mean(p);
        double beta = meanP / meanT;
        double gamma = (Math.sqrt(StatUtils.populationVariance(p)) / meanP)
                / (Math.sqrt(StatUtils.populationVariance(t)) / meanT);
        return 1.0 - Math.sqrt((r - 1) * (r - 1) + (beta - 1) * (beta - 1) + (gamma - 1) * (gamma - 1));
    }

    /**
     * Compute the Gini coefficient from the Lorenz curve of the truth values ordered by descending prediction.
     *
     * @param t		truth values
     * @param p		predicted values
     *
     * @return the normalized area between the Lorenz curve and the diagonal
     */
    public static double gini(double[] t, double[] p) {
        int n = t.length;
        // Stable sort of the indices by descending prediction.
        Integer[] idx = IntStream.range(0, n).boxed().toArray(Integer[]::new);
        java.util.Arrays.sort(idx, Comparator.comparingDouble((Integer i) -> p[i]).reversed());
        double totalLosses = StatUtils.sum(t);
        double populationDelta = 1.0 / n;
        double accPopulation = 0.0;
        double accLoss = 0.0;
        double score = 0.0;
        for (int i = 0; i < n; i++) {
            accLoss += t[idx[i]] / totalLosses;
            accPopulation += populationDelta;
            score += accLoss - accPopulation;
        }
        return score / n;
    }

    /**
     * Compute the Gini coefficient as the mean absolute difference of the pooled truth and prediction values,
     * divided by twice their mean.  This is quadratic in the sample count.
     *
     * @param t		truth values
     * @param p		predicted values
     *
     * @return the Gini coefficient of the pooled values
     */
    public static double giniWiki(double[] t, double[] p) {
        double[] y = new double[t.length + p.length];
        System.arraycopy(t, 0, y, 0, t.length);
        System.arraycopy(p, 0, y, t.length, p.length);
        double score = 0.0;
        for (int i = 0; i < y.length; i++) {
            for (int j = 0; j < y.length; j++)
                score += Math.abs(y[i] - y[j]);
        }
        double len = y.length;
        return score / (2 * len * len * StatUtils.mean(y));
    }

    /**
     * @return the fraction of consecutive steps where the truth and prediction move in the same direction
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double changeInDirection(double[] t, double[] p) {
        int steps = t.length - 1;
        double retVal = Double.NaN;
        if (steps > 0) {
            int matches = 0;
            for (int i = 0; i < steps; i++) {
                if (Math.signum(t[i + 1] - t[i]) == Math.signum(p[i + 1] - p[i]))
                    matches++;
            }
            retVal = ((double) matches) / steps;
        }
        return retVal;
    }

    /**
     * Compute the cross entropy of a distribution against another, without filtering.
     *
     * @param a			reference values
     * @param b			compared values (clipped below at the epsilon)
     * @param epsilon	smallest value allowed inside the logarithm
     *
     * @return the sum of -a*log(b)
     */
    public static double entropy(double[] a, double[] b, double epsilon) {
        double retVal = 0.0;
        for (int i = 0; i < a.length; i++)
            retVal -= a[i] * Math.log(Math.max(b[i], epsilon));
        return retVal;
    }

    /**
     * Compute the cross entropy of two binned distributions, using only the bins where both probabilities
     * are positive.
     *
     * @param a			reference probabilities
     * @param b			compared probabilities
     * @param epsilon	smallest value allowed inside the logarithm
     *
     * @return the sum of -a*log(b) over the bins where both are positive
     */
    public static double binEntropy(double[] a, double[] b, double epsilon) {
        double retVal = 0.0;
        for (int i = 0; i < a.length; i++) {
            if (a[i] > 0.0 && b[i] > 0.0)
                retVal -= a[i] * Math.log(Math.max(b[i], epsilon));
        }
        return retVal;
    }

    /**
     * @return the Kullback-Leibler divergence of the prediction histogram from the truth histogram
     *
     * @param hist		histogram of the column
     * @param epsilon	smallest value allowed inside the logarithm
     */
    public static double kullbackLeibler(ProbabilityHistogram hist, double epsilon) {
        double[] fT = hist.getTrueProbs();
        return binEntropy(fT, hist.getPredProbs(), epsilon) - binEntropy(fT, fT, epsilon);
    }

    /**
     * @return the Jensen-Shannon divergence between the truth and prediction histograms
     *
     * @param hist		histogram of the column
     * @param epsilon	smallest value allowed inside the logarithm
     */
    public static double jensenShannon(ProbabilityHistogram hist, double epsilon) {
        double[] fT = hist.getTrueProbs();
        double[] fP = hist.getPredProbs();
        double[] mid = IntStream.range(0, fT.length).mapToDouble(i -> 0.5 * (fT[i] + fP[i])).toArray();
        double t1 = binEntropy(fT, mid, epsilon) - binEntropy(fT, fT, epsilon);
        double t2 = binEntropy(fP, mid, epsilon) - binEntropy(fP, fP, epsilon);
        return 0.5 * t1 + 0.5 * t2;
    }

    /**
     * @return the fraction of samples whose truth/prediction ratio lies within a band around 1
     *
     * @param t			truth values
     * @param p			predicted values
     * @param width		half-width of the band (0.1 for A10, 0.2 for A20)
     */
    public static double ratioIndex(double[] t, double[] p, double width) {
        int count = 0;
        double low = 1.0 - width;
        double high = 1.0 + width;
        for (int i = 0; i < t.length; i++) {
            double div = t[i] / p[i];
            if (div >= low && div <= high)
                count++;
        }
        return ((double) count) / t.length;
    }

    /**
     * Compute the normalized root mean squared error.
     *
     * @param t			truth values
     * @param p			predicted values
     * @param model		denominator variant:  0 = prediction standard deviation, 1 = prediction mean,
     * 					2 = truth range, 3 = root mean squared log ratio (no RMSE involved)
     *
     * @return the normalized error
     */
    public static double normalizedRmse(double[] t, double[] p, int model) {
        double rmse = Math.sqrt(meanSquaredError(t, p));
        double retVal;
        switch (model) {
        case 0 :
            retVal = rmse / Math.sqrt(StatUtils.populationVariance(p));
            break;
        case 1 :
            retVal = rmse / StatUtils.mean(p);
            break;
        case 2 :
            retVal = rmse / (StatUtils.max(t) - StatUtils.min(t));
            break;
        case 3 :
            double sum = 0.0;
            for (int i = 0; i < t.length; i++) {
                double lr = Math.log((p[i] + 1) / (t[i] + 1));
                sum += lr * lr;
            }
            retVal = Math.sqrt(sum / t.length);
            break;
        default :
            throw new IllegalArgumentException("NRMSE model must be 0, 1, 2, or 3, but was " + model + ".");
        }
        return retVal;
    }

    /**
     * @return the squared correlation between the predictions and the truth/prediction ratios
     *
     * @param t		truth values
     * @param p		predicted values
     */
    public static double residualStandardError(double[] t, double[] p) {
        double[] ratio = IntStream.range(0, t.length).mapToDouble(i -> t[i] / p[i]).toArray();
        double r = correlation(p, ratio);
        return r * r;
    }

    /**
     * @return the mean absolute error scaled by the mean absolute seasonal difference of the truth
     *
     * @param t		truth values
     * @param p		predicted values
     * @param m		seasonal lag
     */
    public static double meanAbsoluteScaledError(double[] t, double[] p, int m) {
        double scale = Double.NaN;
        if (m < t.length) {
            double sum = 0.0;
            for (int i = m; i < t.length; i++)
                sum += Math.abs(t[i] - t[i - m]);
            scale = sum / (t.length - m);
        }
        return meanAbsoluteError(t, p) / scale;
    }

}
