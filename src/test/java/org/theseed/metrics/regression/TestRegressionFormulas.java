/**
 *
 */
package org.theseed.metrics.regression;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.theseed.metrics.UndefinedMetricException;

/**
 * Tests for the low-level regression formulas and the probability histogram.
 *
 */
public class TestRegressionFormulas {

    private static final double[] T = new double[] { 1, 2, 3, 4, 5 };
    private static final double[] P = new double[] { 1.5, 1.5, 3.5, 3.5, 5 };

    @Test
    public void testGini() {
        assertThat(RegressionFormulas.gini(T, P), closeTo(0.1066667, 1e-6));
        assertThat(RegressionFormulas.giniWiki(T, P), closeTo(0.26, 1e-9));
    }

    @Test
    public void testNormalizedRmse() {
        assertThat(RegressionFormulas.normalizedRmse(T, P, 0), closeTo(0.3333333, 1e-6));
        assertThat(RegressionFormulas.normalizedRmse(T, P, 1), closeTo(0.1490712, 1e-6));
        assertThat(RegressionFormulas.normalizedRmse(T, P, 2), closeTo(0.1118034, 1e-6));
        assertThat(RegressionFormulas.normalizedRmse(T, P, 3), closeTo(0.1469747, 1e-6));
        assertThrows(IllegalArgumentException.class, () -> RegressionFormulas.normalizedRmse(T, P, 4));
    }

    @Test
    public void testRatioIndex() {
        assertThat(RegressionFormulas.ratioIndex(T, P, 0.1), closeTo(0.2, 1e-9));
        assertThat(RegressionFormulas.ratioIndex(T, P, 0.2), closeTo(0.6, 1e-9));
    }

    @Test
    public void testCorrelation() {
        assertThat(RegressionFormulas.pearson(T, P), closeTo(0.9486833, 1e-6));
        double[] t = new double[] { 2, 4, 6, 8 };
        double[] p = new double[] { 1, 2, 2, 4 };
        assertThat(RegressionFormulas.residualStandardError(t, p), closeTo(0.0175439, 1e-6));
        double[] one = new double[] { 4.0 };
        assertThat(RegressionFormulas.pearson(one, one), notANumber());
        assertThat(RegressionFormulas.residualStandardError(one, one), notANumber());
    }

    @Test
    public void testShortSeries() {
        double[] one = new double[] { 4.0 };
        assertThat(RegressionFormulas.changeInDirection(one, one), notANumber());
        assertThat(RegressionFormulas.meanAbsoluteScaledError(T, P, 5), notANumber());
        assertThat(RegressionFormulas.maxError(T, T), equalTo(0.0));
    }

    @Test
    public void testHistogram() {
        ProbabilityHistogram hist = new ProbabilityHistogram(T, P);
        assertThat(hist.size(), equalTo(4));
        double[] trueProbs = hist.getTrueProbs();
        double total = 0.0;
        for (double p : trueProbs)
            total += p;
        assertThat(total, closeTo(1.0, 1e-9));
        // The last bin is closed on the right.
        assertThat(trueProbs[3], closeTo(0.4, 1e-9));
        double[] edges = hist.getEdges();
        assertThat(edges[0], closeTo(1.0, 1e-9));
        assertThat(edges[4], closeTo(5.0, 1e-9));
        assertThat(RegressionFormulas.kullbackLeibler(hist, RegressionFormulas.LOG_EPSILON), greaterThanOrEqualTo(0.0));
        assertThat(RegressionFormulas.jensenShannon(hist, RegressionFormulas.LOG_EPSILON), greaterThanOrEqualTo(0.0));
        assertThrows(UndefinedMetricException.class,
                () -> new ProbabilityHistogram(new double[] { 3, 3 }, new double[] { 1, 2 }));
    }

    @Test
    public void testEntropy() {
        double[] a = new double[] { 0.5, 0.5 };
        assertThat(RegressionFormulas.entropy(a, a, RegressionFormulas.LOG_EPSILON), closeTo(Math.log(2.0), 1e-9));
        double[] b = new double[] { 1.0, 0.0 };
        assertThat(RegressionFormulas.entropy(a, b, RegressionFormulas.LOG_EPSILON),
                closeTo(-0.5 * Math.log(1e-10), 1e-6));
        assertThat(RegressionFormulas.binEntropy(a, b, RegressionFormulas.LOG_EPSILON), closeTo(0.0, 1e-9));
    }

}
