/**
 *
 */
package org.theseed.metrics.clustering;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Random;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.factory.Nd4j;
import org.theseed.metrics.EvaluationContext;
import org.theseed.metrics.MetricOptions;
import org.theseed.metrics.MetricResult;
import org.theseed.metrics.MissingInputException;
import org.theseed.metrics.ShapeException;
import org.theseed.metrics.UndefinedMetricException;

/**
 * Tests for the internal clustering indices.
 *
 */
public class TestInternalMetrics {

    /** two tight, well-separated clusters */
    private static final double[][] X = new double[][] { { 0, 0 }, { 0, 1 }, { 10, 0 }, { 10, 1 } };
    private static final int[] LABELS = new int[] { 0, 0, 1, 1 };

    /** two clusters with full-rank scatter */
    private static final double[][] X2 = new double[][] { { 0, 0 }, { 1, 2 }, { 2, 1 }, { 10, 1 }, { 12, 0 }, { 11, 3 } };
    private static final int[] LABELS2 = new int[] { 0, 0, 0, 1, 1, 1 };

    private static ClusteringEvaluator evaluator(double[][] x, int[] labels) {
        return new ClusteringEvaluator(null, labels, x, new EvaluationContext());
    }

    @Test
    public void testScatter() {
        ClusterScatter scatter = new ClusterScatter(X, LABELS, 2);
        assertThat(scatter.getClusterCount(), equalTo(2));
        assertThat(scatter.size(), equalTo(4));
        assertThat(scatter.getDimension(), equalTo(2));
        assertThat(scatter.getCentroid(1)[0], closeTo(10.0, 1e-9));
        assertThat(scatter.getCentroid(1)[1], closeTo(0.5, 1e-9));
        assertThat(scatter.getSize(0), equalTo(2));
        assertThat(scatter.getDispersion(0), closeTo(0.5, 1e-9));
        assertThat(scatter.getWGSS(), closeTo(1.0, 1e-9));
        assertThat(scatter.getBGSS(), closeTo(100.0, 1e-9));
        assertThat(scatter.getTSS(), closeTo(101.0, 1e-9));
        assertThat(scatter.withinScatter().getEntry(1, 1), closeTo(1.0, 1e-9));
        assertThat(scatter.totalScatter().getEntry(0, 0), closeTo(100.0, 1e-9));
    }

    @Test
    public void testScores() {
        ClusteringEvaluator evaluator = evaluator(X, LABELS);
        assertThat(evaluator.compute("BHI").getValue(), closeTo(0.25, 1e-9));
        assertThat(evaluator.compute("CHI").getValue(), closeTo(200.0, 1e-9));
        assertThat(evaluator.compute("DBI").getValue(), closeTo(0.1, 1e-9));
        assertThat(evaluator.compute("DI").getValue(), closeTo(10.0, 1e-9));
        assertThat(evaluator.compute("XBI").getValue(), closeTo(0.0025, 1e-9));
        assertThat(evaluator.compute("SSEI").getValue(), closeTo(1.0, 1e-9));
        assertThat(evaluator.compute("DHI").getValue(), closeTo(0.0099, 1e-9));
        assertThat(evaluator.compute("RSI").getValue(), closeTo(0.9901, 1e-9));
        assertThat(evaluator.compute("HI").getValue(), closeTo(100.0, 1e-9));
        assertThat(evaluator.compute("LSRI").getValue(), closeTo(4.60517, 1e-9));
        assertThat(evaluator.compute("SI").getValue(), closeTo(0.90025, 1e-9));
        assertThat(evaluator.compute("BRI").getValue(), closeTo(-5.54518, 1e-9));
        assertThat(evaluator.compute("BI").getValue(), closeTo(50.0, 1e-9));
        assertThat(evaluator.compute("BHGI").getValue(), closeTo(1.0, 1e-9));
        assertThat(evaluator.compute("GPI").getValue(), closeTo(0.0, 1e-9));
        assertThat(evaluator.compute("DBCVI").getValue(), closeTo(0.05, 1e-9));
    }

    @Test
    public void testDunnVariants() {
        ClusteringEvaluator evaluator = evaluator(X2, LABELS2);
        double modified = evaluator.compute(ClusteringMetric.DI, new MetricOptions().setUseModified(true)).getValue();
        double standard = evaluator.compute(ClusteringMetric.DI, new MetricOptions().setUseModified(false)).getValue();
        assertThat(modified, closeTo(standard, 1e-9));
        assertThat(modified, greaterThan(1.0));
    }

    @Test
    public void testDeterminants() {
        ClusteringEvaluator evaluator = evaluator(X2, LABELS2);
        assertThat(evaluator.compute("DRI").getValue(), closeTo(38.525, 1e-4));
        assertThat(evaluator.compute("LDRI").getValue(), closeTo(21.90784, 1e-4));
        MetricOptions raw = new MetricOptions().setUseNormalized(false);
        assertThat(evaluator.compute(ClusteringMetric.KDI, raw).getValue(), closeTo(106.66667, 1e-4));
        double scaled = evaluator.compute(ClusteringMetric.KDI, new MetricOptions().setUseNormalized(true)).getValue();
        assertThat(scaled, greaterThan(0.0));
        assertThat(scaled, lessThan(106.0));
        // A collapsed within-group dimension makes the det-ratio undefined.
        ClusteringEvaluator flat = evaluator(X, LABELS);
        assertThat(flat.compute("DRI").getValue(), equalTo(Double.NEGATIVE_INFINITY));
        assertThat(flat.compute("LDRI").getValue(), equalTo(Double.NEGATIVE_INFINITY));
    }

    @Test
    public void testSingleCluster() {
        int[] one = new int[] { 4, 4, 4, 4 };
        ClusteringEvaluator evaluator = evaluator(X, one);
        assertThat(evaluator.compute("SI").getValue(), equalTo(Double.NEGATIVE_INFINITY));
        assertThat(evaluator.compute("DBI").getValue(), equalTo(Double.POSITIVE_INFINITY));
        assertThat(evaluator.compute("XBI").getValue(), equalTo(Double.POSITIVE_INFINITY));
        assertThat(evaluator.compute("CHI").getValue(), equalTo(0.0));
        assertThat(evaluator.compute("DI").getValue(), equalTo(0.0));
        assertThat(evaluator.compute("DBCVI").getValue(), equalTo(1.0));
        ClusteringEvaluator strict = new ClusteringEvaluator(null, one, X, new EvaluationContext().withRaiseError(true));
        assertThrows(UndefinedMetricException.class, () -> strict.compute("SI"));
        assertThrows(UndefinedMetricException.class, () -> strict.compute("BI"));
    }

    @Test
    public void testSilhouetteSamples() {
        ClusteringEvaluator evaluator = evaluator(X, LABELS);
        MetricResult result = evaluator.compute(ClusteringMetric.SI, new MetricOptions().setSampleScores(true));
        assertThat(result.getKind(), equalTo(MetricResult.Kind.SAMPLES));
        double[] values = result.getValues();
        assertThat(values.length, equalTo(4));
        for (double v : values)
            assertThat(v, closeTo(0.90025, 1e-9));
        // A singleton cluster scores 0.
        ClusteringEvaluator single = evaluator(new double[][] { { 0 }, { 1 }, { 9 } }, new int[] { 0, 0, 1 });
        double[] singles = single.compute(ClusteringMetric.SI, new MetricOptions().setSampleScores(true)).getValues();
        assertThat(singles[2], equalTo(0.0));
    }

    @Test
    public void testInputs() {
        ClusteringEvaluator noX = new ClusteringEvaluator(null, LABELS, null, new EvaluationContext());
        assertThrows(MissingInputException.class, () -> noX.compute("SI"));
        ClusteringEvaluator shortX = evaluator(new double[][] { { 0, 0 }, { 1, 1 } }, LABELS);
        assertThrows(ShapeException.class, () -> shortX.compute("SI"));
        ClusteringEvaluator ragged = evaluator(new double[][] { { 0, 0 }, { 1 }, { 2, 2 }, { 3, 3 } }, LABELS);
        assertThrows(ShapeException.class, () -> ragged.compute("SI"));
        ClusteringEvaluator arrays = new ClusteringEvaluator(null, Nd4j.create(new double[] { 0, 0, 1, 1 }),
                Nd4j.create(X), new EvaluationContext());
        assertThat(arrays.compute("CHI").getValue(), closeTo(200.0, 1e-9));
    }

    @Test
    public void testGammaPairOrder() {
        // The only within-cluster pair comes last, so it has no later pairs to compare with.
        ClusteringEvaluator evaluator = evaluator(new double[][] { { 0 }, { 5 }, { 6 } }, new int[] { 0, 1, 1 });
        assertThat(evaluator.compute("BHGI").getValue(), equalTo(0.0));
        assertThat(evaluator.compute("GPI").getValue(), equalTo(0.0));
        // Here it comes first and beats both between-cluster pairs.
        evaluator = evaluator(new double[][] { { 0 }, { 1 }, { 5 } }, new int[] { 0, 0, 1 });
        assertThat(evaluator.compute("BHGI").getValue(), closeTo(1.0, 1e-9));
        // Between-cluster pairs ahead of a within-cluster pair are not counted.
        evaluator = evaluator(new double[][] { { 0 }, { 1 }, { 10 }, { 11 } }, new int[] { 0, 1, 1, 0 });
        assertThat(evaluator.compute("BHGI").getValue(), closeTo(-0.5, 1e-9));
        assertThat(evaluator.compute("GPI").getValue(), closeTo(0.2, 1e-9));
    }

    @Test
    public void testGammaCounts() {
        Random rand = new Random(1234);
        for (int trial = 0; trial < 20; trial++) {
            int n = 5 + rand.nextInt(10);
            double[][] x = new double[n][2];
            int[] labels = new int[n];
            for (int i = 0; i < n; i++) {
                // Small integer coordinates produce tied distances.
                x[i][0] = rand.nextInt(4);
                x[i][1] = rand.nextInt(4);
                labels[i] = rand.nextInt(3);
            }
            int pairs = n * (n - 1) / 2;
            double[] dist = new double[pairs];
            boolean[] same = new boolean[pairs];
            int idx = 0;
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    dist[idx] = Math.hypot(x[i][0] - x[j][0], x[i][1] - x[j][1]);
                    same[idx] = (labels[i] == labels[j]);
                    idx++;
                }
            }
            double plus = 0.0;
            double minus = 0.0;
            for (int a = 0; a < pairs; a++) {
                for (int b = a + 1; b < pairs; b++) {
                    if (same[a] && ! same[b]) {
                        if (dist[a] < dist[b]) plus++;
                        if (dist[a] > dist[b]) minus++;
                    }
                }
            }
            double gamma = (plus + minus == 0.0 ? 0.0 : (plus - minus) / (plus + minus));
            double gPlus = 2.0 * minus / (pairs * (pairs - 1.0));
            ClusteringEvaluator evaluator = new ClusteringEvaluator(null, labels, x, new EvaluationContext(12));
            assertThat("trial " + trial, evaluator.compute("BHGI").getValue(), closeTo(gamma, 1e-9));
            assertThat("trial " + trial, evaluator.compute("GPI").getValue(), closeTo(gPlus, 1e-9));
        }
    }

}
