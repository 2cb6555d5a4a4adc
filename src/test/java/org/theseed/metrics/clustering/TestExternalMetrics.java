/**
 *
 */
package org.theseed.metrics.clustering;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.theseed.metrics.EvaluationContext;
import org.theseed.metrics.MetricDescriptor;
import org.theseed.metrics.MetricResult;
import org.theseed.metrics.MissingInputException;
import org.theseed.metrics.ShapeException;
import org.theseed.metrics.UndefinedMetricException;
import org.theseed.metrics.UnknownMetricException;
import org.theseed.metrics.data.ExternalClusteringInput;
import org.theseed.metrics.data.InputNormalizer;

/**
 * Tests for the external clustering metrics.
 *
 */
public class TestExternalMetrics {

    private static final int[] Y_TRUE = new int[] { 0, 0, 1, 1, 2, 2 };
    private static final int[] Y_PRED = new int[] { 0, 0, 1, 2, 2, 2 };

    private static ClusteringEvaluator evaluator(int[] yTrue, int[] yPred) {
        return new ClusteringEvaluator(yTrue, yPred, null, new EvaluationContext());
    }

    @Test
    public void testPairCounts() {
        ExternalClusteringInput input = InputNormalizer.prepareExternal(InputNormalizer.asLabels(Y_TRUE),
                InputNormalizer.asLabels(Y_PRED), 5);
        ContingencyTable table = new ContingencyTable(input);
        assertThat(table.getClassCount(), equalTo(3));
        assertThat(table.getClusterCount(), equalTo(3));
        assertThat(table.getCount(1, 2), equalTo(1L));
        assertThat(table.getClusterSize(2), equalTo(3L));
        PairConfusion pc = PairConfusion.count(table, false);
        assertThat(pc.getYY(), equalTo(2.0));
        assertThat(pc.getYN(), equalTo(1.0));
        assertThat(pc.getNY(), equalTo(2.0));
        assertThat(pc.getNN(), equalTo(10.0));
        assertThat(pc.total(), equalTo(15.0));
        PairConfusion norm = PairConfusion.count(table, true);
        assertThat(norm.total(), closeTo(1.0, 1e-12));
        assertThat(norm.getNN(), closeTo(10.0 / 15.0, 1e-12));
    }

    @Test
    public void testPairTotals() {
        Random rand = new Random(1234);
        for (int n = 2; n <= 40; n += 7) {
            int[] yTrue = new int[n];
            int[] yPred = new int[n];
            for (int i = 0; i < n; i++) {
                yTrue[i] = rand.nextInt(3);
                yPred[i] = rand.nextInt(5);
            }
            ExternalClusteringInput input = InputNormalizer.prepareExternal(InputNormalizer.asLabels(yTrue),
                    InputNormalizer.asLabels(yPred), 5);
            PairConfusion pc = PairConfusion.count(new ContingencyTable(input), false);
            assertThat(pc.total(), equalTo(n * (n - 1) / 2.0));
            // Brute-force pair count.
            int yy = 0;
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    if (yTrue[i] == yTrue[j] && yPred[i] == yPred[j])
                        yy++;
                }
            }
            assertThat(pc.getYY(), equalTo((double) yy));
        }
    }

    @Test
    public void testScores() {
        ClusteringEvaluator evaluator = evaluator(Y_TRUE, Y_PRED);
        assertThat(evaluator.compute("RaS").getValue(), closeTo(0.8, 1e-9));
        assertThat(evaluator.compute("FMS").getValue(), closeTo(0.57735, 1e-9));
        assertThat(evaluator.compute("PrS").getValue(), closeTo(0.5, 1e-9));
        assertThat(evaluator.compute("ReS").getValue(), closeTo(0.66667, 1e-9));
        assertThat(evaluator.compute("FmS").getValue(), closeTo(0.57143, 1e-9));
        assertThat(evaluator.compute("JS").getValue(), closeTo(0.4, 1e-9));
        assertThat(evaluator.compute("MIS").getValue(), closeTo(0.78036, 1e-9));
        assertThat(evaluator.compute("NMIS").getValue(), closeTo(0.73967, 1e-9));
        assertThat(evaluator.compute("HS").getValue(), closeTo(0.71031, 1e-9));
        assertThat(evaluator.compute("CS").getValue(), closeTo(0.77156, 1e-9));
        assertThat(evaluator.compute("PuS").getValue(), closeTo(0.83333, 1e-9));
        assertThat(evaluator.compute("ES").getValue(), closeTo(0.45915, 1e-9));
        assertThat(evaluator.compute("TS").getValue(), closeTo(0.6, 1e-9));
        assertThat(evaluator.compute("RRS").getValue(), closeTo(0.13333, 1e-9));
        assertThat(evaluator.compute("CDS").getValue(), closeTo(0.57143, 1e-9));
        assertThat(evaluator.compute("KS").getValue(), closeTo(0.58333, 1e-9));
    }

    @Test
    public void testPerfectMatch() {
        // A relabeled partition is still a perfect match.
        ClusteringEvaluator evaluator = evaluator(new int[] { 0, 0, 1, 1 }, new int[] { 1, 1, 0, 0 });
        for (String code : Arrays.asList("RaS", "FMS", "HS", "CS", "VMS", "PrS", "ReS", "FmS", "CDS", "JS", "KS",
                "RTS", "SS1S", "SS2S", "PuS", "TS", "NMIS", "HGS"))
            assertThat(code, evaluator.compute(code).getValue(), closeTo(1.0, 1e-9));
        assertThat(evaluator.compute("ES").getValue(), closeTo(0.0, 1e-9));
    }

    @Test
    public void testSymmetry() {
        ClusteringEvaluator forward = evaluator(Y_TRUE, Y_PRED);
        ClusteringEvaluator reverse = evaluator(Y_PRED, Y_TRUE);
        for (String code : Arrays.asList("RaS", "FMS", "MIS", "NMIS", "VMS", "JS", "CDS", "TS", "HGS"))
            assertThat(code, reverse.compute(code).getValue(), closeTo(forward.compute(code).getValue(), 1e-9));
        assertThat(reverse.compute("PrS").getValue(), closeTo(forward.compute("ReS").getValue(), 1e-9));
        assertThat(reverse.compute("HS").getValue(), closeTo(forward.compute("CS").getValue(), 1e-9));
    }

    @Test
    public void testDegenerate() {
        ClusteringEvaluator evaluator = evaluator(new int[] { 0, 0, 1, 1 }, new int[] { 0, 0, 0, 0 });
        assertThat(evaluator.compute("HGS").getValue(), equalTo(Double.NEGATIVE_INFINITY));
        assertThat(evaluator.compute("PhS").getValue(), equalTo(Double.NEGATIVE_INFINITY));
        assertThat(evaluator.compute("NMIS").getValue(), equalTo(0.0));
        assertThat(evaluator.compute("CS").getValue(), equalTo(1.0));
        ClusteringEvaluator strict = new ClusteringEvaluator(new int[] { 0, 0, 1, 1 }, new int[] { 0, 0, 0, 0 },
                null, new EvaluationContext().withRaiseError(true));
        assertThrows(UndefinedMetricException.class, () -> strict.compute("HGS"));
        ClusteringEvaluator custom = new ClusteringEvaluator(new int[] { 0, 0, 1, 1 }, new int[] { 0, 0, 0, 0 },
                null, new EvaluationContext().withSentinels(1e10, -1e10));
        assertThat(custom.compute("HGS").getValue(), equalTo(-1e10));
    }

    @Test
    public void testStringLabels() {
        ClusteringEvaluator evaluator = new ClusteringEvaluator(new String[] { "a", "a", "b", "b", "c", "c" },
                new String[] { "x", "x", "y", "z", "z", "z" }, null, new EvaluationContext());
        assertThat(evaluator.compute("RaS").getValue(), closeTo(0.8, 1e-9));
    }

    @Test
    public void testErrors() {
        ClusteringEvaluator empty = new ClusteringEvaluator();
        assertThrows(MissingInputException.class, () -> empty.compute("RaS"));
        ClusteringEvaluator mismatched = evaluator(new int[] { 0, 1 }, new int[] { 0, 1, 1 });
        assertThrows(ShapeException.class, () -> mismatched.compute("RaS"));
        assertThrows(UnknownMetricException.class, () -> empty.compute("nonsense"));
    }

    @Test
    public void testLookup() {
        assertThat(ClusteringMetric.find("FMS"), equalTo(ClusteringMetric.FMS));
        assertThat(ClusteringMetric.find("FmS"), equalTo(ClusteringMetric.FmS));
        assertThrows(UnknownMetricException.class, () -> ClusteringMetric.find("fms"));
        assertThat(ClusteringMetric.find("ras"), equalTo(ClusteringMetric.RaS));
        assertThat(ClusteringMetric.find("fowlkes_mallows_score"), equalTo(ClusteringMetric.FMS));
        assertThat(ClusteringMetric.find("f_measure_score"), equalTo(ClusteringMetric.FmS));
        assertThat(ClusteringMetric.find("silhouette_index"), equalTo(ClusteringMetric.SI));
    }

    @Test
    public void testSupport() {
        Map<String, MetricDescriptor> support = ClusteringMetric.getSupport();
        assertThat(support.size(), equalTo(ClusteringMetric.values().length));
        MetricDescriptor dbi = ClusteringMetric.getSupport("DBI");
        assertThat(dbi.getDirection(), equalTo(MetricDescriptor.Direction.MIN));
        assertThat(dbi.getBestString(), equalTo("0"));
        MetricDescriptor chi = ClusteringMetric.getSupport("CHI");
        assertThat(chi.getDirection(), equalTo(MetricDescriptor.Direction.MAX));
        assertThat(chi.hasBest(), equalTo(false));
        assertThat(chi.getBestString(), equalTo(MetricDescriptor.NO_BEST));
        assertThat(ClusteringMetric.getSupport("SI").getRange(), equalTo("[-1, +1]"));
        assertThat(dbi.isBetter(0.2, 0.5), equalTo(true));
        assertThat(chi.isBetter(0.2, 0.5), equalTo(false));
        MetricDescriptor hi = ClusteringMetric.getSupport("HI");
        assertThat(hi.getDirection(), equalTo(MetricDescriptor.Direction.MIN));
        assertThat(hi.getRange(), equalTo("[0, +inf)"));
        assertThat(hi.getBestString(), equalTo("0"));
        assertThat(hi.isBetter(10.0, 100.0), equalTo(true));
        assertThrows(UnknownMetricException.class, () -> ClusteringMetric.getSupport("dbi"));
        assertThrows(UnsupportedOperationException.class, () -> support.put("XX", dbi));
    }

    @Test
    public void testResultFormat() {
        MetricResult result = evaluator(Y_TRUE, Y_PRED).compute("RaS");
        assertThat(result.isScalar(), equalTo(true));
        assertThat(result.format(), equalTo("0.8"));
    }

}
