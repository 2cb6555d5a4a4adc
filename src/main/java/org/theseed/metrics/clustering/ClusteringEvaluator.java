/**
 *
 */
package org.theseed.metrics.clustering;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.metrics.Aggregator;
import org.theseed.metrics.EvaluationContext;
import org.theseed.metrics.MetricOptions;
import org.theseed.metrics.MetricResult;
import org.theseed.metrics.data.ExternalClusteringInput;
import org.theseed.metrics.data.InputNormalizer;
import org.theseed.metrics.data.InternalClusteringInput;
import org.theseed.metrics.data.NdArrays;

/**
 * This object computes clustering metrics.  External metrics compare the true labels to the predicted labels;
 * internal metrics examine the feature matrix together with the predicted labels.  The labels can be any objects
 * (integers, strings, and so forth); they are encoded fresh for each call.
 *
 * The labels and features can be stored in the evaluator when it is constructed, passed in with each call, or
 * both; data passed in a call takes precedence.
 *
 */
public class ClusteringEvaluator {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(ClusteringEvaluator.class);
    /** default true labels, or NULL if none */
    private final List<?> yTrue;
    /** default predicted labels, or NULL if none */
    private final List<?> yPred;
    /** default feature matrix, or NULL if none */
    private final double[][] x;
    /** evaluation context */
    private final EvaluationContext context;

    /**
     * Construct an evaluator with no stored data and the default context.
     */
    public ClusteringEvaluator() {
        this((List<?>) null, (List<?>) null, (double[][]) null, new EvaluationContext());
    }

    /**
     * Construct an evaluator with no stored data.
     *
     * @param context	evaluation context
     */
    public ClusteringEvaluator(EvaluationContext context) {
        this((List<?>) null, (List<?>) null, (double[][]) null, context);
    }

    /**
     * Construct an evaluator for integer labels.
     *
     * @param yTrue		true labels, or NULL
     * @param yPred		predicted labels, or NULL
     * @param x			feature matrix, or NULL
     * @param context	evaluation context
     */
    public ClusteringEvaluator(int[] yTrue, int[] yPred, double[][] x, EvaluationContext context) {
        this(InputNormalizer.asLabels(yTrue), InputNormalizer.asLabels(yPred), x, context);
    }

    /**
     * Construct an evaluator for string labels.
     *
     * @param yTrue		true labels, or NULL
     * @param yPred		predicted labels, or NULL
     * @param x			feature matrix, or NULL
     * @param context	evaluation context
     */
    public ClusteringEvaluator(String[] yTrue, String[] yPred, double[][] x, EvaluationContext context) {
        this(InputNormalizer.asLabels(yTrue), InputNormalizer.asLabels(yPred), x, context);
    }

    /**
     * Construct an evaluator for nd4j arrays.
     *
     * @param yTrue		vector of true labels, or NULL
     * @param yPred		vector of predicted labels, or NULL
     * @param x			feature matrix, or NULL
     * @param context	evaluation context
     */
    public ClusteringEvaluator(INDArray yTrue, INDArray yPred, INDArray x, EvaluationContext context) {
        this(NdArrays.toLabels(yTrue), NdArrays.toLabels(yPred), NdArrays.toMatrix(x), context);
    }

    /**
     * Construct an evaluator for labels of any type.
     *
     * @param yTrue		true labels, or NULL
     * @param yPred		predicted labels, or NULL
     * @param x			feature matrix, or NULL
     * @param context	evaluation context
     */
    public ClusteringEvaluator(List<?> yTrue, List<?> yPred, double[][] x, EvaluationContext context) {
        this.yTrue = yTrue;
        this.yPred = yPred;
        this.x = x;
        this.context = context;
    }

    /**
     * @return the evaluation context
     */
    public EvaluationContext getContext() {
        return this.context;
    }

    /**
     * Compute a metric on the stored data with default options.
     *
     * @param name		name of the metric
     *
     * @return the metric result
     */
    public MetricResult compute(String name) {
        return this.compute(ClusteringMetric.find(name), null, null, null, null);
    }

    /**
     * Compute a metric on the stored data.
     *
     * @param name		name of the metric
     * @param options	per-call options, or NULL for defaults
     *
     * @return the metric result
     */
    public MetricResult compute(String name, MetricOptions options) {
        return this.compute(ClusteringMetric.find(name), null, null, null, options);
    }

    /**
     * Compute a metric on the stored data.
     *
     * @param metric	metric to compute
     * @param options	per-call options, or NULL for defaults
     *
     * @return the metric result
     */
    public MetricResult compute(ClusteringMetric metric, MetricOptions options) {
        return this.compute(metric, null, null, null, options);
    }

    /**
     * Compute a metric.  Data passed in the call overrides the stored data.
     *
     * @param metric	metric to compute
     * @param yTrue		true labels, or NULL to use the stored labels
     * @param yPred		predicted labels, or NULL to use the stored labels
     * @param x			feature matrix, or NULL to use the stored features
     * @param options	per-call options, or NULL for defaults
     *
     * @return the metric result
     */
    public MetricResult compute(ClusteringMetric metric, List<?> yTrue, List<?> yPred, double[][] x,
            MetricOptions options) {
        MetricOptions opts = (options == null ? MetricOptions.defaults() : options);
        int decimal = this.context.resolveDecimal(opts.getDecimal());
        List<?> predLabels = (yPred != null ? yPred : this.yPred);
        MetricResult retVal;
        if (metric.isInternal()) {
            double[][] features = (x != null ? x : this.x);
            InternalClusteringInput input = InputNormalizer.prepareInternal(features, predLabels, decimal);
            if (metric == ClusteringMetric.SI && opts.isSampleScores() && input.getClusters() > 1) {
                double[] samples = InternalIndices.silhouetteSamples(input);
                retVal = Aggregator.samples(new double[][] { samples }, decimal);
            } else {
                ClusterScatter scatter = new ClusterScatter(input);
                double score = metric.score(input, scatter, this.context, opts);
                retVal = MetricResult.of(Aggregator.round(score, decimal));
            }
        } else {
            List<?> trueLabels = (yTrue != null ? yTrue : this.yTrue);
            ExternalClusteringInput input = InputNormalizer.prepareExternal(trueLabels, predLabels, decimal);
            double score = metric.score(new ExternalStatistics(input), this.context);
            retVal = MetricResult.of(Aggregator.round(score, decimal));
        }
        return retVal;
    }

    /**
     * Compute a list of metrics with default options.
     *
     * @param names		names of the metrics
     *
     * @return a map from each name to its result, in request order
     */
    public Map<String, MetricResult> computeAll(List<String> names) {
        return this.computeAll(names, null);
    }

    /**
     * Compute a list of metrics with matching options.
     *
     * @param names			names of the metrics
     * @param optionList	list of option sets, one per name (NULL entries mean defaults); NULL for all defaults
     *
     * @return a map from each name to its result, in request order
     *
     * @throws IllegalArgumentException if the option list does not match the name list
     */
    public Map<String, MetricResult> computeAll(List<String> names, List<MetricOptions> optionList) {
        if (optionList != null && optionList.size() != names.size())
            throw new IllegalArgumentException("There are " + names.size() + " metric names but " + optionList.size()
                    + " option sets.");
        Map<String, MetricResult> retVal = new LinkedHashMap<String, MetricResult>(names.size() * 4 / 3 + 1);
        for (int i = 0; i < names.size(); i++) {
            String name = names.get(i);
            MetricOptions options = (optionList == null ? null : optionList.get(i));
            log.debug("Computing clustering metric {}.", name);
            retVal.put(name, this.compute(name, options));
        }
        log.debug("{} clustering metrics computed.", retVal.size());
        return retVal;
    }

    /**
     * Compute the metrics in a map of names to options.
     *
     * @param metrics	map from metric names to option sets (NULL values mean defaults)
     *
     * @return a map from each name to its result, in the map's iteration order
     */
    public Map<String, MetricResult> computeAll(Map<String, MetricOptions> metrics) {
        Map<String, MetricResult> retVal = new LinkedHashMap<String, MetricResult>(metrics.size() * 4 / 3 + 1);
        for (Map.Entry<String, MetricOptions> entry : metrics.entrySet()) {
            log.debug("Computing clustering metric {}.", entry.getKey());
            retVal.put(entry.getKey(), this.compute(entry.getKey(), entry.getValue()));
        }
        return retVal;
    }

}
