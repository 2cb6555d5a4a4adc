/**
 *
 */
package org.theseed.metrics.regression;

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
import org.theseed.metrics.data.InputNormalizer;
import org.theseed.metrics.data.NdArrays;
import org.theseed.metrics.data.RegressionInput;

/**
 * This object computes regression metrics.  The truth and prediction data can be stored in the evaluator when it
 * is constructed, passed in with each call, or both; data passed in a call takes precedence.  Each call prepares
 * the data fresh, so the evaluator holds no state beyond its construction parameters.
 *
 * Data is organized as a matrix with one row per sample and one column per output.  A simple array is treated
 * as a single output column, and a single-column result is always a scalar.
 *
 */
public class RegressionEvaluator {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(RegressionEvaluator.class);
    /** default truth matrix, or NULL if none */
    private final double[][] yTrue;
    /** default prediction matrix, or NULL if none */
    private final double[][] yPred;
    /** evaluation context */
    private final EvaluationContext context;

    /**
     * Construct an evaluator with no stored data and the default context.
     */
    public RegressionEvaluator() {
        this((double[][]) null, (double[][]) null, new EvaluationContext());
    }

    /**
     * Construct an evaluator with no stored data.
     *
     * @param context	evaluation context
     */
    public RegressionEvaluator(EvaluationContext context) {
        this((double[][]) null, (double[][]) null, context);
    }

    /**
     * Construct an evaluator for a single output column.
     *
     * @param yTrue		truth values
     * @param yPred		predicted values
     */
    public RegressionEvaluator(double[] yTrue, double[] yPred) {
        this(yTrue, yPred, new EvaluationContext());
    }

    /**
     * Construct an evaluator for a single output column.
     *
     * @param yTrue		truth values
     * @param yPred		predicted values
     * @param context	evaluation context
     */
    public RegressionEvaluator(double[] yTrue, double[] yPred, EvaluationContext context) {
        this(InputNormalizer.asColumn(yTrue), InputNormalizer.asColumn(yPred), context);
    }

    /**
     * Construct an evaluator for multiple output columns.
     *
     * @param yTrue		truth matrix, one row per sample
     * @param yPred		prediction matrix, one row per sample
     */
    public RegressionEvaluator(double[][] yTrue, double[][] yPred) {
        this(yTrue, yPred, new EvaluationContext());
    }

    /**
     * Construct an evaluator for nd4j arrays, such as the label and output arrays of a network.
     *
     * @param yTrue		truth array (vector or matrix)
     * @param yPred		prediction array (vector or matrix)
     * @param context	evaluation context
     */
    public RegressionEvaluator(INDArray yTrue, INDArray yPred, EvaluationContext context) {
        this(NdArrays.toMatrix(yTrue), NdArrays.toMatrix(yPred), context);
    }

    /**
     * Construct an evaluator for multiple output columns.
     *
     * @param yTrue		truth matrix, one row per sample
     * @param yPred		prediction matrix, one row per sample
     * @param context	evaluation context
     */
    public RegressionEvaluator(double[][] yTrue, double[][] yPred, EvaluationContext context) {
        this.yTrue = yTrue;
        this.yPred = yPred;
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
        return this.compute(RegressionMetric.find(name), null, null, null);
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
        return this.compute(RegressionMetric.find(name), null, null, options);
    }

    /**
     * Compute a metric on the stored data.
     *
     * @param metric	metric to compute
     * @param options	per-call options, or NULL for defaults
     *
     * @return the metric result
     */
    public MetricResult compute(RegressionMetric metric, MetricOptions options) {
        return this.compute(metric, null, null, options);
    }

    /**
     * Compute a metric on a single output column passed in the call.
     *
     * @param name		name of the metric
     * @param yTrue		truth values, or NULL to use the stored truth
     * @param yPred		predicted values, or NULL to use the stored predictions
     * @param options	per-call options, or NULL for defaults
     *
     * @return the metric result
     */
    public MetricResult compute(String name, double[] yTrue, double[] yPred, MetricOptions options) {
        return this.compute(RegressionMetric.find(name), InputNormalizer.asColumn(yTrue),
                InputNormalizer.asColumn(yPred), options);
    }

    /**
     * Compute a metric.
     *
     * @param metric	metric to compute
     * @param yTrue		truth matrix, or NULL to use the stored truth
     * @param yPred		prediction matrix, or NULL to use the stored predictions
     * @param options	per-call options, or NULL for defaults
     *
     * @return the metric result
     */
    public MetricResult compute(RegressionMetric metric, double[][] yTrue, double[][] yPred, MetricOptions options) {
        MetricOptions opts = (options == null ? MetricOptions.defaults() : options);
        double[][] trueData = (yTrue != null ? yTrue : this.yTrue);
        double[][] predData = (yPred != null ? yPred : this.yPred);
        int decimal = this.context.resolveDecimal(opts.getDecimal());
        RegressionInput input = InputNormalizer.prepareRegression(trueData, predData,
                opts.isClean(metric.isDefaultClean()), opts.isPositiveOnly(metric.isDefaultPositive()), decimal);
        final int n = input.getColumnCount();
        MetricResult retVal;
        if (metric.isPerSample()) {
            double[][] columns = new double[n][];
            for (int c = 0; c < n; c++)
                columns[c] = metric.sampleScores(input.getTrue(c), input.getPred(c));
            retVal = Aggregator.samples(columns, decimal);
        } else {
            double[] scores = new double[n];
            for (int c = 0; c < n; c++)
                scores[c] = metric.score(input.getTrue(c), input.getPred(c), opts);
            retVal = Aggregator.aggregate(scores, input.isSingleColumn(), opts.getMultiOutput(), decimal);
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
            log.debug("Computing regression metric {}.", name);
            retVal.put(name, this.compute(name, options));
        }
        log.debug("{} regression metrics computed.", retVal.size());
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
            log.debug("Computing regression metric {}.", entry.getKey());
            retVal.put(entry.getKey(), this.compute(entry.getKey(), entry.getValue()));
        }
        return retVal;
    }

}
