/**
 *
 */
package org.theseed.metrics.regression;

import java.util.HashMap;
import java.util.Map;

import org.apache.commons.math3.stat.StatUtils;
import org.theseed.metrics.MetricOptions;
import org.theseed.metrics.UnknownMetricException;

/**
 * This enumeration is the registry of regression metrics.  Each metric has a short code (the enum constant name,
 * except for GINI_WIKI, which is its own code), a long name, a display label, and default settings for the
 * row filters.  Most metrics reduce a column to a single score.  The per-sample metrics (RE, AE, SE, SLE) instead
 * produce one value per row and are never aggregated.
 *
 * Lookup by name tries the short code first, then the long name, and finally a case-insensitive alias table.
 *
 */
public enum RegressionMetric {

    EVS("explained_variance_score", "Explained Variance Score", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.explainedVariance(t, p);
        }
    }, ME("max_error", "Max Error", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.maxError(t, p);
        }
    }, MAE("mean_absolute_error", "Mean Absolute Error", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.meanAbsoluteError(t, p);
        }
    }, MSE("mean_squared_error", "Mean Squared Error", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.meanSquaredError(t, p);
        }
    }, RMSE("root_mean_squared_error", "Root Mean Squared Error", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return Math.sqrt(RegressionFormulas.meanSquaredError(t, p));
        }
    }, MSLE("mean_squared_log_error", "Mean Squared Log Error", true, true) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            double sum = 0.0;
            for (int i = 0; i < t.length; i++) {
                double lr = Math.log(t[i] / p[i]);
                sum += lr * lr;
            }
            return sum / t.length;
        }
    }, MedAE("median_absolute_error", "Median Absolute Error", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.medianAbsoluteError(t, p);
        }
    }, MRE("mean_relative_error", "Mean Relative Error", true, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            double sum = 0.0;
            for (int i = 0; i < t.length; i++)
                sum += Math.abs(t[i] - p[i]) / t[i];
            return sum / t.length;
        }
    }, MAPE("mean_absolute_percentage_error", "Mean Absolute Percentage Error", true, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            double sum = 0.0;
            for (int i = 0; i < t.length; i++)
                sum += Math.abs(t[i] - p[i]) / Math.abs(t[i]);
            return sum / t.length;
        }
    }, SMAPE("symmetric_mean_absolute_percentage_error", "Symmetric Mean Absolute Percentage Error", true, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            double sum = 0.0;
            for (int i = 0; i < t.length; i++)
                sum += 2 * Math.abs(p[i] - t[i]) / (Math.abs(t[i]) + Math.abs(p[i]));
            return sum / t.length;
        }
    }, MAAPE("mean_arctangent_absolute_percentage_error", "Mean Arctangent Absolute Percentage Error", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            double sum = 0.0;
            for (int i = 0; i < t.length; i++)
                sum += Math.atan(Math.abs((t[i] - p[i]) / t[i]));
            return sum / t.length;
        }
    }, MASE("mean_absolute_scaled_error", "Mean Absolute Scaled Error", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.meanAbsoluteScaledError(t, p, options.getM());
        }
    }, NSE("nash_sutcliffe_efficiency", "Nash-Sutcliffe Efficiency", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.nashSutcliffe(t, p);
        }
    }, WI("willmott_index", "Willmott Index", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.willmott(t, p);
        }
    }, R("pearson_correlation_coefficient", "Pearson Correlation Coefficient", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.pearson(t, p);
        }
    }, R2s("pearson_correlation_coefficient_square", "Squared Pearson Correlation Coefficient", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            double r = RegressionFormulas.pearson(t, p);
            return r * r;
        }
    }, CI("confidence_index", "Confidence Index", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.pearson(t, p) * RegressionFormulas.willmott(t, p);
        }
    }, R2("coefficient_of_determination", "Coefficient of Determination", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.nashSutcliffe(t, p);
        }
    }, DRV("deviation_of_runoff_volume", "Deviation of Runoff Volume", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return StatUtils.sum(p) / StatUtils.sum(t);
        }
    }, KGE("kling_gupta_efficiency", "Kling-Gupta Efficiency", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.klingGupta(t, p);
        }
    }, GINI("gini_coefficient", "Gini Coefficient", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.gini(t, p);
        }
    }, GINI_WIKI("gini_coefficient_wiki", "Gini Coefficient (Pooled)", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.giniWiki(t, p);
        }
    }, PCD("prediction_of_change_in_direction", "Prediction of Change in Direction", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.changeInDirection(t, p);
        }
    }, E("entropy", "Entropy", true, true) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.entropy(t, p, RegressionFormulas.LOG_EPSILON);
        }
    }, CE("cross_entropy", "Cross Entropy", true, true) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            ProbabilityHistogram hist = new ProbabilityHistogram(t, p);
            return RegressionFormulas.binEntropy(hist.getTrueProbs(), hist.getPredProbs(), RegressionFormulas.LOG_EPSILON);
        }
    }, KLD("kullback_leibler_divergence", "Kullback-Leibler Divergence", true, true) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.kullbackLeibler(new ProbabilityHistogram(t, p), RegressionFormulas.LOG_EPSILON);
        }
    }, JSD("jensen_shannon_divergence", "Jensen-Shannon Divergence", true, true) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.jensenShannon(new ProbabilityHistogram(t, p), RegressionFormulas.LOG_EPSILON);
        }
    }, VAF("variance_accounted_for", "Variance Accounted For", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.explainedVariance(t, p) * 100.0;
        }
    }, RAE("relative_absolute_error", "Relative Absolute Error", false, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            double denom = 0.0;
            for (double v : t)
                denom += v * v;
            return Math.sqrt(RegressionFormulas.sumSquaredError(t, p)) / Math.sqrt(denom);
        }
    }, A10("a10_index", "A10 Index", true, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.ratioIndex(t, p, 0.1);
        }
    }, A20("a20_index", "A20 Index", true, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.ratioIndex(t, p, 0.2);
        }
    }, NRMSE("normalized_root_mean_square_error", "Normalized Root Mean Square Error", true, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.normalizedRmse(t, p, options.getModel());
        }
    }, RSE("residual_standard_error", "Residual Standard Error", true, false) {
        @Override
        public double score(double[] t, double[] p, MetricOptions options) {
            return RegressionFormulas.residualStandardError(t, p);
        }
    }, RE("single_relative_error", "Relative Error", false, false) {
        @Override
        public double[] sampleScores(double[] t, double[] p) {
            double[] retVal = new double[t.length];
            for (int i = 0; i < t.length; i++)
                retVal[i] = p[i] / t[i] - 1;
            return retVal;
        }
    }, AE("single_absolute_error", "Absolute Error", false, false) {
        @Override
        public double[] sampleScores(double[] t, double[] p) {
            double[] retVal = new double[t.length];
            for (int i = 0; i < t.length; i++)
                retVal[i] = Math.abs(t[i]) - Math.abs(p[i]);
            return retVal;
        }
    }, SE("single_squared_error", "Squared Error", false, false) {
        @Override
        public double[] sampleScores(double[] t, double[] p) {
            double[] retVal = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                double d = t[i] - p[i];
                retVal[i] = d * d;
            }
            return retVal;
        }
    }, SLE("single_squared_log_error", "Squared Log Error", false, true) {
        @Override
        public double[] sampleScores(double[] t, double[] p) {
            double[] retVal = new double[t.length];
            for (int i = 0; i < t.length; i++) {
                double d = Math.log(t[i]) - Math.log(p[i]);
                retVal[i] = d * d;
            }
            return retVal;
        }
    };

    // FIELDS
    /** long name of the metric */
    private final String longName;
    /** displayable name of the metric */
    private final String label;
    /** TRUE if rows with zero predictions are removed by default */
    private final boolean defaultClean;
    /** TRUE if only rows with positive values are kept by default */
    private final boolean defaultPositive;
    /** case-insensitive alias table */
    private static final Map<String, RegressionMetric> ALIASES = new HashMap<String, RegressionMetric>();

    static {
        for (RegressionMetric metric : RegressionMetric.values()) {
            ALIASES.put(metric.name().toLowerCase(), metric);
            ALIASES.put(metric.longName, metric);
        }
    }

    /**
     * Construct a regression metric.
     *
     * @param longName			long name of the metric
     * @param label				displayable name
     * @param defaultClean		TRUE to remove zero-prediction rows by default
     * @param defaultPositive	TRUE to keep only positive rows by default
     */
    private RegressionMetric(String longName, String label, boolean defaultClean, boolean defaultPositive) {
        this.longName = longName;
        this.label = label;
        this.defaultClean = defaultClean;
        this.defaultPositive = defaultPositive;
    }

    /**
     * Compute the score for one column.
     *
     * @param t			filtered truth values
     * @param p			filtered predictions
     * @param options	per-call options
     *
     * @return the unrounded score for the column
     */
    public double score(double[] t, double[] p, MetricOptions options) {
        throw new UnsupportedOperationException(this.name() + " produces one value per sample.");
    }

    /**
     * Compute the per-sample values for one column.
     *
     * @param t			filtered truth values
     * @param p			filtered predictions
     *
     * @return the unrounded value for each sample
     */
    public double[] sampleScores(double[] t, double[] p) {
        throw new UnsupportedOperationException(this.name() + " produces a single score per column.");
    }

    /**
     * @return TRUE if this metric produces one value per sample
     */
    public boolean isPerSample() {
        return (this == RE || this == AE || this == SE || this == SLE);
    }

    /**
     * @return the short code of this metric
     */
    public String getCode() {
        return this.name();
    }

    /**
     * @return the long name of this metric
     */
    public String getLongName() {
        return this.longName;
    }

    /**
     * @return the displayable name of this metric
     */
    public String getLabel() {
        return this.label;
    }

    /**
     * @return TRUE if rows with zero predictions are removed by default
     */
    public boolean isDefaultClean() {
        return this.defaultClean;
    }

    /**
     * @return TRUE if only rows with positive values are kept by default
     */
    public boolean isDefaultPositive() {
        return this.defaultPositive;
    }

    @Override
    public String toString() {
        return this.label;
    }

    /**
     * Find a regression metric by name.
     *
     * @param name		short code, long name, or case-insensitive alias of the metric
     *
     * @return the metric with the specified name
     *
     * @throws UnknownMetricException if no metric has the specified name
     */
    public static RegressionMetric find(String name) {
        RegressionMetric retVal = null;
        if (name != null) {
            for (RegressionMetric metric : RegressionMetric.values()) {
                if (metric.name().equals(name) || metric.longName.equals(name))
                    retVal = metric;
            }
            if (retVal == null)
                retVal = ALIASES.get(name.toLowerCase());
        }
        if (retVal == null)
            throw new UnknownMetricException("regression", name);
        return retVal;
    }

}
