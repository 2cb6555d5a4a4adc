/**
 *
 */
package org.theseed.metrics.clustering;

import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

import org.theseed.metrics.EvaluationContext;
import org.theseed.metrics.MetricDescriptor;
import org.theseed.metrics.MetricDescriptor.Direction;
import org.theseed.metrics.MetricOptions;
import org.theseed.metrics.UnknownMetricException;
import org.theseed.metrics.data.InternalClusteringInput;

/**
 * This enumeration is the registry of clustering metrics.  There are two families.  Internal metrics judge a
 * clustering from the feature matrix and the predicted labels alone.  External metrics compare the predicted
 * labels to the true classes.  Each metric has a descriptor giving its direction of optimization, its range,
 * and its best value.
 *
 * Lookup by name tries the short code first, then the long name, and finally a case-insensitive alias table.
 * A lower-case code shared by two metrics (FMS and FmS) is not an alias for either.
 *
 */
public enum ClusteringMetric {

    BHI("ball_hall_index", "Ball-Hall Index", Family.INTERNAL, Direction.MIN, "[0, +inf)", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.ballHall(scatter);
        }
    }, XBI("xie_beni_index", "Xie-Beni Index", Family.INTERNAL, Direction.MIN, "[0, +inf)", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.xieBeni(scatter, context);
        }
    }, DBI("davies_bouldin_index", "Davies-Bouldin Index", Family.INTERNAL, Direction.MIN, "[0, +inf)", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.daviesBouldin(input, scatter, context);
        }
    }, BRI("banfeld_raftery_index", "Banfeld-Raftery Index", Family.INTERNAL, Direction.MIN, "(-inf, +inf)", Double.NaN) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.banfeldRaftery(scatter, context);
        }
    }, KDI("ksq_detw_index", "Ksq-DetW Index", Family.INTERNAL, Direction.MIN, "(-inf, +inf)", Double.NaN) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.ksqDetW(input, options.isUseNormalized());
        }
    }, DRI("det_ratio_index", "Det-Ratio Index", Family.INTERNAL, Direction.MAX, "[0, +inf)", Double.NaN) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.detRatio(scatter, context);
        }
    }, DI("dunn_index", "Dunn Index", Family.INTERNAL, Direction.MAX, "[0, +inf)", Double.NaN) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.dunn(input, options.isUseModified(), context);
        }
    }, CHI("calinski_harabasz_index", "Calinski-Harabasz Index", Family.INTERNAL, Direction.MAX, "[0, +inf)", Double.NaN) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.calinskiHarabasz(scatter, context);
        }
    }, LDRI("log_det_ratio_index", "Log-Det-Ratio Index", Family.INTERNAL, Direction.MAX, "(-inf, +inf)", Double.NaN) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.logDetRatio(scatter, context);
        }
    }, LSRI("log_ss_ratio_index", "Log-SS-Ratio Index", Family.INTERNAL, Direction.MAX, "(-inf, +inf)", Double.NaN) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.logSsRatio(scatter, context);
        }
    }, SI("silhouette_index", "Silhouette Index", Family.INTERNAL, Direction.MAX, "[-1, +1]", 1) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.silhouette(input, context);
        }
    }, SSEI("sum_squared_error_index", "Sum of Squared Error Index", Family.INTERNAL, Direction.MIN, "[0, +inf)", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return scatter.getWGSS();
        }
    }, DHI("duda_hart_index", "Duda-Hart Index", Family.INTERNAL, Direction.MIN, "[0, +inf)", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.dudaHart(scatter, context);
        }
    }, BI("beale_index", "Beale Index", Family.INTERNAL, Direction.MIN, "[0, +inf)", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.beale(scatter, context);
        }
    }, RSI("r_squared_index", "R-Squared Index", Family.INTERNAL, Direction.MAX, "(-inf, +1]", 1) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.rSquared(scatter);
        }
    }, DBCVI("density_based_clustering_validation_index", "Density-Based Clustering Validation Index", Family.INTERNAL,
            Direction.MIN, "[0, 1]", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.densityBasedValidation(input, context);
        }
    }, HI("hartigan_index", "Hartigan Index", Family.INTERNAL, Direction.MIN, "[0, +inf)", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.hartigan(scatter);
        }
    }, BHGI("baker_hubert_gamma_index", "Baker-Hubert Gamma Index", Family.INTERNAL, Direction.MAX, "[-1, 1]", 1) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.bakerHubertGamma(input);
        }
    }, GPI("g_plus_index", "G-Plus Index", Family.INTERNAL, Direction.MIN, "[0, 1]", 0) {
        @Override
        public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
                MetricOptions options) {
            return InternalIndices.gPlus(input);
        }
    }, MIS("mutual_info_score", "Mutual Information Score", Family.EXTERNAL, Direction.MAX, "[0, +inf)", Double.NaN) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return stats.getTable().mutualInformation();
        }
    }, NMIS("normalized_mutual_info_score", "Normalized Mutual Information Score", Family.EXTERNAL, Direction.MAX,
            "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return ExternalIndices.normalizedMutualInfo(stats.getTable(), context);
        }
    }, RaS("rand_score", "Rand Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            return (pc.getYY() + pc.getNN()) / pc.total();
        }
    }, FMS("fowlkes_mallows_score", "Fowlkes-Mallows Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            return pc.getYY() / Math.sqrt((pc.getYY() + pc.getNY()) * (pc.getYY() + pc.getYN()));
        }
    }, HS("homogeneity_score", "Homogeneity Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return stats.getTable().homogeneity();
        }
    }, CS("completeness_score", "Completeness Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return stats.getTable().completeness();
        }
    }, VMS("v_measure_score", "V-Measure Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return ExternalIndices.vMeasure(stats.getTable());
        }
    }, PrS("precision_score", "Precision Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return ExternalIndices.precision(stats.getPairs());
        }
    }, ReS("recall_score", "Recall Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return ExternalIndices.recall(stats.getPairs());
        }
    }, FmS("f_measure_score", "F-Measure Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return ExternalIndices.fMeasure(stats.getPairs());
        }
    }, CDS("czekanowski_dice_score", "Czekanowski-Dice Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            return 2 * pc.getYY() / (2 * pc.getYY() + pc.getYN() + pc.getNY());
        }
    }, HGS("hubert_gamma_score", "Hubert Gamma Score", Family.EXTERNAL, Direction.MAX, "[-1, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return ExternalIndices.hubertGamma(stats.getNormalized(), stats.getClusterCount(), context);
        }
    }, JS("jaccard_score", "Jaccard Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            return pc.getYY() / (pc.getYY() + pc.getYN() + pc.getNY());
        }
    }, KS("kulczynski_score", "Kulczynski Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            return 0.5 * (ExternalIndices.precision(pc) + ExternalIndices.recall(pc));
        }
    }, MNS("mc_nemar_score", "McNemar Score", Family.EXTERNAL, Direction.MAX, "(-inf, +inf)", Double.NaN) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            return (pc.getNN() - pc.getNY()) / Math.sqrt(pc.getNN() + pc.getNY());
        }
    }, PhS("phi_score", "Phi Score", Family.EXTERNAL, Direction.MAX, "(-inf, +inf)", Double.NaN) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return ExternalIndices.phi(stats.getNormalized(), stats.getClusterCount(), context);
        }
    }, RTS("rogers_tanimoto_score", "Rogers-Tanimoto Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            double agree = pc.getYY() + pc.getNN();
            return agree / (agree + 2 * (pc.getYN() + pc.getNY()));
        }
    }, RRS("russel_rao_score", "Russel-Rao Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            return pc.getYY() / pc.total();
        }
    }, SS1S("sokal_sneath1_score", "Sokal-Sneath Score 1", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            return pc.getYY() / (pc.getYY() + 2 * (pc.getYN() + pc.getNY()));
        }
    }, SS2S("sokal_sneath2_score", "Sokal-Sneath Score 2", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            PairConfusion pc = stats.getPairs();
            double agree = pc.getYY() + pc.getNN();
            return agree / (agree + 0.5 * (pc.getYN() + pc.getNY()));
        }
    }, PuS("purity_score", "Purity Score", Family.EXTERNAL, Direction.MAX, "[0, 1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return stats.getTable().purity();
        }
    }, ES("entropy_score", "Entropy Score", Family.EXTERNAL, Direction.MIN, "[0, 1]", 0) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return stats.getTable().clusterEntropyScore();
        }
    }, TS("tau_score", "Tau Score", Family.EXTERNAL, Direction.MAX, "[-1, +1]", 1) {
        @Override
        public double score(ExternalStatistics stats, EvaluationContext context) {
            return ExternalIndices.tau(stats.getPairs());
        }
    };

    /** metric family */
    public static enum Family {
        /** needs features and predicted labels */
        INTERNAL,
        /** needs true and predicted labels */
        EXTERNAL;
    }

    // FIELDS
    /** long name of the metric */
    private final String longName;
    /** displayable name of the metric */
    private final String label;
    /** metric family */
    private final Family family;
    /** optimization descriptor */
    private final MetricDescriptor descriptor;
    /** case-insensitive alias table */
    private static final Map<String, ClusteringMetric> ALIASES = new HashMap<String, ClusteringMetric>();
    /** read-only map of codes to descriptors, in registry order */
    private static final Map<String, MetricDescriptor> SUPPORT;

    static {
        Set<String> ambiguous = new HashSet<String>();
        Map<String, MetricDescriptor> support = new LinkedHashMap<String, MetricDescriptor>();
        for (ClusteringMetric metric : ClusteringMetric.values()) {
            String alias = metric.name().toLowerCase();
            ClusteringMetric old = ALIASES.put(alias, metric);
            if (old != null && old != metric)
                ambiguous.add(alias);
            ALIASES.put(metric.longName, metric);
            support.put(metric.name(), metric.descriptor);
        }
        for (String alias : ambiguous)
            ALIASES.remove(alias);
        SUPPORT = Collections.unmodifiableMap(support);
    }

    /**
     * Construct a clustering metric.
     *
     * @param longName		long name of the metric
     * @param label			displayable name
     * @param family		metric family
     * @param direction		direction of optimization
     * @param range			displayable value range
     * @param best			best achievable value, or NaN if there is none
     */
    private ClusteringMetric(String longName, String label, Family family, Direction direction, String range, double best) {
        this.longName = longName;
        this.label = label;
        this.family = family;
        this.descriptor = new MetricDescriptor(direction, range, best);
    }

    /**
     * Compute an internal metric.
     *
     * @param input		feature matrix and encoded labels
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context
     * @param options	per-call options
     *
     * @return the unrounded score
     */
    public double score(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context,
            MetricOptions options) {
        throw new UnsupportedOperationException(this.name() + " is an external metric.");
    }

    /**
     * Compute an external metric.
     *
     * @param stats		contingency and pair statistics of the two labelings
     * @param context	evaluation context
     *
     * @return the unrounded score
     */
    public double score(ExternalStatistics stats, EvaluationContext context) {
        throw new UnsupportedOperationException(this.name() + " is an internal metric.");
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
     * @return the family of this metric
     */
    public Family getFamily() {
        return this.family;
    }

    /**
     * @return TRUE if this metric needs the feature matrix
     */
    public boolean isInternal() {
        return this.family == Family.INTERNAL;
    }

    /**
     * @return the optimization descriptor of this metric
     */
    public MetricDescriptor getDescriptor() {
        return this.descriptor;
    }

    @Override
    public String toString() {
        return this.label;
    }

    /**
     * Find a clustering metric by name.
     *
     * @param name		short code, long name, or case-insensitive alias of the metric
     *
     * @return the metric with the specified name
     *
     * @throws UnknownMetricException if no metric has the specified name
     */
    public static ClusteringMetric find(String name) {
        ClusteringMetric retVal = null;
        if (name != null) {
            for (ClusteringMetric metric : ClusteringMetric.values()) {
                if (metric.name().equals(name) || metric.longName.equals(name))
                    retVal = metric;
            }
            if (retVal == null)
                retVal = ALIASES.get(name.toLowerCase());
        }
        if (retVal == null)
            throw new UnknownMetricException("clustering", name);
        return retVal;
    }

    /**
     * @return the descriptor for a clustering metric code
     *
     * @param code		short code of the metric (case-sensitive)
     *
     * @throws UnknownMetricException if no metric has the specified code
     */
    public static MetricDescriptor getSupport(String code) {
        MetricDescriptor retVal = SUPPORT.get(code);
        if (retVal == null)
            throw new UnknownMetricException("clustering", code);
        return retVal;
    }

    /**
     * @return a read-only map of every metric code to its descriptor
     */
    public static Map<String, MetricDescriptor> getSupport() {
        return SUPPORT;
    }

}
