/**
 *
 */
package org.theseed.metrics;

/**
 * This object holds the per-call options for a metric.  Every option is optional; an unset option takes the
 * default of the metric being computed (for example, MAPE cleans zero predictions by default, while MAE
 * does not).  The setters return the object so that options can be chained.
 *
 */
public class MetricOptions {

    // FIELDS
    /** multi-output policy for regression metrics */
    private MultiOutput multiOutput;
    /** TRUE to remove rows with zero predictions */
    private Boolean clean;
    /** TRUE to keep only rows with positive truth and prediction */
    private Boolean positiveOnly;
    /** per-call precision */
    private Integer decimal;
    /** TRUE to use the fast variant of an internal clustering index */
    private Boolean useModified;
    /** TRUE to normalize features before computing determinant indices */
    private Boolean useNormalized;
    /** NRMSE denominator variant */
    private Integer model;
    /** MASE seasonal lag */
    private Integer m;
    /** TRUE to return per-sample silhouette values */
    private Boolean sampleScores;

    /** default NRMSE variant */
    public static final int DEFAULT_MODEL = 0;
    /** default MASE lag */
    public static final int DEFAULT_LAG = 1;

    /**
     * Construct a blank option set.
     */
    public MetricOptions() {
    }

    /**
     * @return a blank option set
     */
    public static MetricOptions defaults() {
        return new MetricOptions();
    }

    /**
     * @return the multi-output policy (raw values if unset)
     */
    public MultiOutput getMultiOutput() {
        return (this.multiOutput == null ? MultiOutput.RAW_VALUES : this.multiOutput);
    }

    /**
     * @param multiOutput 	the multi-output policy to set
     */
    public MetricOptions setMultiOutput(MultiOutput multiOutput) {
        this.multiOutput = multiOutput;
        return this;
    }

    /**
     * @return the clean option
     *
     * @param dflt	value to return if the option is unset
     */
    public boolean isClean(boolean dflt) {
        return (this.clean == null ? dflt : this.clean);
    }

    /**
     * @param clean 	TRUE to remove rows with zero predictions
     */
    public MetricOptions setClean(boolean clean) {
        this.clean = clean;
        return this;
    }

    /**
     * @return the positive-only option
     *
     * @param dflt	value to return if the option is unset
     */
    public boolean isPositiveOnly(boolean dflt) {
        return (this.positiveOnly == null ? dflt : this.positiveOnly);
    }

    /**
     * @param positiveOnly 	TRUE to keep only rows where truth and prediction are positive
     */
    public MetricOptions setPositiveOnly(boolean positiveOnly) {
        this.positiveOnly = positiveOnly;
        return this;
    }

    /**
     * @return the per-call precision, or NULL if the context default should be used
     */
    public Integer getDecimal() {
        return this.decimal;
    }

    /**
     * @param decimal 	the per-call precision to set
     */
    public MetricOptions setDecimal(int decimal) {
        this.decimal = EvaluationContext.checkDecimal(decimal);
        return this;
    }

    /**
     * @return TRUE to use the fast variant of an internal index (default TRUE)
     */
    public boolean isUseModified() {
        return (this.useModified == null ? true : this.useModified);
    }

    /**
     * @param useModified 	TRUE to use the fast variant of an internal index
     */
    public MetricOptions setUseModified(boolean useModified) {
        this.useModified = useModified;
        return this;
    }

    /**
     * @return TRUE to scale features to the unit interval before computing determinants (default TRUE)
     */
    public boolean isUseNormalized() {
        return (this.useNormalized == null ? true : this.useNormalized);
    }

    /**
     * @param useNormalized 	TRUE to scale features before computing determinants
     */
    public MetricOptions setUseNormalized(boolean useNormalized) {
        this.useNormalized = useNormalized;
        return this;
    }

    /**
     * @return the NRMSE denominator variant (0 to 3)
     */
    public int getModel() {
        return (this.model == null ? DEFAULT_MODEL : this.model);
    }

    /**
     * @param model 	the NRMSE denominator variant to set
     */
    public MetricOptions setModel(int model) {
        this.model = model;
        return this;
    }

    /**
     * @return the MASE seasonal lag
     */
    public int getM() {
        return (this.m == null ? DEFAULT_LAG : this.m);
    }

    /**
     * @param m 	the MASE seasonal lag to set
     */
    public MetricOptions setM(int m) {
        if (m < 1)
            throw new IllegalArgumentException("Seasonal lag must be at least 1, but was " + m + ".");
        this.m = m;
        return this;
    }

    /**
     * @return TRUE to return per-sample values instead of a mean (silhouette only)
     */
    public boolean isSampleScores() {
        return (this.sampleScores == null ? false : this.sampleScores);
    }

    /**
     * @param sampleScores 	TRUE to return per-sample values instead of a mean
     */
    public MetricOptions setSampleScores(boolean sampleScores) {
        this.sampleScores = sampleScores;
        return this;
    }

    @Override
    public String toString() {
        return "MetricOptions [multiOutput=" + this.multiOutput + ", clean=" + this.clean + ", positiveOnly="
                + this.positiveOnly + ", decimal=" + this.decimal + ", useModified=" + this.useModified
                + ", useNormalized=" + this.useNormalized + ", model=" + this.model + ", m=" + this.m
                + ", sampleScores=" + this.sampleScores + "]";
    }

}
