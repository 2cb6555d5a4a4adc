/**
 *
 */
package org.theseed.metrics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * This object holds the configuration shared by all the metric calls of an evaluator:  the number of
 * fractional digits to keep, whether undefined metrics throw an error, and the sentinel values returned
 * for undefined metrics when they do not.
 *
 * The context is immutable.  Per-call overrides produce a modified copy, so a context can be shared
 * between evaluators and threads.
 *
 */
public class EvaluationContext {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(EvaluationContext.class);
    /** default number of fractional digits */
    public static final int DEFAULT_DECIMAL = 5;
    /** number of fractional digits to keep */
    private final int decimal;
    /** TRUE if undefined metrics should throw an error */
    private final boolean raiseError;
    /** sentinel for undefined metrics that should be minimized */
    private final double biggestValue;
    /** sentinel for undefined metrics that should be maximized */
    private final double smallestValue;

    /**
     * Construct the default evaluation context.
     */
    public EvaluationContext() {
        this(DEFAULT_DECIMAL, false, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);
    }

    /**
     * Construct an evaluation context with a specific precision.
     *
     * @param decimal		number of fractional digits to keep
     */
    public EvaluationContext(int decimal) {
        this(decimal, false, Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY);
    }

    /**
     * Construct a fully-specified evaluation context.
     *
     * @param decimal		number of fractional digits to keep
     * @param raiseError	TRUE if undefined metrics should throw an error
     * @param biggest		sentinel returned for undefined metrics that should be minimized
     * @param smallest		sentinel returned for undefined metrics that should be maximized
     */
    public EvaluationContext(int decimal, boolean raiseError, double biggest, double smallest) {
        this.decimal = checkDecimal(decimal);
        this.raiseError = raiseError;
        this.biggestValue = biggest;
        this.smallestValue = smallest;
    }

    /**
     * Verify a precision value.
     *
     * @param decimal	proposed number of fractional digits
     *
     * @return the value, if it is valid
     *
     * @throws IllegalArgumentException if the value is negative
     */
    public static int checkDecimal(int decimal) {
        if (decimal < 0)
            throw new IllegalArgumentException("Decimal precision must be 0 or more, but was " + decimal + ".");
        return decimal;
    }

    /**
     * @return the precision to use for a call
     *
     * @param override	per-call precision, or NULL to use the context default
     */
    public int resolveDecimal(Integer override) {
        int retVal = this.decimal;
        if (override != null)
            retVal = checkDecimal(override);
        return retVal;
    }

    /**
     * Handle an undefined metric.  If errors are enabled, an exception is thrown; otherwise the
     * specified fallback is returned.
     *
     * @param message		description of the degenerate condition
     * @param fallback		value to return when errors are suppressed
     *
     * @return the fallback value
     *
     * @throws UndefinedMetricException if errors are enabled
     */
    public double undefined(String message, double fallback) {
        if (this.raiseError)
            throw new UndefinedMetricException(message);
        log.debug("{}  Returning {}.", message, fallback);
        return fallback;
    }

    /**
     * @return the number of fractional digits to keep
     */
    public int getDecimal() {
        return this.decimal;
    }

    /**
     * @return TRUE if undefined metrics throw an error
     */
    public boolean isRaiseError() {
        return this.raiseError;
    }

    /**
     * @return the sentinel for undefined metrics that should be minimized
     */
    public double getBiggestValue() {
        return this.biggestValue;
    }

    /**
     * @return the sentinel for undefined metrics that should be maximized
     */
    public double getSmallestValue() {
        return this.smallestValue;
    }

    /**
     * @return a copy of this context with a different precision
     *
     * @param newDecimal	new number of fractional digits
     */
    public EvaluationContext withDecimal(int newDecimal) {
        return new EvaluationContext(newDecimal, this.raiseError, this.biggestValue, this.smallestValue);
    }

    /**
     * @return a copy of this context with a different error mode
     *
     * @param newRaise		TRUE if undefined metrics should throw an error
     */
    public EvaluationContext withRaiseError(boolean newRaise) {
        return new EvaluationContext(this.decimal, newRaise, this.biggestValue, this.smallestValue);
    }

    /**
     * @return a copy of this context with different sentinel values
     *
     * @param biggest		sentinel returned for undefined metrics that should be minimized
     * @param smallest		sentinel returned for undefined metrics that should be maximized
     */
    public EvaluationContext withSentinels(double biggest, double smallest) {
        return new EvaluationContext(this.decimal, this.raiseError, biggest, smallest);
    }

    @Override
    public String toString() {
        return "EvaluationContext [decimal=" + this.decimal + ", raiseError=" + this.raiseError
                + ", biggestValue=" + this.biggestValue + ", smallestValue=" + this.smallestValue + "]";
    }

}
