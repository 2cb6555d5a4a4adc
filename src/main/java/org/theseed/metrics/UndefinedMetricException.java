/**
 *
 */
package org.theseed.metrics;

/**
 * This exception is thrown when a metric is mathematically undefined for its input (for example, a pair-counting
 * score computed on a single predicted cluster) and the evaluation context asks for errors instead of
 * sentinel values.
 *
 */
public class UndefinedMetricException extends ArithmeticException {

    /** serialization version ID */
    private static final long serialVersionUID = 2836027795019541112L;

    /**
     * Construct an undefined-metric exception.
     *
     * @param message	description of the degenerate condition
     */
    public UndefinedMetricException(String message) {
        super(message);
    }

}
