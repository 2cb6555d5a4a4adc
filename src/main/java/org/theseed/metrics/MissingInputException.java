/**
 *
 */
package org.theseed.metrics;

/**
 * This exception is thrown when a metric needs an input array (truth, predictions or features) that was
 * supplied neither on the call nor on the evaluator.
 *
 */
public class MissingInputException extends IllegalArgumentException {

    /** serialization version ID */
    private static final long serialVersionUID = -3405612741198264021L;

    /**
     * Construct a missing-input exception.
     *
     * @param message	description of the missing input
     */
    public MissingInputException(String message) {
        super(message);
    }

}
