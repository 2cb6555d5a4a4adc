/**
 *
 */
package org.theseed.metrics;

/**
 * This exception is thrown when the arrays passed to a metric have inconsistent sample counts or
 * column counts.  The arrays are never truncated to fit.
 *
 */
public class ShapeException extends IllegalArgumentException {

    /** serialization version ID */
    private static final long serialVersionUID = 5198310740255671345L;

    /**
     * Construct a shape exception.
     *
     * @param message	description of the mismatch
     */
    public ShapeException(String message) {
        super(message);
    }

}
