/**
 *
 */
package org.theseed.metrics;

/**
 * This exception is thrown when a metric name or code does not match any registered metric.
 *
 */
public class UnknownMetricException extends IllegalArgumentException {

    /** serialization version ID */
    private static final long serialVersionUID = -6129840715120993826L;

    /**
     * Construct an unknown-metric exception.
     *
     * @param family	metric family searched ("regression" or "clustering")
     * @param name		name that was not found
     */
    public UnknownMetricException(String family, String name) {
        super("No " + family + " metric is named \"" + name + "\".");
    }

}
