/**
 *
 */
package org.theseed.metrics.reports;

import org.theseed.metrics.MetricResult;

/**
 * This is the interface for classes producing a metric report.  It is used by the command processors to determine
 * the type of output.
 *
 */
public interface IMetricReport extends AutoCloseable {

    /**
     * Initialize the report.
     *
     * @param title		title of the data set being evaluated
     */
    void startReport(String title);

    /**
     * Write the output for a single metric.
     *
     * @param code		short code of the metric
     * @param name		displayable name of the metric
     * @param result	computed result
     */
    void reportMetric(String code, String name, MetricResult result);

    /**
     * Finish the report.
     */
    void finishReport();

    /**
     * Close the underlying file.
     */
    public void close();

}
