/**
 *
 */
package org.theseed.metrics.reports;

import org.theseed.metrics.MetricResult;

/**
 * This is a version of the metric report that produces no output, used when only the logged results are wanted.
 *
 */
public class NullMetricReport implements IMetricReport {

    @Override
    public void startReport(String title) {
    }

    @Override
    public void reportMetric(String code, String name, MetricResult result) {
    }

    @Override
    public void finishReport() {
    }

    @Override
    public void close() {
    }

}
