/**
 *
 */
package org.theseed.metrics.reports;

import java.io.OutputStream;

/**
 * This enumeration describes the types of metric report.
 *
 */
public enum ReportType {
    TEXT {
        @Override
        public IMetricReport create(OutputStream output) {
            return new TextMetricReport(output);
        }
    }, NULL {
        @Override
        public IMetricReport create(OutputStream output) {
            return new NullMetricReport();
        }
    };

    /**
     * @return a report of this type
     *
     * @param output	output stream to receive the report
     */
    public abstract IMetricReport create(OutputStream output);

}
