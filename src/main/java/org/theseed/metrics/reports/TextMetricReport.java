/**
 *
 */
package org.theseed.metrics.reports;

import java.io.OutputStream;

import org.apache.commons.text.TextStringBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.theseed.metrics.MetricResult;

/**
 * This report writes one tab-delimited line per metric, containing the metric code, its displayable name, and its
 * value.  A result with several values lists them separated by commas; per-sample results for several output
 * columns separate the columns with semicolons.
 *
 */
public class TextMetricReport extends BaseMetricReporter {

    // FIELDS
    /** logging facility */
    protected static Logger log = LoggerFactory.getLogger(TextMetricReport.class);
    /** buffer for building output lines */
    private final TextStringBuilder buffer;
    /** number of metrics written */
    private int count;

    /**
     * Construct a text metric report for a specified output stream.
     *
     * @param output	stream to receive the report
     */
    public TextMetricReport(OutputStream output) {
        super(output);
        this.buffer = new TextStringBuilder(80);
        this.count = 0;
    }

    @Override
    public void startReport(String title) {
        log.info("Producing metric report for {}.", title);
        this.println("metric\tname\tvalue");
    }

    @Override
    public void reportMetric(String code, String name, MetricResult result) {
        this.buffer.clear();
        this.buffer.append(code).append('\t').append(name).append('\t').append(result.format());
        this.println(this.buffer.toString());
        this.count++;
    }

    @Override
    public void finishReport() {
        log.info("{} metrics reported.", this.count);
    }

}
