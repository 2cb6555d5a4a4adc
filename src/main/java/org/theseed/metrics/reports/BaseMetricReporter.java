/**
 *
 */
package org.theseed.metrics.reports;

import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * This is the base class for metric reports that write text to an output stream.
 *
 */
public abstract class BaseMetricReporter implements IMetricReport {

    // FIELDS
    /** output writer */
    private final PrintWriter writer;

    /**
     * Construct a metric reporter for a specified output stream.
     *
     * @param output	output stream to receive the report
     */
    public BaseMetricReporter(OutputStream output) {
        this.writer = new PrintWriter(new OutputStreamWriter(output, StandardCharsets.UTF_8));
    }

    /**
     * Write a line of output.
     *
     * @param line		text of the line
     */
    protected void println(String line) {
        this.writer.println(line);
    }

    @Override
    public void close() {
        this.writer.flush();
        this.writer.close();
    }

}
