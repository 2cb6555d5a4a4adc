/**
 *
 */
package org.theseed.metrics.cli;

import java.io.File;
import java.io.FileOutputStream;
import java.io.IOException;
import java.io.OutputStream;

import org.kohsuke.args4j.Option;
import org.theseed.metrics.reports.IMetricReport;
import org.theseed.metrics.reports.ReportType;

/**
 * This is the base class for commands that produce a metric report.  The report goes to the standard output
 * unless an output file is specified.
 *
 * The command-line options are
 *
 * -o		output file for report (if not STDOUT)
 *
 * --format	type of report (TEXT or NULL, default TEXT)
 *
 */
public abstract class BaseReportProcessor extends BaseProcessor {

    // FIELDS
    /** output stream for the report */
    private OutputStream outStream;

    // COMMAND-LINE OPTIONS

    /** output file (if not STDOUT) */
    @Option(name = "-o", aliases = { "--output" }, metaVar = "report.tbl", usage = "output file (if not STDOUT)")
    private File outFile;

    /** report type */
    @Option(name = "--format", usage = "type of report")
    private ReportType format;

    @Override
    protected final void setDefaults() {
        this.outFile = null;
        this.format = ReportType.TEXT;
        this.setReporterDefaults();
    }

    /**
     * Specify the default values for subclass options.
     */
    protected abstract void setReporterDefaults();

    @Override
    protected final boolean validateParms() throws IOException, ParseFailureException {
        this.validateReporterParms();
        if (this.outFile == null) {
            log.info("Output will be to STDOUT.");
            this.outStream = System.out;
        } else {
            log.info("Output will be to {}.", this.outFile);
            this.outStream = new FileOutputStream(this.outFile);
        }
        return true;
    }

    /**
     * Validate the subclass options and parameters.
     *
     * @throws IOException
     * @throws ParseFailureException
     */
    protected abstract void validateReporterParms() throws IOException, ParseFailureException;

    @Override
    protected final void runCommand() throws Exception {
        try (IMetricReport report = this.format.create(this.outStream)) {
            this.runReporter(report);
        } finally {
            if (this.outFile != null)
                this.outStream.close();
        }
    }

    /**
     * Produce the report.
     *
     * @param report	report to receive the output
     *
     * @throws Exception
     */
    protected abstract void runReporter(IMetricReport report) throws Exception;

}
