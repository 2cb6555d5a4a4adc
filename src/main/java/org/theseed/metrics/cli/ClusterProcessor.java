/**
 *
 */
package org.theseed.metrics.cli;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.theseed.metrics.EvaluationContext;
import org.theseed.metrics.MetricOptions;
import org.theseed.metrics.MetricResult;
import org.theseed.metrics.clustering.ClusteringEvaluator;
import org.theseed.metrics.clustering.ClusteringMetric;
import org.theseed.metrics.io.TabbedTable;
import org.theseed.metrics.reports.IMetricReport;

/**
 * This command computes clustering metrics for a tab-delimited file.  One column contains the predicted cluster
 * labels and an optional second column contains the true class labels.  All the remaining columns are numeric
 * features.  External metrics require the true-label column; internal metrics require at least one feature column.
 *
 * The positional parameters are the name of the input file followed by the codes of the metrics to compute.  If no
 * metrics are specified, every metric the input supports is computed.
 *
 * The command-line options are
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report (if not STDOUT)
 *
 * --pred		column containing the predicted cluster labels (default "1")
 * --true		column containing the true class labels (if any)
 * --decimal	number of fractional digits in the output (default 5)
 * --raise		throw an error when a metric is undefined
 * --standard	use the standard Dunn index instead of the modified one
 * --unscaled	use the raw features for KsqDetW instead of min-max scaled ones
 * --samples	output per-sample silhouette values instead of the mean
 * --format		type of report (TEXT or NULL, default TEXT)
 *
 */
public class ClusterProcessor extends BaseReportProcessor {

    // FIELDS
    /** list of metrics to compute */
    private List<ClusteringMetric> metrics;
    /** true labels, or NULL if none */
    private List<String> yTrue;
    /** predicted labels */
    private List<String> yPred;
    /** feature matrix, or NULL if none */
    private double[][] features;

    // COMMAND-LINE OPTIONS

    /** predicted-label column */
    @Option(name = "--pred", metaVar = "cluster", usage = "column containing predicted cluster labels")
    private String predCol;

    /** true-label column */
    @Option(name = "--true", metaVar = "class", usage = "column containing true class labels (if any)")
    private String trueCol;

    /** output precision */
    @Option(name = "--decimal", metaVar = "3", usage = "number of fractional digits in output values")
    private int decimal;

    /** TRUE to throw an error for undefined metrics */
    @Option(name = "--raise", usage = "throw an error when a metric is undefined")
    private boolean raise;

    /** TRUE to use the standard Dunn index */
    @Option(name = "--standard", usage = "use the standard Dunn index")
    private boolean standard;

    /** TRUE to use unscaled features for KsqDetW */
    @Option(name = "--unscaled", usage = "use unscaled features for KsqDetW")
    private boolean unscaled;

    /** TRUE to output per-sample silhouette values */
    @Option(name = "--samples", usage = "output per-sample silhouette values")
    private boolean samples;

    /** input file */
    @Argument(index = 0, metaVar = "input.tbl", usage = "tab-delimited input file", required = true)
    private File inFile;

    /** metric codes */
    @Argument(index = 1, metaVar = "SI DBI ...", usage = "codes of metrics to compute (default all supported)")
    private List<String> metricNames;

    @Override
    protected void setReporterDefaults() {
        this.predCol = "1";
        this.trueCol = null;
        this.decimal = EvaluationContext.DEFAULT_DECIMAL;
        this.raise = false;
        this.standard = false;
        this.unscaled = false;
        this.samples = false;
        this.metricNames = new ArrayList<String>();
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        if (this.decimal < 0)
            throw new ParseFailureException("Decimal precision must be 0 or more.");
        if (! this.inFile.canRead())
            throw new IOException("Input file " + this.inFile + " is not found or unreadable.");
        TabbedTable table = TabbedTable.read(this.inFile);
        int pIdx = table.findField(this.predCol);
        this.yPred = Arrays.asList(table.getStrings(pIdx));
        int[] others;
        if (this.trueCol == null) {
            this.yTrue = null;
            others = table.otherColumns(pIdx);
        } else {
            int tIdx = table.findField(this.trueCol);
            if (tIdx == pIdx)
                throw new ParseFailureException("The true-label and predicted-label columns must be different.");
            this.yTrue = Arrays.asList(table.getStrings(tIdx));
            others = table.otherColumns(pIdx, tIdx);
        }
        this.features = (others.length == 0 ? null : table.getMatrix(others));
        log.info("{} samples with {} features read from {}.", table.size(), others.length, this.inFile);
        // Resolve the metrics.
        this.metrics = new ArrayList<ClusteringMetric>();
        if (this.metricNames.isEmpty()) {
            for (ClusteringMetric metric : ClusteringMetric.values()) {
                if (metric.isInternal() ? this.features != null : this.yTrue != null)
                    this.metrics.add(metric);
            }
            if (this.metrics.isEmpty())
                throw new ParseFailureException("Input has neither true labels nor features, so no metrics apply.");
        } else {
            for (String name : this.metricNames) {
                try {
                    this.metrics.add(ClusteringMetric.find(name));
                } catch (IllegalArgumentException e) {
                    throw new ParseFailureException(e.getMessage());
                }
            }
        }
    }

    @Override
    protected void runReporter(IMetricReport report) throws Exception {
        EvaluationContext context = new EvaluationContext(this.decimal).withRaiseError(this.raise);
        ClusteringEvaluator evaluator = new ClusteringEvaluator(this.yTrue, this.yPred, this.features, context);
        MetricOptions options = new MetricOptions().setUseModified(! this.standard).setUseNormalized(! this.unscaled)
                .setSampleScores(this.samples);
        report.startReport("Clustering metrics for " + this.inFile.getName());
        for (ClusteringMetric metric : this.metrics) {
            log.debug("Computing {}.", metric.getLongName());
            MetricResult result = evaluator.compute(metric, options);
            report.reportMetric(metric.getCode(), metric.getLongName(), result);
        }
        report.finishReport();
    }

}
