/**
 *
 */
package org.theseed.metrics.cli;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;
import org.kohsuke.args4j.Argument;
import org.kohsuke.args4j.Option;
import org.theseed.metrics.EvaluationContext;
import org.theseed.metrics.MetricOptions;
import org.theseed.metrics.MetricResult;
import org.theseed.metrics.MultiOutput;
import org.theseed.metrics.UndefinedMetricException;
import org.theseed.metrics.io.TabbedTable;
import org.theseed.metrics.regression.RegressionEvaluator;
import org.theseed.metrics.regression.RegressionMetric;
import org.theseed.metrics.reports.IMetricReport;

/**
 * This command computes regression metrics for a tab-delimited file containing one or more columns of true values
 * and an equal number of columns of predicted values.  The columns are specified by name or 1-based number.
 *
 * The positional parameters are the name of the input file followed by the codes of the metrics to compute.  If no
 * metrics are specified, all of them are computed.  A metric that is undefined for the input is skipped with a warning
 * unless "--raise" is specified.
 *
 * The command-line options are
 *
 * -h	display command-line usage
 * -v	display more frequent log messages
 * -o	output file for report (if not STDOUT)
 *
 * --true		comma-delimited list of true-value columns (default "1")
 * --pred		comma-delimited list of predicted-value columns (default "2")
 * --decimal	number of fractional digits in the output (default 5)
 * --multi		multi-output policy:  raw_values, uniform_average, or a comma-delimited weight list (default raw_values)
 * --clean		remove samples with a zero prediction before scoring, for every metric
 * --positive	remove samples with non-positive values before scoring, for every metric
 * --model		normalization model for NRMSE (0 to 3, default 0)
 * --lag		seasonal lag for MASE (default 1)
 * --raise		throw an error when a metric is undefined
 * --format		type of report (TEXT or NULL, default TEXT)
 *
 */
public class RegressionProcessor extends BaseReportProcessor {

    // FIELDS
    /** list of metrics to compute */
    private List<RegressionMetric> metrics;
    /** true-value matrix */
    private double[][] yTrue;
    /** predicted-value matrix */
    private double[][] yPred;
    /** multi-output policy */
    private MultiOutput policy;

    // COMMAND-LINE OPTIONS

    /** true-value column specifiers */
    @Option(name = "--true", metaVar = "y1,y2", usage = "comma-delimited list of true-value columns")
    private String trueCols;

    /** predicted-value column specifiers */
    @Option(name = "--pred", metaVar = "p1,p2", usage = "comma-delimited list of predicted-value columns")
    private String predCols;

    /** output precision */
    @Option(name = "--decimal", metaVar = "3", usage = "number of fractional digits in output values")
    private int decimal;

    /** multi-output policy string */
    @Option(name = "--multi", metaVar = "uniform_average", usage = "multi-output policy (raw_values, uniform_average, or weights)")
    private String multi;

    /** TRUE to remove samples with a zero prediction for all metrics */
    @Option(name = "--clean", usage = "remove samples with a zero prediction for all metrics")
    private boolean clean;

    /** TRUE to keep only positive samples for all metrics */
    @Option(name = "--positive", usage = "remove non-positive samples for all metrics")
    private boolean positive;

    /** normalization model for NRMSE */
    @Option(name = "--model", metaVar = "1", usage = "NRMSE normalization model (0 = prediction sd, 1 = prediction mean, 2 = truth range, 3 = log ratio)")
    private int model;

    /** seasonal lag for MASE */
    @Option(name = "--lag", metaVar = "7", usage = "seasonal lag for MASE")
    private int lag;

    /** TRUE to throw an error for undefined metrics */
    @Option(name = "--raise", usage = "throw an error when a metric is undefined")
    private boolean raise;

    /** input file */
    @Argument(index = 0, metaVar = "input.tbl", usage = "tab-delimited input file", required = true)
    private File inFile;

    /** metric codes */
    @Argument(index = 1, metaVar = "MAE RMSE ...", usage = "codes of metrics to compute (default all)")
    private List<String> metricNames;

    @Override
    protected void setReporterDefaults() {
        this.trueCols = "1";
        this.predCols = "2";
        this.decimal = EvaluationContext.DEFAULT_DECIMAL;
        this.multi = "raw_values";
        this.clean = false;
        this.positive = false;
        this.model = MetricOptions.DEFAULT_MODEL;
        this.lag = MetricOptions.DEFAULT_LAG;
        this.raise = false;
        this.metricNames = new ArrayList<String>();
    }

    @Override
    protected void validateReporterParms() throws IOException, ParseFailureException {
        if (this.decimal < 0)
            throw new ParseFailureException("Decimal precision must be 0 or more.");
        if (this.model < 0 || this.model > 3)
            throw new ParseFailureException("NRMSE model must be between 0 and 3.");
        if (this.lag < 1)
            throw new ParseFailureException("Seasonal lag must be at least 1.");
        try {
            this.policy = MultiOutput.parse(this.multi);
        } catch (IllegalArgumentException e) {
            throw new ParseFailureException("Invalid multi-output policy: " + e.getMessage());
        }
        // Resolve the metrics.
        this.metrics = new ArrayList<RegressionMetric>();
        if (this.metricNames.isEmpty()) {
            for (RegressionMetric metric : RegressionMetric.values())
                this.metrics.add(metric);
        } else {
            for (String name : this.metricNames) {
                try {
                    this.metrics.add(RegressionMetric.find(name));
                } catch (IllegalArgumentException e) {
                    throw new ParseFailureException(e.getMessage());
                }
            }
        }
        // Read the input.
        if (! this.inFile.canRead())
            throw new IOException("Input file " + this.inFile + " is not found or unreadable.");
        TabbedTable table = TabbedTable.read(this.inFile);
        int[] tCols = findColumns(table, this.trueCols);
        int[] pCols = findColumns(table, this.predCols);
        if (tCols.length != pCols.length)
            throw new ParseFailureException("There are " + tCols.length + " true-value columns but " + pCols.length
                    + " predicted-value columns.");
        this.yTrue = table.getMatrix(tCols);
        this.yPred = table.getMatrix(pCols);
        log.info("{} samples with {} outputs read from {}.", table.size(), tCols.length, this.inFile);
    }

    /**
     * @return the indices of the columns in a comma-delimited specifier list
     *
     * @param table		input table
     * @param specs		comma-delimited list of column names or numbers
     *
     * @throws IOException
     */
    protected static int[] findColumns(TabbedTable table, String specs) throws IOException {
        String[] names = StringUtils.split(specs, ',');
        int[] retVal = new int[names.length];
        for (int i = 0; i < names.length; i++)
            retVal[i] = table.findField(StringUtils.trim(names[i]));
        return retVal;
    }

    @Override
    protected void runReporter(IMetricReport report) throws Exception {
        EvaluationContext context = new EvaluationContext(this.decimal).withRaiseError(this.raise);
        RegressionEvaluator evaluator = new RegressionEvaluator(this.yTrue, this.yPred, context);
        report.startReport("Regression metrics for " + this.inFile.getName());
        int skipped = 0;
        for (RegressionMetric metric : this.metrics) {
            MetricOptions options = new MetricOptions().setMultiOutput(this.policy).setModel(this.model)
                    .setM(this.lag);
            if (this.clean) options.setClean(true);
            if (this.positive) options.setPositiveOnly(true);
            try {
                MetricResult result = evaluator.compute(metric, options);
                report.reportMetric(metric.getCode(), metric.getLongName(), result);
            } catch (UndefinedMetricException e) {
                if (this.raise)
                    throw e;
                log.warn("Metric {} skipped: {}", metric.getCode(), e.getMessage());
                skipped++;
            }
        }
        report.finishReport();
        log.info("{} metrics computed, {} skipped.", this.metrics.size() - skipped, skipped);
    }

}
