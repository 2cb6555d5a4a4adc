/**
 *
 */
package org.theseed.metrics.cli;

import java.io.IOException;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Map;

import org.apache.commons.text.TextStringBuilder;
import org.kohsuke.args4j.Option;
import org.theseed.metrics.MetricDescriptor;
import org.theseed.metrics.clustering.ClusteringMetric;

/**
 * This command lists the clustering metrics with their optimization direction, value range, and best value.
 *
 * The command-line options are
 *
 * -h			display command-line usage
 * -v			display more frequent log messages
 *
 * --family		only list metrics of the specified family (INTERNAL or EXTERNAL)
 *
 */
public class SupportProcessor extends BaseProcessor {

    // COMMAND-LINE OPTIONS

    /** family filter, or NULL for all */
    @Option(name = "--family", usage = "only list metrics of this family")
    private ClusteringMetric.Family family;

    @Override
    protected void setDefaults() {
        this.family = null;
    }

    @Override
    protected boolean validateParms() throws IOException, ParseFailureException {
        return true;
    }

    @Override
    protected void runCommand() throws Exception {
        PrintWriter writer = new PrintWriter(new OutputStreamWriter(System.out, StandardCharsets.UTF_8));
        writer.println("metric\tname\tfamily\tdirection\trange\tbest");
        int count = 0;
        for (Map.Entry<String, MetricDescriptor> entry : ClusteringMetric.getSupport().entrySet()) {
            ClusteringMetric metric = ClusteringMetric.valueOf(entry.getKey());
            if (this.family == null || metric.getFamily() == this.family) {
                MetricDescriptor desc = entry.getValue();
                TextStringBuilder line = new TextStringBuilder(80);
                line.appendWithSeparators(new Object[] { metric.getCode(), metric.getLongName(), metric.getFamily(),
                        desc.getDirection(), desc.getRange(), desc.getBestString() }, "\t");
                writer.println(line.toString());
                count++;
            }
        }
        writer.flush();
        log.info("{} metrics listed.", count);
    }

}
