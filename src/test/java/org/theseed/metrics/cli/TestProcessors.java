/**
 *
 */
package org.theseed.metrics.cli;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.theseed.metrics.App;
import org.theseed.metrics.UndefinedMetricException;

/**
 * Tests for the command processors.
 *
 */
public class TestProcessors {

    @TempDir
    File tempDir;

    /**
     * @return a map of metric codes to value strings from a text report
     *
     * @param outFile	report file to read
     *
     * @throws IOException
     */
    private static Map<String, String> readReport(File outFile) throws IOException {
        List<String> lines = Files.readAllLines(outFile.toPath(), StandardCharsets.UTF_8);
        assertThat(lines.get(0), equalTo("metric\tname\tvalue"));
        Map<String, String> retVal = new HashMap<String, String>();
        for (String line : lines.subList(1, lines.size())) {
            String[] parts = line.split("\t");
            assertThat(line, parts.length, equalTo(3));
            retVal.put(parts[0], parts[2]);
        }
        return retVal;
    }

    @Test
    public void testRegression() throws IOException {
        File outFile = new File(this.tempDir, "regress.tbl");
        RegressionProcessor processor = new RegressionProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--true", "actual",
                "--pred", "predicted", "src/test/data/regression.tbl", "MAE", "mse", "root_mean_squared_error" });
        assertThat(ok, equalTo(true));
        processor.run();
        Map<String, String> report = readReport(outFile);
        assertThat(report.size(), equalTo(3));
        assertThat(report.get("MAE"), equalTo("0.5"));
        assertThat(report.get("MSE"), equalTo("0.375"));
        assertThat(report.get("RMSE"), equalTo("0.61237"));
    }

    @Test
    public void testCleanOption() throws IOException {
        // Sample s2 has a zero prediction, so cleaning drops it.
        File outFile = new File(this.tempDir, "clean.tbl");
        RegressionProcessor processor = new RegressionProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--true", "actual",
                "--pred", "predicted", "--clean", "src/test/data/regression.tbl", "MSE" });
        assertThat(ok, equalTo(true));
        processor.run();
        assertThat(readReport(outFile).get("MSE"), equalTo("0.41667"));
    }

    @Test
    public void testMultiRegression() throws IOException {
        File outFile = new File(this.tempDir, "multi.tbl");
        RegressionProcessor processor = new RegressionProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--true", "2,4",
                "--pred", "3,5", "--decimal", "3", "src/test/data/regression.tbl", "MAE" });
        assertThat(ok, equalTo(true));
        processor.run();
        assertThat(readReport(outFile).get("MAE"), equalTo("0.5,0.375"));
        processor = new RegressionProcessor();
        ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--true", "2,4",
                "--pred", "3,5", "--multi", "uniform_average", "src/test/data/regression.tbl", "MAE" });
        assertThat(ok, equalTo(true));
        processor.run();
        assertThat(readReport(outFile).get("MAE"), equalTo("0.4375"));
    }

    @Test
    public void testAllRegression() throws IOException {
        File outFile = new File(this.tempDir, "all.tbl");
        RegressionProcessor processor = new RegressionProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--true", "actual",
                "--pred", "predicted", "src/test/data/regression.tbl" });
        assertThat(ok, equalTo(true));
        processor.run();
        Map<String, String> report = readReport(outFile);
        assertThat(report, hasKey("GINI"));
        assertThat(report, hasKey("SE"));
        assertThat(report.get("SE"), equalTo("0.25,0.25,0.0,1.0"));
    }

    @Test
    public void testBadRegression() {
        File outFile = new File(this.tempDir, "bad.tbl");
        RegressionProcessor processor = new RegressionProcessor();
        assertThat(processor.parseCommand(new String[] { "-o", outFile.getPath(), "src/test/data/regression.tbl",
                "XYZZY" }), equalTo(false));
        processor = new RegressionProcessor();
        assertThat(processor.parseCommand(new String[] { "-o", outFile.getPath(), "--true", "2,4", "--pred", "3",
                "src/test/data/regression.tbl" }), equalTo(false));
        processor = new RegressionProcessor();
        assertThat(processor.parseCommand(new String[] { "-o", outFile.getPath(), "--true", "nowhere",
                "src/test/data/regression.tbl" }), equalTo(false));
        processor = new RegressionProcessor();
        assertThat(processor.parseCommand(new String[] { "-o", outFile.getPath() }), equalTo(false));
    }

    @Test
    public void testCluster() throws IOException {
        File outFile = new File(this.tempDir, "cluster.tbl");
        ClusterProcessor processor = new ClusterProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--pred", "cluster",
                "--true", "class", "src/test/data/clusters.tbl" });
        assertThat(ok, equalTo(true));
        processor.run();
        Map<String, String> report = readReport(outFile);
        assertThat(report.get("CHI"), equalTo("200.0"));
        assertThat(report.get("DBI"), equalTo("0.1"));
        assertThat(report.get("RaS"), equalTo("1.0"));
        assertThat(report.get("PuS"), equalTo("1.0"));
        assertThat(report.get("ES"), equalTo("0.0"));
        assertThat(report.size(), equalTo(42));
    }

    @Test
    public void testInternalOnly() throws IOException {
        File outFile = new File(this.tempDir, "internal.tbl");
        ClusterProcessor processor = new ClusterProcessor();
        boolean ok = processor.parseCommand(new String[] { "-o", outFile.getPath(), "--pred", "3",
                "--samples", "src/test/data/internal.tbl", "SI", "BHI" });
        assertThat(ok, equalTo(true));
        processor.run();
        Map<String, String> report = readReport(outFile);
        assertThat(report.get("BHI"), equalTo("0.25"));
        assertThat(report.get("SI"), equalTo("0.90025,0.90025,0.90025,0.90025"));
        // Without true labels, an external metric cannot be computed.
        ClusterProcessor external = new ClusterProcessor();
        assertThat(external.parseCommand(new String[] { "-o", outFile.getPath(), "--pred", "cluster",
                "src/test/data/internal.tbl", "RaS" }), equalTo(true));
        assertThrows(RuntimeException.class, () -> external.run());
    }

    @Test
    public void testRaise() {
        File outFile = new File(this.tempDir, "raise.tbl");
        ClusterProcessor processor = new ClusterProcessor();
        assertThat(processor.parseCommand(new String[] { "-o", outFile.getPath(), "--pred", "class",
                "--true", "cluster", "--raise", "src/test/data/clusters.tbl", "HGS" }), equalTo(true));
        processor.run();
        ClusterProcessor single = new ClusterProcessor();
        assertThat(single.parseCommand(new String[] { "-o", outFile.getPath(), "--pred", "cluster",
                "--true", "class", "--raise", "src/test/data/single.tbl", "HGS" }), equalTo(true));
        assertThrows(UndefinedMetricException.class, () -> single.run());
    }

    @Test
    public void testParms() throws IOException {
        File parmFile = new File(this.tempDir, "parms.prm");
        Files.write(parmFile.toPath(), Arrays.asList("# metric options", "--true actual", "", "--pred  predicted"),
                StandardCharsets.UTF_8);
        List<String> parms = App.readParms(parmFile);
        assertThat(parms, contains("--true", "actual", "--pred", "predicted"));
    }

}
