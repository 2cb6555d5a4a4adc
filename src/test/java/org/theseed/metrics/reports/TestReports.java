/**
 *
 */
package org.theseed.metrics.reports;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Test;
import org.theseed.metrics.MetricResult;

/**
 * Tests for the metric reports.
 *
 */
public class TestReports {

    @Test
    public void testTextReport() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (IMetricReport report = ReportType.TEXT.create(buffer)) {
            report.startReport("test");
            report.reportMetric("MAE", "mean_absolute_error", MetricResult.of(0.5));
            report.reportMetric("MSE", "mean_squared_error", MetricResult.ofVector(new double[] { 0.25, 1.0 }));
            report.finishReport();
        }
        String[] lines = new String(buffer.toByteArray(), StandardCharsets.UTF_8).split("\\r?\\n");
        assertThat(lines, arrayContaining("metric\tname\tvalue", "MAE\tmean_absolute_error\t0.5",
                "MSE\tmean_squared_error\t0.25,1.0"));
    }

    @Test
    public void testNullReport() {
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try (IMetricReport report = ReportType.NULL.create(buffer)) {
            report.startReport("test");
            report.reportMetric("MAE", "mean_absolute_error", MetricResult.of(0.5));
            report.finishReport();
        }
        assertThat(buffer.size(), equalTo(0));
    }

}
