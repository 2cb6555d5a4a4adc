/**
 *
 */
package org.theseed.metrics.io;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;

import org.junit.jupiter.api.Test;

/**
 * Tests for the tab-delimited table reader.
 *
 */
public class TestTabbedTable {

    @Test
    public void testRead() throws IOException {
        TabbedTable table = TabbedTable.read(new File("src/test/data", "clusters.tbl"));
        assertThat(table.width(), equalTo(4));
        // The blank line is skipped.
        assertThat(table.size(), equalTo(4));
        assertThat(table.getLabels(), arrayContaining("x", "y", "cluster", "class"));
        assertThat(table.findField("cluster"), equalTo(2));
        assertThat(table.findField("4"), equalTo(3));
        assertThrows(IOException.class, () -> table.findField("species"));
        assertThrows(IOException.class, () -> table.findField("5"));
        assertThat(table.getStrings(3), arrayContaining("red", "red", "blue", "blue"));
        int[] others = table.otherColumns(2, 3);
        assertThat(others.length, equalTo(2));
        double[][] x = table.getMatrix(others);
        assertThat(x[2][0], equalTo(10.0));
        assertThat(x[3][1], equalTo(1.0));
    }

    @Test
    public void testStream() throws IOException {
        String text = "a\tb\n1.5\t2\n";
        TabbedTable table = TabbedTable.read(new ByteArrayInputStream(text.getBytes(StandardCharsets.UTF_8)));
        assertThat(table.size(), equalTo(1));
        assertThat(table.getMatrix(new int[] { 1, 0 })[0], equalTo(new double[] { 2.0, 1.5 }));
    }

    @Test
    public void testErrors() throws IOException {
        assertThrows(IOException.class, () -> TabbedTable.read(new File("src/test/data", "ragged.tbl")));
        assertThrows(IOException.class, () -> new TabbedTable(Collections.emptyList()));
        TabbedTable table = TabbedTable.read(new File("src/test/data", "bad_number.tbl"));
        assertThrows(IOException.class, () -> table.getMatrix(new int[] { 0, 1 }));
    }

}
