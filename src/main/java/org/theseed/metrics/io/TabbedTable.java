/**
 *
 */
package org.theseed.metrics.io;

import java.io.BufferedReader;
import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang3.StringUtils;

/**
 * This class reads a tab-delimited file with a header line into memory.  Columns can be identified by name or by
 * a 1-based column number, and can be extracted as numbers or as strings.  Blank lines are skipped.
 *
 */
public class TabbedTable {

    // FIELDS
    /** column headers */
    private final String[] labels;
    /** data rows */
    private final List<String[]> rows;

    /**
     * Construct a table from a list of lines.  The first line is the header.
     *
     * @param lines		list of lines, including the header
     *
     * @throws IOException if the header is missing or a data line has the wrong number of fields
     */
    public TabbedTable(List<String> lines) throws IOException {
        if (lines.isEmpty())
            throw new IOException("Tab-delimited input has no header line.");
        this.labels = StringUtils.splitPreserveAllTokens(lines.get(0), '\t');
        this.rows = new ArrayList<String[]>(lines.size());
        for (int i = 1; i < lines.size(); i++) {
            String line = lines.get(i);
            if (! StringUtils.isBlank(line)) {
                String[] fields = StringUtils.splitPreserveAllTokens(line, '\t');
                if (fields.length != this.labels.length)
                    throw new IOException("Line " + (i + 1) + " has " + fields.length + " fields, but the header has "
                            + this.labels.length + ".");
                this.rows.add(fields);
            }
        }
    }

    /**
     * @return a table read from an input stream
     *
     * @param stream	input stream containing the table
     *
     * @throws IOException
     */
    public static TabbedTable read(InputStream stream) throws IOException {
        List<String> lines = new ArrayList<String>();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(stream, StandardCharsets.UTF_8))) {
            String line = reader.readLine();
            while (line != null) {
                lines.add(line);
                line = reader.readLine();
            }
        }
        return new TabbedTable(lines);
    }

    /**
     * @return a table read from a file
     *
     * @param file		file containing the table
     *
     * @throws IOException
     */
    public static TabbedTable read(File file) throws IOException {
        try (InputStream stream = new FileInputStream(file)) {
            return read(stream);
        }
    }

    /**
     * Find a column.
     *
     * @param name		column name, or a 1-based column number
     *
     * @return the 0-based index of the column
     *
     * @throws IOException if the column does not exist
     */
    public int findField(String name) throws IOException {
        int retVal = -1;
        for (int i = 0; i < this.labels.length && retVal < 0; i++) {
            if (this.labels[i].equals(name))
                retVal = i;
        }
        if (retVal < 0 && StringUtils.isNumeric(name)) {
            int col = Integer.parseInt(name);
            if (col >= 1 && col <= this.labels.length)
                retVal = col - 1;
        }
        if (retVal < 0)
            throw new IOException("Column \"" + name + "\" not found in input.");
        return retVal;
    }

    /**
     * @return the column headers
     */
    public String[] getLabels() {
        return this.labels;
    }

    /**
     * @return the number of columns
     */
    public int width() {
        return this.labels.length;
    }

    /**
     * @return the number of data rows
     */
    public int size() {
        return this.rows.size();
    }

    /**
     * @return the string values in a column
     *
     * @param col	0-based index of the column
     */
    public String[] getStrings(int col) {
        String[] retVal = new String[this.rows.size()];
        for (int r = 0; r < retVal.length; r++)
            retVal[r] = this.rows.get(r)[col];
        return retVal;
    }

    /**
     * Extract numeric columns as a matrix.
     *
     * @param cols	0-based indices of the desired columns
     *
     * @return a matrix with one row per data row and one column per requested column
     *
     * @throws IOException if a value is not a number
     */
    public double[][] getMatrix(int[] cols) throws IOException {
        double[][] retVal = new double[this.rows.size()][cols.length];
        for (int r = 0; r < retVal.length; r++) {
            String[] fields = this.rows.get(r);
            for (int c = 0; c < cols.length; c++) {
                String value = fields[cols[c]];
                try {
                    retVal[r][c] = Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    throw new IOException("Invalid number \"" + value + "\" in column " + this.labels[cols[c]]
                            + " of data row " + (r + 1) + ".", e);
                }
            }
        }
        return retVal;
    }

    /**
     * @return the 0-based indices of all the columns not in a list of excluded indices
     *
     * @param excluded	indices of columns to exclude
     */
    public int[] otherColumns(int... excluded) {
        List<Integer> kept = new ArrayList<Integer>(this.labels.length);
        for (int i = 0; i < this.labels.length; i++) {
            boolean skip = false;
            for (int e : excluded) {
                if (e == i) skip = true;
            }
            if (! skip) kept.add(i);
        }
        return kept.stream().mapToInt(Integer::intValue).toArray();
    }

}
