/**
 *
 */
package org.theseed.metrics.data;

/**
 * This object holds regression data that has been validated and filtered for a single metric call.  The data
 * is stored by column:  each output column has its own truth and prediction arrays, since row filtering is
 * applied to each column independently and the columns may end up with different lengths.
 *
 */
public class RegressionInput {

    // FIELDS
    /** truth values for each column */
    private final double[][] trueCols;
    /** predicted values for each column */
    private final double[][] predCols;
    /** TRUE if the data has a single output column */
    private final boolean singleColumn;
    /** number of fractional digits for the result */
    private final int decimal;

    /**
     * Construct a prepared regression input.
     *
     * @param trueCols		truth values for each column
     * @param predCols		predicted values for each column
     * @param decimal		number of fractional digits for the result
     */
    public RegressionInput(double[][] trueCols, double[][] predCols, int decimal) {
        this.trueCols = trueCols;
        this.predCols = predCols;
        this.singleColumn = (trueCols.length == 1);
        this.decimal = decimal;
    }

    /**
     * @return the number of output columns
     */
    public int getColumnCount() {
        return this.trueCols.length;
    }

    /**
     * @return the truth values for a column
     *
     * @param col	index of the column
     */
    public double[] getTrue(int col) {
        return this.trueCols[col];
    }

    /**
     * @return the predicted values for a column
     *
     * @param col	index of the column
     */
    public double[] getPred(int col) {
        return this.predCols[col];
    }

    /**
     * @return TRUE if the data has a single output column
     */
    public boolean isSingleColumn() {
        return this.singleColumn;
    }

    /**
     * @return the number of fractional digits for the result
     */
    public int getDecimal() {
        return this.decimal;
    }

}
