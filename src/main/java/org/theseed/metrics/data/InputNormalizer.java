/**
 *
 */
package org.theseed.metrics.data;

import java.util.Arrays;
import java.util.List;

import org.apache.commons.lang3.ArrayUtils;
import org.theseed.metrics.MissingInputException;
import org.theseed.metrics.ShapeException;

/**
 * This class validates and reshapes the raw inputs of a metric call.  Regression data is checked for
 * consistent shapes, split into columns, and optionally filtered; clustering labels are checked for
 * consistent lengths and encoded as dense integers.
 *
 * Sample matrices are stored with one row per sample.  A one-dimensional array is a matrix with a single
 * column, and so is a matrix with only one column.
 *
 */
public class InputNormalizer {

    /**
     * @return a single-column matrix for a vector of values, or NULL if the vector is NULL
     *
     * @param values	vector of sample values
     */
    public static double[][] asColumn(double[] values) {
        double[][] retVal = null;
        if (values != null) {
            retVal = new double[values.length][];
            for (int i = 0; i < values.length; i++)
                retVal[i] = new double[] { values[i] };
        }
        return retVal;
    }

    /**
     * @return a label list for an array of integer labels, or NULL if the array is NULL
     *
     * @param labels	array of labels
     */
    public static List<Integer> asLabels(int[] labels) {
        return (labels == null ? null : Arrays.asList(ArrayUtils.toObject(labels)));
    }

    /**
     * @return a label list for an array of string labels, or NULL if the array is NULL
     *
     * @param labels	array of labels
     */
    public static List<String> asLabels(String[] labels) {
        return (labels == null ? null : Arrays.asList(labels));
    }

    /**
     * Prepare regression data for a metric call.
     *
     * @param yTrue			truth matrix, one row per sample
     * @param yPred			prediction matrix, one row per sample
     * @param clean			TRUE to remove rows whose prediction is zero
     * @param positiveOnly	TRUE to keep only rows whose truth and prediction are both positive
     * @param decimal		number of fractional digits for the result
     *
     * @return the prepared data, split into columns and filtered
     *
     * @throws MissingInputException if either matrix is missing
     * @throws ShapeException if the matrices do not have compatible shapes
     */
    public static RegressionInput prepareRegression(double[][] yTrue, double[][] yPred, boolean clean, boolean positiveOnly,
            int decimal) {
        if (yTrue == null || yPred == null)
            throw new MissingInputException("You need to pass y_true and y_pred to calculate regression metrics.");
        int n = yTrue.length;
        if (n != yPred.length)
            throw new ShapeException("y_true has " + n + " samples but y_pred has " + yPred.length + ".");
        if (n == 0)
            throw new ShapeException("Regression metrics need at least one sample.");
        int cols = checkRectangular(yTrue, "y_true");
        int predCols = checkRectangular(yPred, "y_pred");
        if (cols != predCols)
            throw new ShapeException("y_true has " + cols + " columns but y_pred has " + predCols + ".");
        double[][] trueCols = new double[cols][];
        double[][] predColumns = new double[cols][];
        for (int c = 0; c < cols; c++) {
            // Count the rows to keep.
            boolean[] keep = new boolean[n];
            int kept = 0;
            for (int r = 0; r < n; r++) {
                double t = yTrue[r][c];
                double p = yPred[r][c];
                boolean ok = (! clean || p != 0.0) && (! positiveOnly || (t > 0.0 && p > 0.0));
                keep[r] = ok;
                if (ok) kept++;
            }
            if (kept == 0)
                throw new ShapeException("Column " + c + " has no samples left after filtering.");
            // Copy the kept rows.
            double[] tCol = new double[kept];
            double[] pCol = new double[kept];
            int i = 0;
            for (int r = 0; r < n; r++) {
                if (keep[r]) {
                    tCol[i] = yTrue[r][c];
                    pCol[i] = yPred[r][c];
                    i++;
                }
            }
            trueCols[c] = tCol;
            predColumns[c] = pCol;
        }
        return new RegressionInput(trueCols, predColumns, decimal);
    }

    /**
     * Prepare labels for an external clustering metric.
     *
     * @param yTrue		list of truth labels
     * @param yPred		list of predicted labels
     * @param decimal	number of fractional digits for the result
     *
     * @return the encoded labels
     *
     * @throws MissingInputException if either list is missing
     * @throws ShapeException if the lists have different lengths
     */
    public static ExternalClusteringInput prepareExternal(List<?> yTrue, List<?> yPred, int decimal) {
        if (yTrue == null || yPred == null)
            throw new MissingInputException("You need to pass y_true and y_pred to calculate external clustering metrics.");
        if (yTrue.size() != yPred.size())
            throw new ShapeException("y_true has " + yTrue.size() + " labels but y_pred has " + yPred.size() + ".");
        if (yTrue.isEmpty())
            throw new ShapeException("Clustering metrics need at least one sample.");
        LabelEncoder trueEncoder = LabelEncoder.fit(yTrue);
        LabelEncoder predEncoder = LabelEncoder.fit(yPred);
        return new ExternalClusteringInput(trueEncoder.transform(yTrue), predEncoder.transform(yPred),
                trueEncoder, predEncoder, decimal);
    }

    /**
     * Prepare features and labels for an internal clustering metric.
     *
     * @param x			feature matrix, one row per sample
     * @param yPred		list of predicted labels
     * @param decimal	number of fractional digits for the result
     *
     * @return the encoded labels and validated features
     *
     * @throws MissingInputException if the features or labels are missing
     * @throws ShapeException if the feature matrix is ragged or does not match the labels
     */
    public static InternalClusteringInput prepareInternal(double[][] x, List<?> yPred, int decimal) {
        if (yPred == null)
            throw new MissingInputException("You need to pass y_pred to calculate internal clustering metrics.");
        if (x == null)
            throw new MissingInputException("To calculate internal metrics, you need to pass X.");
        if (x.length != yPred.size())
            throw new ShapeException("X has " + x.length + " samples but y_pred has " + yPred.size() + ".");
        if (x.length == 0)
            throw new ShapeException("Clustering metrics need at least one sample.");
        checkRectangular(x, "X");
        LabelEncoder encoder = LabelEncoder.fit(yPred);
        return new InternalClusteringInput(x, encoder.transform(yPred), encoder, decimal);
    }

    /**
     * Verify that a matrix has the same number of columns in every row.
     *
     * @param matrix	matrix to check
     * @param name		name of the matrix, for error messages
     *
     * @return the number of columns
     *
     * @throws ShapeException if the matrix is ragged or has no columns
     */
    protected static int checkRectangular(double[][] matrix, String name) {
        int retVal = matrix[0].length;
        if (retVal == 0)
            throw new ShapeException(name + " has no columns.");
        for (int r = 1; r < matrix.length; r++) {
            if (matrix[r].length != retVal)
                throw new ShapeException(name + " row " + r + " has " + matrix[r].length + " columns instead of "
                        + retVal + ".");
        }
        return retVal;
    }

}
