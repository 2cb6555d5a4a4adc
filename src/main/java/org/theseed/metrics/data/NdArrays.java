/**
 *
 */
package org.theseed.metrics.data;

import java.util.ArrayList;
import java.util.List;

import org.nd4j.linalg.api.ndarray.INDArray;
import org.theseed.metrics.ShapeException;

/**
 * This class converts nd4j arrays, such as the expected and output arrays of a trained network, into the
 * plain arrays used by the metric formulas.
 *
 */
public class NdArrays {

    /**
     * Convert an nd4j array of sample values to a sample matrix.  A vector becomes a single-column matrix;
     * a matrix keeps its rows and columns.
     *
     * @param array		array to convert, or NULL
     *
     * @return a matrix with one row per sample, or NULL if the input is NULL
     *
     * @throws ShapeException if the array has more than two dimensions
     */
    public static double[][] toMatrix(INDArray array) {
        double[][] retVal = null;
        if (array != null) {
            if (array.rank() <= 1 || array.isVector())
                retVal = InputNormalizer.asColumn(array.toDoubleVector());
            else if (array.rank() == 2)
                retVal = array.toDoubleMatrix();
            else
                throw new ShapeException("Sample arrays must have one or two dimensions, but this one has "
                        + array.rank() + ".");
        }
        return retVal;
    }

    /**
     * Convert an nd4j vector of cluster labels to a label list.  Integral values become integer labels, or long
     * labels if they are outside the integer range.
     *
     * @param array		vector of labels, or NULL
     *
     * @return a list of labels, or NULL if the input is NULL
     *
     * @throws ShapeException if the array is not a vector
     */
    public static List<Object> toLabels(INDArray array) {
        List<Object> retVal = null;
        if (array != null) {
            if (array.rank() > 1 && ! array.isVector())
                throw new ShapeException("Cluster labels must be a vector.");
            double[] values = array.toDoubleVector();
            retVal = new ArrayList<Object>(values.length);
            for (double v : values) {
                if (v != Math.rint(v) || Double.isInfinite(v))
                    retVal.add(v);
                else if (v >= Integer.MIN_VALUE && v <= Integer.MAX_VALUE)
                    retVal.add((int) v);
                else
                    retVal.add((long) v);
            }
        }
        return retVal;
    }

}
