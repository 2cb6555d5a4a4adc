/**
 *
 */
package org.theseed.metrics.clustering;

/**
 * Euclidean distance utilities for feature rows.
 *
 */
public class Distances {

    /**
     * @return the squared Euclidean distance between two rows
     *
     * @param a		first row
     * @param b		second row
     */
    public static double squared(double[] a, double[] b) {
        double retVal = 0.0;
        for (int i = 0; i < a.length; i++) {
            double d = a[i] - b[i];
            retVal += d * d;
        }
        return retVal;
    }

    /**
     * @return the Euclidean distance between two rows
     *
     * @param a		first row
     * @param b		second row
     */
    public static double euclidean(double[] a, double[] b) {
        return Math.sqrt(squared(a, b));
    }

    /**
     * Compute the full distance matrix for a set of rows.
     *
     * @param x		feature matrix, one row per sample
     *
     * @return a symmetric matrix of pairwise distances
     */
    public static double[][] matrix(double[][] x) {
        final int n = x.length;
        double[][] retVal = new double[n][n];
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                double d = euclidean(x[i], x[j]);
                retVal[i][j] = d;
                retVal[j][i] = d;
            }
        }
        return retVal;
    }

    /**
     * Compute the pairwise distances in enumeration order:  (0,1), (0,2), ... (0,n-1), (1,2), and so forth.
     *
     * @param x			feature matrix, one row per sample
     * @param labels	cluster index for each sample
     * @param within	array to receive the within-cluster flag for each pair; must have n(n-1)/2 entries
     *
     * @return the distance for each pair, in the same order as the flags
     */
    public static double[] orderedPairs(double[][] x, int[] labels, boolean[] within) {
        final int n = x.length;
        double[] retVal = new double[within.length];
        int idx = 0;
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                retVal[idx] = euclidean(x[i], x[j]);
                within[idx] = (labels[i] == labels[j]);
                idx++;
            }
        }
        return retVal;
    }

}
