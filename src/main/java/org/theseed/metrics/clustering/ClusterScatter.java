/**
 *
 */
package org.theseed.metrics.clustering;

import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.EigenDecomposition;
import org.apache.commons.math3.linear.RealMatrix;
import org.theseed.metrics.data.InternalClusteringInput;

/**
 * This object computes the centroids and scatter statistics of a clustered feature matrix.  It provides the
 * sum-of-squares quantities (within-group, between-group and total) and the full within-group and total
 * scatter matrices used by the determinant indices.
 *
 */
public class ClusterScatter {

    // FIELDS
    /** feature matrix */
    private final double[][] x;
    /** cluster index for each sample */
    private final int[] labels;
    /** centroid of each cluster */
    private final double[][] centroids;
    /** number of samples in each cluster */
    private final int[] sizes;
    /** mean of all the samples */
    private final double[] globalMean;
    /** within-group dispersion of each cluster */
    private final double[] dispersions;
    /** within-group sum of squares */
    private final double wgss;
    /** between-group sum of squares */
    private final double bgss;

    /**
     * Compute the scatter statistics for a feature matrix and its cluster labels.
     *
     * @param x				feature matrix, one row per sample
     * @param labels		cluster index for each sample
     * @param nClusters		number of clusters
     */
    public ClusterScatter(double[][] x, int[] labels, int nClusters) {
        this.x = x;
        this.labels = labels;
        final int d = x[0].length;
        this.centroids = new double[nClusters][d];
        this.sizes = new int[nClusters];
        this.globalMean = new double[d];
        for (int i = 0; i < x.length; i++) {
            int k = labels[i];
            this.sizes[k]++;
            for (int j = 0; j < d; j++) {
                this.centroids[k][j] += x[i][j];
                this.globalMean[j] += x[i][j];
            }
        }
        for (int k = 0; k < nClusters; k++) {
            for (int j = 0; j < d; j++)
                this.centroids[k][j] /= this.sizes[k];
        }
        for (int j = 0; j < d; j++)
            this.globalMean[j] /= x.length;
        // Compute the dispersions.
        this.dispersions = new double[nClusters];
        for (int i = 0; i < x.length; i++)
            this.dispersions[labels[i]] += Distances.squared(x[i], this.centroids[labels[i]]);
        double within = 0.0;
        for (double disp : this.dispersions)
            within += disp;
        this.wgss = within;
        double between = 0.0;
        for (int k = 0; k < nClusters; k++)
            between += this.sizes[k] * Distances.squared(this.centroids[k], this.globalMean);
        this.bgss = between;
    }

    /**
     * Compute the scatter statistics for a prepared internal-clustering input.
     *
     * @param input		feature matrix and encoded labels
     */
    public ClusterScatter(InternalClusteringInput input) {
        this(input.getX(), input.getPred(), input.getClusters());
    }

    /**
     * @return the number of clusters
     */
    public int getClusterCount() {
        return this.sizes.length;
    }

    /**
     * @return the number of samples
     */
    public int size() {
        return this.x.length;
    }

    /**
     * @return the number of features
     */
    public int getDimension() {
        return this.globalMean.length;
    }

    /**
     * @return the centroid of a cluster
     *
     * @param k		index of the cluster
     */
    public double[] getCentroid(int k) {
        return this.centroids[k];
    }

    /**
     * @return the number of samples in a cluster
     *
     * @param k		index of the cluster
     */
    public int getSize(int k) {
        return this.sizes[k];
    }

    /**
     * @return the sum of squared distances from the members of a cluster to its centroid
     *
     * @param k		index of the cluster
     */
    public double getDispersion(int k) {
        return this.dispersions[k];
    }

    /**
     * @return the within-group sum of squares
     */
    public double getWGSS() {
        return this.wgss;
    }

    /**
     * @return the between-group sum of squares
     */
    public double getBGSS() {
        return this.bgss;
    }

    /**
     * @return the total sum of squares
     */
    public double getTSS() {
        return this.wgss + this.bgss;
    }

    /**
     * @return the within-group scatter matrix (sum of the outer products of the centered samples)
     */
    public RealMatrix withinScatter() {
        final int d = this.getDimension();
        double[][] retVal = new double[d][d];
        for (int i = 0; i < this.x.length; i++)
            addOuter(retVal, this.x[i], this.centroids[this.labels[i]]);
        return new Array2DRowRealMatrix(retVal, false);
    }

    /**
     * @return the total scatter matrix (centered on the global mean)
     */
    public RealMatrix totalScatter() {
        final int d = this.getDimension();
        double[][] retVal = new double[d][d];
        for (double[] row : this.x)
            addOuter(retVal, row, this.globalMean);
        return new Array2DRowRealMatrix(retVal, false);
    }

    /**
     * Add the outer product of a centered row to a matrix.
     *
     * @param matrix	matrix to update
     * @param row		sample row
     * @param center	center to subtract
     */
    private static void addOuter(double[][] matrix, double[] row, double[] center) {
        final int d = row.length;
        double[] diff = new double[d];
        for (int j = 0; j < d; j++)
            diff[j] = row[j] - center[j];
        for (int a = 0; a < d; a++) {
            for (int b = 0; b < d; b++)
                matrix[a][b] += diff[a] * diff[b];
        }
    }

    /**
     * Compute the natural log of the determinant of a symmetric positive semi-definite matrix from its
     * eigenvalues.
     *
     * @param matrix	matrix to examine
     *
     * @return the log-determinant, or negative infinity if the matrix is singular
     */
    public static double logDeterminant(RealMatrix matrix) {
        double[] eigenvalues = new EigenDecomposition(matrix).getRealEigenvalues();
        double retVal = 0.0;
        for (int i = 0; i < eigenvalues.length && retVal > Double.NEGATIVE_INFINITY; i++) {
            if (eigenvalues[i] <= 0.0)
                retVal = Double.NEGATIVE_INFINITY;
            else
                retVal += Math.log(eigenvalues[i]);
        }
        return retVal;
    }

    /**
     * @return the determinant of a symmetric matrix
     *
     * @param matrix	matrix to examine
     */
    public static double determinant(RealMatrix matrix) {
        return new EigenDecomposition(matrix).getDeterminant();
    }

    /**
     * Scale each feature column to the unit interval.  A constant column becomes all zeroes.
     *
     * @param x		feature matrix to scale
     *
     * @return a new, scaled feature matrix
     */
    public static double[][] minMaxScale(double[][] x) {
        final int d = x[0].length;
        double[][] retVal = new double[x.length][d];
        for (int j = 0; j < d; j++) {
            double min = Double.POSITIVE_INFINITY;
            double max = Double.NEGATIVE_INFINITY;
            for (double[] row : x) {
                min = Math.min(min, row[j]);
                max = Math.max(max, row[j]);
            }
            double range = max - min;
            for (int i = 0; i < x.length; i++)
                retVal[i][j] = (range == 0.0 ? 0.0 : (x[i][j] - min) / range);
        }
        return retVal;
    }

}
