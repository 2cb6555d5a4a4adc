/**
 *
 */
package org.theseed.metrics.clustering;

import org.theseed.metrics.data.ExternalClusteringInput;

/**
 * This object counts the samples for each combination of true class and predicted cluster.  The
 * information-theoretic scores (mutual information, homogeneity, completeness) and the majority-based
 * scores (purity, entropy) are all computed from these counts.
 *
 * Entropies use the natural logarithm unless a base is specified.
 *
 */
public class ContingencyTable {

    // FIELDS
    /** count for each [class][cluster] combination */
    private final long[][] counts;
    /** number of samples in each true class */
    private final long[] classSizes;
    /** number of samples in each predicted cluster */
    private final long[] clusterSizes;
    /** total number of samples */
    private final long n;

    /**
     * Build the contingency table for two encoded label vectors.
     *
     * @param yTrue			encoded true classes
     * @param yPred			encoded predicted clusters
     * @param nClasses		number of true classes
     * @param nClusters		number of predicted clusters
     */
    public ContingencyTable(int[] yTrue, int[] yPred, int nClasses, int nClusters) {
        this.counts = new long[nClasses][nClusters];
        this.classSizes = new long[nClasses];
        this.clusterSizes = new long[nClusters];
        for (int i = 0; i < yTrue.length; i++) {
            this.counts[yTrue[i]][yPred[i]]++;
            this.classSizes[yTrue[i]]++;
            this.clusterSizes[yPred[i]]++;
        }
        this.n = yTrue.length;
    }

    /**
     * Build the contingency table for a prepared external-clustering input.
     *
     * @param input		encoded true and predicted labels
     */
    public ContingencyTable(ExternalClusteringInput input) {
        this(input.getTrue(), input.getPred(), input.getTrueClasses(), input.getPredClusters());
    }

    /**
     * @return the number of samples in a class/cluster combination
     *
     * @param cls		true class index
     * @param cluster	predicted cluster index
     */
    public long getCount(int cls, int cluster) {
        return this.counts[cls][cluster];
    }

    /**
     * @return the number of samples in a true class
     *
     * @param cls	true class index
     */
    public long getClassSize(int cls) {
        return this.classSizes[cls];
    }

    /**
     * @return the number of samples in a predicted cluster
     *
     * @param cluster	predicted cluster index
     */
    public long getClusterSize(int cluster) {
        return this.clusterSizes[cluster];
    }

    /**
     * @return the number of true classes
     */
    public int getClassCount() {
        return this.classSizes.length;
    }

    /**
     * @return the number of predicted clusters
     */
    public int getClusterCount() {
        return this.clusterSizes.length;
    }

    /**
     * @return the total number of samples
     */
    public long size() {
        return this.n;
    }

    /**
     * Compute the entropy of a distribution given as counts.
     *
     * @param counts	array of counts
     * @param base		logarithm base
     *
     * @return the entropy of the normalized counts
     */
    public static double entropy(long[] counts, double base) {
        long total = 0;
        for (long c : counts)
            total += c;
        double retVal = 0.0;
        if (total > 0) {
            for (long c : counts) {
                if (c > 0) {
                    double p = ((double) c) / total;
                    retVal -= p * Math.log(p);
                }
            }
            retVal /= Math.log(base);
        }
        return retVal;
    }

    /**
     * @return the natural-log entropy of the true classes
     */
    public double classEntropy() {
        return entropy(this.classSizes, Math.E);
    }

    /**
     * @return the natural-log entropy of the predicted clusters
     */
    public double clusterEntropy() {
        return entropy(this.clusterSizes, Math.E);
    }

    /**
     * @return the mutual information between the true classes and the predicted clusters
     */
    public double mutualInformation() {
        double retVal = 0.0;
        double total = this.n;
        for (int i = 0; i < this.classSizes.length; i++) {
            for (int j = 0; j < this.clusterSizes.length; j++) {
                long nij = this.counts[i][j];
                if (nij > 0)
                    retVal += (nij / total) * Math.log(nij * total / (this.classSizes[i] * (double) this.clusterSizes[j]));
            }
        }
        // Rounding errors can produce a tiny negative value.
        return Math.max(retVal, 0.0);
    }

    /**
     * @return the conditional entropy of the true classes given the predicted clusters
     */
    public double classGivenCluster() {
        double retVal = 0.0;
        double total = this.n;
        for (int i = 0; i < this.classSizes.length; i++) {
            for (int j = 0; j < this.clusterSizes.length; j++) {
                long nij = this.counts[i][j];
                if (nij > 0)
                    retVal -= (nij / total) * Math.log(((double) nij) / this.clusterSizes[j]);
            }
        }
        return retVal;
    }

    /**
     * @return the conditional entropy of the predicted clusters given the true classes
     */
    public double clusterGivenClass() {
        double retVal = 0.0;
        double total = this.n;
        for (int i = 0; i < this.classSizes.length; i++) {
            for (int j = 0; j < this.clusterSizes.length; j++) {
                long nij = this.counts[i][j];
                if (nij > 0)
                    retVal -= (nij / total) * Math.log(((double) nij) / this.classSizes[i]);
            }
        }
        return retVal;
    }

    /**
     * @return the homogeneity (1.0 if the truth has only one class)
     */
    public double homogeneity() {
        double hc = this.classEntropy();
        return (hc == 0.0 ? 1.0 : 1.0 - this.classGivenCluster() / hc);
    }

    /**
     * @return the completeness (1.0 if the prediction has only one cluster)
     */
    public double completeness() {
        double hk = this.clusterEntropy();
        return (hk == 0.0 ? 1.0 : 1.0 - this.clusterGivenClass() / hk);
    }

    /**
     * @return the fraction of samples belonging to the majority predicted cluster of their true class
     */
    public double purity() {
        long sum = 0;
        for (long[] row : this.counts) {
            long max = 0;
            for (long c : row)
                max = Math.max(max, c);
            sum += max;
        }
        return ((double) sum) / this.n;
    }

    /**
     * @return the size-weighted mean, over predicted clusters, of the base-2 entropy of the true classes
     * 		   in each cluster
     */
    public double clusterEntropyScore() {
        double retVal = 0.0;
        long[] column = new long[this.classSizes.length];
        for (int j = 0; j < this.clusterSizes.length; j++) {
            for (int i = 0; i < column.length; i++)
                column[i] = this.counts[i][j];
            retVal += ((double) this.clusterSizes[j]) / this.n * entropy(column, 2.0);
        }
        return retVal;
    }

}
