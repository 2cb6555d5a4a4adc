/**
 *
 */
package org.theseed.metrics.clustering;

import java.util.Arrays;

import org.apache.commons.math3.linear.RealMatrix;
import org.theseed.metrics.EvaluationContext;
import org.theseed.metrics.data.InternalClusteringInput;

/**
 * This class contains the internal clustering indices.  Each index examines a feature matrix and the predicted
 * cluster labels, without reference to any true classes.  Indices that are undefined for a single cluster (or
 * for another degenerate configuration) consult the evaluation context, which either throws an error or
 * supplies the fallback value.
 *
 * The pairwise indices (silhouette, Dunn, Baker-Hubert gamma, G-plus) are quadratic in the number of samples.
 *
 */
public class InternalIndices {

    /**
     * @return the mean, over clusters, of the mean squared distance from each member to its centroid
     *
     * @param scatter	scatter statistics of the clustering
     */
    public static double ballHall(ClusterScatter scatter) {
        final int k = scatter.getClusterCount();
        double sum = 0.0;
        for (int c = 0; c < k; c++)
            sum += scatter.getDispersion(c) / scatter.getSize(c);
        return sum / k;
    }

    /**
     * @return the Calinski-Harabasz variance ratio
     *
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the degenerate case
     */
    public static double calinskiHarabasz(ClusterScatter scatter, EvaluationContext context) {
        final int k = scatter.getClusterCount();
        final int n = scatter.size();
        double retVal;
        if (k == 1)
            retVal = context.undefined("The Calinski-Harabasz index is undefined for a single cluster.", 0.0);
        else
            retVal = (scatter.getBGSS() / (k - 1)) / (scatter.getWGSS() / (n - k));
        return retVal;
    }

    /**
     * @return the Davies-Bouldin index (mean worst-case ratio of spread to centroid separation)
     *
     * @param input		feature matrix and labels
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the degenerate case
     */
    public static double daviesBouldin(InternalClusteringInput input, ClusterScatter scatter, EvaluationContext context) {
        final int k = scatter.getClusterCount();
        double retVal;
        if (k == 1)
            retVal = context.undefined("The Davies-Bouldin index is undefined for a single cluster.", context.getBiggestValue());
        else {
            // Compute the mean distance from each member to its centroid.
            double[] spread = new double[k];
            double[][] x = input.getX();
            int[] labels = input.getPred();
            for (int i = 0; i < x.length; i++)
                spread[labels[i]] += Distances.euclidean(x[i], scatter.getCentroid(labels[i]));
            for (int c = 0; c < k; c++)
                spread[c] /= scatter.getSize(c);
            double sum = 0.0;
            for (int c = 0; c < k; c++) {
                double worst = 0.0;
                for (int o = 0; o < k; o++) {
                    if (o != c) {
                        double ratio = (spread[c] + spread[o])
                                / Distances.euclidean(scatter.getCentroid(c), scatter.getCentroid(o));
                        worst = Math.max(worst, ratio);
                    }
                }
                sum += worst;
            }
            retVal = sum / k;
        }
        return retVal;
    }

    /**
     * Compute the Dunn index:  the smallest distance between points of different clusters divided by the
     * largest cluster diameter.
     *
     * @param input			feature matrix and labels
     * @param useModified	TRUE to compute distances on the fly instead of building the full distance matrix
     * @param context		evaluation context for the degenerate case
     *
     * @return the Dunn index
     */
    public static double dunn(InternalClusteringInput input, boolean useModified, EvaluationContext context) {
        double retVal;
        if (input.getClusters() == 1)
            retVal = context.undefined("The Dunn index is undefined for a single cluster.", 0.0);
        else {
            double[][] x = input.getX();
            int[] labels = input.getPred();
            final int n = x.length;
            double[][] dist = (useModified ? null : Distances.matrix(x));
            double minBetween = Double.POSITIVE_INFINITY;
            double maxDiameter = 0.0;
            for (int i = 0; i < n; i++) {
                for (int j = i + 1; j < n; j++) {
                    double d = (dist == null ? Distances.euclidean(x[i], x[j]) : dist[i][j]);
                    if (labels[i] == labels[j])
                        maxDiameter = Math.max(maxDiameter, d);
                    else
                        minBetween = Math.min(minBetween, d);
                }
            }
            retVal = minBetween / maxDiameter;
        }
        return retVal;
    }

    /**
     * @return the Xie-Beni index (within-group scatter over N times the smallest squared centroid distance)
     *
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the degenerate case
     */
    public static double xieBeni(ClusterScatter scatter, EvaluationContext context) {
        final int k = scatter.getClusterCount();
        double retVal;
        if (k == 1)
            retVal = context.undefined("The Xie-Beni index is undefined for a single cluster.", context.getBiggestValue());
        else {
            double minSep = Double.POSITIVE_INFINITY;
            for (int c = 0; c < k; c++) {
                for (int o = c + 1; o < k; o++)
                    minSep = Math.min(minSep, Distances.squared(scatter.getCentroid(c), scatter.getCentroid(o)));
            }
            retVal = scatter.getWGSS() / (scatter.size() * minSep);
        }
        return retVal;
    }

    /**
     * Compute the silhouette value of each sample.  A sample in a singleton cluster has a value of 0.
     *
     * @param input		feature matrix and labels
     *
     * @return an array of silhouette values, one per sample
     */
    public static double[] silhouetteSamples(InternalClusteringInput input) {
        double[][] x = input.getX();
        int[] labels = input.getPred();
        final int n = x.length;
        final int k = input.getClusters();
        int[] sizes = new int[k];
        for (int label : labels)
            sizes[label]++;
        double[][] dist = Distances.matrix(x);
        double[] retVal = new double[n];
        double[] sums = new double[k];
        for (int i = 0; i < n; i++) {
            int own = labels[i];
            if (sizes[own] > 1) {
                Arrays.fill(sums, 0.0);
                for (int j = 0; j < n; j++)
                    sums[labels[j]] += dist[i][j];
                double a = sums[own] / (sizes[own] - 1);
                double b = Double.POSITIVE_INFINITY;
                for (int c = 0; c < k; c++) {
                    if (c != own)
                        b = Math.min(b, sums[c] / sizes[c]);
                }
                double denom = Math.max(a, b);
                retVal[i] = (denom == 0.0 ? 0.0 : (b - a) / denom);
            }
        }
        return retVal;
    }

    /**
     * @return the mean silhouette value over all samples
     *
     * @param input		feature matrix and labels
     * @param context	evaluation context for the degenerate case
     */
    public static double silhouette(InternalClusteringInput input, EvaluationContext context) {
        double retVal;
        if (input.getClusters() == 1)
            retVal = context.undefined("The silhouette index is undefined for a single cluster.", context.getSmallestValue());
        else
            retVal = Arrays.stream(silhouetteSamples(input)).average().orElse(Double.NaN);
        return retVal;
    }

    /**
     * @return the log-determinant difference between the total and within-group scatter matrices, or NaN
     * 		   if the within-group matrix is singular
     *
     * @param scatter	scatter statistics of the clustering
     */
    private static double logDetDifference(ClusterScatter scatter) {
        double logW = ClusterScatter.logDeterminant(scatter.withinScatter());
        double retVal = Double.NaN;
        if (logW > Double.NEGATIVE_INFINITY)
            retVal = ClusterScatter.logDeterminant(scatter.totalScatter()) - logW;
        return retVal;
    }

    /**
     * @return the ratio of the determinant of the total scatter matrix to that of the within-group scatter matrix
     *
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the singular case
     */
    public static double detRatio(ClusterScatter scatter, EvaluationContext context) {
        double diff = logDetDifference(scatter);
        double retVal;
        if (Double.isNaN(diff))
            retVal = context.undefined("The det-ratio index is undefined for a singular within-group scatter matrix.",
                    context.getSmallestValue());
        else
            retVal = Math.exp(diff);
        return retVal;
    }

    /**
     * @return N times the log of the determinant ratio
     *
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the singular case
     */
    public static double logDetRatio(ClusterScatter scatter, EvaluationContext context) {
        double diff = logDetDifference(scatter);
        double retVal;
        if (Double.isNaN(diff))
            retVal = context.undefined("The log-det-ratio index is undefined for a singular within-group scatter matrix.",
                    context.getSmallestValue());
        else
            retVal = scatter.size() * diff;
        return retVal;
    }

    /**
     * @return the log of the ratio of the between-group to the within-group sum of squares
     *
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the degenerate case
     */
    public static double logSsRatio(ClusterScatter scatter, EvaluationContext context) {
        double retVal;
        if (scatter.getClusterCount() == 1)
            retVal = context.undefined("The log-SS-ratio index is undefined for a single cluster.", context.getSmallestValue());
        else
            retVal = Math.log(scatter.getBGSS() / scatter.getWGSS());
        return retVal;
    }

    /**
     * @return K squared times the determinant of the within-group scatter matrix
     *
     * @param input				feature matrix and labels
     * @param useNormalized		TRUE to scale each feature to the unit interval first
     */
    public static double ksqDetW(InternalClusteringInput input, boolean useNormalized) {
        double[][] x = (useNormalized ? ClusterScatter.minMaxScale(input.getX()) : input.getX());
        final int k = input.getClusters();
        ClusterScatter scatter = new ClusterScatter(x, input.getPred(), k);
        RealMatrix wg = scatter.withinScatter();
        return ((double) k) * k * ClusterScatter.determinant(wg);
    }

    /**
     * Compute the Banfeld-Raftery index:  the sum over clusters of the cluster size times the log of the mean
     * dispersion.  Clusters with a single member or zero dispersion are skipped.
     *
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the degenerate case
     *
     * @return the Banfeld-Raftery index
     */
    public static double banfeldRaftery(ClusterScatter scatter, EvaluationContext context) {
        final int k = scatter.getClusterCount();
        double retVal;
        if (k == 1)
            retVal = context.undefined("The Banfeld-Raftery index is undefined for a single cluster.", context.getBiggestValue());
        else {
            retVal = 0.0;
            for (int c = 0; c < k; c++) {
                int size = scatter.getSize(c);
                double disp = scatter.getDispersion(c);
                if (size > 1 && disp > 0.0)
                    retVal += size * Math.log(disp / size);
            }
        }
        return retVal;
    }

    /**
     * @return the ratio of the within-group sum of squares to the total sum of squares
     *
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the degenerate case
     */
    public static double dudaHart(ClusterScatter scatter, EvaluationContext context) {
        double retVal;
        if (scatter.getClusterCount() == 1)
            retVal = context.undefined("The Duda-Hart index is undefined for a single cluster.", context.getBiggestValue());
        else
            retVal = scatter.getWGSS() / scatter.getTSS();
        return retVal;
    }

    /**
     * @return the Beale F-ratio
     *
     * @param scatter	scatter statistics of the clustering
     * @param context	evaluation context for the degenerate case
     */
    public static double beale(ClusterScatter scatter, EvaluationContext context) {
        final int k = scatter.getClusterCount();
        final int n = scatter.size();
        final int d = scatter.getDimension();
        double wgss = scatter.getWGSS();
        double retVal;
        if (k == 1 || wgss == 0.0)
            retVal = context.undefined("The Beale index is undefined for a single cluster or zero within-group scatter.",
                    context.getBiggestValue());
        else {
            double num = (scatter.getTSS() - wgss) / wgss;
            double denom = ((n - 1.0) / (n - k)) * Math.pow(k, 2.0 / d) - 1.0;
            retVal = num / denom;
        }
        return retVal;
    }

    /**
     * @return the fraction of the total sum of squares explained by the clustering
     *
     * @param scatter	scatter statistics of the clustering
     */
    public static double rSquared(ClusterScatter scatter) {
        return scatter.getBGSS() / scatter.getTSS();
    }

    /**
     * @return the Hartigan index, (N - K - 1) times the excess of the total over the within-group sum of squares
     *
     * @param scatter	scatter statistics of the clustering
     */
    public static double hartigan(ClusterScatter scatter) {
        final int k = scatter.getClusterCount();
        final int n = scatter.size();
        return (n - k - 1) * (scatter.getTSS() / scatter.getWGSS() - 1.0);
    }

    /**
     * Compute a density-based validity score.  For each cluster, the sparseness is the largest nearest-neighbor
     * distance inside the cluster and the separation is the smallest distance to a point in another cluster.
     * The cluster validity is (separation - sparseness) / max(separation, sparseness), and the overall validity
     * is the size-weighted mean over clusters.  The result is mapped to [0, 1] with 0 as the best value.
     *
     * @param input		feature matrix and labels
     * @param context	evaluation context for the degenerate case
     *
     * @return the density-based validation score
     */
    public static double densityBasedValidation(InternalClusteringInput input, EvaluationContext context) {
        final int k = input.getClusters();
        double retVal;
        if (k == 1)
            retVal = context.undefined("The density-based validation index is undefined for a single cluster.", 1.0);
        else {
            double[][] x = input.getX();
            int[] labels = input.getPred();
            final int n = x.length;
            double[] sparseness = new double[k];
            double[] separation = new double[k];
            Arrays.fill(separation, Double.POSITIVE_INFINITY);
            int[] sizes = new int[k];
            for (int i = 0; i < n; i++) {
                int own = labels[i];
                sizes[own]++;
                double nearest = Double.POSITIVE_INFINITY;
                for (int j = 0; j < n; j++) {
                    if (j != i) {
                        double d = Distances.euclidean(x[i], x[j]);
                        if (labels[j] == own)
                            nearest = Math.min(nearest, d);
                        else
                            separation[own] = Math.min(separation[own], d);
                    }
                }
                if (nearest < Double.POSITIVE_INFINITY)
                    sparseness[own] = Math.max(sparseness[own], nearest);
            }
            double validity = 0.0;
            for (int c = 0; c < k; c++) {
                double denom = Math.max(separation[c], sparseness[c]);
                double vc = (denom == 0.0 ? 0.0 : (separation[c] - sparseness[c]) / denom);
                validity += ((double) sizes[c]) / n * vc;
            }
            retVal = (1.0 - validity) / 2.0;
        }
        return retVal;
    }

    /**
     * Count the concordant and discordant comparisons between within-cluster and between-cluster distances.
     * The sample pairs are enumerated in (i, j) order, and a within-cluster pair is only compared to the
     * between-cluster pairs that come after it.  A comparison is concordant when the within-cluster distance
     * is smaller.
     *
     * The between-cluster distances already passed are held in a rank-indexed counting tree, so the scan runs
     * backward through the pairs in O(P log P) time.
     *
     * @param input		feature matrix and labels
     *
     * @return a three-element array:  concordant count, discordant count, total number of sample pairs
     */
    private static double[] compareDistances(InternalClusteringInput input) {
        final int n = input.size();
        final int pairs = n * (n - 1) / 2;
        boolean[] within = new boolean[pairs];
        double[] distances = Distances.orderedPairs(input.getX(), input.getPred(), within);
        // The sorted between-cluster distances define the ranks.
        double[] ranks = new double[pairs];
        int betweenCount = 0;
        for (int idx = 0; idx < pairs; idx++) {
            if (! within[idx])
                ranks[betweenCount++] = distances[idx];
        }
        ranks = Arrays.copyOf(ranks, betweenCount);
        Arrays.sort(ranks);
        long[] tree = new long[betweenCount + 1];
        long seen = 0;
        double plus = 0.0;
        double minus = 0.0;
        for (int idx = pairs - 1; idx >= 0; idx--) {
            double d = distances[idx];
            if (within[idx]) {
                long less = countBelow(tree, lowerBound(ranks, d));
                long lessOrEqual = countBelow(tree, upperBound(ranks, d));
                minus += less;
                plus += seen - lessOrEqual;
            } else {
                for (int pos = lowerBound(ranks, d) + 1; pos < tree.length; pos += pos & (-pos))
                    tree[pos]++;
                seen++;
            }
        }
        return new double[] { plus, minus, pairs };
    }

    /**
     * @return the number of entries in a counting tree with rank less than the specified limit
     *
     * @param tree		counting tree (1-based)
     * @param limit		number of low ranks to include
     */
    private static long countBelow(long[] tree, int limit) {
        long retVal = 0;
        for (int pos = limit; pos > 0; pos -= pos & (-pos))
            retVal += tree[pos];
        return retVal;
    }

    /**
     * @return the number of values in a sorted array strictly less than the target
     *
     * @param sorted	sorted array
     * @param target	value to compare
     */
    private static int lowerBound(double[] sorted, double target) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] < target)
                lo = mid + 1;
            else
                hi = mid;
        }
        return lo;
    }

    /**
     * @return the number of values in a sorted array less than or equal to the target
     *
     * @param sorted	sorted array
     * @param target	value to compare
     */
    private static int upperBound(double[] sorted, double target) {
        int lo = 0;
        int hi = sorted.length;
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted[mid] <= target)
                lo = mid + 1;
            else
                hi = mid;
        }
        return lo;
    }

    /**
     * @return the Baker-Hubert gamma, (s+ - s-) / (s+ + s-), or 0 if there are no comparisons
     *
     * @param input		feature matrix and labels
     */
    public static double bakerHubertGamma(InternalClusteringInput input) {
        double[] counts = compareDistances(input);
        double denom = counts[0] + counts[1];
        return (denom == 0.0 ? 0.0 : (counts[0] - counts[1]) / denom);
    }

    /**
     * @return the G-plus index, the discordant comparisons as a fraction of all pairs of sample pairs
     *
     * @param input		feature matrix and labels
     */
    public static double gPlus(InternalClusteringInput input) {
        double[] counts = compareDistances(input);
        double pairs = counts[2];
        return 2.0 * counts[1] / (pairs * (pairs - 1.0));
    }

}
