/**
 *
 */
package org.theseed.metrics.clustering;

/**
 * This object holds the pair-confusion counts for two label vectors.  Every unordered pair of distinct samples
 * falls into exactly one of four categories:
 *
 * 	yy		same true class, same predicted cluster
 * 	yn		same true class, different predicted clusters
 * 	ny		different true classes, same predicted cluster
 * 	nn		different true classes, different predicted clusters
 *
 * The counts are computed from the contingency table rather than by enumerating pairs.  In normalized form,
 * each count is divided by the total number of pairs.
 *
 */
public class PairConfusion {

    // FIELDS
    /** pairs together in both labelings */
    private final double yy;
    /** pairs together in the truth only */
    private final double yn;
    /** pairs together in the prediction only */
    private final double ny;
    /** pairs apart in both labelings */
    private final double nn;

    /**
     * Construct a pair-confusion object from explicit counts.
     *
     * @param yy	pairs together in both labelings
     * @param yn	pairs together in the truth only
     * @param ny	pairs together in the prediction only
     * @param nn	pairs apart in both labelings
     */
    public PairConfusion(double yy, double yn, double ny, double nn) {
        this.yy = yy;
        this.yn = yn;
        this.ny = ny;
        this.nn = nn;
    }

    /**
     * Count the sample pairs for a contingency table.
     *
     * @param table			contingency table of true classes against predicted clusters
     * @param normalize		TRUE to divide each count by the total number of pairs
     *
     * @return the pair-confusion counts
     */
    public static PairConfusion count(ContingencyTable table, boolean normalize) {
        double together = 0.0;
        for (int i = 0; i < table.getClassCount(); i++) {
            for (int j = 0; j < table.getClusterCount(); j++)
                together += pairs(table.getCount(i, j));
        }
        double sameTrue = 0.0;
        for (int i = 0; i < table.getClassCount(); i++)
            sameTrue += pairs(table.getClassSize(i));
        double samePred = 0.0;
        for (int j = 0; j < table.getClusterCount(); j++)
            samePred += pairs(table.getClusterSize(j));
        double total = pairs(table.size());
        double yn = sameTrue - together;
        double ny = samePred - together;
        double nn = total - together - yn - ny;
        PairConfusion retVal;
        if (normalize && total > 0)
            retVal = new PairConfusion(together / total, yn / total, ny / total, nn / total);
        else
            retVal = new PairConfusion(together, yn, ny, nn);
        return retVal;
    }

    /**
     * @return the number of unordered pairs in a group
     *
     * @param n		size of the group
     */
    private static double pairs(long n) {
        return n * (n - 1) / 2.0;
    }

    /**
     * @return the number of pairs together in both labelings
     */
    public double getYY() {
        return this.yy;
    }

    /**
     * @return the number of pairs together in the truth only
     */
    public double getYN() {
        return this.yn;
    }

    /**
     * @return the number of pairs together in the prediction only
     */
    public double getNY() {
        return this.ny;
    }

    /**
     * @return the number of pairs apart in both labelings
     */
    public double getNN() {
        return this.nn;
    }

    /**
     * @return the sum of all four counts
     */
    public double total() {
        return this.yy + this.yn + this.ny + this.nn;
    }

    @Override
    public String toString() {
        return "PairConfusion [yy=" + this.yy + ", yn=" + this.yn + ", ny=" + this.ny + ", nn=" + this.nn + "]";
    }

}
