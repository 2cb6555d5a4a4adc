/**
 *
 */
package org.theseed.metrics.clustering;

import org.theseed.metrics.EvaluationContext;

/**
 * This class contains the external clustering scores that need more than a single algebraic expression.  The
 * pair-based scores are simple combinations of the pair-confusion counts and live in the metric registry.
 *
 */
public class ExternalIndices {

    /**
     * @return the mutual information normalized by the arithmetic mean of the two label entropies
     *
     * @param table		contingency table
     * @param context	evaluation context for the degenerate case
     */
    public static double normalizedMutualInfo(ContingencyTable table, EvaluationContext context) {
        double hTrue = table.classEntropy();
        double hPred = table.clusterEntropy();
        double retVal;
        if (hTrue == 0.0 || hPred == 0.0)
            retVal = context.undefined("Normalized mutual information is undefined when either labeling has a single group.", 0.0);
        else
            retVal = table.mutualInformation() / ((hTrue + hPred) / 2.0);
        return retVal;
    }

    /**
     * @return the harmonic mean of homogeneity and completeness (0 if both are 0)
     *
     * @param table		contingency table
     */
    public static double vMeasure(ContingencyTable table) {
        double h = table.homogeneity();
        double c = table.completeness();
        return (h + c == 0.0 ? 0.0 : 2.0 * h * c / (h + c));
    }

    /**
     * @return the pair precision, the fraction of pairs together in the prediction that are together in the truth
     *
     * @param pc	pair-confusion counts
     */
    public static double precision(PairConfusion pc) {
        return pc.getYY() / (pc.getYY() + pc.getNY());
    }

    /**
     * @return the pair recall, the fraction of pairs together in the truth that are together in the prediction
     *
     * @param pc	pair-confusion counts
     */
    public static double recall(PairConfusion pc) {
        return pc.getYY() / (pc.getYY() + pc.getYN());
    }

    /**
     * @return the harmonic mean of pair precision and pair recall
     *
     * @param pc	pair-confusion counts
     */
    public static double fMeasure(PairConfusion pc) {
        double p = precision(pc);
        double r = recall(pc);
        return 2.0 * p * r / (p + r);
    }

    /**
     * Compute the Hubert gamma statistic from the normalized pair counts.
     *
     * @param pc			normalized pair-confusion counts
     * @param clusters		number of predicted clusters
     * @param context		evaluation context for the degenerate case
     *
     * @return the correlation between the two pair-membership indicators
     */
    public static double hubertGamma(PairConfusion pc, int clusters, EvaluationContext context) {
        double retVal;
        if (clusters == 1)
            retVal = context.undefined("The Hubert gamma score is undefined when y_pred has only 1 cluster.",
                    context.getSmallestValue());
        else {
            double yy = pc.getYY();
            double yn = pc.getYN();
            double ny = pc.getNY();
            double nn = pc.getNN();
            double num = pc.total() * yy - (yy + yn) * (yy + ny);
            retVal = num / Math.sqrt((yy + yn) * (yy + ny) * (nn + yn) * (nn + ny));
        }
        return retVal;
    }

    /**
     * Compute the Phi score from the normalized pair counts.  The denominator is the plain product of the four
     * margins, with no square root.
     *
     * @param pc			normalized pair-confusion counts
     * @param clusters		number of predicted clusters
     * @param context		evaluation context for the degenerate case
     *
     * @return the Phi score
     */
    public static double phi(PairConfusion pc, int clusters, EvaluationContext context) {
        double retVal;
        if (clusters == 1)
            retVal = context.undefined("The Phi score is undefined when y_pred has only 1 cluster.",
                    context.getSmallestValue());
        else {
            double yy = pc.getYY();
            double yn = pc.getYN();
            double ny = pc.getNY();
            double nn = pc.getNN();
            retVal = (yy * nn - yn * ny) / ((yy + yn) * (yy + ny) * (yn + nn) * (ny + nn));
        }
        return retVal;
    }

    /**
     * @return the Kendall-style tau, (concordant - discordant) / total over sample pairs
     *
     * @param pc	pair-confusion counts
     */
    public static double tau(PairConfusion pc) {
        double concordant = pc.getYY() + pc.getNN();
        double discordant = pc.getYN() + pc.getNY();
        return (concordant - discordant) / (concordant + discordant);
    }

}
