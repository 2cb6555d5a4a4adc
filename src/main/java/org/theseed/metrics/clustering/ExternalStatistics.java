/**
 *
 */
package org.theseed.metrics.clustering;

import org.theseed.metrics.data.ExternalClusteringInput;

/**
 * This object holds the shared statistics for an external clustering score:  the contingency table and the
 * pair-confusion counts in both raw and normalized form.
 *
 */
public class ExternalStatistics {

    // FIELDS
    /** contingency table of classes against clusters */
    private final ContingencyTable table;
    /** raw pair-confusion counts */
    private final PairConfusion pairs;
    /** normalized pair-confusion counts */
    private final PairConfusion normalized;

    /**
     * Compute the statistics for a prepared input.
     *
     * @param input		encoded true and predicted labels
     */
    public ExternalStatistics(ExternalClusteringInput input) {
        this.table = new ContingencyTable(input);
        this.pairs = PairConfusion.count(this.table, false);
        this.normalized = PairConfusion.count(this.table, true);
    }

    /**
     * @return the contingency table
     */
    public ContingencyTable getTable() {
        return this.table;
    }

    /**
     * @return the raw pair-confusion counts
     */
    public PairConfusion getPairs() {
        return this.pairs;
    }

    /**
     * @return the pair-confusion counts divided by the total number of pairs
     */
    public PairConfusion getNormalized() {
        return this.normalized;
    }

    /**
     * @return the number of predicted clusters
     */
    public int getClusterCount() {
        return this.table.getClusterCount();
    }

}
