/**
 *
 */
package org.theseed.metrics.data;

/**
 * This object holds the encoded truth and prediction labels for one external clustering metric call.
 *
 */
public class ExternalClusteringInput {

    // FIELDS
    /** encoded truth labels */
    private final int[] yTrue;
    /** encoded predicted labels */
    private final int[] yPred;
    /** encoder for the truth labels */
    private final LabelEncoder trueEncoder;
    /** encoder for the predicted labels */
    private final LabelEncoder predEncoder;
    /** number of fractional digits for the result */
    private final int decimal;

    /**
     * Construct an external clustering input.
     *
     * @param yTrue			encoded truth labels
     * @param yPred			encoded predicted labels
     * @param trueEncoder	encoder for the truth labels
     * @param predEncoder	encoder for the predicted labels
     * @param decimal		number of fractional digits for the result
     */
    public ExternalClusteringInput(int[] yTrue, int[] yPred, LabelEncoder trueEncoder, LabelEncoder predEncoder,
            int decimal) {
        this.yTrue = yTrue;
        this.yPred = yPred;
        this.trueEncoder = trueEncoder;
        this.predEncoder = predEncoder;
        this.decimal = decimal;
    }

    /**
     * @return the encoded truth labels
     */
    public int[] getTrue() {
        return this.yTrue;
    }

    /**
     * @return the encoded predicted labels
     */
    public int[] getPred() {
        return this.yPred;
    }

    /**
     * @return the encoder for the truth labels
     */
    public LabelEncoder getTrueEncoder() {
        return this.trueEncoder;
    }

    /**
     * @return the encoder for the predicted labels
     */
    public LabelEncoder getPredEncoder() {
        return this.predEncoder;
    }

    /**
     * @return the number of distinct truth classes
     */
    public int getTrueClasses() {
        return this.trueEncoder.size();
    }

    /**
     * @return the number of distinct predicted clusters
     */
    public int getPredClusters() {
        return this.predEncoder.size();
    }

    /**
     * @return the number of samples
     */
    public int size() {
        return this.yTrue.length;
    }

    /**
     * @return the number of fractional digits for the result
     */
    public int getDecimal() {
        return this.decimal;
    }

}
