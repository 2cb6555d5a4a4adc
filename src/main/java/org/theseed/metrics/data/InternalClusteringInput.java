/**
 *
 */
package org.theseed.metrics.data;

/**
 * This object holds the feature matrix and encoded predicted labels for one internal clustering metric call.
 *
 */
public class InternalClusteringInput {

    // FIELDS
    /** feature matrix, one row per sample */
    private final double[][] x;
    /** encoded predicted labels */
    private final int[] yPred;
    /** encoder for the predicted labels */
    private final LabelEncoder encoder;
    /** number of fractional digits for the result */
    private final int decimal;

    /**
     * Construct an internal clustering input.
     *
     * @param x			feature matrix, one row per sample
     * @param yPred		encoded predicted labels
     * @param encoder	encoder for the predicted labels
     * @param decimal	number of fractional digits for the result
     */
    public InternalClusteringInput(double[][] x, int[] yPred, LabelEncoder encoder, int decimal) {
        this.x = x;
        this.yPred = yPred;
        this.encoder = encoder;
        this.decimal = decimal;
    }

    /**
     * @return the feature matrix
     */
    public double[][] getX() {
        return this.x;
    }

    /**
     * @return the encoded predicted labels
     */
    public int[] getPred() {
        return this.yPred;
    }

    /**
     * @return the encoder for the predicted labels
     */
    public LabelEncoder getEncoder() {
        return this.encoder;
    }

    /**
     * @return the number of distinct predicted clusters
     */
    public int getClusters() {
        return this.encoder.size();
    }

    /**
     * @return the number of samples
     */
    public int size() {
        return this.yPred.length;
    }

    /**
     * @return the number of features
     */
    public int getDimension() {
        return (this.x.length == 0 ? 0 : this.x[0].length);
    }

    /**
     * @return the number of fractional digits for the result
     */
    public int getDecimal() {
        return this.decimal;
    }

}
