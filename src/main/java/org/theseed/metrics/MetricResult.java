/**
 *
 */
package org.theseed.metrics;

import java.util.Arrays;
import java.util.stream.Collectors;

/**
 * This object holds the result of a metric computation.  A result is a single number, a vector with one
 * score per output column, or a set of per-sample values (one array per output column).  All values are
 * already rounded.
 *
 */
public class MetricResult {

    /** shape of a result */
    public static enum Kind {
        /** a single number */
        SCALAR,
        /** one number per output column (or per sample, for per-sample cluster scores) */
        VECTOR,
        /** one array of per-sample values per output column */
        SAMPLES;
    }

    // FIELDS
    /** shape of the result */
    private final Kind kind;
    /** result values, one array per output column (a scalar or vector is stored in the first array) */
    private final double[][] data;

    /**
     * Construct a metric result.
     *
     * @param kind	shape of the result
     * @param data	result values
     */
    private MetricResult(Kind kind, double[][] data) {
        this.kind = kind;
        this.data = data;
    }

    /**
     * @return a scalar result
     *
     * @param value		result value
     */
    public static MetricResult of(double value) {
        return new MetricResult(Kind.SCALAR, new double[][] { { value } });
    }

    /**
     * @return a vector result
     *
     * @param values	result values
     */
    public static MetricResult ofVector(double[] values) {
        return new MetricResult(Kind.VECTOR, new double[][] { values.clone() });
    }

    /**
     * @return a per-sample result
     *
     * @param columns	array of per-sample values for each output column
     */
    public static MetricResult ofSamples(double[][] columns) {
        double[][] copy = Arrays.stream(columns).map(double[]::clone).toArray(double[][]::new);
        return new MetricResult(Kind.SAMPLES, copy);
    }

    /**
     * @return the shape of this result
     */
    public Kind getKind() {
        return this.kind;
    }

    /**
     * @return TRUE if this result is a single number
     */
    public boolean isScalar() {
        return this.kind == Kind.SCALAR;
    }

    /**
     * @return the value of a scalar result
     *
     * @throws IllegalStateException if the result is not a scalar
     */
    public double getValue() {
        if (this.kind != Kind.SCALAR)
            throw new IllegalStateException("Metric result is a " + this.kind + ", not a single number.");
        return this.data[0][0];
    }

    /**
     * @return the values of this result as a flat vector; for a per-sample result this is only available
     * 		   when there is a single output column
     */
    public double[] getValues() {
        if (this.kind == Kind.SAMPLES && this.data.length > 1)
            throw new IllegalStateException("Metric result has per-sample values for " + this.data.length
                    + " columns; use getColumn.");
        return this.data[0].clone();
    }

    /**
     * @return the number of output columns in a per-sample result (1 for the other kinds)
     */
    public int getColumnCount() {
        return this.data.length;
    }

    /**
     * @return the values for one output column of a per-sample result
     *
     * @param i		index of the desired column
     */
    public double[] getColumn(int i) {
        return this.data[i].clone();
    }

    /**
     * @return a displayable form of the values, comma-delimited
     */
    public String format() {
        return Arrays.stream(this.data).map(x -> Arrays.stream(x).mapToObj(Double::toString)
                .collect(Collectors.joining(","))).collect(Collectors.joining(";"));
    }

    @Override
    public String toString() {
        return this.kind + "[" + this.format() + "]";
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + Arrays.deepHashCode(this.data);
        result = prime * result + this.kind.hashCode();
        return result;
    }

    @Override
    public boolean equals(Object obj) {
        if (this == obj) {
            return true;
        }
        if (!(obj instanceof MetricResult)) {
            return false;
        }
        MetricResult other = (MetricResult) obj;
        if (this.kind != other.kind) {
            return false;
        }
        return Arrays.deepEquals(this.data, other.data);
    }

}
