/**
 *
 */
package org.theseed.metrics.data;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Arrays;
import java.util.List;

import org.junit.jupiter.api.Test;
import org.nd4j.linalg.factory.Nd4j;
import org.theseed.metrics.MissingInputException;
import org.theseed.metrics.ShapeException;

/**
 * Tests for label encoding and input preparation.
 *
 */
public class TestInputs {

    @Test
    public void testEncoder() {
        List<String> labels = Arrays.asList("dog", "cat", "emu", "cat", "dog");
        LabelEncoder encoder = LabelEncoder.fit(labels);
        assertThat(encoder.size(), equalTo(3));
        assertThat(encoder.getClasses(), contains((Object) "cat", "dog", "emu"));
        int[] codes = encoder.transform(labels);
        assertThat(codes[0], equalTo(1));
        assertThat(codes[1], equalTo(0));
        assertThat(codes[2], equalTo(2));
        assertThat(encoder.inverseTransform(codes), contains((Object) "dog", "cat", "emu", "cat", "dog"));
        assertThat(encoder.decode(2), equalTo("emu"));
        assertThrows(IllegalArgumentException.class, () -> encoder.encode("gnu"));
        assertThrows(IllegalArgumentException.class, () -> LabelEncoder.fit(Arrays.asList("a", null)));
    }

    @Test
    public void testNumericEncoder() {
        List<Integer> labels = Arrays.asList(10, -2, 10, 3);
        LabelEncoder encoder = LabelEncoder.fit(labels);
        assertThat(encoder.getClasses(), contains((Object) (-2), 3, 10));
        assertThat(encoder.encode(10), equalTo(2));
        // Numeric labels match by value across boxed types.
        assertThat(encoder.encode(3.0), equalTo(1));
        assertThat(encoder.encode(3L), equalTo(1));
    }

    @Test
    public void testRegressionInput() {
        double[][] t = InputNormalizer.asColumn(new double[] { 1.0, 2.0, 3.0 });
        double[][] p = InputNormalizer.asColumn(new double[] { 1.0, 0.0, 4.0 });
        RegressionInput input = InputNormalizer.prepareRegression(t, p, false, false, 5);
        assertThat(input.isSingleColumn(), equalTo(true));
        assertThat(input.getColumnCount(), equalTo(1));
        assertThat(input.getTrue(0).length, equalTo(3));
        input = InputNormalizer.prepareRegression(t, p, true, false, 5);
        assertThat(input.getPred(0).length, equalTo(2));
        assertThat(input.getPred(0)[1], equalTo(4.0));
        assertThat(input.getDecimal(), equalTo(5));
        assertThrows(MissingInputException.class, () -> InputNormalizer.prepareRegression(null, p, false, false, 5));
        assertThrows(ShapeException.class, () -> InputNormalizer.prepareRegression(new double[0][], new double[0][],
                false, false, 5));
        double[][] wide = new double[][] { { 1, 2 }, { 3, 4 }, { 5, 6 } };
        assertThrows(ShapeException.class, () -> InputNormalizer.prepareRegression(t, wide, false, false, 5));
    }

    @Test
    public void testClusteringInput() {
        ExternalClusteringInput ext = InputNormalizer.prepareExternal(Arrays.asList("a", "b", "a"),
                Arrays.asList(7, 7, 2), 4);
        assertThat(ext.size(), equalTo(3));
        assertThat(ext.getTrueClasses(), equalTo(2));
        assertThat(ext.getPredClusters(), equalTo(2));
        assertThat(ext.getPred()[0], equalTo(1));
        assertThat(ext.getPred()[2], equalTo(0));
        assertThrows(ShapeException.class, () -> InputNormalizer.prepareExternal(Arrays.asList(1, 2),
                Arrays.asList(1), 4));
        InternalClusteringInput in = InputNormalizer.prepareInternal(new double[][] { { 1, 2 }, { 3, 4 } },
                Arrays.asList("x", "y"), 4);
        assertThat(in.getClusters(), equalTo(2));
        assertThat(in.getDimension(), equalTo(2));
        assertThrows(MissingInputException.class, () -> InputNormalizer.prepareInternal(null, Arrays.asList(1), 4));
    }

    @Test
    public void testArrays() {
        double[][] matrix = NdArrays.toMatrix(Nd4j.create(new double[][] { { 1, 2 }, { 3, 4 }, { 5, 6 } }));
        assertThat(matrix.length, equalTo(3));
        assertThat(matrix[2][1], equalTo(6.0));
        double[][] column = NdArrays.toMatrix(Nd4j.create(new double[] { 1, 2, 3 }));
        assertThat(column.length, equalTo(3));
        assertThat(column[1].length, equalTo(1));
        List<Object> labels = NdArrays.toLabels(Nd4j.create(new double[] { 1, 0, 2.5 }));
        assertThat(labels, contains((Object) 1, 0, 2.5));
        assertThat(NdArrays.toMatrix(null), nullValue());
        assertThrows(ShapeException.class, () -> NdArrays.toLabels(Nd4j.create(new double[][] { { 1, 2 }, { 3, 4 } })));
        // Large integral labels must stay distinct.
        List<Object> big = NdArrays.toLabels(Nd4j.create(new double[] { 3e9, 4e9, 3e9, 7 }));
        assertThat(big, contains((Object) 3000000000L, 4000000000L, 3000000000L, 7));
        LabelEncoder encoder = LabelEncoder.fit(big);
        assertThat(encoder.size(), equalTo(3));
        assertThat(encoder.transform(big)[1], equalTo(2));
    }

}
