/*
 * Copyright 2022 Jim Carroll
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package ai.kognition.edgecv4j.image;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * <p>
 * {@link IntensityField} is an immutable, fixed size, 2D grid of {@code double} samples
 * stored row-major. Every stage of the edge detector reads one or more of these and produces
 * a new one so no stage can see another stage's intermediate writes.
 * </p>
 *
 * <p>
 * Fields are built by handing a lambda to {@link #create(int, int, PixelSetter)}. For example, this
 * makes a field that's dark on the left and bright on the right:
 * </p>
 *
 * <pre>
 * <code>
 * IntensityField step = IntensityField.create(5, 5, (row, col) -> col &lt; 2 ? 0.0 : 1.0);
 * </code>
 * </pre>
 *
 * Alternatively you can fold over the samples using {@link #reduce(Object, PixelAggregate)}. This
 * will add up all of the samples in a field:
 *
 * <pre>
 * <code>
 * double sum = field.reduce(Double.valueOf(0), (prev, value, row, col) -> prev + value);
 * </code>
 * </pre>
 */
public final class IntensityField {

    private final int rows;
    private final int cols;
    private final double[] data;

    private IntensityField(final int rows, final int cols, final double[] data) {
        this.rows = rows;
        this.cols = cols;
        this.data = data;
    }

    /**
     * Computes the value for the pixel at (row, col). Implementations must only
     * read immutable state since rows may be computed concurrently.
     */
    @FunctionalInterface
    public static interface PixelSetter {
        public double pixel(int row, int col);
    }

    @FunctionalInterface
    public static interface PixelConsumer {
        public void accept(int row, int col, double value);
    }

    @FunctionalInterface
    public static interface PixelAggregate<R> {
        public R apply(R prev, double value, int row, int col);
    }

    /**
     * Build a new field by evaluating {@code setter} at every position. Rows are computed
     * in parallel and each writes only its own slice of the result.
     *
     * <p>
     * Don't call this from the static initializer of the class that defines {@code setter}. The
     * pool threads running a lambda block until that class finishes initializing, which it never
     * does while it waits on them.
     * </p>
     */
    public static IntensityField create(final int rows, final int cols, final PixelSetter setter) {
        checkDimensions(rows, cols);
        final double[] data = new double[rows * cols];
        IntStream.range(0, rows).parallel().forEach(row -> {
            final int rowOffset = row * cols;
            for(int col = 0; col < cols; col++)
                data[rowOffset + col] = setter.pixel(row, col);
        });
        return new IntensityField(rows, cols, data);
    }

    public static IntensityField constant(final int rows, final int cols, final double value) {
        checkDimensions(rows, cols);
        checkFinite(value, 0, 0);
        final double[] data = new double[rows * cols];
        Arrays.fill(data, value);
        return new IntensityField(rows, cols, data);
    }

    /**
     * Copy a {@code double[rows][cols]} into a new field.
     *
     * @throws InvalidParameterException if the array is null, empty, ragged or holds
     * a NaN or infinite sample.
     */
    public static IntensityField of(final double[][] values) {
        if(values == null)
            throw new InvalidParameterException("Can't create an " + IntensityField.class.getSimpleName() + " from a null array");
        if(values.length == 0)
            throw new InvalidParameterException("Can't create an " + IntensityField.class.getSimpleName() + " with no rows");

        final int rows = values.length;
        if(values[0] == null)
            throw new InvalidParameterException("Row 0 is null");
        final int cols = values[0].length;
        checkDimensions(rows, cols);

        final double[] data = new double[rows * cols];
        for(int row = 0; row < rows; row++) {
            final double[] cur = values[row];
            if(cur == null)
                throw new InvalidParameterException("Row " + row + " is null");
            if(cur.length != cols)
                throw new InvalidParameterException("Row " + row + " has " + cur.length + " columns but row 0 has " + cols);
            for(int col = 0; col < cols; col++) {
                checkFinite(cur[col], row, col);
                data[(row * cols) + col] = cur[col];
            }
        }
        return new IntensityField(rows, cols, data);
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    /**
     * The total number of samples.
     */
    public int size() {
        return data.length;
    }

    public double get(final int row, final int col) {
        return data[(row * cols) + col];
    }

    /**
     * Flat, row-major, access.
     */
    public double get(final int pos) {
        return data[pos];
    }

    public boolean inBounds(final int row, final int col) {
        return row >= 0 && row < rows && col >= 0 && col < cols;
    }

    public void forEach(final PixelConsumer consumer) {
        int pos = 0;
        for(int row = 0; row < rows; row++) {
            for(int col = 0; col < cols; col++)
                consumer.accept(row, col, data[pos++]);
        }
    }

    /**
     * Sequential, row-major, fold over every sample.
     */
    public <U> U reduce(final U identity, final PixelAggregate<U> seqOp) {
        U prev = identity;
        int pos = 0;
        for(int row = 0; row < rows; row++) {
            for(int col = 0; col < cols; col++)
                prev = seqOp.apply(prev, data[pos++], row, col);
        }
        return prev;
    }

    public double max() {
        double ret = Double.NEGATIVE_INFINITY;
        for(final double v: data)
            if(v > ret) ret = v;
        return ret;
    }

    public double min() {
        double ret = Double.POSITIVE_INFINITY;
        for(final double v: data)
            if(v < ret) ret = v;
        return ret;
    }

    /**
     * @return a copy of the samples as a {@code double[rows][cols]}
     */
    public double[][] toArray() {
        final double[][] ret = new double[rows][];
        for(int row = 0; row < rows; row++)
            ret[row] = Arrays.copyOfRange(data, row * cols, (row + 1) * cols);
        return ret;
    }

    public boolean sameDimensions(final IntensityField other) {
        return other != null && rows == other.rows && cols == other.cols;
    }

    public void requireSameDimensions(final IntensityField other, final String otherName) {
        if(!sameDimensions(other))
            throw new InvalidParameterException("The " + otherName + " field " + (other == null ? "is null" : ("is " + other.rows + "x" + other.cols))
                + " but is required to be " + rows + "x" + cols);
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + rows;
        result = prime * result + cols;
        result = prime * result + Arrays.hashCode(data);
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null || getClass() != obj.getClass())
            return false;
        final IntensityField other = (IntensityField)obj;
        return rows == other.rows && cols == other.cols && Arrays.equals(data, other.data);
    }

    @Override
    public String toString() {
        return IntensityField.class.getSimpleName() + "[" + rows + "x" + cols + "]";
    }

    private static void checkDimensions(final int rows, final int cols) {
        if(rows <= 0 || cols <= 0)
            throw new InvalidParameterException("An " + IntensityField.class.getSimpleName() + " must be at least 1x1 but " + rows + "x" + cols
                + " was requested");
    }

    private static void checkFinite(final double value, final int row, final int col) {
        if(!Double.isFinite(value))
            throw new InvalidParameterException("The sample at (" + row + ", " + col + ") is " + value);
    }
}
