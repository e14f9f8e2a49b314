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

package ai.kognition.edgecv4j.image.calc;

import java.util.Arrays;

import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.IntensityField.PixelAggregate;
import ai.kognition.edgecv4j.image.InvalidParameterException;

/**
 * Order statistics over the strictly positive samples of a field. Zero (and negative) samples
 * are left out of the population.
 */
public class Percentile {

    private double[] values;
    private int count = 0;
    private boolean sorted = false;

    private Percentile(final int capacity) {
        values = new double[Math.max(capacity, 1)];
    }

    public static PixelAggregate<Percentile> makeAggregate() {
        return (final Percentile prev, final double value, final int row, final int col) -> {
            if(value > 0.0)
                prev.add(value);
            return prev;
        };
    }

    public static Percentile makeInitialValue(final IntensityField field) {
        return new Percentile(field.size());
    }

    public static Percentile ofPositive(final IntensityField field) {
        return field.reduce(makeInitialValue(field), makeAggregate());
    }

    /**
     * The number of samples in the population.
     */
    public int size() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }

    /**
     * <p>
     * The {@code p}th percentile using linear interpolation between the closest ranks. With the
     * population sorted ascending as {@code v[0..n-1]}:
     * </p>
     *
     * <pre>
     * rank = p / 100 * (n - 1)
     * t = rank - floor(rank)
     * ret = v[floor(rank)] + (v[ceil(rank)] - v[floor(rank)]) * t          when t &lt; 0.5
     * ret = v[ceil(rank)] - (v[ceil(rank)] - v[floor(rank)]) * (1 - t)    otherwise
     * </pre>
     *
     * @throws InvalidParameterException if {@code p} is outside of [0, 100]
     * @throws IllegalStateException if the population is empty.
     */
    public double valueAt(final double p) {
        if(!(p >= 0.0 && p <= 100.0))
            throw new InvalidParameterException("A percentile must be within [0, 100] but was " + p);
        if(count == 0)
            throw new IllegalStateException("There's no percentile of an empty population");

        sort();
        final double rank = (p / 100.0) * (count - 1);
        final int lo = (int)Math.floor(rank);
        final int hi = (int)Math.ceil(rank);
        final double vlo = values[lo];
        final double vhi = values[hi];
        final double diff = vhi - vlo;
        final double t = rank - lo;
        return t >= 0.5 ? vhi - (diff * (1.0 - t)) : vlo + (diff * t);
    }

    private void add(final double value) {
        if(count == values.length)
            values = Arrays.copyOf(values, values.length * 2);
        values[count++] = value;
        sorted = false;
    }

    private void sort() {
        if(!sorted) {
            Arrays.sort(values, 0, count);
            sorted = true;
        }
    }
}
