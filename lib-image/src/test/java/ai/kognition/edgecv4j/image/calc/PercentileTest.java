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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.InvalidParameterException;

public class PercentileTest {

    private static final IntensityField WITH_ZEROS = IntensityField.of(new double[][] {
        {0,4,0},
        {2,0,3},
        {0,1,0}
    });

    @Test
    public void testZerosAreExcluded() {
        final Percentile p = Percentile.ofPositive(WITH_ZEROS);
        assertEquals(4, p.size());
        assertFalse(p.isEmpty());
        assertEquals(1.0, p.valueAt(0), 0.0);
        assertEquals(4.0, p.valueAt(100), 0.0);
    }

    @Test
    public void testLinearInterpolation() {
        final Percentile p = Percentile.ofPositive(WITH_ZEROS);
        // rank = 0.7 * 3 = 2.1 between 3 and 4
        assertEquals(3.1, p.valueAt(70), 1e-12);
        // rank = 1.5 between 2 and 3
        assertEquals(2.5, p.valueAt(50), 1e-12);
        assertEquals(2.0, p.valueAt(100.0 / 3.0), 1e-12);
    }

    @Test
    public void testInterpolatesFromTheNearerRank() {
        // measured up from 0.06 this rounds to 0.48700000000000004, measured down from 0.67 it is 0.487
        final Percentile upper = Percentile.ofPositive(IntensityField.of(new double[][] {{0.67,0,0.06}}));
        assertEquals(0.487, upper.valueAt(70), 0.0);

        // below the midpoint it's measured up from the lower rank
        final Percentile lower = Percentile.ofPositive(IntensityField.of(new double[][] {{0.67,0.06}}));
        assertEquals(0.06 + ((0.67 - 0.06) * 0.25), lower.valueAt(25), 0.0);
    }

    @Test
    public void testSingleValue() {
        final IntensityField field = IntensityField.create(5, 5, (r, c) -> r == 2 && c == 3 ? 0.7 : 0.0);
        final Percentile p = Percentile.ofPositive(field);
        assertEquals(1, p.size());
        assertEquals(0.7, p.valueAt(0), 0.0);
        assertEquals(0.7, p.valueAt(70), 0.0);
        assertEquals(0.7, p.valueAt(100), 0.0);
    }

    @Test
    public void testLargePopulation() {
        // 1..400 scattered across the field in a non-sorted order
        final IntensityField field = IntensityField.create(20, 20, (r, c) -> ((((r * 20) + c) * 7) % 400) + 1);
        final Percentile p = Percentile.ofPositive(field);
        assertEquals(400, p.size());
        assertEquals(280.3, p.valueAt(70), 1e-9);
        assertEquals(1.0, p.valueAt(0), 0.0);
    }

    @Test
    public void testEmpty() {
        final Percentile p = Percentile.ofPositive(IntensityField.constant(3, 3, 0.0));
        assertTrue(p.isEmpty());
        assertEquals(0, p.size());
    }

    @Test(expected = IllegalStateException.class)
    public void testEmptyValueAt() {
        Percentile.ofPositive(IntensityField.constant(3, 3, 0.0)).valueAt(70);
    }

    @Test(expected = InvalidParameterException.class)
    public void testPercentileOutOfRange() {
        Percentile.ofPositive(WITH_ZEROS).valueAt(100.5);
    }
}
