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

package ai.kognition.edgecv4j.image.filter;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.Collection;

import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;

import ai.kognition.edgecv4j.image.IntensityField;

@RunWith(Parameterized.class)
public class GaussianBlurTest {

    private final double sigma;
    private final double truncate;
    private final int expectedRadius;

    @Parameterized.Parameters
    public static Collection<Object[]> parameters() {
        return Arrays.asList(new Object[][] {
            {0.1,4.0,0},
            {0.5,4.0,2},
            {1.0,4.0,4},
            {1.4,4.0,6},
            {2.0,3.0,6},
            {3.0,4.0,12},
            {3.0,3.0,9},
        });
    }

    public GaussianBlurTest(final double sigma, final double truncate, final int expectedRadius) {
        this.sigma = sigma;
        this.truncate = truncate;
        this.expectedRadius = expectedRadius;
    }

    @Test
    public void testKernel() {
        final GaussianBlur blur = new GaussianBlur(sigma, truncate);
        assertEquals(expectedRadius, blur.radius());

        final double[] kernel = blur.kernel();
        assertEquals((2 * expectedRadius) + 1, kernel.length);
        assertEquals(1.0, Arrays.stream(kernel).sum(), 1e-12);
        for(int k = 0; k < expectedRadius; k++) {
            assertEquals(kernel[k], kernel[kernel.length - 1 - k], 0.0);
            assertTrue(kernel[k] < kernel[k + 1]);
        }
    }

    @Test
    public void testConstantFieldUnchanged() {
        final IntensityField flat = IntensityField.constant(7, 11, 0.6);
        final IntensityField blurred = new GaussianBlur(sigma, truncate).gaussianBlur(flat);
        assertEquals(7, blurred.rows());
        assertEquals(11, blurred.cols());
        blurred.forEach((r, c, v) -> assertEquals(0.6, v, 1e-12));
    }

    @Test
    public void testSinglePixel() {
        final IntensityField blurred = new GaussianBlur(sigma, truncate).gaussianBlur(IntensityField.constant(1, 1, 0.3));
        assertEquals(1, blurred.size());
        assertEquals(0.3, blurred.get(0, 0), 1e-12);
    }

    @Test
    public void testSmoothingReducesTheRange() {
        final IntensityField checker = IntensityField.create(9, 9, (r, c) -> ((r + c) & 0x01) == 0 ? 1.0 : 0.0);
        final IntensityField blurred = new GaussianBlur(sigma, truncate).gaussianBlur(checker);
        assertTrue(blurred.max() <= 1.0 + 1e-12);
        assertTrue(blurred.min() >= -1e-12);
        if(expectedRadius > 0)
            assertTrue(blurred.max() - blurred.min() < 1.0);
    }
}
