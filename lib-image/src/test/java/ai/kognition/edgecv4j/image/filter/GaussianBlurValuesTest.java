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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;

import org.junit.Test;

import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.InvalidParameterException;

public class GaussianBlurValuesTest {

    private static final double EPS = 1e-12;

    @Test
    public void testUnitSigmaKernel() {
        final double[] expected = {0.00013383062461474175,0.0044318616200312655,0.05399112742070441,0.24197144565660073,
            0.39894346935609776,0.24197144565660073,0.05399112742070441,0.0044318616200312655,0.00013383062461474175};
        assertArrayEquals(expected, new GaussianBlur(1.0).kernel(), EPS);
    }

    @Test
    public void testKnownValues() {
        final IntensityField field = IntensityField.of(new double[][] {
            {0,0,0,0},
            {0,1,0,0},
            {0,0,0,0.5}
        });
        final double[][] blurred = GaussianBlur.gaussianBlur(field, 1.0).toArray();

        assertArrayEquals(new double[] {0.08778146189265933,0.12127797836231657,0.08104727448476516,0.03748402960486969}, blurred[0], EPS);
        assertArrayEquals(new double[] {0.12139142195054325,0.17314877976216142,0.1426035768835461,0.11871161585086948}, blurred[1], EPS);
        assertArrayEquals(new double[] {0.08913945066873294,0.13816006737201889,0.16656954207617153,0.22268480109134575}, blurred[2], EPS);
    }

    @Test
    public void testKernelIsACopy() {
        final GaussianBlur blur = new GaussianBlur(2.0);
        blur.kernel()[0] = 100.0;
        assertEquals(blur.kernel()[blur.kernel().length - 1], blur.kernel()[0], 0.0);
        assertEquals(1.0, Arrays.stream(blur.kernel()).sum(), EPS);
    }

    @Test
    public void testWideKernelTails() {
        // 48000 squared doesn't fit in an int
        final GaussianBlur blur = new GaussianBlur(12000.0);
        assertEquals(48000, blur.radius());
        final double[] kernel = blur.kernel();
        assertEquals(96001, kernel.length);
        assertTrue(kernel[0] < kernel[48000]);
        assertEquals(Math.exp(-8.0), kernel[0] / kernel[48000], 1e-9);
        assertEquals(kernel[0], kernel[kernel.length - 1], 0.0);
    }

    @Test(expected = InvalidParameterException.class)
    public void testHugeSigma() {
        new GaussianBlur(1e9);
    }

    @Test
    public void testLargestRadius() {
        assertEquals(GaussianBlur.MAX_RADIUS, GaussianBlur.radius(GaussianBlur.MAX_RADIUS / 4.0, 4.0));
    }

    @Test(expected = InvalidParameterException.class)
    public void testRadiusPastTheLimit() {
        GaussianBlur.radius((GaussianBlur.MAX_RADIUS + 1) / 4.0, 4.0);
    }

    @Test(expected = InvalidParameterException.class)
    public void testZeroSigma() {
        new GaussianBlur(0.0);
    }

    @Test(expected = InvalidParameterException.class)
    public void testNegativeSigma() {
        new GaussianBlur(-1.0);
    }

    @Test(expected = InvalidParameterException.class)
    public void testNaNSigma() {
        new GaussianBlur(Double.NaN);
    }

    @Test(expected = InvalidParameterException.class)
    public void testNarrowTruncate() {
        new GaussianBlur(1.0, 2.0);
    }
}
