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

package ai.kognition.edgecv4j.image.canny;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

import ai.kognition.edgecv4j.image.IntensityField;

public class SobelGradientTest {

    @Test
    public void testDirectionFolding() {
        assertEquals(0.0, SobelGradient.direction(1, 0), 1e-12);
        assertEquals(45.0, SobelGradient.direction(1, 1), 1e-12);
        assertEquals(90.0, SobelGradient.direction(0, 1), 1e-12);
        assertEquals(135.0, SobelGradient.direction(-1, 1), 1e-12);

        // opposite gradients share an orientation
        assertEquals(45.0, SobelGradient.direction(-1, -1), 1e-12);
        assertEquals(90.0, SobelGradient.direction(0, -1), 1e-12);
        assertEquals(135.0, SobelGradient.direction(1, -1), 1e-12);
    }

    @Test
    public void testHorizontalGradientNeverReaches180() {
        assertEquals(0.0, SobelGradient.direction(-4, 0.0), 0.0);
        assertEquals(0.0, SobelGradient.direction(-4, -0.0), 0.0);
        assertEquals(0.0, SobelGradient.direction(4, -0.0), 0.0);
        assertEquals(0.0, SobelGradient.direction(0.0, 0.0), 0.0);
        for(double a = -360.0; a <= 360.0; a += 7.5) {
            final double rad = Math.toRadians(a);
            final double deg = SobelGradient.direction(Math.cos(rad), Math.sin(rad));
            assertTrue("angle " + a + " folded to " + deg, deg >= 0.0 && deg < 180.0);
        }
    }

    @Test
    public void testVerticalStep() {
        // dark on the left, bright from column 3
        final IntensityField step = IntensityField.create(5, 6, (r, c) -> c < 3 ? 0.0 : 1.0);
        final GradientImages g = SobelGradient.gradient(step);

        assertEquals(5, g.rows());
        assertEquals(6, g.cols());
        for(int r = 0; r < 5; r++) {
            for(int c = 0; c < 6; c++) {
                assertEquals(0.0, g.dy.get(r, c), 0.0);
                final boolean onStep = c == 2 || c == 3;
                assertEquals(onStep ? -4.0 : 0.0, g.dx.get(r, c), 0.0);
                assertEquals(onStep ? 4.0 : 0.0, g.magnitude.get(r, c), 0.0);
                if(onStep)
                    assertEquals(0.0, g.direction.get(r, c), 0.0);
            }
        }
    }

    @Test
    public void testHorizontalStep() {
        final IntensityField step = IntensityField.create(6, 5, (r, c) -> r < 3 ? 1.0 : 0.0);
        final GradientImages g = SobelGradient.gradient(step);
        assertEquals(4.0, g.dy.get(2, 2), 0.0);
        assertEquals(4.0, g.magnitude.get(3, 0), 0.0);
        assertEquals(90.0, g.direction.get(2, 2), 1e-12);
        assertEquals(0.0, g.magnitude.get(0, 4), 0.0);
    }

    @Test
    public void testMagnitudeIsNonNegative() {
        final IntensityField noise = IntensityField.create(16, 16, (r, c) -> Math.sin((r * 31) + (c * 17)));
        final GradientImages g = SobelGradient.gradient(noise);
        g.magnitude.forEach((r, c, v) -> {
            assertTrue(v >= 0.0);
            assertEquals(Math.hypot(g.dx.get(r, c), g.dy.get(r, c)), v, 1e-9);
        });
        g.direction.forEach((r, c, v) -> assertTrue(v >= 0.0 && v < 180.0));
    }
}
