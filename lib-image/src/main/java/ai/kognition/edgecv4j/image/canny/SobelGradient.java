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

import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.filter.Convolution;

/**
 * Estimates the gradient of a (smoothed) field with the 3x3 Sobel operators.
 */
public final class SobelGradient {

    public static final double[][] SOBEL_X = {
        {-1, 0, 1},
        {-2, 0, 2},
        {-1, 0, 1}
    };

    public static final double[][] SOBEL_Y = {
        {-1, -2, -1},
        {0, 0, 0},
        {1, 2, 1}
    };

    private SobelGradient() {}

    public static GradientImages gradient(final IntensityField smoothed) {
        final IntensityField dx = Convolution.convolve3x3(smoothed, SOBEL_X);
        final IntensityField dy = Convolution.convolve3x3(smoothed, SOBEL_Y);

        final IntensityField magnitude = IntensityField.create(dx.rows(), dx.cols(), (row, col) -> {
            final double gx = dx.get(row, col);
            final double gy = dy.get(row, col);
            return Math.sqrt((gx * gx) + (gy * gy));
        });
        final IntensityField direction = IntensityField.create(dx.rows(), dx.cols(),
            (row, col) -> direction(dx.get(row, col), dy.get(row, col)));

        return new GradientImages(dx, dy, magnitude, direction);
    }

    /**
     * The orientation of the gradient in degrees folded into [0, 180). An edge has no
     * sense of direction so a gradient and its negation are the same orientation.
     */
    public static double direction(final double gx, final double gy) {
        double deg = Math.toDegrees(Math.atan2(gy, gx));
        if(deg < 0.0)
            deg += 180.0;
        // atan2 returns +pi when gy is +0.0 and gx is negative
        return deg >= 180.0 ? deg - 180.0 : deg;
    }
}
