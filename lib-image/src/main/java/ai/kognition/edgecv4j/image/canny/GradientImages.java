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

/**
 * The horizontal and vertical derivative fields along with the magnitude and the
 * (undirected) direction derived from them. All four share the same dimensions.
 */
public class GradientImages {
    public final IntensityField dx;
    public final IntensityField dy;

    /**
     * {@code sqrt(dx^2 + dy^2)}
     */
    public final IntensityField magnitude;

    /**
     * Degrees in [0, 180).
     */
    public final IntensityField direction;

    GradientImages(final IntensityField dx, final IntensityField dy, final IntensityField magnitude, final IntensityField direction) {
        dx.requireSameDimensions(dy, "dy");
        dx.requireSameDimensions(magnitude, "magnitude");
        dx.requireSameDimensions(direction, "direction");
        this.dx = dx;
        this.dy = dy;
        this.magnitude = magnitude;
        this.direction = direction;
    }

    public int rows() {
        return magnitude.rows();
    }

    public int cols() {
        return magnitude.cols();
    }
}
