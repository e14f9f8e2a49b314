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
 * <p>
 * Thins a gradient magnitude ridge down to a single pixel. An interior pixel survives only if
 * it's strictly greater than both of its neighbors across the edge, that is along the gradient's
 * orientation. Otherwise, and always for the outermost ring of pixels, the output is zero.
 * </p>
 *
 * <p>
 * The orientation is quantized into one of four {@link DirectionBucket}s 45 degrees wide.
 * </p>
 */
public final class NonMaxSuppression {

    private NonMaxSuppression() {}

    /**
     * Each bucket names the gradient orientation it covers and the (row, col) offsets of the two
     * neighbors a pixel is compared against.
     */
    public static enum DirectionBucket {
        /**
         * [0, 22.5) and [157.5, 180). Compare left and right.
         */
        DEG_0(0, -1, 0, 1),
        /**
         * [22.5, 67.5). Compare up-right and down-left.
         */
        DEG_45(-1, 1, 1, -1),
        /**
         * [67.5, 112.5). Compare up and down.
         */
        DEG_90(-1, 0, 1, 0),
        /**
         * [112.5, 157.5). Compare up-left and down-right.
         */
        DEG_135(-1, -1, 1, 1);

        public final int dr1;
        public final int dc1;
        public final int dr2;
        public final int dc2;

        private DirectionBucket(final int dr1, final int dc1, final int dr2, final int dc2) {
            this.dr1 = dr1;
            this.dc1 = dc1;
            this.dr2 = dr2;
            this.dc2 = dc2;
        }

        public static DirectionBucket forAngle(final double degrees) {
            if(degrees < 22.5 || degrees >= 157.5)
                return DEG_0;
            else if(degrees < 67.5)
                return DEG_45;
            else if(degrees < 112.5)
                return DEG_90;
            else
                return DEG_135;
        }
    }

    public static IntensityField suppress(final GradientImages gradient) {
        return suppress(gradient.magnitude, gradient.direction);
    }

    /**
     * @param magnitude the gradient magnitude
     * @param direction the gradient orientation in degrees, [0, 180)
     * @return a new field holding the magnitude where it's a strict local maximum across the edge
     * and zero elsewhere.
     */
    public static IntensityField suppress(final IntensityField magnitude, final IntensityField direction) {
        magnitude.requireSameDimensions(direction, "direction");
        final int lastRow = magnitude.rows() - 1;
        final int lastCol = magnitude.cols() - 1;

        return IntensityField.create(magnitude.rows(), magnitude.cols(), (row, col) -> {
            if(row == 0 || col == 0 || row == lastRow || col == lastCol)
                return 0.0;

            final double m = magnitude.get(row, col);
            final DirectionBucket b = DirectionBucket.forAngle(direction.get(row, col));
            // ties are suppressed
            return (m > magnitude.get(row + b.dr1, col + b.dc1) && m > magnitude.get(row + b.dr2, col + b.dc2)) ? m : 0.0;
        });
    }
}
