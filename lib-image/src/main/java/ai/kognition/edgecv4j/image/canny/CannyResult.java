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

import ai.kognition.edgecv4j.image.EdgeMap;
import ai.kognition.edgecv4j.image.IntensityField;

/**
 * Everything a {@link CannyEdgeDetector} run produces. The smoothed field, the gradient
 * magnitude and the edge map are the primary outputs, the rest is kept for inspection.
 */
public class CannyResult {
    public final IntensityField smoothed;
    public final GradientImages gradient;
    public final IntensityField suppressed;
    public final Thresholds thresholds;
    public final EdgeMap edges;

    CannyResult(final IntensityField smoothed, final GradientImages gradient, final IntensityField suppressed, final Thresholds thresholds,
        final EdgeMap edges) {
        this.smoothed = smoothed;
        this.gradient = gradient;
        this.suppressed = suppressed;
        this.thresholds = thresholds;
        this.edges = edges;
    }

    /**
     * The gradient magnitude before suppression.
     */
    public IntensityField magnitude() {
        return gradient.magnitude;
    }
}
