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

/**
 * The resolved hysteresis thresholds.
 */
public class Thresholds {
    /**
     * th1. Pixels at or above this may join an edge.
     */
    public final double low;

    /**
     * th2. Pixels strictly above this seed an edge.
     */
    public final double high;

    public Thresholds(final double low, final double high) {
        this.low = low;
        this.high = high;
    }

    @Override
    public String toString() {
        return "Thresholds [low=" + low + ", high=" + high + "]";
    }
}
