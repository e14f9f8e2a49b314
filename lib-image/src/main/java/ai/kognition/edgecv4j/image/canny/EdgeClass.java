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
 * The hysteresis classification of a single suppressed magnitude.
 */
public enum EdgeClass {
    NONE, WEAK, STRONG;

    /**
     * {@code STRONG} above {@code high}, otherwise {@code WEAK} at or above {@code low}, otherwise {@code NONE}.
     */
    public static EdgeClass of(final double magnitude, final Thresholds thresholds) {
        if(magnitude > thresholds.high)
            return STRONG;
        return magnitude >= thresholds.low ? WEAK : NONE;
    }
}
