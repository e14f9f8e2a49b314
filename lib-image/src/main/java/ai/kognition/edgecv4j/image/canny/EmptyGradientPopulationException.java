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

import ai.kognition.edgecv4j.image.EdgeCvException;

/**
 * Thrown when the thresholds need to be derived from the gradient but there's no
 * strictly positive suppressed magnitude to derive them from, as with a flat image.
 */
public class EmptyGradientPopulationException extends EdgeCvException {
    private static final long serialVersionUID = 7750953405931785914L;

    public EmptyGradientPopulationException(final String msg) {
        super(msg);
    }
}
