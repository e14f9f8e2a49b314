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

package ai.kognition.edgecv4j.image;

/**
 * Thrown when a caller supplies something the pipeline can't work with: a
 * non-positive smoothing scale, an empty or ragged grid, non-finite samples,
 * out of range configuration or fields whose dimensions don't agree.
 */
public class InvalidParameterException extends EdgeCvException {
    private static final long serialVersionUID = -2212985470396128541L;

    public InvalidParameterException(final String msg) {
        super(msg);
    }

    public InvalidParameterException(final String msg, final Throwable th) {
        super(msg, th);
    }
}
