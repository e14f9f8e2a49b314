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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.edgecv4j.image.EdgeMap;
import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.InvalidParameterException;
import ai.kognition.edgecv4j.image.filter.GaussianBlur;
import ai.kognition.edgecv4j.util.Timer;

/**
 * <p>
 * <a href="https://en.wikipedia.org/wiki/Canny_edge_detector">Canny</a> edge detection of a grayscale
 * {@link IntensityField}:
 * </p>
 *
 * <ol>
 * <li>{@link GaussianBlur} with the configured sigma</li>
 * <li>{@link SobelGradient} for the derivatives, magnitude and direction</li>
 * <li>{@link NonMaxSuppression} to thin the magnitude</li>
 * <li>{@link ThresholdSelector} for any threshold that isn't configured</li>
 * <li>{@link HysteresisLinker} to produce the final {@link EdgeMap}</li>
 * </ol>
 *
 * <p>
 * Each stage reads the previous stage's output and produces a new field. The detector holds nothing
 * but its configuration so a single instance can be shared between threads.
 * </p>
 */
public class CannyEdgeDetector {
    private static final Logger LOGGER = LoggerFactory.getLogger(CannyEdgeDetector.class);

    private final CannyConfig config;
    private final GaussianBlur blur;

    public CannyEdgeDetector() {
        this(CannyConfig.DEFAULTS);
    }

    public CannyEdgeDetector(final CannyConfig config) {
        if(config == null)
            throw new InvalidParameterException("A " + CannyEdgeDetector.class.getSimpleName() + " requires a configuration");
        this.config = config;
        this.blur = new GaussianBlur(config.sigma, config.truncate);
    }

    public CannyConfig config() {
        return config;
    }

    /**
     * Detect the edges in a grayscale image, normally with samples in [0, 1].
     *
     * @throws InvalidParameterException if {@code image} is null
     * @throws EmptyGradientPopulationException if th2 needs to be derived and the image has no gradient
     */
    public CannyResult detect(final IntensityField image) {
        if(image == null)
            throw new InvalidParameterException("Can't detect edges in a null image");

        LOGGER.debug("Detecting edges in a {}x{} image using {}", image.rows(), image.cols(), config);
        final Timer timer = Timer.started();

        final IntensityField smoothed = blur.gaussianBlur(image);
        LOGGER.debug("Gaussian blur took {} seconds", timer.stop());

        timer.start();
        final GradientImages gradient = SobelGradient.gradient(smoothed);
        LOGGER.debug("Gradient took {} seconds", timer.stop());

        timer.start();
        final IntensityField suppressed = NonMaxSuppression.suppress(gradient);
        LOGGER.debug("Non-maximum suppression took {} seconds", timer.stop());

        final Thresholds thresholds = ThresholdSelector.select(suppressed, config);

        timer.start();
        final EdgeMap edges = HysteresisLinker.link(suppressed, thresholds);
        LOGGER.debug("Hysteresis took {} seconds and found {} edge pixels", timer.stop(), edges.count());

        return new CannyResult(smoothed, gradient, suppressed, thresholds, edges);
    }

    public static CannyResult detect(final IntensityField image, final CannyConfig config) {
        return new CannyEdgeDetector(config).detect(image);
    }
}
