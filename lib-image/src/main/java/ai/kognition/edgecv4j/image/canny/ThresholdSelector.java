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

import java.util.OptionalDouble;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.calc.Percentile;

/**
 * Resolves the hysteresis thresholds. A threshold that's supplied is used as is. When th2 is unset
 * it's the {@code percentile}th percentile of the strictly positive suppressed magnitudes. When th1
 * is unset it's {@code lowRatio * th2}, using th2 after it's resolved whether it was supplied or not.
 */
public final class ThresholdSelector {
    private static final Logger LOGGER = LoggerFactory.getLogger(ThresholdSelector.class);

    private ThresholdSelector() {}

    public static Thresholds select(final IntensityField suppressed, final CannyConfig config) {
        return select(suppressed, config.th1, config.th2, config.percentile, config.lowRatio);
    }

    /**
     * @throws EmptyGradientPopulationException if th2 needs deriving and there isn't a single strictly
     * positive value in {@code suppressed}.
     */
    public static Thresholds select(final IntensityField suppressed, final OptionalDouble th1, final OptionalDouble th2, final double percentile,
        final double lowRatio) {
        if(th1.isPresent() && th2.isPresent())
            return new Thresholds(th1.getAsDouble(), th2.getAsDouble());

        final double high;
        if(th2.isPresent())
            high = th2.getAsDouble();
        else {
            final Percentile population = Percentile.ofPositive(suppressed);
            if(population.isEmpty())
                throw new EmptyGradientPopulationException("Can't derive th2 from a " + suppressed.rows() + "x" + suppressed.cols()
                    + " gradient that has no positive magnitude. Either the image is flat or th2 needs to be supplied.");
            high = population.valueAt(percentile);
            LOGGER.debug("th2 is the {} percentile of {} positive magnitudes", percentile, population.size());
        }
        final double low = th1.isPresent() ? th1.getAsDouble() : lowRatio * high;

        LOGGER.debug("Resolved th1={}{}, th2={}{}", low, th1.isPresent() ? "" : " (derived)", high, th2.isPresent() ? "" : " (derived)");
        return new Thresholds(low, high);
    }
}
