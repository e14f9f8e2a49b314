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

package ai.kognition.edgecv4j.image.filter;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.InvalidParameterException;

/**
 * A <a href="http://mathworld.wolfram.com/GaussianFunction.html">Gaussian</a> blur is a
 * <a href="http://northstar-www.dartmouth.edu/doc/idl/html_6.2/Filtering_an_Imagehvr.html">low-pass filter</a>. It makes
 * changes more gradual which suppresses noise ahead of differentiation.
 * <p>
 * The 2D kernel is separable so this applies a normalized 1D kernel along the rows and then along the columns.
 * The kernel extends {@code floor(truncate * sigma + 0.5)} pixels either side of center. The border is handled by
 * symmetric reflection (see {@link Convolution#reflect(int, int)}) so the output has the input's dimensions.
 */
public class GaussianBlur {
    private static final Logger LOGGER = LoggerFactory.getLogger(GaussianBlur.class);

    /**
     * Kernel half-width in units of sigma.
     */
    public static final double DEFAULT_TRUNCATE = 4.0;

    /**
     * Anything narrower than this clips a visible part of the Gaussian.
     */
    public static final double MIN_TRUNCATE = 3.0;

    /**
     * The widest kernel that will be built, in pixels either side of center.
     */
    public static final int MAX_RADIUS = 1 << 20;

    private final double sigma;
    private final double truncate;
    private final double[] kernel;

    public GaussianBlur(final double sigma) {
        this(sigma, DEFAULT_TRUNCATE);
    }

    /**
     * @param sigma the standard deviation of the Gaussian in pixels. Must be positive.
     * @param truncate the kernel radius in units of sigma. Must be at least {@link #MIN_TRUNCATE}.
     * @throws InvalidParameterException if either is out of range or the kernel would be wider
     * than {@link #MAX_RADIUS} pixels either side of center.
     */
    public GaussianBlur(final double sigma, final double truncate) {
        if(!Double.isFinite(sigma) || sigma <= 0.0)
            throw new InvalidParameterException("The Gaussian sigma must be a positive number but was " + sigma);
        if(!Double.isFinite(truncate) || truncate < MIN_TRUNCATE)
            throw new InvalidParameterException("The Gaussian kernel must extend at least " + MIN_TRUNCATE + " sigma but truncate was " + truncate);

        this.sigma = sigma;
        this.truncate = truncate;
        this.kernel = makeKernel(sigma, radius(sigma, truncate));

        if(LOGGER.isTraceEnabled())
            LOGGER.trace("Gaussian kernel for sigma {} has radius {} ({} taps)", sigma, radius(), kernel.length);
    }

    public double sigma() {
        return sigma;
    }

    public double truncate() {
        return truncate;
    }

    public int radius() {
        return kernel.length / 2;
    }

    /**
     * @return a copy of the normalized 1D kernel
     */
    public double[] kernel() {
        return kernel.clone();
    }

    /**
     * Blur the field returning a new one of the same dimensions.
     */
    public IntensityField gaussianBlur(final IntensityField field) {
        return Convolution.convolveSeparable(field, kernel);
    }

    public static IntensityField gaussianBlur(final IntensityField field, final double sigma) {
        return new GaussianBlur(sigma).gaussianBlur(field);
    }

    /**
     * The kernel radius for {@code sigma} and {@code truncate}.
     *
     * @throws InvalidParameterException if it's more than {@link #MAX_RADIUS}
     */
    public static int radius(final double sigma, final double truncate) {
        final double ret = Math.floor((truncate * sigma) + 0.5);
        if(ret > MAX_RADIUS)
            throw new InvalidParameterException("A Gaussian with sigma " + sigma + " truncated at " + truncate + " sigma needs a radius of " + ret
                + " pixels but at most " + MAX_RADIUS + " is supported");
        return (int)ret;
    }

    private static double[] makeKernel(final double sigma, final int radius) {
        final double[] ret = new double[(2 * radius) + 1];
        final double denom = 2.0 * sigma * sigma;
        double sum = 0.0;
        for(int k = -radius; k <= radius; k++) {
            final double w = Math.exp(-((double)k * k) / denom);
            ret[k + radius] = w;
            sum += w;
        }
        for(int i = 0; i < ret.length; i++)
            ret[i] /= sum;
        return ret;
    }
}
