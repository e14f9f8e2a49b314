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
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.edgecv4j.image.InvalidParameterException;
import ai.kognition.edgecv4j.image.filter.GaussianBlur;
import ai.kognition.edgecv4j.util.PropertiesUtils;

/**
 * <p>
 * Immutable settings for a {@link CannyEdgeDetector} run. Either threshold may be left unset in which
 * case it's derived from the suppressed gradient magnitude (see {@link ThresholdSelector}).
 * </p>
 *
 * <pre>
 * <code>
 * CannyConfig config = new CannyConfig.Builder()
 *     .sigma(1.5)
 *     .th2(0.2)
 *     .build();
 * </code>
 * </pre>
 */
public final class CannyConfig {
    private static final Logger LOGGER = LoggerFactory.getLogger(CannyConfig.class);

    public static final double DEFAULT_SIGMA = 3.0;
    public static final double DEFAULT_PERCENTILE = 70.0;
    public static final double DEFAULT_LOW_RATIO = 0.4;
    public static final double DEFAULT_TRUNCATE = GaussianBlur.DEFAULT_TRUNCATE;

    public static final String KEY_SIGMA = "sigma";
    public static final String KEY_TH1 = "th1";
    public static final String KEY_TH2 = "th2";
    public static final String KEY_PERCENTILE = "percentile";
    public static final String KEY_LOW_RATIO = "lowRatio";
    public static final String KEY_TRUNCATE = "truncate";

    public static final CannyConfig DEFAULTS = new Builder().build();

    public final double sigma;
    public final OptionalDouble th1;
    public final OptionalDouble th2;
    public final double percentile;
    public final double lowRatio;
    public final double truncate;

    private CannyConfig(final Builder b) {
        sigma = b.sigma;
        th1 = b.th1;
        th2 = b.th2;
        percentile = b.percentile;
        lowRatio = b.lowRatio;
        truncate = b.truncate;
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    /**
     * Read the settings under {@code sectionName} (for example {@code canny.sigma}, {@code canny.th2}).
     * Keys that aren't present keep their defaults.
     *
     * @throws InvalidParameterException if a value isn't a number or is out of range
     */
    public static CannyConfig fromProperties(final Properties props, final String sectionName) {
        final Properties section = PropertiesUtils.getSection(props, sectionName, true);
        final Builder b = new Builder();
        final String prefix = sectionName + PropertiesUtils.separator;

        final Double sigma = parse(section, KEY_SIGMA, prefix);
        if(sigma != null) b.sigma(sigma);
        final Double th1 = parse(section, KEY_TH1, prefix);
        if(th1 != null) b.th1(th1);
        final Double th2 = parse(section, KEY_TH2, prefix);
        if(th2 != null) b.th2(th2);
        final Double percentile = parse(section, KEY_PERCENTILE, prefix);
        if(percentile != null) b.percentile(percentile);
        final Double lowRatio = parse(section, KEY_LOW_RATIO, prefix);
        if(lowRatio != null) b.lowRatio(lowRatio);
        final Double truncate = parse(section, KEY_TRUNCATE, prefix);
        if(truncate != null) b.truncate(truncate);

        return b.build();
    }

    private static Double parse(final Properties section, final String key, final String prefix) {
        final String val = section.getProperty(key);
        if(val == null || val.trim().isEmpty())
            return null;
        try {
            return Double.valueOf(val.trim());
        } catch(final NumberFormatException nfe) {
            throw new InvalidParameterException("The property \"" + prefix + key + "\" should be a number but is \"" + val + "\"", nfe);
        }
    }

    @Override
    public String toString() {
        return "CannyConfig [sigma=" + sigma + ", th1=" + (th1.isPresent() ? th1.getAsDouble() : "derived") + ", th2="
            + (th2.isPresent() ? th2.getAsDouble() : "derived") + ", percentile=" + percentile + ", lowRatio=" + lowRatio + ", truncate=" + truncate + "]";
    }

    public static class Builder {
        private double sigma = DEFAULT_SIGMA;
        private OptionalDouble th1 = OptionalDouble.empty();
        private OptionalDouble th2 = OptionalDouble.empty();
        private double percentile = DEFAULT_PERCENTILE;
        private double lowRatio = DEFAULT_LOW_RATIO;
        private double truncate = DEFAULT_TRUNCATE;

        public Builder() {}

        private Builder(final CannyConfig c) {
            sigma = c.sigma;
            th1 = c.th1;
            th2 = c.th2;
            percentile = c.percentile;
            lowRatio = c.lowRatio;
            truncate = c.truncate;
        }

        public Builder sigma(final double sigma) {
            this.sigma = sigma;
            return this;
        }

        public Builder th1(final double th1) {
            this.th1 = OptionalDouble.of(th1);
            return this;
        }

        public Builder th2(final double th2) {
            this.th2 = OptionalDouble.of(th2);
            return this;
        }

        /**
         * Derive th1 from the gradient.
         */
        public Builder deriveTh1() {
            this.th1 = OptionalDouble.empty();
            return this;
        }

        /**
         * Derive th2 from the gradient.
         */
        public Builder deriveTh2() {
            this.th2 = OptionalDouble.empty();
            return this;
        }

        public Builder percentile(final double percentile) {
            this.percentile = percentile;
            return this;
        }

        public Builder lowRatio(final double lowRatio) {
            this.lowRatio = lowRatio;
            return this;
        }

        public Builder truncate(final double truncate) {
            this.truncate = truncate;
            return this;
        }

        public CannyConfig build() {
            if(!Double.isFinite(sigma) || sigma <= 0.0)
                throw new InvalidParameterException("sigma must be a positive number but was " + sigma);
            checkThreshold(KEY_TH1, th1);
            checkThreshold(KEY_TH2, th2);
            if(!(percentile > 0.0 && percentile <= 100.0))
                throw new InvalidParameterException("percentile must be within (0, 100] but was " + percentile);
            if(!Double.isFinite(lowRatio) || lowRatio <= 0.0)
                throw new InvalidParameterException("lowRatio must be a positive number but was " + lowRatio);
            if(!Double.isFinite(truncate) || truncate < GaussianBlur.MIN_TRUNCATE)
                throw new InvalidParameterException("truncate must be at least " + GaussianBlur.MIN_TRUNCATE + " but was " + truncate);
            GaussianBlur.radius(sigma, truncate);

            if(th1.isPresent() && th2.isPresent() && th1.getAsDouble() > th2.getAsDouble())
                LOGGER.warn("th1 ({}) is greater than th2 ({}) so no pixel can be a weak edge", th1.getAsDouble(), th2.getAsDouble());

            return new CannyConfig(this);
        }

        private static void checkThreshold(final String name, final OptionalDouble th) {
            if(th.isPresent()) {
                final double v = th.getAsDouble();
                if(!Double.isFinite(v) || v < 0.0)
                    throw new InvalidParameterException(name + " must be a non-negative number but was " + v);
            }
        }
    }
}
