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

package ai.kognition.edgecv4j.detect;

import java.io.File;
import java.io.IOException;
import java.util.Properties;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import ai.kognition.edgecv4j.image.EdgeCvException;
import ai.kognition.edgecv4j.image.ImageFile;
import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.canny.CannyConfig;
import ai.kognition.edgecv4j.image.canny.CannyEdgeDetector;
import ai.kognition.edgecv4j.image.canny.CannyResult;
import ai.kognition.edgecv4j.util.CommandLineParser;
import ai.kognition.edgecv4j.util.PropertiesUtils;

/**
 * Reads an image, reduces it to gray, runs Canny edge detection and writes the smoothed
 * image, the gradient magnitude and the edge map next to each other in the output directory.
 */
public class EdgeDetect {
    private static final Logger LOGGER = LoggerFactory.getLogger(EdgeDetect.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE = 1;
    public static final int EXIT_FAILED = 2;

    public static final String CONFIG_SECTION = "canny";
    public static final String DEFAULT_EXT = "png";

    public static final String GAUSS_BASENAME = "gauss";
    public static final String MAGNITUDE_BASENAME = "magnitude";
    public static final String EDGES_BASENAME = "edges";

    public static void main(final String[] args) {
        System.exit(run(args));
    }

    static private void usage() {
        System.out.println("usage: java [javaargs] " + EdgeDetect.class.getName()
            + " -i inputImage [-o outputDir] [-ext png] [-sigma 3] [-th1 value] [-th2 value] [-config file.properties]");
        System.out.println("       thresholds that aren't given are derived from the image.");
        System.out.println("       a config file supplies " + CONFIG_SECTION + ".sigma, " + CONFIG_SECTION + ".th1, ... and the command line overrides it.");
    }

    public static int run(final String[] args) {
        final CommandLineParser cl = new CommandLineParser(args);
        if(cl.hasOption("help") || cl.hasOption("-help")) {
            usage();
            return EXIT_USAGE;
        }

        final String input = cl.getProperty("i");
        if(input == null || "true".equals(input)) {
            usage();
            return EXIT_USAGE;
        }
        final File outDir = new File(cl.getProperty("o", "."));
        final String ext = cl.getProperty("ext", DEFAULT_EXT);

        final CannyConfig config;
        try {
            config = configure(cl);
        } catch(final NumberFormatException | EdgeCvException e) {
            LOGGER.error("Bad configuration: {}", e.getMessage());
            usage();
            return EXIT_USAGE;
        } catch(final IOException ioe) {
            LOGGER.error("Couldn't load the configuration file \"{}\"", cl.getProperty("config"), ioe);
            return EXIT_FAILED;
        }

        try {
            final IntensityField image = ImageFile.readIntensityField(input);
            final CannyResult result = new CannyEdgeDetector(config).detect(image);

            if(!outDir.exists() && !outDir.mkdirs())
                throw new IOException("Couldn't create the output directory \"" + outDir.getAbsolutePath() + "\"");

            final File edgesFile = new File(outDir, EDGES_BASENAME + "." + ext);
            ImageFile.writeNormalized(result.smoothed, new File(outDir, GAUSS_BASENAME + "." + ext).getPath());
            ImageFile.writeNormalized(result.magnitude(), new File(outDir, MAGNITUDE_BASENAME + "." + ext).getPath());
            ImageFile.writeEdgeMap(result.edges, edgesFile.getPath());

            LOGGER.info("Edge detection complete. {} edge pixels using {}. The edge map is \"{}\"", result.edges.count(), result.thresholds,
                edgesFile.getPath());
            return EXIT_OK;
        } catch(final EdgeCvException | IOException e) {
            LOGGER.error("Edge detection of \"{}\" failed", input, e);
            return EXIT_FAILED;
        }
    }

    static CannyConfig configure(final CommandLineParser cl) throws IOException {
        final String configFile = cl.getProperty("config");
        final CannyConfig.Builder builder;
        if(configFile != null) {
            final Properties props = PropertiesUtils.loadProps(configFile);
            builder = CannyConfig.fromProperties(props, CONFIG_SECTION).toBuilder();
        } else
            builder = new CannyConfig.Builder();

        final Double sigma = cl.getDouble(CannyConfig.KEY_SIGMA);
        if(sigma != null)
            builder.sigma(sigma);
        final Double th1 = cl.getDouble(CannyConfig.KEY_TH1);
        if(th1 != null)
            builder.th1(th1);
        final Double th2 = cl.getDouble(CannyConfig.KEY_TH2);
        if(th2 != null)
            builder.th2(th2);

        return builder.build();
    }
}
