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

import javax.imageio.ImageIO;

import java.awt.color.ColorSpace;
import java.awt.image.BufferedImage;
import java.awt.image.IndexColorModel;
import java.awt.image.Raster;
import java.awt.image.WritableRaster;
import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.Locale;

import org.apache.commons.io.FilenameUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Moves {@link IntensityField}s and {@link EdgeMap}s in and out of image files using the
 * {@link ImageIO} codecs registered on the classpath.
 */
public class ImageFile {
    private static final Logger LOGGER = LoggerFactory.getLogger(ImageFile.class);

    /**
     * Luminance weights (ITU-R BT.709) used to reduce RGB to gray.
     */
    public static final double RED_WEIGHT = 0.2125;
    public static final double GREEN_WEIGHT = 0.7154;
    public static final double BLUE_WEIGHT = 0.0721;

    public static BufferedImage readBufferedImageFromFile(final String filename) throws IOException {
        final File file = new File(filename);
        if(!file.exists())
            throw new FileNotFoundException("Failed to read image from \"" + file.getAbsolutePath() + "\" because it doesn't exist.");

        final BufferedImage ret = ImageIO.read(file);
        if(ret == null)
            throw new IOException("Failed to read image from \"" + file.getAbsolutePath() + "\" because no installed codec understands it.");
        LOGGER.trace("Read {}x{} image of type {} from {}", ret.getWidth(), ret.getHeight(), ret.getType(), filename);
        return ret;
    }

    /**
     * <p>
     * Read an image file as a grayscale field with samples normalized to [0, 1].
     * </p>
     *
     * <p>
     * A single band gray image is divided by the largest value its sample depth can hold (255 for 8-bit,
     * 65535 for 16-bit). Anything else is converted to 8-bit RGB and reduced to gray with
     * {@code 0.2125 R + 0.7154 G + 0.0721 B}. Alpha is ignored.
     * </p>
     */
    public static IntensityField readIntensityField(final String filename) throws IOException {
        return toIntensityField(readBufferedImageFromFile(filename));
    }

    public static IntensityField toIntensityField(final BufferedImage image) {
        final Raster raster = image.getRaster();
        final boolean isGray = raster.getNumBands() == 1 && !(image.getColorModel() instanceof IndexColorModel)
            && image.getColorModel().getColorSpace().getType() == ColorSpace.TYPE_GRAY;

        if(isGray) {
            final int bits = raster.getSampleModel().getSampleSize(0);
            final double maxVal = (double)((1L << bits) - 1);
            LOGGER.debug("Reading {}-bit gray image", bits);
            return IntensityField.create(image.getHeight(), image.getWidth(), (row, col) -> raster.getSample(col, row, 0) / maxVal);
        }

        LOGGER.debug("Converting image of type {} to gray", image.getType());
        return IntensityField.create(image.getHeight(), image.getWidth(), (row, col) -> {
            final int rgb = image.getRGB(col, row);
            final double r = ((rgb >> 16) & 0xff) / 255.0;
            final double g = ((rgb >> 8) & 0xff) / 255.0;
            final double b = (rgb & 0xff) / 255.0;
            return (RED_WEIGHT * r) + (GREEN_WEIGHT * g) + (BLUE_WEIGHT * b);
        });
    }

    /**
     * Render the field as 8-bit gray scaled so its maximum maps to 255. Values are truncated and
     * anything negative is clamped to 0. A field whose maximum isn't positive renders black.
     */
    public static BufferedImage toBufferedImage(final IntensityField field) {
        final double max = field.max();
        final double scale = max > 0.0 ? 255.0 / max : 0.0;
        final byte[] pixels = new byte[field.size()];
        for(int pos = 0; pos < pixels.length; pos++) {
            final int v = (int)(field.get(pos) * scale);
            pixels[pos] = (byte)(v < 0 ? 0 : (v > 255 ? 255 : v));
        }
        return grayImage(field.rows(), field.cols(), pixels);
    }

    public static BufferedImage toBufferedImage(final EdgeMap edges) {
        return grayImage(edges.rows(), edges.cols(), edges.toBytes());
    }

    public static void writeNormalized(final IntensityField field, final String filename) throws IOException {
        writeImageFile(toBufferedImage(field), filename);
    }

    public static void writeEdgeMap(final EdgeMap edges, final String filename) throws IOException {
        writeImageFile(toBufferedImage(edges), filename);
    }

    /**
     * Write the image in the format named by the file's extension.
     */
    public static void writeImageFile(final BufferedImage image, final String filename) throws IOException {
        final String ext = FilenameUtils.getExtension(filename);
        if(ext == null || ext.isEmpty())
            throw new IOException("Can't determine the image format for \"" + filename + "\" since it has no extension.");

        final String format = ext.toLowerCase(Locale.ROOT);
        if(!ImageIO.write(image, format, new File(filename)))
            throw new IOException("Failed to write \"" + filename + "\" since no installed codec writes \"" + format + "\" images.");
        LOGGER.debug("Wrote {}x{} {} image to {}", image.getWidth(), image.getHeight(), format, filename);
    }

    private static BufferedImage grayImage(final int rows, final int cols, final byte[] pixels) {
        final BufferedImage ret = new BufferedImage(cols, rows, BufferedImage.TYPE_BYTE_GRAY);
        final WritableRaster raster = ret.getRaster();
        raster.setDataElements(0, 0, cols, rows, pixels);
        return ret;
    }
}
