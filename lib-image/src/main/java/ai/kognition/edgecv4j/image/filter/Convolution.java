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

import ai.kognition.edgecv4j.image.IntensityField;
import ai.kognition.edgecv4j.image.InvalidParameterException;

/**
 * <p>
 * Direct and separable <a href="https://en.wikipedia.org/wiki/Kernel_(image_processing)#Convolution">convolution</a>
 * of an {@link IntensityField}. These are true convolutions, the kernel is flipped, and the output has the
 * same dimensions as the input.
 * </p>
 *
 * <p>
 * Pixels outside of the field are supplied by symmetric reflection about the border, edge pixel included
 * ({@code d c b a | a b c d | d c b a}). The reflection repeats so a kernel can be wider than the field.
 * This is OpenCV's {@code BORDER_REFLECT}.
 * </p>
 */
public final class Convolution {

    private Convolution() {}

    /**
     * Map an index that may be outside of {@code [0, n)} back into it by symmetric reflection.
     */
    public static int reflect(final int index, final int n) {
        if(index >= 0 && index < n)
            return index;
        final int period = 2 * n;
        int m = index % period;
        if(m < 0)
            m += period;
        return m < n ? m : period - 1 - m;
    }

    /**
     * Convolve with a 3x3 kernel.
     *
     * <pre>
     * out[i][j] = sum over a,b in {0,1,2} of kernel[a][b] * in[i + 1 - a][j + 1 - b]
     * </pre>
     */
    public static IntensityField convolve3x3(final IntensityField src, final double[][] kernel) {
        checkKernel3x3(kernel);
        final int rows = src.rows();
        final int cols = src.cols();

        return IntensityField.create(rows, cols, (row, col) -> {
            double sum = 0.0;
            for(int a = 0; a < 3; a++) {
                final int srow = reflect(row + 1 - a, rows);
                final double[] krow = kernel[a];
                for(int b = 0; b < 3; b++)
                    sum += krow[b] * src.get(srow, reflect(col + 1 - b, cols));
            }
            return sum;
        });
    }

    /**
     * Convolve each row with the odd length 1D {@code kernel}.
     */
    public static IntensityField convolveRows(final IntensityField src, final double[] kernel) {
        final int radius = checkKernel1d(kernel);
        final int cols = src.cols();
        return IntensityField.create(src.rows(), cols, (row, col) -> {
            double sum = 0.0;
            for(int k = 0; k < kernel.length; k++)
                sum += kernel[k] * src.get(row, reflect(col + radius - k, cols));
            return sum;
        });
    }

    /**
     * Convolve each column with the odd length 1D {@code kernel}.
     */
    public static IntensityField convolveCols(final IntensityField src, final double[] kernel) {
        final int radius = checkKernel1d(kernel);
        final int rows = src.rows();
        return IntensityField.create(rows, src.cols(), (row, col) -> {
            double sum = 0.0;
            for(int k = 0; k < kernel.length; k++)
                sum += kernel[k] * src.get(reflect(row + radius - k, rows), col);
            return sum;
        });
    }

    /**
     * Convolve the rows then the columns with the same 1D kernel.
     */
    public static IntensityField convolveSeparable(final IntensityField src, final double[] kernel) {
        return convolveCols(convolveRows(src, kernel), kernel);
    }

    private static void checkKernel3x3(final double[][] kernel) {
        if(kernel == null || kernel.length != 3)
            throw new InvalidParameterException("A 3x3 kernel requires exactly 3 rows");
        for(int i = 0; i < 3; i++)
            if(kernel[i] == null || kernel[i].length != 3)
                throw new InvalidParameterException("Row " + i + " of a 3x3 kernel must have exactly 3 entries");
    }

    private static int checkKernel1d(final double[] kernel) {
        if(kernel == null || (kernel.length & 0x01) == 0)
            throw new InvalidParameterException("A 1D kernel must have an odd length so it centers on a pixel");
        return kernel.length / 2;
    }
}
