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

/**
 * <p>
 * Double threshold edge linking. Every pixel above the high threshold is a strong edge and seeds
 * a flood fill that spreads through 8-connected neighbors at or above the low threshold. A pixel
 * ends up an edge if and only if it's connected through such pixels to at least one seed (itself
 * included).
 * </p>
 *
 * <p>
 * The frontier is a FIFO over flat pixel indexes in a preallocated array. A pixel is marked before
 * it's enqueued and a marked pixel is never enqueued again so the array never needs more than
 * rows x cols entries.
 * </p>
 */
public final class HysteresisLinker {
    private static final Logger LOGGER = LoggerFactory.getLogger(HysteresisLinker.class);

    private static final int[] NEIGHBOR_DR = {-1, -1, -1, 0, 0, 1, 1, 1};
    private static final int[] NEIGHBOR_DC = {-1, 0, 1, -1, 1, -1, 0, 1};

    private HysteresisLinker() {}

    public static EdgeMap link(final IntensityField suppressed, final Thresholds thresholds) {
        final int rows = suppressed.rows();
        final int cols = suppressed.cols();
        final int size = suppressed.size();
        final double low = thresholds.low;
        final double high = thresholds.high;

        final boolean[] marked = new boolean[size];
        final int[] frontier = new int[size];
        int head = 0;
        int tail = 0;

        for(int pos = 0; pos < size; pos++) {
            if(suppressed.get(pos) > high) {
                marked[pos] = true;
                frontier[tail++] = pos;
            }
        }
        final int seeds = tail;

        while(head < tail) {
            final int pos = frontier[head++];
            final int row = pos / cols;
            final int col = pos - (row * cols);

            for(int n = 0; n < NEIGHBOR_DR.length; n++) {
                final int nrow = row + NEIGHBOR_DR[n];
                final int ncol = col + NEIGHBOR_DC[n];
                if(nrow < 0 || nrow >= rows || ncol < 0 || ncol >= cols)
                    continue;
                final int npos = (nrow * cols) + ncol;
                if(!marked[npos] && suppressed.get(npos) >= low) {
                    marked[npos] = true;
                    frontier[tail++] = npos;
                }
            }
        }

        LOGGER.debug("{} strong seeds grew to {} edge pixels", seeds, tail);
        return EdgeMap.of(rows, cols, marked);
    }

    /**
     * The per-pixel {@link EdgeClass} ahead of linking, {@code [rows][cols]}.
     */
    public static EdgeClass[][] classify(final IntensityField suppressed, final Thresholds thresholds) {
        final EdgeClass[][] ret = new EdgeClass[suppressed.rows()][suppressed.cols()];
        suppressed.forEach((row, col, value) -> ret[row][col] = EdgeClass.of(value, thresholds));
        return ret;
    }
}
