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

import java.util.Arrays;

/**
 * Immutable binary edge / no-edge grid. Rendered, the map is 8-bit gray with
 * {@link #EDGE} where there's an edge and {@link #NOEDGE} elsewhere.
 */
public final class EdgeMap {
    public static final int EDGE = 255;
    public static final int NOEDGE = 0;

    public static final byte EDGE_BYTE = (byte)-1;
    public static final byte NOEDGE_BYTE = (byte)0;

    private final int rows;
    private final int cols;
    private final boolean[] edges;

    private EdgeMap(final int rows, final int cols, final boolean[] edges) {
        this.rows = rows;
        this.cols = cols;
        this.edges = edges;
    }

    /**
     * Copies the row-major {@code edges}.
     */
    public static EdgeMap of(final int rows, final int cols, final boolean[] edges) {
        if(rows <= 0 || cols <= 0)
            throw new InvalidParameterException("An " + EdgeMap.class.getSimpleName() + " must be at least 1x1 but " + rows + "x" + cols
                + " was requested");
        if(edges == null || edges.length != rows * cols)
            throw new InvalidParameterException("An " + rows + "x" + cols + " " + EdgeMap.class.getSimpleName() + " needs " + (rows * cols)
                + " entries but was given " + (edges == null ? "null" : Integer.toString(edges.length)));
        return new EdgeMap(rows, cols, Arrays.copyOf(edges, edges.length));
    }

    public int rows() {
        return rows;
    }

    public int cols() {
        return cols;
    }

    public boolean isEdge(final int row, final int col) {
        return edges[(row * cols) + col];
    }

    /**
     * @return {@link #EDGE} or {@link #NOEDGE}
     */
    public int get(final int row, final int col) {
        return isEdge(row, col) ? EDGE : NOEDGE;
    }

    /**
     * The number of edge pixels.
     */
    public int count() {
        int ret = 0;
        for(final boolean e: edges)
            if(e) ret++;
        return ret;
    }

    /**
     * Row-major 8-bit rendering of the map.
     */
    public byte[] toBytes() {
        final byte[] ret = new byte[edges.length];
        for(int i = 0; i < edges.length; i++)
            ret[i] = edges[i] ? EDGE_BYTE : NOEDGE_BYTE;
        return ret;
    }

    /**
     * @return true if every edge in this map is also an edge in {@code other}
     */
    public boolean isSubsetOf(final EdgeMap other) {
        if(other == null || other.rows != rows || other.cols != cols)
            return false;
        for(int i = 0; i < edges.length; i++)
            if(edges[i] && !other.edges[i])
                return false;
        return true;
    }

    @Override
    public int hashCode() {
        final int prime = 31;
        int result = 1;
        result = prime * result + rows;
        result = prime * result + cols;
        result = prime * result + Arrays.hashCode(edges);
        return result;
    }

    @Override
    public boolean equals(final Object obj) {
        if(this == obj)
            return true;
        if(obj == null || getClass() != obj.getClass())
            return false;
        final EdgeMap other = (EdgeMap)obj;
        return rows == other.rows && cols == other.cols && Arrays.equals(edges, other.edges);
    }

    @Override
    public String toString() {
        final StringBuilder sb = new StringBuilder(EdgeMap.class.getSimpleName()).append("[").append(rows).append("x").append(cols).append("]");
        for(int row = 0; row < rows; row++) {
            sb.append(System.lineSeparator());
            for(int col = 0; col < cols; col++)
                sb.append(isEdge(row, col) ? '#' : '.');
        }
        return sb.toString();
    }
}
