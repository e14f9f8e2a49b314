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

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class EdgeMapTest {

    private static final boolean[] DIAGONAL = {
        true,false,false,
        false,true,false
    };

    @Test
    public void testAccess() {
        final EdgeMap map = EdgeMap.of(2, 3, DIAGONAL);
        assertEquals(2, map.rows());
        assertEquals(3, map.cols());
        assertEquals(2, map.count());
        assertTrue(map.isEdge(1, 1));
        assertFalse(map.isEdge(1, 0));
        assertEquals(EdgeMap.EDGE, map.get(0, 0));
        assertEquals(EdgeMap.NOEDGE, map.get(0, 1));
    }

    @Test
    public void testToBytes() {
        final byte[] bytes = EdgeMap.of(2, 3, DIAGONAL).toBytes();
        assertArrayEquals(new byte[] {(byte)255,0,0,0,(byte)255,0}, bytes);
        assertEquals(255, Byte.toUnsignedInt(bytes[0]));
    }

    @Test
    public void testCopiesInput() {
        final boolean[] edges = DIAGONAL.clone();
        final EdgeMap map = EdgeMap.of(2, 3, edges);
        edges[2] = true;
        assertFalse(map.isEdge(0, 2));
    }

    @Test
    public void testSubset() {
        final EdgeMap map = EdgeMap.of(2, 3, DIAGONAL);
        final EdgeMap bigger = EdgeMap.of(2, 3, new boolean[] {true,true,false,false,true,false});
        assertTrue(map.isSubsetOf(bigger));
        assertTrue(map.isSubsetOf(map));
        assertFalse(bigger.isSubsetOf(map));
        assertFalse(map.isSubsetOf(EdgeMap.of(3, 2, DIAGONAL)));
        assertEquals(map, EdgeMap.of(2, 3, DIAGONAL.clone()));
    }

    @Test(expected = InvalidParameterException.class)
    public void testWrongLength() {
        EdgeMap.of(2, 2, DIAGONAL);
    }

    @Test(expected = InvalidParameterException.class)
    public void testEmpty() {
        EdgeMap.of(0, 0, new boolean[0]);
    }
}
