/*
 * Copyright (C) celltrace contributors
 *
 * This File is part of celltrace
 *
 * celltrace is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * celltrace is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 *
 * You should have received a copy of the GNU General Public License
 * along with celltrace.  If not, see <http://www.gnu.org/licenses/>.
 */
package celltrace.image;

import org.junit.Test;

import java.util.Map;

import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;

public class ImageLabellerTest {

    static boolean[] mask(String... rows) {
        int sizeX = rows[0].length();
        boolean[] res = new boolean[sizeX * rows.length];
        for (int y = 0; y<rows.length; ++y) {
            for (int x = 0; x<sizeX; ++x) res[x + y * sizeX] = rows[y].charAt(x)=='#';
        }
        return res;
    }

    @Test
    public void testConnectivity() {
        boolean[] m = mask(
                "##..#",
                "..#.#",
                "..#..",
                "#...#");
        int[] labels4 = ImageLabeller.labelImageLowConnectivity(m, 5, 4);
        assertArrayEquals(new int[]{
                1, 1, 0, 0, 2,
                0, 0, 3, 0, 2,
                0, 0, 3, 0, 0,
                4, 0, 0, 0, 5}, labels4);
        int[] labels8 = ImageLabeller.labelImage(m, 5, 4);
        assertEquals("diagonal neighbours are merged", labels8[0], labels8[7]);
        assertEquals(labels8[7], labels8[12]);
        assertEquals(4, ImageLabeller.labelImage(m, 5, 4)[19]);
    }

    @Test
    public void testUShape() {
        boolean[] m = mask(
                "#.#",
                "#.#",
                "###");
        int[] labels = ImageLabeller.labelImageLowConnectivity(m, 3, 3);
        for (int i = 0; i<labels.length; ++i) assertEquals(m[i] ? 1 : 0, labels[i]);
    }

    @Test
    public void testBoundingBoxes() {
        int[] labels = new int[]{
                0, 1, 1, 0,
                0, 0, 1, 0,
                2, 0, 0, 0};
        Map<Integer, BoundingBox> boxes = BoundingBox.ofLabels(labels, 4);
        assertEquals(new BoundingBox(0, 1, 2, 3), boxes.get(1));
        assertEquals(new BoundingBox(2, 0, 3, 1), boxes.get(2));
        assertEquals(boxes.get(1), BoundingBox.of(labels, 4, 1));
        assertEquals("padding is clipped to the image", new BoundingBox(0, 0, 3, 4), boxes.get(1).pad(2, 3, 4));
        assertArrayEquals(new boolean[]{true, true, false, true}, boxes.get(1).cropMask(labels, 4, 1));
    }
}
