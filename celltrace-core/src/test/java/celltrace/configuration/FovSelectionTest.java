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
package celltrace.configuration;

import org.junit.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.fail;

public class FovSelectionTest {

    @Test
    public void testAll() {
        assertEquals(Arrays.asList(0, 1, 2, 3), FovSelection.parse("all", 4));
        assertEquals(Arrays.asList(0, 1, 2), FovSelection.parse("  ", 3));
        assertEquals(Arrays.asList(0, 1), FovSelection.parse(null, 2));
    }

    @Test
    public void testRangesAndItems() {
        List<Integer> fovs = FovSelection.parse("5, 0-2 ,2-3", 10);
        assertEquals("sorted and distinct", Arrays.asList(0, 1, 2, 3, 5), fovs);
        assertEquals(Arrays.asList(7), FovSelection.parse("7", 8));
        assertEquals(Arrays.asList(4), FovSelection.parse("4-4", 8));
    }

    @Test
    public void testInvalidSelections() {
        for (String s : new String[]{"0;1", "3-1", "-1", "a", "1,,2", "2-x"}) {
            try {
                FovSelection.parse(s, 10);
                fail("selection should be rejected: "+s);
            } catch (IllegalArgumentException e) {
                // expected
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testOutOfRange() {
        FovSelection.parse("0-4", 4);
    }
}
