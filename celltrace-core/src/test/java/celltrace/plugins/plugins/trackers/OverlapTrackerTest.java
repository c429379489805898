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
package celltrace.plugins.plugins.trackers;

import celltrace.core.CancellationToken;
import celltrace.image.PixelType;
import celltrace.image.StackFile;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;

import static celltrace.plugins.plugins.trackers.TrackerTestUtils.frame;
import static celltrace.plugins.plugins.trackers.TrackerTestUtils.idAt;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertTrue;

public class OverlapTrackerTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();
    static final int W = 40, H = 20;

    @Test
    public void testIdsStableThroughDrift() throws IOException {
        int[][] tracks = TrackerTestUtils.track(new OverlapTracker(), testFolder.getRoot(), W, H,
                frame(W, H, new int[]{2, 2, 6}, new int[]{20, 2, 6}),
                // labels swapped: order of objects differs from previous frame
                frame(W, H, new int[]{21, 3, 6}, new int[]{3, 2, 6}),
                frame(W, H, new int[]{4, 3, 6}, new int[]{22, 3, 6}));
        assertEquals(1, idAt(tracks[0], W, 2, 2));
        assertEquals(2, idAt(tracks[0], W, 20, 2));
        assertEquals(1, idAt(tracks[1], W, 3, 2));
        assertEquals(2, idAt(tracks[1], W, 21, 3));
        assertEquals(1, idAt(tracks[2], W, 4, 3));
        assertEquals(2, idAt(tracks[2], W, 22, 3));
    }

    @Test
    public void testNewAndLostObjects() throws IOException {
        int[][] tracks = TrackerTestUtils.track(new OverlapTracker(), testFolder.getRoot(), W, H,
                frame(W, H, new int[]{2, 2, 6}, new int[]{20, 2, 6}),
                frame(W, H, new int[]{2, 2, 6}),
                // object reappears at a previous location and a new object appears: both get new ids
                frame(W, H, new int[]{2, 2, 6}, new int[]{20, 2, 6}, new int[]{30, 10, 4}));
        assertEquals(1, idAt(tracks[1], W, 2, 2));
        assertEquals(1, idAt(tracks[2], W, 2, 2));
        assertEquals("ids are never reused", 3, idAt(tracks[2], W, 20, 2));
        assertEquals(4, idAt(tracks[2], W, 30, 10));
    }

    @Test
    public void testNoOverlapStartsNewTrack() throws IOException {
        int[][] tracks = TrackerTestUtils.track(new OverlapTracker(), testFolder.getRoot(), W, H,
                frame(W, H, new int[]{2, 2, 6}),
                frame(W, H, new int[]{10, 2, 6}));
        assertEquals(2, idAt(tracks[1], W, 10, 2));
    }

    @Test
    public void testCancellation() throws IOException {
        File in = new File(testFolder.getRoot(), "in.stack");
        try (StackFile.Writer w = StackFile.create(in, PixelType.UINT16, 2, H, W)) {
            w.commit();
        }
        CancellationToken cancel = new CancellationToken();
        assertTrue(cancel.cancel());
        assertFalse("cancel is idempotent", cancel.cancel());
        File out = new File(testFolder.getRoot(), "out.stack");
        try (StackFile s = StackFile.open(in); StackFile.Writer w = StackFile.create(out, PixelType.UINT16, 2, H, W)) {
            assertFalse(new OverlapTracker().track(s, w, cancel, (c, t, m) -> { throw new AssertionError("no progress expected"); }));
        }
        assertFalse(out.exists());
    }
}
