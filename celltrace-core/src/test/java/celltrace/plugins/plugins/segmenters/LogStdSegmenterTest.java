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
package celltrace.plugins.plugins.segmenters;

import celltrace.image.Region;
import celltrace.test_utils.SyntheticAcquisition;
import org.junit.Test;

import java.io.IOException;
import java.util.Map;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class LogStdSegmenterTest {

    static float[] toFloat(short[] frame) {
        float[] res = new float[frame.length];
        for (int i = 0; i<frame.length; ++i) res[i] = frame[i] & 0xffff;
        return res;
    }

    @Test
    public void testSegmentDiscs() throws IOException {
        SyntheticAcquisition acq = new SyntheticAcquisition(1, 1, 1);
        int size = SyntheticAcquisition.SIZE;
        int[] labels = new LogStdSegmenter().segment(toFloat(acq.readFrame(0, 0, 0)), size, size);
        Map<Integer, Region> regions = Region.fromLabels(labels, size);
        assertEquals("one object per disc", 2, regions.size());
        double expectedArea = Math.PI * SyntheticAcquisition.RADIUS * SyntheticAcquisition.RADIUS;
        for (Region r : regions.values()) {
            assertEquals("area of "+r, expectedArea, r.size(), expectedArea * 0.3);
        }
        Region first = regions.get(1);
        assertEquals(SyntheticAcquisition.CENTERS[0][0], first.getCenterX(), 2);
        assertEquals(SyntheticAcquisition.CENTERS[0][1], first.getCenterY(), 2);
        assertTrue(labels[0]==0);
    }

    @Test
    public void testThreshold() {
        float[] values = new float[1000];
        for (int i = 0; i<900; ++i) values[i] = 1 + (i % 3) * 0.01f;
        for (int i = 900; i<1000; ++i) values[i] = 5;
        double thld = LogStdSegmenter.getThreshold(values, 200, 3);
        assertTrue("threshold "+thld, thld>1 && thld<5);
    }
}
