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
import celltrace.core.ProgressCallback;
import celltrace.image.PixelType;
import celltrace.image.StackFile;
import celltrace.plugins.Tracker;

import java.io.File;
import java.io.IOException;

public class TrackerTestUtils {

    /**
     * Square objects: {x, y, side} per object per frame. Labels follow the object order of each frame.
     */
    public static int[] frame(int sizeX, int sizeY, int[]... objects) {
        int[] res = new int[sizeX * sizeY];
        for (int o = 0; o<objects.length; ++o) {
            int[] ob = objects[o];
            for (int y = ob[1]; y<ob[1]+ob[2]; ++y) for (int x = ob[0]; x<ob[0]+ob[2]; ++x) res[x + y * sizeX] = o + 1;
        }
        return res;
    }

    public static int[][] track(Tracker tracker, File dir, int sizeX, int sizeY, int[]... frames) throws IOException {
        File in = new File(dir, "in.stack"), out = new File(dir, "out.stack");
        try (StackFile.Writer w = StackFile.create(in, PixelType.UINT16, frames.length, sizeY, sizeX)) {
            for (int t = 0; t<frames.length; ++t) w.writeFrame(t, frames[t]);
            w.commit();
        }
        try (StackFile s = StackFile.open(in); StackFile.Writer w = StackFile.create(out, PixelType.UINT16, frames.length, sizeY, sizeX)) {
            if (!tracker.track(s, w, new CancellationToken(), ProgressCallback.NONE)) throw new IllegalStateException("tracking interrupted");
            w.commit();
        }
        int[][] res = new int[frames.length][];
        try (StackFile s = StackFile.open(out)) {
            for (int t = 0; t<frames.length; ++t) res[t] = s.readInt(t);
        }
        in.delete();
        out.delete();
        return res;
    }

    /**
     * @return track id at the top-left corner of the object
     */
    public static int idAt(int[] tracks, int sizeX, int x, int y) {
        return tracks[x + y * sizeX];
    }
}
