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
import celltrace.image.Region;
import celltrace.image.StackFile;
import celltrace.plugins.Tracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.Arrays;
import java.util.HashMap;
import java.util.Map;
import java.util.TreeMap;

/**
 * Frame-by-frame tracking: objects of each frame are linked to tracks of previous frames, objects that are not linked start a new track.
 * Track ids are allocated in increasing order starting from 1 and never reused.
 */
public abstract class FrameLinker implements Tracker {
    public final static Logger logger = LoggerFactory.getLogger(FrameLinker.class);
    public static final int MAX_TRACK_ID = 65535;
    private int nextId;

    /**
     * @param frame current frame index
     * @param previousTracks track ids of the previous frame (null at the first frame)
     * @param previousRegions regions of the previous frame, keyed by track id (empty at the first frame)
     * @param labels labels of the current frame
     * @param regions regions of the current frame, keyed by label
     * @return map label -> track id for linked objects of the current frame. Each track id may be used at most once
     */
    protected abstract Map<Integer, Integer> link(int frame, int[] previousTracks, Map<Integer, Region> previousRegions, int[] labels, Map<Integer, Region> regions);

    /**
     * Called before processing a new stack
     */
    protected void reset() {}

    protected int newTrackId() {
        if (nextId>MAX_TRACK_ID) throw new IllegalStateException("Too many tracks: ids exceed "+MAX_TRACK_ID);
        return nextId++;
    }

    @Override
    public boolean track(StackFile labelsIn, StackFile.Writer labelsOut, CancellationToken cancel, ProgressCallback progress) throws IOException {
        if (!Arrays.equals(labelsIn.shape(), labelsOut.shape())) throw new IllegalArgumentException("Input and output shapes differ: "+Arrays.toString(labelsIn.shape())+" vs "+Arrays.toString(labelsOut.shape()));
        int nFrames = labelsIn.sizeT();
        int sizeX = labelsIn.sizeX();
        nextId = 1;
        reset();
        int[] previous = null;
        Map<Integer, Region> previousRegions = new HashMap<>();
        for (int t = 0; t<nFrames; ++t) {
            if (cancel.isCancelled()) {
                logger.info("Tracking cancelled at frame {}", t);
                return false;
            }
            int[] labels = labelsIn.readInt(t);
            Map<Integer, Region> regions = Region.fromLabels(labels, sizeX);
            Map<Integer, Integer> labelToTrack = new HashMap<>(link(t, previous, previousRegions, labels, regions));
            for (int label : regions.keySet()) {
                if (!labelToTrack.containsKey(label)) labelToTrack.put(label, newTrackId());
            }
            int[] tracks = new int[labels.length];
            for (int i = 0; i<labels.length; ++i) {
                if (labels[i]!=0) tracks[i] = labelToTrack.get(labels[i]);
            }
            labelsOut.writeFrame(t, tracks);
            Map<Integer, Region> trackRegions = new TreeMap<>();
            regions.forEach((l, r) -> trackRegions.put(labelToTrack.get(l), r.withLabel(labelToTrack.get(l))));
            previous = tracks;
            previousRegions = trackRegions;
            progress.setProgress(t, nFrames, "Tracking");
        }
        logger.debug("tracking done: {} tracks over {} frames", nextId-1, nFrames);
        return true;
    }
}
