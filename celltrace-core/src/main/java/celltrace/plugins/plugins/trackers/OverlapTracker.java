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

import celltrace.image.Region;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Links objects of consecutive frames by overlap.
 * Candidate pairs (previous track, current object) whose intersection over union is at least {@link #minIoU} are assigned greedily by decreasing overlap; ties are broken by lowest track id then lowest label. Each track and each object is used at most once.
 * A track that has no match in the next frame ends.
 */
public class OverlapTracker extends FrameLinker {
    public static final double DEFAULT_MIN_IOU = 0.1;
    double minIoU = DEFAULT_MIN_IOU;

    public OverlapTracker() {}

    public OverlapTracker(double minIoU) {
        this.minIoU = minIoU;
    }

    @Override
    protected Map<Integer, Integer> link(int frame, int[] previousTracks, Map<Integer, Region> previousRegions, int[] labels, Map<Integer, Region> regions) {
        Map<Integer, Integer> res = new HashMap<>();
        if (previousTracks==null) return res;
        Map<Long, Integer> intersections = new HashMap<>();
        for (int i = 0; i<labels.length; ++i) {
            int p = previousTracks[i], c = labels[i];
            if (p!=0 && c!=0) intersections.merge(((long)p << 32) | c, 1, Integer::sum);
        }
        List<Overlap> candidates = new ArrayList<>();
        intersections.forEach((key, inter) -> {
            int track = (int)(key >>> 32);
            int label = (int)(key & 0xffffffffL);
            double union = previousRegions.get(track).size() + regions.get(label).size() - inter;
            double iou = inter / union;
            if (iou>=minIoU) candidates.add(new Overlap(track, label, iou));
        });
        candidates.sort(Comparator.comparingDouble((Overlap o) -> -o.iou).thenComparingInt(o -> o.track).thenComparingInt(o -> o.label));
        Set<Integer> usedTracks = new HashSet<>();
        for (Overlap o : candidates) {
            if (res.containsKey(o.label) || usedTracks.contains(o.track)) continue;
            res.put(o.label, o.track);
            usedTracks.add(o.track);
        }
        return res;
    }

    static class Overlap {
        final int track, label;
        final double iou;
        Overlap(int track, int label, double iou) {
            this.track = track;
            this.label = label;
            this.iou = iou;
        }
    }
}
