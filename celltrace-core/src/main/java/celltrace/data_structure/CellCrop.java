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
package celltrace.data_structure;

import celltrace.image.BoundingBox;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-cell record of the crop container: frames where the cell is present, its bounding box, mask and pixel crops in each of those frames.
 * All per-frame lists are aligned with {@link #getFrames()}.
 */
public class CellCrop {
    final int cellId;
    final List<Integer> frames = new ArrayList<>();
    final List<BoundingBox> bounds = new ArrayList<>();
    final List<boolean[]> masks = new ArrayList<>();
    final Map<String, List<float[]>> channels = new LinkedHashMap<>();
    final Map<String, List<float[]>> backgrounds = new LinkedHashMap<>();

    public CellCrop(int cellId) {
        this.cellId = cellId;
    }

    public CellCrop addFrame(int frame, BoundingBox bounds, boolean[] mask) {
        if (mask.length != bounds.sizeX() * bounds.sizeY()) throw new IllegalArgumentException("mask size does not match bounding box "+bounds);
        this.frames.add(frame);
        this.bounds.add(bounds);
        this.masks.add(mask);
        return this;
    }
    public CellCrop addChannelCrop(String channel, float[] crop) {
        channels.computeIfAbsent(channel, c -> new ArrayList<>()).add(crop);
        return this;
    }
    public CellCrop addBackgroundCrop(String channel, float[] crop) {
        backgrounds.computeIfAbsent(channel, c -> new ArrayList<>()).add(crop);
        return this;
    }

    public int getCellId() {
        return cellId;
    }
    public int size() {
        return frames.size();
    }
    public List<Integer> getFrames() {
        return Collections.unmodifiableList(frames);
    }
    public BoundingBox getBounds(int idx) {
        return bounds.get(idx);
    }
    public boolean[] getMask(int idx) {
        return masks.get(idx);
    }
    public boolean hasChannel(String channel) {
        return channels.containsKey(channel);
    }
    public boolean hasBackground(String channel) {
        return backgrounds.containsKey(channel);
    }
    /**
     * @return crop of {@code channel} at index {@code idx}, or null if the channel was not cropped
     */
    public float[] getChannelCrop(String channel, int idx) {
        List<float[]> l = channels.get(channel);
        return l==null ? null : l.get(idx);
    }
    /**
     * @return background crop of {@code channel} at index {@code idx}, or null if there is no background for this channel
     */
    public float[] getBackgroundCrop(String channel, int idx) {
        List<float[]> l = backgrounds.get(channel);
        return l==null ? null : l.get(idx);
    }
    public List<String> getChannels() {
        return new ArrayList<>(channels.keySet());
    }
    public List<String> getBackgroundChannels() {
        return new ArrayList<>(backgrounds.keySet());
    }
}
