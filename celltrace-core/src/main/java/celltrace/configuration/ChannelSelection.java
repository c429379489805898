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

import celltrace.utils.JSONSerializable;
import celltrace.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * A channel index with the ordered features extracted from it
 */
public class ChannelSelection implements JSONSerializable {
    int channel;
    List<String> features = new ArrayList<>();
    boolean bboxAsMask;

    public ChannelSelection() {}

    public ChannelSelection(int channel, boolean bboxAsMask, String... features) {
        this(channel, bboxAsMask, Arrays.asList(features));
    }

    public ChannelSelection(int channel, boolean bboxAsMask, List<String> features) {
        if (channel<0) throw new IllegalArgumentException("Channel index must be >=0");
        this.channel = channel;
        this.bboxAsMask = bboxAsMask;
        this.features = new ArrayList<>(new LinkedHashSet<>(features));
    }

    public static ChannelSelection phaseContrast(int channel, String... features) {
        return new ChannelSelection(channel, false, features);
    }
    public static ChannelSelection fluorescence(int channel, String... features) {
        return new ChannelSelection(channel, true, features);
    }

    public int getChannel() {
        return channel;
    }
    public List<String> getFeatures() {
        return Collections.unmodifiableList(features);
    }
    /**
     * @return true if features are computed over the whole bounding box instead of the cell mask
     */
    public boolean isBboxAsMask() {
        return bboxAsMask;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("channel", channel);
        res.put("features", JSONUtils.toJSONArrayString(features));
        res.put("bbox_as_mask", bboxAsMask);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object json) {
        initFromJSONEntry(json, false);
    }

    void initFromJSONEntry(Object json, boolean defaultBboxAsMask) {
        JSONObject o = (JSONObject)json;
        if (!o.containsKey("channel")) throw new IllegalArgumentException("Channel selection without channel index: "+o);
        channel = ((Number)o.get("channel")).intValue();
        if (channel<0) throw new IllegalArgumentException("Channel index must be >=0");
        features = o.containsKey("features") ? new ArrayList<>(new LinkedHashSet<>(JSONUtils.fromStringArrayList((JSONArray)o.get("features")))) : new ArrayList<>();
        bboxAsMask = o.containsKey("bbox_as_mask") ? (Boolean)o.get("bbox_as_mask") : defaultBboxAsMask;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof ChannelSelection)) return false;
        ChannelSelection that = (ChannelSelection) o;
        return channel == that.channel && bboxAsMask == that.bboxAsMask && features.equals(that.features);
    }

    @Override
    public int hashCode() {
        return Objects.hash(channel, features, bboxAsMask);
    }

    @Override
    public String toString() {
        return "ch" + channel + features;
    }
}
