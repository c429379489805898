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
package celltrace.image.io;

import celltrace.utils.JSONSerializable;
import celltrace.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Description of an acquisition: dimensions, channel names and optional time points (in milliseconds)
 */
public class MicroscopyMetadata implements JSONSerializable {
    String filePath;
    String baseName;
    String fileType = "";
    int height, width, nFrames, nFovs, nChannels;
    double[] timepoints;
    List<String> channelNames = new ArrayList<>();
    String dtype = "uint16";

    public MicroscopyMetadata() {}

    public MicroscopyMetadata(String baseName, int nFovs, int nChannels, int nFrames, int height, int width) {
        this.baseName = baseName;
        this.nFovs = nFovs;
        this.nChannels = nChannels;
        this.nFrames = nFrames;
        this.height = height;
        this.width = width;
    }

    public MicroscopyMetadata setFilePath(String filePath) {
        this.filePath = filePath;
        return this;
    }
    public MicroscopyMetadata setFileType(String fileType) {
        this.fileType = fileType;
        return this;
    }
    public MicroscopyMetadata setTimepoints(double[] timepointsMs) {
        this.timepoints = timepointsMs;
        return this;
    }
    public MicroscopyMetadata setChannelNames(List<String> channelNames) {
        this.channelNames = new ArrayList<>(channelNames);
        return this;
    }
    public MicroscopyMetadata setDtype(String dtype) {
        this.dtype = dtype;
        return this;
    }

    public String getFilePath() {
        return filePath;
    }
    public String getBaseName() {
        return baseName;
    }
    public String getFileType() {
        return fileType;
    }
    public int getHeight() {
        return height;
    }
    public int getWidth() {
        return width;
    }
    public int getNFrames() {
        return nFrames;
    }
    public int getNFovs() {
        return nFovs;
    }
    public int getNChannels() {
        return nChannels;
    }
    public List<String> getChannelNames() {
        return Collections.unmodifiableList(channelNames);
    }
    public String getDtype() {
        return dtype;
    }
    public boolean hasTimepoints() {
        return timepoints!=null && timepoints.length>0;
    }

    /**
     * @return time of {@code frame} in minutes when time points are known, the frame index otherwise
     */
    public double getTime(int frame) {
        if (hasTimepoints() && frame<timepoints.length) return timepoints[frame] / 60000d;
        return frame;
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        if (filePath!=null) res.put("file_path", filePath);
        res.put("base_name", baseName);
        res.put("file_type", fileType);
        res.put("height", height);
        res.put("width", width);
        res.put("n_frames", nFrames);
        res.put("n_fovs", nFovs);
        res.put("n_channels", nChannels);
        if (hasTimepoints()) res.put("timepoints", JSONUtils.toJSONArray(timepoints));
        res.put("channel_names", JSONUtils.toJSONArrayString(channelNames));
        res.put("dtype", dtype);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object json) {
        JSONObject o = (JSONObject)json;
        filePath = JSONUtils.getString(o, "file_path", null);
        baseName = JSONUtils.getString(o, "base_name", null);
        fileType = JSONUtils.getString(o, "file_type", "");
        height = JSONUtils.getInt(o, "height", 0);
        width = JSONUtils.getInt(o, "width", 0);
        nFrames = JSONUtils.getInt(o, "n_frames", 0);
        nFovs = JSONUtils.getInt(o, "n_fovs", 0);
        nChannels = JSONUtils.getInt(o, "n_channels", 0);
        if (o.containsKey("timepoints")) timepoints = JSONUtils.fromDoubleArray((JSONArray)o.get("timepoints"));
        if (o.containsKey("channel_names")) channelNames = JSONUtils.fromStringArrayList((JSONArray)o.get("channel_names"));
        dtype = JSONUtils.getString(o, "dtype", "uint16");
    }

    @Override
    public String toString() {
        return baseName+" [fovs="+nFovs+", channels="+nChannels+", frames="+nFrames+", "+height+"x"+width+"]";
    }
}
