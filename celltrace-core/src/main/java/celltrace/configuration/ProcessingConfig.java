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

import celltrace.image.io.MicroscopyMetadata;
import celltrace.utils.FileIO;
import celltrace.utils.JSONSerializable;
import celltrace.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Channel selections and parameters of a processing run. Persisted as a JSON document next to the outputs.
 */
public class ProcessingConfig implements JSONSerializable {
    public final static Logger logger = LoggerFactory.getLogger(ProcessingConfig.class);
    ChannelSelection pc;
    List<ChannelSelection> fl = new ArrayList<>();
    ProcessingParams params = ProcessingParams.builder().build();

    public ProcessingConfig() {}

    public ProcessingConfig(ChannelSelection pc, List<ChannelSelection> fl, ProcessingParams params) {
        this.pc = pc;
        this.fl = new ArrayList<>(fl);
        this.params = params;
    }

    /**
     * @return phase contrast selection or null if no phase contrast channel is configured
     */
    public ChannelSelection getPhaseContrast() {
        return pc;
    }
    public List<ChannelSelection> getFluorescence() {
        return Collections.unmodifiableList(fl);
    }
    public ProcessingParams getParams() {
        return params;
    }
    public ProcessingConfig withParams(ProcessingParams params) {
        return new ProcessingConfig(pc, fl, params);
    }
    /**
     * @return PC selection first (if any) then FL selections in configuration order
     */
    public List<ChannelSelection> getAllChannels() {
        List<ChannelSelection> res = new ArrayList<>();
        if (pc!=null) res.add(pc);
        res.addAll(fl);
        return res;
    }

    /**
     * Checks channels against the acquisition and parses the FOV selection
     * @return selected FOVs
     * @throws IllegalArgumentException if the configuration does not match the acquisition
     */
    public List<Integer> validate(MicroscopyMetadata metadata) {
        Set<Integer> flChannels = new HashSet<>();
        for (ChannelSelection c : getAllChannels()) {
            if (c.getChannel()>=metadata.getNChannels()) throw new IllegalArgumentException("Channel "+c.getChannel()+" out of range: acquisition has "+metadata.getNChannels()+" channels");
        }
        for (ChannelSelection c : fl) {
            if (!flChannels.add(c.getChannel())) throw new IllegalArgumentException("Fluorescence channel "+c.getChannel()+" selected twice");
        }
        return FovSelection.parse(params.getFovs(), metadata.getNFovs());
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject channels = new JSONObject();
        if (pc!=null) channels.put("pc", pc.toJSONEntry());
        JSONArray flArray = new JSONArray();
        for (ChannelSelection c : fl) flArray.add(c.toJSONEntry());
        channels.put("fl", flArray);
        JSONObject res = new JSONObject();
        res.put("channels", channels);
        res.put("params", params.toJSONEntry());
        return res;
    }

    @Override
    public void initFromJSONEntry(Object json) {
        JSONObject o = (JSONObject)json;
        JSONObject channels = (JSONObject)o.get("channels");
        pc = null;
        fl = new ArrayList<>();
        if (channels!=null) {
            if (channels.get("pc")!=null) {
                pc = new ChannelSelection();
                pc.initFromJSONEntry(channels.get("pc"), false);
            }
            if (channels.get("fl")!=null) {
                for (Object c : (JSONArray)channels.get("fl")) {
                    ChannelSelection sel = new ChannelSelection();
                    sel.initFromJSONEntry(c, true);
                    fl.add(sel);
                }
            }
        }
        params = new ProcessingParams();
        if (o.get("params")!=null) params.initFromJSONEntry(o.get("params"));
        else params.validate();
    }

    public static ProcessingConfig load(File file) throws IOException {
        try {
            ProcessingConfig res = new ProcessingConfig();
            res.initFromJSONEntry(JSONUtils.parse(FileIO.readToString(file)));
            return res;
        } catch (ParseException|ClassCastException e) {
            throw new IllegalArgumentException("Invalid configuration file: "+file, e);
        }
    }

    /**
     * Writes this configuration unless {@code file} already exists
     * @return true if the file was written
     */
    public boolean saveIfAbsent(File file) throws IOException {
        if (file.exists()) return false;
        if (file.getParentFile()!=null) file.getParentFile().mkdirs();
        try {
            Files.write(file.toPath(), JSONUtils.serialize(this).getBytes(StandardCharsets.UTF_8), StandardOpenOption.CREATE_NEW, StandardOpenOption.WRITE);
            return true;
        } catch (FileAlreadyExistsException e) {
            logger.debug("configuration already written by another run: {}", file);
            return false;
        }
    }

    @Override
    public String toString() {
        return "ProcessingConfig[pc=" + pc + ", fl=" + fl + ", params=" + params + "]";
    }
}
