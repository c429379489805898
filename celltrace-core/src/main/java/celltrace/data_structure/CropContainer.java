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
import celltrace.utils.FileIO;
import celltrace.utils.JSONUtils;
import org.json.simple.JSONArray;
import org.json.simple.JSONObject;
import org.json.simple.parser.ParseException;

import java.io.BufferedInputStream;
import java.io.ByteArrayOutputStream;
import java.io.Closeable;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;

/**
 * Per-FOV store of cell crops, backed by a zip file.
 * <p>
 * Entries: {@code cells.json} (cell ids, channel names), and for each cell {@code cell_NNNNN/meta.json} (frames and bounding boxes), {@code mask.bin}, {@code <channel>.bin} and {@code <channel>_background.bin}.
 * Binary entries hold the number of frames followed, for each frame, by a (type, height, width) header and the pixel values.
 */
public class CropContainer {
    public static final String INDEX_ENTRY = "cells.json";
    static final byte TYPE_MASK = 0, TYPE_FLOAT32 = 1;

    public static String pcChannelName(int channel) {
        return "pc_ch_" + channel;
    }
    public static String flChannelName(int channel) {
        return "fl_ch_" + channel;
    }

    public static String cellDir(int cellId) {
        return String.format("cell_%05d/", cellId);
    }

    /**
     * Writes to a temporary file; the container only appears at its final location on {@link #commit()}. Closing without committing removes the temporary file.
     */
    public static class Writer implements Closeable {
        final File target;
        final FileIO.ZipWriter zip;
        final List<Integer> cellIds = new ArrayList<>();
        final List<String> channels, backgroundChannels;
        boolean committed, closed;

        public Writer(File target, List<String> channels, List<String> backgroundChannels) throws IOException {
            this.target = target;
            this.channels = channels;
            this.backgroundChannels = backgroundChannels;
            if (target.getParentFile()!=null) target.getParentFile().mkdirs();
            this.zip = new FileIO.ZipWriter(FileIO.partFile(target));
        }

        public void writeCell(CellCrop cell) throws IOException {
            String dir = cellDir(cell.getCellId());
            JSONObject meta = new JSONObject();
            meta.put("cell", cell.getCellId());
            meta.put("frames", JSONUtils.toJSONArray(cell.getFrames()));
            JSONArray bounds = new JSONArray();
            for (int i = 0; i<cell.size(); ++i) bounds.add(JSONUtils.toJSONArray(cell.getBounds(i).toArray()));
            meta.put("bboxes", bounds);
            zip.writeString(dir + "meta.json", meta.toJSONString());
            zip.write(dir + "mask.bin", encodeMasks(cell));
            for (String c : cell.getChannels()) zip.write(dir + c + ".bin", encodeCrops(cell, c, false));
            for (String c : cell.getBackgroundChannels()) zip.write(dir + c + "_background.bin", encodeCrops(cell, c, true));
            cellIds.add(cell.getCellId());
        }

        public int cellCount() {
            return cellIds.size();
        }

        public void commit() throws IOException {
            JSONObject index = new JSONObject();
            index.put("cells", JSONUtils.toJSONArray(cellIds));
            index.put("channels", JSONUtils.toJSONArrayString(channels));
            index.put("backgrounds", JSONUtils.toJSONArrayString(backgroundChannels));
            zip.writeString(INDEX_ENTRY, index.toJSONString());
            zip.close();
            closed = true;
            FileIO.commit(zip.getFile(), target);
            committed = true;
        }

        @Override
        public void close() throws IOException {
            if (committed) return;
            try {
                if (!closed) zip.close();
            } finally {
                closed = true;
                if (!FileIO.delete(zip.getFile())) throw new IOException("Could not remove partial crop container: "+zip.getFile());
            }
        }

        static byte[] encodeMasks(CellCrop cell) throws IOException {
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            try (DataOutputStream out = new DataOutputStream(bos)) {
                out.writeInt(cell.size());
                for (int i = 0; i<cell.size(); ++i) {
                    BoundingBox b = cell.getBounds(i);
                    out.writeByte(TYPE_MASK);
                    out.writeInt(b.sizeY());
                    out.writeInt(b.sizeX());
                    for (boolean v : cell.getMask(i)) out.writeBoolean(v);
                }
            }
            return bos.toByteArray();
        }
        static byte[] encodeCrops(CellCrop cell, String channel, boolean background) throws IOException {
            ByteArrayOutputStream bos = new ByteArrayOutputStream();
            try (DataOutputStream out = new DataOutputStream(bos)) {
                out.writeInt(cell.size());
                for (int i = 0; i<cell.size(); ++i) {
                    BoundingBox b = cell.getBounds(i);
                    float[] crop = background ? cell.getBackgroundCrop(channel, i) : cell.getChannelCrop(channel, i);
                    out.writeByte(TYPE_FLOAT32);
                    out.writeInt(b.sizeY());
                    out.writeInt(b.sizeX());
                    for (float v : crop) out.writeFloat(v);
                }
            }
            return bos.toByteArray();
        }
    }

    public static class Reader implements Closeable {
        final FileIO.ZipReader zip;
        final List<Integer> cellIds;
        final List<String> channels, backgroundChannels;

        public Reader(File file) throws IOException {
            zip = new FileIO.ZipReader(file);
            try {
                JSONObject index = JSONUtils.parse(zip.readString(INDEX_ENTRY));
                cellIds = JSONUtils.fromIntArrayList((JSONArray)index.get("cells"));
                channels = JSONUtils.fromStringArrayList((JSONArray)index.get("channels"));
                backgroundChannels = JSONUtils.fromStringArrayList((JSONArray)index.get("backgrounds"));
            } catch (ParseException|IOException|RuntimeException e) {
                zip.close();
                throw new IOException("Invalid crop container: "+file, e);
            }
        }

        public List<Integer> getCellIds() {
            return cellIds;
        }
        public List<String> getChannels() {
            return channels;
        }
        public List<String> getBackgroundChannels() {
            return backgroundChannels;
        }

        public CellCrop readCell(int cellId) throws IOException {
            String dir = cellDir(cellId);
            JSONObject meta;
            try {
                meta = JSONUtils.parse(zip.readString(dir + "meta.json"));
            } catch (ParseException e) {
                throw new IOException("Invalid metadata for cell "+cellId, e);
            }
            List<Integer> frames = JSONUtils.fromIntArrayList((JSONArray)meta.get("frames"));
            JSONArray bounds = (JSONArray)meta.get("bboxes");
            List<boolean[]> masks = decodeMasks(dir + "mask.bin");
            if (masks.size()!=frames.size() || bounds.size()!=frames.size()) throw new IOException("Inconsistent record for cell "+cellId);
            CellCrop res = new CellCrop(cellId);
            for (int i = 0; i<frames.size(); ++i) res.addFrame(frames.get(i), BoundingBox.fromArray(JSONUtils.fromIntArray((List)bounds.get(i))), masks.get(i));
            for (String c : channels) {
                if (zip.contains(dir + c + ".bin")) for (float[] crop : decodeCrops(dir + c + ".bin")) res.addChannelCrop(c, crop);
            }
            for (String c : backgroundChannels) {
                if (zip.contains(dir + c + "_background.bin")) for (float[] crop : decodeCrops(dir + c + "_background.bin")) res.addBackgroundCrop(c, crop);
            }
            return res;
        }

        List<boolean[]> decodeMasks(String entry) throws IOException {
            try (InputStream is = zip.readFile(entry); DataInputStream in = new DataInputStream(new BufferedInputStream(is))) {
                int n = in.readInt();
                List<boolean[]> res = new ArrayList<>(n);
                for (int i = 0; i<n; ++i) {
                    byte type = in.readByte();
                    if (type!=TYPE_MASK) throw new IOException("Unexpected entry type in "+entry+": "+type);
                    boolean[] m = new boolean[in.readInt() * in.readInt()];
                    for (int j = 0; j<m.length; ++j) m[j] = in.readBoolean();
                    res.add(m);
                }
                return res;
            }
        }
        List<float[]> decodeCrops(String entry) throws IOException {
            try (InputStream is = zip.readFile(entry); DataInputStream in = new DataInputStream(new BufferedInputStream(is))) {
                int n = in.readInt();
                List<float[]> res = new ArrayList<>(n);
                for (int i = 0; i<n; ++i) {
                    byte type = in.readByte();
                    if (type!=TYPE_FLOAT32) throw new IOException("Unexpected entry type in "+entry+": "+type);
                    float[] c = new float[in.readInt() * in.readInt()];
                    for (int j = 0; j<c.length; ++j) c[j] = in.readFloat();
                    res.add(c);
                }
                return res;
            }
        }

        @Override
        public void close() throws IOException {
            zip.close();
        }
    }
}
