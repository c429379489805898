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

import ij.ImagePlus;
import ij.io.Opener;
import ij.process.ImageProcessor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Reads an acquisition stored as TIFF hyperstacks, one file per FOV (sorted by file name). All files must have the same dimensions.
 * Frames are read from the time dimension, or from the z dimension for files that have a single time point.
 * The hyperstack of the last requested FOV is kept in memory.
 */
public class TiffFrameReader implements FrameReader {
    public final static Logger logger = LoggerFactory.getLogger(TiffFrameReader.class);
    final List<File> files;
    final MicroscopyMetadata metadata;
    int currentFov = -1;
    ImagePlus current;

    /**
     * @param input a TIFF file (single FOV) or a directory of TIFF files
     */
    public TiffFrameReader(File input) throws IOException {
        if (!input.exists()) throw new FileNotFoundException("Input not found: "+input.getAbsolutePath());
        if (input.isDirectory()) {
            File[] tifs = input.listFiles(f -> f.isFile() && isTiff(f.getName()));
            files = tifs==null ? new ArrayList<>() : new ArrayList<>(Arrays.asList(tifs));
            Collections.sort(files);
        } else files = new ArrayList<>(Collections.singletonList(input));
        if (files.isEmpty()) throw new FileNotFoundException("No TIFF file in: "+input.getAbsolutePath());
        ImagePlus first = open(0);
        String baseName = input.isDirectory() ? input.getName() : stripExtension(input.getName());
        metadata = new MicroscopyMetadata(baseName, files.size(), first.getNChannels(), getNFrames(first), first.getHeight(), first.getWidth())
                .setFilePath(input.getAbsolutePath())
                .setFileType("tiff")
                .setDtype(first.getBitDepth()==32 ? "float32" : "uint"+first.getBitDepth());
        logger.info("TIFF acquisition: {}", metadata);
    }

    static boolean isTiff(String name) {
        String n = name.toLowerCase();
        return n.endsWith(".tif") || n.endsWith(".tiff");
    }
    static String stripExtension(String name) {
        int i = name.lastIndexOf('.');
        return i>0 ? name.substring(0, i) : name;
    }
    static int getNFrames(ImagePlus imp) {
        return imp.getNFrames()==1 ? imp.getNSlices() : imp.getNFrames();
    }

    synchronized ImagePlus open(int fov) throws IOException {
        if (fov==currentFov) return current;
        if (fov<0 || fov>=files.size()) throw new IllegalArgumentException("FOV "+fov+" out of range [0;"+files.size()+")");
        File f = files.get(fov);
        Opener opener = new Opener();
        opener.setSilentMode(true);
        ImagePlus imp = opener.openTiff(f.getParent(), f.getName());
        if (imp==null) throw new IOException("Could not open TIFF file: "+f.getAbsolutePath());
        if (metadata!=null && (imp.getWidth()!=metadata.getWidth() || imp.getHeight()!=metadata.getHeight() || imp.getNChannels()!=metadata.getNChannels() || getNFrames(imp)!=metadata.getNFrames())) {
            throw new IOException("Dimensions of "+f.getName()+" differ from those of the acquisition "+metadata);
        }
        logger.debug("opened FOV {}: {}", fov, f.getName());
        current = imp;
        currentFov = fov;
        return imp;
    }

    @Override
    public synchronized short[] readFrame(int fov, int channel, int frame) throws IOException {
        ImagePlus imp = open(fov);
        if (channel<0 || channel>=imp.getNChannels()) throw new IllegalArgumentException("Channel "+channel+" out of range");
        if (frame<0 || frame>=metadata.getNFrames()) throw new IllegalArgumentException("Frame "+frame+" out of range");
        int idx = imp.getNFrames()==1 ? imp.getStackIndex(channel+1, frame+1, 1) : imp.getStackIndex(channel+1, 1, frame+1);
        ImageProcessor ip = imp.getStack().getProcessor(idx);
        if (imp.getBitDepth()!=16) ip = ip.convertToShort(false);
        return ((short[])ip.getPixels()).clone();
    }

    @Override
    public MicroscopyMetadata getMetadata() {
        return metadata;
    }

    @Override
    public synchronized void close() {
        current = null;
        currentFov = -1;
    }
}
