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
package celltrace.core.stage;

import celltrace.configuration.ChannelSelection;
import celltrace.configuration.ProcessingConfig;
import celltrace.core.CancellationToken;
import celltrace.core.ProgressCallback;
import celltrace.data_structure.ArtifactNaming;
import celltrace.data_structure.CellCrop;
import celltrace.data_structure.CropContainer;
import celltrace.image.BoundingBox;
import celltrace.image.StackFile;
import celltrace.image.io.MicroscopyMetadata;
import celltrace.processing.BinaryMorphology;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Extracts, for each tracked cell, its padded bounding box, mask and channel crops in every frame where it is present, and stores them in the crop container of the FOV.
 * Cells present in less than {@code minFrames} frames are discarded.
 */
public class CroppingStage implements Stage {
    public final static Logger logger = LoggerFactory.getLogger(CroppingStage.class);

    @Override
    public String getName() {
        return "Cropping";
    }

    @Override
    public boolean isDone(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir) {
        return config.getPhaseContrast()==null || ArtifactNaming.crops(outputDir, metadata.getBaseName(), fov).exists();
    }

    @Override
    public void process(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, CancellationToken cancel, ProgressCallback progress) throws IOException {
        ChannelSelection pc = config.getPhaseContrast();
        if (pc==null) {
            logger.warn("FOV {}: no phase contrast channel, skipping cropping", fov);
            return;
        }
        String base = metadata.getBaseName();
        File output = ArtifactNaming.crops(outputDir, base, fov);
        if (output.exists()) {
            logger.info("FOV {}: crops already exist, skipping", fov);
            return;
        }
        File trackedFile = ArtifactNaming.segTracked(outputDir, base, fov, pc.getChannel());
        if (!trackedFile.exists()) throw new FileNotFoundException("FOV "+fov+": tracked segmentation not found: "+trackedFile);

        if (cancel.isCancelled()) return;
        progress.setProgress(0, 3, "Computing bounding boxes");
        int padding = config.getParams().getCropPadding();
        Map<Integer, CellCrop> cells;
        try (StackFile tracked = StackFile.open(trackedFile)) {
            cells = computeBoundingBoxes(tracked, padding);
        }
        int minFrames = config.getParams().getMinFrames();
        cells.values().removeIf(c -> c.size()<minFrames);
        logger.debug("FOV {}: {} cells present in at least {} frames", fov, cells.size(), minFrames);

        if (cancel.isCancelled()) return;
        progress.setProgress(1, 3, "Extracting crops");
        Map<String, File> channelFiles = new LinkedHashMap<>();
        Map<String, File> backgroundFiles = new LinkedHashMap<>();
        File pcFile = ArtifactNaming.pcStack(outputDir, base, fov, pc.getChannel());
        if (pcFile.exists()) channelFiles.put(CropContainer.pcChannelName(pc.getChannel()), pcFile);
        else logger.warn("FOV {}: phase contrast stack not found, phase contrast will not be cropped", fov);
        for (ChannelSelection fl : config.getFluorescence()) {
            String name = CropContainer.flChannelName(fl.getChannel());
            File flFile = ArtifactNaming.flStack(outputDir, base, fov, fl.getChannel());
            if (flFile.exists()) channelFiles.put(name, flFile);
            else logger.warn("FOV {}: fluorescence stack of channel {} not found, channel will not be cropped", fov, fl.getChannel());
            File bgFile = ArtifactNaming.flBackground(outputDir, base, fov, fl.getChannel());
            if (bgFile.exists()) backgroundFiles.put(name, bgFile);
        }
        if (!cells.isEmpty()) {
            if (!extractCrops(fov, cells, trackedFile, channelFiles, backgroundFiles, config.getParams().getMaskMargin(), cancel)) return;
        } else logger.warn("FOV {}: no cells to crop", fov);

        progress.setProgress(2, 3, "Saving crops");
        try (CropContainer.Writer writer = new CropContainer.Writer(output, new ArrayList<>(channelFiles.keySet()), new ArrayList<>(backgroundFiles.keySet()))) {
            for (CellCrop cell : cells.values()) {
                if (cancel.isCancelled()) {
                    logger.info("FOV {}: cropping cancelled while saving, {} cells saved", fov, writer.cellCount());
                    return; // writer is closed without commit: partial container is removed
                }
                writer.writeCell(cell);
            }
            writer.commit();
        }
        progress.setProgress(3, 3, "Done");
        logger.info("FOV {}: {} cells cropped", fov, cells.size());
    }

    /**
     * @return cell records with frames and padded bounding boxes, keyed by track id in ascending order. Masks are empty placeholders until {@link #extractCrops} is called.
     */
    static Map<Integer, CellCrop> computeBoundingBoxes(StackFile tracked, int padding) throws IOException {
        Map<Integer, CellCrop> cells = new TreeMap<>();
        int sizeX = tracked.sizeX(), sizeY = tracked.sizeY();
        int[] labels = new int[sizeX * sizeY];
        for (int t = 0; t<tracked.sizeT(); ++t) {
            for (Map.Entry<Integer, BoundingBox> e : BoundingBox.ofLabels(tracked.readInt(t, labels), sizeX).entrySet()) {
                BoundingBox b = e.getValue().pad(padding, sizeY, sizeX);
                cells.computeIfAbsent(e.getKey(), CellCrop::new).addFrame(t, b, new boolean[b.sizeX() * b.sizeY()]);
            }
        }
        return cells;
    }

    /**
     * Reads each frame once and fills masks and crops of all cells present in the frame
     * @return false if cancelled
     */
    boolean extractCrops(int fov, Map<Integer, CellCrop> cells, File trackedFile, Map<String, File> channelFiles, Map<String, File> backgroundFiles, int maskMargin, CancellationToken cancel) throws IOException {
        List<StackFile> opened = new ArrayList<>();
        try {
            StackFile tracked = StackFile.open(trackedFile);
            opened.add(tracked);
            Map<String, StackFile> channels = new LinkedHashMap<>();
            for (Map.Entry<String, File> e : channelFiles.entrySet()) channels.put(e.getKey(), open(e.getValue(), tracked, opened));
            Map<String, StackFile> backgrounds = new LinkedHashMap<>();
            for (Map.Entry<String, File> e : backgroundFiles.entrySet()) backgrounds.put(e.getKey(), open(e.getValue(), tracked, opened));
            int sizeX = tracked.sizeX(), sizeY = tracked.sizeY();
            // index of the next frame to fill for each cell; frames of a cell are in ascending order
            Map<Integer, Integer> cursor = new TreeMap<>();
            for (int t = 0; t<tracked.sizeT(); ++t) {
                if (cancel.isCancelled()) {
                    logger.info("FOV {}: crop extraction cancelled at frame {}", fov, t);
                    return false;
                }
                int[] labels = tracked.readInt(t);
                Map<String, float[]> channelFrames = new LinkedHashMap<>();
                for (Map.Entry<String, StackFile> e : channels.entrySet()) channelFrames.put(e.getKey(), e.getValue().readFloat(t));
                Map<String, float[]> backgroundFrames = new LinkedHashMap<>();
                for (Map.Entry<String, StackFile> e : backgrounds.entrySet()) backgroundFrames.put(e.getKey(), e.getValue().readFloat(t));
                for (CellCrop cell : cells.values()) {
                    int idx = cursor.getOrDefault(cell.getCellId(), 0);
                    if (idx>=cell.size() || cell.getFrames().get(idx)!=t) continue;
                    cursor.put(cell.getCellId(), idx+1);
                    BoundingBox b = cell.getBounds(idx);
                    boolean[] mask = b.cropMask(labels, sizeX, cell.getCellId());
                    System.arraycopy(applyMargin(mask, b.sizeX(), b.sizeY(), maskMargin), 0, cell.getMask(idx), 0, mask.length);
                    for (Map.Entry<String, float[]> e : channelFrames.entrySet()) cell.addChannelCrop(e.getKey(), b.crop(e.getValue(), sizeX));
                    for (Map.Entry<String, float[]> e : backgroundFrames.entrySet()) cell.addBackgroundCrop(e.getKey(), b.crop(e.getValue(), sizeX));
                }
            }
            return true;
        } finally {
            for (StackFile s : opened) s.close();
        }
    }

    private static StackFile open(File file, StackFile reference, List<StackFile> opened) throws IOException {
        StackFile res = StackFile.open(file);
        opened.add(res);
        if (!res.sameShape(reference)) throw new IOException(res+" and "+reference+" have different shapes");
        return res;
    }

    /**
     * Positive margin dilates the mask, negative margin erodes it. An erosion that would empty the mask is not applied.
     */
    public static boolean[] applyMargin(boolean[] mask, int sizeX, int sizeY, int margin) {
        if (margin>0) return BinaryMorphology.dilate(mask, sizeX, sizeY, margin);
        if (margin<0) {
            boolean[] eroded = BinaryMorphology.erode(mask, sizeX, sizeY, -margin);
            if (BinaryMorphology.count(eroded)>0) return eroded;
        }
        return mask;
    }
}
