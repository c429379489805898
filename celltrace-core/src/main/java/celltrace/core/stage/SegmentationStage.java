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
import celltrace.image.PixelType;
import celltrace.image.StackFile;
import celltrace.image.io.MicroscopyMetadata;
import celltrace.plugins.Segmenter;
import celltrace.plugins.plugins.trackers.FrameLinker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Segments each frame of the phase contrast stack into labeled cells.
 * Labels of components outside of the configured size range are set to background; remaining labels are not renumbered.
 */
public class SegmentationStage implements Stage {
    public final static Logger logger = LoggerFactory.getLogger(SegmentationStage.class);
    final Segmenter segmenter;

    public SegmentationStage(Segmenter segmenter) {
        this.segmenter = segmenter;
    }

    @Override
    public String getName() {
        return "Segmentation";
    }

    @Override
    public boolean isDone(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir) {
        ChannelSelection pc = config.getPhaseContrast();
        return pc==null || ArtifactNaming.segLabeled(outputDir, metadata.getBaseName(), fov, pc.getChannel()).exists();
    }

    @Override
    public void process(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, CancellationToken cancel, ProgressCallback progress) throws IOException {
        ChannelSelection pc = config.getPhaseContrast();
        if (pc==null) {
            logger.warn("FOV {}: no phase contrast channel, skipping segmentation", fov);
            return;
        }
        File output = ArtifactNaming.segLabeled(outputDir, metadata.getBaseName(), fov, pc.getChannel());
        if (output.exists()) {
            logger.info("FOV {}: segmentation already exists, skipping", fov);
            return;
        }
        File input = ArtifactNaming.pcStack(outputDir, metadata.getBaseName(), fov, pc.getChannel());
        if (!input.exists()) throw new FileNotFoundException("FOV "+fov+": phase contrast stack not found: "+input);
        Integer minSize = config.getParams().getMinCellSize();
        Integer maxSize = config.getParams().getMaxCellSize();
        try (StackFile stack = StackFile.open(input);
             StackFile.Writer writer = StackFile.create(output, PixelType.UINT16, stack.sizeT(), stack.sizeY(), stack.sizeX())) {
            int nFrames = stack.sizeT(), sizeX = stack.sizeX(), sizeY = stack.sizeY();
            float[] frame = new float[sizeX * sizeY];
            for (int t = 0; t<nFrames; ++t) {
                if (cancel.isCancelled()) {
                    logger.info("FOV {}: segmentation cancelled at frame {}", fov, t);
                    return;
                }
                int[] labels = segmenter.segment(stack.readFloat(t, frame), sizeX, sizeY);
                if (minSize!=null || maxSize!=null) filterBySize(labels, minSize, maxSize);
                for (int l : labels) if (l>FrameLinker.MAX_TRACK_ID) throw new IllegalStateException("FOV "+fov+" frame "+t+": label "+l+" exceeds "+FrameLinker.MAX_TRACK_ID);
                writer.writeFrame(t, labels);
                progress.setProgress(t, nFrames, "Segmentation");
                logger.debug("FOV {}: frame {} segmented", fov, t);
            }
            writer.commit();
        }
        logger.info("FOV {}: segmentation done", fov);
    }

    /**
     * Sets to 0 the pixels of components whose size is out of [minSize, maxSize]. Bounds may be null.
     */
    public static void filterBySize(int[] labels, Integer minSize, Integer maxSize) {
        int max = 0;
        for (int l : labels) if (l>max) max = l;
        int[] sizes = new int[max+1];
        for (int l : labels) ++sizes[l];
        boolean[] remove = new boolean[max+1];
        for (int l = 1; l<=max; ++l) {
            remove[l] = (minSize!=null && sizes[l]<minSize) || (maxSize!=null && sizes[l]>maxSize);
        }
        for (int i = 0; i<labels.length; ++i) if (remove[labels[i]]) labels[i] = 0;
    }
}
