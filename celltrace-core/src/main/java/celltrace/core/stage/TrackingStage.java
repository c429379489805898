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
import celltrace.plugins.Tracker;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Replaces per-frame labels of the segmentation by track ids stable through time
 */
public class TrackingStage implements Stage {
    public final static Logger logger = LoggerFactory.getLogger(TrackingStage.class);
    final Tracker tracker;

    public TrackingStage(Tracker tracker) {
        this.tracker = tracker;
    }

    @Override
    public String getName() {
        return "Tracking";
    }

    @Override
    public boolean isDone(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir) {
        ChannelSelection pc = config.getPhaseContrast();
        return pc==null || ArtifactNaming.segTracked(outputDir, metadata.getBaseName(), fov, pc.getChannel()).exists();
    }

    @Override
    public void process(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, CancellationToken cancel, ProgressCallback progress) throws IOException {
        ChannelSelection pc = config.getPhaseContrast();
        if (pc==null) {
            logger.warn("FOV {}: no phase contrast channel, skipping tracking", fov);
            return;
        }
        File output = ArtifactNaming.segTracked(outputDir, metadata.getBaseName(), fov, pc.getChannel());
        if (output.exists()) {
            logger.info("FOV {}: tracking already exists, skipping", fov);
            return;
        }
        File input = ArtifactNaming.segLabeled(outputDir, metadata.getBaseName(), fov, pc.getChannel());
        if (!input.exists()) throw new FileNotFoundException("FOV "+fov+": segmentation not found: "+input);
        try (StackFile labels = StackFile.open(input);
             StackFile.Writer writer = StackFile.create(output, PixelType.UINT16, labels.sizeT(), labels.sizeY(), labels.sizeX())) {
            if (!tracker.track(labels, writer, cancel, progress)) {
                logger.info("FOV {}: tracking cancelled", fov);
                return;
            }
            writer.commit();
        }
        logger.info("FOV {}: tracking done", fov);
    }
}
