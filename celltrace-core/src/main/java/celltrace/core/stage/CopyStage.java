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
import celltrace.image.io.FrameReader;
import celltrace.image.io.MicroscopyMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Copies the frames of each selected channel from the acquisition to one frame stack per channel, one frame at a time
 */
public class CopyStage implements Stage {
    public final static Logger logger = LoggerFactory.getLogger(CopyStage.class);
    final FrameReader reader;

    public CopyStage(FrameReader reader) {
        this.reader = reader;
    }

    @Override
    public String getName() {
        return "Copy";
    }

    static List<File> getTargets(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, List<Integer> channels) {
        List<File> res = new ArrayList<>();
        if (config.getPhaseContrast()!=null) {
            res.add(ArtifactNaming.pcStack(outputDir, metadata.getBaseName(), fov, config.getPhaseContrast().getChannel()));
            channels.add(config.getPhaseContrast().getChannel());
        }
        for (ChannelSelection fl : config.getFluorescence()) {
            res.add(ArtifactNaming.flStack(outputDir, metadata.getBaseName(), fov, fl.getChannel()));
            channels.add(fl.getChannel());
        }
        return res;
    }

    @Override
    public boolean isDone(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir) {
        return getTargets(fov, config, metadata, outputDir, new ArrayList<>()).stream().allMatch(File::exists);
    }

    @Override
    public void process(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, CancellationToken cancel, ProgressCallback progress) throws IOException {
        List<Integer> channels = new ArrayList<>();
        List<File> targets = getTargets(fov, config, metadata, outputDir, channels);
        int nFrames = metadata.getNFrames(), sizeY = metadata.getHeight(), sizeX = metadata.getWidth();
        for (int i = 0; i<targets.size(); ++i) {
            File target = targets.get(i);
            int channel = channels.get(i);
            if (target.exists()) {
                logger.info("FOV {}: {} already exists, skipping copy", fov, target.getName());
                continue;
            }
            try (StackFile.Writer writer = StackFile.create(target, PixelType.UINT16, nFrames, sizeY, sizeX)) {
                for (int t = 0; t<nFrames; ++t) {
                    if (cancel.isCancelled()) {
                        logger.info("FOV {}: copy of channel {} cancelled at frame {}", fov, channel, t);
                        return; // writer is closed without commit: partial stack is removed
                    }
                    short[] frame = reader.readFrame(fov, channel, t);
                    if (frame.length!=sizeX * sizeY) throw new IOException("FOV "+fov+" channel "+channel+" frame "+t+": expected "+sizeX * sizeY+" pixels, got "+frame.length);
                    writer.writeFrame(t, frame);
                    progress.setProgress(t, nFrames, "Copying");
                }
                writer.commit();
            }
            logger.info("FOV {}: copied channel {} to {}", fov, channel, target.getName());
        }
    }
}
