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
import celltrace.processing.BackgroundEstimator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;

/**
 * Estimates the background of each fluorescence channel, using the segmentation to exclude cells. Each channel is skipped independently when its background already exists.
 */
public class BackgroundStage implements Stage {
    public final static Logger logger = LoggerFactory.getLogger(BackgroundStage.class);
    final BackgroundEstimator estimator;

    public BackgroundStage() {
        this(new BackgroundEstimator());
    }
    public BackgroundStage(BackgroundEstimator estimator) {
        this.estimator = estimator;
    }

    @Override
    public String getName() {
        return "Background";
    }

    @Override
    public boolean isDone(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir) {
        if (config.getPhaseContrast()==null || config.getFluorescence().isEmpty()) return true;
        for (ChannelSelection fl : config.getFluorescence()) {
            if (!ArtifactNaming.flBackground(outputDir, metadata.getBaseName(), fov, fl.getChannel()).exists()) return false;
        }
        return true;
    }

    @Override
    public void process(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, CancellationToken cancel, ProgressCallback progress) throws IOException {
        ChannelSelection pc = config.getPhaseContrast();
        if (pc==null || config.getFluorescence().isEmpty()) {
            logger.warn("FOV {}: background estimation requires a phase contrast and a fluorescence channel, skipping", fov);
            return;
        }
        String base = metadata.getBaseName();
        File segFile = ArtifactNaming.segLabeled(outputDir, base, fov, pc.getChannel());
        if (!segFile.exists()) throw new FileNotFoundException("FOV "+fov+": segmentation not found: "+segFile);
        try (StackFile seg = StackFile.open(segFile)) {
            for (ChannelSelection fl : config.getFluorescence()) {
                if (cancel.isCancelled()) {
                    logger.info("FOV {}: background estimation cancelled", fov);
                    return;
                }
                File output = ArtifactNaming.flBackground(outputDir, base, fov, fl.getChannel());
                if (output.exists()) {
                    logger.info("FOV {}: background of channel {} already exists, skipping", fov, fl.getChannel());
                    continue;
                }
                File flFile = ArtifactNaming.flStack(outputDir, base, fov, fl.getChannel());
                if (!flFile.exists()) {
                    logger.warn("FOV {}: fluorescence stack of channel {} not found, skipping background", fov, fl.getChannel());
                    continue;
                }
                if (!processChannel(fov, fl.getChannel(), seg, flFile, output, cancel, progress)) return;
            }
        }
    }

    /**
     * @return false if cancelled
     */
    boolean processChannel(int fov, int channel, StackFile seg, File flFile, File output, CancellationToken cancel, ProgressCallback progress) throws IOException {
        try (StackFile fl = StackFile.open(flFile);
             StackFile.Writer writer = StackFile.create(output, PixelType.FLOAT32, fl.sizeT(), fl.sizeY(), fl.sizeX())) {
            if (!fl.sameShape(seg)) throw new IOException("FOV "+fov+": fluorescence channel "+channel+" "+fl+" and segmentation "+seg+" have different shapes");
            int nFrames = fl.sizeT(), sizeX = fl.sizeX(), sizeY = fl.sizeY();
            float[] image = new float[sizeX * sizeY];
            int[] labels = new int[sizeX * sizeY];
            for (int t = 0; t<nFrames; ++t) {
                if (cancel.isCancelled()) {
                    logger.info("FOV {}: background estimation of channel {} cancelled at frame {}", fov, channel, t);
                    return false;
                }
                writer.writeFrame(t, estimator.estimate(fl.readFloat(t, image), seg.readInt(t, labels), sizeX, sizeY));
                progress.setProgress(t, nFrames, "Background");
            }
            writer.commit();
        }
        logger.info("FOV {}: background of channel {} done", fov, channel);
        return true;
    }
}
