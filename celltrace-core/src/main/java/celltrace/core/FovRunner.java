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
package celltrace.core;

import celltrace.configuration.ProcessingConfig;
import celltrace.core.stage.Stage;
import celltrace.image.io.MicroscopyMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.List;

/**
 * Runs the stages of one FOV in order. The cancellation flag is checked before each stage; an exception raised by a stage stops the remaining stages of this FOV only.
 */
public class FovRunner {
    public final static Logger logger = LoggerFactory.getLogger(FovRunner.class);
    final List<Stage> stages;
    final ProcessingConfig config;
    final MicroscopyMetadata metadata;
    final File outputDir;
    final CancellationToken cancel;
    final ProgressCallback.Factory progress;

    public FovRunner(List<Stage> stages, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, CancellationToken cancel, ProgressCallback.Factory progress) {
        this.stages = stages;
        this.config = config;
        this.metadata = metadata;
        this.outputDir = outputDir;
        this.cancel = cancel;
        this.progress = progress;
    }

    public FovResult run(int fov) {
        int completed = 0;
        for (Stage stage : stages) {
            if (cancel.isCancelled()) {
                logger.info("FOV {}: cancelled before {} ({} stages completed)", fov, stage.getName(), completed);
                return FovResult.cancelled(fov, completed);
            }
            if (stage.isDone(fov, config, metadata, outputDir)) {
                logger.info("FOV {}: {} already done, skipping", fov, stage.getName());
                ++completed;
                continue;
            }
            try {
                logger.info("FOV {}: {}...", fov, stage.getName());
                long t0 = System.currentTimeMillis();
                stage.process(fov, config, metadata, outputDir, cancel, progress.get(fov, stage.getName()));
                if (cancel.isCancelled() && !stage.isDone(fov, config, metadata, outputDir)) {
                    logger.info("FOV {}: {} cancelled ({} stages completed)", fov, stage.getName(), completed);
                    return FovResult.cancelled(fov, completed);
                }
                logger.debug("FOV {}: {} done in {}ms", fov, stage.getName(), System.currentTimeMillis() - t0);
            } catch (Exception e) {
                logger.error("FOV {}: error during {}", fov, stage.getName(), e);
                return FovResult.failed(fov, completed, e);
            }
            ++completed;
        }
        return FovResult.completed(fov, completed);
    }
}
