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

import celltrace.configuration.ProcessingConfig;
import celltrace.core.CancellationToken;
import celltrace.core.ProgressCallback;
import celltrace.image.io.MicroscopyMetadata;

import java.io.File;
import java.io.IOException;

/**
 * One processing step of a FOV. A stage reads the artifacts of upstream stages and writes its own artifacts through {@link celltrace.data_structure.ArtifactNaming}.
 * Stages are idempotent: when their output already exists they return without doing anything.
 * Cancellation is checked at least once per frame or cell; a cancelled stage removes its partial output and returns normally.
 */
public interface Stage {
    String getName();

    /**
     * @return true if there is nothing left to do for this FOV: outputs exist, or the stage does not apply to the configuration
     */
    boolean isDone(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir);

    /**
     * @throws java.io.FileNotFoundException if an upstream artifact is missing
     * @throws IOException on read or write errors
     */
    void process(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, CancellationToken cancel, ProgressCallback progress) throws IOException;
}
