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
import celltrace.image.io.FrameReader;
import celltrace.image.io.MicroscopyMetadata;
import celltrace.utils.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Entry point of a workflow run for callers: owns the cancellation flag of the run.
 * {@link #run()} never throws, every outcome is returned as a (success, message) pair. {@link #cancel()} can be called from any thread, before, during or after the run.
 */
public class WorkflowWorker {
    private static final Logger logger = LoggerFactory.getLogger(WorkflowWorker.class);
    public static final String CANCELLED = "Workflow cancelled";
    public static final String FAILURE = "Workflow reported failure";
    final MicroscopyMetadata metadata;
    final ProcessingConfig config;
    final File outputDir;
    final FrameReader reader;
    final CancellationToken cancel = new CancellationToken();
    ProgressCallback.Factory progress;
    WorkflowTask task;
    WorkflowResult result;

    public WorkflowWorker(MicroscopyMetadata metadata, ProcessingConfig config, File outputDir, FrameReader reader) {
        this.metadata = metadata;
        this.config = config;
        this.outputDir = outputDir;
        this.reader = reader;
    }

    public WorkflowWorker setProgressFactory(ProgressCallback.Factory progress) {
        this.progress = progress;
        return this;
    }

    /**
     * Gives access to the underlying task before it runs, e.g. to replace its stages
     */
    public WorkflowTask getTask() {
        if (task==null) {
            task = new WorkflowTask(metadata, config, outputDir, reader, cancel);
            if (progress!=null) task.setProgressFactory(progress);
        }
        return task;
    }

    public Pair<Boolean, String> run() {
        if (cancel.isCancelled()) {
            logger.info("Workflow cancelled before start");
            return new Pair<>(false, CANCELLED);
        }
        try {
            result = getTask().run();
            if (result.isCancelled() || cancel.isCancelled()) return new Pair<>(false, CANCELLED);
            if (result.isSuccess()) return new Pair<>(true, "Results saved to " + outputDir.getAbsolutePath());
            logger.warn("Workflow reported failure: {}", result);
            return new Pair<>(false, FAILURE);
        } catch (Throwable t) {
            logger.error("Workflow error", t);
            return new Pair<>(false, "Workflow error: " + t.getMessage());
        }
    }

    /**
     * Idempotent
     */
    public void cancel() {
        if (cancel.cancel()) logger.info("Cancellation requested");
    }

    public boolean isCancelled() {
        return cancel.isCancelled();
    }

    /**
     * @return counts of the last run, null if it did not start
     */
    public WorkflowResult getResult() {
        return result;
    }
}
