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
import celltrace.configuration.ProcessingParams;
import celltrace.core.stage.BackgroundStage;
import celltrace.core.stage.CopyStage;
import celltrace.core.stage.CroppingStage;
import celltrace.core.stage.ExtractionStage;
import celltrace.core.stage.SegmentationStage;
import celltrace.core.stage.Stage;
import celltrace.core.stage.TrackingStage;
import celltrace.data_structure.ArtifactNaming;
import celltrace.image.io.FrameReader;
import celltrace.image.io.MicroscopyMetadata;
import celltrace.plugins.PluginFactory;
import celltrace.plugins.Segmenter;
import celltrace.plugins.Tracker;
import celltrace.utils.MultipleException;
import celltrace.utils.Pair;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Processes the selected FOVs batch by batch. For each batch, frames are first copied serially FOV by FOV, then the batch is split into worker ranges
 * that run concurrently on a fixed thread pool, each range processing its FOVs in ascending order.
 * <p>
 * Counts are updated only on the thread draining completed ranges. The configuration is written next to the outputs after a successful or cancelled run, unless one is already present.
 */
public class WorkflowTask {
    public final static Logger logger = LoggerFactory.getLogger(WorkflowTask.class);
    final MicroscopyMetadata metadata;
    final ProcessingConfig config;
    final File outputDir;
    final FrameReader reader;
    final CancellationToken cancel;
    ProgressCallback.Factory progress = (fov, stage) -> ProgressCallback.log(logger, fov);
    ProgressCallback runProgress = (current, total, message) -> logger.info("{} done ({}/{})", message, current, total);
    Supplier<List<Stage>> fovStages = this::createFovStages;
    final MultipleException errors = new MultipleException();

    public WorkflowTask(MicroscopyMetadata metadata, ProcessingConfig config, File outputDir, FrameReader reader, CancellationToken cancel) {
        this.metadata = metadata;
        this.config = config;
        this.outputDir = outputDir;
        this.reader = reader;
        this.cancel = cancel;
    }

    public WorkflowTask setProgressFactory(ProgressCallback.Factory progress) {
        this.progress = progress;
        return this;
    }

    /**
     * @param runProgress called on the orchestrating thread each time a FOV ends, with the number of FOVs ended so far and the target FOV count
     */
    public WorkflowTask setRunProgress(ProgressCallback runProgress) {
        this.runProgress = runProgress;
        return this;
    }

    /**
     * @param fovStages provides the stages run on each FOV after the frame copy; called once per worker range
     */
    public WorkflowTask setFovStages(Supplier<List<Stage>> fovStages) {
        this.fovStages = fovStages;
        return this;
    }

    /**
     * Segmentation, tracking, background, cropping and extraction stages, with new plugin instances
     * @throws IllegalArgumentException if a method name is unknown or the plugin parameters are invalid
     */
    public List<Stage> createFovStages() {
        ProcessingParams params = config.getParams();
        Segmenter segmenter = PluginFactory.getPlugin(Segmenter.class, params.getSegmentationMethod());
        segmenter.configure(params);
        Tracker tracker = PluginFactory.getPlugin(Tracker.class, params.getTrackingMethod());
        tracker.configure(params);
        return new ArrayList<>(Arrays.asList(new SegmentationStage(segmenter), new TrackingStage(tracker), new BackgroundStage(), new CroppingStage(), new ExtractionStage()));
    }

    public MultipleException getErrors() {
        return errors;
    }

    /**
     * @return counts of the run
     * @throws IllegalArgumentException if the configuration is not valid for the acquisition; in this case no work is done
     */
    public WorkflowResult run() {
        List<Integer> fovs = config.validate(metadata);
        // resolve plugins and features once, before any work
        createFovStages();
        ExtractionStage.getFeatureColumns(config);
        WorkflowResult result = new WorkflowResult(fovs.size());
        if (cancel.isCancelled()) {
            logger.info("Workflow cancelled before start");
            result.setCancelled();
            return result;
        }
        if (!outputDir.exists() && !outputDir.mkdirs()) throw new IllegalArgumentException("Could not create output directory: "+outputDir);
        ProcessingParams params = config.getParams();
        List<List<Integer>> batches = BatchPartitioner.batches(fovs, params.getBatchSize());
        logger.info("Processing {} FOVs in {} batches with {} workers, output: {}", fovs.size(), batches.size(), params.getNWorkers(), outputDir);
        ExecutorService executor = Executors.newFixedThreadPool(params.getNWorkers());
        try {
            for (int b = 0; b<batches.size(); ++b) {
                if (cancel.isCancelled()) break;
                logger.info("Batch {}/{}: FOVs {}", b+1, batches.size(), batches.get(b));
                List<Integer> copied = copyFrames(batches.get(b), result);
                if (cancel.isCancelled()) break;
                processBatch(copied, executor, result);
            }
        } finally {
            executor.shutdown();
            awaitTermination(executor);
        }
        if (cancel.isCancelled()) result.setCancelled();
        if (result.isSuccess() || result.isCancelled()) saveConfiguration();
        if (!errors.isEmpty()) {
            logger.error("Errors during workflow: {}", errors.getMessage());
            for (Pair<String, Throwable> e : errors.getExceptions()) logger.error(e.key, e.value);
        }
        logger.info("Workflow done: {}", result);
        return result;
    }

    /**
     * Serial copy of the frames of each FOV of the batch
     * @return FOVs whose frames are available
     */
    List<Integer> copyFrames(List<Integer> batch, WorkflowResult result) {
        CopyStage copy = new CopyStage(reader);
        List<Integer> res = new ArrayList<>(batch.size());
        for (int fov : batch) {
            if (cancel.isCancelled()) break;
            if (copy.isDone(fov, config, metadata, outputDir)) {
                res.add(fov);
                continue;
            }
            try {
                copy.process(fov, config, metadata, outputDir, cancel, progress.get(fov, copy.getName()));
                if (copy.isDone(fov, config, metadata, outputDir)) res.add(fov);
            } catch (IOException|RuntimeException e) {
                logger.error("FOV {}: error while copying frames", fov, e);
                result.addFailure(fov, e);
                errors.addException("FOV "+fov, e);
                fovEnded(fov, result);
            }
        }
        return res;
    }

    void processBatch(List<Integer> fovs, ExecutorService executor, WorkflowResult result) {
        CompletionService<List<FovResult>> completion = new ExecutorCompletionService<>(executor);
        Map<Future<List<FovResult>>, List<Integer>> ranges = new HashMap<>();
        for (List<Integer> range : BatchPartitioner.workerRanges(fovs, config.getParams().getNWorkers())) {
            ranges.put(completion.submit(() -> runRange(range)), range);
        }
        for (int i = 0; i<ranges.size(); ++i) {
            Future<List<FovResult>> f = null;
            try {
                f = completion.take();
                for (FovResult r : f.get()) {
                    result.add(r);
                    if (r.status==FovResult.Status.FAILED) errors.addException("FOV "+r.fov, r.error);
                    fovEnded(r.fov, result);
                }
            } catch (InterruptedException e) {
                logger.warn("Interrupted while waiting for workers: cancelling", e);
                Thread.currentThread().interrupt();
                cancel.cancel();
            } catch (ExecutionException e) {
                for (int fov : ranges.get(f)) {
                    result.addFailure(fov, e.getCause());
                    errors.addException("FOV "+fov, e.getCause());
                    fovEnded(fov, result);
                }
            }
            if (cancel.isCancelled()) {
                int notStarted = 0;
                for (Future<List<FovResult>> other : ranges.keySet()) if (!other.isDone() && other.cancel(false)) ++notStarted;
                logger.info("Workflow cancelled: {} worker ranges not started", notStarted);
                return;
            }
        }
    }

    private void fovEnded(int fov, WorkflowResult result) {
        runProgress.setProgress(result.getCompleted() + result.getFailed(), result.getTotal(), "FOV "+fov);
    }

    List<FovResult> runRange(List<Integer> range) {
        FovRunner runner = new FovRunner(fovStages.get(), config, metadata, outputDir, cancel, progress);
        List<FovResult> res = new ArrayList<>(range.size());
        for (int fov : range) {
            if (cancel.isCancelled()) break;
            res.add(runner.run(fov));
        }
        return res;
    }

    void saveConfiguration() {
        File configFile = ArtifactNaming.config(outputDir);
        try {
            if (config.saveIfAbsent(configFile)) logger.info("Configuration saved to {}", configFile);
            else logger.info("Configuration already present: {}, not overwritten", configFile);
        } catch (IOException e) {
            logger.error("Could not save configuration to {}", configFile, e);
            errors.addException("Configuration", e);
        }
    }

    private static void awaitTermination(ExecutorService executor) {
        try {
            while (!executor.awaitTermination(1, TimeUnit.MINUTES)) logger.debug("waiting for running workers...");
        } catch (InterruptedException e) {
            logger.warn("Interrupted while waiting for running workers", e);
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Errors are logged, never thrown
     * @return true if every selected FOV was processed
     */
    public static boolean runWorkflow(MicroscopyMetadata metadata, ProcessingConfig config, File outputDir, FrameReader reader, CancellationToken cancel) {
        try {
            return new WorkflowTask(metadata, config, outputDir, reader, cancel).run().isSuccess();
        } catch (RuntimeException e) {
            logger.error("Workflow error", e);
            return false;
        }
    }
}
