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
package celltrace.ui;

import celltrace.configuration.ProcessingConfig;
import celltrace.core.WorkflowWorker;
import celltrace.image.io.FrameReader;
import celltrace.image.io.TiffFrameReader;
import celltrace.utils.Pair;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Command line processing of an acquisition.
 * <p>
 * Usage: {@code ProcessWorkflow <configuration.json> <input TIFF file or directory> <output directory> [--verbose]}
 * <p>
 * Exit status: 0 on success, 1 on failure or cancellation, 2 on invalid arguments or configuration.
 */
public class ProcessWorkflow {
    public static final int SUCCESS = 0, FAILURE = 1, CONFIGURATION_ERROR = 2;
    static final String USAGE = "Usage: ProcessWorkflow <configuration.json> <input TIFF file or directory> <output directory> [--verbose]";

    public static void main(String[] args) {
        System.exit(run(args));
    }

    public static int run(String[] args) {
        Logger root = (Logger)LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
        List<String> positional = new ArrayList<>();
        boolean verbose = false;
        for (String a : args) {
            if ("--verbose".equals(a) || "-v".equals(a)) verbose = true;
            else positional.add(a);
        }
        root.setLevel(verbose ? Level.DEBUG : Level.INFO);
        org.slf4j.Logger logger = LoggerFactory.getLogger(ProcessWorkflow.class);
        if (positional.size()!=3) {
            logger.error("Expected 3 arguments, got {}. {}", positional.size(), USAGE);
            return CONFIGURATION_ERROR;
        }
        File configFile = new File(positional.get(0));
        File input = new File(positional.get(1));
        File outputDir = new File(positional.get(2));
        ProcessingConfig config;
        try {
            config = ProcessingConfig.load(configFile);
        } catch (IOException|IllegalArgumentException e) {
            logger.error("Could not read configuration: {}", configFile, e);
            return CONFIGURATION_ERROR;
        }
        try (FrameReader reader = new TiffFrameReader(input)) {
            try {
                List<Integer> fovs = config.validate(reader.getMetadata());
                logger.info("{} FOVs selected", fovs.size());
            } catch (IllegalArgumentException e) {
                logger.error("Invalid configuration: {}", e.getMessage());
                return CONFIGURATION_ERROR;
            }
            WorkflowWorker worker = new WorkflowWorker(reader.getMetadata(), config, outputDir, reader);
            Pair<Boolean, String> result = worker.run();
            if (result.key) logger.info(result.value);
            else logger.error(result.value);
            return result.key ? SUCCESS : FAILURE;
        } catch (IOException e) {
            logger.error("Could not open acquisition: {}", input, e);
            return CONFIGURATION_ERROR;
        }
    }
}
