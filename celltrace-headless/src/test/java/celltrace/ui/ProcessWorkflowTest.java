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

import celltrace.configuration.ChannelSelection;
import celltrace.configuration.ProcessingConfig;
import celltrace.configuration.ProcessingParams;
import celltrace.data_structure.ArtifactNaming;
import ij.ImagePlus;
import ij.ImageStack;
import ij.io.FileSaver;
import ij.process.ShortProcessor;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Random;

import static org.junit.Assert.*;

public class ProcessWorkflowTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    /**
     * Two channels, one disc brighter than the background in both
     */
    File writeAcquisition(String name, int nFrames) {
        int size = 64;
        Random r = new Random(7);
        ImageStack stack = new ImageStack(size, size);
        for (int t = 0; t<nFrames; ++t) {
            for (int c = 0; c<2; ++c) {
                ShortProcessor ip = new ShortProcessor(size, size);
                for (int y = 0; y<size; ++y) {
                    for (int x = 0; x<size; ++x) {
                        boolean cell = (x-30-t) * (x-30-t) + (y-32) * (y-32) <= 100;
                        double v = c==0 ? (cell ? 1200 + 40 * r.nextGaussian() : 1000 + 2 * r.nextGaussian()) : (cell ? 500 : 100) + 2 * r.nextGaussian();
                        ip.set(x, y, (int)Math.round(v));
                    }
                }
                stack.addSlice(ip);
            }
        }
        ImagePlus imp = new ImagePlus(name, stack);
        imp.setDimensions(2, 1, nFrames);
        imp.setOpenAsHyperStack(true);
        File file = new File(testFolder.getRoot(), name + ".tif");
        assertTrue(new FileSaver(imp).saveAsTiffStack(file.getAbsolutePath()));
        return file;
    }

    File writeConfig(int flChannel) throws IOException {
        File file = new File(testFolder.getRoot(), "config_" + flChannel + ".json");
        ProcessingConfig config = new ProcessingConfig(ChannelSelection.phaseContrast(0, "area", "aspect_ratio"), Arrays.asList(ChannelSelection.fluorescence(flChannel, "intensity_mean")),
                ProcessingParams.builder().batchSize(1).nWorkers(1).build());
        assertTrue(config.saveIfAbsent(file));
        return file;
    }

    @Test
    public void testRun() throws IOException {
        File input = writeAcquisition("movie", 3);
        File output = new File(testFolder.getRoot(), "output");
        File config = writeConfig(1);
        assertEquals(ProcessWorkflow.SUCCESS, ProcessWorkflow.run(new String[]{config.getPath(), input.getPath(), output.getPath()}));
        assertTrue(ArtifactNaming.traces(output, "movie", 0).exists());
        assertTrue(ArtifactNaming.config(output).exists());
        assertEquals("second run reuses outputs", ProcessWorkflow.SUCCESS, ProcessWorkflow.run(new String[]{config.getPath(), input.getPath(), output.getPath(), "-v"}));
    }

    @Test
    public void testInvalidArguments() throws IOException {
        assertEquals(ProcessWorkflow.CONFIGURATION_ERROR, ProcessWorkflow.run(new String[0]));
        File input = writeAcquisition("movie", 2);
        File output = new File(testFolder.getRoot(), "output");
        assertEquals("missing configuration", ProcessWorkflow.CONFIGURATION_ERROR, ProcessWorkflow.run(new String[]{new File(testFolder.getRoot(), "none.json").getPath(), input.getPath(), output.getPath()}));
        assertEquals("missing input", ProcessWorkflow.CONFIGURATION_ERROR, ProcessWorkflow.run(new String[]{writeConfig(1).getPath(), new File(testFolder.getRoot(), "none.tif").getPath(), output.getPath()}));
        assertEquals("channel out of range", ProcessWorkflow.CONFIGURATION_ERROR, ProcessWorkflow.run(new String[]{writeConfig(4).getPath(), input.getPath(), output.getPath()}));
        assertFalse(output.exists());
    }
}
