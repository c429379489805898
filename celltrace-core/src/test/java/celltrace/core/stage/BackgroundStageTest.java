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
import celltrace.configuration.ProcessingParams;
import celltrace.core.CancellationToken;
import celltrace.core.ProgressCallback;
import celltrace.data_structure.ArtifactNaming;
import celltrace.image.StackFile;
import celltrace.image.io.MicroscopyMetadata;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static celltrace.core.stage.StageTestUtils.BASE;
import static celltrace.core.stage.StageTestUtils.SIZE;
import static org.junit.Assert.*;

public class BackgroundStageTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();
    File outputDir;
    MicroscopyMetadata metadata = new MicroscopyMetadata(BASE, 1, 3, 3, SIZE, SIZE);

    @Before
    public void setUp() throws IOException {
        outputDir = testFolder.newFolder("output");
        StageTestUtils.writeLabels(ArtifactNaming.segLabeled(outputDir, BASE, 0, 0), 3);
        StageTestUtils.writeConstantStack(ArtifactNaming.flStack(outputDir, BASE, 0, 1), 3, 7);
        StageTestUtils.writeConstantStack(ArtifactNaming.flStack(outputDir, BASE, 0, 2), 3, 7);
    }

    static ProcessingConfig config(ChannelSelection pc, ChannelSelection... fl) {
        return new ProcessingConfig(pc, Arrays.asList(fl), ProcessingParams.builder().build());
    }

    static float valueAt(File stack, int frame, int idx) throws IOException {
        try (StackFile s = StackFile.open(stack)) {
            return s.readFloat(frame)[idx];
        }
    }

    @Test
    public void testExistingChannelIsSkipped() throws IOException {
        ProcessingConfig config = config(ChannelSelection.phaseContrast(0), ChannelSelection.fluorescence(1), ChannelSelection.fluorescence(2));
        File bck1 = ArtifactNaming.flBackground(outputDir, BASE, 0, 1);
        File bck2 = ArtifactNaming.flBackground(outputDir, BASE, 0, 2);
        StageTestUtils.writeConstantStack(bck1, 3, 99);
        long modified = bck1.lastModified();
        BackgroundStage stage = new BackgroundStage();
        assertFalse(stage.isDone(0, config, metadata, outputDir));

        List<Integer> frames = Collections.synchronizedList(new ArrayList<>());
        stage.process(0, config, metadata, outputDir, new CancellationToken(), (c, t, m) -> frames.add(c));
        assertEquals("only the missing channel is computed", Arrays.asList(0, 1, 2), frames);
        assertEquals(modified, bck1.lastModified());
        assertEquals(99, valueAt(bck1, 0, 0), 0);
        assertTrue(bck2.exists());
        assertEquals(7, valueAt(bck2, 2, 5 + 5 * SIZE), 1e-5);
        assertEquals("background under cells is interpolated", 7, valueAt(bck2, 0, 3 + 3 * SIZE), 1e-5);
        assertTrue(stage.isDone(0, config, metadata, outputDir));
    }

    @Test
    public void testWithoutFluorescenceOrPhaseContrast() throws IOException {
        BackgroundStage stage = new BackgroundStage();
        for (ProcessingConfig config : Arrays.asList(config(ChannelSelection.phaseContrast(0)), config(null, ChannelSelection.fluorescence(1)))) {
            assertTrue(stage.isDone(0, config, metadata, outputDir));
            stage.process(0, config, metadata, outputDir, new CancellationToken(), (c, t, m) -> fail("nothing to compute"));
            assertFalse(ArtifactNaming.flBackground(outputDir, BASE, 0, 1).exists());
        }
    }

    @Test
    public void testMissingFluorescenceStack() throws IOException {
        ProcessingConfig config = config(ChannelSelection.phaseContrast(0), ChannelSelection.fluorescence(1));
        assertTrue(ArtifactNaming.flStack(outputDir, BASE, 0, 1).delete());
        new BackgroundStage().process(0, config, metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
        assertFalse(ArtifactNaming.flBackground(outputDir, BASE, 0, 1).exists());
    }

    @Test
    public void testCancelled() throws IOException {
        ProcessingConfig config = config(ChannelSelection.phaseContrast(0), ChannelSelection.fluorescence(1));
        CancellationToken cancel = new CancellationToken();
        new BackgroundStage().process(0, config, metadata, outputDir, cancel, (c, t, m) -> cancel.cancel());
        assertFalse(ArtifactNaming.flBackground(outputDir, BASE, 0, 1).exists());
        assertFalse(StageTestUtils.hasPartFiles(ArtifactNaming.fovDir(outputDir, 0)));
    }

    @Test(expected = FileNotFoundException.class)
    public void testMissingSegmentation() throws IOException {
        assertTrue(ArtifactNaming.segLabeled(outputDir, BASE, 0, 0).delete());
        new BackgroundStage().process(0, config(ChannelSelection.phaseContrast(0), ChannelSelection.fluorescence(1)), metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
    }
}
