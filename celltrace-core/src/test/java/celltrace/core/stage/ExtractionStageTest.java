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
import celltrace.image.io.MicroscopyMetadata;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.util.Arrays;
import java.util.List;

import static celltrace.core.stage.StageTestUtils.BASE;
import static celltrace.core.stage.StageTestUtils.SIZE;
import static org.junit.Assert.*;

public class ExtractionStageTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();
    File outputDir;
    MicroscopyMetadata metadata = new MicroscopyMetadata(BASE, 1, 3, 3, SIZE, SIZE);

    @Before
    public void setUp() throws IOException {
        outputDir = testFolder.newFolder("output");
        StageTestUtils.writeTracked(outputDir, 0, 3);
        StageTestUtils.writeIndexStack(ArtifactNaming.pcStack(outputDir, BASE, 0, 0), 3);
        StageTestUtils.writeConstantStack(ArtifactNaming.flStack(outputDir, BASE, 0, 1), 3, 7);
        StageTestUtils.writeConstantStack(ArtifactNaming.flBackground(outputDir, BASE, 0, 1), 3, 2);
    }

    ProcessingConfig config(int minFrames, double backgroundWeight, ChannelSelection... fl) {
        return new ProcessingConfig(ChannelSelection.phaseContrast(0, "area"), Arrays.asList(fl),
                ProcessingParams.builder().cropPadding(1).minFrames(minFrames).backgroundWeight(backgroundWeight).build());
    }

    List<String> run(ProcessingConfig config) throws IOException {
        new CroppingStage().process(0, config, metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
        new ExtractionStage().process(0, config, metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
        return Files.readAllLines(ArtifactNaming.traces(outputDir, BASE, 0).toPath(), StandardCharsets.UTF_8);
    }

    @Test
    public void testTable() throws IOException {
        List<String> lines = run(config(2, 1, new ChannelSelection(1, false, "intensity_mean", "intensity_total")));
        assertEquals("fov,cell,frame,time,good,position_x,position_y,bbox_x0,bbox_y0,bbox_x1,bbox_y1,area_ch_0,intensity_mean_ch_1,intensity_total_ch_1", lines.get(0));
        assertEquals(4, lines.size());
        assertEquals("0,1,0,0,true,3.5,3.5,1,1,7,7,16,5,80", lines.get(1));
        assertTrue(lines.get(3).startsWith("0,1,2,2,"));
    }

    @Test
    public void testBackgroundWeight() throws IOException {
        List<String> lines = run(config(2, 0.5, ChannelSelection.fluorescence(1, "intensity_mean")));
        assertTrue(lines.get(1), lines.get(1).endsWith(",16,6"));
    }

    @Test
    public void testBoundingBoxAsMask() throws IOException {
        List<String> lines = run(config(2, 0, new ChannelSelection(1, true, "area")));
        assertTrue(lines.get(1), lines.get(1).endsWith(",16,36"));
    }

    @Test
    public void testMissingChannel() throws IOException {
        List<String> lines = run(config(2, 1, ChannelSelection.fluorescence(2, "intensity_mean")));
        assertEquals("fov,cell,frame,time,good,position_x,position_y,bbox_x0,bbox_y0,bbox_x1,bbox_y1,area_ch_0,intensity_mean_ch_2", lines.get(0));
        assertTrue(lines.get(1), lines.get(1).endsWith(",16,NaN"));
    }

    @Test
    public void testEmptyContainer() throws IOException {
        List<String> lines = run(config(10, 1, ChannelSelection.fluorescence(1, "intensity_mean")));
        assertEquals("header only", 1, lines.size());
    }

    @Test
    public void testTimepoints() throws IOException {
        metadata.setTimepoints(new double[]{0, 120000, 240000});
        List<String> lines = run(config(2, 1));
        assertTrue(lines.get(2), lines.get(2).startsWith("0,1,1,2,"));
    }

    @Test
    public void testCancelled() throws IOException {
        ProcessingConfig config = config(1, 1);
        new CroppingStage().process(0, config, metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
        CancellationToken cancel = new CancellationToken();
        cancel.cancel();
        ExtractionStage stage = new ExtractionStage();
        stage.process(0, config, metadata, outputDir, cancel, ProgressCallback.NONE);
        assertFalse(stage.isDone(0, config, metadata, outputDir));
        assertFalse(StageTestUtils.hasPartFiles(ArtifactNaming.fovDir(outputDir, 0)));
    }

    @Test(expected = FileNotFoundException.class)
    public void testMissingCrops() throws IOException {
        new ExtractionStage().process(0, config(1, 1), metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testUnknownFeature() {
        ExtractionStage.getFeatureColumns(config(1, 1, ChannelSelection.fluorescence(1, "volume")));
    }
}
