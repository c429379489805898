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
import celltrace.data_structure.CellCrop;
import celltrace.data_structure.CropContainer;
import celltrace.image.BoundingBox;
import celltrace.image.io.MicroscopyMetadata;
import celltrace.processing.BinaryMorphology;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static celltrace.core.stage.StageTestUtils.BASE;
import static celltrace.core.stage.StageTestUtils.SIZE;
import static org.junit.Assert.*;

public class CroppingStageTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();
    File outputDir;
    MicroscopyMetadata metadata = new MicroscopyMetadata(BASE, 1, 2, 3, SIZE, SIZE);

    @Before
    public void setUp() throws IOException {
        outputDir = testFolder.newFolder("output");
        StageTestUtils.writeTracked(outputDir, 0, 3);
        StageTestUtils.writeIndexStack(ArtifactNaming.pcStack(outputDir, BASE, 0, 0), 3);
        StageTestUtils.writeConstantStack(ArtifactNaming.flStack(outputDir, BASE, 0, 1), 3, 7);
        StageTestUtils.writeConstantStack(ArtifactNaming.flBackground(outputDir, BASE, 0, 1), 3, 2);
    }

    static ProcessingConfig config(int minFrames, int maskMargin) {
        return new ProcessingConfig(ChannelSelection.phaseContrast(0, "area"), Arrays.asList(ChannelSelection.fluorescence(1, "intensity_mean")),
                ProcessingParams.builder().cropPadding(1).minFrames(minFrames).maskMargin(maskMargin).build());
    }

    @Test
    public void testCrops() throws IOException {
        CroppingStage stage = new CroppingStage();
        ProcessingConfig config = config(2, 0);
        assertFalse(stage.isDone(0, config, metadata, outputDir));
        List<String> messages = new ArrayList<>();
        stage.process(0, config, metadata, outputDir, new CancellationToken(), (c, t, m) -> messages.add(m));
        assertTrue(stage.isDone(0, config, metadata, outputDir));
        assertEquals(Arrays.asList("Computing bounding boxes", "Extracting crops", "Saving crops", "Done"), messages);
        try (CropContainer.Reader reader = new CropContainer.Reader(ArtifactNaming.crops(outputDir, BASE, 0))) {
            assertEquals("cell present in a single frame is discarded", Arrays.asList(1), reader.getCellIds());
            assertEquals(Arrays.asList("pc_ch_0", "fl_ch_1"), reader.getChannels());
            assertEquals(Arrays.asList("fl_ch_1"), reader.getBackgroundChannels());
            CellCrop cell = reader.readCell(1);
            assertEquals(Arrays.asList(0, 1, 2), cell.getFrames());
            for (int i = 0; i<3; ++i) {
                assertEquals("padded box", new BoundingBox(1, 1, 7, 7), cell.getBounds(i));
                assertEquals(16, BinaryMorphology.count(cell.getMask(i)));
                assertFalse("padding is not part of the mask", cell.getMask(i)[0]);
                assertEquals("crop starts at (1,1)", 1 + SIZE, cell.getChannelCrop("pc_ch_0", i)[0], 0);
                assertEquals(36, cell.getChannelCrop("fl_ch_1", i).length);
                assertEquals(7, cell.getChannelCrop("fl_ch_1", i)[0], 0);
                assertEquals(2, cell.getBackgroundCrop("fl_ch_1", i)[0], 0);
            }
        }
        assertFalse(StageTestUtils.hasPartFiles(ArtifactNaming.fovDir(outputDir, 0)));
    }

    @Test
    public void testSkipWhenDone() throws IOException {
        CroppingStage stage = new CroppingStage();
        stage.process(0, config(1, 0), metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
        File crops = ArtifactNaming.crops(outputDir, BASE, 0);
        long modified = crops.lastModified();
        stage.process(0, config(1, 0), metadata, outputDir, new CancellationToken(), (c, t, m) -> fail("no progress expected when output exists"));
        assertEquals(modified, crops.lastModified());
        try (CropContainer.Reader reader = new CropContainer.Reader(crops)) {
            assertEquals(Arrays.asList(1, 2), reader.getCellIds());
        }
    }

    @Test
    public void testMaskMargin() throws IOException {
        new CroppingStage().process(0, config(2, -1), metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
        try (CropContainer.Reader reader = new CropContainer.Reader(ArtifactNaming.crops(outputDir, BASE, 0))) {
            CellCrop cell = reader.readCell(1);
            assertEquals("bounding box does not depend on margin", new BoundingBox(1, 1, 7, 7), cell.getBounds(0));
            assertEquals(4, BinaryMorphology.count(cell.getMask(0)));
        }
    }

    @Test
    public void testApplyMargin() {
        boolean[] mask = new boolean[25];
        for (int y = 1; y<4; ++y) for (int x = 1; x<4; ++x) mask[x + y * 5] = true;
        assertEquals(9, BinaryMorphology.count(CroppingStage.applyMargin(mask, 5, 5, 0)));
        assertEquals(25, BinaryMorphology.count(CroppingStage.applyMargin(mask, 5, 5, 1)));
        assertEquals(1, BinaryMorphology.count(CroppingStage.applyMargin(mask, 5, 5, -1)));
        assertEquals("erosion that empties the mask is not applied", 9, BinaryMorphology.count(CroppingStage.applyMargin(mask, 5, 5, -2)));
    }

    @Test
    public void testNoCells() throws IOException {
        new CroppingStage().process(0, config(10, 0), metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
        File crops = ArtifactNaming.crops(outputDir, BASE, 0);
        assertTrue(crops.exists());
        try (CropContainer.Reader reader = new CropContainer.Reader(crops)) {
            assertTrue(reader.getCellIds().isEmpty());
        }
    }

    @Test
    public void testCancelWhileSaving() throws IOException {
        CancellationToken cancel = new CancellationToken();
        new CroppingStage().process(0, config(1, 0), metadata, outputDir, cancel, (c, t, m) -> {
            if ("Saving crops".equals(m)) cancel.cancel();
        });
        assertFalse(ArtifactNaming.crops(outputDir, BASE, 0).exists());
        assertFalse("partial container is removed", StageTestUtils.hasPartFiles(ArtifactNaming.fovDir(outputDir, 0)));
    }

    @Test
    public void testCancelledBeforeStart() throws IOException {
        CancellationToken cancel = new CancellationToken();
        cancel.cancel();
        new CroppingStage().process(0, config(1, 0), metadata, outputDir, cancel, (c, t, m) -> fail("cancelled stage reports no progress"));
        assertFalse(ArtifactNaming.crops(outputDir, BASE, 0).exists());
    }

    @Test(expected = FileNotFoundException.class)
    public void testMissingTrackedSegmentation() throws IOException {
        File empty = testFolder.newFolder("empty");
        new CroppingStage().process(0, config(1, 0), metadata, empty, new CancellationToken(), ProgressCallback.NONE);
    }

    @Test
    public void testWithoutPhaseContrast() throws IOException {
        ProcessingConfig config = new ProcessingConfig(null, Arrays.asList(ChannelSelection.fluorescence(1, "intensity_mean")), ProcessingParams.builder().build());
        CroppingStage stage = new CroppingStage();
        assertTrue(stage.isDone(0, config, metadata, outputDir));
        stage.process(0, config, metadata, outputDir, new CancellationToken(), ProgressCallback.NONE);
        assertFalse(ArtifactNaming.crops(outputDir, BASE, 0).exists());
    }
}
