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
package celltrace.configuration;

import celltrace.image.io.MicroscopyMetadata;
import celltrace.utils.FileIO;
import celltrace.utils.JSONUtils;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.io.IOException;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;

public class ProcessingConfigTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    static ProcessingConfig config(String fovs) {
        return new ProcessingConfig(ChannelSelection.phaseContrast(0, "area"),
                Arrays.asList(ChannelSelection.fluorescence(1, "intensity_total", "intensity_mean")),
                ProcessingParams.builder().fovs(fovs).batchSize(3).nWorkers(4).minFrames(2).maskMargin(-1).build());
    }

    @Test
    public void testDefaults() {
        ProcessingParams p = ProcessingParams.builder().build();
        assertEquals("all", p.getFovs());
        assertEquals(2, p.getBatchSize());
        assertEquals(2, p.getNWorkers());
        assertEquals("logstd", p.getSegmentationMethod());
        assertEquals("iou", p.getTrackingMethod());
        assertEquals(5, p.getCropPadding());
        assertEquals(0, p.getMaskMargin());
        assertEquals(1, p.getMinFrames());
        assertEquals(1, p.getBackgroundWeight(), 0);
        assertNull(p.getMinCellSize());
        assertEquals(0.5, ProcessingParams.builder().backgroundWeight(0.5).build().getBackgroundWeight(), 0);
        assertEquals("weight clamped to [0, 1]", 1, ProcessingParams.builder().backgroundWeight(3).build().getBackgroundWeight(), 0);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBatchSize() {
        ProcessingParams.builder().batchSize(0).build();
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidWorkerCount() {
        ProcessingParams.builder().nWorkers(0).build();
    }

    @Test
    public void testJSON() throws Exception {
        ProcessingConfig c = config("0-2");
        ProcessingConfig c2 = new ProcessingConfig();
        c2.initFromJSONEntry(JSONUtils.parse(JSONUtils.serialize(c)));
        assertEquals(c.getPhaseContrast(), c2.getPhaseContrast());
        assertEquals(c.getFluorescence(), c2.getFluorescence());
        assertEquals(JSONUtils.serialize(c.getParams()), JSONUtils.serialize(c2.getParams()));
        assertTrue("fluorescence default: features over the bounding box", c2.getFluorescence().get(0).isBboxAsMask());
        assertFalse(c2.getPhaseContrast().isBboxAsMask());
    }

    @Test
    public void testValidate() {
        MicroscopyMetadata md = new MicroscopyMetadata("test", 4, 2, 3, 10, 10);
        assertEquals(Arrays.asList(0, 1, 2), config("0-2").validate(md));
        try {
            config("2-5").validate(md);
            throw new AssertionError("FOV out of range should be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
        ProcessingConfig badChannel = new ProcessingConfig(ChannelSelection.phaseContrast(0), Collections.singletonList(ChannelSelection.fluorescence(2)), ProcessingParams.builder().build());
        try {
            badChannel.validate(md);
            throw new AssertionError("channel out of range should be rejected");
        } catch (IllegalArgumentException e) {
            // expected
        }
    }

    @Test
    public void testSaveNeverOverwrites() throws IOException {
        File f = new File(testFolder.getRoot(), "processing_config.json");
        assertTrue(config("0").saveIfAbsent(f));
        String content = FileIO.readToString(f);
        assertFalse(config("1-2").saveIfAbsent(f));
        assertEquals(content, FileIO.readToString(f));
        assertEquals("0", ProcessingConfig.load(f).getParams().getFovs());
    }
}
