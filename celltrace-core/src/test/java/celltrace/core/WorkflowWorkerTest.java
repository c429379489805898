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

import celltrace.configuration.ChannelSelection;
import celltrace.configuration.ProcessingConfig;
import celltrace.configuration.ProcessingParams;
import celltrace.test_utils.SyntheticAcquisition;
import celltrace.utils.Pair;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.File;
import java.util.Arrays;

import static org.junit.Assert.*;

public class WorkflowWorkerTest {
    @Rule
    public TemporaryFolder testFolder = new TemporaryFolder();

    static ProcessingConfig config(int flChannel) {
        return new ProcessingConfig(ChannelSelection.phaseContrast(0, "area"), Arrays.asList(ChannelSelection.fluorescence(flChannel, "intensity_total")),
                ProcessingParams.builder().batchSize(1).nWorkers(1).build());
    }

    @Test
    public void testSuccess() {
        SyntheticAcquisition acquisition = new SyntheticAcquisition(1, 2, 2);
        File output = new File(testFolder.getRoot(), "output");
        WorkflowWorker worker = new WorkflowWorker(acquisition.getMetadata(), config(1), output, acquisition);
        Pair<Boolean, String> res = worker.run();
        assertTrue(res.value, res.key);
        assertEquals("Results saved to " + output.getAbsolutePath(), res.value);
        assertEquals(1, worker.getResult().getCompleted());
    }

    @Test
    public void testCancelBeforeRun() {
        SyntheticAcquisition acquisition = new SyntheticAcquisition(1, 2, 2);
        WorkflowWorker worker = new WorkflowWorker(acquisition.getMetadata(), config(1), new File(testFolder.getRoot(), "output"), acquisition);
        worker.cancel();
        worker.cancel();
        assertTrue(worker.isCancelled());
        Pair<Boolean, String> res = worker.run();
        assertFalse(res.key);
        assertEquals(WorkflowWorker.CANCELLED, res.value);
        assertNull("task did not start", worker.getResult());
        assertEquals(0, acquisition.readCount.get());
    }

    @Test
    public void testCancelDuringRun() {
        SyntheticAcquisition acquisition = new SyntheticAcquisition(3, 2, 3);
        WorkflowWorker worker = new WorkflowWorker(acquisition.getMetadata(), config(1), new File(testFolder.getRoot(), "output"), acquisition);
        worker.setProgressFactory((fov, stage) -> (c, t, m) -> {
            if ("Segmentation".equals(stage)) worker.cancel();
        });
        Pair<Boolean, String> res = worker.run();
        assertFalse(res.key);
        assertEquals(WorkflowWorker.CANCELLED, res.value);
        assertTrue(worker.getResult().getCompleted()<3);
    }

    @Test
    public void testFailure() {
        SyntheticAcquisition acquisition = new SyntheticAcquisition(2, 2, 2).setFailing(0);
        WorkflowWorker worker = new WorkflowWorker(acquisition.getMetadata(), config(1), new File(testFolder.getRoot(), "output"), acquisition);
        Pair<Boolean, String> res = worker.run();
        assertFalse(res.key);
        assertEquals(WorkflowWorker.FAILURE, res.value);
        assertEquals(1, worker.getResult().getCompleted());
        assertEquals(1, worker.getResult().getFailed());
    }

    @Test
    public void testConfigurationError() {
        SyntheticAcquisition acquisition = new SyntheticAcquisition(1, 2, 2);
        WorkflowWorker worker = new WorkflowWorker(acquisition.getMetadata(), config(3), new File(testFolder.getRoot(), "output"), acquisition);
        Pair<Boolean, String> res = worker.run();
        assertFalse(res.key);
        assertTrue(res.value, res.value.startsWith("Workflow error: "));
        assertTrue(res.value, res.value.contains("Channel 3"));
    }
}
