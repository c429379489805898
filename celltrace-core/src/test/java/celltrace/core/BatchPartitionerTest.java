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

import org.junit.Test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;

public class BatchPartitionerTest {

    static List<Integer> range(int n) {
        List<Integer> res = new ArrayList<>();
        for (int i = 0; i<n; ++i) res.add(i);
        return res;
    }

    @Test
    public void testSixFovsBatchFourTwoWorkers() {
        List<List<Integer>> batches = BatchPartitioner.batches(range(6), 4);
        assertEquals(Arrays.asList(Arrays.asList(0, 1, 2, 3), Arrays.asList(4, 5)), batches);
        assertEquals(Arrays.asList(Arrays.asList(0, 1), Arrays.asList(2, 3)), BatchPartitioner.workerRanges(batches.get(0), 2));
        assertEquals(Arrays.asList(Arrays.asList(4), Arrays.asList(5)), BatchPartitioner.workerRanges(batches.get(1), 2));
    }

    @Test
    public void testRemainderGoesToFirstRanges() {
        assertEquals(Arrays.asList(Arrays.asList(0, 1, 2), Arrays.asList(3, 4), Arrays.asList(5, 6)), BatchPartitioner.workerRanges(range(7), 3));
        assertEquals("no empty range", 2, BatchPartitioner.workerRanges(range(2), 5).size());
        assertTrue(BatchPartitioner.workerRanges(Collections.<Integer>emptyList(), 3).isEmpty());
    }

    @Test
    public void testPartitionProperties() {
        for (int n = 0; n<25; ++n) {
            List<Integer> items = range(n);
            for (int batchSize = 1; batchSize<8; ++batchSize) {
                List<Integer> union = new ArrayList<>();
                for (List<Integer> batch : BatchPartitioner.batches(items, batchSize)) {
                    assertTrue(batch.size()<=batchSize);
                    for (int workers = 1; workers<6; ++workers) {
                        List<List<Integer>> ranges = BatchPartitioner.workerRanges(batch, workers);
                        assertTrue(ranges.size()<=workers);
                        int min = Integer.MAX_VALUE, max = 0;
                        List<Integer> batchUnion = new ArrayList<>();
                        for (List<Integer> r : ranges) {
                            min = Math.min(min, r.size());
                            max = Math.max(max, r.size());
                            batchUnion.addAll(r);
                        }
                        if (!ranges.isEmpty()) assertTrue("sizes differ by at most one", max - min <= 1);
                        assertEquals("ranges are disjoint, contiguous and cover the batch", batch, batchUnion);
                    }
                    union.addAll(batch);
                }
                assertEquals("batches preserve order", items, union);
            }
        }
    }

    @Test(expected = IllegalArgumentException.class)
    public void testInvalidBatchSize() {
        BatchPartitioner.batches(range(3), 0);
    }
}
