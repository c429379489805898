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

import com.google.common.collect.Lists;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits the FOV list into sequential batches, and each batch into contiguous ranges, one per worker
 */
public class BatchPartitioner {

    /**
     * @return contiguous batches of at most {@code batchSize} elements, in list order
     */
    public static <T> List<List<T>> batches(List<T> items, int batchSize) {
        if (batchSize<1) throw new IllegalArgumentException("Batch size must be >=1");
        List<List<T>> res = new ArrayList<>();
        for (List<T> b : Lists.partition(items, batchSize)) res.add(new ArrayList<>(b));
        return res;
    }

    /**
     * Splits {@code batch} into at most {@code nWorkers} non-empty contiguous ranges whose sizes differ by at most one; the first ranges receive the remainder.
     */
    public static <T> List<List<T>> workerRanges(List<T> batch, int nWorkers) {
        if (nWorkers<1) throw new IllegalArgumentException("Worker count must be >=1");
        List<List<T>> res = new ArrayList<>();
        int n = batch.size();
        if (n==0) return res;
        int w = Math.min(nWorkers, n);
        int size = n / w, remainder = n % w;
        int start = 0;
        for (int i = 0; i<w; ++i) {
            int end = start + size + (i<remainder ? 1 : 0);
            res.add(new ArrayList<>(batch.subList(start, end)));
            start = end;
        }
        return res;
    }
}
