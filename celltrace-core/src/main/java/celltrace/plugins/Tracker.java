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
package celltrace.plugins;

import celltrace.core.CancellationToken;
import celltrace.core.ProgressCallback;
import celltrace.image.StackFile;

import java.io.IOException;

/**
 * Links labeled objects through time. The output holds, at each frame, the same pixels as the input with labels replaced by track ids that are stable across frames.
 * New ids are allocated in increasing order and never reused.
 */
public interface Tracker extends Plugin {
    /**
     * @param labelsIn per-frame labeled stack
     * @param labelsOut output stack of the same shape
     * @return false if tracking was interrupted by cancellation, in which case the output is incomplete
     */
    boolean track(StackFile labelsIn, StackFile.Writer labelsOut, CancellationToken cancel, ProgressCallback progress) throws IOException;
}
