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

import celltrace.utils.Pair;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Counts of a workflow run. The run is successful when every target FOV completed.
 */
public class WorkflowResult {
    final int total;
    int completed;
    boolean cancelled;
    final List<Pair<Integer, Throwable>> failures = new ArrayList<>();

    public WorkflowResult(int total) {
        this.total = total;
    }

    void add(FovResult r) {
        switch (r.status) {
            case COMPLETED:
                ++completed;
                break;
            case CANCELLED:
                cancelled = true;
                break;
            default:
                failures.add(new Pair<>(r.fov, r.error));
        }
    }
    void addFailure(int fov, Throwable error) {
        failures.add(new Pair<>(fov, error));
    }
    void setCancelled() {
        cancelled = true;
    }

    public int getTotal() {
        return total;
    }
    public int getCompleted() {
        return completed;
    }
    public int getFailed() {
        return failures.size();
    }
    public boolean isCancelled() {
        return cancelled;
    }
    public List<Pair<Integer, Throwable>> getFailures() {
        return Collections.unmodifiableList(failures);
    }
    public boolean isSuccess() {
        return completed == total;
    }

    @Override
    public String toString() {
        return "WorkflowResult[completed=" + completed + "/" + total + ", failed=" + getFailed() + (cancelled ? ", cancelled" : "") + "]";
    }
}
