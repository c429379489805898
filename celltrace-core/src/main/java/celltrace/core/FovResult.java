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

/**
 * Outcome of the processing of one FOV
 */
public class FovResult {
    public enum Status {COMPLETED, CANCELLED, FAILED}
    public final int fov;
    public final Status status;
    public final int stagesCompleted;
    public final Throwable error;

    FovResult(int fov, Status status, int stagesCompleted, Throwable error) {
        this.fov = fov;
        this.status = status;
        this.stagesCompleted = stagesCompleted;
        this.error = error;
    }
    public static FovResult completed(int fov, int stagesCompleted) {
        return new FovResult(fov, Status.COMPLETED, stagesCompleted, null);
    }
    public static FovResult cancelled(int fov, int stagesCompleted) {
        return new FovResult(fov, Status.CANCELLED, stagesCompleted, null);
    }
    public static FovResult failed(int fov, int stagesCompleted, Throwable error) {
        return new FovResult(fov, Status.FAILED, stagesCompleted, error);
    }

    @Override
    public String toString() {
        return "FOV " + fov + ": " + status + " (" + stagesCompleted + " stages)" + (error==null ? "" : " " + error);
    }
}
