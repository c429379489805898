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
package celltrace.image.io;

import java.io.Closeable;
import java.io.IOException;

/**
 * Source of raw acquisition planes. Implementations decode a given microscopy format.
 */
public interface FrameReader extends Closeable {
    /**
     * @return the plane (fov, channel, frame) as unsigned 16-bit values in row-major order, of size height * width
     */
    short[] readFrame(int fov, int channel, int frame) throws IOException;
    MicroscopyMetadata getMetadata();
}
