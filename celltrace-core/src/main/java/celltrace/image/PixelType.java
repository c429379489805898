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
package celltrace.image;

/**
 * Pixel types of on-disk frame stacks
 */
public enum PixelType {
    UINT8(1, 1), UINT16(2, 2), FLOAT32(3, 4);
    public final int code;
    public final int bytes;
    PixelType(int code, int bytes) {
        this.code = code;
        this.bytes = bytes;
    }
    public static PixelType fromCode(int code) {
        for (PixelType t : values()) if (t.code==code) return t;
        throw new IllegalArgumentException("Unknown pixel type code: "+code);
    }
}
