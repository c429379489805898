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
package celltrace.processing;

/**
 * Binary morphology on 2D masks stored in row-major boolean arrays, with square structuring elements.
 * Pixels outside the image are considered as background: erosion removes objects touching the border within the element's radius.
 */
public class BinaryMorphology {

    /**
     * @param radius half side of the square element (radius 3 gives a 7x7 square)
     */
    public static boolean[] erode(boolean[] mask, int sizeX, int sizeY, int radius) {
        if (radius<=0) return mask.clone();
        int[] integral = integral(mask, sizeX, sizeY);
        int full = (2*radius+1)*(2*radius+1);
        boolean[] res = new boolean[mask.length];
        for (int y = radius; y<sizeY-radius; ++y) {
            for (int x = radius; x<sizeX-radius; ++x) {
                res[x + y * sizeX] = count(integral, sizeX, x-radius, y-radius, x+radius, y+radius) == full;
            }
        }
        return res;
    }

    public static boolean[] dilate(boolean[] mask, int sizeX, int sizeY, int radius) {
        if (radius<=0) return mask.clone();
        int[] integral = integral(mask, sizeX, sizeY);
        boolean[] res = new boolean[mask.length];
        for (int y = 0; y<sizeY; ++y) {
            for (int x = 0; x<sizeX; ++x) {
                int xMin = Math.max(0, x-radius), yMin = Math.max(0, y-radius);
                int xMax = Math.min(sizeX-1, x+radius), yMax = Math.min(sizeY-1, y+radius);
                res[x + y * sizeX] = count(integral, sizeX, xMin, yMin, xMax, yMax) > 0;
            }
        }
        return res;
    }

    public static boolean[] open(boolean[] mask, int sizeX, int sizeY, int radius, int iterations) {
        boolean[] res = mask;
        for (int i = 0; i<iterations; ++i) res = erode(res, sizeX, sizeY, radius);
        for (int i = 0; i<iterations; ++i) res = dilate(res, sizeX, sizeY, radius);
        return res;
    }

    public static boolean[] close(boolean[] mask, int sizeX, int sizeY, int radius, int iterations) {
        boolean[] res = mask;
        for (int i = 0; i<iterations; ++i) res = dilate(res, sizeX, sizeY, radius);
        for (int i = 0; i<iterations; ++i) res = erode(res, sizeX, sizeY, radius);
        return res;
    }

    /**
     * Binary fill: background pixels that cannot be reached from the border through 4-connected background are set to foreground
     */
    public static boolean[] fillHoles(boolean[] mask, int sizeX, int sizeY) {
        boolean[] reached = new boolean[mask.length];
        int[] stack = new int[mask.length];
        int size = 0;
        for (int x = 0; x<sizeX; ++x) {
            size = push(mask, reached, stack, size, x);
            size = push(mask, reached, stack, size, x + (sizeY-1) * sizeX);
        }
        for (int y = 0; y<sizeY; ++y) {
            size = push(mask, reached, stack, size, y * sizeX);
            size = push(mask, reached, stack, size, sizeX - 1 + y * sizeX);
        }
        while (size>0) {
            int c = stack[--size];
            int x = c % sizeX, y = c / sizeX;
            if (x>0) size = push(mask, reached, stack, size, c-1);
            if (x<sizeX-1) size = push(mask, reached, stack, size, c+1);
            if (y>0) size = push(mask, reached, stack, size, c-sizeX);
            if (y<sizeY-1) size = push(mask, reached, stack, size, c+sizeX);
        }
        boolean[] res = new boolean[mask.length];
        for (int i = 0; i<res.length; ++i) res[i] = !reached[i];
        return res;
    }
    private static int push(boolean[] mask, boolean[] reached, int[] stack, int size, int coord) {
        if (mask[coord] || reached[coord]) return size;
        reached[coord] = true;
        stack[size++] = coord;
        return size;
    }

    public static int count(boolean[] mask) {
        int c = 0;
        for (boolean b : mask) if (b) ++c;
        return c;
    }

    // integral image with one extra row and column of zeros
    static int[] integral(boolean[] mask, int sizeX, int sizeY) {
        int w = sizeX + 1;
        int[] res = new int[w * (sizeY + 1)];
        for (int y = 0; y<sizeY; ++y) {
            int rowSum = 0;
            for (int x = 0; x<sizeX; ++x) {
                if (mask[x + y * sizeX]) ++rowSum;
                res[(x+1) + (y+1) * w] = res[(x+1) + y * w] + rowSum;
            }
        }
        return res;
    }
    static int count(int[] integral, int sizeX, int xMin, int yMin, int xMax, int yMax) {
        int w = sizeX + 1;
        return integral[(xMax+1) + (yMax+1) * w] - integral[xMin + (yMax+1) * w] - integral[(xMax+1) + yMin * w] + integral[xMin + yMin * w];
    }
}
