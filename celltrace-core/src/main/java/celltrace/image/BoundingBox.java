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

import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * Axis-aligned box in pixel coordinates; end coordinates are exclusive.
 */
public class BoundingBox {
    public final int y0, x0, y1, x1;

    public BoundingBox(int y0, int x0, int y1, int x1) {
        this.y0 = y0;
        this.x0 = x0;
        this.y1 = y1;
        this.x1 = x1;
    }

    /**
     * @return box enclosing all pixels of value {@code label}, or null if there is none
     */
    public static BoundingBox of(int[] labels, int width, int label) {
        int minY = Integer.MAX_VALUE, minX = Integer.MAX_VALUE, maxY = -1, maxX = -1;
        for (int i = 0; i<labels.length; ++i) {
            if (labels[i]==label) {
                int y = i / width, x = i % width;
                if (y<minY) minY = y;
                if (y>maxY) maxY = y;
                if (x<minX) minX = x;
                if (x>maxX) maxX = x;
            }
        }
        if (maxY<0) return null;
        return new BoundingBox(minY, minX, maxY+1, maxX+1);
    }

    /**
     * Bounding boxes of all labels of a frame, in one pass
     */
    public static Map<Integer, BoundingBox> ofLabels(int[] labels, int width) {
        Map<Integer, int[]> extent = new TreeMap<>();
        for (int i = 0; i<labels.length; ++i) {
            int l = labels[i];
            if (l==0) continue;
            int y = i / width, x = i % width;
            int[] e = extent.get(l);
            if (e==null) extent.put(l, new int[]{y, x, y, x});
            else {
                if (y<e[0]) e[0] = y;
                if (x<e[1]) e[1] = x;
                if (y>e[2]) e[2] = y;
                if (x>e[3]) e[3] = x;
            }
        }
        Map<Integer, BoundingBox> res = new TreeMap<>();
        extent.forEach((l, e) -> res.put(l, new BoundingBox(e[0], e[1], e[2]+1, e[3]+1)));
        return res;
    }

    public BoundingBox pad(int padding, int height, int width) {
        return new BoundingBox(Math.max(0, y0-padding), Math.max(0, x0-padding), Math.min(height, y1+padding), Math.min(width, x1+padding));
    }

    public int sizeY() {
        return y1 - y0;
    }
    public int sizeX() {
        return x1 - x0;
    }
    public double yMean() {
        return (y0 + y1 - 1) / 2d;
    }
    public double xMean() {
        return (x0 + x1 - 1) / 2d;
    }

    public float[] crop(float[] image, int width) {
        float[] res = new float[sizeY() * sizeX()];
        int idx = 0;
        for (int y = y0; y<y1; ++y) {
            for (int x = x0; x<x1; ++x) res[idx++] = image[y * width + x];
        }
        return res;
    }
    public boolean[] cropMask(int[] labels, int width, int label) {
        boolean[] res = new boolean[sizeY() * sizeX()];
        int idx = 0;
        for (int y = y0; y<y1; ++y) {
            for (int x = x0; x<x1; ++x) res[idx++] = labels[y * width + x] == label;
        }
        return res;
    }

    public int[] toArray() {
        return new int[]{y0, x0, y1, x1};
    }
    public static BoundingBox fromArray(int[] a) {
        return new BoundingBox(a[0], a[1], a[2], a[3]);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BoundingBox)) return false;
        BoundingBox that = (BoundingBox) o;
        return y0 == that.y0 && x0 == that.x0 && y1 == that.y1 && x1 == that.x1;
    }

    @Override
    public int hashCode() {
        return Objects.hash(y0, x0, y1, x1);
    }

    @Override
    public String toString() {
        return "[y:"+y0+"-"+y1+", x:"+x0+"-"+x1+"]";
    }
}
