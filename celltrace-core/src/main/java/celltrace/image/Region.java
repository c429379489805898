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
import java.util.TreeMap;

/**
 * Size and centroid of one labeled object in a frame
 */
public class Region {
    public final int label;
    int size;
    double sumX, sumY;

    public Region(int label) {
        this.label = label;
    }

    public static Map<Integer, Region> fromLabels(int[] labels, int sizeX) {
        Map<Integer, Region> res = new TreeMap<>();
        for (int i = 0; i<labels.length; ++i) {
            int l = labels[i];
            if (l==0) continue;
            Region r = res.get(l);
            if (r==null) {
                r = new Region(l);
                res.put(l, r);
            }
            r.size++;
            r.sumX += i % sizeX;
            r.sumY += i / sizeX;
        }
        return res;
    }

    public Region withLabel(int label) {
        Region r = new Region(label);
        r.size = size;
        r.sumX = sumX;
        r.sumY = sumY;
        return r;
    }

    public int size() {
        return size;
    }
    public double getCenterX() {
        return sumX / size;
    }
    public double getCenterY() {
        return sumY / size;
    }

    @Override
    public String toString() {
        return "Region{" + label + ", size=" + size + ", center=(" + getCenterX() + ";" + getCenterY() + ")}";
    }
}
