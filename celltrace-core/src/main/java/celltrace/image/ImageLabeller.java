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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Connected component labelling of a 2D binary mask
 */
public class ImageLabeller {
    public static final int[][] neigh2D8Half = new int[][]{ {1, -1}, {0, -1}, {-1, -1}, {-1, 0} };
    public static final int[][] neigh2D4Half = new int[][]{ {0, -1}, {-1, 0} };
    final boolean[] mask;
    final int sizeX, sizeY;
    final int[] imLabels;
    final Map<Integer, Spot> spots = new TreeMap<>();
    int[][] neigh = neigh2D4Half;

    public ImageLabeller(boolean[] mask, int sizeX, int sizeY) {
        if (mask.length != sizeX * sizeY) throw new IllegalArgumentException("mask size does not match dimensions");
        this.mask = mask;
        this.sizeX = sizeX;
        this.sizeY = sizeY;
        this.imLabels = new int[mask.length];
    }

    /**
     * Labels 4-connected components. Labels are consecutive starting from 1, in raster order of their first pixel.
     * @return label array of the same size as {@code mask}, 0 = background
     */
    public static int[] labelImageLowConnectivity(boolean[] mask, int sizeX, int sizeY) {
        ImageLabeller il = new ImageLabeller(mask, sizeX, sizeY);
        il.neigh = neigh2D4Half;
        il.labelSpots();
        return il.getLabels();
    }

    public static int[] labelImage(boolean[] mask, int sizeX, int sizeY) {
        ImageLabeller il = new ImageLabeller(mask, sizeX, sizeY);
        il.neigh = neigh2D8Half;
        il.labelSpots();
        return il.getLabels();
    }

    protected int[] getLabels() {
        int label = 1;
        for (Spot s : spots.values()) s.setLabel(label++);
        return imLabels;
    }

    private void labelSpots() {
        int currentLabel = 1;
        for (int y = 0; y < sizeY; ++y) {
            for (int x = 0; x < sizeX; ++x) {
                int coord = x + y * sizeX;
                if (!mask[coord]) continue;
                Spot currentSpot = null;
                for (int[] t : neigh) {
                    int nx = x + t[0], ny = y + t[1];
                    if (nx<0 || nx>=sizeX || ny<0) continue;
                    int nextLabel = imLabels[nx + ny * sizeX];
                    if (nextLabel != 0) {
                        if (currentSpot == null) {
                            currentSpot = spots.get(nextLabel);
                            currentSpot.addVox(coord);
                        } else if (nextLabel != currentSpot.label) {
                            currentSpot = currentSpot.fusion(spots.get(nextLabel));
                        }
                    }
                }
                if (currentSpot == null) {
                    spots.put(currentLabel, new Spot(currentLabel++, coord));
                }
            }
        }
    }

    class Spot {
        final List<Integer> voxels = new ArrayList<>();
        int label;

        Spot(int label, int coord) {
            this.label = label;
            addVox(coord);
        }

        void addVox(int c) {
            voxels.add(c);
            imLabels[c] = label;
        }

        void setLabel(int label) {
            this.label = label;
            for (int c : voxels) imLabels[c] = label;
        }

        Spot fusion(Spot other) {
            if (other.label < label) {
                return other.fusion(this);
            }
            spots.remove(other.label);
            for (int c : other.voxels) imLabels[c] = label;
            voxels.addAll(other.voxels);
            other.voxels.clear();
            return this;
        }
    }
}
