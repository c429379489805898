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

import org.apache.commons.math3.stat.descriptive.rank.Median;

/**
 * Smooth background surface of a fluorescence frame, estimated from pixels outside of segmented objects.
 * The frame is split into square tiles, the median of background pixels is computed in each tile and tile values are bilinearly interpolated between tile centers.
 */
public class BackgroundEstimator {
    public static final int DEFAULT_TILE_SIZE = 32;
    public static final int DEFAULT_FOREGROUND_DILATION = 1;
    final int tileSize;
    final int foregroundDilation;
    final int minPixelsPerTile;

    public BackgroundEstimator() {
        this(DEFAULT_TILE_SIZE, DEFAULT_FOREGROUND_DILATION);
    }
    public BackgroundEstimator(int tileSize, int foregroundDilation) {
        if (tileSize<1) throw new IllegalArgumentException("Tile size must be >=1");
        this.tileSize = tileSize;
        this.foregroundDilation = Math.max(0, foregroundDilation);
        this.minPixelsPerTile = Math.max(1, tileSize * tileSize / 10);
    }

    /**
     * @param image fluorescence frame
     * @param labels segmentation of the same frame, 0 = background
     * @return background estimate, same size as {@code image}
     */
    public float[] estimate(float[] image, int[] labels, int sizeX, int sizeY) {
        boolean[] foreground = new boolean[labels.length];
        for (int i = 0; i<labels.length; ++i) foreground[i] = labels[i]!=0;
        foreground = BinaryMorphology.dilate(foreground, sizeX, sizeY, foregroundDilation);

        int nTX = (sizeX + tileSize - 1) / tileSize;
        int nTY = (sizeY + tileSize - 1) / tileSize;
        double[] tiles = new double[nTX * nTY];
        double[] buffer = new double[tileSize * tileSize];
        double[] all = new double[image.length];
        int allCount = 0;
        Median median = new Median();
        for (int ty = 0; ty<nTY; ++ty) {
            for (int tx = 0; tx<nTX; ++tx) {
                int count = 0;
                for (int y = ty * tileSize; y<Math.min(sizeY, (ty+1) * tileSize); ++y) {
                    for (int x = tx * tileSize; x<Math.min(sizeX, (tx+1) * tileSize); ++x) {
                        int i = x + y * sizeX;
                        if (!foreground[i]) {
                            buffer[count++] = image[i];
                            all[allCount++] = image[i];
                        }
                    }
                }
                tiles[tx + ty * nTX] = count>=minPixelsPerTile ? median.evaluate(buffer, 0, count) : Double.NaN;
            }
        }
        double fallback = allCount>0 ? median.evaluate(all, 0, allCount) : 0;
        for (int i = 0; i<tiles.length; ++i) if (Double.isNaN(tiles[i])) tiles[i] = fallback;
        return interpolate(tiles, nTX, nTY, sizeX, sizeY);
    }

    float[] interpolate(double[] tiles, int nTX, int nTY, int sizeX, int sizeY) {
        float[] res = new float[sizeX * sizeY];
        double half = (tileSize - 1) / 2d;
        for (int y = 0; y<sizeY; ++y) {
            double fy = clamp((y - half) / tileSize, nTY - 1);
            int ty0 = (int)Math.floor(fy);
            int ty1 = Math.min(nTY - 1, ty0 + 1);
            double wy = fy - ty0;
            for (int x = 0; x<sizeX; ++x) {
                double fx = clamp((x - half) / tileSize, nTX - 1);
                int tx0 = (int)Math.floor(fx);
                int tx1 = Math.min(nTX - 1, tx0 + 1);
                double wx = fx - tx0;
                double top = (1 - wx) * tiles[tx0 + ty0 * nTX] + wx * tiles[tx1 + ty0 * nTX];
                double bottom = (1 - wx) * tiles[tx0 + ty1 * nTX] + wx * tiles[tx1 + ty1 * nTX];
                res[x + y * sizeX] = (float)((1 - wy) * top + wy * bottom);
            }
        }
        return res;
    }
    private static double clamp(double v, int max) {
        return v<0 ? 0 : (v>max ? max : v);
    }
}
