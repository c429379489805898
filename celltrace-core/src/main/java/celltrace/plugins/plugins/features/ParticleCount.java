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
package celltrace.plugins.plugins.features;

import celltrace.plugins.CellFeature;
import celltrace.plugins.FeatureContext;
import celltrace.processing.Filters;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Counts fluorescent spots inside the measured region.
 * The background-corrected image (negative values set to 0) is restricted to the region and smoothed; pixels brighter than the mean of the region are candidates,
 * local maxima separated by at least {@code minDistance} pixels are spot seeds and each candidate pixel is assigned to the closest seed.
 * Spots whose half mean bounding box side is lower than {@code minRadius} or whose brightest corrected pixel is lower than {@code minIntensity} are not counted.
 */
public class ParticleCount implements CellFeature {
    double sigma = 2;
    int minDistance = 30;
    double minRadius = 3;
    double minIntensity = 50;

    public ParticleCount() {}

    public ParticleCount(double sigma, int minDistance, double minRadius, double minIntensity) {
        this.sigma = sigma;
        this.minDistance = minDistance;
        this.minRadius = minRadius;
        this.minIntensity = minIntensity;
    }

    @Override
    public double compute(FeatureContext context) {
        boolean[] mask = context.getMask();
        int sizeX = context.sizeX(), sizeY = context.sizeY();
        float[] corrected = new float[mask.length];
        double sum = 0;
        int count = 0;
        for (int i = 0; i<mask.length; ++i) {
            if (mask[i]) {
                corrected[i] = (float)Math.max(0, context.getCorrectedValue(i));
                ++count;
            }
        }
        if (count==0) return 0;
        float[] smoothed = Filters.gaussianBlur(corrected, sizeX, sizeY, sigma);
        for (int i = 0; i<mask.length; ++i) if (mask[i]) sum += smoothed[i];
        double threshold = sum / count;
        boolean[] spotMask = new boolean[mask.length];
        for (int i = 0; i<mask.length; ++i) spotMask[i] = mask[i] && smoothed[i] > threshold;

        List<Integer> seeds = getSeeds(smoothed, spotMask, sizeX, sizeY);
        if (seeds.isEmpty()) return 0;
        int nSeeds = seeds.size();
        int[] minX = new int[nSeeds], minY = new int[nSeeds], maxX = new int[nSeeds], maxY = new int[nSeeds];
        double[] maxIntensity = new double[nSeeds];
        for (int s = 0; s<nSeeds; ++s) {
            minX[s] = Integer.MAX_VALUE;
            minY[s] = Integer.MAX_VALUE;
            maxX[s] = -1;
            maxY[s] = -1;
        }
        for (int i = 0; i<mask.length; ++i) {
            if (!spotMask[i]) continue;
            int x = i % sizeX, y = i / sizeX;
            int closest = 0;
            double dMin = Double.POSITIVE_INFINITY;
            for (int s = 0; s<nSeeds; ++s) {
                int sx = seeds.get(s) % sizeX, sy = seeds.get(s) / sizeX;
                double d = (double)(sx - x) * (sx - x) + (double)(sy - y) * (sy - y);
                if (d<dMin) {
                    dMin = d;
                    closest = s;
                }
            }
            minX[closest] = Math.min(minX[closest], x);
            maxX[closest] = Math.max(maxX[closest], x);
            minY[closest] = Math.min(minY[closest], y);
            maxY[closest] = Math.max(maxY[closest], y);
            maxIntensity[closest] = Math.max(maxIntensity[closest], corrected[i]);
        }
        int res = 0;
        for (int s = 0; s<nSeeds; ++s) {
            double radius = 0.5 * ((maxX[s] - minX[s] + 1) + (maxY[s] - minY[s] + 1)) / 2d;
            if (radius>=minRadius && maxIntensity[s]>=minIntensity) ++res;
        }
        return res;
    }

    /**
     * @return local maxima of {@code image} within {@code mask}, brightest first, at least {@code minDistance} pixels (chessboard distance) from each other
     */
    List<Integer> getSeeds(float[] image, boolean[] mask, int sizeX, int sizeY) {
        List<Integer> candidates = new ArrayList<>();
        for (int y = 0; y<sizeY; ++y) {
            for (int x = 0; x<sizeX; ++x) {
                int i = x + y * sizeX;
                if (mask[i] && isLocalMax(image, mask, sizeX, sizeY, x, y)) candidates.add(i);
            }
        }
        candidates.sort(Comparator.comparingDouble((Integer i) -> -image[i]).thenComparingInt(i -> i));
        List<Integer> seeds = new ArrayList<>();
        for (int c : candidates) {
            int cx = c % sizeX, cy = c / sizeX;
            boolean far = true;
            for (int s : seeds) {
                if (Math.max(Math.abs(s % sizeX - cx), Math.abs(s / sizeX - cy)) < minDistance) {
                    far = false;
                    break;
                }
            }
            if (far) seeds.add(c);
        }
        return seeds;
    }
    private static boolean isLocalMax(float[] image, boolean[] mask, int sizeX, int sizeY, int x, int y) {
        float v = image[x + y * sizeX];
        for (int dy = -1; dy<=1; ++dy) {
            for (int dx = -1; dx<=1; ++dx) {
                int nx = x + dx, ny = y + dy;
                if ((dx==0 && dy==0) || nx<0 || ny<0 || nx>=sizeX || ny>=sizeY) continue;
                if (mask[nx + ny * sizeX] && image[nx + ny * sizeX] > v) return false;
            }
        }
        return true;
    }
}
