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
package celltrace.plugins;

/**
 * Input of a {@link CellFeature}: the pixel crop of one channel around a cell, the region to measure and an optional background crop
 */
public class FeatureContext {
    final float[] image;
    final boolean[] mask;
    final float[] background;
    final double backgroundWeight;
    final int sizeX, sizeY;

    /**
     * @param background null if there is no background for this channel
     * @param backgroundWeight clamped to [0, 1]
     */
    public FeatureContext(float[] image, boolean[] mask, float[] background, double backgroundWeight, int sizeX, int sizeY) {
        if (image.length!=sizeX*sizeY || mask.length!=image.length) throw new IllegalArgumentException("crop sizes do not match");
        if (background!=null && background.length!=image.length) throw new IllegalArgumentException("background size does not match crop");
        this.image = image;
        this.mask = mask;
        this.background = background;
        this.backgroundWeight = Math.max(0, Math.min(1, backgroundWeight));
        this.sizeX = sizeX;
        this.sizeY = sizeY;
    }

    public float[] getImage() {
        return image;
    }
    public boolean[] getMask() {
        return mask;
    }
    public boolean hasBackground() {
        return background!=null;
    }
    public float[] getBackground() {
        return background;
    }
    public double getBackgroundWeight() {
        return backgroundWeight;
    }
    public int sizeX() {
        return sizeX;
    }
    public int sizeY() {
        return sizeY;
    }

    /**
     * @return pixel value with weighted background subtracted (no subtraction without background)
     */
    public double getCorrectedValue(int idx) {
        if (background==null || backgroundWeight==0) return image[idx];
        return image[idx] - backgroundWeight * background[idx];
    }
}
