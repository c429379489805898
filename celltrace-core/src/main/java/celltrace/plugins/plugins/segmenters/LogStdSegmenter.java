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
package celltrace.plugins.plugins.segmenters;

import celltrace.image.ImageLabeller;
import celltrace.plugins.Segmenter;
import celltrace.processing.BinaryMorphology;
import celltrace.processing.Filters;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Segments textured objects (e.g. cells in phase contrast) over a flat background.
 * Foreground is where the local log standard deviation exceeds the histogram mode of the log standard deviation image by 3 standard deviations of the values below the mode.
 * The binary mask is then filled, opened and closed, and 4-connected components are labeled.
 */
public class LogStdSegmenter implements Segmenter {
    public final static Logger logger = LoggerFactory.getLogger(LogStdSegmenter.class);
    int windowRadius = 1;
    int nBins = 200;
    double nSigma = 3;
    int morphoRadius = 3;
    int morphoIterations = 3;

    public LogStdSegmenter() {}

    public LogStdSegmenter(int windowRadius, int morphoRadius, int morphoIterations) {
        this.windowRadius = windowRadius;
        this.morphoRadius = morphoRadius;
        this.morphoIterations = morphoIterations;
    }

    @Override
    public int[] segment(float[] frame, int sizeX, int sizeY) {
        float[] logStd = Filters.localLogStd(frame, sizeX, sizeY, windowRadius);
        double thld = getThreshold(logStd, nBins, nSigma);
        boolean[] mask = new boolean[logStd.length];
        for (int i = 0; i<mask.length; ++i) mask[i] = logStd[i] > thld;
        mask = BinaryMorphology.fillHoles(mask, sizeX, sizeY);
        mask = BinaryMorphology.open(mask, sizeX, sizeY, morphoRadius, morphoIterations);
        mask = BinaryMorphology.close(mask, sizeX, sizeY, morphoRadius, morphoIterations);
        logger.trace("logstd threshold: {}, foreground pixels: {}", thld, BinaryMorphology.count(mask));
        return ImageLabeller.labelImageLowConnectivity(mask, sizeX, sizeY);
    }

    /**
     * @return center of the most populated histogram bin + {@code nSigma} x standard deviation of values lower or equal to it
     */
    public static double getThreshold(float[] values, int nBins, double nSigma) {
        double min = Double.POSITIVE_INFINITY, max = Double.NEGATIVE_INFINITY;
        for (float v : values) {
            if (v<min) min = v;
            if (v>max) max = v;
        }
        if (!(max>min)) return max;
        double binSize = (max - min) / nBins;
        int[] counts = new int[nBins];
        for (float v : values) {
            int b = (int)((v - min) / binSize);
            if (b>=nBins) b = nBins-1;
            ++counts[b];
        }
        int modeBin = 0;
        for (int b = 1; b<nBins; ++b) if (counts[b]>counts[modeBin]) modeBin = b;
        double mode = min + (modeBin + 0.5) * binSize;
        double sum = 0, sum2 = 0;
        int n = 0;
        for (float v : values) {
            if (v<=mode) {
                sum += v;
                sum2 += (double)v * v;
                ++n;
            }
        }
        double sigma = 0;
        if (n>0) {
            double mean = sum / n;
            sigma = Math.sqrt(Math.max(0, sum2 / n - mean * mean));
        }
        return mode + nSigma * sigma;
    }
}
