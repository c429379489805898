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
 * Grey-level filters on 2D float images stored in row-major arrays
 */
public class Filters {

    /**
     * Local log standard deviation: 0.5 * ln(variance) over a (2*radius+1)² window, with mirrored borders. Pixels with non-positive variance are set to 0.
     */
    public static float[] localLogStd(float[] image, int sizeX, int sizeY, int radius) {
        // sums over padded image, border mirrored including the edge pixel
        int pw = sizeX + 2 * radius, ph = sizeY + 2 * radius;
        double[] sum = new double[(pw+1) * (ph+1)];
        double[] sum2 = new double[(pw+1) * (ph+1)];
        for (int y = 0; y<ph; ++y) {
            int sy = reflect(y - radius, sizeY);
            double rowSum = 0, rowSum2 = 0;
            for (int x = 0; x<pw; ++x) {
                double v = image[reflect(x - radius, sizeX) + sy * sizeX];
                rowSum += v;
                rowSum2 += v * v;
                sum[(x+1) + (y+1) * (pw+1)] = sum[(x+1) + y * (pw+1)] + rowSum;
                sum2[(x+1) + (y+1) * (pw+1)] = sum2[(x+1) + y * (pw+1)] + rowSum2;
            }
        }
        int side = 2 * radius + 1;
        double n = side * side;
        float[] res = new float[image.length];
        for (int y = 0; y<sizeY; ++y) {
            for (int x = 0; x<sizeX; ++x) {
                // window in padded coordinates: [x, x+side) x [y, y+side)
                double s = window(sum, pw+1, x, y, side);
                double s2 = window(sum2, pw+1, x, y, side);
                double mean = s / n;
                double variance = s2 / n - mean * mean;
                res[x + y * sizeX] = variance > 0 ? (float)(0.5 * Math.log(variance)) : 0f;
            }
        }
        return res;
    }
    private static double window(double[] integral, int w, int x, int y, int side) {
        return integral[(x+side) + (y+side) * w] - integral[x + (y+side) * w] - integral[(x+side) + y * w] + integral[x + y * w];
    }
    static int reflect(int i, int size) {
        if (size==1) return 0;
        int period = 2 * size;
        i = ((i % period) + period) % period;
        return i < size ? i : period - 1 - i;
    }

    /**
     * Separable gaussian blur, kernel truncated at 4 sigma, nearest border
     */
    public static float[] gaussianBlur(float[] image, int sizeX, int sizeY, double sigma) {
        int r = (int)Math.ceil(4 * sigma);
        double[] kernel = new double[2 * r + 1];
        double sum = 0;
        for (int i = -r; i<=r; ++i) {
            kernel[i+r] = Math.exp(-(i * i) / (2 * sigma * sigma));
            sum += kernel[i+r];
        }
        for (int i = 0; i<kernel.length; ++i) kernel[i] /= sum;
        float[] tmp = new float[image.length];
        for (int y = 0; y<sizeY; ++y) {
            for (int x = 0; x<sizeX; ++x) {
                double v = 0;
                for (int i = -r; i<=r; ++i) v += kernel[i+r] * image[clamp(x+i, sizeX) + y * sizeX];
                tmp[x + y * sizeX] = (float)v;
            }
        }
        float[] res = new float[image.length];
        for (int y = 0; y<sizeY; ++y) {
            for (int x = 0; x<sizeX; ++x) {
                double v = 0;
                for (int i = -r; i<=r; ++i) v += kernel[i+r] * tmp[x + clamp(y+i, sizeY) * sizeX];
                res[x + y * sizeX] = (float)v;
            }
        }
        return res;
    }
    private static int clamp(int i, int size) {
        return i<0 ? 0 : (i>=size ? size-1 : i);
    }
}
