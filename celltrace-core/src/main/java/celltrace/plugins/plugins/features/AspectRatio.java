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

/**
 * Ratio of major to minor axis of the ellipse with the same second moments as the measured region. NaN for an empty region.
 */
public class AspectRatio implements CellFeature {
    @Override
    public double compute(FeatureContext context) {
        boolean[] mask = context.getMask();
        int sizeX = context.sizeX();
        double n = 0, sx = 0, sy = 0;
        for (int i = 0; i<mask.length; ++i) {
            if (!mask[i]) continue;
            ++n;
            sx += i % sizeX;
            sy += i / sizeX;
        }
        if (n==0) return Double.NaN;
        double mx = sx / n, my = sy / n;
        // pixels are unit squares: each contributes 1/12 to the variance along each axis
        double cxx = 1/12d, cyy = 1/12d, cxy = 0;
        for (int i = 0; i<mask.length; ++i) {
            if (!mask[i]) continue;
            double dx = i % sizeX - mx, dy = i / sizeX - my;
            cxx += dx * dx / n;
            cyy += dy * dy / n;
            cxy += dx * dy / n;
        }
        double trace = cxx + cyy;
        double delta = Math.sqrt((cxx - cyy) * (cxx - cyy) + 4 * cxy * cxy);
        double l1 = (trace + delta) / 2, l2 = (trace - delta) / 2;
        return Math.sqrt(l1 / l2);
    }
}
