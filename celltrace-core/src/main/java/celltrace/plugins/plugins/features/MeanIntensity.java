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
 * Mean over the measured region of the background-corrected intensity. NaN for an empty region.
 */
public class MeanIntensity implements CellFeature {
    @Override
    public double compute(FeatureContext context) {
        boolean[] mask = context.getMask();
        double sum = 0;
        int count = 0;
        for (int i = 0; i<mask.length; ++i) {
            if (mask[i]) {
                sum += context.getCorrectedValue(i);
                ++count;
            }
        }
        return count==0 ? Double.NaN : sum / count;
    }
}
