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
package celltrace.measurement;

import celltrace.utils.FileIO;

import java.io.File;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Tidy per-FOV table: one row per (cell, frame), identity and geometry columns followed by one column per (feature, channel)
 */
public class FeatureTable {
    public final static String separator = ",";
    public final static List<String> BASE_COLUMNS = Collections.unmodifiableList(Arrays.asList("fov", "cell", "frame", "time", "good", "position_x", "position_y", "bbox_x0", "bbox_y0", "bbox_x1", "bbox_y1"));
    public static Function<Number, String> numberFormater = (Number n) -> {
        double d = n.doubleValue();
        if (Double.isNaN(d)) return "NaN";
        if (d == Math.rint(d) && !Double.isInfinite(d) && Math.abs(d)<1e15) return Long.toString((long)d);
        return Double.toString(d);
    };
    final List<String> featureColumns;
    final List<String> rows = new ArrayList<>();

    public FeatureTable(List<String> featureColumns) {
        this.featureColumns = featureColumns;
    }

    public static String featureColumn(String feature, int channel) {
        return feature + "_ch_" + channel;
    }

    public String getHeader() {
        StringBuilder header = new StringBuilder(String.join(separator, BASE_COLUMNS));
        for (String f : featureColumns) {
            header.append(separator);
            header.append(f);
        }
        return header.toString();
    }

    /**
     * @param bounds {x0, y0, x1, y1}, end exclusive
     * @param features one value per feature column
     */
    public void addRow(int fov, int cell, int frame, double time, boolean good, double positionX, double positionY, int[] bounds, double[] features) {
        if (features.length!=featureColumns.size()) throw new IllegalArgumentException("Expected "+featureColumns.size()+" feature values, got "+features.length);
        StringBuilder line = new StringBuilder();
        line.append(fov).append(separator).append(cell).append(separator).append(frame).append(separator);
        line.append(numberFormater.apply(time)).append(separator).append(good).append(separator);
        line.append(numberFormater.apply(positionX)).append(separator).append(numberFormater.apply(positionY));
        for (int b : bounds) line.append(separator).append(b);
        for (double f : features) line.append(separator).append(numberFormater.apply(f));
        rows.add(line.toString());
    }

    public int size() {
        return rows.size();
    }

    /**
     * Writes header and rows to a temporary file then moves it to {@code output}. The header is written even when there are no rows.
     */
    public void write(File output) throws IOException {
        File part = FileIO.partFile(output);
        try {
            FileIO.writeToFile(part, getHeader(), rows, r -> r);
            FileIO.commit(part, output);
        } catch (IOException|RuntimeException e) {
            FileIO.delete(part);
            throw e;
        }
    }
}
