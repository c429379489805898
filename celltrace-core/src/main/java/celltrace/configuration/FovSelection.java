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
package celltrace.configuration;

import java.util.ArrayList;
import java.util.List;
import java.util.TreeSet;

/**
 * Parses FOV selections such as {@code "all"}, {@code "0-5, 7"} or {@code "3"}
 */
public class FovSelection {
    public static final String ALL = "all";

    /**
     * @param selection "all" (or empty) for all FOVs, otherwise comma-separated indices or inclusive ranges {@code a-b}
     * @param nFovs number of FOVs of the acquisition
     * @return sorted distinct FOV indices
     * @throws IllegalArgumentException if the selection is malformed or contains an index out of [0, nFovs)
     */
    public static List<Integer> parse(String selection, int nFovs) {
        List<Integer> res = new ArrayList<>();
        if (selection==null || selection.trim().isEmpty() || ALL.equalsIgnoreCase(selection.trim())) {
            for (int i = 0; i<nFovs; ++i) res.add(i);
            return res;
        }
        TreeSet<Integer> fovs = parseRange(selection);
        for (int fov : fovs) {
            if (fov>=nFovs) throw new IllegalArgumentException("FOV "+fov+" out of range: acquisition has "+nFovs+" FOVs");
            res.add(fov);
        }
        return res;
    }

    static TreeSet<Integer> parseRange(String selection) {
        if (selection.contains(";")) throw new IllegalArgumentException("Invalid FOV selection: use ',' to separate items: "+selection);
        TreeSet<Integer> res = new TreeSet<>();
        for (String item : selection.replaceAll("\\s", "").split(",")) {
            if (item.isEmpty()) throw new IllegalArgumentException("Empty item in FOV selection: "+selection);
            int dash = item.indexOf('-', 1);
            if (item.startsWith("-")) throw new IllegalArgumentException("Negative FOV in selection: "+item);
            if (dash>0) {
                int start = parseIndex(item.substring(0, dash), selection);
                int end = parseIndex(item.substring(dash+1), selection);
                if (start>end) throw new IllegalArgumentException("Invalid FOV range "+item+": start > end");
                for (int i = start; i<=end; ++i) res.add(i);
            } else res.add(parseIndex(item, selection));
        }
        return res;
    }

    private static int parseIndex(String s, String selection) {
        try {
            int i = Integer.parseInt(s);
            if (i<0) throw new IllegalArgumentException("Negative FOV in selection: "+selection);
            return i;
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid FOV selection: "+selection, e);
        }
    }
}
