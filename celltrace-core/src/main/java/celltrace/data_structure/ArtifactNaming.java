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
package celltrace.data_structure;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * File layout of processing outputs. All stages read and write through these paths.
 * <p>
 * Pattern: {@code {root}/fov_{fov:03d}/{base}_fov_{fov:03d}_{kind}[_ch_{channel}].{ext}}
 */
public class ArtifactNaming {
    public final static Logger logger = LoggerFactory.getLogger(ArtifactNaming.class);
    public static final String FOV_PREFIX = "fov_";
    public static final String CONFIG_FILE = "processing_config.json";

    public enum ArtifactKind {
        PC_STACK("pc", ".stack", true),
        FL_STACK("fl", ".stack", true),
        SEG_LABELED("seg_labeled", ".stack", true),
        SEG_TRACKED("seg_tracked", ".stack", true),
        FL_BACKGROUND("fl_background", ".stack", true),
        CROPS("crops", ".zip", false),
        TRACES("traces", ".csv", false);
        public final String suffix;
        public final String extension;
        public final boolean perChannel;
        ArtifactKind(String suffix, String extension, boolean perChannel) {
            this.suffix = suffix;
            this.extension = extension;
            this.perChannel = perChannel;
        }
    }

    private static final Pattern ARTIFACT_PATTERN = Pattern.compile("^(.+)_fov_(\\d+)_(pc|fl|seg_labeled|seg_tracked|fl_background|crops|traces)(?:_ch_(\\d+))?(\\.stack|\\.zip|\\.csv)$");

    public static String fovDirName(int fov) {
        return String.format("%s%03d", FOV_PREFIX, fov);
    }
    public static File fovDir(File outputDir, int fov) {
        return new File(outputDir, fovDirName(fov));
    }

    /**
     * @param channel ignored for kinds that are not defined per channel
     */
    public static File path(File outputDir, String baseName, int fov, int channel, ArtifactKind kind) {
        String name = String.format("%s_fov_%03d_%s", baseName, fov, kind.suffix);
        if (kind.perChannel) name += "_ch_" + channel;
        return new File(fovDir(outputDir, fov), name + kind.extension);
    }
    public static File pcStack(File outputDir, String baseName, int fov, int channel) {
        return path(outputDir, baseName, fov, channel, ArtifactKind.PC_STACK);
    }
    public static File flStack(File outputDir, String baseName, int fov, int channel) {
        return path(outputDir, baseName, fov, channel, ArtifactKind.FL_STACK);
    }
    public static File segLabeled(File outputDir, String baseName, int fov, int channel) {
        return path(outputDir, baseName, fov, channel, ArtifactKind.SEG_LABELED);
    }
    public static File segTracked(File outputDir, String baseName, int fov, int channel) {
        return path(outputDir, baseName, fov, channel, ArtifactKind.SEG_TRACKED);
    }
    public static File flBackground(File outputDir, String baseName, int fov, int channel) {
        return path(outputDir, baseName, fov, channel, ArtifactKind.FL_BACKGROUND);
    }
    public static File crops(File outputDir, String baseName, int fov) {
        return path(outputDir, baseName, fov, -1, ArtifactKind.CROPS);
    }
    public static File traces(File outputDir, String baseName, int fov) {
        return path(outputDir, baseName, fov, -1, ArtifactKind.TRACES);
    }
    public static File mergedTraces(File outputDir, String baseName) {
        return new File(outputDir, baseName + "_traces_merged.csv");
    }
    public static File config(File outputDir) {
        return new File(outputDir, CONFIG_FILE);
    }

    // discovery

    /**
     * @return sorted indices of existing FOV directories
     */
    public static List<Integer> discoverFovs(File outputDir) {
        File[] dirs = outputDir.listFiles(f -> f.isDirectory() && f.getName().startsWith(FOV_PREFIX));
        if (dirs==null) return Collections.emptyList();
        List<Integer> res = new ArrayList<>();
        for (File d : dirs) {
            try {
                res.add(Integer.parseInt(d.getName().substring(FOV_PREFIX.length())));
            } catch (NumberFormatException e) {
                logger.debug("ignoring directory: {}", d.getName());
            }
        }
        Collections.sort(res);
        return res;
    }

    public static List<File> discoverTraces(File outputDir) {
        List<File> res = new ArrayList<>();
        for (int fov : discoverFovs(outputDir)) res.addAll(listFiles(fovDir(outputDir, fov), "_traces.csv"));
        Collections.sort(res);
        return res;
    }

    /**
     * @return the tracked segmentation of {@code fov}, or null if there is none
     */
    public static File discoverSegTracked(File outputDir, int fov) {
        return listFiles(fovDir(outputDir, fov), null).stream().filter(f -> kindOf(f)==ArtifactKind.SEG_TRACKED).findFirst().orElse(null);
    }

    /**
     * @return the crop container of {@code fov}, or null if there is none
     */
    public static File discoverCrops(File outputDir, int fov) {
        List<File> res = listFiles(fovDir(outputDir, fov), "_crops.zip");
        return res.isEmpty() ? null : res.get(0);
    }

    /**
     * @return existing artifacts of {@code fov} grouped by kind
     */
    public static Map<ArtifactKind, List<File>> discoverArtifacts(File outputDir, int fov) {
        Map<ArtifactKind, List<File>> res = new EnumMap<>(ArtifactKind.class);
        for (File f : listFiles(fovDir(outputDir, fov), null)) {
            ArtifactKind k = kindOf(f);
            if (k!=null) res.computeIfAbsent(k, kk -> new ArrayList<>()).add(f);
        }
        return res;
    }

    /**
     * @return kind of an artifact file from its name, or null if the name does not follow the naming pattern
     */
    public static ArtifactKind kindOf(File file) {
        Matcher m = ARTIFACT_PATTERN.matcher(file.getName());
        if (!m.matches()) return null;
        String suffix = m.group(3);
        boolean hasChannel = m.group(4)!=null;
        for (ArtifactKind k : ArtifactKind.values()) {
            if (k.suffix.equals(suffix) && k.extension.equals(m.group(5)) && k.perChannel==hasChannel) return k;
        }
        return null;
    }

    private static List<File> listFiles(File dir, String endsWith) {
        File[] files = dir.listFiles(f -> f.isFile() && (endsWith==null || f.getName().endsWith(endsWith)));
        if (files==null) return new ArrayList<>();
        Arrays.sort(files);
        return new ArrayList<>(Arrays.asList(files));
    }
}
