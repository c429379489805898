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
package celltrace.core.stage;

import celltrace.configuration.ChannelSelection;
import celltrace.configuration.ProcessingConfig;
import celltrace.core.CancellationToken;
import celltrace.core.ProgressCallback;
import celltrace.data_structure.ArtifactNaming;
import celltrace.data_structure.CellCrop;
import celltrace.data_structure.CropContainer;
import celltrace.image.BoundingBox;
import celltrace.image.io.MicroscopyMetadata;
import celltrace.measurement.FeatureTable;
import celltrace.plugins.CellFeature;
import celltrace.plugins.FeatureContext;
import celltrace.plugins.PluginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.FileNotFoundException;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Computes the configured features of each cell in each frame from the crop container and writes the feature table of the FOV
 */
public class ExtractionStage implements Stage {
    public final static Logger logger = LoggerFactory.getLogger(ExtractionStage.class);

    /**
     * One column of the table: a feature computed on a channel
     */
    public static class FeatureColumn {
        public final ChannelSelection channel;
        public final boolean phaseContrast;
        public final String name;
        public final CellFeature feature;
        FeatureColumn(ChannelSelection channel, boolean phaseContrast, String name, CellFeature feature) {
            this.channel = channel;
            this.phaseContrast = phaseContrast;
            this.name = name;
            this.feature = feature;
        }
        public String getColumnName() {
            return FeatureTable.featureColumn(name, channel.getChannel());
        }
        public String getCropChannel() {
            return phaseContrast ? CropContainer.pcChannelName(channel.getChannel()) : CropContainer.flChannelName(channel.getChannel());
        }
    }

    /**
     * Instantiates the feature plugins in column order: phase contrast features first, then fluorescence channels in configuration order
     * @throws IllegalArgumentException if a feature name is unknown
     */
    public static List<FeatureColumn> getFeatureColumns(ProcessingConfig config) {
        List<FeatureColumn> res = new ArrayList<>();
        ChannelSelection pc = config.getPhaseContrast();
        if (pc!=null) for (String f : pc.getFeatures()) res.add(new FeatureColumn(pc, true, f, getFeature(f, config)));
        for (ChannelSelection fl : config.getFluorescence()) {
            for (String f : fl.getFeatures()) res.add(new FeatureColumn(fl, false, f, getFeature(f, config)));
        }
        return res;
    }
    private static CellFeature getFeature(String name, ProcessingConfig config) {
        CellFeature f = PluginFactory.getPlugin(CellFeature.class, name);
        f.configure(config.getParams());
        return f;
    }

    @Override
    public String getName() {
        return "Extraction";
    }

    @Override
    public boolean isDone(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir) {
        return config.getPhaseContrast()==null || ArtifactNaming.traces(outputDir, metadata.getBaseName(), fov).exists();
    }

    @Override
    public void process(int fov, ProcessingConfig config, MicroscopyMetadata metadata, File outputDir, CancellationToken cancel, ProgressCallback progress) throws IOException {
        if (config.getPhaseContrast()==null) {
            logger.warn("FOV {}: no phase contrast channel, skipping extraction", fov);
            return;
        }
        File output = ArtifactNaming.traces(outputDir, metadata.getBaseName(), fov);
        if (output.exists()) {
            logger.info("FOV {}: feature table already exists, skipping", fov);
            return;
        }
        File cropFile = ArtifactNaming.crops(outputDir, metadata.getBaseName(), fov);
        if (!cropFile.exists()) throw new FileNotFoundException("FOV "+fov+": crop container not found: "+cropFile);
        List<FeatureColumn> columns = getFeatureColumns(config);
        List<String> columnNames = new ArrayList<>();
        for (FeatureColumn c : columns) columnNames.add(c.getColumnName());
        FeatureTable table = new FeatureTable(columnNames);
        double bgWeight = config.getParams().getBackgroundWeight();
        try (CropContainer.Reader reader = new CropContainer.Reader(cropFile)) {
            List<Integer> cellIds = new ArrayList<>(reader.getCellIds());
            Collections.sort(cellIds);
            for (int i = 0; i<cellIds.size(); ++i) {
                if (cancel.isCancelled()) {
                    logger.info("FOV {}: extraction cancelled after {} cells", fov, i);
                    return;
                }
                CellCrop cell = reader.readCell(cellIds.get(i));
                for (int idx = 0; idx<cell.size(); ++idx) addRow(table, fov, metadata, cell, idx, columns, bgWeight);
                progress.setProgress(i, cellIds.size(), "Extraction");
            }
        }
        table.write(output);
        logger.info("FOV {}: {} rows extracted", fov, table.size());
    }

    static void addRow(FeatureTable table, int fov, MicroscopyMetadata metadata, CellCrop cell, int idx, List<FeatureColumn> columns, double bgWeight) {
        int frame = cell.getFrames().get(idx);
        BoundingBox b = cell.getBounds(idx);
        boolean[] mask = cell.getMask(idx);
        double[] position = getPosition(mask, b);
        double[] values = new double[columns.size()];
        for (int c = 0; c<columns.size(); ++c) {
            FeatureColumn col = columns.get(c);
            String channel = col.getCropChannel();
            float[] crop = cell.getChannelCrop(channel, idx);
            if (crop==null) {
                values[c] = Double.NaN;
                continue;
            }
            boolean[] m = mask;
            if (col.channel.isBboxAsMask()) {
                m = new boolean[mask.length];
                Arrays.fill(m, true);
            }
            float[] background = col.phaseContrast ? null : cell.getBackgroundCrop(channel, idx);
            double weight = col.phaseContrast ? 0 : bgWeight;
            values[c] = col.feature.compute(new FeatureContext(crop, m, background, weight, b.sizeX(), b.sizeY()));
        }
        table.addRow(fov, cell.getCellId(), frame, metadata.getTime(frame), true, position[0], position[1], new int[]{b.x0, b.y0, b.x1, b.y1}, values);
    }

    /**
     * @return {x, y}: middle of the mask extent in image coordinates, or center of the bounding box if the mask is empty
     */
    static double[] getPosition(boolean[] mask, BoundingBox b) {
        int sizeX = b.sizeX();
        int minX = Integer.MAX_VALUE, minY = Integer.MAX_VALUE, maxX = -1, maxY = -1;
        for (int i = 0; i<mask.length; ++i) {
            if (!mask[i]) continue;
            int x = i % sizeX, y = i / sizeX;
            if (x<minX) minX = x;
            if (x>maxX) maxX = x;
            if (y<minY) minY = y;
            if (y>maxY) maxY = y;
        }
        if (maxX<0) return new double[]{b.xMean(), b.yMean()};
        return new double[]{b.x0 + (minX + maxX) / 2d, b.y0 + (minY + maxY) / 2d};
    }
}
