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

import celltrace.utils.JSONSerializable;
import celltrace.utils.JSONUtils;
import org.json.simple.JSONObject;

/**
 * Parameters of a processing run. Instances are immutable; use {@link #builder()} to create them.
 */
public class ProcessingParams implements JSONSerializable {
    String fovs = FovSelection.ALL;
    int batchSize = 2;
    int nWorkers = 2;
    String segmentationMethod = "logstd";
    String trackingMethod = "iou";
    int cropPadding = 5;
    int maskMargin = 0;
    int minFrames = 1;
    double backgroundWeight = 1;
    Integer minCellSize, maxCellSize;
    double maxSearchRadius = 50;
    double trackerProcessNoise = 1;
    double trackerMeasurementNoise = 4;

    ProcessingParams() {}

    public static Builder builder() {
        return new Builder();
    }
    public Builder toBuilder() {
        Builder b = new Builder();
        b.p = copy();
        return b;
    }

    public String getFovs() {
        return fovs;
    }
    public int getBatchSize() {
        return batchSize;
    }
    public int getNWorkers() {
        return nWorkers;
    }
    public String getSegmentationMethod() {
        return segmentationMethod;
    }
    public String getTrackingMethod() {
        return trackingMethod;
    }
    public int getCropPadding() {
        return cropPadding;
    }
    /**
     * @return signed margin applied to cell masks: positive dilates, negative erodes
     */
    public int getMaskMargin() {
        return maskMargin;
    }
    public int getMinFrames() {
        return minFrames;
    }
    /**
     * @return background subtraction weight clamped to [0, 1]
     */
    public double getBackgroundWeight() {
        return Math.max(0, Math.min(1, backgroundWeight));
    }
    public Integer getMinCellSize() {
        return minCellSize;
    }
    public Integer getMaxCellSize() {
        return maxCellSize;
    }
    public double getMaxSearchRadius() {
        return maxSearchRadius;
    }
    public double getTrackerProcessNoise() {
        return trackerProcessNoise;
    }
    public double getTrackerMeasurementNoise() {
        return trackerMeasurementNoise;
    }

    ProcessingParams copy() {
        ProcessingParams res = new ProcessingParams();
        res.initFromJSONEntry(toJSONEntry());
        return res;
    }

    void validate() {
        if (batchSize<1) throw new IllegalArgumentException("batch_size must be >=1, got "+batchSize);
        if (nWorkers<1) throw new IllegalArgumentException("n_workers must be >=1, got "+nWorkers);
        if (cropPadding<0) throw new IllegalArgumentException("crop_padding must be >=0, got "+cropPadding);
        if (minFrames<0) throw new IllegalArgumentException("min_frames must be >=0, got "+minFrames);
        if (Double.isNaN(backgroundWeight)) throw new IllegalArgumentException("background_weight must be a number");
        if (minCellSize!=null && maxCellSize!=null && minCellSize>maxCellSize) throw new IllegalArgumentException("min_cell_size > max_cell_size");
        if (segmentationMethod==null || trackingMethod==null) throw new IllegalArgumentException("segmentation and tracking methods must be set");
    }

    @Override
    public JSONObject toJSONEntry() {
        JSONObject res = new JSONObject();
        res.put("fovs", fovs);
        res.put("batch_size", batchSize);
        res.put("n_workers", nWorkers);
        res.put("segmentation_method", segmentationMethod);
        res.put("tracking_method", trackingMethod);
        res.put("crop_padding", cropPadding);
        res.put("mask_margin", maskMargin);
        res.put("min_frames", minFrames);
        res.put("background_weight", backgroundWeight);
        if (minCellSize!=null) res.put("min_cell_size", minCellSize);
        if (maxCellSize!=null) res.put("max_cell_size", maxCellSize);
        res.put("max_search_radius", maxSearchRadius);
        res.put("tracker_process_noise", trackerProcessNoise);
        res.put("tracker_measurement_noise", trackerMeasurementNoise);
        return res;
    }

    @Override
    public void initFromJSONEntry(Object json) {
        JSONObject o = (JSONObject)json;
        fovs = JSONUtils.getString(o, "fovs", FovSelection.ALL);
        batchSize = JSONUtils.getInt(o, "batch_size", 2);
        nWorkers = JSONUtils.getInt(o, "n_workers", 2);
        segmentationMethod = JSONUtils.getString(o, "segmentation_method", "logstd");
        trackingMethod = JSONUtils.getString(o, "tracking_method", "iou");
        cropPadding = JSONUtils.getInt(o, "crop_padding", 5);
        maskMargin = JSONUtils.getInt(o, "mask_margin", 0);
        minFrames = JSONUtils.getInt(o, "min_frames", 1);
        backgroundWeight = JSONUtils.getDouble(o, "background_weight", 1);
        minCellSize = JSONUtils.getInteger(o, "min_cell_size");
        maxCellSize = JSONUtils.getInteger(o, "max_cell_size");
        maxSearchRadius = JSONUtils.getDouble(o, "max_search_radius", 50);
        trackerProcessNoise = JSONUtils.getDouble(o, "tracker_process_noise", 1);
        trackerMeasurementNoise = JSONUtils.getDouble(o, "tracker_measurement_noise", 4);
        validate();
    }

    @Override
    public String toString() {
        return toJSONEntry().toJSONString();
    }

    public static class Builder {
        ProcessingParams p = new ProcessingParams();
        public Builder fovs(String fovs) {
            p.fovs = fovs;
            return this;
        }
        public Builder batchSize(int batchSize) {
            p.batchSize = batchSize;
            return this;
        }
        public Builder nWorkers(int nWorkers) {
            p.nWorkers = nWorkers;
            return this;
        }
        public Builder segmentationMethod(String method) {
            p.segmentationMethod = method;
            return this;
        }
        public Builder trackingMethod(String method) {
            p.trackingMethod = method;
            return this;
        }
        public Builder cropPadding(int cropPadding) {
            p.cropPadding = cropPadding;
            return this;
        }
        public Builder maskMargin(int maskMargin) {
            p.maskMargin = maskMargin;
            return this;
        }
        public Builder minFrames(int minFrames) {
            p.minFrames = minFrames;
            return this;
        }
        public Builder backgroundWeight(double backgroundWeight) {
            p.backgroundWeight = backgroundWeight;
            return this;
        }
        public Builder cellSizeRange(Integer minCellSize, Integer maxCellSize) {
            p.minCellSize = minCellSize;
            p.maxCellSize = maxCellSize;
            return this;
        }
        public Builder maxSearchRadius(double maxSearchRadius) {
            p.maxSearchRadius = maxSearchRadius;
            return this;
        }
        public Builder trackerNoise(double processNoise, double measurementNoise) {
            p.trackerProcessNoise = processNoise;
            p.trackerMeasurementNoise = measurementNoise;
            return this;
        }
        public ProcessingParams build() {
            p.validate();
            return p.copy();
        }
    }
}
