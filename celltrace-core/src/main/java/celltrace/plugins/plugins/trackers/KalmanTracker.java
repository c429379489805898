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
package celltrace.plugins.plugins.trackers;

import celltrace.configuration.ProcessingParams;
import celltrace.image.Region;
import celltrace.plugins.TrackerConfigurationException;
import org.apache.commons.math3.exception.MathArithmeticException;
import org.apache.commons.math3.exception.MathIllegalArgumentException;
import org.apache.commons.math3.exception.MathIllegalStateException;
import org.apache.commons.math3.exception.MathRuntimeException;
import org.apache.commons.math3.filter.DefaultMeasurementModel;
import org.apache.commons.math3.filter.DefaultProcessModel;
import org.apache.commons.math3.filter.KalmanFilter;
import org.apache.commons.math3.linear.Array2DRowRealMatrix;
import org.apache.commons.math3.linear.ArrayRealVector;
import org.apache.commons.math3.linear.MatrixUtils;
import org.apache.commons.math3.linear.RealMatrix;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Probabilistic tracker for moving cells: each track carries a constant-velocity Kalman filter over its centroid, and objects are treated as noisy detections.
 * Detections are assigned greedily to the track with the closest predicted position within {@code maxSearchRadius}; ties are broken by lowest track id then lowest label.
 * A track without detection is kept for {@link #maxGap} frames before it ends.
 * <p>
 * Invalid parameters and numerical failures of the filters raise a {@link TrackerConfigurationException}.
 */
public class KalmanTracker extends FrameLinker {
    double maxSearchRadius = 50;
    double processNoise = 1;
    double measurementNoise = 4;
    int maxGap = 1;
    final Map<Integer, TrackState> activeTracks = new TreeMap<>();

    public KalmanTracker() {}

    public KalmanTracker(double maxSearchRadius, double processNoise, double measurementNoise) {
        this.maxSearchRadius = maxSearchRadius;
        this.processNoise = processNoise;
        this.measurementNoise = measurementNoise;
        checkParameters();
    }

    @Override
    public void configure(ProcessingParams params) {
        this.maxSearchRadius = params.getMaxSearchRadius();
        this.processNoise = params.getTrackerProcessNoise();
        this.measurementNoise = params.getTrackerMeasurementNoise();
        checkParameters();
    }

    void checkParameters() {
        if (!(maxSearchRadius>0) || Double.isInfinite(maxSearchRadius)) throw new TrackerConfigurationException("max_search_radius must be a finite positive number, got "+maxSearchRadius);
        if (!(processNoise>0) || Double.isInfinite(processNoise)) throw new TrackerConfigurationException("tracker_process_noise must be a finite positive number, got "+processNoise);
        if (!(measurementNoise>0) || Double.isInfinite(measurementNoise)) throw new TrackerConfigurationException("tracker_measurement_noise must be a finite positive number, got "+measurementNoise);
    }

    @Override
    protected void reset() {
        activeTracks.clear();
    }

    @Override
    protected Map<Integer, Integer> link(int frame, int[] previousTracks, Map<Integer, Region> previousRegions, int[] labels, Map<Integer, Region> regions) {
        try {
            return linkDetections(regions);
        } catch (MathIllegalArgumentException | MathIllegalStateException | MathArithmeticException | MathRuntimeException e) {
            throw new TrackerConfigurationException("Kalman filter failure at frame "+frame+": check tracker parameters", e);
        }
    }

    Map<Integer, Integer> linkDetections(Map<Integer, Region> regions) {
        Map<Integer, double[]> predictions = new HashMap<>();
        for (Map.Entry<Integer, TrackState> e : activeTracks.entrySet()) {
            predictions.put(e.getKey(), e.getValue().predict());
        }
        List<Candidate> candidates = new ArrayList<>();
        for (Map.Entry<Integer, double[]> p : predictions.entrySet()) {
            for (Region r : regions.values()) {
                double d = Math.hypot(p.getValue()[0] - r.getCenterX(), p.getValue()[1] - r.getCenterY());
                if (d<=maxSearchRadius) candidates.add(new Candidate(p.getKey(), r.label, d));
            }
        }
        candidates.sort(Comparator.comparingDouble((Candidate c) -> c.distance).thenComparingInt(c -> c.track).thenComparingInt(c -> c.label));
        Map<Integer, Integer> res = new HashMap<>();
        Set<Integer> usedTracks = new HashSet<>();
        for (Candidate c : candidates) {
            if (res.containsKey(c.label) || usedTracks.contains(c.track)) continue;
            res.put(c.label, c.track);
            usedTracks.add(c.track);
            Region r = regions.get(c.label);
            activeTracks.get(c.track).correct(r.getCenterX(), r.getCenterY());
        }
        Iterator<Map.Entry<Integer, TrackState>> it = activeTracks.entrySet().iterator();
        while (it.hasNext()) {
            Map.Entry<Integer, TrackState> e = it.next();
            if (!usedTracks.contains(e.getKey()) && ++e.getValue().missed>maxGap) it.remove();
        }
        // new tracks for unlinked detections, in label order
        for (Region r : regions.values()) {
            if (res.containsKey(r.label)) continue;
            int id = newTrackId();
            res.put(r.label, id);
            activeTracks.put(id, new TrackState(r.getCenterX(), r.getCenterY()));
        }
        return res;
    }

    class TrackState {
        final KalmanFilter filter;
        int missed;
        TrackState(double x, double y) {
            RealMatrix a = new Array2DRowRealMatrix(new double[][]{{1, 0, 1, 0}, {0, 1, 0, 1}, {0, 0, 1, 0}, {0, 0, 0, 1}});
            RealMatrix h = new Array2DRowRealMatrix(new double[][]{{1, 0, 0, 0}, {0, 1, 0, 0}});
            RealMatrix q = MatrixUtils.createRealIdentityMatrix(4).scalarMultiply(processNoise);
            RealMatrix r = MatrixUtils.createRealIdentityMatrix(2).scalarMultiply(measurementNoise);
            RealMatrix p0 = MatrixUtils.createRealDiagonalMatrix(new double[]{measurementNoise, measurementNoise, maxSearchRadius * maxSearchRadius, maxSearchRadius * maxSearchRadius});
            filter = new KalmanFilter(new DefaultProcessModel(a, null, q, new ArrayRealVector(new double[]{x, y, 0, 0}), p0), new DefaultMeasurementModel(h, r));
        }
        double[] predict() {
            filter.predict();
            double[] s = filter.getStateEstimation();
            if (Double.isNaN(s[0]) || Double.isNaN(s[1]) || Double.isInfinite(s[0]) || Double.isInfinite(s[1])) throw new TrackerConfigurationException("Kalman filter diverged: check tracker noise parameters");
            return s;
        }
        void correct(double x, double y) {
            filter.correct(new double[]{x, y});
            missed = 0;
        }
    }

    static class Candidate {
        final int track, label;
        final double distance;
        Candidate(int track, int label, double distance) {
            this.track = track;
            this.label = label;
            this.distance = distance;
        }
    }
}
