package com.anomaly.detection.engine.dbscan;

import com.anomaly.detection.engine.AbstractAnomalyDetector;
import com.anomaly.detection.engine.AnomalyDetectionException;
import com.anomaly.detection.engine.DensityAnomalyDetector;
import com.anomaly.detection.engine.DetectionResult;
import com.anomaly.detection.engine.DetectorConfig;
import com.anomaly.detection.engine.distance.EuclideanDistance;
import com.anomaly.detection.engine.distance.NearestNeighbors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Density-based (DBSCAN) detector over a bounded history of points.
 *
 * Points live in a FIFO history capped at {@code maxHistorySize}. With
 * {@code autoRecluster} on, the history is reclustered whenever its size is a
 * multiple of {@code reclusterThreshold}; otherwise clustering runs on
 * {@link #recluster()}, or lazily on the first detection that finds no clusters.
 *
 * A query is anomalous when fewer than {@code minPoints} stored points lie within
 * {@code epsilon} of it, or when none of those neighbours belongs to a cluster.
 * A query of the wrong dimensionality is reported as an anomalous result, not thrown.
 */
public class DbscanDetector extends AbstractAnomalyDetector implements DensityAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(DbscanDetector.class);

    public static final String DEFAULT_NAME = "DBSCAN Detector";

    private double epsilon;
    private int minPoints;
    private int maxHistorySize = 1000;
    private boolean autoRecluster = true;
    private int reclusterThreshold = 50;

    private final List<DbscanPoint> points = new ArrayList<>();
    private int clusterCount;
    private int outlierCount;
    private boolean clustered;
    private Instant lastClusteringTime;

    public DbscanDetector() {
        this(0.5, 5, 0);
    }

    /**
     * @param dimensions fixed dimensionality, or 0 to take it from the first point
     */
    public DbscanDetector(double epsilon, int minPoints, int dimensions) {
        this(DEFAULT_NAME, epsilon, minPoints, dimensions, DetectorConfig.defaults());
    }

    public DbscanDetector(String name, double epsilon, int minPoints, int dimensions, DetectorConfig config) {
        super(name, config, dimensions);
        validateEpsilon(epsilon);
        validateMinPoints(minPoints);
        this.epsilon = epsilon;
        this.minPoints = minPoints;
    }

    /**
     * Append a point to the history, evicting the oldest beyond {@code maxHistorySize}.
     *
     * @throws com.anomaly.detection.engine.DimensionMismatchException on a length mismatch
     */
    public void addPoint(double[] values) {
        lock.lock();
        try {
            enforceDimensions(values);
            points.add(new DbscanPoint(Arrays.copyOf(values, values.length)));
            trimHistory();

            if (autoRecluster && points.size() % reclusterThreshold == 0) {
                log.debug("{}: history at {} points, auto-reclustering", getName(), points.size());
                performClustering();
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addTrainingData(double[] instance) {
        addPoint(instance);
    }

    @Override
    public void addValue(double value) {
        addPoint(new double[]{value});
    }

    @Override
    public void train() {
        recluster();
    }

    @Override
    public void build() {
        recluster();
    }

    public void recluster() {
        lock.lock();
        try {
            performClustering();
        } finally {
            lock.unlock();
        }
    }

    @Override
    public DetectionResult detect(double value) {
        return detectMultiDim(new double[]{value});
    }

    @Override
    public DetectionResult detectMultiDimensional(double[] instance) {
        return detectMultiDim(instance);
    }

    public DetectionResult detectMultiDim(double[] values) {
        lock.lock();
        try {
            if (dimensions != 0 && values.length != dimensions) {
                return DetectionResult.builder()
                        .anomaly(true)
                        .description("Invalid dimension")
                        .build();
            }

            double mean = 0.0;
            for (double v : values) {
                mean += v;
            }
            mean = values.length > 0 ? mean / values.length : 0.0;

            if (points.size() < minPoints) {
                return DetectionResult.builder()
                        .anomaly(false)
                        .value(mean)
                        .description("Not enough samples")
                        .build();
            }

            if (!clustered || clusterCount == 0) {
                performClustering();
            }

            List<Integer> neighbors = NearestNeighbors.withinRadius(points, values, epsilon);
            DetectionResult.DetectionResultBuilder result = DetectionResult.builder()
                    .value(mean)
                    .lowerLimit(0.0)
                    .upperLimit(epsilon);

            if (neighbors.size() < minPoints) {
                result.anomaly(true)
                        .zScore((minPoints - neighbors.size()) / Math.sqrt(minPoints))
                        .description("Low density region");
            } else {
                double minDistance = Double.MAX_VALUE;
                int nearestCluster = DbscanPoint.NOISE;
                for (int index : neighbors) {
                    DbscanPoint point = points.get(index);
                    if (point.isClustered()) {
                        double distance = EuclideanDistance.distance(values, point.getValues());
                        if (distance < minDistance) {
                            minDistance = distance;
                            nearestCluster = point.getClusterId();
                        }
                    }
                }

                if (nearestCluster == DbscanPoint.NOISE) {
                    result.anomaly(true)
                            .zScore(Double.MAX_VALUE)
                            .description("Not in any cluster");
                } else {
                    result.anomaly(false)
                            .zScore(minDistance / epsilon)
                            .description("Normal");
                }
            }

            DetectionResult detection = result.build();
            notifyTransition(detection);
            return detection;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Standard DBSCAN over the whole history. Noise is provisional: a noise point
     * reached from a core point becomes a border point of that cluster. Caller must hold the lock.
     */
    private void performClustering() {
        for (DbscanPoint point : points) {
            point.setClusterId(DbscanPoint.UNCLASSIFIED);
            point.setVisited(false);
        }

        int clusterId = 0;
        outlierCount = 0;

        for (int i = 0; i < points.size(); i++) {
            DbscanPoint point = points.get(i);
            if (point.isVisited()) {
                continue;
            }
            point.setVisited(true);

            List<Integer> neighbors = regionQuery(point);
            if (neighbors.size() < minPoints) {
                point.setClusterId(DbscanPoint.NOISE);
                outlierCount++;
            } else {
                clusterId++;
                expandCluster(i, neighbors, clusterId);
            }
        }

        clusterCount = clusterId;
        clustered = true;
        lastClusteringTime = Instant.now();
        log.debug("{}: clustered {} points into {} clusters, {} outliers",
                getName(), points.size(), clusterCount, outlierCount);
    }

    private void expandCluster(int pointIndex, List<Integer> seeds, int clusterId) {
        points.get(pointIndex).setClusterId(clusterId);

        boolean[] queued = new boolean[points.size()];
        for (int seed : seeds) {
            queued[seed] = true;
        }

        // seeds grows while it is walked
        for (int i = 0; i < seeds.size(); i++) {
            DbscanPoint neighbor = points.get(seeds.get(i));

            if (!neighbor.isVisited()) {
                neighbor.setVisited(true);
                List<Integer> neighborRegion = regionQuery(neighbor);
                if (neighborRegion.size() >= minPoints) {
                    for (int candidate : neighborRegion) {
                        if (!queued[candidate]) {
                            queued[candidate] = true;
                            seeds.add(candidate);
                        }
                    }
                }
            }

            if (neighbor.getClusterId() == DbscanPoint.UNCLASSIFIED) {
                neighbor.setClusterId(clusterId);
            } else if (neighbor.isNoise()) {
                neighbor.setClusterId(clusterId);
                outlierCount--;
            }
        }
    }

    private List<Integer> regionQuery(DbscanPoint point) {
        return NearestNeighbors.withinRadius(points, point.getValues(), epsilon);
    }

    private void trimHistory() {
        int excess = points.size() - maxHistorySize;
        if (excess > 0) {
            points.subList(0, excess).clear();
        }
    }

    /**
     * Drop all history and clustering results. The dimensionality stays fixed.
     */
    public void reset() {
        lock.lock();
        try {
            points.clear();
            clusterCount = 0;
            outlierCount = 0;
            clustered = false;
            lastClusteringTime = null;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isInitialized() {
        lock.lock();
        try {
            return points.size() >= minPoints;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected String stateTag() {
        return "dbscan";
    }

    @Override
    protected void writeState(DataOutput out) throws IOException {
        out.writeDouble(epsilon);
        out.writeInt(minPoints);
        out.writeInt(dimensions);
        out.writeInt(maxHistorySize);
        out.writeBoolean(autoRecluster);
        out.writeInt(reclusterThreshold);

        out.writeInt(points.size());
        for (DbscanPoint point : points) {
            writeVector(out, point.getValues());
        }
        for (DbscanPoint point : points) {
            out.writeInt(point.getClusterId());
        }
    }

    /**
     * Restores parameters and history, keeping only the newest {@code maxHistorySize}
     * points, then reclusters if there are at least {@code minPoints} points.
     */
    @Override
    protected void readState(DataInput in) throws IOException {
        double savedEpsilon = in.readDouble();
        int savedMinPoints = in.readInt();
        int savedDimensions = in.readInt();
        int savedMaxHistory = in.readInt();
        boolean savedAutoRecluster = in.readBoolean();
        int savedReclusterThreshold = in.readInt();
        validateEpsilon(savedEpsilon);
        validateMinPoints(savedMinPoints);
        validateMaxHistorySize(savedMaxHistory);
        validateReclusterThreshold(savedReclusterThreshold);

        int count = in.readInt();
        if (count < 0) {
            throw new AnomalyDetectionException("Corrupt state: negative point count " + count);
        }
        List<double[]> vectors = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vectors.add(readVector(in));
        }
        int[] clusterIds = new int[count];
        for (int i = 0; i < count; i++) {
            clusterIds[i] = in.readInt();
        }

        epsilon = savedEpsilon;
        minPoints = savedMinPoints;
        dimensions = savedDimensions;
        maxHistorySize = savedMaxHistory;
        autoRecluster = savedAutoRecluster;
        reclusterThreshold = savedReclusterThreshold;

        points.clear();
        for (int i = 0; i < count; i++) {
            points.add(new DbscanPoint(vectors.get(i), clusterIds[i]));
        }
        trimHistory();
        clusterCount = 0;
        outlierCount = 0;
        clustered = false;
        lastClusteringTime = null;

        if (points.size() >= minPoints) {
            performClustering();
        }
        log.info("{}: restored {} points ({} clusters)", getName(), points.size(), clusterCount);
    }

    private static void validateEpsilon(double epsilon) {
        if (!(epsilon > 0)) {
            throw new IllegalArgumentException("epsilon must be > 0, got " + epsilon);
        }
    }

    private static void validateMinPoints(int minPoints) {
        if (minPoints < 1) {
            throw new IllegalArgumentException("minPoints must be >= 1, got " + minPoints);
        }
    }

    private static void validateMaxHistorySize(int maxHistorySize) {
        if (maxHistorySize < 1) {
            throw new IllegalArgumentException("maxHistorySize must be >= 1, got " + maxHistorySize);
        }
    }

    private static void validateReclusterThreshold(int reclusterThreshold) {
        if (reclusterThreshold < 1) {
            throw new IllegalArgumentException("reclusterThreshold must be >= 1, got " + reclusterThreshold);
        }
    }

    public double getEpsilon() {
        lock.lock();
        try {
            return epsilon;
        } finally {
            lock.unlock();
        }
    }

    public void setEpsilon(double epsilon) {
        validateEpsilon(epsilon);
        lock.lock();
        try {
            this.epsilon = epsilon;
        } finally {
            lock.unlock();
        }
    }

    public int getMinPoints() {
        lock.lock();
        try {
            return minPoints;
        } finally {
            lock.unlock();
        }
    }

    public void setMinPoints(int minPoints) {
        validateMinPoints(minPoints);
        lock.lock();
        try {
            this.minPoints = minPoints;
        } finally {
            lock.unlock();
        }
    }

    public int getMaxHistorySize() {
        lock.lock();
        try {
            return maxHistorySize;
        } finally {
            lock.unlock();
        }
    }

    public void setMaxHistorySize(int maxHistorySize) {
        validateMaxHistorySize(maxHistorySize);
        lock.lock();
        try {
            this.maxHistorySize = maxHistorySize;
            trimHistory();
        } finally {
            lock.unlock();
        }
    }

    public boolean isAutoRecluster() {
        lock.lock();
        try {
            return autoRecluster;
        } finally {
            lock.unlock();
        }
    }

    public void setAutoRecluster(boolean autoRecluster) {
        lock.lock();
        try {
            this.autoRecluster = autoRecluster;
        } finally {
            lock.unlock();
        }
    }

    public int getReclusterThreshold() {
        lock.lock();
        try {
            return reclusterThreshold;
        } finally {
            lock.unlock();
        }
    }

    public void setReclusterThreshold(int reclusterThreshold) {
        validateReclusterThreshold(reclusterThreshold);
        lock.lock();
        try {
            this.reclusterThreshold = reclusterThreshold;
        } finally {
            lock.unlock();
        }
    }

    public int getClusterCount() {
        lock.lock();
        try {
            return clusterCount;
        } finally {
            lock.unlock();
        }
    }

    public int getOutlierCount() {
        lock.lock();
        try {
            return outlierCount;
        } finally {
            lock.unlock();
        }
    }

    public int getPointCount() {
        lock.lock();
        try {
            return points.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Cluster id of the point at {@code index} in insertion order (oldest first):
     * 0 unclassified, -1 noise, positive for a cluster.
     */
    public int getClusterId(int index) {
        lock.lock();
        try {
            return points.get(index).getClusterId();
        } finally {
            lock.unlock();
        }
    }

    public Instant getLastClusteringTime() {
        lock.lock();
        try {
            return lastClusteringTime;
        } finally {
            lock.unlock();
        }
    }
}
