package com.anomaly.detection.engine.lof;

import com.anomaly.detection.engine.AbstractAnomalyDetector;
import com.anomaly.detection.engine.DensityAnomalyDetector;
import com.anomaly.detection.engine.DetectionResult;
import com.anomaly.detection.engine.DetectorConfig;
import com.anomaly.detection.engine.DimensionMismatchException;
import com.anomaly.detection.engine.InsufficientDataException;
import com.anomaly.detection.engine.NotTrainedException;
import com.anomaly.detection.engine.distance.NearestNeighbors;
import com.anomaly.detection.engine.distance.Neighbor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Local Outlier Factor detector.
 *
 * <p>{@link #build()} scores every stored point and caches each point's k-distance and
 * local reachability density (LRD). A query is scored against that cache: its own LRD
 * over its k nearest stored points, divided into the mean LRD of those neighbours.
 * LOF near 1 means the query is as dense as its neighbourhood; well above 1 means it
 * sits in a sparser region. Anything added after a build makes the model stale and
 * detection fails until the next build.</p>
 */
public class LofDetector extends AbstractAnomalyDetector implements DensityAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(LofDetector.class);

    public static final String DEFAULT_NAME = "LOF Detector";

    // z-score reported for a query with no neighbours at all
    static final double ISOLATED_Z_SCORE = 999.0;

    // LRD used when every reachability distance is zero (all neighbours coincide)
    private static final double COINCIDENT_LRD = 1.0;

    private int kNeighbors;
    private double threshold;

    private final List<LofPoint> points = new ArrayList<>();
    private double[] kDistances = new double[0];
    private double[] densities = new double[0];
    private boolean built;

    public LofDetector() {
        this(20, 0);
    }

    public LofDetector(int kNeighbors, int dimensions) {
        this(kNeighbors, dimensions, 1.5);
    }

    public LofDetector(int kNeighbors, int dimensions, double threshold) {
        this(DEFAULT_NAME, kNeighbors, dimensions, threshold, DetectorConfig.defaults());
    }

    public LofDetector(String name, int kNeighbors, int dimensions, double threshold, DetectorConfig config) {
        super(name, config, dimensions);
        validateK(kNeighbors);
        this.kNeighbors = kNeighbors;
        this.threshold = threshold;
    }

    public void addPoint(double[] values) {
        lock.lock();
        try {
            enforceDimensions(values);
            points.add(new LofPoint(Arrays.copyOf(values, values.length)));
            built = false;
        } finally {
            lock.unlock();
        }
    }

    public void addPoints(double[][] values) {
        lock.lock();
        try {
            for (double[] point : values) {
                addPoint(point);
            }
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void addValue(double value) {
        addPoint(new double[]{value});
    }

    @Override
    public void addTrainingData(double[] instance) {
        addPoint(instance);
    }

    /**
     * Score every stored point.
     *
     * @throws InsufficientDataException with fewer than {@code kNeighbors + 1} points
     */
    @Override
    public void build() {
        lock.lock();
        try {
            int required = minPoints();
            if (points.size() < required) {
                throw new InsufficientDataException(required, points.size());
            }
            computeScores();
            log.debug("{}: built LOF model over {} points (k={})", getName(), points.size(), kNeighbors);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void train() {
        build();
    }

    /**
     * Caller must hold the lock.
     */
    private void computeScores() {
        int n = points.size();
        List<List<Neighbor>> neighborhoods = new ArrayList<>(n);
        kDistances = new double[n];
        for (int i = 0; i < n; i++) {
            List<Neighbor> neighbors = NearestNeighbors.findKNearest(points, points.get(i).getValues(), kNeighbors);
            neighborhoods.add(neighbors);
            kDistances[i] = neighbors.isEmpty() ? 0.0 : neighbors.get(neighbors.size() - 1).distance();
        }

        densities = new double[n];
        for (int i = 0; i < n; i++) {
            densities[i] = localReachabilityDensity(neighborhoods.get(i));
        }

        for (int i = 0; i < n; i++) {
            LofPoint point = points.get(i);
            point.setLofScore(outlierFactor(neighborhoods.get(i), densities[i]));
            point.setProcessed(true);
        }
        built = true;
    }

    private double localReachabilityDensity(List<Neighbor> neighbors) {
        double reachSum = 0.0;
        for (Neighbor neighbor : neighbors) {
            reachSum += Math.max(neighbor.distance(), kDistances[neighbor.index()]);
        }
        if (reachSum == 0.0) {
            return COINCIDENT_LRD;
        }
        return neighbors.size() / reachSum;
    }

    private double outlierFactor(List<Neighbor> neighbors, double ownDensity) {
        if (neighbors.isEmpty() || ownDensity == 0.0) {
            return 1.0;
        }
        double densitySum = 0.0;
        for (Neighbor neighbor : neighbors) {
            densitySum += densities[neighbor.index()];
        }
        return (densitySum / neighbors.size()) / ownDensity;
    }

    /**
     * @throws NotTrainedException if the model was never built or is stale
     * @throws DimensionMismatchException if the query length differs from the stored points
     */
    @Override
    public DetectionResult detectMultiDimensional(double[] instance) {
        lock.lock();
        try {
            if (!built) {
                throw new NotTrainedException("LOF model must be built before detection");
            }
            if (instance.length != dimensions) {
                throw new DimensionMismatchException(dimensions, instance.length);
            }

            List<Neighbor> neighbors = NearestNeighbors.findKNearest(points, instance, kNeighbors);
            DetectionResult result;
            if (neighbors.isEmpty()) {
                result = DetectionResult.builder()
                        .anomaly(true)
                        .value(0.0)
                        .zScore(ISOLATED_Z_SCORE)
                        .lowerLimit(0.0)
                        .upperLimit(threshold)
                        .description("No neighbors found - isolated point")
                        .build();
            } else {
                double lof = outlierFactor(neighbors, localReachabilityDensity(neighbors));
                boolean anomaly = lof > threshold;
                result = DetectionResult.builder()
                        .anomaly(anomaly)
                        .value(lof)
                        .zScore(lof)
                        .lowerLimit(0.0)
                        .upperLimit(threshold)
                        .description(anomaly
                                ? String.format("ANOMALY: LOF score %.4f (threshold: %.4f) - Point has lower density than neighbors",
                                        lof, threshold)
                                : String.format("Normal: LOF score %.4f (similar density to neighbors)", lof))
                        .build();
            }

            notifyTransition(result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public DetectionResult detect(double value) {
        return detectMultiDimensional(new double[]{value});
    }

    public void clear() {
        lock.lock();
        try {
            points.clear();
            kDistances = new double[0];
            densities = new double[0];
            built = false;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean isInitialized() {
        lock.lock();
        try {
            return built && points.size() >= minPoints();
        } finally {
            lock.unlock();
        }
    }

    public int getDataPointsCount() {
        lock.lock();
        try {
            return points.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * LOF score of the stored point at {@code index}, as of the last build.
     */
    public double getLofScore(int index) {
        lock.lock();
        try {
            LofPoint point = points.get(index);
            if (!point.isProcessed()) {
                throw new NotTrainedException("Point " + index + " has not been scored yet");
            }
            return point.getLofScore();
        } finally {
            lock.unlock();
        }
    }

    private int minPoints() {
        return kNeighbors + 1;
    }

    @Override
    protected String stateTag() {
        return "lof";
    }

    @Override
    protected void writeState(DataOutput out) throws IOException {
        out.writeInt(kNeighbors);
        out.writeInt(dimensions);
        out.writeDouble(threshold);
        out.writeBoolean(built);

        out.writeInt(points.size());
        for (LofPoint point : points) {
            writeVector(out, point.getValues());
        }
        for (LofPoint point : points) {
            out.writeDouble(point.getLofScore());
            out.writeBoolean(point.isProcessed());
        }
    }

    /**
     * Restores parameters and points. A model that was built when saved is rebuilt,
     * since the density cache is not part of the stream.
     */
    @Override
    protected void readState(DataInput in) throws IOException {
        int savedK = in.readInt();
        int savedDimensions = in.readInt();
        double savedThreshold = in.readDouble();
        boolean wasBuilt = in.readBoolean();
        validateK(savedK);

        int count = in.readInt();
        List<LofPoint> restored = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            restored.add(new LofPoint(readVector(in)));
        }
        for (LofPoint point : restored) {
            point.setLofScore(in.readDouble());
            point.setProcessed(in.readBoolean());
        }

        kNeighbors = savedK;
        dimensions = savedDimensions;
        threshold = savedThreshold;
        points.clear();
        points.addAll(restored);
        kDistances = new double[0];
        densities = new double[0];
        built = false;

        if (wasBuilt && points.size() >= minPoints()) {
            computeScores();
        }
        log.info("{}: restored {} points (built={})", getName(), count, built);
    }

    private static void validateK(int kNeighbors) {
        if (kNeighbors < 1) {
            throw new IllegalArgumentException("kNeighbors must be >= 1, got " + kNeighbors);
        }
    }

    public int getKNeighbors() {
        lock.lock();
        try {
            return kNeighbors;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Changing k invalidates the current model.
     */
    public void setKNeighbors(int kNeighbors) {
        validateK(kNeighbors);
        lock.lock();
        try {
            if (this.kNeighbors != kNeighbors) {
                this.kNeighbors = kNeighbors;
                built = false;
            }
        } finally {
            lock.unlock();
        }
    }

    public double getThreshold() {
        lock.lock();
        try {
            return threshold;
        } finally {
            lock.unlock();
        }
    }

    public void setThreshold(double threshold) {
        lock.lock();
        try {
            this.threshold = threshold;
        } finally {
            lock.unlock();
        }
    }

    public boolean isBuilt() {
        lock.lock();
        try {
            return built;
        } finally {
            lock.unlock();
        }
    }
}
