package com.anomaly.detection.engine.isolationforest;

import com.anomaly.detection.engine.AbstractAnomalyDetector;
import com.anomaly.detection.engine.AnomalyDetectionException;
import com.anomaly.detection.engine.DensityAnomalyDetector;
import com.anomaly.detection.engine.DetectionResult;
import com.anomaly.detection.engine.DetectorConfig;
import com.anomaly.detection.engine.DimensionMismatchException;
import com.anomaly.detection.engine.InsufficientDataException;
import com.anomaly.detection.engine.NotTrainedException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.DataInput;
import java.io.DataOutput;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

/**
 * Isolation Forest detector over multi-dimensional points.
 *
 * Training data accumulates in an unbounded buffer. Once the buffer holds
 * {@code autoTrainThreshold} points, every further addition retrains the forest
 * and recalibrates the threshold. Scores are in (0, 1]; a point is anomalous when
 * its score exceeds the threshold.
 *
 * Detection on an untrained detector trains implicitly from the buffer (without
 * recalibrating the threshold), so {@code detect} may mutate the model.
 */
public class IsolationForestDetector extends AbstractAnomalyDetector implements DensityAnomalyDetector {

    private static final Logger log = LoggerFactory.getLogger(IsolationForestDetector.class);

    public static final String DEFAULT_NAME = "Isolation Forest Detector";

    private static final int THRESHOLD_SAMPLE_LIMIT = 100;
    private static final double THRESHOLD_PERCENTILE = 0.9;
    private static final double MIN_THRESHOLD = 0.5;
    private static final double MAX_THRESHOLD = 0.9;
    private static final double FRAUD_THRESHOLD = 0.55;
    private static final double SENSOR_THRESHOLD = 0.50;

    private final int numTrees;
    private final int subSampleSize;
    private final int maxDepth;
    private final Long seed;
    private int autoTrainThreshold = 256;
    private double threshold = 0.5;

    private final List<double[]> trainingData = new ArrayList<>();
    private IsolationForest forest;
    private boolean trained;

    public IsolationForestDetector() {
        this(100, 256, 10);
    }

    public IsolationForestDetector(int numTrees, int subSampleSize, int maxDepth) {
        this(numTrees, subSampleSize, maxDepth, DetectorConfig.defaults(), null);
    }

    /**
     * @param seed fixed seed for reproducible training, or null for a fresh random source
     */
    public IsolationForestDetector(int numTrees, int subSampleSize, int maxDepth,
                                   DetectorConfig config, Long seed) {
        this(DEFAULT_NAME, numTrees, subSampleSize, maxDepth, config, seed);
    }

    public IsolationForestDetector(String name, int numTrees, int subSampleSize, int maxDepth,
                                   DetectorConfig config, Long seed) {
        super(name, config, 0);
        if (numTrees < 1) throw new IllegalArgumentException("numTrees must be >= 1, got " + numTrees);
        if (subSampleSize < 1) throw new IllegalArgumentException("subSampleSize must be >= 1, got " + subSampleSize);
        if (maxDepth < 0) throw new IllegalArgumentException("maxDepth must be >= 0, got " + maxDepth);
        this.numTrees = numTrees;
        this.subSampleSize = subSampleSize;
        this.maxDepth = maxDepth;
        this.seed = seed;
    }

    @Override
    public void addValue(double value) {
        addTrainingData(new double[]{value});
    }

    @Override
    public void addTrainingData(double[] instance) {
        lock.lock();
        try {
            enforceDimensions(instance);
            trainingData.add(Arrays.copyOf(instance, instance.length));
            trained = false;

            if (trainingData.size() >= autoTrainThreshold) {
                log.debug("{}: buffer reached {} points, auto-training", getName(), trainingData.size());
                train();
                calculateOptimalThreshold();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Rebuild every tree from the current buffer. The threshold is left as is.
     *
     * @throws InsufficientDataException if the buffer is empty
     */
    @Override
    public void train() {
        lock.lock();
        try {
            if (trainingData.isEmpty()) {
                throw new InsufficientDataException(1, 0);
            }
            Random random = seed != null ? new Random(seed) : new Random();
            double[][] data = trainingData.toArray(new double[0][]);
            forest = IsolationForest.train(data, numTrees, subSampleSize, maxDepth, random);
            trained = true;
            log.debug("{}: trained {} trees on {} points (sub-sample {}, c(n)={})",
                    getName(), numTrees, data.length, forest.getSampleSize(), forest.getAveragePathLength());
        } finally {
            lock.unlock();
        }
    }

    @Override
    public void build() {
        train();
    }

    /**
     * Replace the buffer with {@code dataset} (without auto-training on the way),
     * then train and recalibrate the threshold. The dataset fixes the dimensionality.
     */
    public void trainFromDataset(double[][] dataset) {
        lock.lock();
        try {
            if (dataset.length == 0) {
                throw new InsufficientDataException(1, 0);
            }
            int width = dataset[0].length;
            for (double[] row : dataset) {
                if (row.length != width || width == 0) {
                    throw new DimensionMismatchException(Math.max(width, 1), row.length);
                }
            }
            trainingData.clear();
            dimensions = width;
            for (double[] row : dataset) {
                trainingData.add(Arrays.copyOf(row, row.length));
            }
            trained = false;
            train();
            calculateOptimalThreshold();
            log.info("{}: trained from dataset of {} x {} (threshold {})",
                    getName(), dataset.length, dimensions, threshold);
        } finally {
            lock.unlock();
        }
    }

    public void trainForFraudDetection(double[][] transactionData) {
        lock.lock();
        try {
            trainFromDataset(transactionData);
            threshold = FRAUD_THRESHOLD;
        } finally {
            lock.unlock();
        }
    }

    public void trainForMultiSensorData(double[][] sensorData) {
        lock.lock();
        try {
            trainFromDataset(sensorData);
            threshold = SENSOR_THRESHOLD;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Add every row of a comma-separated numeric file as training data, then train
     * and recalibrate. Blank lines are skipped.
     */
    public void trainFromCsv(Path file, boolean skipHeader) throws IOException {
        List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
        lock.lock();
        try {
            for (int i = skipHeader ? 1 : 0; i < lines.size(); i++) {
                String line = lines.get(i).trim();
                if (line.isEmpty()) {
                    continue;
                }
                addTrainingData(parseCsvRow(line, i + 1));
            }
            train();
            calculateOptimalThreshold();
        } finally {
            lock.unlock();
        }
    }

    private static double[] parseCsvRow(String line, int lineNumber) {
        String[] cells = line.split(",");
        double[] row = new double[cells.length];
        for (int j = 0; j < cells.length; j++) {
            try {
                row[j] = Double.parseDouble(cells[j].trim());
            } catch (NumberFormatException e) {
                throw new AnomalyDetectionException(String.format(
                        "Invalid numeric value in CSV line %d, column %d: %s", lineNumber, j + 1, cells[j]), e);
            }
        }
        return row;
    }

    /**
     * Train and recalibrate if there is anything buffered; otherwise do nothing.
     */
    public void finalizeTraining() {
        lock.lock();
        try {
            if (!trainingData.isEmpty()) {
                train();
                calculateOptimalThreshold();
            }
        } finally {
            lock.unlock();
        }
    }

    /**
     * Set the threshold to the 90th-percentile score of the first (up to) 100 buffered
     * points, clamped to [0.5, 0.9]. No-op while untrained.
     */
    public void calculateOptimalThreshold() {
        lock.lock();
        try {
            if (!trained || trainingData.isEmpty()) {
                return;
            }
            int count = Math.min(THRESHOLD_SAMPLE_LIMIT, trainingData.size());
            double[] scores = new double[count];
            for (int i = 0; i < count; i++) {
                scores[i] = forest.anomalyScore(trainingData.get(i));
            }
            Arrays.sort(scores);

            int percentileIndex = (int) Math.rint(count * THRESHOLD_PERCENTILE);
            double candidate = percentileIndex < count ? scores[percentileIndex] : MIN_THRESHOLD;
            threshold = Math.max(MIN_THRESHOLD, Math.min(MAX_THRESHOLD, candidate));
        } finally {
            lock.unlock();
        }
    }

    public double anomalyScore(double[] instance) {
        lock.lock();
        try {
            ensureTrained();
            checkQueryDimensions(instance);
            return forest.anomalyScore(instance);
        } finally {
            lock.unlock();
        }
    }

    public double[] featureContributions(double[] instance, double[] featureMeans) {
        lock.lock();
        try {
            ensureTrained();
            checkQueryDimensions(instance);
            checkQueryDimensions(featureMeans);
            return forest.featureContributions(instance, featureMeans);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public DetectionResult detect(double value) {
        return detectMultiDimensional(new double[]{value});
    }

    @Override
    public DetectionResult detectMultiDimensional(double[] instance) {
        lock.lock();
        try {
            ensureTrained();
            checkQueryDimensions(instance);

            double score = forest.anomalyScore(instance);
            boolean anomaly = score > threshold;
            DetectionResult result = DetectionResult.builder()
                    .anomaly(anomaly)
                    .value(instance[0])
                    .zScore((score - threshold) / 0.2)
                    .lowerLimit(threshold)
                    .upperLimit(1.0)
                    .description(anomaly
                            ? String.format("ISOLATION FOREST ANOMALY: Score %.4f (threshold %.4f)", score, threshold)
                            : String.format("Normal: Score %.4f (threshold %.4f)", score, threshold))
                    .build();

            notifyTransition(result);
            return result;
        } finally {
            lock.unlock();
        }
    }

    private void ensureTrained() {
        if (trained) {
            return;
        }
        if (trainingData.isEmpty()) {
            throw new NotTrainedException("Detector must be trained first: no training data available");
        }
        log.debug("{}: model stale, training implicitly before detection", getName());
        train();
    }

    private void checkQueryDimensions(double[] instance) {
        if (instance.length != dimensions) {
            throw new DimensionMismatchException(dimensions, instance.length);
        }
    }

    @Override
    public boolean isInitialized() {
        lock.lock();
        try {
            return trained;
        } finally {
            lock.unlock();
        }
    }

    @Override
    protected String stateTag() {
        return "isolation-forest";
    }

    @Override
    protected void writeState(DataOutput out) throws IOException {
        out.writeInt(numTrees);
        out.writeInt(subSampleSize);
        out.writeInt(maxDepth);
        out.writeDouble(threshold);
        out.writeBoolean(trained);
        out.writeDouble(getAveragePathLength());
        out.writeInt(dimensions);
        out.writeInt(autoTrainThreshold);
        out.writeBoolean(seed != null);
        out.writeLong(seed != null ? seed : 0L);

        out.writeInt(trainingData.size());
        for (double[] row : trainingData) {
            writeVector(out, row);
        }
    }

    /**
     * Trees are never persisted: a detector that was trained when saved retrains
     * from the restored buffer here, with its own parameters and seed, and keeps
     * the persisted threshold.
     */
    @Override
    protected void readState(DataInput in) throws IOException {
        int savedTrees = in.readInt();
        int savedSubSample = in.readInt();
        int savedDepth = in.readInt();
        double savedThreshold = in.readDouble();
        boolean wasTrained = in.readBoolean();
        in.readDouble(); // average path length, recomputed on retrain
        int savedDimensions = in.readInt();
        int savedAutoTrain = in.readInt();
        boolean hadSeed = in.readBoolean();
        long savedSeed = in.readLong();

        int count = in.readInt();
        List<double[]> restored = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            restored.add(readVector(in));
        }

        if (savedTrees != numTrees || savedSubSample != subSampleSize || savedDepth != maxDepth
                || hadSeed != (seed != null) || (hadSeed && savedSeed != seed)) {
            log.warn("{}: loading state saved with numTrees={}, subSampleSize={}, maxDepth={}, seed={}; "
                            + "retraining with this instance's parameters", getName(),
                    savedTrees, savedSubSample, savedDepth, hadSeed ? savedSeed : "none");
        }

        trainingData.clear();
        trainingData.addAll(restored);
        dimensions = savedDimensions;
        autoTrainThreshold = savedAutoTrain;
        threshold = savedThreshold;
        forest = null;
        trained = false;

        if (wasTrained && !trainingData.isEmpty()) {
            train();
        }
        log.info("{}: restored {} training points (trained={})", getName(), count, trained);
    }

    public int getNumTrees() { return numTrees; }
    public int getSubSampleSize() { return subSampleSize; }
    public int getMaxDepth() { return maxDepth; }
    public Long getSeed() { return seed; }

    public boolean isTrained() {
        return isInitialized();
    }

    public int getFeatureCount() {
        return getDimensions();
    }

    public int getTrainingDataSize() {
        lock.lock();
        try {
            return trainingData.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * c(n) for the current sub-sample size; 0 while untrained.
     */
    public double getAveragePathLength() {
        lock.lock();
        try {
            return forest != null ? forest.getAveragePathLength() : 0.0;
        } finally {
            lock.unlock();
        }
    }

    public int getAutoTrainThreshold() {
        lock.lock();
        try {
            return autoTrainThreshold;
        } finally {
            lock.unlock();
        }
    }

    public void setAutoTrainThreshold(int autoTrainThreshold) {
        lock.lock();
        try {
            this.autoTrainThreshold = autoTrainThreshold;
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
}
