package com.anomaly.detection.engine;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.Path;

/**
 * Lifecycle shared by every detector: accumulate training data, build a model,
 * then detect against it.
 */
public interface AnomalyDetector {

    String getName();

    /**
     * Training phase: add a single observation.
     */
    void addValue(double value);

    /**
     * Training phase: add a batch of observations, in order.
     */
    void addValues(double[] values);

    /**
     * Build (or rebuild) the model from the data accumulated so far.
     *
     * @throws InsufficientDataException if the detector holds too few points
     */
    void build();

    /**
     * Detect whether a single value is anomalous against the current model.
     */
    DetectionResult detect(double value);

    default boolean isAnomaly(double value) {
        return detect(value).isAnomaly();
    }

    default String getAnomalyInfo(double value) {
        return detect(value).getDescription();
    }

    boolean isInitialized();

    DetectorConfig getConfig();

    void setConfig(DetectorConfig config);

    void setAnomalyEventListener(AnomalyEventListener listener);

    /**
     * Write the data needed to reconstruct this detector. Derived models (trees,
     * clusterings) are rebuilt on load rather than written.
     */
    void saveState(OutputStream out) throws IOException;

    void loadState(InputStream in) throws IOException;

    void saveToFile(Path file) throws IOException;

    void loadFromFile(Path file) throws IOException;
}
