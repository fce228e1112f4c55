package com.anomaly.detection.engine;

/**
 * Detector over fixed-length feature vectors. The dimensionality is fixed by
 * configuration or by the first ingested vector, and enforced from then on.
 */
public interface DensityAnomalyDetector extends AnomalyDetector {

    /**
     * @throws DimensionMismatchException if the vector length differs from {@link #getDimensions()}
     */
    void addTrainingData(double[] instance);

    void train();

    DetectionResult detectMultiDimensional(double[] instance);

    /**
     * @return the fixed dimensionality, or 0 while it is still unknown
     */
    int getDimensions();
}
