package com.anomaly.detection.engine;

/**
 * A feature vector's length disagrees with the dimensionality the detector fixed
 * at construction or on its first ingested point.
 */
public class DimensionMismatchException extends AnomalyDetectionException {

    private final int expected;
    private final int actual;

    public DimensionMismatchException(int expected, int actual) {
        super(String.format("Point dimension mismatch: expected %d, got %d", expected, actual));
        this.expected = expected;
        this.actual = actual;
    }

    public int getExpected() { return expected; }
    public int getActual() { return actual; }
}
