package com.anomaly.detection.engine;

/**
 * Root of the detector error hierarchy. All detector failures are local
 * precondition violations: nothing here is retried automatically.
 */
public class AnomalyDetectionException extends RuntimeException {

    public AnomalyDetectionException(String message) {
        super(message);
    }

    public AnomalyDetectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
