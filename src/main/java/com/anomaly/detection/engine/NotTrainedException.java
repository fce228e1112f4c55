package com.anomaly.detection.engine;

/**
 * Detection was requested while no valid model exists and there is no buffered
 * data to build one from.
 */
public class NotTrainedException extends AnomalyDetectionException {

    public NotTrainedException(String message) {
        super(message);
    }
}
