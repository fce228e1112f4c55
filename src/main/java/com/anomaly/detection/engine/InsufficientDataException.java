package com.anomaly.detection.engine;

public class InsufficientDataException extends AnomalyDetectionException {

    private final int required;
    private final int available;

    public InsufficientDataException(int required, int available) {
        super(String.format("Insufficient data points: need at least %d, have %d", required, available));
        this.required = required;
        this.available = available;
    }

    public int getRequired() { return required; }
    public int getAvailable() { return available; }
}
