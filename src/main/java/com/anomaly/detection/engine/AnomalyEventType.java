package com.anomaly.detection.engine;

public enum AnomalyEventType {
    ANOMALY_DETECTED,
    NORMAL_RESUMED
}
