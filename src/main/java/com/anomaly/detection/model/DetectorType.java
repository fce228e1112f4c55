package com.anomaly.detection.model;

import com.anomaly.detection.engine.AnomalyDetector;
import com.anomaly.detection.engine.dbscan.DbscanDetector;
import com.anomaly.detection.engine.isolationforest.IsolationForestDetector;
import com.anomaly.detection.engine.lof.LofDetector;

public enum DetectorType {
    ISOLATION_FOREST,
    DBSCAN,
    LOF;

    public static DetectorType of(AnomalyDetector detector) {
        if (detector instanceof IsolationForestDetector) return ISOLATION_FOREST;
        if (detector instanceof DbscanDetector) return DBSCAN;
        if (detector instanceof LofDetector) return LOF;
        throw new IllegalArgumentException("Unknown detector implementation: " + detector.getClass().getName());
    }
}
