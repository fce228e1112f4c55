package com.anomaly.detection.service;

import com.anomaly.detection.config.DetectorProperties;
import com.anomaly.detection.engine.DensityAnomalyDetector;
import com.anomaly.detection.engine.DetectorConfig;
import com.anomaly.detection.engine.dbscan.DbscanDetector;
import com.anomaly.detection.engine.isolationforest.IsolationForestDetector;
import com.anomaly.detection.engine.lof.LofDetector;
import com.anomaly.detection.model.DetectorType;
import org.springframework.stereotype.Component;

/**
 * Builds detectors configured from the {@code detector.*} properties.
 */
@Component
public class DetectorFactory {

    private final DetectorProperties properties;

    public DetectorFactory(DetectorProperties properties) {
        this.properties = properties;
    }

    public DensityAnomalyDetector create(String name, DetectorType type) {
        DetectorConfig config = DetectorConfig.builder()
                .sigmaMultiplier(properties.getSensitivity().getSigmaMultiplier())
                .minStdDev(properties.getSensitivity().getMinStdDev())
                .build();

        return switch (type) {
            case ISOLATION_FOREST -> createIsolationForest(name, config);
            case DBSCAN -> createDbscan(name, config);
            case LOF -> createLof(name, config);
        };
    }

    private IsolationForestDetector createIsolationForest(String name, DetectorConfig config) {
        DetectorProperties.IsolationForest p = properties.getIsolationForest();
        IsolationForestDetector detector = new IsolationForestDetector(
                name, p.getNumTrees(), p.getSubSampleSize(), p.getMaxDepth(), config, p.getSeed());
        detector.setAutoTrainThreshold(p.getAutoTrainThreshold());
        detector.setThreshold(p.getThreshold());
        return detector;
    }

    private DbscanDetector createDbscan(String name, DetectorConfig config) {
        DetectorProperties.Dbscan p = properties.getDbscan();
        DbscanDetector detector = new DbscanDetector(
                name, p.getEpsilon(), p.getMinPoints(), p.getDimensions(), config);
        detector.setMaxHistorySize(p.getMaxHistorySize());
        detector.setAutoRecluster(p.isAutoRecluster());
        detector.setReclusterThreshold(p.getReclusterThreshold());
        return detector;
    }

    private LofDetector createLof(String name, DetectorConfig config) {
        DetectorProperties.Lof p = properties.getLof();
        return new LofDetector(name, p.getKNeighbors(), p.getDimensions(), p.getThreshold(), config);
    }
}
