package com.anomaly.detection.service;

import com.anomaly.detection.config.MetricsConfig;
import com.anomaly.detection.engine.AnomalyDetectionException;
import com.anomaly.detection.engine.AnomalyEvent;
import com.anomaly.detection.engine.DensityAnomalyDetector;
import com.anomaly.detection.engine.DetectionResult;
import com.anomaly.detection.engine.dbscan.DbscanDetector;
import com.anomaly.detection.engine.isolationforest.IsolationForestDetector;
import com.anomaly.detection.engine.lof.LofDetector;
import com.anomaly.detection.model.DetectorInfo;
import com.anomaly.detection.model.DetectorSnapshot;
import com.anomaly.detection.model.DetectorType;
import com.anomaly.detection.repository.DetectorSnapshotRepository;
import io.micrometer.observation.annotation.Observed;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Named detector instances shared by the application. Each detector serializes its
 * own calls; the registry only guards membership.
 */
@Service
public class DetectorRegistryService {

    private static final Logger log = LoggerFactory.getLogger(DetectorRegistryService.class);

    private final DetectorFactory detectorFactory;
    private final DetectorSnapshotRepository snapshotRepository;
    private final MetricsConfig metrics;

    private final Map<String, DensityAnomalyDetector> detectors = new ConcurrentHashMap<>();

    public DetectorRegistryService(DetectorFactory detectorFactory,
                                   DetectorSnapshotRepository snapshotRepository,
                                   MetricsConfig metrics) {
        this.detectorFactory = detectorFactory;
        this.snapshotRepository = snapshotRepository;
        this.metrics = metrics;
    }

    /**
     * @throws IllegalArgumentException if a detector with this name already exists
     */
    public DensityAnomalyDetector register(String name, DetectorType type) {
        DensityAnomalyDetector detector = detectorFactory.create(name, type);
        if (!add(name, detector)) {
            throw new IllegalArgumentException("Detector already registered: " + name);
        }
        log.info("Registered {} detector '{}'", type, name);
        return detector;
    }

    private boolean add(String name, DensityAnomalyDetector detector) {
        detector.setAnomalyEventListener(this::onAnomalyEvent);
        if (detectors.putIfAbsent(name, detector) != null) {
            return false;
        }
        metrics.updateRegisteredCount(detectors.size());
        return true;
    }

    /**
     * @throws IllegalArgumentException if no detector has this name
     */
    public DensityAnomalyDetector get(String name) {
        DensityAnomalyDetector detector = detectors.get(name);
        if (detector == null) {
            throw new IllegalArgumentException("Unknown detector: " + name);
        }
        return detector;
    }

    public boolean remove(String name) {
        DensityAnomalyDetector removed = detectors.remove(name);
        if (removed == null) {
            return false;
        }
        metrics.updateRegisteredCount(detectors.size());
        log.info("Removed detector '{}'", name);
        return true;
    }

    public List<String> names() {
        List<String> names = new ArrayList<>(detectors.keySet());
        names.sort(Comparator.naturalOrder());
        return names;
    }

    public List<DetectorInfo> list() {
        List<DetectorInfo> infos = new ArrayList<>();
        for (String name : names()) {
            DensityAnomalyDetector detector = detectors.get(name);
            if (detector == null) continue; // removed concurrently
            infos.add(DetectorInfo.builder()
                    .name(name)
                    .type(DetectorType.of(detector))
                    .initialized(detector.isInitialized())
                    .dimensions(detector.getDimensions())
                    .pointCount(pointCount(detector))
                    .build());
        }
        return infos;
    }

    @Observed(name = "detector.add_training_data", contextualName = "add-training-data")
    public void addTrainingData(String name, double[] vector) {
        get(name).addTrainingData(vector);
    }

    @Observed(name = "detector.train", contextualName = "train-detector")
    public void train(String name) {
        DensityAnomalyDetector detector = get(name);
        detector.train();
        metrics.recordTraining(name, DetectorType.of(detector).name());
        log.info("Trained detector '{}'", name);
    }

    @Observed(name = "detector.detect", contextualName = "detect-anomaly")
    public DetectionResult detect(String name, double[] vector) {
        DensityAnomalyDetector detector = get(name);
        long start = System.nanoTime();
        DetectionResult result = detector.detectMultiDimensional(vector);
        metrics.recordDetection(name, DetectorType.of(detector).name(), result.isAnomaly(),
                System.nanoTime() - start);
        return result;
    }

    /**
     * Persist the named detector's state.
     *
     * @return true if the snapshot was stored
     */
    @Observed(name = "detector.snapshot", contextualName = "snapshot-detector")
    public boolean snapshot(String name) {
        DensityAnomalyDetector detector = get(name);
        ByteArrayOutputStream buffer = new ByteArrayOutputStream();
        try {
            detector.saveState(buffer);
        } catch (IOException e) {
            log.error("Failed to serialize detector '{}'", name, e);
            metrics.recordSnapshot("error");
            return false;
        }

        boolean saved = snapshotRepository.save(DetectorSnapshot.builder()
                .name(name)
                .type(DetectorType.of(detector))
                .state(buffer.toByteArray())
                .pointCount(pointCount(detector))
                .savedAt(System.currentTimeMillis())
                .build());
        metrics.recordSnapshot(saved ? "success" : "error");
        return saved;
    }

    /**
     * Load the named detector's last snapshot. An unregistered name is registered
     * only once its state has loaded.
     *
     * @return false if there is no usable snapshot
     */
    @Observed(name = "detector.restore", contextualName = "restore-detector")
    public boolean restore(String name) {
        DetectorSnapshot snapshot = snapshotRepository.load(name);
        if (snapshot == null) {
            log.warn("No snapshot found for detector '{}'", name);
            return false;
        }

        DensityAnomalyDetector existing = detectors.get(name);
        if (existing != null && DetectorType.of(existing) != snapshot.getType()) {
            log.warn("Snapshot of '{}' is a {} but the registered detector is a {}; not restoring",
                    name, snapshot.getType(), DetectorType.of(existing));
            return false;
        }

        DensityAnomalyDetector detector = existing != null
                ? existing
                : detectorFactory.create(name, snapshot.getType());
        try {
            detector.loadState(new ByteArrayInputStream(snapshot.getState()));
        } catch (IOException | AnomalyDetectionException | IllegalArgumentException e) {
            log.error("Failed to restore detector '{}' from snapshot", name, e);
            return false;
        }

        if (existing == null && !add(name, detector)) {
            log.warn("Detector '{}' was registered while restoring; snapshot discarded", name);
            return false;
        }
        log.info("Restored detector '{}' from snapshot ({} points, saved at {})",
                name, snapshot.getPointCount(), snapshot.getSavedAt());
        return true;
    }

    private void onAnomalyEvent(AnomalyEvent event) {
        log.info("Detector '{}': {} ({})", event.getDetectorName(), event.getEventType(), event.getAdditionalInfo());
        metrics.recordEvent(event.getDetectorName(), event.getEventType().name());
    }

    private static int pointCount(DensityAnomalyDetector detector) {
        if (detector instanceof IsolationForestDetector forest) return forest.getTrainingDataSize();
        if (detector instanceof DbscanDetector dbscan) return dbscan.getPointCount();
        if (detector instanceof LofDetector lof) return lof.getDataPointsCount();
        return 0;
    }
}
