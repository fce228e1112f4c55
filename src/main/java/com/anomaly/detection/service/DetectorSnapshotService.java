package com.anomaly.detection.service;

import com.anomaly.detection.config.DetectorProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Periodically persists every registered detector.
 */
@Service
public class DetectorSnapshotService {

    private static final Logger log = LoggerFactory.getLogger(DetectorSnapshotService.class);

    private final DetectorRegistryService registryService;
    private final DetectorProperties properties;

    public DetectorSnapshotService(DetectorRegistryService registryService, DetectorProperties properties) {
        this.registryService = registryService;
        this.properties = properties;
    }

    @Scheduled(fixedRateString = "${detector.snapshot.interval-seconds:300}",
               timeUnit = TimeUnit.SECONDS,
               initialDelayString = "${detector.snapshot.interval-seconds:300}")
    public void snapshotAll() {
        if (!properties.getSnapshot().isEnabled()) {
            return;
        }

        List<String> names = registryService.names();
        if (names.isEmpty()) {
            return;
        }

        int saved = 0;
        for (String name : names) {
            try {
                if (registryService.snapshot(name)) {
                    saved++;
                }
            } catch (Exception e) {
                log.error("Failed to snapshot detector '{}'", name, e);
            }
        }

        if (saved < names.size()) {
            log.warn("Snapshot run saved {} of {} detectors", saved, names.size());
        } else {
            log.info("Snapshot run saved {} detectors", saved);
        }
    }
}
