package com.anomaly.detection;

import com.anomaly.detection.config.DetectorProperties;
import com.anomaly.detection.config.TestAerospikeConfig;
import com.anomaly.detection.engine.DetectionResult;
import com.anomaly.detection.engine.lof.LofDetector;
import com.anomaly.detection.model.DetectorType;
import com.anomaly.detection.service.DetectorRegistryService;
import io.micrometer.core.instrument.MeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@Import(TestAerospikeConfig.class)
@ActiveProfiles("test")
class DensityAnomalyDetectionApplicationTest {

    @Autowired
    private DetectorProperties properties;

    @Autowired
    private DetectorRegistryService registryService;

    @Autowired
    private MeterRegistry meterRegistry;

    @AfterEach
    void tearDown() {
        registryService.names().forEach(registryService::remove);
    }

    @Test
    void contextLoads_bindsDetectorProperties() {
        assertThat(properties.getLof().getKNeighbors()).isEqualTo(3);
        assertThat(properties.getIsolationForest().getSeed()).isEqualTo(42L);
        assertThat(properties.getDbscan().getMinPoints()).isEqualTo(3);
        assertThat(properties.getDbscan().getMaxHistorySize()).isEqualTo(1000);
        assertThat(properties.getSnapshot().isEnabled()).isFalse();
    }

    @Test
    void registry_endToEnd_detectsOutlierAndRecordsMetrics() {
        LofDetector detector = (LofDetector) registryService.register("latency", DetectorType.LOF);
        for (double v : new double[]{9.5, 9.6, 9.7, 9.8, 9.9, 10.0, 10.1, 10.2, 10.3, 10.4, 10.5}) {
            registryService.addTrainingData("latency", new double[]{v});
        }
        registryService.train("latency");

        DetectionResult normal = registryService.detect("latency", new double[]{10.2});
        DetectionResult outlier = registryService.detect("latency", new double[]{90.0});

        assertThat(detector.getKNeighbors()).isEqualTo(3);
        assertThat(normal.isAnomaly()).isFalse();
        assertThat(outlier.isAnomaly()).isTrue();
        assertThat(meterRegistry.get("detector.detection.count").tag("detector", "latency")
                .tag("result", "anomaly").counter().count()).isEqualTo(1.0);
    }
}
