package com.anomaly.detection.engine.dbscan;

import com.anomaly.detection.engine.AnomalyDetectionException;
import com.anomaly.detection.engine.AnomalyEvent;
import com.anomaly.detection.engine.AnomalyEventType;
import com.anomaly.detection.engine.DetectionResult;
import com.anomaly.detection.engine.DimensionMismatchException;
import com.anomaly.detection.engine.isolationforest.IsolationForestDetector;
import com.anomaly.detection.testutil.TestDataFactory;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class DbscanDetectorTest {

    private DbscanDetector detector;

    @BeforeEach
    void setUp() {
        detector = new DbscanDetector(1.0, 3, 0);
    }

    private void addScenarioPoints() {
        for (int i = 0; i < 20; i++) {
            detector.addValue(9.0 + i * 0.1);
        }
        detector.addValue(100.0);
        detector.addValue(200.0);
    }

    private void assertClusteringInvariants() {
        int noise = 0;
        int maxId = 0;
        for (int i = 0; i < detector.getPointCount(); i++) {
            int id = detector.getClusterId(i);
            if (id == DbscanPoint.NOISE) noise++;
            maxId = Math.max(maxId, id);
        }
        assertThat(noise).isEqualTo(detector.getOutlierCount());
        assertThat(maxId).isEqualTo(detector.getClusterCount());
    }

    private static byte[] dbscanState(int maxHistorySize, int reclusterThreshold, double... values) throws IOException {
        ByteArrayOutputStream bytes = new ByteArrayOutputStream();
        DataOutputStream data = new DataOutputStream(bytes);
        data.writeInt(0x41444554);
        data.writeUTF("dbscan");
        data.writeInt(1);
        data.writeDouble(3.0);
        data.writeDouble(0.001);
        data.writeDouble(1.0);
        data.writeInt(3);
        data.writeInt(1);
        data.writeInt(maxHistorySize);
        data.writeBoolean(true);
        data.writeInt(reclusterThreshold);
        data.writeInt(values.length);
        for (double value : values) {
            data.writeInt(1);
            data.writeDouble(value);
        }
        for (int i = 0; i < values.length; i++) {
            data.writeInt(DbscanPoint.UNCLASSIFIED);
        }
        data.flush();
        return bytes.toByteArray();
    }

    @Test
    void recluster_denseGroupAndTwoIsolatedPoints_findsClusterAndOutliers() {
        addScenarioPoints();

        detector.recluster();

        assertThat(detector.getClusterCount()).isGreaterThanOrEqualTo(1);
        assertThat(detector.getOutlierCount()).isGreaterThanOrEqualTo(2);
        assertThat(detector.getClusterId(20)).isEqualTo(DbscanPoint.NOISE);
        assertThat(detector.getClusterId(21)).isEqualTo(DbscanPoint.NOISE);
        assertThat(detector.getLastClusteringTime()).isNotNull();
        assertClusteringInvariants();
    }

    @Test
    void recluster_noiseReachedFromCorePoint_becomesBorderPoint() {
        // 0.0 sees only itself and 1.0; 1.0 is core and claims it
        detector.addValue(0.0);
        detector.addValue(1.0);
        detector.addValue(2.0);

        detector.recluster();

        assertThat(detector.getClusterCount()).isEqualTo(1);
        assertThat(detector.getOutlierCount()).isZero();
        assertThat(detector.getClusterId(0)).isEqualTo(1);
        assertClusteringInvariants();
    }

    @Test
    void recluster_multipleClusters_numberedConsecutively() {
        double[][] left = TestDataFactory.gaussianCluster(1, 30, new double[]{0, 0}, 0.2);
        double[][] right = TestDataFactory.gaussianCluster(2, 30, new double[]{20, 20}, 0.2);
        for (double[] p : left) detector.addPoint(p);
        for (double[] p : right) detector.addPoint(p);
        detector.addPoint(new double[]{10, -10});

        detector.recluster();

        assertThat(detector.getClusterCount()).isEqualTo(2);
        assertThat(detector.getOutlierCount()).isEqualTo(1);
        assertThat(detector.getClusterId(0)).isEqualTo(1);
        assertThat(detector.getClusterId(30)).isEqualTo(2);
        assertClusteringInvariants();
    }

    @Test
    void recluster_twice_isDeterministic() {
        addScenarioPoints();
        detector.recluster();
        DetectionResult first = detector.detect(9.55);

        detector.recluster();
        DetectionResult second = detector.detect(9.55);

        assertThat(second).isEqualTo(first);
    }

    @Test
    void detect_insideCluster_isNormal() {
        addScenarioPoints();
        detector.recluster();

        DetectionResult result = detector.detect(10.0);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getDescription()).isEqualTo("Normal");
        assertThat(result.getValue()).isEqualTo(10.0);
        assertThat(result.getZScore()).isBetween(0.0, 1.0);
        assertThat(result.getUpperLimit()).isEqualTo(1.0);
    }

    @Test
    void detect_emptyRegion_isLowDensityAnomaly() {
        addScenarioPoints();
        detector.recluster();

        DetectionResult result = detector.detect(50.0);

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getDescription()).isEqualTo("Low density region");
        assertThat(result.getZScore()).isCloseTo(3 / Math.sqrt(3), within(1e-12));
    }

    @Test
    void detect_denseButOnlyNoiseNeighbours_isNotInAnyCluster() {
        DbscanDetector sparse = new DbscanDetector(1.0, 3, 2);
        sparse.addPoint(new double[]{1, 0});
        sparse.addPoint(new double[]{-1, 0});
        sparse.addPoint(new double[]{0, 1});

        DetectionResult result = sparse.detectMultiDim(new double[]{0, 0});

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getDescription()).isEqualTo("Not in any cluster");
        assertThat(result.getZScore()).isEqualTo(Double.MAX_VALUE);
        assertThat(sparse.getOutlierCount()).isEqualTo(3);
    }

    @Test
    void detect_fewerPointsThanMinPoints_reportsNotEnoughSamples() {
        detector.addValue(1.0);

        DetectionResult result = detector.detect(1.0);

        assertThat(result.isAnomaly()).isFalse();
        assertThat(result.getDescription()).isEqualTo("Not enough samples");
    }

    @Test
    void detect_beforeAnyClustering_clustersLazily() {
        detector.setAutoRecluster(false);
        addScenarioPoints();
        assertThat(detector.getClusterCount()).isZero();

        detector.detect(10.0);

        assertThat(detector.getClusterCount()).isGreaterThanOrEqualTo(1);
    }

    @Test
    void detectMultiDim_wrongLength_returnsAnomalyInsteadOfThrowing() {
        DbscanDetector twoDim = new DbscanDetector(1.0, 3, 2);

        DetectionResult result = twoDim.detectMultiDim(new double[]{1, 2, 3});

        assertThat(result.isAnomaly()).isTrue();
        assertThat(result.getDescription()).isEqualTo("Invalid dimension");
    }

    @Test
    void addPoint_wrongLength_throws() {
        detector.addPoint(new double[]{1, 2});

        assertThatThrownBy(() -> detector.addPoint(new double[]{1, 2, 3}))
                .isInstanceOf(DimensionMismatchException.class);
    }

    @Test
    void addPoint_beyondMaxHistory_evictsOldest() {
        detector.setAutoRecluster(false);
        detector.setMaxHistorySize(5);
        for (int i = 0; i < 8; i++) {
            detector.addValue(i);
        }

        assertThat(detector.getPointCount()).isEqualTo(5);
        detector.recluster();
        // 0, 1, 2 are gone, so 3..7 form one chain
        assertThat(detector.getClusterCount()).isEqualTo(1);
        assertThat(detector.getOutlierCount()).isZero();
    }

    @Test
    void addPoint_atReclusterThreshold_reclustersAutomatically() {
        detector.setReclusterThreshold(5);
        for (int i = 0; i < 4; i++) {
            detector.addValue(10.0 + i * 0.1);
        }
        assertThat(detector.getLastClusteringTime()).isNull();

        detector.addValue(10.4);

        assertThat(detector.getLastClusteringTime()).isNotNull();
        assertThat(detector.getClusterCount()).isEqualTo(1);
    }

    @Test
    void reset_clearsHistoryAndClusters() {
        addScenarioPoints();
        detector.recluster();

        detector.reset();

        assertThat(detector.getPointCount()).isZero();
        assertThat(detector.getClusterCount()).isZero();
        assertThat(detector.getOutlierCount()).isZero();
        assertThat(detector.isInitialized()).isFalse();
    }

    @Test
    void saveAndLoad_freshInstance_reproducesDetection() throws Exception {
        addScenarioPoints();
        detector.recluster();
        DetectionResult before = detector.detect(10.3);

        ByteArrayOutputStream out = new ByteArrayOutputStream();
        detector.saveState(out);
        DbscanDetector restored = new DbscanDetector();
        restored.loadState(new ByteArrayInputStream(out.toByteArray()));

        assertThat(restored.getEpsilon()).isEqualTo(1.0);
        assertThat(restored.getMinPoints()).isEqualTo(3);
        assertThat(restored.getPointCount()).isEqualTo(22);
        assertThat(restored.getClusterCount()).isEqualTo(detector.getClusterCount());
        assertThat(restored.detect(10.3)).isEqualTo(before);
    }

    @Test
    void loadState_streamFromOtherDetectorType_isRejected() throws Exception {
        IsolationForestDetector forest = new IsolationForestDetector(5, 16, 4);
        forest.addValue(1.0);
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        forest.saveState(out);

        assertThatThrownBy(() -> detector.loadState(new ByteArrayInputStream(out.toByteArray())))
                .isInstanceOf(AnomalyDetectionException.class);
    }

    @Test
    void detect_transitions_fireEvents() {
        List<AnomalyEvent> events = new ArrayList<>();
        detector.setAnomalyEventListener(events::add);
        addScenarioPoints();
        detector.recluster();

        detector.detect(50.0);
        detector.detect(10.0);

        assertThat(events).extracting(AnomalyEvent::getEventType)
                .containsExactly(AnomalyEventType.ANOMALY_DETECTED, AnomalyEventType.NORMAL_RESUMED);
        assertThat(events.get(0).getAdditionalInfo()).isEqualTo("Anomaly detected: Low density region");
    }

    @Test
    void constructor_invalidParameters_throw() {
        assertThatThrownBy(() -> new DbscanDetector(0.0, 3, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> new DbscanDetector(1.0, 0, 0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> detector.setMaxHistorySize(0)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> detector.setReclusterThreshold(0)).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void loadState_zeroReclusterThreshold_isRejectedAndStateKept() throws Exception {
        addScenarioPoints();
        byte[] state = dbscanState(1000, 0, 1.0, 1.5, 2.0);

        assertThatThrownBy(() -> detector.loadState(new ByteArrayInputStream(state)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("reclusterThreshold");
        assertThat(detector.getPointCount()).isEqualTo(22);
        assertThat(detector.getReclusterThreshold()).isEqualTo(50);
    }

    @Test
    void loadState_zeroMaxHistorySize_isRejected() throws Exception {
        byte[] state = dbscanState(0, 50, 1.0);

        assertThatThrownBy(() -> detector.loadState(new ByteArrayInputStream(state)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("maxHistorySize");
        assertThat(detector.getMaxHistorySize()).isEqualTo(1000);
    }

    @Test
    void loadState_historyLongerThanMaxHistorySize_keepsNewestPoints() throws Exception {
        byte[] state = dbscanState(3, 50, 0.0, 1.0, 2.0, 3.0, 4.0, 5.0);

        detector.loadState(new ByteArrayInputStream(state));

        assertThat(detector.getPointCount()).isEqualTo(3);
        assertThat(detector.getMaxHistorySize()).isEqualTo(3);
        // 3, 4, 5 remain and chain into one cluster
        assertThat(detector.getClusterCount()).isEqualTo(1);
        assertThat(detector.getOutlierCount()).isZero();
        assertClusteringInvariants();
    }
}
