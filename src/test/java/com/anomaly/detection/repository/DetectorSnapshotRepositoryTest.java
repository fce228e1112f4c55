package com.anomaly.detection.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.AerospikeException;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.anomaly.detection.config.AerospikeConfig;
import com.anomaly.detection.model.DetectorSnapshot;
import com.anomaly.detection.model.DetectorType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.HashMap;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DetectorSnapshotRepositoryTest {

    @Mock private AerospikeClient client;

    private final WritePolicy writePolicy = new WritePolicy();
    private final Policy readPolicy = new Policy();
    private DetectorSnapshotRepository repository;

    @BeforeEach
    void setUp() {
        repository = new DetectorSnapshotRepository(client, "test", writePolicy, readPolicy);
    }

    @Test
    void save_writesRecordKeyedByName() {
        DetectorSnapshot snapshot = DetectorSnapshot.builder()
                .name("sensors")
                .type(DetectorType.ISOLATION_FOREST)
                .state(new byte[]{1, 2, 3})
                .pointCount(3)
                .savedAt(1000L)
                .build();

        assertThat(repository.save(snapshot)).isTrue();

        ArgumentCaptor<Key> keyCaptor = ArgumentCaptor.forClass(Key.class);
        verify(client).put(eq(writePolicy), keyCaptor.capture(), any(Bin[].class));
        assertThat(keyCaptor.getValue().namespace).isEqualTo("test");
        assertThat(keyCaptor.getValue().setName).isEqualTo(AerospikeConfig.SET_DETECTOR_SNAPSHOTS);
        assertThat(keyCaptor.getValue().userKey.getObject()).isEqualTo("sensors");
    }

    @Test
    void save_clientFailure_returnsFalse() {
        doThrow(new AerospikeException("cluster unavailable"))
                .when(client).put(eq(writePolicy), any(Key.class), any(Bin[].class));

        boolean saved = repository.save(DetectorSnapshot.builder()
                .name("sensors").type(DetectorType.LOF).state(new byte[0]).build());

        assertThat(saved).isFalse();
    }

    @Test
    void load_existingRecord_mapsBins() {
        Map<String, Object> bins = new HashMap<>();
        bins.put("name", "sensors");
        bins.put("type", "DBSCAN");
        bins.put("state", new byte[]{9, 8});
        bins.put("pointCount", 42L);
        bins.put("savedAt", 1234L);
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(new Record(bins, 1, 0));

        DetectorSnapshot snapshot = repository.load("sensors");

        assertThat(snapshot.getName()).isEqualTo("sensors");
        assertThat(snapshot.getType()).isEqualTo(DetectorType.DBSCAN);
        assertThat(snapshot.getState()).containsExactly(9, 8);
        assertThat(snapshot.getPointCount()).isEqualTo(42);
        assertThat(snapshot.getSavedAt()).isEqualTo(1234L);
    }

    @Test
    void load_missingRecord_returnsNull() {
        when(client.get(eq(readPolicy), any(Key.class))).thenReturn(null);

        assertThat(repository.load("unknown")).isNull();
    }

    @Test
    void load_clientFailure_returnsNull() {
        when(client.get(eq(readPolicy), any(Key.class))).thenThrow(new AerospikeException("timeout"));

        assertThat(repository.load("sensors")).isNull();
    }
}
