package com.anomaly.detection.repository;

import com.aerospike.client.AerospikeClient;
import com.aerospike.client.Bin;
import com.aerospike.client.Key;
import com.aerospike.client.Record;
import com.aerospike.client.policy.Policy;
import com.aerospike.client.policy.WritePolicy;
import com.anomaly.detection.config.AerospikeConfig;
import com.anomaly.detection.model.DetectorSnapshot;
import com.anomaly.detection.model.DetectorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Repository;

@Repository
public class DetectorSnapshotRepository {

    private static final Logger log = LoggerFactory.getLogger(DetectorSnapshotRepository.class);

    private final AerospikeClient client;
    private final String namespace;
    private final WritePolicy writePolicy;
    private final Policy readPolicy;

    public DetectorSnapshotRepository(AerospikeClient client,
                                      @Qualifier("aerospikeNamespace") String namespace,
                                      @Qualifier("defaultWritePolicy") WritePolicy writePolicy,
                                      @Qualifier("defaultReadPolicy") Policy readPolicy) {
        this.client = client;
        this.namespace = namespace;
        this.writePolicy = writePolicy;
        this.readPolicy = readPolicy;
    }

    /**
     * @return true if the snapshot was written
     */
    public boolean save(DetectorSnapshot snapshot) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_DETECTOR_SNAPSHOTS, snapshot.getName());

            client.put(writePolicy, key,
                    new Bin("name", snapshot.getName()),
                    new Bin("type", snapshot.getType().name()),
                    new Bin("state", snapshot.getState()),
                    new Bin("pointCount", snapshot.getPointCount()),
                    new Bin("savedAt", snapshot.getSavedAt()));

            log.info("Saved snapshot of {} ({}): {} points, {} bytes",
                    snapshot.getName(), snapshot.getType(), snapshot.getPointCount(), snapshot.getState().length);
            return true;
        } catch (Exception e) {
            log.error("Failed to save snapshot of {}", snapshot.getName(), e);
            return false;
        }
    }

    public DetectorSnapshot load(String name) {
        try {
            Key key = new Key(namespace, AerospikeConfig.SET_DETECTOR_SNAPSHOTS, name);
            Record record = client.get(readPolicy, key);
            if (record == null) return null;

            return DetectorSnapshot.builder()
                    .name(record.getString("name"))
                    .type(DetectorType.valueOf(record.getString("type")))
                    .state((byte[]) record.getValue("state"))
                    .pointCount(record.getInt("pointCount"))
                    .savedAt(record.getLong("savedAt"))
                    .build();
        } catch (Exception e) {
            log.error("Failed to load snapshot of {}", name, e);
            return null;
        }
    }
}
