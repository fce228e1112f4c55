package com.anomaly.detection.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Persisted detector state as stored in Aerospike. {@code state} is the
 * detector's own binary stream, restorable with {@code loadState}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectorSnapshot {
    private String name;
    private DetectorType type;
    private byte[] state;
    private int pointCount;
    private long savedAt;
}
