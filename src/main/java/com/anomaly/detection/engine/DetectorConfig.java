package com.anomaly.detection.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Sensitivity settings shared by every detector. Persisted at the head of each
 * detector's saved state.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class DetectorConfig {

    // Standard deviations from the mean before a value counts as anomalous
    @Builder.Default
    private double sigmaMultiplier = 3.0;

    // Floor for the standard deviation, avoids false positives on flat data
    @Builder.Default
    private double minStdDev = 0.001;

    public static DetectorConfig defaults() {
        return DetectorConfig.builder().build();
    }
}
