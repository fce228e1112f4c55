package com.anomaly.detection.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectionResult {

    private boolean anomaly;

    // Detector-specific representative value (query coordinate, LOF score, ...)
    private double value;

    private double zScore;

    private double lowerLimit;

    private double upperLimit;

    private String description;
}
