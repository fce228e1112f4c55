package com.anomaly.detection.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DetectorInfo {
    private String name;
    private DetectorType type;
    private boolean initialized;
    private int dimensions;
    private int pointCount;
}
