package com.anomaly.detection.engine;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class AnomalyEvent {

    private AnomalyEventType eventType;

    private Instant timestamp;

    private DetectionResult result;

    private String detectorName;

    private String additionalInfo;
}
