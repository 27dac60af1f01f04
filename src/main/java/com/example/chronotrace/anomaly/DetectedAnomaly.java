package com.example.chronotrace.anomaly;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * What a detector found, before it is stored. {@code evidenceKey} identifies the underlying
 * evidence so repeated evaluations of the same situation yield one anomaly.
 */
@Value
@Builder
public class DetectedAnomaly {
    AnomalyType type;
    double confidence;
    Severity severity;
    String trackId;
    String segmentId;
    String cameraId;
    String location;
    Instant detectedAt;
    String description;
    String evidenceKey;
}
