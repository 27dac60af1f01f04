package com.example.chronotrace.index;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * The subset of segment fields stored next to each vector so filters need no join.
 */
@Value
@Builder(toBuilder = true)
public class PointMetadata {
    String videoId;
    String cameraId;
    String location;
    double startOffset;
    double endOffset;
    Instant timestamp;
    boolean hasFaces;
    boolean hasVehicles;
    boolean motionDetected;
}
