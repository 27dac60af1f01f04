package com.example.chronotrace.search;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * A ranked segment enriched with catalog detail.
 */
@Value
@Builder(toBuilder = true)
public class SearchHit {
    String segmentId;
    String pointId;
    double score;
    String videoId;
    double startOffset;
    double endOffset;
    String cameraId;
    String location;
    Instant timestamp;
    boolean hasFaces;
    boolean hasVehicles;
    boolean motionDetected;

    public double getDuration() {
        return Math.round((endOffset - startOffset) * 1000.0) / 1000.0;
    }
}
