package com.example.chronotrace.ingest;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class IngestResult {
    String segmentId;
    IngestStatus status;
    String pointId;
    String fingerprint;
    boolean cacheHit;
    String message;
}
