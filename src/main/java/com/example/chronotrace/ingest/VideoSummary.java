package com.example.chronotrace.ingest;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * A video as seen through its catalogued segments. {@code segments} is empty in list views.
 */
@Value
@Builder
public class VideoSummary {
    String videoId;
    String cameraId;
    String location;
    int segmentCount;
    int indexedCount;
    int queuedCount;
    int failedCount;
    IngestStatus status;
    Instant firstSegmentAt;
    Instant lastSegmentAt;
    List<SegmentRecord> segments;

    /**
     * Worst state of any segment: failed, then queued, then pending, otherwise indexed.
     */
    static IngestStatus overall(List<SegmentRecord> segments) {
        boolean pending = false;
        boolean queued = false;
        for (SegmentRecord r : segments) {
            if (r.getStatus() == IngestStatus.FAILED) return IngestStatus.FAILED;
            if (r.getStatus() == IngestStatus.QUEUED_FOR_RETRY) queued = true;
            if (r.getStatus() == IngestStatus.PENDING) pending = true;
        }
        if (queued) return IngestStatus.QUEUED_FOR_RETRY;
        return pending ? IngestStatus.PENDING : IngestStatus.INDEXED;
    }
}
