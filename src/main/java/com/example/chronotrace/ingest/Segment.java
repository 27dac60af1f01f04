package com.example.chronotrace.ingest;

import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.ToString;

import java.time.Instant;

/**
 * A short clip cut from a video by the external segmentation step. Immutable; offsets are kept
 * at millisecond precision.
 */
@Getter
@ToString
@EqualsAndHashCode
public final class Segment {

    private final String id;
    private final String videoId;
    private final Integer segmentIndex;
    private final double startOffset;
    private final double endOffset;
    private final String cameraId;
    private final String location;
    private final Instant timestamp;
    private final boolean hasFaces;
    private final boolean hasVehicles;
    private final boolean motionDetected;
    private final Integer faceCount;

    @Builder(toBuilder = true)
    private Segment(String id, String videoId, Integer segmentIndex, double startOffset, double endOffset,
                    String cameraId, String location, Instant timestamp, boolean hasFaces,
                    boolean hasVehicles, boolean motionDetected, Integer faceCount) {
        if (isBlank(id)) throw new IllegalArgumentException("segment id is required");
        if (isBlank(videoId)) throw new IllegalArgumentException("video id is required for segment " + id);
        if (isBlank(cameraId)) throw new IllegalArgumentException("camera id is required for segment " + id);
        if (timestamp == null) throw new IllegalArgumentException("timestamp is required for segment " + id);
        if (startOffset < 0 || endOffset < startOffset) {
            throw new IllegalArgumentException("invalid offsets [" + startOffset + ", " + endOffset + "] for segment " + id);
        }
        this.id = id;
        this.videoId = videoId;
        this.segmentIndex = segmentIndex;
        this.startOffset = roundOffset(startOffset);
        this.endOffset = roundOffset(endOffset);
        this.cameraId = cameraId;
        this.location = location;
        this.timestamp = timestamp;
        this.hasFaces = hasFaces;
        this.hasVehicles = hasVehicles;
        this.motionDetected = motionDetected;
        this.faceCount = faceCount;
    }

    public double getDuration() {
        return roundOffset(endOffset - startOffset);
    }

    static double roundOffset(double seconds) {
        return Math.round(seconds * 1000.0) / 1000.0;
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
