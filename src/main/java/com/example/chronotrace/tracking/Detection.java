package com.example.chronotrace.tracking;

import com.example.chronotrace.embedding.EmbeddingVector;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * One entity sighting from the external detector: where, when, and what it looked like.
 */
@Value
@Builder
public class Detection {
    String cameraId;
    String location;
    String segmentId;
    Instant timestamp;
    Position position;
    EmbeddingVector descriptor;

    public void validate() {
        if (cameraId == null || cameraId.isBlank()) throw new IllegalArgumentException("detection camera id is required");
        if (timestamp == null) throw new IllegalArgumentException("detection timestamp is required");
        if (position == null) throw new IllegalArgumentException("detection position is required");
        if (descriptor == null || descriptor.dimension() == 0) {
            throw new IllegalArgumentException("detection appearance descriptor is required");
        }
    }

    /** Location when known, otherwise the camera id. */
    public String locationKey() {
        return location == null || location.isBlank() ? cameraId : location;
    }
}
