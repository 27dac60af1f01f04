package com.example.chronotrace.tracking;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * An object the external detector reports as left in place, with the track that brought it.
 * Present from {@code firstSeen} until {@code lastSeen}.
 */
@Value
@Builder(toBuilder = true)
public class StationaryObject {
    String id;
    String cameraId;
    String location;
    Position position;
    String ownerTrackId;
    Instant firstSeen;
    Instant lastSeen;

    public void validate() {
        if (id == null || id.isBlank()) throw new IllegalArgumentException("object id is required");
        if (cameraId == null || cameraId.isBlank()) throw new IllegalArgumentException("object camera id is required");
        if (position == null) throw new IllegalArgumentException("object position is required");
        if (firstSeen == null) throw new IllegalArgumentException("object firstSeen is required");
        if (lastSeen != null && lastSeen.isBefore(firstSeen)) {
            throw new IllegalArgumentException("object " + id + " lastSeen precedes firstSeen");
        }
    }

    public Instant presentUntil(Instant now) {
        return lastSeen == null || lastSeen.isAfter(now) ? now : lastSeen;
    }

    public String locationKey() {
        return location == null || location.isBlank() ? cameraId : location;
    }
}
