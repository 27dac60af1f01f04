package com.example.chronotrace.tracking;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Read-only copy of a track, handed to the anomaly engine and the REST layer.
 */
@Value
@Builder
public class TrackSnapshot {
    String id;
    String streamId;
    TrackState state;
    double continuityConfidence;
    List<TrackObservation> observations;
    List<CameraHandoff> handoffs;
    Instant closedAt;

    public Instant getFirstSeen() {
        return observations.get(0).getTimestamp();
    }

    public Instant getLastSeen() {
        return observations.get(observations.size() - 1).getTimestamp();
    }

    public TrackObservation getLatest() {
        return observations.get(observations.size() - 1);
    }

    public boolean isOpen() {
        return state == TrackState.OPEN;
    }

    public boolean seenOn(String cameraId) {
        return observations.stream().anyMatch(o -> o.getCameraId().equals(cameraId));
    }

    public boolean overlaps(Instant from, Instant to) {
        return (from == null || !getLastSeen().isBefore(from)) && (to == null || !getFirstSeen().isAfter(to));
    }
}
