package com.example.chronotrace.tracking;

import com.example.chronotrace.embedding.EmbeddingVector;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable track owned by one {@link TrackCorrelator}. Once closed it no longer changes.
 */
final class Track {

    private final String id;
    private final String streamId;
    private final List<TrackObservation> observations = new ArrayList<>();
    private final List<CameraHandoff> handoffs = new ArrayList<>();
    private EmbeddingVector latestDescriptor;
    private TrackState state = TrackState.OPEN;
    private Instant closedAt;
    private double similaritySum;
    private int matches;
    private boolean persisted;

    Track(String id, String streamId, Detection first) {
        this.id = id;
        this.streamId = streamId;
        this.observations.add(TrackObservation.of(first));
        this.latestDescriptor = first.getDescriptor();
    }

    void extend(Detection d, double similarity) {
        if (state == TrackState.CLOSED) throw new IllegalStateException("track " + id + " is closed");
        TrackObservation last = latest();
        if (!last.getCameraId().equals(d.getCameraId())) {
            double gap = (d.getTimestamp().toEpochMilli() - last.getTimestamp().toEpochMilli()) / 1000.0;
            handoffs.add(new CameraHandoff(last.getCameraId(), d.getCameraId(), d.getTimestamp(), gap, similarity));
        }
        observations.add(TrackObservation.of(d));
        latestDescriptor = d.getDescriptor();
        similaritySum += similarity;
        matches++;
    }

    void close(Instant at) {
        if (state == TrackState.CLOSED) return;
        state = TrackState.CLOSED;
        closedAt = at;
    }

    String getId() {
        return id;
    }

    boolean isOpen() {
        return state == TrackState.OPEN;
    }

    Instant getClosedAt() {
        return closedAt;
    }

    boolean isPersisted() {
        return persisted;
    }

    void markPersisted() {
        persisted = true;
    }

    TrackObservation latest() {
        return observations.get(observations.size() - 1);
    }

    EmbeddingVector getLatestDescriptor() {
        return latestDescriptor;
    }

    double continuity() {
        return matches == 0 ? 1.0 : similaritySum / matches;
    }

    TrackSnapshot snapshot() {
        return TrackSnapshot.builder()
                .id(id)
                .streamId(streamId)
                .state(state)
                .continuityConfidence(continuity())
                .observations(List.copyOf(observations))
                .handoffs(List.copyOf(handoffs))
                .closedAt(closedAt)
                .build();
    }
}
