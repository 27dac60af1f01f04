package com.example.chronotrace.tracking;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Durable copy of closed tracks. Streams write a track here once it closes and later evict it
 * from memory; listings read evicted tracks back from this store.
 */
@Slf4j
@Component
public class TrackStore {

    private final TrackRepository repo;
    private final ObjectMapper objectMapper;

    public TrackStore(TrackRepository repo, ObjectMapper objectMapper) {
        this.repo = repo;
        this.objectMapper = objectMapper;
    }

    @Transactional
    public void save(TrackSnapshot t) {
        if (t.isOpen()) throw new IllegalArgumentException("track " + t.getId() + " is still open");
        TrackRecord r = repo.findById(t.getId()).orElseGet(TrackRecord::new);
        r.setId(t.getId());
        r.setStreamId(t.getStreamId());
        r.setSequence(TrackCorrelator.sequenceOf(t.getId()));
        r.setFirstSeen(t.getFirstSeen().toEpochMilli());
        r.setLastSeen(t.getLastSeen().toEpochMilli());
        r.setClosedAt(t.getClosedAt() == null ? t.getLastSeen().toEpochMilli() : t.getClosedAt().toEpochMilli());
        r.setContinuityConfidence(t.getContinuityConfidence());
        r.setObservationCount(t.getObservations().size());
        r.setHandoffCount(t.getHandoffs().size());
        r.setCameras(cameraKey(t));
        r.setHistory(writeHistory(t));
        repo.save(r);
    }

    /** Highest track sequence stored for the stream, 0 when it has none. */
    public long lastSequence(String streamId) {
        return repo.maxSequence(streamId);
    }

    public Optional<TrackSnapshot> find(String trackId) {
        return repo.findById(trackId).flatMap(this::toSnapshot);
    }

    /**
     * Stored tracks overlapping {@code [from, to]}, optionally only those seen on a camera.
     */
    public List<TrackSnapshot> find(String cameraId, Instant from, Instant to) {
        long lo = from == null ? Long.MIN_VALUE : from.toEpochMilli();
        long hi = to == null ? Long.MAX_VALUE : to.toEpochMilli();
        List<TrackSnapshot> out = new ArrayList<>();
        for (TrackRecord r : repo.findByLastSeenGreaterThanEqualAndFirstSeenLessThanEqualOrderByFirstSeenAsc(lo, hi)) {
            if (cameraId != null && !r.getCameras().contains("|" + cameraId + "|")) continue;
            toSnapshot(r).ifPresent(out::add);
        }
        return out;
    }

    private static String cameraKey(TrackSnapshot t) {
        Set<String> cameras = new LinkedHashSet<>();
        for (TrackObservation o : t.getObservations()) cameras.add(o.getCameraId());
        return "|" + String.join("|", cameras) + "|";
    }

    private String writeHistory(TrackSnapshot t) {
        History h = new History();
        for (TrackObservation o : t.getObservations()) {
            ObservationRow row = new ObservationRow();
            row.setSegmentId(o.getSegmentId());
            row.setCameraId(o.getCameraId());
            row.setLocation(o.getLocation());
            row.setTimestamp(o.getTimestamp().toEpochMilli());
            row.setX(o.getPosition().getX());
            row.setY(o.getPosition().getY());
            h.getObservations().add(row);
        }
        for (CameraHandoff c : t.getHandoffs()) {
            HandoffRow row = new HandoffRow();
            row.setFromCamera(c.getFromCamera());
            row.setToCamera(c.getToCamera());
            row.setAt(c.getAt().toEpochMilli());
            row.setGapSeconds(c.getGapSeconds());
            row.setSimilarity(c.getSimilarity());
            h.getHandoffs().add(row);
        }
        try {
            return objectMapper.writeValueAsString(h);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot serialize history of track " + t.getId(), e);
        }
    }

    private Optional<TrackSnapshot> toSnapshot(TrackRecord r) {
        History h;
        try {
            h = objectMapper.readValue(r.getHistory(), History.class);
        } catch (JsonProcessingException e) {
            log.warn("Skipping stored track {} with unreadable history: {}", r.getId(), e.getOriginalMessage());
            return Optional.empty();
        }
        if (h.getObservations().isEmpty()) {
            log.warn("Skipping stored track {} without observations", r.getId());
            return Optional.empty();
        }
        List<TrackObservation> observations = new ArrayList<>(h.getObservations().size());
        for (ObservationRow o : h.getObservations()) {
            observations.add(new TrackObservation(o.getSegmentId(), o.getCameraId(), o.getLocation(),
                    Instant.ofEpochMilli(o.getTimestamp()), Position.of(o.getX(), o.getY())));
        }
        List<CameraHandoff> handoffs = new ArrayList<>(h.getHandoffs().size());
        for (HandoffRow c : h.getHandoffs()) {
            handoffs.add(new CameraHandoff(c.getFromCamera(), c.getToCamera(), Instant.ofEpochMilli(c.getAt()),
                    c.getGapSeconds(), c.getSimilarity()));
        }
        return Optional.of(TrackSnapshot.builder()
                .id(r.getId())
                .streamId(r.getStreamId())
                .state(TrackState.CLOSED)
                .continuityConfidence(r.getContinuityConfidence())
                .observations(List.copyOf(observations))
                .handoffs(List.copyOf(handoffs))
                .closedAt(Instant.ofEpochMilli(r.getClosedAt()))
                .build());
    }

    @Data
    static class History {
        private List<ObservationRow> observations = new ArrayList<>();
        private List<HandoffRow> handoffs = new ArrayList<>();
    }

    @Data
    static class ObservationRow {
        private String segmentId;
        private String cameraId;
        private String location;
        private long timestamp;
        private double x;
        private double y;
    }

    @Data
    static class HandoffRow {
        private String fromCamera;
        private String toCamera;
        private long at;
        private double gapSeconds;
        private double similarity;
    }
}
