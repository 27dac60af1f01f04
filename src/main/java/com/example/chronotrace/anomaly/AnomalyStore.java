package com.example.chronotrace.anomaly;

import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.UUID;

/**
 * Append-only side of the anomaly table, used by the engines.
 */
@Component
public class AnomalyStore {

    private final AnomalyRepository repo;

    public AnomalyStore(AnomalyRepository repo) {
        this.repo = repo;
    }

    /**
     * Inserts the anomaly unless one with the same evidence already exists for the stream.
     */
    @Transactional
    public Optional<AnomalyRecord> append(String streamId, DetectedAnomaly a) {
        if (repo.existsByStreamIdAndEvidenceKey(streamId, a.getEvidenceKey())) {
            return Optional.empty();
        }
        long now = System.currentTimeMillis();
        AnomalyRecord r = new AnomalyRecord();
        r.setId(UUID.randomUUID().toString());
        r.setStreamId(streamId);
        r.setType(a.getType());
        r.setConfidence(a.getConfidence());
        r.setSeverity(a.getSeverity());
        r.setTrackId(a.getTrackId());
        r.setSegmentId(a.getSegmentId());
        r.setCameraId(a.getCameraId());
        r.setLocation(a.getLocation());
        r.setDetectedAt(a.getDetectedAt().toEpochMilli());
        r.setDescription(a.getDescription());
        r.setEvidenceKey(a.getEvidenceKey());
        r.setStatus(AnomalyStatus.NEW);
        r.setCreatedAt(now);
        r.setStatusUpdatedAt(now);
        return Optional.of(repo.save(r));
    }
}
