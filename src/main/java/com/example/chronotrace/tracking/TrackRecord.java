package com.example.chronotrace.tracking;

import jakarta.persistence.*;

/**
 * Closed track as written to the track store. The full observation and handoff history is kept
 * as JSON in {@code history}; the other columns serve the listing queries.
 */
@Entity
@Table(name = "tracks", indexes = {
        @Index(name = "idx_track_stream", columnList = "stream_id"),
        @Index(name = "idx_track_seen", columnList = "first_seen,last_seen")
})
public class TrackRecord {

    @Id
    private String id;

    @Column(name = "stream_id", nullable = false)
    private String streamId;

    // numeric part of the id, so a restarted stream keeps numbering after it
    private long sequence;

    @Column(name = "first_seen")
    private long firstSeen;

    @Column(name = "last_seen")
    private long lastSeen;

    @Column(name = "closed_at")
    private long closedAt;

    @Column(name = "continuity_confidence")
    private double continuityConfidence;

    @Column(name = "observation_count")
    private int observationCount;

    @Column(name = "handoff_count")
    private int handoffCount;

    // "|CAM-1|CAM-2|"
    @Column(length = 1000)
    private String cameras;

    @Lob
    @Column(nullable = false)
    private String history;

    public TrackRecord() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getStreamId() { return streamId; }
    public void setStreamId(String streamId) { this.streamId = streamId; }
    public long getSequence() { return sequence; }
    public void setSequence(long sequence) { this.sequence = sequence; }
    public long getFirstSeen() { return firstSeen; }
    public void setFirstSeen(long firstSeen) { this.firstSeen = firstSeen; }
    public long getLastSeen() { return lastSeen; }
    public void setLastSeen(long lastSeen) { this.lastSeen = lastSeen; }
    public long getClosedAt() { return closedAt; }
    public void setClosedAt(long closedAt) { this.closedAt = closedAt; }
    public double getContinuityConfidence() { return continuityConfidence; }
    public void setContinuityConfidence(double continuityConfidence) { this.continuityConfidence = continuityConfidence; }
    public int getObservationCount() { return observationCount; }
    public void setObservationCount(int observationCount) { this.observationCount = observationCount; }
    public int getHandoffCount() { return handoffCount; }
    public void setHandoffCount(int handoffCount) { this.handoffCount = handoffCount; }
    public String getCameras() { return cameras; }
    public void setCameras(String cameras) { this.cameras = cameras; }
    public String getHistory() { return history; }
    public void setHistory(String history) { this.history = history; }
}
