package com.example.chronotrace.anomaly;

import jakarta.persistence.*;

/**
 * Stored anomaly. Rows are only ever inserted by the engine; operators change {@code status}.
 */
@Entity
@Table(name = "anomalies",
        uniqueConstraints = @UniqueConstraint(name = "uk_anomaly_evidence", columnNames = {"stream_id", "evidence_key"}),
        indexes = {
                @Index(name = "idx_anomaly_detected_at", columnList = "detected_at"),
                @Index(name = "idx_anomaly_status", columnList = "status")
        })
public class AnomalyRecord {

    @Id
    private String id;

    @Column(name = "stream_id", nullable = false)
    private String streamId;

    @Enumerated(EnumType.STRING)
    @Column(name = "anomaly_type", nullable = false, length = 32)
    private AnomalyType type;

    private double confidence;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private Severity severity;

    @Column(name = "track_id")
    private String trackId;

    @Column(name = "segment_id")
    private String segmentId;

    @Column(name = "camera_id")
    private String cameraId;

    private String location;

    @Column(name = "detected_at")
    private long detectedAt;

    @Column(length = 1000)
    private String description;

    @Column(name = "evidence_key", nullable = false)
    private String evidenceKey;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 16)
    private AnomalyStatus status;

    private long createdAt;

    private long statusUpdatedAt;

    public AnomalyRecord() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getStreamId() { return streamId; }
    public void setStreamId(String streamId) { this.streamId = streamId; }
    public AnomalyType getType() { return type; }
    public void setType(AnomalyType type) { this.type = type; }
    public double getConfidence() { return confidence; }
    public void setConfidence(double confidence) { this.confidence = confidence; }
    public Severity getSeverity() { return severity; }
    public void setSeverity(Severity severity) { this.severity = severity; }
    public String getTrackId() { return trackId; }
    public void setTrackId(String trackId) { this.trackId = trackId; }
    public String getSegmentId() { return segmentId; }
    public void setSegmentId(String segmentId) { this.segmentId = segmentId; }
    public String getCameraId() { return cameraId; }
    public void setCameraId(String cameraId) { this.cameraId = cameraId; }
    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public long getDetectedAt() { return detectedAt; }
    public void setDetectedAt(long detectedAt) { this.detectedAt = detectedAt; }
    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }
    public String getEvidenceKey() { return evidenceKey; }
    public void setEvidenceKey(String evidenceKey) { this.evidenceKey = evidenceKey; }
    public AnomalyStatus getStatus() { return status; }
    public void setStatus(AnomalyStatus status) { this.status = status; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public long getStatusUpdatedAt() { return statusUpdatedAt; }
    public void setStatusUpdatedAt(long statusUpdatedAt) { this.statusUpdatedAt = statusUpdatedAt; }
}
