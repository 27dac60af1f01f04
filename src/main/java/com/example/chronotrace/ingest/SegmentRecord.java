package com.example.chronotrace.ingest;

import jakarta.persistence.*;

/**
 * Catalog row for a segment: its metadata, where it lives in the index and how ingest went.
 */
@Entity
@Table(name = "segments", indexes = {
        @Index(name = "idx_segment_video", columnList = "video_id"),
        @Index(name = "idx_segment_camera", columnList = "camera_id")
})
public class SegmentRecord {

    @Id
    private String id;

    @Column(name = "video_id", nullable = false)
    private String videoId;

    @Column(name = "segment_index")
    private Integer segmentIndex;

    @Column(name = "start_offset")
    private double startOffset;

    @Column(name = "end_offset")
    private double endOffset;

    private double duration;

    @Column(name = "camera_id", nullable = false)
    private String cameraId;

    private String location;

    @Column(name = "segment_timestamp")
    private long timestamp;

    @Column(name = "has_faces")
    private boolean hasFaces;

    @Column(name = "has_vehicles")
    private boolean hasVehicles;

    @Column(name = "motion_detected")
    private boolean motionDetected;

    @Column(name = "face_count")
    private Integer faceCount;

    @Column(name = "file_size")
    private Long fileSize;

    @Column(name = "fingerprint", length = 64)
    private String fingerprint;

    @Column(name = "point_id")
    private String pointId;

    @Column(name = "embedding_generated")
    private boolean embeddingGenerated;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", length = 32)
    private IngestStatus status;

    private int attempts;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    private long createdAt;

    private long updatedAt;

    public SegmentRecord() {}

    // getters/setters
    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getVideoId() { return videoId; }
    public void setVideoId(String videoId) { this.videoId = videoId; }
    public Integer getSegmentIndex() { return segmentIndex; }
    public void setSegmentIndex(Integer segmentIndex) { this.segmentIndex = segmentIndex; }
    public double getStartOffset() { return startOffset; }
    public void setStartOffset(double startOffset) { this.startOffset = startOffset; }
    public double getEndOffset() { return endOffset; }
    public void setEndOffset(double endOffset) { this.endOffset = endOffset; }
    public double getDuration() { return duration; }
    public void setDuration(double duration) { this.duration = duration; }
    public String getCameraId() { return cameraId; }
    public void setCameraId(String cameraId) { this.cameraId = cameraId; }
    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public long getTimestamp() { return timestamp; }
    public void setTimestamp(long timestamp) { this.timestamp = timestamp; }
    public boolean isHasFaces() { return hasFaces; }
    public void setHasFaces(boolean hasFaces) { this.hasFaces = hasFaces; }
    public boolean isHasVehicles() { return hasVehicles; }
    public void setHasVehicles(boolean hasVehicles) { this.hasVehicles = hasVehicles; }
    public boolean isMotionDetected() { return motionDetected; }
    public void setMotionDetected(boolean motionDetected) { this.motionDetected = motionDetected; }
    public Integer getFaceCount() { return faceCount; }
    public void setFaceCount(Integer faceCount) { this.faceCount = faceCount; }
    public Long getFileSize() { return fileSize; }
    public void setFileSize(Long fileSize) { this.fileSize = fileSize; }
    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public String getPointId() { return pointId; }
    public void setPointId(String pointId) { this.pointId = pointId; }
    public boolean isEmbeddingGenerated() { return embeddingGenerated; }
    public void setEmbeddingGenerated(boolean embeddingGenerated) { this.embeddingGenerated = embeddingGenerated; }
    public IngestStatus getStatus() { return status; }
    public void setStatus(IngestStatus status) { this.status = status; }
    public int getAttempts() { return attempts; }
    public void setAttempts(int attempts) { this.attempts = attempts; }
    public String getLastError() { return lastError; }
    public void setLastError(String lastError) { this.lastError = lastError; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
    public long getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(long updatedAt) { this.updatedAt = updatedAt; }
}
