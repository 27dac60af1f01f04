package com.example.chronotrace.index;

import jakarta.persistence.*;

@Entity
@Table(name = "index_points", indexes = {
        @Index(name = "idx_point_segment", columnList = "segment_id")
})
public class IndexPointRecord {

    @Id
    private String id;

    @Column(name = "segment_id", nullable = false)
    private String segmentId;

    @Column(name = "video_id")
    private String videoId;

    @Column(name = "camera_id")
    private String cameraId;

    private String location;

    @Column(name = "start_offset")
    private double startOffset;

    @Column(name = "end_offset")
    private double endOffset;

    @Column(name = "segment_timestamp")
    private long timestamp;

    @Column(name = "has_faces")
    private boolean hasFaces;

    @Column(name = "has_vehicles")
    private boolean hasVehicles;

    @Column(name = "motion_detected")
    private boolean motionDetected;

    // compressed binary embedding blob (GZIPped float bytes)
    @Lob
    @Column(name = "vector_blob", columnDefinition = "BLOB", nullable = false)
    private byte[] vectorBlob;

    @Column(name = "fingerprint", length = 64)
    private String fingerprint;

    private long createdAt;

    public IndexPointRecord() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }
    public String getSegmentId() { return segmentId; }
    public void setSegmentId(String segmentId) { this.segmentId = segmentId; }
    public String getVideoId() { return videoId; }
    public void setVideoId(String videoId) { this.videoId = videoId; }
    public String getCameraId() { return cameraId; }
    public void setCameraId(String cameraId) { this.cameraId = cameraId; }
    public String getLocation() { return location; }
    public void setLocation(String location) { this.location = location; }
    public double getStartOffset() { return startOffset; }
    public void setStartOffset(double startOffset) { this.startOffset = startOffset; }
    public double getEndOffset() { return endOffset; }
    public void setEndOffset(double endOffset) { this.endOffset = endOffset; }
    public long getTimestamp() { return timestamp; }
    public void setTimestamp(long timestamp) { this.timestamp = timestamp; }
    public boolean isHasFaces() { return hasFaces; }
    public void setHasFaces(boolean hasFaces) { this.hasFaces = hasFaces; }
    public boolean isHasVehicles() { return hasVehicles; }
    public void setHasVehicles(boolean hasVehicles) { this.hasVehicles = hasVehicles; }
    public boolean isMotionDetected() { return motionDetected; }
    public void setMotionDetected(boolean motionDetected) { this.motionDetected = motionDetected; }
    public byte[] getVectorBlob() { return vectorBlob; }
    public void setVectorBlob(byte[] vectorBlob) { this.vectorBlob = vectorBlob; }
    public String getFingerprint() { return fingerprint; }
    public void setFingerprint(String fingerprint) { this.fingerprint = fingerprint; }
    public long getCreatedAt() { return createdAt; }
    public void setCreatedAt(long createdAt) { this.createdAt = createdAt; }
}
