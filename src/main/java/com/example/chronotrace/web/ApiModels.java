package com.example.chronotrace.web;

import com.example.chronotrace.anomaly.AnomalyRecord;
import com.example.chronotrace.anomaly.AnomalyStatus;
import com.example.chronotrace.anomaly.AnomalyType;
import com.example.chronotrace.anomaly.Severity;
import com.example.chronotrace.embedding.EmbeddingVector;
import com.example.chronotrace.index.SearchFilters;
import com.example.chronotrace.ingest.Segment;
import com.example.chronotrace.ingest.VideoSummary;
import com.example.chronotrace.search.SearchRequest;
import com.example.chronotrace.tracking.Detection;
import com.example.chronotrace.tracking.Position;
import com.example.chronotrace.tracking.StationaryObject;
import lombok.Data;
import org.springframework.data.domain.Page;

import java.time.Instant;
import java.util.List;

/**
 * Request and response bodies of the REST surface, and their mapping to domain types.
 */
public class ApiModels {

    @Data
    public static class SegmentRequest {
        private String id;
        private String videoId;
        private Integer segmentIndex;
        private double startOffset;
        private double endOffset;
        private String cameraId;
        private String location;
        private Instant timestamp;
        private boolean hasFaces;
        private boolean hasVehicles;
        private boolean motionDetected;
        private Integer faceCount;
        // exactly one of these
        private String contentBase64;
        private String contentPath;

        public Segment toSegment() {
            return Segment.builder()
                    .id(id)
                    .videoId(videoId)
                    .segmentIndex(segmentIndex)
                    .startOffset(startOffset)
                    .endOffset(endOffset)
                    .cameraId(cameraId)
                    .location(location)
                    .timestamp(timestamp)
                    .hasFaces(hasFaces)
                    .hasVehicles(hasVehicles)
                    .motionDetected(motionDetected)
                    .faceCount(faceCount)
                    .build();
        }
    }

    @Data
    public static class SegmentBatchRequest {
        private List<SegmentRequest> segments;
    }

    @Data
    public static class Filters {
        private String cameraId;
        private String location;
        private String videoId;
        private Instant from;
        private Instant to;
        private Boolean hasFaces;
        private Boolean hasVehicles;
        private Boolean motionDetected;

        public SearchFilters toSearchFilters() {
            SearchFilters.Builder b = SearchFilters.builder();
            if (cameraId != null) b.cameraId(cameraId);
            if (location != null) b.location(location);
            if (videoId != null) b.videoId(videoId);
            if (from != null || to != null) b.timeRange(from, to);
            if (hasFaces != null) b.hasFaces(hasFaces);
            if (hasVehicles != null) b.hasVehicles(hasVehicles);
            if (motionDetected != null) b.motionDetected(motionDetected);
            return b.build();
        }
    }

    @Data
    public static class SearchBody {
        private String query;
        private Filters filters;
        private Integer topK;
        private Double scoreThreshold;

        public SearchRequest toRequest() {
            return SearchRequest.builder()
                    .query(query)
                    .filters(filters == null ? SearchFilters.none() : filters.toSearchFilters())
                    .topK(topK)
                    .scoreThreshold(scoreThreshold)
                    .build();
        }
    }

    @Data
    public static class DetectionBody {
        private String cameraId;
        private String location;
        private String segmentId;
        private Instant timestamp;
        private double x;
        private double y;
        private float[] descriptor;

        public Detection toDetection() {
            return Detection.builder()
                    .cameraId(cameraId)
                    .location(location)
                    .segmentId(segmentId)
                    .timestamp(timestamp)
                    .position(Position.of(x, y))
                    .descriptor(descriptor == null ? null : EmbeddingVector.of(descriptor))
                    .build();
        }
    }

    @Data
    public static class DetectionsRequest {
        private List<DetectionBody> detections;
    }

    @Data
    public static class StationaryObjectBody {
        private String id;
        private String cameraId;
        private String location;
        private double x;
        private double y;
        private String ownerTrackId;
        private Instant firstSeen;
        private Instant lastSeen;

        public StationaryObject toObject() {
            return StationaryObject.builder()
                    .id(id)
                    .cameraId(cameraId)
                    .location(location)
                    .position(Position.of(x, y))
                    .ownerTrackId(ownerTrackId)
                    .firstSeen(firstSeen)
                    .lastSeen(lastSeen)
                    .build();
        }
    }

    @Data
    public static class AnalyzeRequest {
        private Instant at;
        private List<String> segmentIds;
    }

    @Data
    public static class StatusUpdate {
        private AnomalyStatus status;
    }

    @Data
    public static class AnomalyView {
        private String id;
        private String streamId;
        private AnomalyType type;
        private double confidence;
        private Severity severity;
        private String trackId;
        private String segmentId;
        private String cameraId;
        private String location;
        private Instant detectedAt;
        private String description;
        private AnomalyStatus status;
        private Instant createdAt;

        public static AnomalyView of(AnomalyRecord r) {
            AnomalyView v = new AnomalyView();
            v.setId(r.getId());
            v.setStreamId(r.getStreamId());
            v.setType(r.getType());
            v.setConfidence(r.getConfidence());
            v.setSeverity(r.getSeverity());
            v.setTrackId(r.getTrackId());
            v.setSegmentId(r.getSegmentId());
            v.setCameraId(r.getCameraId());
            v.setLocation(r.getLocation());
            v.setDetectedAt(Instant.ofEpochMilli(r.getDetectedAt()));
            v.setDescription(r.getDescription());
            v.setStatus(r.getStatus());
            v.setCreatedAt(Instant.ofEpochMilli(r.getCreatedAt()));
            return v;
        }
    }

    @Data
    public static class VideoPage {
        private List<VideoSummary> videos;
        private long total;
        private int page;
        private int pageSize;

        public static VideoPage of(Page<VideoSummary> p, int page, int pageSize) {
            VideoPage v = new VideoPage();
            v.setVideos(p.getContent());
            v.setTotal(p.getTotalElements());
            v.setPage(page);
            v.setPageSize(pageSize);
            return v;
        }
    }
}
