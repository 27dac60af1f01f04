package com.example.chronotrace.ingest;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Store of full segment detail, consulted to enrich search hits and to resolve the segments a
 * tracking stream refers to.
 */
@Service
public class SegmentCatalog {

    private static final int MAX_ERROR_LENGTH = 2000;
    private static final int MAX_PAGE_SIZE = 100;

    private final SegmentRepository repo;

    public SegmentCatalog(SegmentRepository repo) {
        this.repo = repo;
    }

    /**
     * Creates or refreshes the catalog row and counts an ingest attempt.
     */
    @Transactional
    public SegmentRecord register(Segment s, long fileSize) {
        long now = System.currentTimeMillis();
        SegmentRecord r = repo.findById(s.getId()).orElse(null);
        if (r == null) {
            r = new SegmentRecord();
            r.setId(s.getId());
            r.setCreatedAt(now);
            r.setStatus(IngestStatus.PENDING);
        }
        r.setVideoId(s.getVideoId());
        r.setSegmentIndex(s.getSegmentIndex());
        r.setStartOffset(s.getStartOffset());
        r.setEndOffset(s.getEndOffset());
        r.setDuration(s.getDuration());
        r.setCameraId(s.getCameraId());
        r.setLocation(s.getLocation());
        r.setTimestamp(s.getTimestamp().toEpochMilli());
        r.setHasFaces(s.isHasFaces());
        r.setHasVehicles(s.isHasVehicles());
        r.setMotionDetected(s.isMotionDetected());
        r.setFaceCount(s.getFaceCount());
        r.setFileSize(fileSize);
        r.setAttempts(r.getAttempts() + 1);
        r.setUpdatedAt(now);
        return repo.save(r);
    }

    @Transactional
    public void markIndexed(String segmentId, String pointId, String fingerprint) {
        repo.findById(segmentId).ifPresent(r -> {
            r.setPointId(pointId);
            r.setFingerprint(fingerprint);
            r.setEmbeddingGenerated(true);
            r.setStatus(IngestStatus.INDEXED);
            r.setLastError(null);
            r.setUpdatedAt(System.currentTimeMillis());
            repo.save(r);
        });
    }

    @Transactional
    public void markQueued(String segmentId, String reason) {
        update(segmentId, IngestStatus.QUEUED_FOR_RETRY, reason);
    }

    @Transactional
    public void markFailed(String segmentId, String reason) {
        update(segmentId, IngestStatus.FAILED, reason);
    }

    private void update(String segmentId, IngestStatus status, String reason) {
        repo.findById(segmentId).ifPresent(r -> {
            r.setStatus(status);
            r.setLastError(reason != null && reason.length() > MAX_ERROR_LENGTH ? reason.substring(0, MAX_ERROR_LENGTH) : reason);
            r.setUpdatedAt(System.currentTimeMillis());
            repo.save(r);
        });
    }

    public Optional<SegmentRecord> find(String segmentId) {
        return repo.findById(segmentId);
    }

    public Map<String, SegmentRecord> findAll(Collection<String> segmentIds) {
        return repo.findAllById(segmentIds).stream()
                .collect(Collectors.toMap(SegmentRecord::getId, Function.identity()));
    }

    public List<SegmentRecord> forVideo(String videoId) {
        return repo.findByVideoIdOrderByStartOffsetAsc(videoId);
    }

    @Transactional
    public void delete(String segmentId) {
        repo.findById(segmentId).ifPresent(repo::delete);
    }

    /**
     * One page of videos ordered by id. With a status, only videos having at least one segment
     * in that status are listed.
     *
     * @param page 1-based page number
     */
    public Page<VideoSummary> listVideos(int page, int pageSize, IngestStatus status) {
        if (page < 1) throw new IllegalArgumentException("page must be at least 1");
        if (pageSize < 1 || pageSize > MAX_PAGE_SIZE) {
            throw new IllegalArgumentException("pageSize must be between 1 and " + MAX_PAGE_SIZE);
        }
        Pageable pageable = PageRequest.of(page - 1, pageSize);
        Page<String> ids = status == null ? repo.findVideoIds(pageable) : repo.findVideoIdsWithStatus(status, pageable);
        return ids.map(id -> summarize(id, forVideo(id), false));
    }

    public Optional<VideoSummary> video(String videoId) {
        List<SegmentRecord> segments = forVideo(videoId);
        return segments.isEmpty() ? Optional.empty() : Optional.of(summarize(videoId, segments, true));
    }

    private static VideoSummary summarize(String videoId, List<SegmentRecord> segments, boolean withSegments) {
        int indexed = 0;
        int queued = 0;
        int failed = 0;
        long first = Long.MAX_VALUE;
        long last = Long.MIN_VALUE;
        for (SegmentRecord r : segments) {
            if (r.getStatus() == IngestStatus.INDEXED) indexed++;
            else if (r.getStatus() == IngestStatus.QUEUED_FOR_RETRY) queued++;
            else if (r.getStatus() == IngestStatus.FAILED) failed++;
            first = Math.min(first, r.getTimestamp());
            last = Math.max(last, r.getTimestamp());
        }
        SegmentRecord head = segments.get(0);
        return VideoSummary.builder()
                .videoId(videoId)
                .cameraId(head.getCameraId())
                .location(head.getLocation())
                .segmentCount(segments.size())
                .indexedCount(indexed)
                .queuedCount(queued)
                .failedCount(failed)
                .status(VideoSummary.overall(segments))
                .firstSegmentAt(Instant.ofEpochMilli(first))
                .lastSegmentAt(Instant.ofEpochMilli(last))
                .segments(withSegments ? List.copyOf(segments) : List.of())
                .build();
    }

    public static Segment toSegment(SegmentRecord r) {
        return Segment.builder()
                .id(r.getId())
                .videoId(r.getVideoId())
                .segmentIndex(r.getSegmentIndex())
                .startOffset(r.getStartOffset())
                .endOffset(r.getEndOffset())
                .cameraId(r.getCameraId())
                .location(r.getLocation())
                .timestamp(Instant.ofEpochMilli(r.getTimestamp()))
                .hasFaces(r.isHasFaces())
                .hasVehicles(r.isHasVehicles())
                .motionDetected(r.isMotionDetected())
                .faceCount(r.getFaceCount())
                .build();
    }
}
