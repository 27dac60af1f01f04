package com.example.chronotrace.ingest;

import com.example.chronotrace.embedding.EmbeddingPipeline;
import com.example.chronotrace.embedding.EmbeddingResult;
import com.example.chronotrace.error.ChronoTraceException;
import com.example.chronotrace.error.IndexCapacityException;
import com.example.chronotrace.index.IndexPoint;
import com.example.chronotrace.index.IndexPointStore;
import com.example.chronotrace.index.PointMetadata;
import com.example.chronotrace.index.VectorIndex;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Takes segments from the segmentation step to searchable index points.
 */
@Slf4j
@Service
public class IngestService {

    private final EmbeddingPipeline pipeline;
    private final VectorIndex index;
    private final IndexPointStore pointStore;
    private final SegmentCatalog catalog;
    private final IngestRetryQueue retryQueue;
    private final ExecutorService ingestExecutor;
    private final SegmentLocks locks = new SegmentLocks(64);

    public IngestService(EmbeddingPipeline pipeline, VectorIndex index, IndexPointStore pointStore,
                         SegmentCatalog catalog, IngestRetryQueue retryQueue,
                         @Qualifier("ingestExecutor") ExecutorService ingestExecutor) {
        this.pipeline = pipeline;
        this.index = index;
        this.pointStore = pointStore;
        this.catalog = catalog;
        this.retryQueue = retryQueue;
        this.ingestExecutor = ingestExecutor;
    }

    /**
     * Embeds the segment and makes it searchable. Re-indexing changed content replaces the old
     * point; unchanged content reports {@link IngestStatus#UNCHANGED}. Calls for the same segment
     * id are serialized around the catalog and index updates, so a segment never has more than
     * one live point.
     *
     * @throws ChronoTraceException when the embedding could not be produced; the catalog row is
     *                              marked failed and the segment id is carried on the exception
     */
    public IngestResult index(SegmentContent content) {
        Segment s = content.getSegment();
        ReentrantLock lock = locks.forSegment(s.getId());
        lock.lock();
        try {
            catalog.register(s, content.size());
        } finally {
            lock.unlock();
        }

        EmbeddingResult emb;
        try {
            emb = pipeline.embedSegment(content);
        } catch (ChronoTraceException e) {
            lock.lock();
            try {
                catalog.markFailed(s.getId(), e.getKind() + ": " + e.getMessage());
            } finally {
                lock.unlock();
            }
            throw e;
        }

        lock.lock();
        try {
            return apply(content, emb);
        } finally {
            lock.unlock();
        }
    }

    // caller holds the segment lock
    private IngestResult apply(SegmentContent content, EmbeddingResult emb) {
        Segment s = content.getSegment();
        SegmentRecord record = catalog.find(s.getId()).orElse(null);
        String previousPointId = record != null && record.getPointId() != null
                ? record.getPointId()
                : pointStore.pointIdForSegment(s.getId()).orElse(null);
        boolean wasIndexed = record != null && record.getStatus() == IngestStatus.INDEXED;

        String fingerprint = emb.getFingerprint();
        String pointId = pointIdFor(s.getId(), fingerprint);
        IndexPoint point = new IndexPoint(pointId, s.getId(), emb.getVector(), metadataOf(s));
        try {
            if (previousPointId != null && !previousPointId.equals(pointId)) {
                index.remove(previousPointId);
                pointStore.delete(previousPointId);
                log.info("Segment {} content changed, replaced point {}", s.getId(), previousPointId);
            }
            index.upsert(point);
        } catch (IndexCapacityException e) {
            return queueForRetry(content, emb, e);
        }
        pointStore.save(point, fingerprint);
        catalog.markIndexed(s.getId(), pointId, fingerprint);

        IngestStatus status = wasIndexed && pointId.equals(previousPointId) ? IngestStatus.UNCHANGED : IngestStatus.INDEXED;
        log.debug("Segment {} {} as point {}", s.getId(), status, pointId);
        return IngestResult.builder()
                .segmentId(s.getId())
                .status(status)
                .pointId(pointId)
                .fingerprint(fingerprint)
                .cacheHit(emb.isCacheHit())
                .build();
    }

    private IngestResult queueForRetry(SegmentContent content, EmbeddingResult emb, IndexCapacityException full) {
        String segmentId = content.getSegment().getId();
        try {
            retryQueue.enqueue(content);
        } catch (IndexCapacityException queueFull) {
            log.error("Index and retry queue both full, segment {} dropped: {}", segmentId, queueFull.getMessage());
            catalog.markFailed(segmentId, queueFull.getKind() + ": " + queueFull.getMessage());
            throw queueFull;
        }
        log.warn("Index full, segment {} queued for retry: {}", segmentId, full.getMessage());
        catalog.markQueued(segmentId, full.getMessage());
        return IngestResult.builder()
                .segmentId(segmentId)
                .status(IngestStatus.QUEUED_FOR_RETRY)
                .fingerprint(emb.getFingerprint())
                .cacheHit(emb.isCacheHit())
                .message(full.getMessage())
                .build();
    }

    /**
     * Removes a segment everywhere: index, persisted points, retry queue and catalog.
     *
     * @return false if the catalog never heard of the segment
     */
    public boolean delete(String segmentId) {
        ReentrantLock lock = locks.forSegment(segmentId);
        lock.lock();
        try {
            boolean known = catalog.find(segmentId).isPresent();
            for (String pointId : pointStore.pointIdsForSegment(segmentId)) {
                index.remove(pointId);
                pointStore.delete(pointId);
            }
            retryQueue.remove(segmentId);
            catalog.delete(segmentId);
            return known;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Deletes every segment of a video.
     *
     * @return number of segments removed; 0 when the video is unknown
     */
    public int deleteVideo(String videoId) {
        int removed = 0;
        for (SegmentRecord r : catalog.forVideo(videoId)) {
            if (delete(r.getId())) removed++;
        }
        log.info("Video {} deleted: {} segments removed from catalog and index", videoId, removed);
        return removed;
    }

    /**
     * Indexes a batch on the ingest pool. Results follow input order; a failed segment yields a
     * {@link IngestStatus#FAILED} result and does not stop the others.
     */
    public List<IngestResult> indexAll(List<SegmentContent> contents) {
        List<CompletableFuture<IngestResult>> futures = new ArrayList<>(contents.size());
        for (SegmentContent c : contents) {
            futures.add(CompletableFuture.supplyAsync(() -> index(c), ingestExecutor)
                    .exceptionally(ex -> failed(c.getSegment().getId(), ex)));
        }
        List<IngestResult> out = new ArrayList<>(futures.size());
        for (CompletableFuture<IngestResult> f : futures) {
            out.add(f.join());
        }
        long indexed = out.stream().filter(r -> r.getStatus() != IngestStatus.FAILED).count();
        log.info("Batch ingest finished: {}/{} segments ok", indexed, out.size());
        return out;
    }

    private static IngestResult failed(String segmentId, Throwable ex) {
        Throwable cause = ex instanceof CompletionException && ex.getCause() != null ? ex.getCause() : ex;
        log.warn("Segment {} failed to index: {}", segmentId, cause.getMessage());
        return IngestResult.builder()
                .segmentId(segmentId)
                .status(IngestStatus.FAILED)
                .message(cause.getMessage())
                .build();
    }

    public static String pointIdFor(String segmentId, String fingerprint) {
        return UUID.nameUUIDFromBytes((segmentId + ":" + fingerprint).getBytes(StandardCharsets.UTF_8)).toString();
    }

    static PointMetadata metadataOf(Segment s) {
        return PointMetadata.builder()
                .videoId(s.getVideoId())
                .cameraId(s.getCameraId())
                .location(s.getLocation())
                .startOffset(s.getStartOffset())
                .endOffset(s.getEndOffset())
                .timestamp(s.getTimestamp())
                .hasFaces(s.isHasFaces())
                .hasVehicles(s.isHasVehicles())
                .motionDetected(s.isMotionDetected())
                .build();
    }
}
