package com.example.chronotrace.index;

import com.example.chronotrace.embedding.VectorCodec;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Durable copy of the index. The in-memory index is rebuilt from it at startup, and it holds
 * the segment to point mapping.
 */
@Slf4j
@Component
public class IndexPointStore {

    private final IndexPointRepository repo;
    private final int pageSize;

    public IndexPointStore(IndexPointRepository repo, @Value("${chronotrace.index.rebuild-page-size:1000}") int pageSize) {
        this.repo = repo;
        this.pageSize = pageSize;
    }

    @Transactional
    public void save(IndexPoint point, String fingerprint) {
        PointMetadata m = point.getMetadata();
        IndexPointRecord r = repo.findById(point.getId()).orElseGet(IndexPointRecord::new);
        r.setId(point.getId());
        r.setSegmentId(point.getSegmentId());
        r.setVideoId(m.getVideoId());
        r.setCameraId(m.getCameraId());
        r.setLocation(m.getLocation());
        r.setStartOffset(m.getStartOffset());
        r.setEndOffset(m.getEndOffset());
        r.setTimestamp(m.getTimestamp().toEpochMilli());
        r.setHasFaces(m.isHasFaces());
        r.setHasVehicles(m.isHasVehicles());
        r.setMotionDetected(m.isMotionDetected());
        r.setVectorBlob(VectorCodec.encode(point.getVector()));
        r.setFingerprint(fingerprint);
        r.setCreatedAt(System.currentTimeMillis());
        repo.save(r);
    }

    @Transactional
    public void delete(String pointId) {
        repo.deleteById(pointId);
    }

    public Optional<String> pointIdForSegment(String segmentId) {
        return repo.findBySegmentId(segmentId).stream().map(IndexPointRecord::getId).findFirst();
    }

    public List<String> pointIdsForSegment(String segmentId) {
        return repo.findBySegmentId(segmentId).stream().map(IndexPointRecord::getId).collect(Collectors.toList());
    }

    /**
     * Paged scan of every persisted point; malformed rows are skipped.
     */
    public List<IndexPoint> loadAll() {
        List<IndexPoint> out = new ArrayList<>();
        int page = 0;
        while (true) {
            Page<IndexPointRecord> p = repo.findAll(PageRequest.of(page, pageSize, Sort.by("id")));
            if (!p.hasContent()) break;
            for (IndexPointRecord r : p.getContent()) {
                try {
                    out.add(toPoint(r));
                } catch (RuntimeException ex) {
                    log.warn("Skipping malformed index point {}: {}", r.getId(), ex.getMessage());
                }
            }
            if (!p.hasNext()) break;
            page++;
        }
        return out;
    }

    static IndexPoint toPoint(IndexPointRecord r) {
        PointMetadata metadata = PointMetadata.builder()
                .videoId(r.getVideoId())
                .cameraId(r.getCameraId())
                .location(r.getLocation())
                .startOffset(r.getStartOffset())
                .endOffset(r.getEndOffset())
                .timestamp(Instant.ofEpochMilli(r.getTimestamp()))
                .hasFaces(r.isHasFaces())
                .hasVehicles(r.isHasVehicles())
                .motionDetected(r.isMotionDetected())
                .build();
        return new IndexPoint(r.getId(), r.getSegmentId(), VectorCodec.decode(r.getVectorBlob()), metadata);
    }
}
