package com.example.chronotrace.tracking;

import com.example.chronotrace.anomaly.AnomalyEngineFactory;
import com.example.chronotrace.anomaly.AnomalyRecord;
import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.ingest.Segment;
import com.example.chronotrace.ingest.SegmentCatalog;
import com.example.chronotrace.ingest.SegmentRecord;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.stream.Collectors;

/**
 * Registry of analysis streams, created on first use.
 */
@Slf4j
@Service
public class TrackingService {

    private final ConcurrentMap<String, AnalysisStream> streams = new ConcurrentHashMap<>();
    private final AnomalyEngineFactory engineFactory;
    private final SegmentCatalog catalog;
    private final TrackStore trackStore;
    private final ChronoTraceProperties.TrackingConfig config;

    public TrackingService(AnomalyEngineFactory engineFactory, SegmentCatalog catalog, TrackStore trackStore,
                           ChronoTraceProperties properties) {
        this.engineFactory = engineFactory;
        this.catalog = catalog;
        this.trackStore = trackStore;
        this.config = properties.getTracking();
    }

    public AnalysisStream stream(String streamId) {
        if (streamId == null || streamId.isBlank()) throw new IllegalArgumentException("stream id is required");
        return streams.computeIfAbsent(streamId, id -> {
            long lastSequence = trackStore.lastSequence(id);
            log.info("Opening analysis stream {} (track numbering continues after {})", id, lastSequence);
            return new AnalysisStream(id, new TrackCorrelator(id, config, lastSequence), engineFactory.create(id),
                    trackStore, config.getRetention());
        });
    }

    public SubmitResult submitDetections(String streamId, List<Detection> detections) {
        SubmitResult r = stream(streamId).submit(detections);
        if (r.getRejectedLate() > 0) {
            log.warn("Stream {}: {} late detections rejected", streamId, r.getRejectedLate());
        }
        return r;
    }

    public void registerObject(String streamId, StationaryObject object) {
        stream(streamId).register(object);
    }

    public List<AnomalyRecord> analyze(String streamId, Instant at, Collection<String> extraSegmentIds) {
        AnalysisStream s = stream(streamId);
        if (extraSegmentIds != null && !extraSegmentIds.isEmpty()) {
            s.attachSegments(extraSegmentIds);
        }
        List<AnomalyRecord> found = s.analyze(at == null ? Instant.now() : at, this::resolveSegments);
        log.debug("Stream {} analyzed: {} new anomalies", streamId, found.size());
        return found;
    }

    private List<Segment> resolveSegments(Collection<String> ids) {
        List<Segment> out = new ArrayList<>();
        for (SegmentRecord r : catalog.findAll(ids).values()) {
            out.add(SegmentCatalog.toSegment(r));
        }
        out.sort(Comparator.comparing(Segment::getTimestamp).thenComparing(Segment::getId));
        return out;
    }

    /**
     * Tracks of every stream, optionally limited to a camera and a time range they overlap. Live
     * tracks come from the streams, evicted ones from the track store.
     */
    public List<TrackSnapshot> tracks(String cameraId, Instant from, Instant to) {
        Map<String, TrackSnapshot> byId = new LinkedHashMap<>();
        for (TrackSnapshot t : trackStore.find(cameraId, from, to)) {
            byId.put(t.getId(), t);
        }
        streams.values().stream()
                .flatMap(s -> s.tracks().stream())
                .filter(t -> cameraId == null || t.seenOn(cameraId))
                .filter(t -> t.overlaps(from, to))
                .forEach(t -> byId.put(t.getId(), t));
        return byId.values().stream()
                .sorted(Comparator.comparing(TrackSnapshot::getFirstSeen).thenComparing(TrackSnapshot::getId))
                .collect(Collectors.toList());
    }

    public Set<String> streamIds() {
        return Set.copyOf(streams.keySet());
    }
}
