package com.example.chronotrace.tracking;

import com.example.chronotrace.anomaly.AnomalyEngine;
import com.example.chronotrace.anomaly.AnomalyRecord;
import com.example.chronotrace.ingest.Segment;
import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * State of one logical stream (a camera group or an investigation). Everything here is
 * private to the stream; calls on one stream are serialized, different streams never contend.
 *
 * <p>Live state is bounded by the retention window: after each analysis, closed tracks are
 * written to the {@link TrackStore} and dropped once they have been closed for longer than the
 * window, together with stationary objects and segments older than it.</p>
 */
@Slf4j
public class AnalysisStream {

    private final String streamId;
    private final TrackCorrelator correlator;
    private final AnomalyEngine engine;
    private final TrackStore trackStore;
    private final Duration retention;
    private final Map<String, StationaryObject> objects = new LinkedHashMap<>();
    private final Set<String> segmentIds = new LinkedHashSet<>();

    public AnalysisStream(String streamId, TrackCorrelator correlator, AnomalyEngine engine,
                          TrackStore trackStore, Duration retention) {
        this.streamId = streamId;
        this.correlator = correlator;
        this.engine = engine;
        this.trackStore = trackStore;
        this.retention = retention;
    }

    public synchronized SubmitResult submit(List<Detection> detections) {
        int accepted = 0;
        int late = 0;
        for (Detection d : detections) {
            if (correlator.submit(d)) {
                accepted++;
                if (d.getSegmentId() != null) segmentIds.add(d.getSegmentId());
            } else {
                late++;
            }
        }
        return new SubmitResult(streamId, accepted, late, correlator.pendingCount(), correlator.openTracks().size());
    }

    public synchronized void register(StationaryObject object) {
        object.validate();
        objects.put(object.getId(), object);
    }

    public synchronized void attachSegments(Collection<String> ids) {
        segmentIds.addAll(ids);
    }

    /**
     * Releases buffered detections, closes idle tracks and runs the anomaly engine as of {@code now}.
     */
    public synchronized List<AnomalyRecord> analyze(Instant now, Function<Collection<String>, List<Segment>> segmentResolver) {
        correlator.flush(now);
        persistClosed();
        List<Segment> segments = segmentIds.isEmpty() ? List.of() : segmentResolver.apply(segmentIds);
        List<AnomalyRecord> found = engine.analyze(correlator.snapshots(), segments, new ArrayList<>(objects.values()), now);
        expire(now.minus(retention), segments);
        return found;
    }

    private void persistClosed() {
        for (TrackSnapshot t : correlator.unpersistedClosed()) {
            try {
                trackStore.save(t);
                correlator.markPersisted(t.getId());
            } catch (RuntimeException e) {
                // stays in memory and is written on the next analysis
                log.warn("Stream {}: could not persist track {}: {}", streamId, t.getId(), e.getMessage());
            }
        }
    }

    // everything here has been through at least one evaluation
    private void expire(Instant cutoff, List<Segment> evaluated) {
        List<String> evicted = correlator.evictClosedBefore(cutoff);
        engine.forgetTracks(evicted);
        objects.values().removeIf(o -> o.getLastSeen() != null && o.getLastSeen().isBefore(cutoff));
        for (Segment s : evaluated) {
            if (s.getTimestamp().isBefore(cutoff)) segmentIds.remove(s.getId());
        }
    }

    public synchronized List<TrackSnapshot> tracks() {
        return correlator.snapshots();
    }

    public synchronized int liveTrackCount() {
        return correlator.trackCount();
    }

    public synchronized int liveSegmentCount() {
        return segmentIds.size();
    }

    public synchronized int liveObjectCount() {
        return objects.size();
    }

    public AnomalyEngine getEngine() {
        return engine;
    }

    public String getStreamId() {
        return streamId;
    }
}
