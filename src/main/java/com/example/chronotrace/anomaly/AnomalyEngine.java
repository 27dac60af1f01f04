package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.ingest.Segment;
import com.example.chronotrace.tracking.StationaryObject;
import com.example.chronotrace.tracking.TrackSnapshot;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.Set;

/**
 * Runs every detector over one stream's state and records what they find. Owns the stream's
 * dwell and movement baselines, which grow from tracks as they close.
 */
public class AnomalyEngine {

    private static final Logger log = LoggerFactory.getLogger(AnomalyEngine.class);
    private static final long MAX_REMEMBERED_EVIDENCE = 10_000;

    private final String streamId;
    private final List<AnomalyDetector> detectors;
    private final AnomalyStore store;
    private final double loiteringRadius;
    private final int dwellWindow;
    private final Map<String, DwellBaseline> dwellBaselines = new HashMap<>();
    private final Map<String, MovementBaseline> movementBaselines = new HashMap<>();
    // evidence keys already appended; the store stays the authority once a key falls out
    private final Cache<String, Boolean> reported = Caffeine.newBuilder().maximumSize(MAX_REMEMBERED_EVIDENCE).build();
    private final Set<String> learnedTracks = new HashSet<>();

    public AnomalyEngine(String streamId, List<AnomalyDetector> detectors, AnomalyStore store,
                         ChronoTraceProperties.AnomalyConfig cfg) {
        this.streamId = streamId;
        this.detectors = List.copyOf(detectors);
        this.store = store;
        this.loiteringRadius = cfg.getLoitering().getRadius();
        this.dwellWindow = cfg.getLoitering().getBaselineWindow();
    }

    /**
     * Evaluates all detectors, stores anomalies not reported before and returns them. Baselines
     * learn from newly closed tracks after evaluation, so a track never contributes to the
     * baseline it is judged against.
     */
    public synchronized List<AnomalyRecord> analyze(List<TrackSnapshot> tracks, List<Segment> segments,
                                                   List<StationaryObject> objects, Instant evaluatedAt) {
        AnalysisInput input = AnalysisInput.builder()
                .streamId(streamId)
                .tracks(tracks)
                .segments(segments)
                .stationaryObjects(objects)
                .dwellBaselines(dwellBaselines)
                .movementBaselines(movementBaselines)
                .evaluatedAt(evaluatedAt)
                .build();

        List<AnomalyRecord> created = new ArrayList<>();
        for (AnomalyDetector detector : detectors) {
            List<DetectedAnomaly> found;
            try {
                found = detector.evaluate(input);
            } catch (RuntimeException e) {
                log.error("Stream {}: {} detector failed, skipping it this round", streamId, detector.type(), e);
                continue;
            }
            for (DetectedAnomaly a : found) {
                if (reported.asMap().putIfAbsent(a.getEvidenceKey(), Boolean.TRUE) != null) continue;
                Optional<AnomalyRecord> saved = store.append(streamId, a);
                saved.ifPresent(r -> {
                    created.add(r);
                    log.info("Stream {}: {} anomaly {} ({}, confidence {})", streamId, r.getType(), r.getId(),
                            r.getSeverity(), String.format("%.2f", r.getConfidence()));
                });
            }
        }
        learn(tracks);
        return created;
    }

    private void learn(List<TrackSnapshot> tracks) {
        for (TrackSnapshot t : tracks) {
            if (t.isOpen() || !learnedTracks.add(t.getId())) continue;
            TrackMetrics.DwellSpan span = TrackMetrics.longestDwell(t, loiteringRadius);
            if (span != null && !span.getDuration().isZero()) {
                dwellBaselines.computeIfAbsent(span.getLocation(), k -> new DwellBaseline(dwellWindow))
                        .add(span.getDuration());
            }
            OptionalDouble speed = TrackMetrics.meanSpeed(t);
            if (speed.isPresent()) {
                movementBaselines.computeIfAbsent(TrackMetrics.primaryCamera(t), k -> new MovementBaseline())
                        .add(speed.getAsDouble(), TrackMetrics.meanTurnRate(t).orElse(0.0));
            }
        }
    }

    /**
     * Forgets tracks the stream no longer holds. Their contribution to the baselines stays.
     */
    public synchronized void forgetTracks(Collection<String> trackIds) {
        learnedTracks.removeAll(trackIds);
    }

    public synchronized int learnedTrackCount() {
        return learnedTracks.size();
    }

    /** Seeds a location's dwell baseline, e.g. from a site survey. */
    public synchronized void seedDwellBaseline(String location, Duration averageDwell, int samples) {
        DwellBaseline b = dwellBaselines.computeIfAbsent(location, k -> new DwellBaseline(dwellWindow));
        for (int i = 0; i < Math.max(1, samples); i++) {
            b.add(averageDwell);
        }
    }

    public synchronized void seedMovementBaseline(String cameraId, MovementBaseline baseline) {
        movementBaselines.put(cameraId, baseline);
    }

    public synchronized Optional<DwellBaseline> dwellBaseline(String location) {
        return Optional.ofNullable(dwellBaselines.get(location));
    }

    public synchronized Optional<MovementBaseline> movementBaseline(String cameraId) {
        return Optional.ofNullable(movementBaselines.get(cameraId));
    }

    public String getStreamId() {
        return streamId;
    }
}
