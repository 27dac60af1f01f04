package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.tracking.TrackObservation;
import com.example.chronotrace.tracking.TrackSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Flags a location whose count of concurrent tracks crosses the threshold after a sudden rise.
 * A slow build-up over hours never fires. After firing, the location re-arms only once the
 * count has fallen back to the threshold.
 */
@Component
public class CrowdFormationDetector implements AnomalyDetector {

    private final int threshold;
    private final int minSurge;
    private final Duration window;

    @Autowired
    public CrowdFormationDetector(ChronoTraceProperties properties) {
        this(properties.getAnomaly().getCrowd());
    }

    public CrowdFormationDetector(ChronoTraceProperties.AnomalyConfig.CrowdConfig cfg) {
        this.threshold = cfg.getThreshold();
        this.minSurge = cfg.getMinSurge();
        this.window = cfg.getWindow();
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.CROWD_FORMATION;
    }

    @Override
    public List<DetectedAnomaly> evaluate(AnalysisInput input) {
        Map<String, List<Event>> byLocation = new LinkedHashMap<>();
        for (TrackSnapshot track : input.getTracks()) {
            Map<String, Event[]> spans = new LinkedHashMap<>();
            for (TrackObservation o : track.getObservations()) {
                Event[] span = spans.get(o.getLocation());
                if (span == null) {
                    spans.put(o.getLocation(), new Event[]{
                            new Event(o.getTimestamp(), +1, track.getId(), o.getCameraId()),
                            new Event(o.getTimestamp(), -1, track.getId(), o.getCameraId())});
                } else {
                    span[1] = new Event(o.getTimestamp(), -1, track.getId(), o.getCameraId());
                }
            }
            spans.forEach((location, span) -> {
                List<Event> events = byLocation.computeIfAbsent(location, k -> new ArrayList<>());
                events.add(span[0]);
                events.add(span[1]);
            });
        }
        List<DetectedAnomaly> out = new ArrayList<>();
        byLocation.forEach((location, events) -> sweep(location, events, out));
        return out;
    }

    private void sweep(String location, List<Event> events, List<DetectedAnomaly> out) {
        // arrivals before departures at the same instant
        events.sort(Comparator.comparing((Event e) -> e.at).thenComparingInt(e -> -e.delta));
        List<Instant> times = new ArrayList<>();
        List<Integer> counts = new ArrayList<>();
        int count = 0;
        boolean armed = true;
        for (Event e : events) {
            count += e.delta;
            if (e.delta > 0 && armed && count > threshold) {
                int lowest = lowestSince(times, counts, e.at.minus(window));
                if (count - lowest >= minSurge) {
                    out.add(anomaly(location, e, count, lowest));
                    armed = false;
                }
            } else if (e.delta < 0 && count <= threshold) {
                armed = true;
            }
            times.add(e.at);
            counts.add(count);
        }
    }

    /** Lowest count in effect at any point from {@code since} up to now. */
    private static int lowestSince(List<Instant> times, List<Integer> counts, Instant since) {
        int lowest = Integer.MAX_VALUE;
        int i = times.size() - 1;
        for (; i >= 0 && !times.get(i).isBefore(since); i--) {
            lowest = Math.min(lowest, counts.get(i));
        }
        // value in effect when the window opened
        lowest = Math.min(lowest, i >= 0 ? counts.get(i) : 0);
        return lowest;
    }

    private DetectedAnomaly anomaly(String location, Event trigger, int count, int lowest) {
        return DetectedAnomaly.builder()
                .type(AnomalyType.CROWD_FORMATION)
                .confidence(Math.min(1.0, 0.5 + 0.5 * (count - threshold) / (double) threshold))
                .severity(count >= 2 * threshold ? Severity.HIGH : Severity.MEDIUM)
                .trackId(trigger.trackId)
                .cameraId(trigger.cameraId)
                .location(location)
                .detectedAt(trigger.at)
                .description(String.format("%d concurrent tracks at %s, up from %d within %d s",
                        count, location, lowest, window.getSeconds()))
                .evidenceKey("CROWD:" + location + ":" + trigger.at.toEpochMilli())
                .build();
    }

    private static final class Event {
        final Instant at;
        final int delta;
        final String trackId;
        final String cameraId;

        Event(Instant at, int delta, String trackId, String cameraId) {
            this.at = at;
            this.delta = delta;
            this.trackId = trackId;
            this.cameraId = cameraId;
        }
    }
}
