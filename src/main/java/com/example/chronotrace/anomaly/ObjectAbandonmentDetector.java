package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.tracking.StationaryObject;
import com.example.chronotrace.tracking.TrackObservation;
import com.example.chronotrace.tracking.TrackSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Flags a stationary object whose owner has been away from it, farther than the distance
 * threshold or off its camera, for at least the duration threshold while the object remains.
 */
@Component
public class ObjectAbandonmentDetector implements AnomalyDetector {

    private final double distanceThreshold;
    private final Duration duration;

    @Autowired
    public ObjectAbandonmentDetector(ChronoTraceProperties properties) {
        this(properties.getAnomaly().getAbandonment());
    }

    public ObjectAbandonmentDetector(ChronoTraceProperties.AnomalyConfig.AbandonmentConfig cfg) {
        this.distanceThreshold = cfg.getDistanceThreshold();
        this.duration = cfg.getDuration();
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.OBJECT_ABANDONMENT;
    }

    @Override
    public List<DetectedAnomaly> evaluate(AnalysisInput input) {
        Map<String, TrackSnapshot> tracks = input.getTracks().stream()
                .collect(Collectors.toMap(TrackSnapshot::getId, Function.identity(), (a, b) -> a));
        List<DetectedAnomaly> out = new ArrayList<>();
        for (StationaryObject obj : input.getStationaryObjects()) {
            TrackSnapshot owner = obj.getOwnerTrackId() == null ? null : tracks.get(obj.getOwnerTrackId());
            if (owner == null) continue;
            Instant until = obj.presentUntil(input.getEvaluatedAt());
            Instant awayFrom = awaySince(owner, obj, until);
            if (awayFrom == null) continue;
            Duration away = Duration.between(awayFrom, until);
            if (away.compareTo(duration) < 0) continue;

            double ratio = (double) away.toMillis() / Math.max(1, duration.toMillis());
            out.add(DetectedAnomaly.builder()
                    .type(AnomalyType.OBJECT_ABANDONMENT)
                    .confidence(Math.min(1.0, 0.5 * ratio))
                    .severity(ratio >= 2.0 ? Severity.CRITICAL : Severity.HIGH)
                    .trackId(owner.getId())
                    .cameraId(obj.getCameraId())
                    .location(obj.locationKey())
                    .detectedAt(awayFrom.plus(duration))
                    .description(String.format("Object %s left by track %s, owner away for %d s",
                            obj.getId(), owner.getId(), away.getSeconds()))
                    .evidenceKey("ABANDONMENT:" + obj.getId())
                    .build());
        }
        return out;
    }

    /**
     * Start of the owner's current absence from the object, or null if the owner is still near.
     */
    private Instant awaySince(TrackSnapshot owner, StationaryObject obj, Instant until) {
        Instant awayFrom = null;
        TrackObservation lastSeen = null;
        for (TrackObservation o : owner.getObservations()) {
            if (o.getTimestamp().isAfter(until)) break;
            lastSeen = o;
            if (o.getTimestamp().isBefore(obj.getFirstSeen())) continue;
            boolean near = o.getCameraId().equals(obj.getCameraId())
                    && o.getPosition().distanceTo(obj.getPosition()) <= distanceThreshold;
            if (near) {
                awayFrom = null;
            } else if (awayFrom == null) {
                awayFrom = o.getTimestamp();
            }
        }
        if (awayFrom == null && !owner.isOpen() && lastSeen != null) {
            // owner left the scene while next to the object
            awayFrom = lastSeen.getTimestamp().isBefore(obj.getFirstSeen()) ? obj.getFirstSeen() : lastSeen.getTimestamp();
        }
        return awayFrom;
    }
}
