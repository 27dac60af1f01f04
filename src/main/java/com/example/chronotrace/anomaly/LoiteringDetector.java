package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.tracking.TrackSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Flags a track that stays within a small radius for much longer than is usual at its
 * location. Without a baseline the absolute floor applies.
 */
@Component
public class LoiteringDetector implements AnomalyDetector {

    private final double radius;
    private final double baselineMultiple;
    private final Duration absoluteFloor;
    private final Duration recentWindow;

    @Autowired
    public LoiteringDetector(ChronoTraceProperties properties) {
        this(properties.getAnomaly().getLoitering());
    }

    public LoiteringDetector(ChronoTraceProperties.AnomalyConfig.LoiteringConfig cfg) {
        this.radius = cfg.getRadius();
        this.baselineMultiple = cfg.getBaselineMultiple();
        this.absoluteFloor = cfg.getAbsoluteFloor();
        this.recentWindow = cfg.getRecentWindow();
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.LOITERING;
    }

    @Override
    public List<DetectedAnomaly> evaluate(AnalysisInput input) {
        List<DetectedAnomaly> out = new ArrayList<>();
        for (TrackSnapshot track : input.getTracks()) {
            if (!eligible(track, input)) continue;
            TrackMetrics.DwellSpan span = TrackMetrics.longestDwell(track, radius);
            if (span == null) continue;
            Duration threshold = thresholdFor(input.getDwellBaselines().get(span.getLocation()));
            if (span.getDuration().compareTo(threshold) <= 0) continue;

            double ratio = (double) span.getDuration().toMillis() / threshold.toMillis();
            out.add(DetectedAnomaly.builder()
                    .type(AnomalyType.LOITERING)
                    .confidence(Math.min(1.0, 0.5 * ratio))
                    .severity(ratio >= 2.0 ? Severity.HIGH : Severity.MEDIUM)
                    .trackId(track.getId())
                    .segmentId(span.getAnchor().getSegmentId())
                    .cameraId(span.getCameraId())
                    .location(span.getLocation())
                    .detectedAt(span.getAnchor().getTimestamp().plus(span.getDuration()))
                    .description(String.format("Track %s stayed within %.1f units at %s for %d min (threshold %d min)",
                            track.getId(), radius, span.getLocation(),
                            span.getDuration().toMinutes(), threshold.toMinutes()))
                    .evidenceKey("LOITERING:" + track.getId() + ":" + span.getLocation())
                    .build());
        }
        return out;
    }

    private boolean eligible(TrackSnapshot track, AnalysisInput input) {
        if (track.isOpen()) return true;
        return track.getClosedAt() != null
                && !track.getClosedAt().isBefore(input.getEvaluatedAt().minus(recentWindow));
    }

    Duration thresholdFor(DwellBaseline baseline) {
        if (baseline == null || baseline.sampleCount() == 0 || baseline.average().isZero()) {
            return absoluteFloor;
        }
        return Duration.ofMillis(Math.round(baseline.average().toMillis() * baselineMultiple));
    }
}
