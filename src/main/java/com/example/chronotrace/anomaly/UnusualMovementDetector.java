package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.tracking.TrackSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Flags a track whose speed or turn rate sits far outside what its camera usually sees.
 * Cameras without enough history are skipped.
 */
@Component
public class UnusualMovementDetector implements AnomalyDetector {

    private final double sigma;
    private final int minSamples;

    @Autowired
    public UnusualMovementDetector(ChronoTraceProperties properties) {
        this(properties.getAnomaly().getMovement());
    }

    public UnusualMovementDetector(ChronoTraceProperties.AnomalyConfig.MovementConfig cfg) {
        this.sigma = cfg.getSigma();
        this.minSamples = cfg.getMinSamples();
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.UNUSUAL_MOVEMENT;
    }

    @Override
    public List<DetectedAnomaly> evaluate(AnalysisInput input) {
        List<DetectedAnomaly> out = new ArrayList<>();
        for (TrackSnapshot track : input.getTracks()) {
            String camera = TrackMetrics.primaryCamera(track);
            MovementBaseline baseline = input.getMovementBaselines().get(camera);
            if (baseline == null || baseline.sampleCount() < minSamples) continue;
            OptionalDouble speed = TrackMetrics.meanSpeed(track);
            if (speed.isEmpty()) continue;
            OptionalDouble turn = TrackMetrics.meanTurnRate(track);

            double speedZ = baseline.getSpeed().zScore(speed.getAsDouble());
            double turnZ = turn.isPresent() ? baseline.getTurnRate().zScore(turn.getAsDouble()) : 0.0;
            double z = Math.max(speedZ, turnZ);
            if (z <= sigma) continue;

            String what = speedZ >= turnZ
                    ? String.format("speed %.2f vs mean %.2f", speed.getAsDouble(), baseline.getSpeed().getMean())
                    : String.format("turn rate %.2f rad/s vs mean %.2f", turn.getAsDouble(), baseline.getTurnRate().getMean());
            out.add(DetectedAnomaly.builder()
                    .type(AnomalyType.UNUSUAL_MOVEMENT)
                    .confidence(Math.min(1.0, z / (2 * sigma)))
                    .severity(z >= 2 * sigma ? Severity.MEDIUM : Severity.LOW)
                    .trackId(track.getId())
                    .segmentId(track.getLatest().getSegmentId())
                    .cameraId(camera)
                    .location(track.getLatest().getLocation())
                    .detectedAt(track.getLastSeen())
                    .description(String.format("Track %s moving unusually on %s: %s (%.1f sigma)", track.getId(), camera, what, z))
                    .evidenceKey("MOVEMENT:" + track.getId())
                    .build());
        }
        return out;
    }
}
