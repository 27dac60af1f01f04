package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.ingest.Segment;
import com.example.chronotrace.tracking.TrackObservation;
import com.example.chronotrace.tracking.TrackSnapshot;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.time.LocalTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Any activity outside operating hours. Segments already explained by a flagged track are not
 * reported again.
 */
@Component
public class AfterHoursDetector implements AnomalyDetector {

    private final OperatingHours hours;

    @Autowired
    public AfterHoursDetector(ChronoTraceProperties properties) {
        this(properties.getAnomaly().getOperatingHours());
    }

    public AfterHoursDetector(ChronoTraceProperties.AnomalyConfig.OperatingHoursConfig cfg) {
        this(new OperatingHours(LocalTime.parse(cfg.getStart()), LocalTime.parse(cfg.getEnd()), ZoneId.of(cfg.getZone())));
    }

    public AfterHoursDetector(OperatingHours hours) {
        this.hours = hours;
    }

    @Override
    public AnomalyType type() {
        return AnomalyType.AFTER_HOURS_ACCESS;
    }

    @Override
    public List<DetectedAnomaly> evaluate(AnalysisInput input) {
        List<DetectedAnomaly> out = new ArrayList<>();
        Set<String> covered = new HashSet<>();
        for (TrackSnapshot track : input.getTracks()) {
            TrackObservation first = null;
            for (TrackObservation o : track.getObservations()) {
                if (hours.isOpenAt(o.getTimestamp())) continue;
                if (first == null) first = o;
                if (o.getSegmentId() != null) covered.add(o.getSegmentId());
            }
            if (first == null) continue;
            out.add(DetectedAnomaly.builder()
                    .type(AnomalyType.AFTER_HOURS_ACCESS)
                    .confidence(1.0)
                    .severity(Severity.HIGH)
                    .trackId(track.getId())
                    .segmentId(first.getSegmentId())
                    .cameraId(first.getCameraId())
                    .location(first.getLocation())
                    .detectedAt(first.getTimestamp())
                    .description(String.format("Track %s active at %s, outside operating hours %s",
                            track.getId(), hours.localTime(first.getTimestamp()), hours))
                    .evidenceKey("AFTER_HOURS:track:" + track.getId())
                    .build());
        }
        for (Segment s : input.getSegments()) {
            if (covered.contains(s.getId()) || hours.isOpenAt(s.getTimestamp())) continue;
            out.add(DetectedAnomaly.builder()
                    .type(AnomalyType.AFTER_HOURS_ACCESS)
                    .confidence(1.0)
                    .severity(Severity.HIGH)
                    .segmentId(s.getId())
                    .cameraId(s.getCameraId())
                    .location(s.getLocation() == null ? s.getCameraId() : s.getLocation())
                    .detectedAt(s.getTimestamp())
                    .description(String.format("Activity recorded at %s on %s, outside operating hours %s",
                            hours.localTime(s.getTimestamp()), s.getCameraId(), hours))
                    .evidenceKey("AFTER_HOURS:segment:" + s.getId())
                    .build());
        }
        return out;
    }
}
