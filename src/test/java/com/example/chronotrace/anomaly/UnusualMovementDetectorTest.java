package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import org.junit.jupiter.api.Test;

import static com.example.chronotrace.anomaly.AnomalyFixtures.T0;
import static com.example.chronotrace.anomaly.AnomalyFixtures.open;
import static com.example.chronotrace.anomaly.AnomalyFixtures.walking;
import static org.assertj.core.api.Assertions.assertThat;

public class UnusualMovementDetectorTest {

    private final UnusualMovementDetector detector =
            new UnusualMovementDetector(new ChronoTraceProperties().getAnomaly().getMovement());

    private static MovementBaseline strollers(long samples) {
        return new MovementBaseline(new RunningStats(samples, 1.0, 0.2), new RunningStats(samples, 0.1, 0.05));
    }

    @Test
    public void runningWhereEveryoneWalksIsUnusual() {
        AnalysisInput input = AnalysisInput.builder()
                .track(open("runner", walking("CAM-1", T0, 10, 5.0)))
                .movementBaseline("CAM-1", strollers(30))
                .evaluatedAt(T0.plusSeconds(10))
                .build();

        assertThat(detector.evaluate(input)).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AnomalyType.UNUSUAL_MOVEMENT);
            assertThat(a.getConfidence()).isEqualTo(1.0);
            assertThat(a.getSeverity()).isEqualTo(Severity.MEDIUM);
            assertThat(a.getCameraId()).isEqualTo("CAM-1");
            assertThat(a.getDetectedAt()).isEqualTo(T0.plusSeconds(10));
            assertThat(a.getEvidenceKey()).isEqualTo("MOVEMENT:runner");
        });
    }

    @Test
    public void ordinaryPaceIsNotFlagged() {
        AnalysisInput input = AnalysisInput.builder()
                .track(open("walker", walking("CAM-1", T0, 10, 1.1)))
                .movementBaseline("CAM-1", strollers(30))
                .evaluatedAt(T0.plusSeconds(10))
                .build();

        assertThat(detector.evaluate(input)).isEmpty();
    }

    @Test
    public void camerasWithLittleHistoryAreSkipped() {
        AnalysisInput input = AnalysisInput.builder()
                .track(open("runner", walking("CAM-1", T0, 10, 5.0)))
                .movementBaseline("CAM-1", strollers(5))
                .track(open("elsewhere", walking("CAM-9", T0, 10, 5.0)))
                .evaluatedAt(T0.plusSeconds(10))
                .build();

        assertThat(detector.evaluate(input)).isEmpty();
    }
}
