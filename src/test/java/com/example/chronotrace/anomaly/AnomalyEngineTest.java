package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.tracking.TrackSnapshot;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static com.example.chronotrace.anomaly.AnomalyFixtures.T0;
import static com.example.chronotrace.anomaly.AnomalyFixtures.closed;
import static com.example.chronotrace.anomaly.AnomalyFixtures.open;
import static com.example.chronotrace.anomaly.AnomalyFixtures.standing;
import static com.example.chronotrace.anomaly.AnomalyFixtures.walking;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

public class AnomalyEngineTest {

    private AnomalyStore store;
    private ChronoTraceProperties.AnomalyConfig cfg;

    @BeforeEach
    public void setUp() {
        store = mock(AnomalyStore.class);
        when(store.append(any(), any())).thenAnswer(inv -> {
            DetectedAnomaly a = inv.getArgument(1);
            AnomalyRecord r = new AnomalyRecord();
            r.setId("rec-" + a.getEvidenceKey());
            r.setStreamId(inv.getArgument(0));
            r.setType(a.getType());
            r.setSeverity(a.getSeverity());
            r.setConfidence(a.getConfidence());
            r.setEvidenceKey(a.getEvidenceKey());
            r.setStatus(AnomalyStatus.NEW);
            return Optional.of(r);
        });
        cfg = new ChronoTraceProperties().getAnomaly();
    }

    private static DetectedAnomaly finding(String key) {
        return DetectedAnomaly.builder()
                .type(AnomalyType.LOITERING)
                .confidence(0.7)
                .severity(Severity.MEDIUM)
                .detectedAt(T0)
                .description("test finding")
                .evidenceKey(key)
                .build();
    }

    @Test
    public void sameEvidenceIsReportedOnce() {
        FixedDetector detector = new FixedDetector(List.of(finding("k1"), finding("k1"), finding("k2")));
        AnomalyEngine engine = new AnomalyEngine("s1", List.of(detector), store, cfg);

        List<AnomalyRecord> first = engine.analyze(List.of(), List.of(), List.of(), T0);
        List<AnomalyRecord> second = engine.analyze(List.of(), List.of(), List.of(), T0.plusSeconds(30));

        assertThat(first).extracting(AnomalyRecord::getEvidenceKey).containsExactly("k1", "k2");
        assertThat(second).isEmpty();
        assertThat(detector.calls.get()).isEqualTo(2);
        verify(store, times(2)).append(eq("s1"), any());
    }

    @Test
    public void evidenceAlreadyStoredIsNotReturnedAgain() {
        when(store.append(eq("s1"), any())).thenReturn(Optional.empty());
        AnomalyEngine engine = new AnomalyEngine("s1", List.of(new FixedDetector(List.of(finding("k1")))), store, cfg);

        assertThat(engine.analyze(List.of(), List.of(), List.of(), T0)).isEmpty();
    }

    @Test
    public void failingDetectorDoesNotStopTheOthers() {
        AnomalyDetector broken = new AnomalyDetector() {
            @Override
            public AnomalyType type() {
                return AnomalyType.CROWD_FORMATION;
            }

            @Override
            public List<DetectedAnomaly> evaluate(AnalysisInput input) {
                throw new IllegalStateException("boom");
            }
        };
        AnomalyEngine engine = new AnomalyEngine("s1", List.of(broken, new FixedDetector(List.of(finding("ok")))), store, cfg);

        assertThat(engine.analyze(List.of(), List.of(), List.of(), T0))
                .extracting(AnomalyRecord::getEvidenceKey).containsExactly("ok");
    }

    @Test
    public void closedTracksTeachTheBaselinesOnce() {
        AnomalyEngine engine = new AnomalyEngine("s1", List.of(), store, cfg);
        TrackSnapshot visitor = closed("v1", T0.plusSeconds(300), standing("CAM-1", "atm", T0, 3));
        TrackSnapshot walker = closed("v2", T0.plusSeconds(300), walking("CAM-2", T0, 10, 1.5));
        TrackSnapshot stillHere = open("v3", standing("CAM-1", "atm", T0, 30));

        engine.analyze(List.of(visitor, walker, stillHere), List.of(), List.of(), T0.plusSeconds(400));
        engine.analyze(List.of(visitor, walker, stillHere), List.of(), List.of(), T0.plusSeconds(500));

        assertThat(engine.dwellBaseline("atm")).hasValueSatisfying(b -> {
            assertThat(b.sampleCount()).isEqualTo(1);
            assertThat(b.average()).isEqualTo(Duration.ofMinutes(3));
        });
        assertThat(engine.movementBaseline("CAM-2")).hasValueSatisfying(b -> {
            assertThat(b.sampleCount()).isEqualTo(1);
            assertThat(b.getSpeed().getMean()).isEqualTo(1.5);
        });
    }

    @Test
    public void learnedBaselineDrivesLoitering() {
        AnomalyEngine engine = new AnomalyEngine("s1", List.of(new LoiteringDetector(cfg.getLoitering())), store, cfg);
        engine.seedDwellBaseline("atm", Duration.ofMinutes(2), 10);

        // eleven minutes is under the 15 minute floor but above five times the learned two minute average
        List<AnomalyRecord> found = engine.analyze(
                List.of(open("lingerer", standing("CAM-1", "atm", T0, 11))), List.of(), List.of(), T0.plusSeconds(660));

        assertThat(found).singleElement().satisfies(r -> assertThat(r.getType()).isEqualTo(AnomalyType.LOITERING));
    }

    static final class FixedDetector implements AnomalyDetector {
        final AtomicInteger calls = new AtomicInteger();
        private final List<DetectedAnomaly> findings;

        FixedDetector(List<DetectedAnomaly> findings) {
            this.findings = findings;
        }

        @Override
        public AnomalyType type() {
            return AnomalyType.LOITERING;
        }

        @Override
        public List<DetectedAnomaly> evaluate(AnalysisInput input) {
            calls.incrementAndGet();
            return findings;
        }
    }
}
