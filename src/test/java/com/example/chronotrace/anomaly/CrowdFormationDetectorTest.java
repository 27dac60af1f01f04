package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import com.example.chronotrace.tracking.TrackSnapshot;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import static com.example.chronotrace.anomaly.AnomalyFixtures.T0;
import static com.example.chronotrace.anomaly.AnomalyFixtures.obs;
import static com.example.chronotrace.anomaly.AnomalyFixtures.open;
import static org.assertj.core.api.Assertions.assertThat;

public class CrowdFormationDetectorTest {

    private final CrowdFormationDetector detector = new CrowdFormationDetector(new ChronoTraceProperties().getAnomaly().getCrowd());

    private static TrackSnapshot present(String id, String location, Instant from, Instant to) {
        return open(id, List.of(obs("CAM-1", location, from, 0, 0), obs("CAM-1", location, to, 1, 1)));
    }

    private static AnalysisInput input(List<TrackSnapshot> tracks, Instant at) {
        return AnalysisInput.builder().tracks(tracks).evaluatedAt(at).build();
    }

    private static List<TrackSnapshot> regulars(String location) {
        return regulars(location, T0.plusSeconds(3600));
    }

    private static List<TrackSnapshot> regulars(String location, Instant until) {
        List<TrackSnapshot> out = new ArrayList<>();
        for (int i = 0; i < 4; i++) {
            out.add(present("reg-" + i, location, T0, until));
        }
        return out;
    }

    // eight arrivals spread evenly over the span, first at 0 and last at spanSeconds
    private static long[] evenly(long spanSeconds) {
        long[] offsets = new long[8];
        for (int i = 0; i < 8; i++) {
            offsets[i] = Math.round(i * spanSeconds / 7.0);
        }
        return offsets;
    }

    @Test
    public void riseFromFourToTwelveWithinFortyFiveSecondsIsACrowd() {
        List<TrackSnapshot> tracks = regulars("plaza");
        Instant surge = T0.plusSeconds(600);
        long[] arrivals = evenly(45);
        assertThat(arrivals).containsExactly(0, 6, 13, 19, 26, 32, 39, 45);
        for (int i = 0; i < 8; i++) {
            tracks.add(present("new-" + i, "plaza", surge.plusSeconds(arrivals[i]), surge.plusSeconds(900)));
        }

        List<DetectedAnomaly> found = detector.evaluate(input(tracks, surge.plusSeconds(60)));

        assertThat(found).singleElement().satisfies(a -> {
            assertThat(a.getType()).isEqualTo(AnomalyType.CROWD_FORMATION);
            assertThat(a.getLocation()).isEqualTo("plaza");
            // the eleventh concurrent track crosses the threshold of ten
            assertThat(a.getDetectedAt()).isEqualTo(surge.plusSeconds(39));
            assertThat(a.getTrackId()).isEqualTo("new-6");
            assertThat(a.getEvidenceKey()).isEqualTo("CROWD:plaza:" + surge.plusSeconds(39).toEpochMilli());
            assertThat(a.getDescription()).contains("up from 4");
            assertThat(a.getConfidence()).isGreaterThanOrEqualTo(0.5);
        });
    }

    @Test
    public void riseFromFourToTwelveOverTwoHoursNeverFires() {
        Instant start = T0.plusSeconds(600);
        Instant end = start.plusSeconds(2 * 3600);
        List<TrackSnapshot> tracks = regulars("plaza", end.plusSeconds(3600));
        long[] arrivals = evenly(2 * 3600);
        for (int i = 0; i < 8; i++) {
            tracks.add(present("slow-" + i, "plaza", start.plusSeconds(arrivals[i]), end.plusSeconds(3600)));
        }

        assertThat(arrivals[7]).isEqualTo(2 * 3600);
        assertThat(detector.evaluate(input(tracks, end.plusSeconds(3600)))).isEmpty();
    }

    @Test
    public void locationsAreCountedSeparately() {
        List<TrackSnapshot> tracks = new ArrayList<>();
        Instant surge = T0.plusSeconds(600);
        for (int i = 0; i < 12; i++) {
            tracks.add(present("t-" + i, i % 2 == 0 ? "north" : "south", surge.plusSeconds(i), surge.plusSeconds(300)));
        }

        assertThat(detector.evaluate(input(tracks, surge.plusSeconds(300)))).isEmpty();
    }

    @Test
    public void firesAgainOnlyAfterTheCrowdDisperses() {
        List<TrackSnapshot> tracks = regulars("plaza");
        Instant first = T0.plusSeconds(600);
        for (int i = 0; i < 8; i++) {
            tracks.add(present("a-" + i, "plaza", first.plusSeconds(i), first.plusSeconds(300)));
        }
        // second wave while the first is still there: same crowd
        for (int i = 0; i < 6; i++) {
            tracks.add(present("b-" + i, "plaza", first.plusSeconds(120 + i), first.plusSeconds(300)));
        }
        Instant second = first.plusSeconds(1200);
        for (int i = 0; i < 8; i++) {
            tracks.add(present("c-" + i, "plaza", second.plusSeconds(i), second.plusSeconds(300)));
        }

        List<DetectedAnomaly> found = detector.evaluate(input(tracks, second.plusSeconds(300)));

        assertThat(found).hasSize(2);
        assertThat(found).extracting(DetectedAnomaly::getTrackId).containsExactly("a-6", "c-6");
    }
}
