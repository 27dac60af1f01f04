package com.example.chronotrace.anomaly;

import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@ActiveProfiles("exact-index")
public class AnomalyServiceTest {

    private static final Instant AT = Instant.parse("2023-02-01T03:00:00Z");

    @Autowired
    private AnomalyStore store;

    @Autowired
    private AnomalyService service;

    private AnomalyRecord stored(Severity severity, Instant at) {
        String key = "TEST:" + UUID.randomUUID();
        return store.append("svc-stream", DetectedAnomaly.builder()
                .type(AnomalyType.AFTER_HOURS_ACCESS)
                .confidence(1.0)
                .severity(severity)
                .cameraId("CAM-1")
                .location("yard")
                .detectedAt(at)
                .description("after hours")
                .evidenceKey(key)
                .build()).orElseThrow();
    }

    @Test
    public void storeKeepsOneRecordPerEvidence() {
        AnomalyRecord r = stored(Severity.HIGH, AT);
        DetectedAnomaly again = DetectedAnomaly.builder()
                .type(AnomalyType.AFTER_HOURS_ACCESS).confidence(1.0).severity(Severity.HIGH)
                .detectedAt(AT).description("dup").evidenceKey(r.getEvidenceKey()).build();

        assertThat(store.append("svc-stream", again)).isEmpty();
        assertThat(store.append("other-stream", again)).isPresent();
        assertThat(r.getStatus()).isEqualTo(AnomalyStatus.NEW);
    }

    @Test
    public void operatorWorkflowFollowsAllowedTransitions() {
        String id = stored(Severity.HIGH, AT).getId();

        assertThat(service.updateStatus(id, AnomalyStatus.ACKNOWLEDGED).getStatus()).isEqualTo(AnomalyStatus.ACKNOWLEDGED);
        assertThat(service.updateStatus(id, AnomalyStatus.INVESTIGATING).getStatus()).isEqualTo(AnomalyStatus.INVESTIGATING);
        assertThat(service.updateStatus(id, AnomalyStatus.INVESTIGATING).getStatus()).isEqualTo(AnomalyStatus.INVESTIGATING);
        assertThat(service.updateStatus(id, AnomalyStatus.RESOLVED).getStatus()).isEqualTo(AnomalyStatus.RESOLVED);

        assertThatThrownBy(() -> service.updateStatus(id, AnomalyStatus.NEW))
                .isInstanceOf(IllegalStatusTransitionException.class);
        assertThat(service.get(id).getStatus()).isEqualTo(AnomalyStatus.RESOLVED);
    }

    @Test
    public void nothingGoesBackToNew() {
        String id = stored(Severity.LOW, AT).getId();
        service.updateStatus(id, AnomalyStatus.ACKNOWLEDGED);

        assertThatThrownBy(() -> service.updateStatus(id, AnomalyStatus.NEW))
                .isInstanceOf(IllegalStatusTransitionException.class);
    }

    @Test
    public void unknownIdIsNotFound() {
        assertThatThrownBy(() -> service.get("missing"))
                .isInstanceOf(AnomalyNotFoundException.class);
        assertThatThrownBy(() -> service.updateStatus("missing", AnomalyStatus.RESOLVED))
                .isInstanceOf(AnomalyNotFoundException.class);
    }

    @Test
    public void queryFiltersByStatusSeverityAndTime() {
        Instant base = Instant.parse("2023-03-01T00:00:00Z");
        AnomalyRecord low = stored(Severity.LOW, base);
        AnomalyRecord high = stored(Severity.HIGH, base.plusSeconds(60));
        AnomalyRecord critical = stored(Severity.CRITICAL, base.plusSeconds(120));
        service.updateStatus(critical.getId(), AnomalyStatus.FALSE_POSITIVE);

        assertThat(service.query(null, null, base, base.plusSeconds(120)))
                .extracting(AnomalyRecord::getId)
                .containsExactly(critical.getId(), high.getId(), low.getId());
        assertThat(service.query(null, Severity.HIGH, base, base.plusSeconds(120)))
                .extracting(AnomalyRecord::getId)
                .containsExactly(critical.getId(), high.getId());
        assertThat(service.query(AnomalyStatus.NEW, Severity.HIGH, base, base.plusSeconds(120)))
                .extracting(AnomalyRecord::getId)
                .containsExactly(high.getId());
        assertThat(service.query(null, null, base.plusSeconds(1), base.plusSeconds(60)))
                .extracting(AnomalyRecord::getId)
                .containsExactly(high.getId());
    }
}
