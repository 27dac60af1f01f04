package com.example.chronotrace.anomaly;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Operator-facing view of the anomaly store.
 */
@Slf4j
@Service
public class AnomalyService {

    private final AnomalyRepository repo;

    public AnomalyService(AnomalyRepository repo) {
        this.repo = repo;
    }

    /**
     * Anomalies detected within [{@code from}, {@code to}], newest first. Null arguments do not
     * filter; {@code minSeverity} keeps that severity and above.
     */
    public List<AnomalyRecord> query(AnomalyStatus status, Severity minSeverity, Instant from, Instant to) {
        long lo = from == null ? Long.MIN_VALUE : from.toEpochMilli();
        long hi = to == null ? Long.MAX_VALUE : to.toEpochMilli();
        return repo.findByDetectedAtBetweenOrderByDetectedAtDesc(lo, hi).stream()
                .filter(a -> status == null || a.getStatus() == status)
                .filter(a -> a.getSeverity().atLeast(minSeverity))
                .collect(Collectors.toList());
    }

    public AnomalyRecord get(String id) {
        return repo.findById(id).orElseThrow(() -> new AnomalyNotFoundException(id));
    }

    @Transactional
    public AnomalyRecord updateStatus(String id, AnomalyStatus next) {
        AnomalyRecord r = get(id);
        AnomalyStatus current = r.getStatus();
        if (current == next) return r;
        if (!current.canTransitionTo(next)) {
            throw new IllegalStatusTransitionException(id, current, next);
        }
        r.setStatus(next);
        r.setStatusUpdatedAt(System.currentTimeMillis());
        log.info("Anomaly {} moved {} -> {}", id, current, next);
        return repo.save(r);
    }
}
