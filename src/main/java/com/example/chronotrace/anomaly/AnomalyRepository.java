package com.example.chronotrace.anomaly;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface AnomalyRepository extends JpaRepository<AnomalyRecord, String> {
    boolean existsByStreamIdAndEvidenceKey(String streamId, String evidenceKey);
    List<AnomalyRecord> findByDetectedAtBetweenOrderByDetectedAtDesc(long from, long to);
    List<AnomalyRecord> findByStreamIdOrderByDetectedAtAsc(String streamId);
}
