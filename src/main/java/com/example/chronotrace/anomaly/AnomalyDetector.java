package com.example.chronotrace.anomaly;

import java.util.List;

/**
 * One rule over an analysis snapshot. Implementations keep no state between calls; the
 * engine de-duplicates by {@link DetectedAnomaly#getEvidenceKey()}.
 */
public interface AnomalyDetector {

    AnomalyType type();

    List<DetectedAnomaly> evaluate(AnalysisInput input);
}
