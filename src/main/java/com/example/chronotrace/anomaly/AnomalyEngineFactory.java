package com.example.chronotrace.anomaly;

import com.example.chronotrace.config.ChronoTraceProperties;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Builds one engine per analysis stream, sharing the detector beans and the store.
 */
@Component
public class AnomalyEngineFactory {

    private final List<AnomalyDetector> detectors;
    private final AnomalyStore store;
    private final ChronoTraceProperties properties;

    public AnomalyEngineFactory(List<AnomalyDetector> detectors, AnomalyStore store, ChronoTraceProperties properties) {
        this.detectors = detectors;
        this.store = store;
        this.properties = properties;
    }

    public AnomalyEngine create(String streamId) {
        return new AnomalyEngine(streamId, detectors, store, properties.getAnomaly());
    }
}
