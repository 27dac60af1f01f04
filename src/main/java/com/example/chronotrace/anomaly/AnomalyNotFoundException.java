package com.example.chronotrace.anomaly;

public class AnomalyNotFoundException extends RuntimeException {

    private final String anomalyId;

    public AnomalyNotFoundException(String anomalyId) {
        super("anomaly " + anomalyId + " not found");
        this.anomalyId = anomalyId;
    }

    public String getAnomalyId() {
        return anomalyId;
    }
}
