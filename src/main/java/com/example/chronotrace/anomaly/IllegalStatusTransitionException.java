package com.example.chronotrace.anomaly;

public class IllegalStatusTransitionException extends RuntimeException {

    private final String anomalyId;

    public IllegalStatusTransitionException(String anomalyId, AnomalyStatus from, AnomalyStatus to) {
        super("anomaly " + anomalyId + " cannot move from " + from + " to " + to);
        this.anomalyId = anomalyId;
    }

    public String getAnomalyId() {
        return anomalyId;
    }
}
