package com.example.chronotrace.anomaly;

public enum AnomalyType {
    LOITERING,
    CROWD_FORMATION,
    OBJECT_ABANDONMENT,
    AFTER_HOURS_ACCESS,
    UNUSUAL_MOVEMENT
}
