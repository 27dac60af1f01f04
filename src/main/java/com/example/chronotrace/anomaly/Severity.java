package com.example.chronotrace.anomaly;

/**
 * Ordered from least to most severe.
 */
public enum Severity {
    LOW,
    MEDIUM,
    HIGH,
    CRITICAL;

    public boolean atLeast(Severity other) {
        return other == null || compareTo(other) >= 0;
    }
}
