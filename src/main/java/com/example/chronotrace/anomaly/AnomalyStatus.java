package com.example.chronotrace.anomaly;

import java.util.EnumSet;
import java.util.Set;

/**
 * Operator workflow state. {@link #RESOLVED} and {@link #FALSE_POSITIVE} are final.
 */
public enum AnomalyStatus {
    NEW,
    ACKNOWLEDGED,
    INVESTIGATING,
    RESOLVED,
    FALSE_POSITIVE;

    public boolean isTerminal() {
        return this == RESOLVED || this == FALSE_POSITIVE;
    }

    public boolean canTransitionTo(AnomalyStatus next) {
        return allowedNext().contains(next);
    }

    private Set<AnomalyStatus> allowedNext() {
        switch (this) {
            case NEW:
                return EnumSet.of(ACKNOWLEDGED, INVESTIGATING, RESOLVED, FALSE_POSITIVE);
            case ACKNOWLEDGED:
                return EnumSet.of(INVESTIGATING, RESOLVED, FALSE_POSITIVE);
            case INVESTIGATING:
                return EnumSet.of(ACKNOWLEDGED, RESOLVED, FALSE_POSITIVE);
            default:
                return EnumSet.noneOf(AnomalyStatus.class);
        }
    }
}
