package com.example.chronotrace.error;

/**
 * Base type for failures the core reports to its callers. Carries the id of the segment,
 * query or anomaly involved so the caller can re-attempt the operation.
 */
public abstract class ChronoTraceException extends RuntimeException {

    private final FailureKind kind;
    private final String subjectId;

    protected ChronoTraceException(FailureKind kind, String subjectId, String message) {
        super(message);
        this.kind = kind;
        this.subjectId = subjectId;
    }

    protected ChronoTraceException(FailureKind kind, String subjectId, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subjectId = subjectId;
    }

    public FailureKind getKind() {
        return kind;
    }

    public String getSubjectId() {
        return subjectId;
    }
}
