package com.example.chronotrace.error;

/**
 * The embedding service rejected the input. Never retried.
 */
public class PermanentExternalException extends ChronoTraceException {

    public PermanentExternalException(String subjectId, String message) {
        super(FailureKind.PERMANENT_EXTERNAL, subjectId, message);
    }

    public PermanentExternalException(String subjectId, String message, Throwable cause) {
        super(FailureKind.PERMANENT_EXTERNAL, subjectId, message, cause);
    }
}
