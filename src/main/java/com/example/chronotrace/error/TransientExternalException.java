package com.example.chronotrace.error;

/**
 * The embedding service timed out or rate limited us and the retry budget is spent.
 */
public class TransientExternalException extends ChronoTraceException {

    public TransientExternalException(String subjectId, String message, Throwable cause) {
        super(FailureKind.TRANSIENT_EXTERNAL, subjectId, message, cause);
    }
}
