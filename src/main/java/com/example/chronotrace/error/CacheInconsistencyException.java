package com.example.chronotrace.error;

/**
 * Two different contents produced the same fingerprint. The cached entry is kept as is.
 */
public class CacheInconsistencyException extends ChronoTraceException {

    public CacheInconsistencyException(String fingerprint, String message) {
        super(FailureKind.CACHE_INCONSISTENCY, fingerprint, message);
    }
}
