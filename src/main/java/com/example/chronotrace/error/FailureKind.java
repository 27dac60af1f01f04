package com.example.chronotrace.error;

/**
 * Classification of failures surfaced by the core. Callers use it to decide whether a
 * manual re-attempt makes sense.
 */
public enum FailureKind {
    TRANSIENT_EXTERNAL,
    PERMANENT_EXTERNAL,
    CACHE_INCONSISTENCY,
    INDEX_CAPACITY,
    FILTER_VALIDATION,
    SEARCH_TIMEOUT
}
