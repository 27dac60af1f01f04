package com.example.chronotrace.error;

/**
 * Search input rejected at the boundary, before any embedding work is spent on it.
 */
public class FilterValidationException extends ChronoTraceException {

    public FilterValidationException(String message) {
        super(FailureKind.FILTER_VALIDATION, null, message);
    }
}
