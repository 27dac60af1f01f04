package com.example.chronotrace.error;

public class SearchTimeoutException extends ChronoTraceException {

    public SearchTimeoutException(String queryId, String message) {
        super(FailureKind.SEARCH_TIMEOUT, queryId, message);
    }
}
