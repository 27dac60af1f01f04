package com.example.chronotrace.error;

public class IndexCapacityException extends ChronoTraceException {

    public IndexCapacityException(String pointId, String message) {
        super(FailureKind.INDEX_CAPACITY, pointId, message);
    }
}
