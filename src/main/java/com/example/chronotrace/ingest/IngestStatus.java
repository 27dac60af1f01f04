package com.example.chronotrace.ingest;

public enum IngestStatus {
    PENDING,
    INDEXED,
    UNCHANGED,          // result only: same content was already indexed
    QUEUED_FOR_RETRY,
    FAILED
}
