package com.example.chronotrace.tracking;

public enum TrackState {
    OPEN,
    CLOSED
}
