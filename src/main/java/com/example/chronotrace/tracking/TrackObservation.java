package com.example.chronotrace.tracking;

import lombok.Value;

import java.time.Instant;

@Value
public class TrackObservation {
    String segmentId;
    String cameraId;
    String location;
    Instant timestamp;
    Position position;

    static TrackObservation of(Detection d) {
        return new TrackObservation(d.getSegmentId(), d.getCameraId(), d.locationKey(), d.getTimestamp(), d.getPosition());
    }
}
