package com.example.chronotrace.tracking;

import lombok.Value;

import java.time.Instant;

/**
 * The same entity seen on a different camera within the handoff delay.
 */
@Value
public class CameraHandoff {
    String fromCamera;
    String toCamera;
    Instant at;
    double gapSeconds;
    double similarity;
}
