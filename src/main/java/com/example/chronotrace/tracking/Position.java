package com.example.chronotrace.tracking;

import lombok.Value;

/**
 * Point in a camera's floor-plane coordinates. Distances are only meaningful between
 * positions on the same camera.
 */
@Value
public class Position {
    double x;
    double y;

    public static Position of(double x, double y) {
        return new Position(x, y);
    }

    public double distanceTo(Position other) {
        return Math.hypot(x - other.x, y - other.y);
    }
}
