package com.example.chronotrace.index;

/**
 * Metadata fields a search may constrain. Declaration order is the canonical predicate order.
 */
public enum FilterField {
    CAMERA_ID,
    LOCATION,
    VIDEO_ID,
    TIME_RANGE,
    HAS_FACES,
    HAS_VEHICLES,
    MOTION_DETECTED
}
