package com.example.chronotrace.anomaly;

import java.time.Instant;
import java.time.LocalTime;
import java.time.ZoneId;

/**
 * Daily open window in a zone. A window whose end precedes its start runs overnight; equal
 * bounds mean always open.
 */
public final class OperatingHours {

    private final LocalTime start;
    private final LocalTime end;
    private final ZoneId zone;

    public OperatingHours(LocalTime start, LocalTime end, ZoneId zone) {
        this.start = start;
        this.end = end;
        this.zone = zone;
    }

    public boolean isOpenAt(Instant instant) {
        LocalTime t = instant.atZone(zone).toLocalTime();
        if (start.equals(end)) return true;
        if (start.isBefore(end)) {
            return !t.isBefore(start) && t.isBefore(end);
        }
        return !t.isBefore(start) || t.isBefore(end);
    }

    public LocalTime localTime(Instant instant) {
        return instant.atZone(zone).toLocalTime();
    }

    @Override
    public String toString() {
        return start + "-" + end + " " + zone;
    }
}
