package com.example.chronotrace.anomaly;

import com.example.chronotrace.tracking.TrackObservation;
import com.example.chronotrace.tracking.TrackSnapshot;
import lombok.Value;

import java.time.Duration;
import java.util.List;
import java.util.OptionalDouble;

/**
 * Geometry over a track's observations. Only consecutive observations on the same camera are
 * compared, since positions on different cameras do not share coordinates.
 */
public final class TrackMetrics {

    private TrackMetrics() {
    }

    @Value
    public static class DwellSpan {
        String cameraId;
        String location;
        TrackObservation anchor;
        Duration duration;
    }

    /**
     * Longest stretch during which the track stayed within {@code radius} of the observation
     * that started the stretch.
     */
    public static DwellSpan longestDwell(TrackSnapshot track, double radius) {
        List<TrackObservation> obs = track.getObservations();
        DwellSpan best = null;
        for (int i = 0; i < obs.size(); i++) {
            TrackObservation anchor = obs.get(i);
            TrackObservation last = anchor;
            for (int j = i + 1; j < obs.size(); j++) {
                TrackObservation o = obs.get(j);
                if (!o.getCameraId().equals(anchor.getCameraId())
                        || anchor.getPosition().distanceTo(o.getPosition()) > radius) {
                    break;
                }
                last = o;
            }
            Duration d = Duration.between(anchor.getTimestamp(), last.getTimestamp());
            if (best == null || d.compareTo(best.duration) > 0) {
                best = new DwellSpan(anchor.getCameraId(), anchor.getLocation(), anchor, d);
            }
        }
        return best;
    }

    /** Distance per second over same-camera steps. */
    public static OptionalDouble meanSpeed(TrackSnapshot track) {
        List<TrackObservation> obs = track.getObservations();
        double distance = 0;
        double seconds = 0;
        for (int i = 1; i < obs.size(); i++) {
            TrackObservation a = obs.get(i - 1);
            TrackObservation b = obs.get(i);
            double dt = seconds(a, b);
            if (!a.getCameraId().equals(b.getCameraId()) || dt <= 0) continue;
            distance += a.getPosition().distanceTo(b.getPosition());
            seconds += dt;
        }
        return seconds > 0 ? OptionalDouble.of(distance / seconds) : OptionalDouble.empty();
    }

    /** Mean absolute heading change in radians per second. */
    public static OptionalDouble meanTurnRate(TrackSnapshot track) {
        List<TrackObservation> obs = track.getObservations();
        Double previousHeading = null;
        double total = 0;
        int turns = 0;
        for (int i = 1; i < obs.size(); i++) {
            TrackObservation a = obs.get(i - 1);
            TrackObservation b = obs.get(i);
            double dt = seconds(a, b);
            double dx = b.getPosition().getX() - a.getPosition().getX();
            double dy = b.getPosition().getY() - a.getPosition().getY();
            if (!a.getCameraId().equals(b.getCameraId()) || dt <= 0) {
                previousHeading = null;
                continue;
            }
            if (dx == 0 && dy == 0) continue;
            double heading = Math.atan2(dy, dx);
            if (previousHeading != null) {
                double turn = Math.abs(heading - previousHeading);
                if (turn > Math.PI) turn = 2 * Math.PI - turn;
                total += turn / dt;
                turns++;
            }
            previousHeading = heading;
        }
        return turns > 0 ? OptionalDouble.of(total / turns) : OptionalDouble.empty();
    }

    /** Camera with the most observations; first seen wins ties. */
    public static String primaryCamera(TrackSnapshot track) {
        java.util.Map<String, Integer> counts = new java.util.LinkedHashMap<>();
        for (TrackObservation o : track.getObservations()) {
            counts.merge(o.getCameraId(), 1, Integer::sum);
        }
        String best = null;
        int bestCount = -1;
        for (java.util.Map.Entry<String, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private static double seconds(TrackObservation a, TrackObservation b) {
        return (b.getTimestamp().toEpochMilli() - a.getTimestamp().toEpochMilli()) / 1000.0;
    }
}
