package com.example.chronotrace.anomaly;

import java.time.Duration;
import java.util.ArrayDeque;
import java.util.Deque;

/**
 * Rolling average of dwell durations for one location over the last {@code window} samples.
 */
public class DwellBaseline {

    private final int window;
    private final Deque<Double> samples = new ArrayDeque<>();
    private double sum;

    public DwellBaseline(int window) {
        this.window = Math.max(1, window);
    }

    public synchronized void add(Duration dwell) {
        double s = dwell.toMillis() / 1000.0;
        samples.addLast(s);
        sum += s;
        while (samples.size() > window) {
            sum -= samples.removeFirst();
        }
    }

    public synchronized int sampleCount() {
        return samples.size();
    }

    public synchronized Duration average() {
        if (samples.isEmpty()) return Duration.ZERO;
        return Duration.ofMillis(Math.round(sum / samples.size() * 1000.0));
    }
}
