package com.example.chronotrace.anomaly;

/**
 * Welford mean and variance.
 */
public class RunningStats {

    private long count;
    private double mean;
    private double m2;

    public RunningStats() {
    }

    /** Seeds the statistics from a known distribution. */
    public RunningStats(long count, double mean, double stddev) {
        this.count = count;
        this.mean = mean;
        this.m2 = count > 1 ? stddev * stddev * (count - 1) : 0.0;
    }

    public synchronized void add(double value) {
        count++;
        double delta = value - mean;
        mean += delta / count;
        m2 += delta * (value - mean);
    }

    public synchronized long getCount() {
        return count;
    }

    public synchronized double getMean() {
        return mean;
    }

    public synchronized double getStddev() {
        return count > 1 ? Math.sqrt(m2 / (count - 1)) : 0.0;
    }

    /**
     * Distance from the mean in standard deviations, or 0 when the spread is unknown.
     */
    public synchronized double zScore(double value) {
        double sd = getStddev();
        return sd > 0 ? Math.abs(value - mean) / sd : 0.0;
    }
}
