package com.example.chronotrace.anomaly;

/**
 * Speed and turn-rate statistics of closed tracks seen by one camera.
 */
public class MovementBaseline {

    private final RunningStats speed;
    private final RunningStats turnRate;

    public MovementBaseline() {
        this(new RunningStats(), new RunningStats());
    }

    public MovementBaseline(RunningStats speed, RunningStats turnRate) {
        this.speed = speed;
        this.turnRate = turnRate;
    }

    public void add(double meanSpeed, double meanTurnRate) {
        speed.add(meanSpeed);
        turnRate.add(meanTurnRate);
    }

    public RunningStats getSpeed() {
        return speed;
    }

    public RunningStats getTurnRate() {
        return turnRate;
    }

    public long sampleCount() {
        return speed.getCount();
    }
}
