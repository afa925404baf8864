package me.go_gradually.techinterview.domain.profile;

/**
 * Incremental arithmetic mean kept as an explicit sum and count.
 */
public final class RunningAverage {
    private double sum;
    private int count;

    public void add(double value) {
        sum += value;
        count += 1;
    }

    public double value() {
        return count == 0 ? 0.0 : sum / count;
    }

    public int count() {
        return count;
    }

    public boolean isEmpty() {
        return count == 0;
    }
}
