package com.cycletrade.core.indicators;

/**
 * Streaming exponential moving average.
 * Seeded with the simple average of the first {@code period} values, NaN before that.
 */
public final class EMA {

    private final int period;
    private final double multiplier;

    private int count;
    private double seedSum;
    private double value = Double.NaN;
    private double previous = Double.NaN;

    public EMA(int period) {
        if (period < 1) {
            throw new IllegalArgumentException("EMA period must be >= 1, got " + period);
        }
        this.period = period;
        this.multiplier = 2.0 / (period + 1);
    }

    /**
     * Feed the next value and return the updated average (NaN during warmup).
     */
    public double update(double input) {
        previous = value;
        count++;
        if (count < period) {
            seedSum += input;
        } else if (count == period) {
            seedSum += input;
            value = seedSum / period;
        } else {
            value = (input - value) * multiplier + value;
        }
        return value;
    }

    public double value() {
        return value;
    }

    /**
     * Value before the most recent update.
     */
    public double previous() {
        return previous;
    }

    /**
     * Change of the average over the last update, NaN until two values exist.
     */
    public double slope() {
        return Double.isNaN(value) || Double.isNaN(previous) ? Double.NaN : value - previous;
    }

    public boolean isReady() {
        return count >= period;
    }

    public int period() {
        return period;
    }
}
