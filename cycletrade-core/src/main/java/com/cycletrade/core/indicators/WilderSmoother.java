package com.cycletrade.core.indicators;

/**
 * Wilder smoothing: the first value is the simple average of the first {@code period} valid inputs,
 * after that {@code s = s + (x - s) / period}. NaN inputs are skipped.
 */
final class WilderSmoother {

    private final int period;
    private int count;
    private double sum;
    private double value = Double.NaN;

    WilderSmoother(int period) {
        this.period = period;
    }

    double update(double x) {
        if (Double.isNaN(x)) {
            return value;
        }
        if (count < period) {
            sum += x;
            count++;
            if (count == period) {
                value = sum / period;
            }
        } else {
            value = value + (x - value) / period;
        }
        return value;
    }

    double value() {
        return value;
    }
}
