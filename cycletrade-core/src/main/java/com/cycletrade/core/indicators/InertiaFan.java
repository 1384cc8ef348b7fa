package com.cycletrade.core.indicators;

/**
 * Trend-projected mid price from the EMA slope, the percentile bands and ADX.
 */
public final class InertiaFan {

    private InertiaFan() {}

    /**
     * Projection horizon in bars: {@code base * (1 + adx / 100)} clamped to [min, max].
     */
    public static double horizon(double adx, double base, double min, double max) {
        double t = base * (1 + adx / 100.0);
        return Math.max(min, Math.min(max, t));
    }

    /**
     * Mid line. A slope smaller than {@code ema * flatRatio} counts as flat and returns the EMA;
     * a rising slope projects from P95, a falling one from P5.
     */
    public static double mid(double ema, double slope, double p5, double p95, double horizon, double flatRatio) {
        if (Double.isNaN(ema) || Double.isNaN(slope) || Double.isNaN(horizon)) {
            return Double.NaN;
        }
        if (Math.abs(slope) < ema * flatRatio) {
            return ema;
        }
        return slope > 0 ? p95 + slope * horizon : p5 + slope * horizon;
    }
}
