package com.cycletrade.core.indicators;

/**
 * Exponentially weighted mean and standard deviation of a series.
 * Uses alpha = 2 / (window + 1). The first observation seeds the mean with zero variance;
 * the variance update uses the freshly updated mean.
 */
public final class EwmaVolatility {

    private final double alpha;

    private boolean seeded;
    private double mean = Double.NaN;
    private double variance = Double.NaN;

    public EwmaVolatility(int window) {
        if (window < 1) {
            throw new IllegalArgumentException("EWMA window must be >= 1, got " + window);
        }
        this.alpha = 2.0 / (window + 1);
    }

    /**
     * Feed the next observation. NaN observations leave the state unchanged.
     *
     * @return the current standard deviation
     */
    public double update(double x) {
        if (Double.isNaN(x)) {
            return stdDev();
        }
        if (!seeded) {
            mean = x;
            variance = 0.0;
            seeded = true;
        } else {
            mean = alpha * x + (1 - alpha) * mean;
            double diff = x - mean;
            variance = alpha * diff * diff + (1 - alpha) * variance;
        }
        return stdDev();
    }

    public double mean() {
        return mean;
    }

    public double stdDev() {
        return seeded ? Math.sqrt(variance) : Double.NaN;
    }

    public boolean isReady() {
        return seeded;
    }
}
