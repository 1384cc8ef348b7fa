package com.cycletrade.core.indicators;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Parameters of the indicator pipeline.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record IndicatorSettings(
    int emaPeriod,          // Trend EMA, also the band center
    int ewmaWindow,         // Window of the deviation volatility estimate
    int adxPeriod,
    double bandZScore,      // 1.645 puts the bands at the 5th/95th percentile
    double trendScale,      // Trend value = slope * scale
    double inertiaBase,     // Projection horizon before the ADX boost
    double inertiaMin,
    double inertiaMax,
    double flatSlopeRatio   // |slope| below ema * ratio counts as flat
) {
    public IndicatorSettings {
        if (emaPeriod < 2) throw new IllegalArgumentException("emaPeriod must be >= 2");
        if (ewmaWindow < 1) throw new IllegalArgumentException("ewmaWindow must be >= 1");
        if (adxPeriod < 2) throw new IllegalArgumentException("adxPeriod must be >= 2");
        if (bandZScore < 0) throw new IllegalArgumentException("bandZScore must be >= 0");
        if (inertiaMin > inertiaMax) throw new IllegalArgumentException("inertiaMin above inertiaMax");
    }

    public static IndicatorSettings defaults() {
        return new IndicatorSettings(25, 50, 14, 1.645, 100.0, 5.0, 5.0, 10.0, 0.0001);
    }

    /**
     * Bars needed before every pipeline output can be defined.
     */
    public int warmupBars() {
        return Math.max(emaPeriod + 1, 2 * adxPeriod - 1);
    }
}
