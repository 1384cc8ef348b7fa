package com.cycletrade.core.indicators;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Indicator values for one bar. When {@code ready} is false the history is insufficient
 * and every value is NaN.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record SignalSnapshot(
    long timestamp,
    int barsSeen,
    boolean ready,
    double close,
    double trendValue,      // EMA slope * trend scale
    double trendDelta,      // Change of trend value from the previous bar
    double volatility,      // EWMA std dev of the close/EMA deviation
    double ema,
    double p5,
    double p95,
    double inertiaMid,
    double adx
) {
    public static SignalSnapshot insufficient(long timestamp, int barsSeen, double close) {
        return new SignalSnapshot(timestamp, barsSeen, false, close,
            Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN, Double.NaN);
    }
}
