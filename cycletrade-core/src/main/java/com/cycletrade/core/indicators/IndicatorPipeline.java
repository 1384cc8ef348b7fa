package com.cycletrade.core.indicators;

import com.cycletrade.core.model.Bar;

/**
 * Incremental indicator pipeline for one instrument.
 *
 * <p>Each {@link #update(Bar)} consumes exactly one new bar and only recursive state, so a
 * snapshot for bar t never depends on bars after t. Per bar it computes the trend EMA, the
 * close/EMA deviation and its EWMA volatility, the P5/P95 bands, ADX, the EMA slope scaled into
 * the trend value, and the inertia mid line.</p>
 */
public class IndicatorPipeline {

    private final IndicatorSettings settings;
    private final int minLookback;

    private final EMA ema;
    private final EwmaVolatility deviation;
    private final ADX adx;

    private int barsSeen;
    private double previousTrendValue = Double.NaN;

    public IndicatorPipeline(IndicatorSettings settings, int minLookback) {
        this.settings = settings;
        this.minLookback = Math.max(minLookback, settings.warmupBars());
        this.ema = new EMA(settings.emaPeriod());
        this.deviation = new EwmaVolatility(settings.ewmaWindow());
        this.adx = new ADX(settings.adxPeriod());
    }

    /**
     * Consume the next bar. Returns {@link SignalSnapshot#insufficient} until the lookback is met.
     */
    public SignalSnapshot update(Bar bar) {
        barsSeen++;
        double close = bar.close();

        double emaValue = ema.update(close);
        double vol = Double.NaN;
        if (!Double.isNaN(emaValue) && emaValue != 0) {
            vol = deviation.update((close - emaValue) / emaValue);
        }
        double adxValue = adx.update(bar);

        double slope = ema.slope();
        double trendValue = Double.isNaN(slope) ? Double.NaN : slope * settings.trendScale();
        double trendDelta = Double.isNaN(previousTrendValue) || Double.isNaN(trendValue)
            ? Double.NaN
            : trendValue - previousTrendValue;
        if (!Double.isNaN(trendValue)) {
            previousTrendValue = trendValue;
        }

        double p5 = emaValue * (1 - settings.bandZScore() * vol);
        double p95 = emaValue * (1 + settings.bandZScore() * vol);
        double horizon = Double.isNaN(adxValue)
            ? Double.NaN
            : InertiaFan.horizon(adxValue, settings.inertiaBase(), settings.inertiaMin(), settings.inertiaMax());
        double mid = InertiaFan.mid(emaValue, slope, p5, p95, horizon, settings.flatSlopeRatio());

        boolean ready = barsSeen >= minLookback
            && Double.isFinite(trendValue)
            && Double.isFinite(vol)
            && Double.isFinite(mid)
            && Double.isFinite(adxValue);
        if (!ready) {
            return SignalSnapshot.insufficient(bar.timestamp(), barsSeen, close);
        }
        return new SignalSnapshot(bar.timestamp(), barsSeen, true, close,
            trendValue, trendDelta, vol, emaValue, p5, p95, mid, adxValue);
    }

    public int barsSeen() {
        return barsSeen;
    }

    /**
     * Effective lookback: the configured minimum or the indicator warmup, whichever is larger.
     */
    public int minLookback() {
        return minLookback;
    }

    public IndicatorSettings settings() {
        return settings;
    }
}
