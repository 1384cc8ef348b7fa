package com.cycletrade.core.indicators;

import com.cycletrade.core.model.Bar;

/**
 * Streaming Average Directional Index with Wilder smoothing.
 * First value appears after {@code 2 * period - 1} bars.
 */
public final class ADX {

    private final int period;
    private final WilderSmoother trueRange;
    private final WilderSmoother plusDm;
    private final WilderSmoother minusDm;
    private final WilderSmoother dx;

    private Bar previous;
    private double plusDi = Double.NaN;
    private double minusDi = Double.NaN;

    public ADX(int period) {
        if (period < 2) {
            throw new IllegalArgumentException("ADX period must be >= 2, got " + period);
        }
        this.period = period;
        this.trueRange = new WilderSmoother(period);
        this.plusDm = new WilderSmoother(period);
        this.minusDm = new WilderSmoother(period);
        this.dx = new WilderSmoother(period);
    }

    /**
     * Feed the next bar and return the ADX (NaN during warmup).
     */
    public double update(Bar bar) {
        double tr;
        double up = 0;
        double down = 0;

        if (previous == null) {
            tr = bar.high() - bar.low();
        } else {
            double highLow = bar.high() - bar.low();
            double highPrevClose = Math.abs(bar.high() - previous.close());
            double lowPrevClose = Math.abs(bar.low() - previous.close());
            tr = Math.max(highLow, Math.max(highPrevClose, lowPrevClose));

            double upMove = bar.high() - previous.high();
            double downMove = previous.low() - bar.low();
            if (upMove > downMove && upMove > 0) {
                up = upMove;
            }
            if (downMove > upMove && downMove > 0) {
                down = downMove;
            }
        }
        previous = bar;

        double smoothedTr = trueRange.update(tr);
        double smoothedPlus = plusDm.update(up);
        double smoothedMinus = minusDm.update(down);

        if (Double.isNaN(smoothedTr) || smoothedTr == 0) {
            return dx.value();
        }
        plusDi = 100 * smoothedPlus / smoothedTr;
        minusDi = 100 * smoothedMinus / smoothedTr;

        // No directional movement at all counts as zero trend strength
        double diSum = plusDi + minusDi;
        double dxValue = diSum == 0 ? 0 : 100 * Math.abs(plusDi - minusDi) / diSum;
        return dx.update(dxValue);
    }

    public double value() {
        return dx.value();
    }

    public double plusDi() {
        return plusDi;
    }

    public double minusDi() {
        return minusDi;
    }

    public int period() {
        return period;
    }
}
