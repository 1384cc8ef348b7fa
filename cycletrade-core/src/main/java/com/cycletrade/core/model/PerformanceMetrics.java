package com.cycletrade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.util.List;

/**
 * Performance metrics calculated from closed trades and the equity curve.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PerformanceMetrics(
    int totalTrades,
    int winningTrades,
    int losingTrades,
    double winRate,
    double profitFactor,
    double totalReturn,
    double totalReturnPercent,
    double maxDrawdown,
    double maxDrawdownPercent,
    double averageWin,
    double averageLoss,
    double largestWin,
    double largestLoss,
    double averageHoldingHours,
    double finalEquity,
    double totalFees,
    double apr                  // Annualized return over the covered calendar days
) {
    private static final double MILLIS_PER_DAY = 24.0 * 60 * 60 * 1000;

    /**
     * Create empty metrics (no trades, flat equity)
     */
    public static PerformanceMetrics empty(double initialCapital) {
        return new PerformanceMetrics(
            0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, 0, initialCapital, 0, 0
        );
    }

    /**
     * Calculate metrics from closed trades and the portfolio equity curve.
     * Final equity and drawdown come from the curve so open positions are marked to market.
     */
    public static PerformanceMetrics calculate(List<Trade> trades, List<EquityPoint> equityCurve,
                                               double initialCapital) {
        if (trades == null) {
            trades = List.of();
        }
        if (equityCurve == null) {
            equityCurve = List.of();
        }
        if (trades.isEmpty() && equityCurve.isEmpty()) {
            return empty(initialCapital);
        }

        int winners = 0;
        int losers = 0;
        double totalWins = 0;
        double totalLosses = 0;
        double largestWin = 0;
        double largestLoss = 0;
        double totalHolding = 0;
        double totalFees = 0;

        for (Trade t : trades) {
            totalFees += t.fees().doubleValue();
            double pnl = t.pnl().doubleValue();
            if (pnl > 0) {
                winners++;
                totalWins += pnl;
                largestWin = Math.max(largestWin, pnl);
            } else if (pnl < 0) {
                losers++;
                totalLosses += Math.abs(pnl);
                largestLoss = Math.max(largestLoss, Math.abs(pnl));
            }
            totalHolding += t.holdingHours();
        }

        int total = trades.size();
        double winRate = total > 0 ? (double) winners / total * 100 : 0;
        double profitFactor = totalLosses > 0 ? totalWins / totalLosses : totalWins > 0 ? Double.POSITIVE_INFINITY : 0;
        double avgWin = winners > 0 ? totalWins / winners : 0;
        double avgLoss = losers > 0 ? totalLosses / losers : 0;
        double avgHolding = total > 0 ? totalHolding / total : 0;

        double finalEquity = initialCapital;
        double peak = initialCapital;
        double maxDD = 0;
        double maxDDPct = 0;
        for (EquityPoint point : equityCurve) {
            double equity = point.equity().doubleValue();
            finalEquity = equity;
            if (equity > peak) {
                peak = equity;
            }
            double dd = peak - equity;
            if (dd > maxDD) {
                maxDD = dd;
            }
            if (peak > 0) {
                maxDDPct = Math.max(maxDDPct, dd / peak * 100);
            }
        }

        double totalReturn = finalEquity - initialCapital;
        double totalReturnPct = initialCapital > 0 ? totalReturn / initialCapital * 100 : 0;
        double apr = annualize(totalReturnPct, equityCurve);

        return new PerformanceMetrics(
            total, winners, losers, winRate, profitFactor,
            totalReturn, totalReturnPct, maxDD, maxDDPct,
            avgWin, avgLoss, largestWin, largestLoss, avgHolding,
            finalEquity, totalFees, apr
        );
    }

    /**
     * Max drawdown percent of an arbitrary value series, relative to its running peak.
     */
    public static double maxDrawdownPercent(List<Double> values) {
        double peak = Double.NEGATIVE_INFINITY;
        double maxDDPct = 0;
        for (double v : values) {
            peak = Math.max(peak, v);
            if (peak > 0) {
                maxDDPct = Math.max(maxDDPct, (peak - v) / peak * 100);
            }
        }
        return maxDDPct;
    }

    // Compounded: (1 + r)^(365 / days) - 1, in percent. At least one day of coverage.
    private static double annualize(double totalReturnPct, List<EquityPoint> equityCurve) {
        if (equityCurve == null || equityCurve.size() < 2 || totalReturnPct <= -100) {
            return 0;
        }
        long span = equityCurve.get(equityCurve.size() - 1).timestamp() - equityCurve.get(0).timestamp();
        double days = Math.max(1.0, span / MILLIS_PER_DAY);
        return (Math.pow(1 + totalReturnPct / 100, 365.0 / days) - 1) * 100;
    }
}
