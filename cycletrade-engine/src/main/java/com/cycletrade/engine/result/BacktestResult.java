package com.cycletrade.engine.result;

import com.cycletrade.core.model.EquityPoint;
import com.cycletrade.core.model.PerformanceMetrics;
import com.cycletrade.core.model.Trade;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Result of a backtest run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record BacktestResult(
    String runId,
    BigDecimal initialCapital,
    BigDecimal finalTotal,              // Pool total: initial capital plus realized P&L
    List<Trade> trades,                 // Closed trades in fill order
    List<EquityPoint> equityCurve,      // One point per timestamp of the union timeline
    Map<String, InstrumentSummary> instruments,
    PerformanceMetrics metrics,
    List<InstrumentFailure> failures,
    int openPositions,
    int insufficientCapitalCount,
    int rejectedFills,                  // Buy fills refused for lack of a position slot
    int barsProcessed,
    long duration,
    List<String> errors                 // Unexpected failures that stopped the run
) {
    public static String newRunId() {
        return UUID.randomUUID().toString().substring(0, 8);
    }

    /**
     * Check if the backtest ran to the end (instrument failures are not errors)
     */
    @JsonIgnore
    public boolean isSuccessful() {
        return errors == null || errors.isEmpty();
    }

    @JsonIgnore
    public boolean hasFailures() {
        return failures != null && !failures.isEmpty();
    }

    /**
     * Get summary string
     */
    @JsonIgnore
    public String getSummary() {
        return String.format(
            "%d trades, %.1f%% win rate, %+.2f%% return, %.2f%% max drawdown, %d open",
            metrics.totalTrades(),
            metrics.winRate(),
            metrics.totalReturnPercent(),
            metrics.maxDrawdownPercent(),
            openPositions
        );
    }
}
