package com.cycletrade.engine.result;

import com.cycletrade.core.model.Phase;
import com.cycletrade.core.model.PhaseStreak;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Per-instrument statistics of a run. Returns and drawdown are relative to the run's
 * initial capital, since all instruments share one capital pool.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstrumentSummary(
    String instrumentId,
    InstrumentStatus status,
    int barsProcessed,
    int tradeCount,
    int winningTrades,
    double winRate,
    BigDecimal realizedPnl,
    double totalReturnPercent,
    double maxDrawdownPercent,
    int openPositions,
    int ordersCreated,
    int ordersFilled,
    int ordersCancelled,
    int insufficientCapitalCount,
    Map<Phase, Integer> phaseCounts,
    PhaseStreak finalStreak
) {}
