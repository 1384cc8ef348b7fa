package com.cycletrade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * A closed round trip: one filled buy and the exit that closed it.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Trade(
    String instrumentId,
    String positionId,
    int entryBar,           // Bar index within the instrument's own series
    int exitBar,
    long entryTime,
    long exitTime,
    BigDecimal entryPrice,
    BigDecimal exitPrice,
    BigDecimal quantity,
    BigDecimal costBasis,   // quantity * entryPrice
    BigDecimal proceeds,    // quantity * exitPrice, before fees
    BigDecimal fees,
    BigDecimal pnl,         // proceeds - costBasis - fees
    double pnlPercent,
    ExitReason exitReason,
    Phase entryPhase,
    Phase exitPhase
) {
    /**
     * Build a trade, deriving pnl and pnl percent from the money fields.
     */
    public static Trade close(String instrumentId, String positionId,
                              int entryBar, long entryTime, BigDecimal entryPrice, Phase entryPhase,
                              int exitBar, long exitTime, BigDecimal exitPrice, Phase exitPhase,
                              BigDecimal quantity, BigDecimal costBasis, BigDecimal proceeds,
                              BigDecimal fees, ExitReason exitReason) {
        BigDecimal pnl = proceeds.subtract(costBasis).subtract(fees);
        double pnlPercent = costBasis.signum() > 0
            ? pnl.divide(costBasis, 10, RoundingMode.HALF_EVEN).doubleValue() * 100
            : 0;
        return new Trade(instrumentId, positionId, entryBar, exitBar, entryTime, exitTime,
            entryPrice, exitPrice, quantity, costBasis, proceeds, fees, pnl, pnlPercent,
            exitReason, entryPhase, exitPhase);
    }

    @JsonIgnore
    public boolean isWinner() {
        return pnl.signum() > 0;
    }

    /**
     * Holding time in hours.
     */
    @JsonIgnore
    public double holdingHours() {
        return (exitTime - entryTime) / (60.0 * 60 * 1000);
    }
}
