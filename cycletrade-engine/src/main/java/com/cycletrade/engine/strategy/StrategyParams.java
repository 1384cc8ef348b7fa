package com.cycletrade.engine.strategy;

import java.math.BigDecimal;

/**
 * Pricing and sizing parameters shared by the strategy variants.
 *
 * @param discount                fraction taken off the base buy price
 * @param consolidationMultiplier order size multiplier during consolidation (conservative entry)
 * @param takeProfitRate          caps the sell target at entry * (1 + rate); null disables
 * @param stopLossRate            closes at entry * (1 - rate) when reached; null disables
 */
public record StrategyParams(
    BigDecimal discount,
    BigDecimal consolidationMultiplier,
    BigDecimal takeProfitRate,
    BigDecimal stopLossRate
) {
    public static StrategyParams defaults() {
        return new StrategyParams(new BigDecimal("0.001"), new BigDecimal("3"), null, null);
    }
}
