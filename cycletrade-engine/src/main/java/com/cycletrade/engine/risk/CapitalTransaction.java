package com.cycletrade.engine.risk;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * One entry of the capital pool ledger.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CapitalTransaction(
    long sequence,
    Type type,
    BigDecimal amount,
    String instrumentId,
    String orderId,
    long timestamp,
    BigDecimal availableAfter,
    BigDecimal frozenAfter
) {
    public enum Type {
        FREEZE,     // Reserved for a buy order
        UNFREEZE,   // Reservation returned (cancel, rejection, fill residual)
        RELEASE,    // Position cost basis leaves frozen on close
        SETTLE      // Net proceeds of a close credited to available
    }
}
