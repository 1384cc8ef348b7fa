package com.cycletrade.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why a position was closed.
 */
public enum ExitReason {
    BULL_TARGET("bull_target"),                     // Sold at the upper band (P95)
    CONSOLIDATION_TARGET("consolidation_target"),   // Sold at the band/EMA midpoint
    BEAR_TARGET("bear_target"),                     // Sold back at the EMA
    TAKE_PROFIT_CAP("take_profit_cap"),
    STOP_LOSS("stop_loss"),
    INSTRUMENT_ABORTED("instrument_aborted");

    private final String key;

    ExitReason(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static ExitReason fromKey(String key) {
        for (ExitReason reason : values()) {
            if (reason.key.equalsIgnoreCase(key)) {
                return reason;
            }
        }
        throw new IllegalArgumentException("Unknown exit reason: " + key);
    }

    /**
     * Phase-driven target for a given phase.
     */
    public static ExitReason forPhase(Phase phase) {
        return switch (phase) {
            case BULL_WARNING, BULL_STRONG -> BULL_TARGET;
            case BEAR_WARNING, BEAR_STRONG -> BEAR_TARGET;
            case CONSOLIDATION -> CONSOLIDATION_TARGET;
        };
    }

    @Override
    public String toString() {
        return key;
    }
}
