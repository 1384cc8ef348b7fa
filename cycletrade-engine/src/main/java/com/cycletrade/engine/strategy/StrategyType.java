package com.cycletrade.engine.strategy;

import com.cycletrade.core.model.Phase;
import com.cycletrade.engine.order.LimitOrderManager;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * The strategy variants selectable by configuration.
 */
public enum StrategyType implements CycleStrategy {

    /**
     * Places a band-based buy order on every bar the entry gate allows.
     */
    LIMIT_ENTRY("limit_entry") {
        @Override
        public boolean entryPredicate(BarContext ctx) {
            return true;
        }
    },

    /**
     * Like {@link #LIMIT_ENTRY}, with a larger order during consolidation.
     */
    CONSERVATIVE_ENTRY("conservative_entry") {
        @Override
        public boolean entryPredicate(BarContext ctx) {
            return true;
        }

        @Override
        public BigDecimal sizeFactor(BarContext ctx) {
            return ctx.phase() == Phase.CONSOLIDATION ? ctx.params().consolidationMultiplier() : BigDecimal.ONE;
        }
    },

    /**
     * Buys at the close on the bar a bull warning starts out of consolidation.
     */
    BULL_WARNING_ENTRY("bull_warning_entry") {
        @Override
        public boolean entryPredicate(BarContext ctx) {
            return ctx.previousPhase() == Phase.CONSOLIDATION && ctx.phase() == Phase.BULL_WARNING;
        }

        @Override
        public BigDecimal entryPrice(BarContext ctx) {
            return BigDecimal.valueOf(ctx.bar().close())
                .setScale(LimitOrderManager.PRICE_SCALE, RoundingMode.HALF_UP);
        }
    };

    private final String key;

    StrategyType(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static StrategyType fromKey(String key) {
        if (key == null) return LIMIT_ENTRY;
        for (StrategyType type : values()) {
            if (type.key.equalsIgnoreCase(key) || type.name().equalsIgnoreCase(key)) {
                return type;
            }
        }
        throw new IllegalArgumentException("Unknown strategy: " + key);
    }
}
