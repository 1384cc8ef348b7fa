package com.cycletrade.engine.order;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.math.BigDecimal;

/**
 * How a recomputed sell target relates to the position's previous target.
 */
public enum SellRepricingPolicy {

    /**
     * Use the freshly computed target every bar, up or down.
     */
    FOLLOW("follow") {
        @Override
        public BigDecimal reprice(BigDecimal previous, BigDecimal computed) {
            return computed;
        }
    },

    /**
     * Never lower the target below the previous one.
     */
    NON_DECREASING("non_decreasing") {
        @Override
        public BigDecimal reprice(BigDecimal previous, BigDecimal computed) {
            if (previous == null) {
                return computed;
            }
            return computed.compareTo(previous) < 0 ? previous : computed;
        }
    };

    private final String key;

    SellRepricingPolicy(String key) {
        this.key = key;
    }

    /**
     * @param previous target of the previous bar, null for a new position
     * @param computed target computed for the current bar
     */
    public abstract BigDecimal reprice(BigDecimal previous, BigDecimal computed);

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static SellRepricingPolicy fromKey(String key) {
        if (key == null) return FOLLOW;
        for (SellRepricingPolicy policy : values()) {
            if (policy.key.equalsIgnoreCase(key) || policy.name().equalsIgnoreCase(key)) {
                return policy;
            }
        }
        throw new IllegalArgumentException("Unknown repricing policy: " + key);
    }
}
