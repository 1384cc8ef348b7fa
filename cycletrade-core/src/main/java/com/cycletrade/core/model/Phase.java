package com.cycletrade.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Market cycle phase assigned to every bar by the cycle classifier.
 */
public enum Phase {
    /**
     * No trend in progress, or data insufficient to tell.
     */
    CONSOLIDATION("consolidation"),

    /**
     * Trend value crossed the bull warning threshold while rising.
     */
    BULL_WARNING("bull_warning"),

    /**
     * Bull cycle confirmed by the strong threshold.
     */
    BULL_STRONG("bull_strong"),

    /**
     * Trend value crossed the bear warning threshold while falling.
     */
    BEAR_WARNING("bear_warning"),

    /**
     * Bear cycle confirmed by the strong threshold.
     */
    BEAR_STRONG("bear_strong");

    private final String key;

    Phase(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    @JsonCreator
    public static Phase fromKey(String key) {
        if (key == null) return CONSOLIDATION;
        for (Phase phase : values()) {
            if (phase.key.equalsIgnoreCase(key) || phase.name().equalsIgnoreCase(key)) {
                return phase;
            }
        }
        throw new IllegalArgumentException("Unknown phase: " + key);
    }

    public boolean isBullish() {
        return this == BULL_WARNING || this == BULL_STRONG;
    }

    public boolean isBearish() {
        return this == BEAR_WARNING || this == BEAR_STRONG;
    }

    public boolean isStrong() {
        return this == BULL_STRONG || this == BEAR_STRONG;
    }

    @Override
    public String toString() {
        return key;
    }
}
