package com.cycletrade.engine.order;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Lifecycle of a pending order: PENDING, then exactly one of FILLED or CANCELLED.
 */
public enum OrderStatus {
    PENDING("pending"),
    FILLED("filled"),
    CANCELLED("cancelled");

    private final String key;

    OrderStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }

    public boolean isTerminal() {
        return this != PENDING;
    }
}
