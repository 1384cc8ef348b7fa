package com.cycletrade.engine.order;

import com.fasterxml.jackson.annotation.JsonValue;

public enum OrderSide {
    BUY("buy"),
    SELL("sell");

    private final String key;

    OrderSide(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
