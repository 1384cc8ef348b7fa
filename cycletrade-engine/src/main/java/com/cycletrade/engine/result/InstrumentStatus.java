package com.cycletrade.engine.result;

import com.fasterxml.jackson.annotation.JsonValue;

public enum InstrumentStatus {
    COMPLETED("completed"),
    ABORTED("aborted");

    private final String key;

    InstrumentStatus(String key) {
        this.key = key;
    }

    @JsonValue
    public String key() {
        return key;
    }
}
