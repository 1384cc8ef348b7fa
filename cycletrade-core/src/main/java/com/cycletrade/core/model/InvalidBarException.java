package com.cycletrade.core.model;

/**
 * Raised when a bar is malformed or out of order. Fatal for the instrument it belongs to.
 */
public class InvalidBarException extends RuntimeException {

    private final String instrumentId;
    private final long timestamp;

    public InvalidBarException(String instrumentId, long timestamp, String reason) {
        super("Invalid bar for " + instrumentId + " at " + timestamp + ": " + reason);
        this.instrumentId = instrumentId;
        this.timestamp = timestamp;
    }

    public String getInstrumentId() {
        return instrumentId;
    }

    public long getTimestamp() {
        return timestamp;
    }
}
