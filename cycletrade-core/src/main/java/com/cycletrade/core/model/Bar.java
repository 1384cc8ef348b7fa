package com.cycletrade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

/**
 * One OHLCV observation of an instrument.
 * Timestamps are epoch milliseconds and must be strictly increasing per instrument.
 */
public record Bar(
    long timestamp,
    double open,
    double high,
    double low,
    double close,
    double volume
) {
    /**
     * Check the bar for internal consistency.
     *
     * @param instrumentId instrument the bar belongs to, used in the error
     * @throws InvalidBarException if any price is non-finite or non-positive, volume is negative,
     *                             low exceeds high, or open/close lie outside [low, high]
     */
    public void validate(String instrumentId) {
        if (!Double.isFinite(open) || !Double.isFinite(high) || !Double.isFinite(low)
                || !Double.isFinite(close) || !Double.isFinite(volume)) {
            throw new InvalidBarException(instrumentId, timestamp, "non-finite field");
        }
        if (open <= 0 || high <= 0 || low <= 0 || close <= 0) {
            throw new InvalidBarException(instrumentId, timestamp, "non-positive price");
        }
        if (volume < 0) {
            throw new InvalidBarException(instrumentId, timestamp, "negative volume");
        }
        if (low > high) {
            throw new InvalidBarException(instrumentId, timestamp,
                String.format("low %.8f above high %.8f", low, high));
        }
        if (open < low || open > high || close < low || close > high) {
            throw new InvalidBarException(instrumentId, timestamp, "open/close outside high-low range");
        }
    }

    /**
     * Whether a price lies inside this bar's traded range, bounds included.
     */
    @JsonIgnore
    public boolean contains(double price) {
        return low <= price && price <= high;
    }
}
