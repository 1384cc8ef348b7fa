package com.cycletrade.engine.risk;

import java.math.BigDecimal;

/**
 * Thrown when capital accounting no longer balances. Always a programming error.
 */
public class CapitalInvariantException extends IllegalStateException {

    private final BigDecimal available;
    private final BigDecimal frozen;
    private final BigDecimal total;

    public CapitalInvariantException(String message, BigDecimal available, BigDecimal frozen, BigDecimal total) {
        super(message + " (available=" + available.toPlainString()
            + ", frozen=" + frozen.toPlainString() + ", total=" + total.toPlainString() + ")");
        this.available = available;
        this.frozen = frozen;
        this.total = total;
    }

    public BigDecimal getAvailable() {
        return available;
    }

    public BigDecimal getFrozen() {
        return frozen;
    }

    public BigDecimal getTotal() {
        return total;
    }
}
