package com.cycletrade.engine.order;

import com.cycletrade.core.model.Phase;

import java.math.BigDecimal;

/**
 * An open long position, created by a buy fill. Its cost basis stays frozen in the pool
 * until the position closes.
 */
public class Position {
    private final String id;
    private final String instrumentId;
    private final BigDecimal entryPrice;
    private final BigDecimal quantity;
    private final BigDecimal costBasis;     // quantity * entryPrice, exact
    private final int entryBar;
    private final long entryTime;
    private final Phase entryPhase;

    PendingOrder sellOrder;                 // Resting exit order, null until the first target
    BigDecimal lastTarget;                  // Most recent sell target

    Position(String id, String instrumentId, BigDecimal entryPrice, BigDecimal quantity,
             int entryBar, long entryTime, Phase entryPhase) {
        this.id = id;
        this.instrumentId = instrumentId;
        this.entryPrice = entryPrice;
        this.quantity = quantity;
        this.costBasis = quantity.multiply(entryPrice);
        this.entryBar = entryBar;
        this.entryTime = entryTime;
        this.entryPhase = entryPhase;
    }

    /**
     * Market value at the given price.
     */
    public BigDecimal valueAt(BigDecimal price) {
        return quantity.multiply(price);
    }

    public String getId() { return id; }
    public String getInstrumentId() { return instrumentId; }
    public BigDecimal getEntryPrice() { return entryPrice; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getCostBasis() { return costBasis; }
    public int getEntryBar() { return entryBar; }
    public long getEntryTime() { return entryTime; }
    public Phase getEntryPhase() { return entryPhase; }
    public PendingOrder getSellOrder() { return sellOrder; }
    public BigDecimal getLastTarget() { return lastTarget; }
}
