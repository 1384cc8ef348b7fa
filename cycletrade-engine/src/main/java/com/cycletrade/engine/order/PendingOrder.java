package com.cycletrade.engine.order;

import com.cycletrade.core.model.ExitReason;

import java.math.BigDecimal;

/**
 * A resting limit order. Ids are never reused; a repriced sell order is a new order.
 */
public class PendingOrder {
    private final String id;
    private final String instrumentId;
    private final OrderSide side;
    private final BigDecimal price;          // Limit price, also the fill price
    private final BigDecimal quantity;
    private final BigDecimal frozenAmount;   // Capital reserved at creation (buys only, zero for sells)
    private final int createdBar;
    private final long createdTime;
    private final String positionId;         // Sells: position this order would close
    private final ExitReason reason;         // Sells: which target produced the price
    private OrderStatus status = OrderStatus.PENDING;

    PendingOrder(String id, String instrumentId, OrderSide side, BigDecimal price, BigDecimal quantity,
                 BigDecimal frozenAmount, int createdBar, long createdTime,
                 String positionId, ExitReason reason) {
        this.id = id;
        this.instrumentId = instrumentId;
        this.side = side;
        this.price = price;
        this.quantity = quantity;
        this.frozenAmount = frozenAmount;
        this.createdBar = createdBar;
        this.createdTime = createdTime;
        this.positionId = positionId;
        this.reason = reason;
    }

    void markFilled() {
        requirePending();
        status = OrderStatus.FILLED;
    }

    void markCancelled() {
        requirePending();
        status = OrderStatus.CANCELLED;
    }

    private void requirePending() {
        if (status.isTerminal()) {
            throw new IllegalStateException("Order " + id + " already " + status.key());
        }
    }

    public boolean isPending() {
        return status == OrderStatus.PENDING;
    }

    public String getId() { return id; }
    public String getInstrumentId() { return instrumentId; }
    public OrderSide getSide() { return side; }
    public BigDecimal getPrice() { return price; }
    public BigDecimal getQuantity() { return quantity; }
    public BigDecimal getFrozenAmount() { return frozenAmount; }
    public int getCreatedBar() { return createdBar; }
    public long getCreatedTime() { return createdTime; }
    public String getPositionId() { return positionId; }
    public ExitReason getReason() { return reason; }
    public OrderStatus getStatus() { return status; }

    @Override
    public String toString() {
        return String.format("%s[%s %s @ %s x %s, %s]", id, side.key(), instrumentId,
            price.toPlainString(), quantity.toPlainString(), status.key());
    }
}
