package com.cycletrade.engine.order;

import com.cycletrade.core.model.Bar;
import com.cycletrade.core.model.ExitReason;
import com.cycletrade.core.model.Phase;
import com.cycletrade.core.model.Trade;
import com.cycletrade.engine.risk.CapitalPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Limit order book of one instrument, settling against the shared {@link CapitalPool}.
 *
 * <p>Buy orders freeze their amount on creation. A filled buy becomes a {@link Position} whose
 * cost basis stays frozen; the rounding residual is unfrozen. Each open position has at most one
 * resting sell order. Orders fill at their own price when the bar's range contains it.</p>
 */
public class LimitOrderManager {

    private static final Logger log = LoggerFactory.getLogger(LimitOrderManager.class);

    /** Scale of order quantities (rounded down). */
    public static final int QUANTITY_SCALE = 12;
    /** Scale of limit prices and fees. */
    public static final int PRICE_SCALE = 8;

    private final String instrumentId;
    private final CapitalPool pool;
    private final BigDecimal feeRate;

    private final List<PendingOrder> pendingBuys = new ArrayList<>();
    private final Map<String, Position> openPositions = new LinkedHashMap<>();

    private long orderSequence;
    private long positionSequence;
    private int ordersCreated;
    private int ordersFilled;
    private int ordersCancelled;
    private int insufficientCapital;

    public LimitOrderManager(String instrumentId, CapitalPool pool, BigDecimal feeRate) {
        this.instrumentId = instrumentId;
        this.pool = pool;
        this.feeRate = feeRate != null ? feeRate : BigDecimal.ZERO;
    }

    /**
     * Place a buy order reserving {@code amount} of capital.
     * Nothing changes unless the result is {@link OrderResult.Status#CREATED}.
     */
    public OrderResult createBuyOrder(BigDecimal price, BigDecimal amount, int barIndex, long time) {
        if (price == null || price.signum() <= 0 || amount == null || amount.signum() <= 0) {
            return OrderResult.invalid("Price and amount must be positive: price=" + price + ", amount=" + amount);
        }
        BigDecimal quantity = amount.divide(price, QUANTITY_SCALE, RoundingMode.DOWN);
        if (quantity.signum() <= 0) {
            return OrderResult.invalid("Amount " + amount + " buys nothing at " + price);
        }

        String orderId = nextOrderId(OrderSide.BUY);
        if (!pool.freeze(amount, instrumentId, orderId, time)) {
            insufficientCapital++;
            return OrderResult.insufficientCapital(String.format(
                "Need %s, available %s", amount.toPlainString(), pool.getAvailable().toPlainString()));
        }

        PendingOrder order = new PendingOrder(orderId, instrumentId, OrderSide.BUY, price, quantity,
            amount, barIndex, time, null, null);
        pendingBuys.add(order);
        ordersCreated++;
        log.debug("Buy order {} created at bar {}", order, barIndex);
        return OrderResult.created(order);
    }

    /**
     * Cancel every resting buy and unfreeze its capital. Calling it again changes nothing.
     *
     * @return capital returned to available
     */
    public BigDecimal cancelAllPendingBuys(long time) {
        BigDecimal released = BigDecimal.ZERO;
        for (PendingOrder order : pendingBuys) {
            order.markCancelled();
            pool.unfreeze(order.getFrozenAmount(), instrumentId, order.getId(), time);
            released = released.add(order.getFrozenAmount());
            ordersCancelled++;
        }
        pendingBuys.clear();
        return released;
    }

    /**
     * Whether a pending order would fill on this bar: {@code low <= price <= high}, bounds inclusive.
     */
    public static boolean checkFill(PendingOrder order, Bar bar) {
        if (!order.isPending()) {
            return false;
        }
        BigDecimal price = order.getPrice();
        return price.compareTo(BigDecimal.valueOf(bar.low())) >= 0
            && price.compareTo(BigDecimal.valueOf(bar.high())) <= 0;
    }

    /**
     * Fill a buy at its limit price and open the position.
     */
    public Position fillBuy(PendingOrder order, int barIndex, long time, Phase phase) {
        requireOwnPendingBuy(order);
        order.markFilled();
        pendingBuys.remove(order);
        ordersFilled++;

        Position position = new Position(instrumentId + "-P" + (++positionSequence), instrumentId,
            order.getPrice(), order.getQuantity(), barIndex, time, phase);
        BigDecimal residual = order.getFrozenAmount().subtract(position.getCostBasis());
        if (residual.signum() > 0) {
            pool.unfreeze(residual, instrumentId, order.getId(), time);
        }
        openPositions.put(position.getId(), position);
        log.debug("Buy {} filled at bar {}, opened {}", order.getId(), barIndex, position.getId());
        return position;
    }

    /**
     * Cancel a buy that reached its price but could not take a position slot.
     */
    public void rejectBuy(PendingOrder order, long time) {
        requireOwnPendingBuy(order);
        order.markCancelled();
        pendingBuys.remove(order);
        pool.unfreeze(order.getFrozenAmount(), instrumentId, order.getId(), time);
        ordersCancelled++;
        log.debug("Buy {} rejected: no free position slot", order.getId());
    }

    /**
     * Replace the position's resting sell order with one at {@code target}.
     */
    public PendingOrder placeSellOrder(Position position, BigDecimal target, ExitReason reason,
                                       int barIndex, long time) {
        if (!openPositions.containsKey(position.getId())) {
            throw new IllegalArgumentException("Position " + position.getId() + " is not open on " + instrumentId);
        }
        if (target == null || target.signum() <= 0) {
            throw new IllegalArgumentException("Sell target must be positive, got " + target);
        }
        cancelSellOrder(position);

        PendingOrder order = new PendingOrder(nextOrderId(OrderSide.SELL), instrumentId, OrderSide.SELL,
            target, position.getQuantity(), BigDecimal.ZERO, barIndex, time, position.getId(), reason);
        position.sellOrder = order;
        position.lastTarget = target;
        ordersCreated++;
        return order;
    }

    /**
     * Fill a resting sell order at its price and close its position.
     */
    public Trade fillSell(PendingOrder order, int barIndex, long time, Phase phase) {
        if (order.getSide() != OrderSide.SELL || !order.isPending()) {
            throw new IllegalArgumentException("Not a pending sell order: " + order);
        }
        Position position = openPositions.get(order.getPositionId());
        if (position == null || position.sellOrder != order) {
            throw new IllegalArgumentException("Sell order " + order.getId() + " does not belong to an open position");
        }
        order.markFilled();
        ordersFilled++;
        position.sellOrder = null;
        return settle(position, order.getPrice(), order.getReason(), order.getId(), barIndex, time, phase);
    }

    /**
     * Close a position outside its resting sell order (stop loss, instrument abort).
     */
    public Trade closePosition(Position position, BigDecimal price, ExitReason reason,
                               int barIndex, long time, Phase phase) {
        if (!openPositions.containsKey(position.getId())) {
            throw new IllegalArgumentException("Position " + position.getId() + " is not open on " + instrumentId);
        }
        cancelSellOrder(position);
        return settle(position, price, reason, position.getId(), barIndex, time, phase);
    }

    private Trade settle(Position position, BigDecimal price, ExitReason reason, String reference,
                         int barIndex, long time, Phase phase) {
        BigDecimal proceeds = position.getQuantity().multiply(price);
        BigDecimal fees = position.getCostBasis().add(proceeds).multiply(feeRate)
            .setScale(PRICE_SCALE, RoundingMode.HALF_UP);
        // Fees never exceed what the sale returns
        if (fees.compareTo(proceeds) > 0) {
            fees = proceeds;
        }
        pool.release(position.getCostBasis(), proceeds.subtract(fees), instrumentId, reference, time);
        openPositions.remove(position.getId());

        Trade trade = Trade.close(instrumentId, position.getId(),
            position.getEntryBar(), position.getEntryTime(), position.getEntryPrice(), position.getEntryPhase(),
            barIndex, time, price, phase,
            position.getQuantity(), position.getCostBasis(), proceeds, fees, reason);
        log.debug("Closed {} at {} ({}), pnl {}", position.getId(), price.toPlainString(), reason, trade.pnl());
        return trade;
    }

    private void cancelSellOrder(Position position) {
        PendingOrder previous = position.sellOrder;
        if (previous != null && previous.isPending()) {
            previous.markCancelled();
            ordersCancelled++;
        }
        position.sellOrder = null;
    }

    private void requireOwnPendingBuy(PendingOrder order) {
        if (order.getSide() != OrderSide.BUY || !order.isPending() || !pendingBuys.contains(order)) {
            throw new IllegalArgumentException("Not a pending buy order of " + instrumentId + ": " + order);
        }
    }

    private String nextOrderId(OrderSide side) {
        return instrumentId + "-" + side.key() + "-" + (++orderSequence);
    }

    /**
     * Market value of all open positions at the given price.
     */
    public BigDecimal holdingsValue(BigDecimal markPrice) {
        BigDecimal value = BigDecimal.ZERO;
        for (Position position : openPositions.values()) {
            value = value.add(position.valueAt(markPrice));
        }
        return value;
    }

    /**
     * Sum of the cost bases of the open positions.
     */
    public BigDecimal openCostBasis() {
        BigDecimal cost = BigDecimal.ZERO;
        for (Position position : openPositions.values()) {
            cost = cost.add(position.getCostBasis());
        }
        return cost;
    }

    /**
     * Capital currently reserved by resting buys.
     */
    public BigDecimal pendingBuyAmount() {
        BigDecimal amount = BigDecimal.ZERO;
        for (PendingOrder order : pendingBuys) {
            amount = amount.add(order.getFrozenAmount());
        }
        return amount;
    }

    /**
     * Open positions in opening order.
     */
    public List<Position> getOpenPositions() {
        return List.copyOf(openPositions.values());
    }

    public List<PendingOrder> getPendingBuys() {
        return Collections.unmodifiableList(new ArrayList<>(pendingBuys));
    }

    /**
     * Resting sell orders of the open positions, in opening order.
     */
    public List<PendingOrder> getPendingSells() {
        List<PendingOrder> sells = new ArrayList<>();
        for (Position position : openPositions.values()) {
            PendingOrder sell = position.sellOrder;
            if (sell != null && sell.isPending()) {
                sells.add(sell);
            }
        }
        return sells;
    }

    public String getInstrumentId() { return instrumentId; }
    public int getOrdersCreated() { return ordersCreated; }
    public int getOrdersFilled() { return ordersFilled; }
    public int getOrdersCancelled() { return ordersCancelled; }
    public int getInsufficientCapital() { return insufficientCapital; }
}
