package com.cycletrade.engine.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Shared cash account of a backtest run.
 *
 * <p>Capital is either available or frozen. Buy orders freeze their amount; the amount stays
 * frozen as the position's cost basis after the fill and leaves frozen when the position closes,
 * at which point the net proceeds are credited. {@code available + frozen == total} holds exactly
 * after every operation and {@code total} only moves by realized profit and loss.</p>
 *
 * <p>All mutators are synchronized.</p>
 */
public class CapitalPool {

    private static final Logger log = LoggerFactory.getLogger(CapitalPool.class);

    private final BigDecimal initialCapital;
    private BigDecimal total;
    private BigDecimal available;
    private BigDecimal frozen = BigDecimal.ZERO;

    private final List<CapitalTransaction> ledger = new ArrayList<>();
    private long sequence;
    private int failedFreezes;

    public CapitalPool(BigDecimal initialCapital) {
        if (initialCapital == null || initialCapital.signum() <= 0) {
            throw new IllegalArgumentException("Initial capital must be positive, got " + initialCapital);
        }
        this.initialCapital = initialCapital;
        this.total = initialCapital;
        this.available = initialCapital;
    }

    /**
     * Reserve capital for an order.
     *
     * @return false (and no change) when the amount is not positive or exceeds available capital
     */
    public synchronized boolean freeze(BigDecimal amount, String instrumentId, String orderId, long timestamp) {
        if (amount == null || amount.signum() <= 0 || amount.compareTo(available) > 0) {
            failedFreezes++;
            log.debug("Cannot freeze {} for {} (available {})", amount, orderId, available);
            return false;
        }
        available = available.subtract(amount);
        frozen = frozen.add(amount);
        record(CapitalTransaction.Type.FREEZE, amount, instrumentId, orderId, timestamp);
        return true;
    }

    /**
     * Return reserved capital to available.
     *
     * @throws CapitalInvariantException if more than the frozen amount is returned
     */
    public synchronized void unfreeze(BigDecimal amount, String instrumentId, String orderId, long timestamp) {
        if (amount.signum() == 0) {
            return;
        }
        if (amount.signum() < 0 || amount.compareTo(frozen) > 0) {
            throw new CapitalInvariantException("Cannot unfreeze " + amount.toPlainString(), available, frozen, total);
        }
        frozen = frozen.subtract(amount);
        available = available.add(amount);
        record(CapitalTransaction.Type.UNFREEZE, amount, instrumentId, orderId, timestamp);
    }

    /**
     * Close out a position: its cost basis leaves frozen and the net proceeds become available.
     * Total changes by {@code netProceeds - costBasis}.
     */
    public synchronized void release(BigDecimal costBasis, BigDecimal netProceeds,
                                     String instrumentId, String orderId, long timestamp) {
        if (costBasis.signum() < 0 || costBasis.compareTo(frozen) > 0) {
            throw new CapitalInvariantException("Cannot release " + costBasis.toPlainString(), available, frozen, total);
        }
        if (netProceeds.signum() < 0) {
            throw new IllegalArgumentException("Net proceeds must not be negative: " + netProceeds);
        }
        frozen = frozen.subtract(costBasis);
        record(CapitalTransaction.Type.RELEASE, costBasis, instrumentId, orderId, timestamp);
        available = available.add(netProceeds);
        total = total.add(netProceeds.subtract(costBasis));
        record(CapitalTransaction.Type.SETTLE, netProceeds, instrumentId, orderId, timestamp);
    }

    private void record(CapitalTransaction.Type type, BigDecimal amount, String instrumentId,
                        String orderId, long timestamp) {
        ledger.add(new CapitalTransaction(++sequence, type, amount, instrumentId, orderId, timestamp,
            available, frozen));
        if (type != CapitalTransaction.Type.RELEASE) {
            checkInvariant();
        }
    }

    /**
     * @throws CapitalInvariantException if any balance is negative or the pool does not add up
     */
    public synchronized void checkInvariant() {
        if (available.signum() < 0 || frozen.signum() < 0) {
            throw new CapitalInvariantException("Negative balance", available, frozen, total);
        }
        if (available.add(frozen).compareTo(total) != 0) {
            throw new CapitalInvariantException("available + frozen != total", available, frozen, total);
        }
    }

    public synchronized BigDecimal getAvailable() {
        return available;
    }

    public synchronized BigDecimal getFrozen() {
        return frozen;
    }

    public synchronized BigDecimal getTotal() {
        return total;
    }

    public BigDecimal getInitialCapital() {
        return initialCapital;
    }

    /**
     * Realized profit and loss since the start of the run.
     */
    public synchronized BigDecimal realizedPnl() {
        return total.subtract(initialCapital);
    }

    /**
     * Number of freeze requests refused for lack of capital.
     */
    public synchronized int getFailedFreezes() {
        return failedFreezes;
    }

    public synchronized List<CapitalTransaction> getLedger() {
        return Collections.unmodifiableList(new ArrayList<>(ledger));
    }
}
