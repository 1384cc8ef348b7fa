package com.cycletrade.engine.risk;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collections;
import java.util.Map;
import java.util.TreeMap;

/**
 * Global cap on simultaneously open positions across all instruments, and the dynamic
 * order size derived from it.
 *
 * <p>A slot is taken when a buy fills and returned when the position closes, so the number of
 * open positions never exceeds {@code maxPositions}.</p>
 */
public class PositionCoordinator {

    private static final Logger log = LoggerFactory.getLogger(PositionCoordinator.class);

    /** Scale of computed order amounts. */
    public static final int AMOUNT_SCALE = 8;

    private final int maxPositions;
    private final Map<String, Integer> openByInstrument = new TreeMap<>();
    private int openPositions;
    private int rejectedFills;

    public PositionCoordinator(int maxPositions) {
        if (maxPositions < 1) {
            throw new IllegalArgumentException("maxPositions must be >= 1, got " + maxPositions);
        }
        this.maxPositions = maxPositions;
    }

    public boolean canOpenPosition() {
        return openPositions < maxPositions;
    }

    /**
     * Equal share of the available capital for each free slot:
     * {@code available / (maxPositions - openPositions)}, rounded down.
     * Zero when no slot is free or nothing is available.
     */
    public BigDecimal dynamicOrderSize(BigDecimal available) {
        int freeSlots = maxPositions - openPositions;
        if (freeSlots <= 0 || available == null || available.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return available.divide(BigDecimal.valueOf(freeSlots), AMOUNT_SCALE, RoundingMode.DOWN);
    }

    /**
     * Take a slot for a filled buy.
     *
     * @return false when every slot is taken; the caller must then reject the fill
     */
    public boolean occupySlot(String instrumentId) {
        if (!canOpenPosition()) {
            rejectedFills++;
            log.debug("No free position slot for {} ({}/{})", instrumentId, openPositions, maxPositions);
            return false;
        }
        openPositions++;
        openByInstrument.merge(instrumentId, 1, Integer::sum);
        checkInvariant();
        return true;
    }

    /**
     * Return the slot of a closed position.
     */
    public void releaseSlot(String instrumentId) {
        Integer count = openByInstrument.get(instrumentId);
        if (count == null || count <= 0) {
            throw new IllegalStateException("No open position to release for " + instrumentId);
        }
        if (count == 1) {
            openByInstrument.remove(instrumentId);
        } else {
            openByInstrument.put(instrumentId, count - 1);
        }
        openPositions--;
        checkInvariant();
    }

    private void checkInvariant() {
        int sum = openByInstrument.values().stream().mapToInt(Integer::intValue).sum();
        if (sum != openPositions || openPositions < 0 || openPositions > maxPositions) {
            throw new IllegalStateException(String.format(
                "Position count broken: counted=%d tracked=%d max=%d", sum, openPositions, maxPositions));
        }
    }

    public int getOpenPositions() {
        return openPositions;
    }

    public int getOpenPositions(String instrumentId) {
        return openByInstrument.getOrDefault(instrumentId, 0);
    }

    public int getMaxPositions() {
        return maxPositions;
    }

    /**
     * Buy fills refused because every slot was taken.
     */
    public int getRejectedFills() {
        return rejectedFills;
    }

    public Map<String, Integer> getOpenByInstrument() {
        return Collections.unmodifiableMap(openByInstrument);
    }
}
