package com.cycletrade.engine;

import com.cycletrade.core.cycle.Classification;
import com.cycletrade.core.cycle.CycleClassifier;
import com.cycletrade.core.indicators.IndicatorPipeline;
import com.cycletrade.core.indicators.SignalSnapshot;
import com.cycletrade.core.model.Bar;
import com.cycletrade.core.model.ExitReason;
import com.cycletrade.core.model.InvalidBarException;
import com.cycletrade.core.model.PerformanceMetrics;
import com.cycletrade.core.model.Phase;
import com.cycletrade.core.model.Trade;
import com.cycletrade.engine.order.LimitOrderManager;
import com.cycletrade.engine.order.OrderResult;
import com.cycletrade.engine.order.PendingOrder;
import com.cycletrade.engine.order.Position;
import com.cycletrade.engine.result.InstrumentFailure;
import com.cycletrade.engine.result.InstrumentStatus;
import com.cycletrade.engine.result.InstrumentSummary;
import com.cycletrade.engine.strategy.BarContext;
import com.cycletrade.engine.strategy.ExitTarget;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Simulation state of one instrument: its bar cursor, indicator pipeline, classifier and
 * order book, plus the statistics reported at the end of the run.
 */
class InstrumentRun {

    private static final Logger log = LoggerFactory.getLogger(InstrumentRun.class);

    private final String instrumentId;
    private final List<Bar> bars;
    private final RunSettings settings;
    private final IndicatorPipeline pipeline;
    private final CycleClassifier classifier;
    private final LimitOrderManager orders;

    private int nextIndex;
    private long lastTimestamp = Long.MIN_VALUE;
    private double lastClose = Double.NaN;
    private Classification lastClassification;
    private InstrumentStatus status = InstrumentStatus.COMPLETED;
    private InstrumentFailure failure;

    private final Map<Phase, Integer> phaseCounts = new EnumMap<>(Phase.class);
    private final List<Double> valueCurve = new ArrayList<>();
    private BigDecimal realizedPnl = BigDecimal.ZERO;
    private int tradeCount;
    private int winningTrades;
    private int belowMinimumOrders;

    InstrumentRun(String instrumentId, List<Bar> bars, RunSettings settings) {
        this.instrumentId = instrumentId;
        this.bars = bars;
        this.settings = settings;
        this.pipeline = new IndicatorPipeline(settings.indicatorSettings(), settings.minLookbackBars());
        this.classifier = new CycleClassifier(settings.thresholds());
        this.orders = new LimitOrderManager(instrumentId, settings.pool(), settings.feeRate());
        for (Phase phase : Phase.values()) {
            phaseCounts.put(phase, 0);
        }
    }

    /**
     * Whether the next unprocessed bar is at or before {@code timestamp}. A bar before it can only
     * be out of order, and a missing (null) bar is always due; {@link #step} rejects both.
     */
    boolean isDue(long timestamp) {
        if (!isActive() || !hasRemaining()) {
            return false;
        }
        Bar next = bars.get(nextIndex);
        return next == null || next.timestamp() <= timestamp;
    }

    boolean hasRemaining() {
        return nextIndex < bars.size();
    }

    boolean isActive() {
        return status == InstrumentStatus.COMPLETED;
    }

    /**
     * Process the next bar. Validation happens before any state changes.
     *
     * @throws InvalidBarException if the bar is missing, malformed or not after the previous one
     */
    void step(List<Trade> tradeSink) {
        int barIndex = nextIndex;
        Bar bar = bars.get(barIndex);
        if (bar == null) {
            // Reported at the last valid timestamp, the missing bar has none
            throw new InvalidBarException(instrumentId, lastTimestamp == Long.MIN_VALUE ? 0L : lastTimestamp,
                "missing bar at index " + barIndex);
        }
        bar.validate(instrumentId);
        if (bar.timestamp() <= lastTimestamp) {
            throw new InvalidBarException(instrumentId, bar.timestamp(),
                "timestamp not after previous bar " + lastTimestamp);
        }
        nextIndex++;
        long time = bar.timestamp();
        Phase phaseBefore = lastClassification != null ? lastClassification.phase() : Phase.CONSOLIDATION;

        // 1. Exits from orders resting since the previous bar
        for (Position position : orders.getOpenPositions()) {
            BigDecimal stop = settings.strategy().stopPrice(position, settings.params());
            if (stop != null && BigDecimal.valueOf(bar.low()).compareTo(stop) <= 0) {
                record(orders.closePosition(position, stop, ExitReason.STOP_LOSS, barIndex, time, phaseBefore), tradeSink);
                continue;
            }
            PendingOrder sell = position.getSellOrder();
            if (sell != null && LimitOrderManager.checkFill(sell, bar)) {
                record(orders.fillSell(sell, barIndex, time, phaseBefore), tradeSink);
            }
        }

        // 2. Entries from orders resting since the previous bar
        for (PendingOrder buy : orders.getPendingBuys()) {
            if (!LimitOrderManager.checkFill(buy, bar)) {
                continue;
            }
            if (settings.coordinator().occupySlot(instrumentId)) {
                orders.fillBuy(buy, barIndex, time, phaseBefore);
            } else {
                orders.rejectBuy(buy, time);
            }
        }

        // 3. This bar's signals, then fresh exit targets
        SignalSnapshot snapshot = pipeline.update(bar);
        Classification classification = classifier.classify(barIndex, bar, snapshot);
        phaseCounts.merge(classification.phase(), 1, Integer::sum);
        BarContext ctx = new BarContext(instrumentId, barIndex, bar, snapshot, classification,
            phaseBefore, settings.params());

        if (snapshot.ready()) {
            for (Position position : orders.getOpenPositions()) {
                repriceExit(ctx, position);
            }
        }

        // 4. Replace the stale buy order
        orders.cancelAllPendingBuys(time);
        if (snapshot.ready()) {
            placeEntry(ctx);
        }

        // 5. Statistics
        lastTimestamp = time;
        lastClose = bar.close();
        lastClassification = classification;
        BigDecimal unrealized = orders.holdingsValue(BigDecimal.valueOf(lastClose)).subtract(orders.openCostBasis());
        valueCurve.add(settings.pool().getInitialCapital().add(realizedPnl).add(unrealized).doubleValue());
    }

    private void repriceExit(BarContext ctx, Position position) {
        ExitTarget target = settings.strategy().exitTarget(ctx, position);
        BigDecimal price = settings.repricing().reprice(position.getLastTarget(), target.price());
        PendingOrder resting = position.getSellOrder();
        if (resting != null && resting.isPending() && resting.getPrice().compareTo(price) == 0) {
            return;
        }
        ExitReason reason = price.compareTo(target.price()) == 0 || resting == null
            ? target.reason()
            : resting.getReason();
        orders.placeSellOrder(position, price, reason, ctx.barIndex(), ctx.bar().timestamp());
    }

    private void placeEntry(BarContext ctx) {
        if (!settings.strategy().entryPredicate(ctx)
                || !settings.entryGate().allows(ctx.phase())
                || !settings.coordinator().canOpenPosition()) {
            return;
        }
        BigDecimal price = settings.strategy().entryPrice(ctx);
        if (price == null || price.signum() <= 0) {
            return;
        }
        // Share of the capital not held by open positions; resting buys of other instruments count as free
        BigDecimal available = settings.pool().getAvailable();
        BigDecimal uncommitted = settings.pool().getTotal().subtract(settings.positionCapital().get());
        BigDecimal amount = settings.coordinator().dynamicOrderSize(uncommitted)
            .multiply(settings.strategy().sizeFactor(ctx))
            .min(available)
            .setScale(LimitOrderManager.PRICE_SCALE, RoundingMode.DOWN);
        if (amount.signum() <= 0 || amount.compareTo(settings.minOrderAmount()) < 0) {
            belowMinimumOrders++;
            log.debug("{} bar {}: order amount {} below minimum {}", instrumentId, ctx.barIndex(),
                amount, settings.minOrderAmount());
            return;
        }
        OrderResult result = orders.createBuyOrder(price, amount, ctx.barIndex(), ctx.bar().timestamp());
        if (!result.isCreated()) {
            log.debug("{} bar {}: buy not placed ({}): {}", instrumentId, ctx.barIndex(),
                result.status(), result.message());
        }
    }

    private void record(Trade trade, List<Trade> tradeSink) {
        tradeSink.add(trade);
        settings.coordinator().releaseSlot(instrumentId);
        realizedPnl = realizedPnl.add(trade.pnl());
        tradeCount++;
        if (trade.isWinner()) {
            winningTrades++;
        }
    }

    /**
     * Stop the instrument after an invalid bar: resting buys are cancelled and open positions
     * closed at the last valid close.
     */
    InstrumentFailure abort(InvalidBarException cause, List<Trade> tradeSink) {
        status = InstrumentStatus.ABORTED;
        failure = new InstrumentFailure(instrumentId, cause.getTimestamp(), nextIndex, cause.getMessage());
        long time = lastTimestamp == Long.MIN_VALUE ? cause.getTimestamp() : lastTimestamp;

        orders.cancelAllPendingBuys(time);
        if (!Double.isNaN(lastClose)) {
            Phase phase = lastClassification != null ? lastClassification.phase() : Phase.CONSOLIDATION;
            BigDecimal price = BigDecimal.valueOf(lastClose);
            for (Position position : orders.getOpenPositions()) {
                record(orders.closePosition(position, price, ExitReason.INSTRUMENT_ABORTED,
                    nextIndex - 1, time, phase), tradeSink);
            }
        }
        log.info("Instrument {} aborted at bar {}: {}", instrumentId, nextIndex, cause.getMessage());
        return failure;
    }

    /**
     * Market value of open positions at the last close.
     */
    BigDecimal holdingsValue() {
        if (Double.isNaN(lastClose)) {
            return BigDecimal.ZERO;
        }
        return orders.holdingsValue(BigDecimal.valueOf(lastClose));
    }

    BigDecimal openCostBasis() {
        return orders.openCostBasis();
    }

    int insufficientCapitalCount() {
        return orders.getInsufficientCapital() + belowMinimumOrders;
    }

    InstrumentSummary summarize() {
        BigDecimal initial = settings.pool().getInitialCapital();
        double returnPct = realizedPnl.doubleValue() / initial.doubleValue() * 100;
        double winRate = tradeCount > 0 ? (double) winningTrades / tradeCount * 100 : 0;
        return new InstrumentSummary(
            instrumentId, status, nextIndex,
            tradeCount, winningTrades, winRate, realizedPnl, returnPct,
            PerformanceMetrics.maxDrawdownPercent(valueCurve),
            orders.getOpenPositions().size(),
            orders.getOrdersCreated(), orders.getOrdersFilled(), orders.getOrdersCancelled(),
            insufficientCapitalCount(),
            new EnumMap<>(phaseCounts),
            classifier.currentStreak()
        );
    }

    String getInstrumentId() {
        return instrumentId;
    }

    LimitOrderManager getOrders() {
        return orders;
    }
}
