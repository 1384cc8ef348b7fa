package com.cycletrade.engine;

import com.cycletrade.core.cycle.CycleThresholds;
import com.cycletrade.core.indicators.IndicatorSettings;
import com.cycletrade.core.model.Bar;
import com.cycletrade.core.model.EquityPoint;
import com.cycletrade.core.model.InvalidBarException;
import com.cycletrade.core.model.PerformanceMetrics;
import com.cycletrade.core.model.Trade;
import com.cycletrade.engine.config.BacktestConfig;
import com.cycletrade.engine.order.SellRepricingPolicy;
import com.cycletrade.engine.result.BacktestResult;
import com.cycletrade.engine.result.InstrumentFailure;
import com.cycletrade.engine.result.InstrumentSummary;
import com.cycletrade.engine.risk.CapitalPool;
import com.cycletrade.engine.risk.EntryGate;
import com.cycletrade.engine.risk.PositionCoordinator;
import com.cycletrade.engine.strategy.CycleStrategy;
import com.cycletrade.engine.strategy.StrategyParams;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.function.Consumer;

/**
 * Runs the cycle strategy over several instruments that share one capital pool and one
 * position cap.
 *
 * <p>Instruments advance in lockstep over the sorted union of their timestamps. Within one
 * timestamp each instrument with a bar there is processed in the context's instrument order:
 * resting sells, then resting buys are checked against the bar, then indicators and the phase
 * are updated, sell orders repriced and a new buy order placed. An instrument without a bar at
 * a timestamp is skipped and its orders keep resting. One equity point is recorded per
 * timestamp.</p>
 *
 * <p>An invalid bar stops only its own instrument. Any other failure ends the run and is
 * reported in {@link BacktestResult#errors()}; {@code run} does not throw.</p>
 */
public class BacktestDriver {

    private static final Logger log = LoggerFactory.getLogger(BacktestDriver.class);

    private final BigDecimal initialCapital;
    private final int maxPositions;
    private final int minLookbackBars;
    private final IndicatorSettings indicatorSettings;
    private final CycleThresholds thresholds;
    private final CycleStrategy strategy;
    private final StrategyParams params;
    private final EntryGate entryGate;
    private final SellRepricingPolicy repricing;
    private final BigDecimal feeRate;
    private final BigDecimal minOrderAmount;
    private final List<String> instrumentOrder;

    /**
     * @throws IllegalArgumentException if the configuration is invalid
     */
    public BacktestDriver(BacktestConfig config) {
        this(config, config.getStrategy());
    }

    /**
     * Driver with a custom strategy in place of the configured variant.
     */
    public BacktestDriver(BacktestConfig config, CycleStrategy strategy) {
        config.validate();
        this.initialCapital = config.getInitialCapital();
        this.maxPositions = config.getMaxPositions();
        this.minLookbackBars = config.getMinLookbackBars();
        this.indicatorSettings = config.toIndicatorSettings();
        this.thresholds = config.toThresholds();
        this.strategy = strategy;
        this.params = config.toStrategyParams();
        this.entryGate = config.getEntryGate();
        this.repricing = config.getRepricing() != null ? config.getRepricing() : SellRepricingPolicy.FOLLOW;
        this.feeRate = config.getFeeRate();
        this.minOrderAmount = config.getMinOrderAmount();
        this.instrumentOrder = config.getInstrumentOrder() == null ? List.of() : List.copyOf(config.getInstrumentOrder());
    }

    /**
     * Run over the given series in the configured instrument order.
     */
    public BacktestResult run(Map<String, List<Bar>> bars) {
        return run(BacktestContext.of(bars, instrumentOrder), null);
    }

    public BacktestResult run(BacktestContext context, Consumer<Progress> onProgress) {
        long startTime = System.currentTimeMillis();
        String runId = BacktestResult.newRunId();

        CapitalPool pool = new CapitalPool(initialCapital);
        PositionCoordinator coordinator = new PositionCoordinator(maxPositions);
        Map<String, InstrumentRun> runs = new LinkedHashMap<>();
        RunSettings settings = new RunSettings(pool, coordinator, () -> openCostBasis(runs.values()),
            indicatorSettings, thresholds, minLookbackBars,
            strategy, params, entryGate, repricing, feeRate, minOrderAmount);

        List<Trade> trades = new ArrayList<>();
        List<EquityPoint> equityCurve = new ArrayList<>();
        List<InstrumentFailure> failures = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int barsProcessed = 0;

        try {
            for (String id : context.resolveOrder()) {
                runs.put(id, new InstrumentRun(id, context.bars().get(id), settings));
            }
            TreeSet<Long> timeline = context.timeline();
            log.info("Backtest {} starting: {} instruments, {} timestamps, capital {}, max positions {}",
                runId, runs.size(), timeline.size(), initialCapital.toPlainString(), maxPositions);

            int current = 0;
            int total = timeline.size();
            for (long timestamp : timeline) {
                for (InstrumentRun run : runs.values()) {
                    if (!run.isDue(timestamp)) {
                        continue;
                    }
                    try {
                        run.step(trades);
                        barsProcessed++;
                    } catch (InvalidBarException e) {
                        failures.add(run.abort(e, trades));
                    }
                }
                equityCurve.add(equityPoint(timestamp, pool, coordinator, runs.values()));

                current++;
                if (onProgress != null && (current % 100 == 0 || current == total)) {
                    int pct = current * 100 / total;
                    onProgress.accept(new Progress(current, total, pct, "Simulating " + current + "/" + total));
                }
            }

            // Bars left over were behind their predecessor and never came due in order
            for (InstrumentRun run : runs.values()) {
                while (run.isActive() && run.hasRemaining()) {
                    try {
                        run.step(trades);
                        barsProcessed++;
                    } catch (InvalidBarException e) {
                        failures.add(run.abort(e, trades));
                    }
                }
            }
            if (!failures.isEmpty() && !equityCurve.isEmpty()) {
                EquityPoint last = equityCurve.remove(equityCurve.size() - 1);
                equityCurve.add(equityPoint(last.timestamp(), pool, coordinator, runs.values()));
            }
            pool.checkInvariant();
        } catch (RuntimeException e) {
            log.error("Backtest {} failed", runId, e);
            errors.add(e.getClass().getSimpleName() + ": " + e.getMessage());
        }

        Map<String, InstrumentSummary> summaries = new LinkedHashMap<>();
        int insufficientCapital = 0;
        for (InstrumentRun run : runs.values()) {
            summaries.put(run.getInstrumentId(), run.summarize());
            insufficientCapital += run.insufficientCapitalCount();
        }

        PerformanceMetrics metrics = PerformanceMetrics.calculate(trades, equityCurve, initialCapital.doubleValue());
        long duration = System.currentTimeMillis() - startTime;

        BacktestResult result = new BacktestResult(
            runId,
            initialCapital,
            pool.getTotal(),
            List.copyOf(trades),
            List.copyOf(equityCurve),
            summaries,
            metrics,
            List.copyOf(failures),
            coordinator.getOpenPositions(),
            insufficientCapital,
            coordinator.getRejectedFills(),
            barsProcessed,
            duration,
            List.copyOf(errors)
        );
        log.info("Backtest {} finished in {} ms: {}", runId, duration, result.getSummary());
        return result;
    }

    private static EquityPoint equityPoint(long timestamp, CapitalPool pool, PositionCoordinator coordinator,
                                           Iterable<InstrumentRun> runs) {
        BigDecimal holdings = BigDecimal.ZERO;
        for (InstrumentRun run : runs) {
            holdings = holdings.add(run.holdingsValue());
        }
        BigDecimal openCost = openCostBasis(runs);
        BigDecimal available = pool.getAvailable();
        BigDecimal frozen = pool.getFrozen();
        BigDecimal equity = available.add(frozen).subtract(openCost).add(holdings);
        return new EquityPoint(timestamp, equity, available, frozen, pool.getTotal(), holdings,
            coordinator.getOpenPositions());
    }

    private static BigDecimal openCostBasis(Iterable<InstrumentRun> runs) {
        BigDecimal cost = BigDecimal.ZERO;
        for (InstrumentRun run : runs) {
            cost = cost.add(run.openCostBasis());
        }
        return cost;
    }

    /**
     * Progress callback data
     */
    public record Progress(int current, int total, int percentage, String message) {}
}
