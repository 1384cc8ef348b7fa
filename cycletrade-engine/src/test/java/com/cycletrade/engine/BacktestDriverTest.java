package com.cycletrade.engine;

import com.cycletrade.core.model.Bar;
import com.cycletrade.core.model.EquityPoint;
import com.cycletrade.core.model.ExitReason;
import com.cycletrade.core.model.Phase;
import com.cycletrade.core.model.Trade;
import com.cycletrade.engine.config.BacktestConfig;
import com.cycletrade.engine.order.LimitOrderManager;
import com.cycletrade.engine.order.Position;
import com.cycletrade.engine.result.BacktestResult;
import com.cycletrade.engine.result.InstrumentFailure;
import com.cycletrade.engine.result.InstrumentStatus;
import com.cycletrade.engine.result.InstrumentSummary;
import com.cycletrade.engine.strategy.BarContext;
import com.cycletrade.engine.strategy.CycleStrategy;
import com.cycletrade.engine.strategy.ExitTarget;
import com.cycletrade.engine.strategy.StrategyType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class BacktestDriverTest {

    private BacktestConfig config;

    @BeforeEach
    void setUp() {
        config = new BacktestConfig();
        config.setInitialCapital(new BigDecimal("10000"));
        config.setMaxPositions(2);
    }

    /** Index of the first bar with a ready snapshot under the default lookback of 30. */
    private static final int FIRST_READY = 29;
    private static final BigDecimal CAPITAL = new BigDecimal("10000");

    private static Map<String, List<Bar>> twoInstruments() {
        Map<String, List<Bar>> bars = new LinkedHashMap<>();
        bars.put("BTC", TestBars.cycle(400));
        bars.put("ETH", TestBars.cycle(400, 500, 80, 36, 9));
        return bars;
    }

    /** Two identical flat series trading between 99 and 101 around 100. */
    private static Map<String, List<Bar>> flatPair() {
        Map<String, List<Bar>> bars = new LinkedHashMap<>();
        bars.put("A", TestBars.flat(60, 100));
        bars.put("B", TestBars.flat(60, 100));
        return bars;
    }

    private static void assertAmount(String expected, BigDecimal actual) {
        assertEquals(0, new BigDecimal(expected).compareTo(actual), () -> "expected " + expected + " but was " + actual);
    }

    /**
     * Buys at the close on one scripted bar per instrument, and from a given bar on keeps a buy
     * resting far below the market where it never fills. Sells far above the market until
     * {@code exitFromBar}, at the close after that.
     */
    private static final class ScriptedStrategy implements CycleStrategy {
        private static final BigDecimal PARKED = new BigDecimal("0.01");

        private final Map<String, Integer> entryBars;
        private final Map<String, Integer> parkFromBars;
        private final int exitFromBar;

        ScriptedStrategy(Map<String, Integer> entryBars, Map<String, Integer> parkFromBars, int exitFromBar) {
            this.entryBars = entryBars;
            this.parkFromBars = parkFromBars;
            this.exitFromBar = exitFromBar;
        }

        private boolean isEntryBar(BarContext ctx) {
            Integer bar = entryBars.get(ctx.instrumentId());
            return bar != null && bar == ctx.barIndex();
        }

        @Override
        public boolean entryPredicate(BarContext ctx) {
            Integer from = parkFromBars.get(ctx.instrumentId());
            return isEntryBar(ctx) || (from != null && ctx.barIndex() >= from);
        }

        @Override
        public BigDecimal entryPrice(BarContext ctx) {
            return isEntryBar(ctx) ? close(ctx) : PARKED;
        }

        @Override
        public ExitTarget exitTarget(BarContext ctx, Position position) {
            BigDecimal price = ctx.barIndex() >= exitFromBar ? close(ctx) : close(ctx).multiply(BigDecimal.TEN);
            return new ExitTarget(price, ExitReason.CONSOLIDATION_TARGET);
        }

        private static BigDecimal close(BarContext ctx) {
            return BigDecimal.valueOf(ctx.bar().close()).setScale(LimitOrderManager.PRICE_SCALE, RoundingMode.HALF_UP);
        }
    }

    @Nested
    @DisplayName("Capital and position invariants")
    class Invariants {

        @Test
        @DisplayName("Pool balances and position cap hold at every timestamp")
        void everyEquityPoint() {
            BacktestResult result = new BacktestDriver(config).run(twoInstruments());

            assertTrue(result.isSuccessful(), () -> "errors: " + result.errors());
            assertEquals(400, result.equityCurve().size());
            for (EquityPoint point : result.equityCurve()) {
                assertEquals(0, point.available().add(point.frozen()).compareTo(point.total()),
                    "available + frozen != total at " + point.timestamp());
                assertTrue(point.available().signum() >= 0);
                assertTrue(point.frozen().signum() >= 0);
                assertTrue(point.openPositions() <= 2, "too many positions at " + point.timestamp());
            }
        }

        @Test
        @DisplayName("Trades happen and realized pnl equals the change in total")
        void pnlMatchesTotal() {
            BacktestResult result = new BacktestDriver(config).run(twoInstruments());

            assertFalse(result.trades().isEmpty());
            BigDecimal pnl = result.trades().stream().map(Trade::pnl).reduce(BigDecimal.ZERO, BigDecimal::add);
            assertEquals(0, result.finalTotal().subtract(result.initialCapital()).compareTo(pnl));
            assertEquals(result.trades().size(), result.metrics().totalTrades());
        }

        @Test
        @DisplayName("Every trade fills inside its bar and exits after it entered")
        void tradesAreConsistent() {
            BacktestResult result = new BacktestDriver(config).run(twoInstruments());

            for (Trade trade : result.trades()) {
                assertTrue(trade.exitBar() > trade.entryBar(), "same-bar round trip: " + trade);
                assertTrue(trade.exitTime() > trade.entryTime());
                assertEquals(0, trade.costBasis().compareTo(trade.quantity().multiply(trade.entryPrice())));
                assertNotEquals(ExitReason.INSTRUMENT_ABORTED, trade.exitReason());
            }
        }

        @Test
        @DisplayName("A single slot never holds two positions")
        void singleSlot() {
            config.setMaxPositions(1);
            BacktestResult result = new BacktestDriver(config).run(twoInstruments());

            assertTrue(result.equityCurve().stream().allMatch(p -> p.openPositions() <= 1));
            assertTrue(result.openPositions() <= 1);
        }
    }

    @Nested
    @DisplayName("Order sizing")
    class OrderSizing {

        @Test
        @DisplayName("Two free slots give each instrument half the capital on every bar")
        void equalSplitAcrossInstruments() {
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of(), Map.of("A", 0, "B", 0), Integer.MAX_VALUE);

            BacktestResult result = new BacktestDriver(config, strategy).run(flatPair());

            assertTrue(result.isSuccessful(), () -> "errors: " + result.errors());
            assertAmount("0", result.equityCurve().get(FIRST_READY - 1).frozen());
            for (EquityPoint point : result.equityCurve().subList(FIRST_READY, 60)) {
                assertAmount("10000", point.frozen());
                assertAmount("0", point.available());
                assertEquals(0, point.openPositions());
            }
            assertEquals(0, result.insufficientCapitalCount());
        }

        @Test
        @DisplayName("After one fill the last free slot gets the remaining capital")
        void remainingCapitalAfterFill() {
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of("A", 40), Map.of("B", 0), Integer.MAX_VALUE);

            BacktestResult result = new BacktestDriver(config, strategy).run(flatPair());

            EquityPoint beforeFill = result.equityCurve().get(40);
            EquityPoint afterFill = result.equityCurve().get(41);
            assertEquals(0, beforeFill.openPositions());
            assertAmount("10000", beforeFill.frozen());
            assertEquals(1, afterFill.openPositions());
            // A's position costs 5000, B rests (10000 - 5000) / (2 - 1)
            assertAmount("10000", afterFill.frozen());
            assertAmount("0", afterFill.available());
            assertEquals(1, result.instruments().get("A").openPositions());
        }
    }

    @Nested
    @DisplayName("Orchestration")
    class Orchestration {

        @Test
        @DisplayName("No buy order is priced on a bear_warning bar")
        void bearWarningBlocksEntries() {
            List<Phase> offered = new ArrayList<>();
            List<Phase> priced = new ArrayList<>();
            CycleStrategy recording = new CycleStrategy() {
                @Override
                public boolean entryPredicate(BarContext ctx) {
                    offered.add(ctx.phase());
                    return true;
                }

                @Override
                public BigDecimal entryPrice(BarContext ctx) {
                    priced.add(ctx.phase());
                    return StrategyType.LIMIT_ENTRY.entryPrice(ctx);
                }
            };

            new BacktestDriver(config, recording).run(twoInstruments());

            assertTrue(offered.contains(Phase.BEAR_WARNING), "series never reached bear_warning");
            assertFalse(priced.isEmpty());
            assertFalse(priced.contains(Phase.BEAR_WARNING));
        }

        @Test
        @DisplayName("Blocking every phase places no buy order at all")
        void everyPhaseBlocked() {
            config.setBlockedEntryPhases(List.of(Phase.values()));

            BacktestResult result = new BacktestDriver(config).run(twoInstruments());

            assertTrue(result.trades().isEmpty());
            result.instruments().values().forEach(summary -> assertEquals(0, summary.ordersCreated()));
        }

        @Test
        @DisplayName("The first instrument in the processing order wins contended capital")
        void instrumentOrderDecidesContention() {
            config.setMaxPositions(1);
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of("A", 40, "B", 40), Map.of(), Integer.MAX_VALUE);

            config.setInstrumentOrder(List.of("A", "B"));
            BacktestResult aFirst = new BacktestDriver(config, strategy).run(flatPair());
            config.setInstrumentOrder(List.of("B", "A"));
            BacktestResult bFirst = new BacktestDriver(config, strategy).run(flatPair());

            assertAll(
                () -> assertEquals(1, aFirst.instruments().get("A").openPositions()),
                () -> assertEquals(0, aFirst.instruments().get("B").openPositions()),
                () -> assertEquals(1, aFirst.instruments().get("B").insufficientCapitalCount()),
                () -> assertEquals(0, bFirst.instruments().get("A").openPositions()),
                () -> assertEquals(1, bFirst.instruments().get("B").openPositions()),
                () -> assertEquals(1, bFirst.instruments().get("A").insufficientCapitalCount())
            );
        }

        @Test
        @DisplayName("Capital and slot freed by an exit fund another instrument's entry at the same timestamp")
        void exitFundsEntryAtSameTimestamp() {
            config.setMaxPositions(1);
            ScriptedStrategy strategy = new ScriptedStrategy(Map.of("A", 40), Map.of("B", 42), 45);

            BacktestResult result = new BacktestDriver(config, strategy).run(flatPair());

            assertEquals(1, result.trades().size());
            Trade exit = result.trades().get(0);
            assertEquals("A", exit.instrumentId());
            assertEquals(46, exit.exitBar());

            EquityPoint holding = result.equityCurve().get(45);
            EquityPoint exitBar = result.equityCurve().get(46);
            assertEquals(1, holding.openPositions());
            assertEquals(0, exitBar.openPositions());
            assertAmount("10000", exitBar.frozen());
            assertAmount("0", exitBar.available());
            assertEquals(0, result.finalTotal().compareTo(CAPITAL));
        }
    }

    @Nested
    @DisplayName("Determinism")
    class Determinism {

        @Test
        @DisplayName("Replaying the same input gives the same trades and equity curve")
        void replay() {
            BacktestResult first = new BacktestDriver(config).run(twoInstruments());
            BacktestResult second = new BacktestDriver(config).run(twoInstruments());

            assertEquals(first.trades(), second.trades());
            assertEquals(first.equityCurve(), second.equityCurve());
            assertEquals(first.instruments(), second.instruments());
            assertEquals(0, first.finalTotal().compareTo(second.finalTotal()));
        }

        @Test
        @DisplayName("Progress reaches one hundred percent")
        void progress() {
            List<BacktestDriver.Progress> updates = new ArrayList<>();
            new BacktestDriver(config).run(BacktestContext.of(twoInstruments()), updates::add);

            assertFalse(updates.isEmpty());
            BacktestDriver.Progress last = updates.get(updates.size() - 1);
            assertEquals(100, last.percentage());
            assertEquals(400, last.total());
        }
    }

    @Nested
    @DisplayName("Data problems")
    class DataProblems {

        @Test
        @DisplayName("An invalid bar stops only its own instrument")
        void invalidBarIsolated() {
            Map<String, List<Bar>> bars = twoInstruments();
            List<Bar> eth = new ArrayList<>(bars.get("ETH"));
            Bar good = eth.get(150);
            eth.set(150, new Bar(good.timestamp(), good.open(), 90, 110, good.close(), good.volume()));
            bars.put("ETH", eth);

            BacktestResult result = new BacktestDriver(config).run(bars);

            assertTrue(result.isSuccessful());
            assertTrue(result.hasFailures());
            assertEquals(1, result.failures().size());
            InstrumentFailure failure = result.failures().get(0);
            assertEquals("ETH", failure.instrumentId());
            assertEquals(good.timestamp(), failure.timestamp());

            InstrumentSummary btc = result.instruments().get("BTC");
            InstrumentSummary ethSummary = result.instruments().get("ETH");
            assertEquals(InstrumentStatus.COMPLETED, btc.status());
            assertEquals(400, btc.barsProcessed());
            assertEquals(InstrumentStatus.ABORTED, ethSummary.status());
            assertEquals(150, ethSummary.barsProcessed());
            assertEquals(0, ethSummary.openPositions());
            assertTrue(result.trades().stream()
                .filter(t -> t.instrumentId().equals("ETH"))
                .allMatch(t -> t.exitTime() <= good.timestamp()));
        }

        @Test
        @DisplayName("A null bar stops only its own instrument")
        void nullBarIsolated() {
            Map<String, List<Bar>> bars = twoInstruments();
            List<Bar> eth = new ArrayList<>(bars.get("ETH"));
            long previous = eth.get(149).timestamp();
            eth.set(150, null);
            bars.put("ETH", eth);

            BacktestResult result = new BacktestDriver(config).run(bars);

            assertTrue(result.isSuccessful(), () -> "errors: " + result.errors());
            assertEquals(1, result.failures().size());
            InstrumentFailure failure = result.failures().get(0);
            assertEquals("ETH", failure.instrumentId());
            assertEquals(150, failure.barIndex());
            assertEquals(previous, failure.timestamp());
            assertTrue(failure.reason().contains("missing bar"));
            assertEquals(InstrumentStatus.ABORTED, result.instruments().get("ETH").status());
            assertEquals(150, result.instruments().get("ETH").barsProcessed());
            assertEquals(400, result.instruments().get("BTC").barsProcessed());
            assertEquals(400, result.equityCurve().size());
        }

        @Test
        @DisplayName("Missing bars skip the instrument for that timestamp")
        void missingBars() {
            Map<String, List<Bar>> bars = twoInstruments();
            List<Bar> eth = new ArrayList<>();
            for (int i = 0; i < bars.get("ETH").size(); i++) {
                if (i % 7 != 3) {
                    eth.add(bars.get("ETH").get(i));
                }
            }
            bars.put("ETH", eth);

            BacktestResult result = new BacktestDriver(config).run(bars);

            assertTrue(result.isSuccessful());
            assertFalse(result.hasFailures());
            assertEquals(400, result.equityCurve().size());
            assertEquals(eth.size(), result.instruments().get("ETH").barsProcessed());
            assertEquals(400 + eth.size(), result.barsProcessed());
        }

        @Test
        @DisplayName("A bar older than its predecessor aborts the instrument")
        void outOfOrder() {
            Map<String, List<Bar>> bars = twoInstruments();
            List<Bar> eth = new ArrayList<>(bars.get("ETH"));
            Bar earlier = eth.get(200);
            eth.set(200, eth.get(201));
            eth.set(201, earlier);
            bars.put("ETH", eth);

            BacktestResult result = new BacktestDriver(config).run(bars);

            assertEquals(1, result.failures().size());
            assertEquals("ETH", result.failures().get(0).instrumentId());
            assertEquals(201, result.failures().get(0).barIndex());
            assertEquals(InstrumentStatus.ABORTED, result.instruments().get("ETH").status());
            assertEquals(InstrumentStatus.COMPLETED, result.instruments().get("BTC").status());
        }

        @Test
        @DisplayName("A series shorter than the lookback never trades")
        void shortSeries() {
            Map<String, List<Bar>> bars = new LinkedHashMap<>();
            bars.put("BTC", TestBars.cycle(20));

            BacktestResult result = new BacktestDriver(config).run(bars);

            assertTrue(result.trades().isEmpty());
            assertEquals(0, result.instruments().get("BTC").ordersCreated());
            assertTrue(result.equityCurve().stream()
                .allMatch(p -> p.equity().compareTo(new BigDecimal("10000")) == 0));
        }

        @Test
        @DisplayName("No bars at all gives an empty result")
        void noBars() {
            BacktestResult result = new BacktestDriver(config).run(Map.of());

            assertTrue(result.isSuccessful());
            assertTrue(result.trades().isEmpty());
            assertTrue(result.equityCurve().isEmpty());
            assertEquals(0, result.finalTotal().compareTo(new BigDecimal("10000")));
        }
    }

    @Nested
    @DisplayName("Failures")
    class Failures {

        @Test
        @DisplayName("A failing strategy is reported as an error, not thrown")
        void strategyThrows() {
            BacktestDriver driver = new BacktestDriver(config, ctx -> {
                throw new IllegalStateException("strategy exploded");
            });

            BacktestResult result = assertDoesNotThrow(() -> driver.run(twoInstruments()));

            assertFalse(result.isSuccessful());
            assertTrue(result.errors().get(0).contains("strategy exploded"));
        }

        @Test
        @DisplayName("An invalid configuration is refused at construction")
        void invalidConfig() {
            config.setMaxPositions(0);
            assertThrows(IllegalArgumentException.class, () -> new BacktestDriver(config));
        }
    }
}
