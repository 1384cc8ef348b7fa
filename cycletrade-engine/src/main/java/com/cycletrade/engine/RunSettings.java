package com.cycletrade.engine;

import com.cycletrade.core.cycle.CycleThresholds;
import com.cycletrade.core.indicators.IndicatorSettings;
import com.cycletrade.engine.order.SellRepricingPolicy;
import com.cycletrade.engine.risk.CapitalPool;
import com.cycletrade.engine.risk.EntryGate;
import com.cycletrade.engine.risk.PositionCoordinator;
import com.cycletrade.engine.strategy.CycleStrategy;
import com.cycletrade.engine.strategy.StrategyParams;

import java.math.BigDecimal;
import java.util.function.Supplier;

/**
 * Settings and shared state handed to every instrument of one run.
 */
record RunSettings(
    CapitalPool pool,
    PositionCoordinator coordinator,
    Supplier<BigDecimal> positionCapital,   // Cost basis of the open positions of all instruments
    IndicatorSettings indicatorSettings,
    CycleThresholds thresholds,
    int minLookbackBars,
    CycleStrategy strategy,
    StrategyParams params,
    EntryGate entryGate,
    SellRepricingPolicy repricing,
    BigDecimal feeRate,
    BigDecimal minOrderAmount
) {}
