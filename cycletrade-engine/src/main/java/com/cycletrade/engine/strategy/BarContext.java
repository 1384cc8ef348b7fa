package com.cycletrade.engine.strategy;

import com.cycletrade.core.cycle.Classification;
import com.cycletrade.core.indicators.SignalSnapshot;
import com.cycletrade.core.model.Bar;
import com.cycletrade.core.model.Phase;

/**
 * Everything a strategy sees about one instrument on one bar. Only data up to this bar.
 */
public record BarContext(
    String instrumentId,
    int barIndex,
    Bar bar,
    SignalSnapshot signals,
    Classification classification,
    Phase previousPhase,        // Phase of the previous bar, CONSOLIDATION on the first bar
    StrategyParams params
) {
    public Phase phase() {
        return classification.phase();
    }
}
