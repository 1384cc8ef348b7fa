package com.cycletrade.core.cycle;

import com.cycletrade.core.indicators.SignalSnapshot;
import com.cycletrade.core.model.Bar;
import com.cycletrade.core.model.Phase;
import com.cycletrade.core.model.PhaseStreak;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Stateful five-phase cycle state machine over the trend value series.
 *
 * <p>Transitions, with v the current trend value:</p>
 * <ul>
 *   <li>consolidation to bull_warning when v exceeds the bull warning level and rose since the
 *       previous bar; to bear_warning when v is below the bear warning level and fell</li>
 *   <li>bull_warning to bull_strong when v exceeds the bull strong level; back to consolidation
 *       when v drops to the bull exit level</li>
 *   <li>bull_strong to consolidation at the bull exit level</li>
 *   <li>bear side mirrored</li>
 * </ul>
 *
 * <p>The first classified value is compared against a baseline of zero. Bars without sufficient
 * data are labelled consolidation and leave the machine untouched.</p>
 */
public class CycleClassifier {

    private static final Logger log = LoggerFactory.getLogger(CycleClassifier.class);

    private final CycleThresholds thresholds;

    private Phase state = Phase.CONSOLIDATION;
    private double previousValue = Double.NaN;
    private PhaseStreak streak;

    public CycleClassifier(CycleThresholds thresholds) {
        this.thresholds = thresholds;
    }

    /**
     * Classify a bar from its indicator snapshot.
     */
    public Classification classify(int barIndex, Bar bar, SignalSnapshot snapshot) {
        double value = snapshot.ready() ? snapshot.trendValue() : Double.NaN;
        return advance(barIndex, bar.timestamp(), bar.close(), value);
    }

    /**
     * Advance the machine by one bar. A NaN or infinite trend value means insufficient data.
     */
    public Classification advance(int barIndex, long timestamp, double price, double trendValue) {
        if (!Double.isFinite(trendValue)) {
            if (streak == null) {
                streak = PhaseStreak.start(Phase.CONSOLIDATION, barIndex, timestamp, price, Double.NaN);
            }
            return new Classification(barIndex, timestamp, Phase.CONSOLIDATION, false, false, trendValue, streak);
        }

        double prev = Double.isNaN(previousValue) ? 0.0 : previousValue;
        Phase next = transition(state, trendValue, prev);
        previousValue = trendValue;

        if (next != state) {
            log.debug("Phase {} -> {} at bar {} (trend value {})", state, next, barIndex, trendValue);
            state = next;
            streak = PhaseStreak.start(next, barIndex, timestamp, price, trendValue);
        } else if (streak == null) {
            streak = PhaseStreak.start(next, barIndex, timestamp, price, trendValue);
        } else {
            streak = streak.observe(trendValue);
        }

        // Strong phases are only reachable through their warning phase
        return new Classification(barIndex, timestamp, state, state.isStrong(), true, trendValue, streak);
    }

    private Phase transition(Phase current, double v, double prev) {
        return switch (current) {
            case CONSOLIDATION -> {
                if (v > thresholds.bullWarning() && v > prev) {
                    yield Phase.BULL_WARNING;
                }
                if (v < thresholds.bearWarning() && v < prev) {
                    yield Phase.BEAR_WARNING;
                }
                yield Phase.CONSOLIDATION;
            }
            case BULL_WARNING -> {
                if (v > thresholds.bullStrong()) {
                    yield Phase.BULL_STRONG;
                }
                yield v <= thresholds.bullExit() ? Phase.CONSOLIDATION : Phase.BULL_WARNING;
            }
            case BULL_STRONG -> v <= thresholds.bullExit() ? Phase.CONSOLIDATION : Phase.BULL_STRONG;
            case BEAR_WARNING -> {
                if (v < thresholds.bearStrong()) {
                    yield Phase.BEAR_STRONG;
                }
                yield v >= thresholds.bearExit() ? Phase.CONSOLIDATION : Phase.BEAR_WARNING;
            }
            case BEAR_STRONG -> v >= thresholds.bearExit() ? Phase.CONSOLIDATION : Phase.BEAR_STRONG;
        };
    }

    public PhaseStreak currentStreak() {
        return streak;
    }

    public CycleThresholds thresholds() {
        return thresholds;
    }
}
