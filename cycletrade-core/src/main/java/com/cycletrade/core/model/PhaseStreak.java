package com.cycletrade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * The current uninterrupted run of one phase.
 * Replaced whenever the phase changes; the extremum is null during consolidation.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PhaseStreak(
    Phase phase,
    int startBarIndex,
    long startTimestamp,
    double startPrice,
    Double extremumValue    // Highest trend value for bull phases, lowest for bear phases
) {
    /**
     * Start a new streak on the given bar.
     */
    public static PhaseStreak start(Phase phase, int barIndex, long timestamp, double price, double trendValue) {
        Double extremum = phase == Phase.CONSOLIDATION ? null : trendValue;
        return new PhaseStreak(phase, barIndex, timestamp, price, extremum);
    }

    /**
     * Same streak with the extremum moved if the trend value is more extreme.
     */
    public PhaseStreak observe(double trendValue) {
        if (extremumValue == null || Double.isNaN(trendValue)) {
            return this;
        }
        boolean better = phase.isBullish() ? trendValue > extremumValue : trendValue < extremumValue;
        return better ? new PhaseStreak(phase, startBarIndex, startTimestamp, startPrice, trendValue) : this;
    }

    /**
     * Number of bars the streak has lasted, counting both ends.
     */
    @JsonIgnore
    public int durationBars(int currentBarIndex) {
        return currentBarIndex - startBarIndex + 1;
    }
}
