package com.cycletrade.core.cycle;

import com.cycletrade.core.model.Phase;
import com.cycletrade.core.model.PhaseStreak;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Phase label for one bar.
 *
 * @param confirmed      the current cycle has reached its strong threshold
 * @param sufficientData false when the label was forced to consolidation for lack of history
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record Classification(
    int barIndex,
    long timestamp,
    Phase phase,
    boolean confirmed,
    boolean sufficientData,
    double trendValue,
    PhaseStreak streak
) {}
