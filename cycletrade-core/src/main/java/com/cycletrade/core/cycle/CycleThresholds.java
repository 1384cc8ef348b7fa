package com.cycletrade.core.cycle;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Trend value levels driving the cycle state machine.
 * Bull levels must satisfy {@code bullExit < bullWarning < bullStrong}, bear levels the mirror.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CycleThresholds(
    double bullWarning,
    double bullStrong,
    double bullExit,
    double bearWarning,
    double bearStrong,
    double bearExit
) {
    public CycleThresholds {
        if (!(bullExit < bullWarning && bullWarning < bullStrong)) {
            throw new IllegalArgumentException(String.format(
                "Bull thresholds must increase: exit=%s warning=%s strong=%s", bullExit, bullWarning, bullStrong));
        }
        if (!(bearExit > bearWarning && bearWarning > bearStrong)) {
            throw new IllegalArgumentException(String.format(
                "Bear thresholds must decrease: exit=%s warning=%s strong=%s", bearExit, bearWarning, bearStrong));
        }
    }

    public static CycleThresholds defaults() {
        return new CycleThresholds(600, 1000, 0, -600, -1000, 0);
    }
}
