package com.cycletrade.engine.result;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Why an instrument stopped before the end of the run.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record InstrumentFailure(
    String instrumentId,
    long timestamp,         // Timestamp of the offending bar
    int barIndex,
    String reason
) {}
