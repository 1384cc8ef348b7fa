package com.cycletrade.core.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

import java.math.BigDecimal;

/**
 * Portfolio state after all instruments processed one timestamp.
 * Equity marks open positions at their last close; total is the capital pool total.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record EquityPoint(
    long timestamp,
    BigDecimal equity,
    BigDecimal available,
    BigDecimal frozen,
    BigDecimal total,
    BigDecimal holdingsValue,
    int openPositions
) {}
