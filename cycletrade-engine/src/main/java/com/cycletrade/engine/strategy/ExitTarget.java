package com.cycletrade.engine.strategy;

import com.cycletrade.core.model.ExitReason;

import java.math.BigDecimal;

/**
 * Sell price for an open position and the rule that produced it.
 */
public record ExitTarget(BigDecimal price, ExitReason reason) {}
