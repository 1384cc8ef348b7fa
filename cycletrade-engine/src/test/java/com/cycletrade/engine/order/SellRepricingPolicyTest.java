package com.cycletrade.engine.order;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.junit.jupiter.api.Assertions.*;

class SellRepricingPolicyTest {

    private static final BigDecimal LOW = new BigDecimal("105");
    private static final BigDecimal HIGH = new BigDecimal("110");

    @Test
    @DisplayName("Follow takes the computed target in both directions")
    void follow() {
        assertEquals(LOW, SellRepricingPolicy.FOLLOW.reprice(HIGH, LOW));
        assertEquals(HIGH, SellRepricingPolicy.FOLLOW.reprice(LOW, HIGH));
        assertEquals(LOW, SellRepricingPolicy.FOLLOW.reprice(null, LOW));
    }

    @Test
    @DisplayName("Non-decreasing keeps the previous target when the new one is lower")
    void nonDecreasing() {
        assertEquals(HIGH, SellRepricingPolicy.NON_DECREASING.reprice(HIGH, LOW));
        assertEquals(HIGH, SellRepricingPolicy.NON_DECREASING.reprice(LOW, HIGH));
        assertEquals(LOW, SellRepricingPolicy.NON_DECREASING.reprice(null, LOW));
    }

    @Test
    @DisplayName("Keys parse case-insensitively")
    void fromKey() {
        assertEquals(SellRepricingPolicy.NON_DECREASING, SellRepricingPolicy.fromKey("non_decreasing"));
        assertEquals(SellRepricingPolicy.FOLLOW, SellRepricingPolicy.fromKey("FOLLOW"));
        assertEquals(SellRepricingPolicy.FOLLOW, SellRepricingPolicy.fromKey(null));
        assertThrows(IllegalArgumentException.class, () -> SellRepricingPolicy.fromKey("trailing"));
    }
}
