package com.flagship.lease_ledger.calculation;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;

import static org.junit.jupiter.api.Assertions.*;

class MoneyRoundingTest {

    @Test
    @DisplayName("Halves round away from zero")
    void halvesRoundAwayFromZero() {
        assertEquals(new BigDecimal("0.01"), MoneyRounding.round2(new BigDecimal("0.005")));
        assertEquals(new BigDecimal("-0.01"), MoneyRounding.round2(new BigDecimal("-0.005")));
        assertEquals(new BigDecimal("2.68"), MoneyRounding.round2(new BigDecimal("2.675")));
        assertEquals(new BigDecimal("2.67"), MoneyRounding.round2(new BigDecimal("2.6749")));
    }

    @Test
    @DisplayName("Null rounds to zero with two decimals")
    void nullIsZero() {
        assertEquals(new BigDecimal("0.00"), MoneyRounding.round2(null));
    }

    @Test
    @DisplayName("Percentage is computed in decimal and rounded once")
    void percentOf() {
        assertEquals(new BigDecimal("600.00"), MoneyRounding.percentOf(new BigDecimal("12000.00"), new BigDecimal("5")));
        assertEquals(new BigDecimal("0.17"), MoneyRounding.percentOf(new BigDecimal("3.33"), new BigDecimal("5")));
    }

    @Test
    @DisplayName("Sum ignores nulls and rounds the result")
    void sumIgnoresNulls() {
        assertEquals(new BigDecimal("30.01"),
                MoneyRounding.sum(Arrays.asList(new BigDecimal("10.005"), null, new BigDecimal("20"))));
    }
}
