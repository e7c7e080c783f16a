package com.flagship.lease_ledger.calculation;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.Collection;
import java.util.Objects;

/**
 * The single rounding primitive for every monetary value the engine produces.
 *
 * Amounts are rounded to two decimals, half away from zero (BigDecimal HALF_UP), so
 * 0.005 becomes 0.01 and -0.005 becomes -0.01. All arithmetic is decimal; no binary
 * floating point is involved anywhere a money value is computed.
 */
public final class MoneyRounding {

    public static final int SCALE = 2;
    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(SCALE);

    private MoneyRounding() {
    }

    /**
     * Rounds to two decimals, half away from zero. A null amount is treated as zero.
     */
    public static BigDecimal round2(BigDecimal amount) {
        if (amount == null) {
            return ZERO;
        }
        return amount.setScale(SCALE, RoundingMode.HALF_UP);
    }

    /**
     * round2(amount * percentage / 100)
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percentage) {
        Objects.requireNonNull(amount, "amount");
        Objects.requireNonNull(percentage, "percentage");
        return round2(amount.multiply(percentage).movePointLeft(2));
    }

    /**
     * Sum of the given amounts, rounded. Nulls count as zero.
     */
    public static BigDecimal sum(Collection<BigDecimal> amounts) {
        return round2(amounts.stream()
                .filter(Objects::nonNull)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    public static boolean isNegative(BigDecimal amount) {
        return amount != null && amount.signum() < 0;
    }
}
