package com.microfinance.domain.model;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Monetary helpers. Every derived amount is rounded to two decimals at the
 * point it is derived.
 */
public final class Money {

    public static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2);
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Money() {
    }

    public static BigDecimal round2(BigDecimal value) {
        return value == null ? ZERO : value.setScale(2, RoundingMode.HALF_UP);
    }

    public static BigDecimal orZero(BigDecimal value) {
        return value == null ? BigDecimal.ZERO : value;
    }

    public static boolean isPositive(BigDecimal value) {
        return value != null && value.signum() > 0;
    }

    /**
     * {@code round2(amount * percent / 100)}.
     */
    public static BigDecimal percentOf(BigDecimal amount, BigDecimal percent) {
        return round2(orZero(amount).multiply(orZero(percent)).divide(HUNDRED));
    }

    /**
     * {@code round2(amount * (1 + ratePercent / 100))}.
     */
    public static BigDecimal withInterest(BigDecimal amount, BigDecimal ratePercent) {
        BigDecimal base = orZero(amount);
        return round2(base.add(base.multiply(orZero(ratePercent)).divide(HUNDRED)));
    }

    /**
     * Even split rounded to cents; zero when there is nothing to split across.
     */
    public static BigDecimal divide(BigDecimal amount, int parts) {
        if (parts <= 0) {
            return ZERO;
        }
        return orZero(amount).divide(BigDecimal.valueOf(parts), 2, RoundingMode.HALF_UP);
    }
}
