package com.familybudget.budget.analytics;

import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Zero-denominator guards and money rounding shared by the analytics components.
 * A zero denominator resolves to the supplied default; NaN and infinity never escape.
 */
final class Ratios {

    static final BigDecimal ZERO = BigDecimal.ZERO.setScale(2, RoundingMode.HALF_UP);
    static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Ratios() {
    }

    static BigDecimal money(BigDecimal amount) {
        return amount == null ? ZERO : amount.setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal money(double amount) {
        if (Double.isNaN(amount) || Double.isInfinite(amount)) {
            return ZERO;
        }
        return BigDecimal.valueOf(amount).setScale(2, RoundingMode.HALF_UP);
    }

    static BigDecimal percentOf(BigDecimal part, BigDecimal whole) {
        if (whole == null || whole.signum() == 0) {
            return ZERO;
        }
        return part.multiply(HUNDRED).divide(whole, 2, RoundingMode.HALF_UP);
    }

    static double divideOrDefault(double numerator, double denominator, double fallback) {
        if (denominator == 0d) {
            return fallback;
        }
        double result = numerator / denominator;
        return Double.isNaN(result) || Double.isInfinite(result) ? fallback : result;
    }

    static double clamp(double value, double min, double max) {
        return Math.min(max, Math.max(min, value));
    }
}
