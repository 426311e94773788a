package com.familybudget.budget.analytics;

import java.time.LocalDate;
import java.time.YearMonth;

/**
 * Inclusive date range the analytics read transactions from.
 */
public record AggregationWindow(LocalDate from, LocalDate to) {

    public AggregationWindow {
        if (from == null || to == null) {
            throw new IllegalArgumentException("window bounds must be provided");
        }
        if (to.isBefore(from)) {
            throw new IllegalArgumentException("window end must not precede its start");
        }
    }

    public static AggregationWindow ofMonth(YearMonth month) {
        return new AggregationWindow(month.atDay(1), month.atEndOfMonth());
    }

    /**
     * The {@code months} calendar months ending with the month of {@code today}, cut off at {@code today}.
     */
    public static AggregationWindow trailingMonths(int months, LocalDate today) {
        if (months < 1) {
            throw new IllegalArgumentException("months must be positive");
        }
        LocalDate start = YearMonth.from(today).minusMonths(months - 1L).atDay(1);
        return new AggregationWindow(start, today);
    }

    /**
     * Date-based lookback: the same day {@code months} months ago up to {@code today}.
     */
    public static AggregationWindow lookback(int months, LocalDate today) {
        if (months < 1) {
            throw new IllegalArgumentException("months must be positive");
        }
        return new AggregationWindow(today.minusMonths(months), today);
    }

    public boolean contains(LocalDate date) {
        return !date.isBefore(from) && !date.isAfter(to);
    }
}
