package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.UUID;

public record BudgetEntry(
        UUID ownerId,
        String category,
        String subcategory,
        BigDecimal plannedAmount,
        int month,
        int year
) {
    public BudgetEntry {
        if (ownerId == null) {
            throw new IllegalArgumentException("ownerId must be provided");
        }
        if (category == null || category.isBlank() || subcategory == null || subcategory.isBlank()) {
            throw new IllegalArgumentException("category and subcategory must be provided");
        }
        if (plannedAmount == null || plannedAmount.signum() < 0) {
            throw new IllegalArgumentException("plannedAmount must not be negative");
        }
        if (month < 1 || month > 12) {
            throw new IllegalArgumentException("month must be between 1 and 12");
        }
    }

    public YearMonth period() {
        return YearMonth.of(year, month);
    }

    public Key key() {
        return new Key(ownerId, category, subcategory, period());
    }

    /**
     * Uniqueness key of a budget line; a second entry with the same key replaces the first.
     */
    public record Key(UUID ownerId, String category, String subcategory, YearMonth period) {
    }
}
