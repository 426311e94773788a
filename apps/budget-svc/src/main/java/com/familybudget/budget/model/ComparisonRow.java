package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.util.Optional;

public record ComparisonRow(
        String category,
        Optional<String> subcategory,
        BigDecimal plannedAmount,
        BigDecimal actualAmount,
        BigDecimal difference,
        BigDecimal percentage,
        Status status
) {
    public enum Status {
        OVER_BUDGET("Over Budget"),
        ON_TRACK("On Track");

        private final String label;

        Status(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public boolean isOverBudget() {
        return status == Status.OVER_BUDGET;
    }
}
