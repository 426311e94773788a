package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.util.Optional;

public record Recommendation(
        String category,
        Optional<String> subcategory,
        Kind kind,
        Priority priority,
        String message,
        String suggestion,
        BigDecimal suggestedAmount
) {
    public enum Kind {
        OVER_BUDGET("Budget Alert"),
        OPTIMIZATION("Optimization Opportunity"),
        SAVINGS_GOAL("Savings Goal");

        private final String label;

        Kind(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }

    public enum Priority {
        HIGH("High"),
        MEDIUM("Medium"),
        LOW("Low");

        private final String label;

        Priority(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
