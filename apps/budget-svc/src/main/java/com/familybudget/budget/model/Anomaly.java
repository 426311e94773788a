package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Optional;
import java.util.UUID;

public record Anomaly(
        UUID transactionId,
        String category,
        Optional<String> subcategory,
        BigDecimal amount,
        LocalDate date,
        String description,
        ExpectedRange expectedRange,
        BigDecimal deviation,
        Severity severity
) {
    public record ExpectedRange(BigDecimal lower, BigDecimal upper) {
    }

    public enum Severity {
        HIGH("High"),
        MEDIUM("Medium");

        private final String label;

        Severity(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
