package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

public record Transaction(
        UUID id,
        UUID ownerId,
        Type type,
        String category,
        Optional<String> subcategory,
        BigDecimal amount,
        LocalDate occurredOn,
        String description,
        List<String> tags
) {
    public enum Type {
        EXPENSE,
        INCOME
    }

    public Transaction {
        if (id == null || ownerId == null || type == null) {
            throw new IllegalArgumentException("id, ownerId and type must be provided");
        }
        if (category == null || category.isBlank()) {
            throw new IllegalArgumentException("category must be provided");
        }
        if (amount == null || amount.signum() <= 0) {
            throw new IllegalArgumentException("amount must be positive");
        }
        if (occurredOn == null) {
            throw new IllegalArgumentException("occurredOn must be provided");
        }
        // income rows carry their source in category and never a subcategory
        subcategory = type == Type.INCOME || subcategory == null ? Optional.empty() : subcategory;
        description = description == null ? "" : description;
        tags = tags == null ? List.of() : List.copyOf(tags);
    }

    public static Transaction expense(UUID ownerId, String category, String subcategory, BigDecimal amount, LocalDate occurredOn, String description) {
        return new Transaction(UUID.randomUUID(), ownerId, Type.EXPENSE, category, Optional.ofNullable(subcategory),
                amount, occurredOn, description, List.of());
    }

    public static Transaction income(UUID ownerId, String source, BigDecimal amount, LocalDate occurredOn, String description) {
        return new Transaction(UUID.randomUUID(), ownerId, Type.INCOME, source, Optional.empty(),
                amount, occurredOn, description, List.of());
    }

    public boolean isExpense() {
        return type == Type.EXPENSE;
    }

    public YearMonth period() {
        return YearMonth.from(occurredOn);
    }
}
