package com.familybudget.budget.model;

import java.math.BigDecimal;

public record BudgetSummary(
        BigDecimal totalPlanned,
        BigDecimal totalActual,
        BigDecimal totalDifference,
        int overBudgetCount
) {
}
