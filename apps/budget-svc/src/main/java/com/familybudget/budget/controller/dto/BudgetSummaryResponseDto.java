package com.familybudget.budget.controller.dto;

import java.math.BigDecimal;

public record BudgetSummaryResponseDto(
        String month,
        BigDecimal totalPlanned,
        BigDecimal totalActual,
        BigDecimal totalDifference,
        int overBudgetCount
) {
}
