package com.familybudget.budget.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record BudgetComparisonResponseDto(String month, boolean rollup, List<Row> rows) {

    public record Row(
            String category,
            String subcategory,
            BigDecimal plannedAmount,
            BigDecimal actualAmount,
            BigDecimal difference,
            BigDecimal percentage,
            String status
    ) {
    }
}
