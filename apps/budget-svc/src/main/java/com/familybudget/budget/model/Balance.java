package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.time.YearMonth;

public record Balance(
        YearMonth month,
        BigDecimal incomeTotal,
        BigDecimal expenseTotal,
        BigDecimal balance,
        BigDecimal savingsRate
) {
}
