package com.familybudget.budget.controller.dto;

import java.math.BigDecimal;

public record BalanceResponseDto(
        String month,
        BigDecimal income,
        BigDecimal expenses,
        BigDecimal balance,
        BigDecimal savingsRate
) {
}
