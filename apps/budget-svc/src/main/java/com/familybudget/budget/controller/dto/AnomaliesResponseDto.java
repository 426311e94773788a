package com.familybudget.budget.controller.dto;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;

public record AnomaliesResponseDto(
        boolean success,
        int anomaliesFound,
        List<AnomalyDto> anomalies,
        String message
) {
    public record AnomalyDto(
            String transactionId,
            String category,
            String subcategory,
            BigDecimal amount,
            LocalDate date,
            String description,
            ExpectedRange expectedRange,
            BigDecimal deviation,
            String severity
    ) {
    }

    public record ExpectedRange(BigDecimal lower, BigDecimal upper) {
    }
}
