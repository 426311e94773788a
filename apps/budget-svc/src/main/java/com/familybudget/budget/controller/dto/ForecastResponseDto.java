package com.familybudget.budget.controller.dto;

import java.math.BigDecimal;
import java.util.Map;

public record ForecastResponseDto(
        boolean success,
        String message,
        Map<String, CategoryPrediction> predictions,
        BigDecimal totalPredicted,
        AnalysisPeriod analysisPeriod
) {
    public record CategoryPrediction(
            BigDecimal predictedAmount,
            BigDecimal confidence,
            BigDecimal historicalAverage,
            String trend,
            int monthsAnalyzed
    ) {
    }

    public record AnalysisPeriod(String from, String to) {
    }
}
