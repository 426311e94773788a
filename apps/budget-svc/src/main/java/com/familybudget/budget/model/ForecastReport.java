package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Map;

public record ForecastReport(
        boolean success,
        String message,
        Map<String, CategoryForecast> predictions,
        BigDecimal totalPredicted,
        YearMonth analysisFrom,
        YearMonth analysisTo
) {
    public static ForecastReport failure(String message) {
        return new ForecastReport(false, message, Map.of(), BigDecimal.ZERO, null, null);
    }

    public record CategoryForecast(
            BigDecimal predictedAmount,
            BigDecimal confidence,
            BigDecimal historicalAverage,
            Trend trend,
            int monthsAnalyzed
    ) {
    }

    public enum Trend {
        INCREASING("increasing"),
        DECREASING("decreasing");

        private final String label;

        Trend(String label) {
            this.label = label;
        }

        public String label() {
            return label;
        }
    }
}
