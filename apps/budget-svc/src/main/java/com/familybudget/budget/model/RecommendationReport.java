package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.util.List;

public record RecommendationReport(
        boolean success,
        String message,
        List<Recommendation> recommendations,
        BigDecimal totalPotentialSavings,
        BigDecimal currentSavingsRate
) {
    public static RecommendationReport failure(String message) {
        return new RecommendationReport(false, message, List.of(), BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
