package com.familybudget.budget.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record RecommendationsResponseDto(
        boolean success,
        String message,
        List<RecommendationDto> recommendations,
        BigDecimal totalPotentialSavings,
        BigDecimal currentSavingsRate
) {
    public record RecommendationDto(
            String category,
            String subcategory,
            String type,
            String priority,
            String message,
            String suggestion,
            BigDecimal suggestedAmount
    ) {
    }
}
