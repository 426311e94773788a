package com.familybudget.budget.controller.dto;

import java.math.BigDecimal;
import java.util.List;

public record MonthlyTrendResponseDto(int months, String granularity, List<SeriesPointDto> series) {

    public record SeriesPointDto(String period, String category, String subcategory, BigDecimal totalAmount, int count) {
    }
}
