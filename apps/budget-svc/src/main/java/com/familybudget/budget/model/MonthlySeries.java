package com.familybudget.budget.model;

import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Expense totals bucketed by month and category, ascending by period, then category, then subcategory.
 */
public record MonthlySeries(List<Point> points) {

    public static final Comparator<Point> ORDER = Comparator.comparing(Point::period)
            .thenComparing(Point::category)
            .thenComparing(point -> point.subcategory().orElse(""));

    public MonthlySeries {
        points = points == null ? List.of() : points.stream().sorted(ORDER).toList();
    }

    public static MonthlySeries empty() {
        return new MonthlySeries(List.of());
    }

    public Set<String> categories() {
        Set<String> categories = new LinkedHashSet<>();
        points.forEach(point -> categories.add(point.category()));
        return categories;
    }

    public record Point(YearMonth period, String category, Optional<String> subcategory, BigDecimal totalAmount, int count) {
    }
}
