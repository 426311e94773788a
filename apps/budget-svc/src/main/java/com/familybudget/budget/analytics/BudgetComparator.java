package com.familybudget.budget.analytics;

import com.familybudget.budget.model.BudgetEntry;
import com.familybudget.budget.model.BudgetSummary;
import com.familybudget.budget.model.ComparisonRow;
import com.familybudget.budget.model.MonthlySeries;
import java.math.BigDecimal;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

/**
 * Budget versus actual spending for one month. The budget drives the result: expenses in lines
 * without a planned amount are left out, budgeted lines without expenses report an actual of zero.
 */
@Component
public class BudgetComparator {

    /**
     * @param actuals subcategory-level expense totals for the budget's month
     */
    public List<ComparisonRow> compare(List<BudgetEntry> budget, MonthlySeries actuals) {
        if (budget == null || budget.isEmpty()) {
            return List.of();
        }
        Map<LineKey, BigDecimal> actualByLine = new HashMap<>();
        for (MonthlySeries.Point point : actuals.points()) {
            LineKey key = new LineKey(point.category(), point.subcategory().orElse(null));
            actualByLine.merge(key, point.totalAmount(), BigDecimal::add);
        }
        return budget.stream()
                .sorted(Comparator.comparing(BudgetEntry::category).thenComparing(BudgetEntry::subcategory))
                .map(entry -> row(
                        entry.category(),
                        Optional.of(entry.subcategory()),
                        entry.plannedAmount(),
                        actualByLine.getOrDefault(new LineKey(entry.category(), entry.subcategory()), BigDecimal.ZERO)
                ))
                .toList();
    }

    /**
     * Category-level variant: planned and actual amounts of the budgeted subcategories are summed per category.
     */
    public List<ComparisonRow> rollupByCategory(List<BudgetEntry> budget, MonthlySeries actuals) {
        Map<String, List<ComparisonRow>> byCategory = compare(budget, actuals).stream()
                .collect(Collectors.groupingBy(ComparisonRow::category, LinkedHashMap::new, Collectors.toList()));
        return byCategory.entrySet().stream()
                .map(entry -> row(
                        entry.getKey(),
                        Optional.empty(),
                        entry.getValue().stream().map(ComparisonRow::plannedAmount).reduce(BigDecimal.ZERO, BigDecimal::add),
                        entry.getValue().stream().map(ComparisonRow::actualAmount).reduce(BigDecimal.ZERO, BigDecimal::add)
                ))
                .toList();
    }

    public BudgetSummary summarize(List<ComparisonRow> rows) {
        BigDecimal planned = rows.stream().map(ComparisonRow::plannedAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        BigDecimal actual = rows.stream().map(ComparisonRow::actualAmount).reduce(BigDecimal.ZERO, BigDecimal::add);
        int overBudget = (int) rows.stream().filter(ComparisonRow::isOverBudget).count();
        return new BudgetSummary(Ratios.money(planned), Ratios.money(actual), Ratios.money(planned.subtract(actual)), overBudget);
    }

    static ComparisonRow row(String category, Optional<String> subcategory, BigDecimal planned, BigDecimal actual) {
        // equality is on track
        ComparisonRow.Status status = actual.compareTo(planned) > 0
                ? ComparisonRow.Status.OVER_BUDGET
                : ComparisonRow.Status.ON_TRACK;
        return new ComparisonRow(
                category,
                subcategory,
                Ratios.money(planned),
                Ratios.money(actual),
                Ratios.money(planned.subtract(actual)),
                Ratios.percentOf(actual, planned),
                status
        );
    }

    private record LineKey(String category, String subcategory) {
    }
}
