package com.familybudget.budget.analytics;

import static org.assertj.core.api.Assertions.assertThat;

import com.familybudget.budget.model.BudgetEntry;
import com.familybudget.budget.model.BudgetSummary;
import com.familybudget.budget.model.ComparisonRow;
import com.familybudget.budget.model.MonthlySeries;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class BudgetComparatorTest {

    private static final YearMonth MARCH = YearMonth.of(2024, 3);

    private final BudgetComparator comparator = new BudgetComparator();
    private final UUID ownerId = UUID.randomUUID();

    @Test
    void overspentLineIsOverBudget() {
        List<ComparisonRow> rows = comparator.compare(
                List.of(budget("Food", "Groceries", "500")),
                actuals(actual("Food", "Groceries", "600")));

        assertThat(rows).singleElement().satisfies(row -> {
            assertThat(row.plannedAmount()).isEqualByComparingTo("500.00");
            assertThat(row.actualAmount()).isEqualByComparingTo("600.00");
            assertThat(row.difference()).isEqualByComparingTo("-100.00");
            assertThat(row.percentage()).isEqualByComparingTo("120.00");
            assertThat(row.status()).isEqualTo(ComparisonRow.Status.OVER_BUDGET);
            assertThat(row.status().label()).isEqualTo("Over Budget");
        });
    }

    @Test
    void spendingExactlyThePlanIsOnTrack() {
        List<ComparisonRow> rows = comparator.compare(
                List.of(budget("Food", "Groceries", "400")),
                actuals(actual("Food", "Groceries", "400")));

        assertThat(rows.get(0).status()).isEqualTo(ComparisonRow.Status.ON_TRACK);
        assertThat(rows.get(0).difference()).isEqualByComparingTo("0.00");
        assertThat(rows.get(0).percentage()).isEqualByComparingTo("100.00");
    }

    @Test
    void zeroPlanReportsZeroPercentage() {
        List<ComparisonRow> rows = comparator.compare(
                List.of(budget("Gifts", "Birthdays", "0")),
                actuals(actual("Gifts", "Birthdays", "45")));

        assertThat(rows.get(0).percentage()).isEqualByComparingTo("0.00");
        assertThat(rows.get(0).isOverBudget()).isTrue();
    }

    @Test
    void budgetDrivesTheRows() {
        List<ComparisonRow> rows = comparator.compare(
                List.of(budget("Transport", "Fuel", "150"), budget("Food", "Groceries", "500")),
                actuals(actual("Food", "Groceries", "120"), actual("Entertainment", "Cinema", "60")));

        assertThat(rows).extracting(ComparisonRow::category).containsExactly("Food", "Transport");
        assertThat(rows.get(1).actualAmount()).isEqualByComparingTo("0.00");
        assertThat(rows.get(1).percentage()).isEqualByComparingTo("0.00");
        assertThat(rows.get(1).status()).isEqualTo(ComparisonRow.Status.ON_TRACK);
    }

    @Test
    void noBudgetYieldsNoRows() {
        assertThat(comparator.compare(List.of(), actuals(actual("Food", "Groceries", "10")))).isEmpty();
    }

    @Test
    void rollupSumsBudgetedSubcategoriesPerCategory() {
        List<BudgetEntry> budget = List.of(
                budget("Food", "Groceries", "400"),
                budget("Food", "Dining", "100"),
                budget("Transport", "Fuel", "200")
        );
        MonthlySeries actuals = actuals(
                actual("Food", "Groceries", "300"),
                actual("Food", "Dining", "250"),
                actual("Food", "Snacks", "80"),
                actual("Transport", "Fuel", "150")
        );

        List<ComparisonRow> rows = comparator.rollupByCategory(budget, actuals);

        assertThat(rows).hasSize(2);
        ComparisonRow food = rows.get(0);
        assertThat(food.category()).isEqualTo("Food");
        assertThat(food.subcategory()).isEmpty();
        assertThat(food.plannedAmount()).isEqualByComparingTo("500.00");
        assertThat(food.actualAmount()).isEqualByComparingTo("550.00");
        assertThat(food.status()).isEqualTo(ComparisonRow.Status.OVER_BUDGET);
        assertThat(rows.get(1).status()).isEqualTo(ComparisonRow.Status.ON_TRACK);
    }

    @Test
    void summaryTotalsRows() {
        List<ComparisonRow> rows = comparator.compare(
                List.of(budget("Food", "Groceries", "500"), budget("Transport", "Fuel", "200")),
                actuals(actual("Food", "Groceries", "600"), actual("Transport", "Fuel", "50")));

        BudgetSummary summary = comparator.summarize(rows);

        assertThat(summary.totalPlanned()).isEqualByComparingTo("700.00");
        assertThat(summary.totalActual()).isEqualByComparingTo("650.00");
        assertThat(summary.totalDifference()).isEqualByComparingTo("50.00");
        assertThat(summary.overBudgetCount()).isEqualTo(1);
    }

    private BudgetEntry budget(String category, String subcategory, String planned) {
        return new BudgetEntry(ownerId, category, subcategory, new BigDecimal(planned), MARCH.getMonthValue(), MARCH.getYear());
    }

    private static MonthlySeries.Point actual(String category, String subcategory, String amount) {
        return new MonthlySeries.Point(MARCH, category, Optional.of(subcategory), new BigDecimal(amount), 1);
    }

    private static MonthlySeries actuals(MonthlySeries.Point... points) {
        return new MonthlySeries(List.of(points));
    }
}
