package com.familybudget.budget.analytics;

import com.familybudget.budget.config.FamilyBudgetProperties;
import com.familybudget.budget.model.Balance;
import com.familybudget.budget.model.ComparisonRow;
import com.familybudget.budget.model.Recommendation;
import com.familybudget.budget.model.RecommendationReport;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

/**
 * Savings suggestions derived from a month's budget comparison and balance. Three independent passes
 * (over-budget alerts, optimization of the largest discretionary lines, savings-rate goal) are
 * concatenated without deduplication.
 */
@Component
public class RecommendationEngine {

    static final int OPTIMIZATION_CANDIDATES = 3;
    private static final BigDecimal HALF = new BigDecimal("0.5");
    private static final BigDecimal TWO = BigDecimal.valueOf(2);
    private static final BigDecimal OPTIMIZATION_SHARE = new BigDecimal("0.15");

    private final Set<String> essentialCategories;
    private final BigDecimal savingsRateTarget;

    @Autowired
    public RecommendationEngine(FamilyBudgetProperties properties) {
        this(properties.analytics().essentialCategorySet(), properties.analytics().savingsRateTarget());
    }

    public RecommendationEngine(Set<String> essentialCategories, BigDecimal savingsRateTarget) {
        this.essentialCategories = Set.copyOf(essentialCategories);
        this.savingsRateTarget = savingsRateTarget;
    }

    /**
     * @throws NoBudgetConfiguredException when there are no comparison rows for the month
     */
    public RecommendationReport recommend(List<ComparisonRow> rows, Balance balance) {
        if (rows == null || rows.isEmpty()) {
            throw new NoBudgetConfiguredException("No budget configured for " + balance.month()
                    + ". Set a budget first to get recommendations.");
        }
        List<Recommendation> recommendations = new ArrayList<>();
        recommendations.addAll(overBudgetAlerts(rows));
        recommendations.addAll(optimizationOpportunities(rows));
        savingsGoal(balance).ifPresent(recommendations::add);

        BigDecimal total = recommendations.stream()
                .map(Recommendation::suggestedAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        return new RecommendationReport(
                true,
                "Generated " + recommendations.size() + " recommendations",
                List.copyOf(recommendations),
                Ratios.money(total),
                balance.savingsRate()
        );
    }

    List<Recommendation> overBudgetAlerts(List<ComparisonRow> rows) {
        List<Recommendation> alerts = new ArrayList<>();
        for (ComparisonRow row : rows) {
            BigDecimal overspend = row.actualAmount().subtract(row.plannedAmount());
            if (overspend.signum() <= 0) {
                continue;
            }
            BigDecimal suggested = overspend.divide(TWO, 2, RoundingMode.HALF_UP);
            // anything spent against a zero plan is entirely unplanned
            boolean severe = row.plannedAmount().signum() == 0
                    || overspend.compareTo(row.plannedAmount().multiply(HALF)) > 0;
            alerts.add(new Recommendation(
                    row.category(),
                    row.subcategory(),
                    Recommendation.Kind.OVER_BUDGET,
                    severe ? Recommendation.Priority.HIGH : Recommendation.Priority.MEDIUM,
                    "Over budget in " + label(row) + " by $" + Ratios.money(overspend),
                    "Try to reduce spending by $" + suggested + " next month",
                    suggested
            ));
        }
        return alerts;
    }

    List<Recommendation> optimizationOpportunities(List<ComparisonRow> rows) {
        return rows.stream()
                .filter(row -> !essentialCategories.contains(row.category()))
                .sorted(Comparator.comparing(ComparisonRow::actualAmount).reversed())
                .limit(OPTIMIZATION_CANDIDATES)
                .map(row -> {
                    BigDecimal suggested = Ratios.money(row.actualAmount().multiply(OPTIMIZATION_SHARE));
                    return new Recommendation(
                            row.category(),
                            row.subcategory(),
                            Recommendation.Kind.OPTIMIZATION,
                            Recommendation.Priority.MEDIUM,
                            label(row) + " is one of your largest expenses ($" + row.actualAmount() + ")",
                            "Cutting it by 15% would save $" + suggested + " per month",
                            suggested
                    );
                })
                .toList();
    }

    Optional<Recommendation> savingsGoal(Balance balance) {
        if (!belowSavingsTarget(balance)) {
            return Optional.empty();
        }
        BigDecimal targetSavings = balance.incomeTotal().multiply(savingsRateTarget).divide(Ratios.HUNDRED, 2, RoundingMode.HALF_UP);
        BigDecimal suggested = Ratios.money(targetSavings.subtract(balance.balance()).max(BigDecimal.ZERO));
        return Optional.of(new Recommendation(
                "Savings",
                Optional.empty(),
                Recommendation.Kind.SAVINGS_GOAL,
                Recommendation.Priority.HIGH,
                "Your savings rate is " + balance.savingsRate() + "%, below the "
                        + savingsRateTarget.stripTrailingZeros().toPlainString() + "% target",
                "Set aside an extra $" + suggested + " per month to reach the target",
                suggested
        ));
    }

    /**
     * Exact rate against the target; {@link Balance#savingsRate()} is rounded for display.
     */
    private boolean belowSavingsTarget(Balance balance) {
        BigDecimal income = balance.incomeTotal();
        if (income.signum() == 0) {
            return BigDecimal.ZERO.compareTo(savingsRateTarget) < 0;
        }
        return balance.balance().multiply(Ratios.HUNDRED).compareTo(savingsRateTarget.multiply(income)) < 0;
    }

    private static String label(ComparisonRow row) {
        return row.subcategory().map(sub -> row.category() + " - " + sub).orElse(row.category());
    }
}
