package com.familybudget.budget.analytics;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.familybudget.budget.config.FamilyBudgetProperties;
import com.familybudget.budget.model.AnomalyReport;
import com.familybudget.budget.model.Balance;
import com.familybudget.budget.model.BudgetEntry;
import com.familybudget.budget.model.BudgetSummary;
import com.familybudget.budget.model.ComparisonRow;
import com.familybudget.budget.model.ForecastReport;
import com.familybudget.budget.model.MonthlySeries;
import com.familybudget.budget.model.RecommendationReport;
import com.familybudget.budget.model.Transaction;
import com.familybudget.budget.repository.BudgetRepository;
import com.familybudget.budget.repository.TransactionRepository;
import com.familybudget.budget.security.AuthenticatedUserProvider;
import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.YearMonth;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;

class AnalyticsServiceTest {

    private static final YearMonth MARCH = YearMonth.of(2024, 3);

    @Mock
    private TransactionRepository transactionRepository;

    @Mock
    private BudgetRepository budgetRepository;

    @Mock
    private AuthenticatedUserProvider authenticatedUserProvider;

    private AnalyticsService analyticsService;

    private final UUID ownerId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        FamilyBudgetProperties properties = new FamilyBudgetProperties(null, null);
        analyticsService = new AnalyticsService(
                transactionRepository,
                budgetRepository,
                authenticatedUserProvider,
                new TransactionAggregator(),
                new ExpenseForecaster(),
                new AnomalyDetectionService(),
                new BudgetComparator(),
                new BalanceCalculator(),
                new RecommendationEngine(properties),
                properties,
                Clock.fixed(Instant.parse("2024-06-15T10:00:00Z"), ZoneOffset.UTC)
        );
        when(authenticatedUserProvider.requireCurrentOwnerId()).thenReturn(ownerId);
    }

    @Test
    void forecastReadsTrailingSixMonths() {
        when(transactionRepository.findByOwnerAndRange(ownerId, LocalDate.parse("2024-01-01"), LocalDate.parse("2024-06-15")))
                .thenReturn(List.of(
                        expense("Food", "Groceries", "1000", "2024-03-10"),
                        expense("Food", "Groceries", "1100", "2024-04-10"),
                        expense("Food", "Groceries", "1200", "2024-05-10"),
                        Transaction.income(ownerId, "Salary", new BigDecimal("4000"), LocalDate.parse("2024-05-01"), "payroll")
                ));

        ForecastReport report = analyticsService.forecast(Optional.empty());

        assertThat(report.success()).isTrue();
        assertThat(report.predictions()).containsOnlyKeys("Food");
        assertThat(report.predictions().get("Food").predictedAmount()).isEqualByComparingTo("1200.00");
        assertThat(report.analysisFrom()).isEqualTo(YearMonth.of(2024, 3));
        assertThat(report.analysisTo()).isEqualTo(YearMonth.of(2024, 5));
        verify(authenticatedUserProvider).requireCurrentOwnerId();
    }

    @Test
    void forecastWithShortHistoryIsFailureResult() {
        when(transactionRepository.findByOwnerAndRange(ownerId, LocalDate.parse("2024-01-01"), LocalDate.parse("2024-06-15")))
                .thenReturn(List.of(expense("Food", "Groceries", "1000", "2024-05-10")));

        ForecastReport report = analyticsService.forecast(Optional.of("Food"));

        assertThat(report.success()).isFalse();
        assertThat(report.message()).contains("at least 3 months");
        assertThat(report.predictions()).isEmpty();
        assertThat(report.totalPredicted()).isEqualByComparingTo("0");
    }

    @Test
    void anomaliesUseConfiguredThresholdAndLookback() {
        List<Transaction> transactions = new ArrayList<>();
        for (int i = 0; i < 10; i++) {
            transactions.add(expense("Food", "Groceries", "100", LocalDate.parse("2024-04-01").plusDays(i).toString()));
        }
        transactions.add(expense("Food", "Groceries", "1200", "2024-05-20"));
        when(transactionRepository.findByOwnerAndRange(ownerId, LocalDate.parse("2024-03-15"), LocalDate.parse("2024-06-15")))
                .thenReturn(transactions);

        AnomalyReport report = analyticsService.detectAnomalies(Optional.empty(), Optional.empty());

        assertThat(report.success()).isTrue();
        assertThat(report.anomalies()).singleElement()
                .satisfies(anomaly -> assertThat(anomaly.amount()).isEqualByComparingTo("1200.00"));
    }

    @Test
    void anomaliesWithoutExpensesIsFailureResult() {
        AnomalyReport report = analyticsService.detectAnomalies(Optional.of(2.5d), Optional.of("Food"));

        assertThat(report.success()).isFalse();
        assertThat(report.message()).isEqualTo("Not enough transaction data for anomaly detection");
    }

    @Test
    void compareBudgetRollsUpWhenAsked() {
        stubMarch();

        List<ComparisonRow> detailed = analyticsService.compareBudget(MARCH, false);
        List<ComparisonRow> rolledUp = analyticsService.compareBudget(MARCH, true);

        assertThat(detailed).hasSize(2);
        assertThat(rolledUp).singleElement().satisfies(row -> {
            assertThat(row.category()).isEqualTo("Food");
            assertThat(row.plannedAmount()).isEqualByComparingTo("600.00");
            assertThat(row.actualAmount()).isEqualByComparingTo("700.00");
            assertThat(row.status()).isEqualTo(ComparisonRow.Status.OVER_BUDGET);
        });
    }

    @Test
    void compareBudgetWithoutBudgetSkipsTransactions() {
        List<ComparisonRow> rows = analyticsService.compareBudget(MARCH, false);

        assertThat(rows).isEmpty();
        verify(transactionRepository, never()).findByOwnerAndRange(ownerId, MARCH.atDay(1), MARCH.atEndOfMonth());
    }

    @Test
    void budgetSummaryCountsOverBudgetLines() {
        stubMarch();

        BudgetSummary summary = analyticsService.budgetSummary(MARCH);

        assertThat(summary.totalPlanned()).isEqualByComparingTo("600.00");
        assertThat(summary.totalActual()).isEqualByComparingTo("700.00");
        assertThat(summary.overBudgetCount()).isEqualTo(1);
    }

    @Test
    void balanceCombinesIncomeAndExpenses() {
        stubMarch();

        Balance balance = analyticsService.balance(MARCH);

        assertThat(balance.incomeTotal()).isEqualByComparingTo("2500.00");
        assertThat(balance.expenseTotal()).isEqualByComparingTo("700.00");
        assertThat(balance.balance()).isEqualByComparingTo("1800.00");
        assertThat(balance.savingsRate()).isEqualByComparingTo("72.00");
    }

    @Test
    void recommendationsForBudgetedMonth() {
        stubMarch();

        RecommendationReport report = analyticsService.recommend(MARCH);

        assertThat(report.success()).isTrue();
        // groceries alert plus two optimization lines; savings rate is above target
        assertThat(report.recommendations()).hasSize(3);
        assertThat(report.currentSavingsRate()).isEqualByComparingTo("72.00");
    }

    @Test
    void recommendationsWithoutBudgetIsFailureResult() {
        RecommendationReport report = analyticsService.recommend(MARCH);

        assertThat(report.success()).isFalse();
        assertThat(report.message()).isEqualTo("No budget configured for 2024-03. Set a budget first to get recommendations.");
        assertThat(report.recommendations()).isEmpty();
    }

    @Test
    void monthlyTrendAggregatesByCategory() {
        when(transactionRepository.findByOwnerAndRange(ownerId, LocalDate.parse("2024-04-01"), LocalDate.parse("2024-06-15")))
                .thenReturn(List.of(
                        expense("Food", "Groceries", "100", "2024-04-02"),
                        expense("Food", "Dining", "50", "2024-04-12"),
                        expense("Transport", "Fuel", "70", "2024-05-03")
                ));

        MonthlySeries series = analyticsService.monthlyTrend(3, Optional.empty(), TransactionAggregator.Granularity.CATEGORY);

        assertThat(series.points()).hasSize(2);
        assertThat(series.points().get(0).totalAmount()).isEqualByComparingTo("150.00");
        assertThat(series.points().get(0).count()).isEqualTo(2);
    }

    @Test
    void monthlyTrendBreaksCategoryDownBySubcategory() {
        when(transactionRepository.findByOwnerAndRange(ownerId, LocalDate.parse("2024-06-01"), LocalDate.parse("2024-06-15")))
                .thenReturn(List.of(
                        expense("Food", "Groceries", "100", "2024-06-02"),
                        expense("Food", "Dining", "50", "2024-06-05"),
                        expense("Food", "Groceries", "30", "2024-06-12"),
                        expense("Transport", "Fuel", "70", "2024-06-03")
                ));

        MonthlySeries series = analyticsService.monthlyTrend(1, Optional.of("Food"), TransactionAggregator.Granularity.SUBCATEGORY);

        assertThat(series.points())
                .extracting(point -> point.subcategory().orElseThrow())
                .containsExactly("Dining", "Groceries");
        assertThat(series.points().get(1).totalAmount()).isEqualByComparingTo("130.00");
        assertThat(series.points().get(1).count()).isEqualTo(2);
    }

    private void stubMarch() {
        when(budgetRepository.findByOwnerAndMonth(ownerId, MARCH)).thenReturn(List.of(
                new BudgetEntry(ownerId, "Food", "Dining", new BigDecimal("100"), 3, 2024),
                new BudgetEntry(ownerId, "Food", "Groceries", new BigDecimal("500"), 3, 2024)
        ));
        when(transactionRepository.findByOwnerAndRange(ownerId, MARCH.atDay(1), MARCH.atEndOfMonth())).thenReturn(List.of(
                expense("Food", "Groceries", "620", "2024-03-05"),
                expense("Food", "Dining", "80", "2024-03-18")
        ));
        when(transactionRepository.sumIncome(ownerId, MARCH.atDay(1), MARCH.atEndOfMonth())).thenReturn(new BigDecimal("2500"));
    }

    private Transaction expense(String category, String subcategory, String amount, String date) {
        return Transaction.expense(ownerId, category, subcategory, new BigDecimal(amount), LocalDate.parse(date), subcategory);
    }
}
