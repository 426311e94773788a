package com.familybudget.budget.analytics;

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
import java.time.LocalDate;
import java.time.YearMonth;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

/**
 * Entry point of the analytics engine. Reads owner snapshots from the repositories, runs the pure
 * components and turns expected engine failures into tagged failure results.
 */
@Service
public class AnalyticsService {

    private static final Logger log = LoggerFactory.getLogger(AnalyticsService.class);

    private final TransactionRepository transactionRepository;
    private final BudgetRepository budgetRepository;
    private final AuthenticatedUserProvider authenticatedUserProvider;
    private final TransactionAggregator aggregator;
    private final ExpenseForecaster forecaster;
    private final AnomalyDetectionService anomalyDetectionService;
    private final BudgetComparator budgetComparator;
    private final BalanceCalculator balanceCalculator;
    private final RecommendationEngine recommendationEngine;
    private final FamilyBudgetProperties.Analytics settings;
    private final Clock clock;

    public AnalyticsService(
            TransactionRepository transactionRepository,
            BudgetRepository budgetRepository,
            AuthenticatedUserProvider authenticatedUserProvider,
            TransactionAggregator aggregator,
            ExpenseForecaster forecaster,
            AnomalyDetectionService anomalyDetectionService,
            BudgetComparator budgetComparator,
            BalanceCalculator balanceCalculator,
            RecommendationEngine recommendationEngine,
            FamilyBudgetProperties properties,
            Clock clock
    ) {
        this.transactionRepository = transactionRepository;
        this.budgetRepository = budgetRepository;
        this.authenticatedUserProvider = authenticatedUserProvider;
        this.aggregator = aggregator;
        this.forecaster = forecaster;
        this.anomalyDetectionService = anomalyDetectionService;
        this.budgetComparator = budgetComparator;
        this.balanceCalculator = balanceCalculator;
        this.recommendationEngine = recommendationEngine;
        this.settings = properties.analytics();
        this.clock = clock;
    }

    public ForecastReport forecast(Optional<String> category) {
        return forecastForOwner(authenticatedUserProvider.requireCurrentOwnerId(), category);
    }

    public ForecastReport forecastForOwner(UUID ownerId, Optional<String> category) {
        AggregationWindow window = AggregationWindow.trailingMonths(settings.forecastLookbackMonths(), today());
        List<Transaction> transactions = load(ownerId, window);
        MonthlySeries series = aggregator.aggregate(transactions, window, scope(category), TransactionAggregator.Granularity.CATEGORY);
        try {
            ForecastReport report = forecaster.forecast(series, scope(category));
            log.debug("Forecast: owner={} categories={} total={}", ownerId, report.predictions().size(), report.totalPredicted());
            return report;
        } catch (InsufficientHistoryException ex) {
            log.info("Forecast unavailable: owner={} category={} reason={}", ownerId, category.orElse("*"), ex.getMessage());
            return ForecastReport.failure(ex.getMessage());
        }
    }

    public AnomalyReport detectAnomalies(Optional<Double> threshold, Optional<String> category) {
        return detectAnomaliesForOwner(authenticatedUserProvider.requireCurrentOwnerId(),
                threshold.orElse(settings.anomalyThreshold()), category);
    }

    public AnomalyReport detectAnomaliesForOwner(UUID ownerId, double threshold, Optional<String> category) {
        AggregationWindow window = AggregationWindow.lookback(settings.anomalyLookbackMonths(), today());
        List<Transaction> expenses = aggregator.expensesIn(load(ownerId, window), window, scope(category));
        AnomalyReport report = anomalyDetectionService.detectAnomalies(expenses, threshold, scope(category));
        if (report.success()) {
            log.debug("Anomalies: owner={} threshold={} found={}", ownerId, threshold, report.anomaliesFound());
        } else {
            log.info("Anomaly detection unavailable: owner={} reason={}", ownerId, report.message());
        }
        return report;
    }

    public List<ComparisonRow> compareBudget(YearMonth month, boolean rollup) {
        return compareBudgetForOwner(authenticatedUserProvider.requireCurrentOwnerId(), month, rollup);
    }

    /**
     * Empty when no budget is set for the month.
     */
    public List<ComparisonRow> compareBudgetForOwner(UUID ownerId, YearMonth month, boolean rollup) {
        List<BudgetEntry> budget = budgetRepository.findByOwnerAndMonth(ownerId, month);
        if (budget.isEmpty()) {
            log.debug("Budget comparison: owner={} month={} has no budget", ownerId, month);
            return List.of();
        }
        MonthlySeries actuals = monthlyActuals(ownerId, month);
        return rollup
                ? budgetComparator.rollupByCategory(budget, actuals)
                : budgetComparator.compare(budget, actuals);
    }

    public BudgetSummary budgetSummary(YearMonth month) {
        return budgetSummaryForOwner(authenticatedUserProvider.requireCurrentOwnerId(), month);
    }

    public BudgetSummary budgetSummaryForOwner(UUID ownerId, YearMonth month) {
        return budgetComparator.summarize(compareBudgetForOwner(ownerId, month, false));
    }

    public Balance balance(YearMonth month) {
        return balanceForOwner(authenticatedUserProvider.requireCurrentOwnerId(), month);
    }

    public Balance balanceForOwner(UUID ownerId, YearMonth month) {
        AggregationWindow window = AggregationWindow.ofMonth(month);
        BigDecimal income = transactionRepository.sumIncome(ownerId, window.from(), window.to());
        BigDecimal expenses = aggregator.totalExpenses(load(ownerId, window), window);
        return balanceCalculator.calculate(month, income, expenses);
    }

    public RecommendationReport recommend(YearMonth month) {
        return recommendForOwner(authenticatedUserProvider.requireCurrentOwnerId(), month);
    }

    public RecommendationReport recommendForOwner(UUID ownerId, YearMonth month) {
        List<ComparisonRow> rows = compareBudgetForOwner(ownerId, month, false);
        Balance balance = balanceForOwner(ownerId, month);
        try {
            RecommendationReport report = recommendationEngine.recommend(rows, balance);
            log.debug("Recommendations: owner={} month={} count={} potentialSavings={}",
                    ownerId, month, report.recommendations().size(), report.totalPotentialSavings());
            return report;
        } catch (NoBudgetConfiguredException ex) {
            log.info("Recommendations unavailable: owner={} month={} reason={}", ownerId, month, ex.getMessage());
            return RecommendationReport.failure(ex.getMessage());
        }
    }

    public MonthlySeries monthlyTrend(int months, Optional<String> category, TransactionAggregator.Granularity granularity) {
        return monthlyTrendForOwner(authenticatedUserProvider.requireCurrentOwnerId(), months, category, granularity);
    }

    /**
     * Monthly expense totals over the trailing {@code months}; subcategory granularity gives the
     * per-category breakdown.
     */
    public MonthlySeries monthlyTrendForOwner(
            UUID ownerId,
            int months,
            Optional<String> category,
            TransactionAggregator.Granularity granularity
    ) {
        AggregationWindow window = AggregationWindow.trailingMonths(months, today());
        MonthlySeries series = aggregator.aggregate(load(ownerId, window), window, scope(category), granularity);
        log.debug("Trend: owner={} months={} granularity={} points={}", ownerId, months, granularity, series.points().size());
        return series;
    }

    private MonthlySeries monthlyActuals(UUID ownerId, YearMonth month) {
        AggregationWindow window = AggregationWindow.ofMonth(month);
        return aggregator.aggregate(load(ownerId, window), window, Set.of(), TransactionAggregator.Granularity.SUBCATEGORY);
    }

    private List<Transaction> load(UUID ownerId, AggregationWindow window) {
        return transactionRepository.findByOwnerAndRange(ownerId, window.from(), window.to());
    }

    private static Set<String> scope(Optional<String> category) {
        return category.filter(value -> !value.isBlank()).map(Set::of).orElseGet(Set::of);
    }

    private LocalDate today() {
        return LocalDate.now(clock);
    }
}
