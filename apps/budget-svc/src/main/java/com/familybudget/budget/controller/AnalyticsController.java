package com.familybudget.budget.controller;

import com.familybudget.budget.analytics.AnalyticsService;
import com.familybudget.budget.analytics.TransactionAggregator;
import com.familybudget.budget.controller.dto.AnomaliesResponseDto;
import com.familybudget.budget.controller.dto.BalanceResponseDto;
import com.familybudget.budget.controller.dto.BudgetComparisonResponseDto;
import com.familybudget.budget.controller.dto.BudgetSummaryResponseDto;
import com.familybudget.budget.controller.dto.ForecastResponseDto;
import com.familybudget.budget.controller.dto.MonthlyTrendResponseDto;
import com.familybudget.budget.controller.dto.RecommendationsResponseDto;
import com.familybudget.budget.model.Anomaly;
import com.familybudget.budget.model.AnomalyReport;
import com.familybudget.budget.model.Balance;
import com.familybudget.budget.model.BudgetSummary;
import com.familybudget.budget.model.ComparisonRow;
import com.familybudget.budget.model.ForecastReport;
import com.familybudget.budget.model.MonthlySeries;
import com.familybudget.budget.model.Recommendation;
import com.familybudget.budget.model.RecommendationReport;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Positive;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/analytics")
@Validated
public class AnalyticsController {

    private final AnalyticsService analyticsService;

    public AnalyticsController(AnalyticsService analyticsService) {
        this.analyticsService = analyticsService;
    }

    @GetMapping("/forecast")
    public ResponseEntity<ForecastResponseDto> forecast(
            @RequestParam(value = "category", required = false) String category
    ) {
        ForecastReport report = analyticsService.forecast(Optional.ofNullable(category));
        return ResponseEntity.ok(map(report));
    }

    @GetMapping("/anomalies")
    public ResponseEntity<AnomaliesResponseDto> anomalies(
            @RequestParam(value = "threshold", required = false) @Positive Double threshold,
            @RequestParam(value = "category", required = false) String category
    ) {
        AnomalyReport report = analyticsService.detectAnomalies(Optional.ofNullable(threshold), Optional.ofNullable(category));
        return ResponseEntity.ok(map(report));
    }

    @GetMapping("/budget/comparison")
    public ResponseEntity<BudgetComparisonResponseDto> budgetComparison(
            @RequestParam("month") @Min(1) @Max(12) int month,
            @RequestParam("year") @Min(1) @Max(9999) int year,
            @RequestParam(value = "rollup", required = false, defaultValue = "false") boolean rollup
    ) {
        YearMonth period = YearMonth.of(year, month);
        List<BudgetComparisonResponseDto.Row> rows = analyticsService.compareBudget(period, rollup).stream()
                .map(AnalyticsController::map)
                .toList();
        return ResponseEntity.ok(new BudgetComparisonResponseDto(period.toString(), rollup, rows));
    }

    @GetMapping("/budget/summary")
    public ResponseEntity<BudgetSummaryResponseDto> budgetSummary(
            @RequestParam("month") @Min(1) @Max(12) int month,
            @RequestParam("year") @Min(1) @Max(9999) int year
    ) {
        YearMonth period = YearMonth.of(year, month);
        BudgetSummary summary = analyticsService.budgetSummary(period);
        return ResponseEntity.ok(new BudgetSummaryResponseDto(
                period.toString(),
                summary.totalPlanned(),
                summary.totalActual(),
                summary.totalDifference(),
                summary.overBudgetCount()
        ));
    }

    @GetMapping("/recommendations")
    public ResponseEntity<RecommendationsResponseDto> recommendations(
            @RequestParam("month") @Min(1) @Max(12) int month,
            @RequestParam("year") @Min(1) @Max(9999) int year
    ) {
        RecommendationReport report = analyticsService.recommend(YearMonth.of(year, month));
        return ResponseEntity.ok(map(report));
    }

    @GetMapping("/balance")
    public ResponseEntity<BalanceResponseDto> balance(
            @RequestParam("month") @Min(1) @Max(12) int month,
            @RequestParam("year") @Min(1) @Max(9999) int year
    ) {
        Balance balance = analyticsService.balance(YearMonth.of(year, month));
        return ResponseEntity.ok(new BalanceResponseDto(
                balance.month().toString(),
                balance.incomeTotal(),
                balance.expenseTotal(),
                balance.balance(),
                balance.savingsRate()
        ));
    }

    @GetMapping("/trend")
    public ResponseEntity<MonthlyTrendResponseDto> trend(
            @RequestParam(value = "months", required = false, defaultValue = "6") @Min(1) @Max(24) int months,
            @RequestParam(value = "category", required = false) String category,
            @RequestParam(value = "granularity", required = false, defaultValue = "CATEGORY") TransactionAggregator.Granularity granularity
    ) {
        MonthlySeries series = analyticsService.monthlyTrend(months, Optional.ofNullable(category), granularity);
        List<MonthlyTrendResponseDto.SeriesPointDto> points = series.points().stream()
                .map(point -> new MonthlyTrendResponseDto.SeriesPointDto(
                        point.period().toString(),
                        point.category(),
                        point.subcategory().orElse(null),
                        point.totalAmount(),
                        point.count()
                ))
                .toList();
        return ResponseEntity.ok(new MonthlyTrendResponseDto(months, granularity.name(), points));
    }

    private static ForecastResponseDto map(ForecastReport report) {
        Map<String, ForecastResponseDto.CategoryPrediction> predictions = new LinkedHashMap<>();
        report.predictions().forEach((category, forecast) -> predictions.put(category, new ForecastResponseDto.CategoryPrediction(
                forecast.predictedAmount(),
                forecast.confidence(),
                forecast.historicalAverage(),
                forecast.trend().label(),
                forecast.monthsAnalyzed()
        )));
        ForecastResponseDto.AnalysisPeriod period = report.analysisFrom() == null
                ? null
                : new ForecastResponseDto.AnalysisPeriod(report.analysisFrom().toString(), report.analysisTo().toString());
        return new ForecastResponseDto(report.success(), report.message(), predictions, report.totalPredicted(), period);
    }

    private static AnomaliesResponseDto map(AnomalyReport report) {
        return new AnomaliesResponseDto(
                report.success(),
                report.anomaliesFound(),
                report.anomalies().stream().map(AnalyticsController::map).toList(),
                report.message()
        );
    }

    private static AnomaliesResponseDto.AnomalyDto map(Anomaly anomaly) {
        return new AnomaliesResponseDto.AnomalyDto(
                anomaly.transactionId().toString(),
                anomaly.category(),
                anomaly.subcategory().orElse(null),
                anomaly.amount(),
                anomaly.date(),
                anomaly.description(),
                new AnomaliesResponseDto.ExpectedRange(anomaly.expectedRange().lower(), anomaly.expectedRange().upper()),
                anomaly.deviation(),
                anomaly.severity().label()
        );
    }

    private static BudgetComparisonResponseDto.Row map(ComparisonRow row) {
        return new BudgetComparisonResponseDto.Row(
                row.category(),
                row.subcategory().orElse(null),
                row.plannedAmount(),
                row.actualAmount(),
                row.difference(),
                row.percentage(),
                row.status().label()
        );
    }

    private static RecommendationsResponseDto map(RecommendationReport report) {
        return new RecommendationsResponseDto(
                report.success(),
                report.message(),
                report.recommendations().stream().map(AnalyticsController::map).toList(),
                report.totalPotentialSavings(),
                report.currentSavingsRate()
        );
    }

    private static RecommendationsResponseDto.RecommendationDto map(Recommendation recommendation) {
        return new RecommendationsResponseDto.RecommendationDto(
                recommendation.category(),
                recommendation.subcategory().orElse(null),
                recommendation.kind().label(),
                recommendation.priority().label(),
                recommendation.message(),
                recommendation.suggestion(),
                recommendation.suggestedAmount()
        );
    }
}
