package com.familybudget.budget.analytics;

import com.familybudget.budget.model.ForecastReport;
import com.familybudget.budget.model.MonthlySeries;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.TreeSet;
import org.springframework.stereotype.Component;

/**
 * Next-month expense prediction: moving average of the latest months plus the least-squares trend
 * over the whole window.
 */
@Component
public class ExpenseForecaster {

    static final int MIN_HISTORY_MONTHS = 3;
    static final int MOVING_AVERAGE_MONTHS = 3;
    static final int MIN_CATEGORY_POINTS = 2;
    private static final double CONFIDENCE_PENALTY = 20d;

    /**
     * Forecasts every category in {@code categories}; an empty set means all categories of the series.
     *
     * @throws InsufficientHistoryException when the scope spans fewer than three months or no category
     *                                      has enough points
     */
    public ForecastReport forecast(MonthlySeries series, Set<String> categories) {
        Set<String> scope = new TreeSet<>(categories == null || categories.isEmpty() ? series.categories() : categories);
        List<MonthlySeries.Point> scoped = series.points().stream()
                .filter(point -> scope.contains(point.category()))
                .toList();
        long months = scoped.stream().map(MonthlySeries.Point::period).distinct().count();
        if (months < MIN_HISTORY_MONTHS) {
            throw new InsufficientHistoryException("Need at least " + MIN_HISTORY_MONTHS
                    + " months of expense history to predict next month (found " + months + ")");
        }

        Map<String, ForecastReport.CategoryForecast> predictions = new LinkedHashMap<>();
        for (String category : scope) {
            List<Double> amounts = monthlyAmounts(scoped, category);
            if (amounts.size() < MIN_CATEGORY_POINTS) {
                continue;
            }
            predictions.put(category, forecastCategory(amounts));
        }
        if (predictions.isEmpty()) {
            throw new InsufficientHistoryException("Not enough monthly data per category to predict next month");
        }

        BigDecimal total = predictions.values().stream()
                .map(ForecastReport.CategoryForecast::predictedAmount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
        YearMonth from = scoped.get(0).period();
        YearMonth to = scoped.get(scoped.size() - 1).period();
        return new ForecastReport(true, "Forecast generated for " + predictions.size() + " categories",
                predictions, Ratios.money(total), from, to);
    }

    ForecastReport.CategoryForecast forecastCategory(List<Double> amounts) {
        double movingAverage = mean(amounts.subList(Math.max(0, amounts.size() - MOVING_AVERAGE_MONTHS), amounts.size()));
        double slope = slope(amounts);
        double predicted = movingAverage + slope;
        double confidence = movingAverage == 0d
                ? 0d
                : Ratios.clamp(100d - Ratios.divideOrDefault(variance(amounts), movingAverage, 0d) * CONFIDENCE_PENALTY, 0d, 100d);
        // zero slope counts as decreasing
        ForecastReport.Trend trend = slope > 0 ? ForecastReport.Trend.INCREASING : ForecastReport.Trend.DECREASING;
        return new ForecastReport.CategoryForecast(
                Ratios.money(predicted),
                Ratios.money(confidence),
                Ratios.money(mean(amounts)),
                trend,
                amounts.size()
        );
    }

    private static List<Double> monthlyAmounts(List<MonthlySeries.Point> points, String category) {
        SortedMap<YearMonth, BigDecimal> byMonth = new TreeMap<>();
        for (MonthlySeries.Point point : points) {
            if (point.category().equals(category)) {
                byMonth.merge(point.period(), point.totalAmount(), BigDecimal::add);
            }
        }
        return byMonth.values().stream().map(BigDecimal::doubleValue).toList();
    }

    static double mean(List<Double> values) {
        return values.stream().mapToDouble(Double::doubleValue).average().orElse(0d);
    }

    static double variance(List<Double> values) {
        double mean = mean(values);
        return values.stream()
                .mapToDouble(value -> Math.pow(value - mean, 2))
                .average()
                .orElse(0d);
    }

    /**
     * Ordinary least-squares slope of the values against their 0-based index.
     */
    static double slope(List<Double> values) {
        int n = values.size();
        if (n < 2) {
            return 0d;
        }
        double meanX = (n - 1) / 2d;
        double meanY = mean(values);
        double numerator = 0d;
        double denominator = 0d;
        for (int i = 0; i < n; i++) {
            double dx = i - meanX;
            numerator += dx * (values.get(i) - meanY);
            denominator += dx * dx;
        }
        return Ratios.divideOrDefault(numerator, denominator, 0d);
    }
}
