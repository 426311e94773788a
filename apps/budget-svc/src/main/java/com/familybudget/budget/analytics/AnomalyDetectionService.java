package com.familybudget.budget.analytics;

import com.familybudget.budget.model.Anomaly;
import com.familybudget.budget.model.AnomalyReport;
import com.familybudget.budget.model.Transaction;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;
import org.springframework.stereotype.Component;

@Component
public class AnomalyDetectionService {

    public static final double DEFAULT_Z_SCORE_THRESHOLD = 2.0d;
    static final int MIN_CATEGORY_SAMPLE = 5;
    private static final double EXPECTED_RANGE_SIGMAS = 2.0d;
    private static final double HIGH_SEVERITY_Z_SCORE = 3.0d;

    /**
     * Flags expenses whose z-score within their own category exceeds {@code threshold}.
     * An empty category set means every category.
     */
    public AnomalyReport detectAnomalies(List<Transaction> transactions, double threshold, Set<String> categories) {
        if (Double.isNaN(threshold) || Double.isInfinite(threshold) || threshold <= 0) {
            throw new IllegalArgumentException("threshold must be a positive number");
        }
        List<Transaction> expenses = transactions == null ? List.of() : transactions.stream()
                .filter(Transaction::isExpense)
                .filter(tx -> categories == null || categories.isEmpty() || categories.contains(tx.category()))
                .toList();
        if (expenses.isEmpty()) {
            return AnomalyReport.failure("Not enough transaction data for anomaly detection");
        }

        Map<String, List<Transaction>> byCategory = expenses.stream()
                .collect(Collectors.groupingBy(Transaction::category, LinkedHashMap::new, Collectors.toList()));
        Map<String, CategoryStats> stats = new HashMap<>();
        byCategory.forEach((category, categoryTransactions) -> {
            if (categoryTransactions.size() < MIN_CATEGORY_SAMPLE) {
                return;
            }
            CategoryStats categoryStats = CategoryStats.of(categoryTransactions);
            if (categoryStats.stdDev() == 0d) {
                return;
            }
            stats.put(category, categoryStats);
        });

        // walk the input once so equal amounts keep their original order through the stable sort
        List<Anomaly> anomalies = new ArrayList<>();
        for (Transaction tx : expenses) {
            CategoryStats categoryStats = stats.get(tx.category());
            if (categoryStats == null) {
                continue;
            }
            double zScore = Math.abs(tx.amount().doubleValue() - categoryStats.mean()) / categoryStats.stdDev();
            if (zScore > threshold) {
                anomalies.add(toAnomaly(tx, categoryStats, zScore));
            }
        }
        anomalies.sort(Comparator.comparing(Anomaly::amount).reversed());
        return AnomalyReport.of(anomalies);
    }

    private Anomaly toAnomaly(Transaction tx, CategoryStats stats, double zScore) {
        double spread = EXPECTED_RANGE_SIGMAS * stats.stdDev();
        return new Anomaly(
                tx.id(),
                tx.category(),
                tx.subcategory(),
                Ratios.money(tx.amount()),
                tx.occurredOn(),
                tx.description(),
                new Anomaly.ExpectedRange(Ratios.money(stats.mean() - spread), Ratios.money(stats.mean() + spread)),
                Ratios.money(zScore),
                zScore > HIGH_SEVERITY_Z_SCORE ? Anomaly.Severity.HIGH : Anomaly.Severity.MEDIUM
        );
    }

    record CategoryStats(double mean, double stdDev) {

        static CategoryStats of(List<Transaction> transactions) {
            List<Double> amounts = transactions.stream()
                    .map(Transaction::amount)
                    .map(BigDecimal::doubleValue)
                    .toList();
            double mean = amounts.stream().mapToDouble(Double::doubleValue).average().orElse(0d);
            double variance = amounts.stream()
                    .mapToDouble(value -> Math.pow(value - mean, 2))
                    .average()
                    .orElse(0d);
            return new CategoryStats(mean, Math.sqrt(variance));
        }
    }
}
