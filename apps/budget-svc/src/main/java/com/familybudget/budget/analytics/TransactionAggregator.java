package com.familybudget.budget.analytics;

import com.familybudget.budget.model.MonthlySeries;
import com.familybudget.budget.model.Transaction;
import java.math.BigDecimal;
import java.time.YearMonth;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import org.springframework.stereotype.Component;

@Component
public class TransactionAggregator {

    public enum Granularity {
        CATEGORY,
        SUBCATEGORY
    }

    public MonthlySeries aggregate(List<Transaction> transactions, AggregationWindow window) {
        return aggregate(transactions, window, Set.of(), Granularity.CATEGORY);
    }

    /**
     * Sums expenses per month and category (or subcategory) inside the window.
     * An empty category set means every category.
     */
    public MonthlySeries aggregate(
            List<Transaction> transactions,
            AggregationWindow window,
            Set<String> categories,
            Granularity granularity
    ) {
        List<Transaction> expenses = expensesIn(transactions, window, categories);
        if (expenses.isEmpty()) {
            return MonthlySeries.empty();
        }
        Map<BucketKey, Bucket> buckets = new LinkedHashMap<>();
        for (Transaction tx : expenses) {
            Optional<String> subcategory = granularity == Granularity.SUBCATEGORY ? tx.subcategory() : Optional.empty();
            BucketKey key = new BucketKey(tx.period(), tx.category(), subcategory);
            buckets.computeIfAbsent(key, ignored -> new Bucket()).add(tx.amount());
        }
        List<MonthlySeries.Point> points = buckets.entrySet().stream()
                .map(entry -> new MonthlySeries.Point(
                        entry.getKey().period(),
                        entry.getKey().category(),
                        entry.getKey().subcategory(),
                        Ratios.money(entry.getValue().total),
                        entry.getValue().count
                ))
                .toList();
        return new MonthlySeries(points);
    }

    public List<Transaction> expensesIn(List<Transaction> transactions, AggregationWindow window, Set<String> categories) {
        if (transactions == null || transactions.isEmpty()) {
            return List.of();
        }
        return transactions.stream()
                .filter(Transaction::isExpense)
                .filter(tx -> window.contains(tx.occurredOn()))
                .filter(tx -> categories == null || categories.isEmpty() || categories.contains(tx.category()))
                .toList();
    }

    public BigDecimal totalExpenses(List<Transaction> transactions, AggregationWindow window) {
        return Ratios.money(expensesIn(transactions, window, Set.of()).stream()
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add));
    }

    private record BucketKey(YearMonth period, String category, Optional<String> subcategory) {
    }

    private static final class Bucket {
        private BigDecimal total = BigDecimal.ZERO;
        private int count;

        void add(BigDecimal amount) {
            total = total.add(amount);
            count++;
        }
    }
}
