package com.familybudget.budget.repository;

import com.familybudget.budget.model.BudgetEntry;
import java.time.YearMonth;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryBudgetRepository implements BudgetRepository {

    private final Map<BudgetEntry.Key, BudgetEntry> storage = new ConcurrentHashMap<>();

    @Override
    public BudgetEntry save(BudgetEntry entry) {
        storage.put(entry.key(), entry);
        return entry;
    }

    @Override
    public List<BudgetEntry> findByOwnerAndMonth(UUID ownerId, YearMonth month) {
        return storage.values().stream()
                .filter(entry -> entry.ownerId().equals(ownerId))
                .filter(entry -> entry.period().equals(month))
                .sorted(Comparator.comparing(BudgetEntry::category).thenComparing(BudgetEntry::subcategory))
                .toList();
    }

    @Override
    public void deleteByOwner(UUID ownerId) {
        storage.keySet().removeIf(key -> key.ownerId().equals(ownerId));
    }
}
