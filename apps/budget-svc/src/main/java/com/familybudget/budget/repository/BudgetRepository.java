package com.familybudget.budget.repository;

import com.familybudget.budget.model.BudgetEntry;
import java.time.YearMonth;
import java.util.List;
import java.util.UUID;

public interface BudgetRepository {

    /**
     * Upserts on (owner, category, subcategory, month, year).
     */
    BudgetEntry save(BudgetEntry entry);

    List<BudgetEntry> findByOwnerAndMonth(UUID ownerId, YearMonth month);

    void deleteByOwner(UUID ownerId);
}
