package com.familybudget.budget.repository;

import com.familybudget.budget.model.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.List;
import java.util.UUID;

/**
 * Read side of the transaction store. Results are immutable snapshots ordered by date, then by
 * insertion order.
 */
public interface TransactionRepository {

    Transaction save(Transaction transaction);

    List<Transaction> findByOwnerAndRange(UUID ownerId, LocalDate fromInclusive, LocalDate toInclusive);

    BigDecimal sumIncome(UUID ownerId, LocalDate fromInclusive, LocalDate toInclusive);

    void deleteByOwner(UUID ownerId);
}
