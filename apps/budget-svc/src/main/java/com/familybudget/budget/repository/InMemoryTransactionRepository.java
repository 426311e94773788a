package com.familybudget.budget.repository;

import com.familybudget.budget.model.Transaction;
import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import org.springframework.stereotype.Repository;

@Repository
public class InMemoryTransactionRepository implements TransactionRepository {

    private final Map<UUID, StoredTransaction> storage = new ConcurrentHashMap<>();
    private final AtomicLong sequence = new AtomicLong();

    @Override
    public Transaction save(Transaction transaction) {
        storage.compute(transaction.id(), (id, existing) -> new StoredTransaction(
                existing != null ? existing.sequence() : sequence.incrementAndGet(),
                transaction
        ));
        return transaction;
    }

    @Override
    public List<Transaction> findByOwnerAndRange(UUID ownerId, LocalDate fromInclusive, LocalDate toInclusive) {
        return storage.values().stream()
                .filter(stored -> stored.transaction().ownerId().equals(ownerId))
                .filter(stored -> {
                    LocalDate date = stored.transaction().occurredOn();
                    return !date.isBefore(fromInclusive) && !date.isAfter(toInclusive);
                })
                .sorted(Comparator.comparing((StoredTransaction stored) -> stored.transaction().occurredOn())
                        .thenComparingLong(StoredTransaction::sequence))
                .map(StoredTransaction::transaction)
                .toList();
    }

    @Override
    public BigDecimal sumIncome(UUID ownerId, LocalDate fromInclusive, LocalDate toInclusive) {
        return findByOwnerAndRange(ownerId, fromInclusive, toInclusive).stream()
                .filter(tx -> tx.type() == Transaction.Type.INCOME)
                .map(Transaction::amount)
                .reduce(BigDecimal.ZERO, BigDecimal::add);
    }

    @Override
    public void deleteByOwner(UUID ownerId) {
        storage.entrySet().removeIf(entry -> entry.getValue().transaction().ownerId().equals(ownerId));
    }

    private record StoredTransaction(long sequence, Transaction transaction) {
    }
}
