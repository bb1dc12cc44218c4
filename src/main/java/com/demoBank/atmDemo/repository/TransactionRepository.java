package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.transaction.model.Transaction;
import org.springframework.stereotype.Repository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Insert-only transaction log. Records are never updated or removed, not even on logout.
 */
@Repository
public class TransactionRepository {

    private final Map<String, Transaction> transactions = new ConcurrentHashMap<>();

    public Transaction insert(Transaction transaction) {
        Transaction existing = transactions.putIfAbsent(transaction.getId(), transaction);
        if (existing != null) {
            throw new IllegalStateException("Transaction already written: " + transaction.getId());
        }
        return transaction;
    }

    public Optional<Transaction> findById(String id) {
        return Optional.ofNullable(transactions.get(id));
    }

    /**
     * Most recent first.
     */
    public List<Transaction> findByAccountId(String accountId, int limit) {
        return transactions.values().stream()
                .filter(transaction -> transaction.involves(accountId))
                .sorted(Comparator.comparing(Transaction::getTimestamp).reversed())
                .limit(limit)
                .toList();
    }

    public List<Transaction> findByIntentId(String intentId) {
        return transactions.values().stream()
                .filter(transaction -> intentId.equals(transaction.getIntentId()))
                .sorted(Comparator.comparing(Transaction::getTimestamp))
                .toList();
    }

    public List<Transaction> findAll() {
        return List.copyOf(transactions.values());
    }
}
