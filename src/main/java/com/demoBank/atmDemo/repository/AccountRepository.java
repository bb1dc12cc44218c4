package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.bank.model.Account;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Repository;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Account store. Balance writes go through {@link #applyBalances}, which replaces every leg of a
 * transaction under one write lock, so a reader sees either all legs or none.
 */
@Slf4j
@Repository
public class AccountRepository {

    private final Map<String, Account> accounts = new HashMap<>();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    public Account save(Account account) {
        lock.writeLock().lock();
        try {
            accounts.put(account.getId(), account);
            return account;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<Account> findById(String id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(accounts.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<Account> findByCustomerId(String customerId) {
        lock.readLock().lock();
        try {
            return accounts.values().stream()
                    .filter(account -> account.isOwnedBy(customerId))
                    .sorted(Comparator.comparing(Account::getId))
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Writes new balances for all given accounts as one unit.
     *
     * @param newBalances account id to its new balance
     * @return the updated snapshots, in the order given
     * @throws IllegalArgumentException if an account is unknown or a balance would go negative;
     *                                  nothing is written in that case
     */
    public List<Account> applyBalances(Map<String, BigDecimal> newBalances) {
        lock.writeLock().lock();
        try {
            List<Account> updated = new ArrayList<>();
            for (Map.Entry<String, BigDecimal> entry : newBalances.entrySet()) {
                Account current = accounts.get(entry.getKey());
                if (current == null) {
                    throw new IllegalArgumentException("Unknown account: " + entry.getKey());
                }
                if (entry.getValue().signum() < 0) {
                    throw new IllegalArgumentException("Negative balance for account: " + entry.getKey());
                }
                updated.add(current.toBuilder().balance(entry.getValue()).build());
            }
            updated.forEach(account -> accounts.put(account.getId(), account));
            log.debug("Balances applied - accounts: {}", newBalances.keySet());
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
