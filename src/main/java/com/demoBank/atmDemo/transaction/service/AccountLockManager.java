package com.demoBank.atmDemo.transaction.service;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

/**
 * Per-account execution locks. Several accounts are always locked in ascending id order,
 * so two transfers in opposite directions cannot deadlock.
 */
@Component
public class AccountLockManager {

    private final Map<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    public <T> T withLocks(List<String> accountIds, Supplier<T> action) {
        TreeSet<String> ordered = new TreeSet<>();
        accountIds.stream().filter(Objects::nonNull).forEach(ordered::add);

        List<ReentrantLock> acquired = new ArrayList<>();
        try {
            for (String accountId : ordered) {
                ReentrantLock lock = locks.computeIfAbsent(accountId, key -> new ReentrantLock());
                lock.lock();
                acquired.add(lock);
            }
            return action.get();
        } finally {
            for (int i = acquired.size() - 1; i >= 0; i--) {
                acquired.get(i).unlock();
            }
        }
    }
}
