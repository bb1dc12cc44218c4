package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.limits.model.DailyLimitRecord;
import org.springframework.stereotype.Repository;

import java.time.LocalDate;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.UnaryOperator;

@Repository
public class DailyLimitRepository {

    private record Key(String accountId, LocalDate date) {}

    private final Map<Key, DailyLimitRecord> records = new ConcurrentHashMap<>();

    public Optional<DailyLimitRecord> find(String accountId, LocalDate date) {
        return Optional.ofNullable(records.get(new Key(accountId, date)));
    }

    /**
     * Creates the (account, date) record if missing and applies the change, atomically per key.
     */
    public DailyLimitRecord upsert(String accountId, LocalDate date, UnaryOperator<DailyLimitRecord> change) {
        return records.compute(new Key(accountId, date), (key, current) ->
                change.apply(current != null ? current : DailyLimitRecord.empty(accountId, date)));
    }
}
