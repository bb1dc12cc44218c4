package com.demoBank.atmDemo.limits.service;

import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.limits.model.DailyLimitRecord;
import com.demoBank.atmDemo.limits.model.LimitCategory;
import com.demoBank.atmDemo.limits.model.RemainingLimits;
import com.demoBank.atmDemo.repository.DailyLimitRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.util.Locale;
import java.util.Map;

/**
 * Per-account, per-day running totals. Callers must hold the account's execution lock
 * between {@link #check} and {@link #record}; the tracker itself only guarantees that each
 * upsert is atomic.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DailyLimitTracker {

    private final DailyLimitRepository dailyLimitRepository;
    private final Clock clock;

    public LocalDate today() {
        return LocalDate.now(clock);
    }

    /**
     * Account whose limit an operation consumes: the credited account for deposits, the debited one otherwise.
     */
    public static String limitedAccountId(OperationType operation, String fromAccountId, String toAccountId) {
        return LimitCategory.of(operation)
                .map(category -> category == LimitCategory.DEPOSIT ? toAccountId : fromAccountId)
                .orElse(null);
    }

    public BigDecimal remaining(Account account, LimitCategory category, LocalDate date) {
        BigDecimal used = dailyLimitRepository.find(account.getId(), date)
                .map(record -> record.total(category))
                .orElse(BigDecimal.ZERO);
        return limitOf(account, category).subtract(used).max(BigDecimal.ZERO);
    }

    public RemainingLimits remainingLimits(Account account, LocalDate date) {
        return RemainingLimits.builder()
                .accountId(account.getId())
                .date(date)
                .currency(account.getCurrency())
                .withdrawal(remaining(account, LimitCategory.WITHDRAWAL, date))
                .deposit(remaining(account, LimitCategory.DEPOSIT, date))
                .transfer(remaining(account, LimitCategory.TRANSFER, date))
                .build();
    }

    /**
     * @throws AtmException LIMIT_ERROR if the amount exceeds what is left today
     */
    public void check(Account account, LimitCategory category, BigDecimal amount, LocalDate date) {
        BigDecimal remaining = remaining(account, category, date);
        if (amount.compareTo(remaining) > 0) {
            log.info("Daily limit exceeded - account: {}, category: {}, requested: {}, remaining: {}",
                    account.getId(), category, amount, remaining);
            throw new AtmException(ErrorKind.LIMIT_ERROR, null,
                    "Daily " + category.name().toLowerCase(Locale.ROOT) + " limit exceeded",
                    Map.of("category", category.name(), "remaining", remaining, "requested", amount),
                    null);
        }
    }

    public DailyLimitRecord record(String accountId, LimitCategory category, BigDecimal amount, LocalDate date) {
        DailyLimitRecord updated = dailyLimitRepository.upsert(accountId, date,
                current -> current.increment(category, amount));
        log.debug("Daily limit recorded - account: {}, category: {}, amount: {}, total: {}",
                accountId, category, amount, updated.total(category));
        return updated;
    }

    public DailyLimitRecord find(String accountId, LocalDate date) {
        return dailyLimitRepository.find(accountId, date).orElse(DailyLimitRecord.empty(accountId, date));
    }

    private static BigDecimal limitOf(Account account, LimitCategory category) {
        return switch (category) {
            case WITHDRAWAL -> account.getDailyWithdrawalLimit();
            case DEPOSIT -> account.getDailyDepositLimit();
            case TRANSFER -> account.getDailyTransferLimit();
        };
    }
}
