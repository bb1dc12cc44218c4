package com.demoBank.atmDemo.limits.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.LocalDate;

/**
 * Running totals for one account on one calendar day. Incremented only after a committed transaction.
 */
@Value
@Builder(toBuilder = true)
public class DailyLimitRecord {

    String accountId;
    LocalDate date;

    @Builder.Default
    BigDecimal totalWithdrawals = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal totalDeposits = BigDecimal.ZERO;
    @Builder.Default
    BigDecimal totalTransfers = BigDecimal.ZERO;

    int withdrawalCount;
    int depositCount;
    int transferCount;

    public static DailyLimitRecord empty(String accountId, LocalDate date) {
        return DailyLimitRecord.builder().accountId(accountId).date(date).build();
    }

    public BigDecimal total(LimitCategory category) {
        return switch (category) {
            case WITHDRAWAL -> totalWithdrawals;
            case DEPOSIT -> totalDeposits;
            case TRANSFER -> totalTransfers;
        };
    }

    public int count(LimitCategory category) {
        return switch (category) {
            case WITHDRAWAL -> withdrawalCount;
            case DEPOSIT -> depositCount;
            case TRANSFER -> transferCount;
        };
    }

    public DailyLimitRecord increment(LimitCategory category, BigDecimal amount) {
        return switch (category) {
            case WITHDRAWAL -> toBuilder()
                    .totalWithdrawals(totalWithdrawals.add(amount))
                    .withdrawalCount(withdrawalCount + 1)
                    .build();
            case DEPOSIT -> toBuilder()
                    .totalDeposits(totalDeposits.add(amount))
                    .depositCount(depositCount + 1)
                    .build();
            case TRANSFER -> toBuilder()
                    .totalTransfers(totalTransfers.add(amount))
                    .transferCount(transferCount + 1)
                    .build();
        };
    }
}
