package com.demoBank.atmDemo.bank.model;

import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;

/**
 * Immutable account snapshot. Balance changes produce a new snapshot that the
 * transaction executor writes back through {@code AccountRepository.applyBalances}.
 */
@Value
@Builder(toBuilder = true)
public class Account {

    String id;
    String customerId;
    String accountNumber;
    String maskedNumber;
    String name;
    AccountType type;

    @Builder.Default
    String currency = "USD";

    @Builder.Default
    BigDecimal balance = BigDecimal.ZERO;

    @Builder.Default
    BigDecimal dailyWithdrawalLimit = new BigDecimal("500.00");

    @Builder.Default
    BigDecimal dailyDepositLimit = new BigDecimal("10000.00");

    @Builder.Default
    BigDecimal dailyTransferLimit = new BigDecimal("5000.00");

    @Builder.Default
    AccountStatus status = AccountStatus.ACTIVE;

    public boolean isActive() {
        return status == AccountStatus.ACTIVE;
    }

    public boolean isOwnedBy(String customerId) {
        return this.customerId != null && this.customerId.equals(customerId);
    }
}
