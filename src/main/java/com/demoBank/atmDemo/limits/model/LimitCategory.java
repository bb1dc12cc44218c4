package com.demoBank.atmDemo.limits.model;

import com.demoBank.atmDemo.intent.model.OperationType;

import java.util.Optional;

public enum LimitCategory {
    WITHDRAWAL,
    DEPOSIT,
    TRANSFER;

    /**
     * Category an operation counts against, if any.
     */
    public static Optional<LimitCategory> of(OperationType operation) {
        return switch (operation) {
            case WITHDRAW -> Optional.of(WITHDRAWAL);
            case DEPOSIT, CASH_DEPOSIT, CHECK_DEPOSIT -> Optional.of(DEPOSIT);
            case TRANSFER, PAYMENT, BILL_PAYMENT -> Optional.of(TRANSFER);
            case BALANCE_INQUIRY, PIN_CHANGE -> Optional.empty();
        };
    }
}
