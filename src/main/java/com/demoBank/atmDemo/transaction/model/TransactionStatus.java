package com.demoBank.atmDemo.transaction.model;

public enum TransactionStatus {
    PENDING,
    COMPLETED,
    FAILED,
    CANCELLED;

    public boolean isTerminal() {
        return this != PENDING;
    }
}
