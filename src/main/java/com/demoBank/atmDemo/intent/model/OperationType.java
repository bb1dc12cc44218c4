package com.demoBank.atmDemo.intent.model;

public enum OperationType {
    WITHDRAW,
    DEPOSIT,
    CASH_DEPOSIT,
    CHECK_DEPOSIT,
    TRANSFER,
    PAYMENT,
    BILL_PAYMENT,
    BALANCE_INQUIRY,
    PIN_CHANGE;

    /**
     * Operations that take money out of a customer account.
     */
    public boolean isDebit() {
        return this == WITHDRAW || this == TRANSFER || this == PAYMENT || this == BILL_PAYMENT;
    }

    /**
     * Operations that put money into a customer account.
     */
    public boolean isCredit() {
        return this == DEPOSIT || this == CASH_DEPOSIT || this == CHECK_DEPOSIT || this == TRANSFER;
    }
}
