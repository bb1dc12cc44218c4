package com.demoBank.atmDemo.bank.model;

public enum AccountStatus {
    ACTIVE,
    INACTIVE,
    BLOCKED,
    CLOSED
}
