package com.demoBank.atmDemo.bank.model;

public enum CardStatus {
    ACTIVE,
    BLOCKED,
    EXPIRED,
    LOST,
    STOLEN
}
