package com.demoBank.atmDemo.bank.model;

public enum AccountType {
    CHECKING,
    SAVINGS
}
