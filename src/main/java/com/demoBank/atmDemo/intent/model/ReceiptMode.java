package com.demoBank.atmDemo.intent.model;

public enum ReceiptMode {
    PRINT,
    EMAIL,
    NONE
}
