package com.demoBank.atmDemo.intent.model;

public enum IntentStatus {
    PENDING_DETAILS,
    READY_TO_EXECUTE,
    COMPLETED,
    CANCELLED;

    public boolean isTerminal() {
        return this == COMPLETED || this == CANCELLED;
    }
}
