package com.demoBank.atmDemo.orchestrator.model;

public enum MessageSender {
    USER,
    ASSISTANT,
    SYSTEM
}
