package com.demoBank.atmDemo.flow.model;

public enum FlowStatus {
    PENDING,
    INTERRUPTED,
    COMPLETE
}
