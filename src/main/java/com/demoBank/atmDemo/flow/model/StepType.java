package com.demoBank.atmDemo.flow.model;

public enum StepType {
    SELECT,
    CONFIRM,
    PROCESSING,
    SUCCESS,
    ERROR
}
