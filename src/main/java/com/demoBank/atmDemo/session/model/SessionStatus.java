package com.demoBank.atmDemo.session.model;

public enum SessionStatus {
    ACTIVE,
    LOCKED,
    EXPIRED,
    ENDED
}
