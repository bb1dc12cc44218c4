package com.demoBank.atmDemo.session.model;

import lombok.Value;

/**
 * Stored request/response pair of a completed phase, used to answer identical replays.
 */
@Value
public class PhaseOutcome {
    Object request;
    Object response;

    public boolean matches(Object candidate) {
        return request != null && request.equals(candidate);
    }
}
