package com.demoBank.atmDemo.session.model;

/**
 * Ordered phases of an ATM session. Each phase may only be entered from its predecessor;
 * {@link #TRANSACTION_AUTHORIZED} returns the session to {@link #OVERVIEW_FINALIZED}.
 */
public enum ProtocolPhase {

    UNAUTHENTICATED(null),
    LOGIN_OK(UNAUTHENTICATED),
    PREFERENCES_SET(LOGIN_OK),
    PIN_VALIDATED(PREFERENCES_SET),
    OVERVIEW_FINALIZED(PIN_VALIDATED),
    TRANSACTION_AUTHORIZED(OVERVIEW_FINALIZED),
    LOCKED(null);

    private final ProtocolPhase predecessor;

    ProtocolPhase(ProtocolPhase predecessor) {
        this.predecessor = predecessor;
    }

    public ProtocolPhase getPredecessor() {
        return predecessor;
    }

    /**
     * Phase in which the session rests after this phase completes.
     */
    public ProtocolPhase restingPhase() {
        return this == TRANSACTION_AUTHORIZED ? OVERVIEW_FINALIZED : this;
    }
}
