package com.demoBank.atmDemo.session.model;

import com.demoBank.atmDemo.bank.dto.AccountSummary;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.EqualsAndHashCode;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;

/**
 * ATM session - created on a successful login, mutated only while its lock is held.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AtmSession {

    private String sessionId;

    /**
     * Opaque bearer token handed to the client at login.
     */
    @ToString.Exclude
    private String token;

    private String customerId;
    private String cardId;
    private String maskedPan;

    @Builder.Default
    private String channel = "atm";

    private int pinAttempts;

    @Builder.Default
    private SessionStatus status = SessionStatus.ACTIVE;

    @Builder.Default
    private ProtocolPhase phase = ProtocolPhase.LOGIN_OK;

    private Instant createdAt;
    private Instant expiresAt;

    private SessionPreferences preferences;

    /**
     * Accounts returned by PIN validation; cleared when the overview is cancelled.
     */
    @Builder.Default
    private List<AccountSummary> overview = new ArrayList<>();

    @Builder.Default
    private Map<ProtocolPhase, PhaseOutcome> phaseOutcomes = new EnumMap<>(ProtocolPhase.class);

    /**
     * Transaction authorizations keyed by host transaction number.
     */
    @Builder.Default
    private Map<String, PhaseOutcome> authorizations = new HashMap<>();

    @Builder.Default
    @ToString.Exclude
    @EqualsAndHashCode.Exclude
    private transient ReentrantLock lock = new ReentrantLock();

    public boolean isExpiredAt(Instant now) {
        return status == SessionStatus.EXPIRED || (expiresAt != null && !now.isBefore(expiresAt));
    }

    public boolean isLocked() {
        return status == SessionStatus.LOCKED;
    }

    /**
     * True once the PIN phase succeeded and the session has not been locked since.
     */
    public boolean isPinVerified() {
        return status == SessionStatus.ACTIVE
                && (phase == ProtocolPhase.PIN_VALIDATED || phase == ProtocolPhase.OVERVIEW_FINALIZED);
    }
}
