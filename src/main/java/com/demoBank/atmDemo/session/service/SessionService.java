package com.demoBank.atmDemo.session.service;

import com.demoBank.atmDemo.bank.model.Card;
import com.demoBank.atmDemo.bank.model.Customer;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.config.AtmProperties;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.model.SessionStatus;
import com.demoBank.atmDemo.util.SensitiveDataMasker;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.RemovalCause;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;

/**
 * Session service - issues tokens and serializes all work on a session.
 *
 * Responsibilities:
 * - Create a session on successful login
 * - Run each request under the session's lock, rejecting requests that cannot get it in time
 * - Check expiry eagerly against the injected clock (sliding idle TTL)
 * - End the session when a request fails with a terminal error
 * - Drop sessions on logout, archive sessions evicted while idle
 *
 * The Caffeine cache only bounds memory; its eviction is set well past the TTL so an
 * expired session is still found and reported as expired.
 */
@Slf4j
@Service
public class SessionService {

    private final AtmProperties.Session settings;
    private final Clock clock;
    private final Cache<String, AtmSession> sessionCache;

    public SessionService(AtmProperties properties, Clock clock, SessionArchiveService sessionArchiveService) {
        this.settings = properties.getSession();
        this.clock = clock;
        this.sessionCache = Caffeine.newBuilder()
                .expireAfterAccess(settings.getTtl().multipliedBy(2))
                .maximumSize(settings.getMaxSessions())
                .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
                .executor(Runnable::run)
                .removalListener((String key, AtmSession value, RemovalCause cause) -> {
                    if (value == null) {
                        return;
                    }
                    log.debug("Session removed - sessionId: {}, cause: {}", value.getSessionId(), cause);
                    if (cause.wasEvicted()) {
                        sessionArchiveService.archive(value);
                    }
                })
                .build();
    }

    public AtmSession create(Card card, Customer customer) {
        Instant now = clock.instant();
        AtmSession session = AtmSession.builder()
                .sessionId(UUID.randomUUID().toString())
                .token(UUID.randomUUID().toString())
                .customerId(customer.getId())
                .cardId(card.getId())
                .maskedPan(card.getMaskedPan())
                .createdAt(now)
                .expiresAt(now.plus(settings.getTtl()))
                .build();
        sessionCache.put(session.getToken(), session);
        log.info("Created new session - customerId: {}, sessionId: {}, card: {}",
                SensitiveDataMasker.maskId(customer.getId()), session.getSessionId(), card.getMaskedPan());
        return session;
    }

    /**
     * Runs the action while holding the session's lock, after checking that the session is alive.
     *
     * @throws AtmException SEQUENCE_ERROR for an unknown token, SESSION_EXPIRED for an expired session,
     *                      CONCURRENT_REQUEST if another request holds the session longer than the lock wait
     */
    public <T> T execute(String token, Function<AtmSession, T> action) {
        return run(token, true, action);
    }

    /**
     * Same as {@link #execute} for work that needs a PIN-validated session.
     *
     * @throws AtmException SEQUENCE_ERROR before PIN validation or after a lockout
     */
    public <T> T executeVerified(String token, Function<AtmSession, T> action) {
        return execute(token, session -> {
            if (!session.isPinVerified()) {
                throw AtmException.sequence("PIN validation is required first");
            }
            return action.apply(session);
        });
    }

    /**
     * Same as {@link #execute} but also admits expired sessions. Used for logout.
     */
    public <T> T executeIgnoringExpiry(String token, Function<AtmSession, T> action) {
        return run(token, false, action);
    }

    /**
     * Looks a session up without locking it. Returns empty for unknown tokens.
     */
    public Optional<AtmSession> findByToken(String token) {
        if (token == null || token.isBlank()) {
            return Optional.empty();
        }
        return Optional.ofNullable(sessionCache.getIfPresent(token));
    }

    public void invalidate(String token) {
        sessionCache.invalidate(token);
    }

    /**
     * Evicts sessions idle past the store's retention, which archives what they owned.
     */
    @Scheduled(fixedDelayString = "${atm.session.sweep-interval-ms:60000}")
    public void evictIdleSessions() {
        sessionCache.cleanUp();
    }

    private <T> T run(String token, boolean requireLive, Function<AtmSession, T> action) {
        AtmSession session = findByToken(token)
                .orElseThrow(() -> AtmException.sequence("No active session, login required"));

        boolean acquired;
        try {
            acquired = session.getLock().tryLock(settings.getLockWait().toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AtmException(ErrorKind.CONCURRENT_REQUEST, "Interrupted while waiting for session", e);
        }
        if (!acquired) {
            log.warn("Session busy - sessionId: {}", session.getSessionId());
            throw new AtmException(ErrorKind.CONCURRENT_REQUEST, "Another request is in progress for this session");
        }

        try {
            Instant now = clock.instant();
            if (requireLive) {
                if (session.isExpiredAt(now)) {
                    session.setStatus(SessionStatus.EXPIRED);
                    log.info("Session expired - sessionId: {}, expiresAt: {}", session.getSessionId(), session.getExpiresAt());
                    throw new AtmException(ErrorKind.SESSION_EXPIRED, "Session has expired, please login again");
                }
                if (session.getStatus() == SessionStatus.ENDED) {
                    throw AtmException.sequence("Session was ended by a protocol error, login required");
                }
                session.setExpiresAt(now.plus(settings.getTtl()));
            }
            return action.apply(session);
        } catch (AtmException e) {
            if (e.isTerminal() && session.getStatus() == SessionStatus.ACTIVE) {
                session.setStatus(SessionStatus.ENDED);
                log.warn("Session ended - sessionId: {}, errorKind: {}", session.getSessionId(), e.getKind());
            }
            throw e;
        } finally {
            session.getLock().unlock();
        }
    }
}
