package com.demoBank.atmDemo.gateway.service;

import com.demoBank.atmDemo.config.AtmProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Simple in-memory sliding-window rate limiter for chat messages, keyed by session.
 */
@Slf4j
@Service
public class RateLimiter {

    private static final long WINDOW_SIZE_SECONDS = 60;

    private final int maxRequestsPerMinute;
    private final Clock clock;

    // sessionId -> request timestamps inside the window
    private final Map<String, RequestWindow> sessionWindows = new ConcurrentHashMap<>();

    public RateLimiter(AtmProperties properties, Clock clock) {
        this.maxRequestsPerMinute = properties.getChat().getMaxRequestsPerMinute();
        this.clock = clock;
    }

    /**
     * Records the request if the session is still under its limit.
     *
     * @return true if request is allowed, false if rate limit exceeded
     */
    public boolean isAllowed(String sessionId) {
        RequestWindow window = sessionWindows.computeIfAbsent(sessionId, k -> new RequestWindow());
        Instant now = clock.instant();
        if (!window.tryAdd(now, maxRequestsPerMinute)) {
            log.warn("Rate limit exceeded - sessionId: {}", sessionId);
            return false;
        }
        return true;
    }

    public void forget(String sessionId) {
        sessionWindows.remove(sessionId);
    }

    private static class RequestWindow {
        private final Deque<Instant> requests = new ArrayDeque<>();

        synchronized boolean tryAdd(Instant now, int max) {
            Instant cutoff = now.minusSeconds(WINDOW_SIZE_SECONDS);
            while (!requests.isEmpty() && !requests.peekFirst().isAfter(cutoff)) {
                requests.pollFirst();
            }
            if (requests.size() >= max) {
                return false;
            }
            requests.addLast(now);
            return true;
        }
    }
}
