package com.demoBank.atmDemo.gateway.exception;

/**
 * Exception thrown when a session sends more chat messages than the per-minute limit.
 */
public class RateLimitExceededException extends RuntimeException {

    public RateLimitExceededException(String message) {
        super(message);
    }
}
