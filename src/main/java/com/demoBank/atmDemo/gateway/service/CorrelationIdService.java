package com.demoBank.atmDemo.gateway.service;

import org.springframework.stereotype.Service;

import java.util.UUID;

/**
 * Service for generating correlation IDs for request tracking.
 */
@Service
public class CorrelationIdService {

    public static final String HEADER = "X-Correlation-ID";

    /**
     * Uses the caller's correlation ID when it sent one, otherwise generates a new one.
     */
    public String resolveCorrelationId(String header) {
        if (header != null && !header.isBlank() && header.length() <= 64) {
            return header.trim();
        }
        return UUID.randomUUID().toString();
    }
}
