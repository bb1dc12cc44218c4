package com.demoBank.atmDemo.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

@Data
@Configuration
@ConfigurationProperties(prefix = "atm")
public class AtmProperties {

    private String defaultCurrency = "USD";
    private String seedResource = "data/bank-seed.json";
    private Session session = new Session();
    private Pin pin = new Pin();
    private Orchestrator orchestrator = new Orchestrator();
    private Chat chat = new Chat();

    @Data
    public static class Session {
        private Duration ttl = Duration.ofMinutes(30);
        /**
         * How long a request waits for another in-flight request on the same session.
         */
        private Duration lockWait = Duration.ofSeconds(5);
        /**
         * How long an identical login request is answered from the replay cache.
         */
        private Duration replayWindow = Duration.ofMinutes(2);
        private long maxSessions = 10_000;
        /**
         * Interval of the idle-session sweep, read by the scheduler.
         */
        private long sweepIntervalMs = 60_000;
    }

    @Data
    public static class Pin {
        private int maxAttempts = 3;
    }

    @Data
    public static class Orchestrator {
        private int maxIterations = 6;
        private int historyWindow = 10;
        private Duration toolTimeout = Duration.ofSeconds(10);
    }

    @Data
    public static class Chat {
        private int maxRequestsPerMinute = 15;
    }
}
