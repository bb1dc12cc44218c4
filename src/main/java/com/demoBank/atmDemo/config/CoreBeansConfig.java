package com.demoBank.atmDemo.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.security.crypto.bcrypt.BCryptPasswordEncoder;
import org.springframework.security.crypto.password.PasswordEncoder;

import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

@Configuration
public class CoreBeansConfig {

    /**
     * Single time source for session expiry and daily-limit dates.
     */
    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public PasswordEncoder pinEncoder() {
        return new BCryptPasswordEncoder();
    }

    /**
     * Runs assistant tool calls so each one can be bounded by the tool timeout.
     */
    @Bean(destroyMethod = "shutdownNow")
    public ExecutorService toolExecutor() {
        return Executors.newCachedThreadPool(new CustomizableThreadFactory("atm-tool-"));
    }
}
