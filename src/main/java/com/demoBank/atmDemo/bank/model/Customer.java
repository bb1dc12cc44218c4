package com.demoBank.atmDemo.bank.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.time.Instant;

@Value
@Builder(toBuilder = true)
public class Customer {

    String id;
    String name;
    String primaryEmail;

    @Builder.Default
    String preferredLanguage = "en";

    /**
     * BCrypt hash; only read by the PIN service.
     */
    @JsonIgnore
    @ToString.Exclude
    String pinHash;

    int pinChangeCount;
    Instant lastPinChange;
}
