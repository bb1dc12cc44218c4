package com.demoBank.atmDemo.orchestrator.model;

import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Append-only conversation log entry. SYSTEM entries record tool errors for audit and are never sent to the model.
 */
@Value
@Builder
public class ConversationMessage {
    String sessionId;
    MessageSender sender;
    String content;
    Instant timestamp;
}
