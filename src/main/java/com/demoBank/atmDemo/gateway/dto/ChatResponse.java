package com.demoBank.atmDemo.gateway.dto;

import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.demoBank.atmDemo.intent.dto.IntentView;
import com.demoBank.atmDemo.orchestrator.model.ConversationMessage;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Response DTO for chat messages.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ChatResponse {

    private String answer;
    private String correlationId;

    /**
     * Messages logged for the customer during this turn.
     */
    private List<ConversationMessage> messages;

    private IntentView intent;
    private ScreenFlow flow;

    /**
     * Set when a tool failure ended the session; the client must log in again.
     */
    private String errorKind;
    private String responseCode;
    private boolean terminal;
}
