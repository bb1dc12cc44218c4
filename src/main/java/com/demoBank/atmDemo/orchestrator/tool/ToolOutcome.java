package com.demoBank.atmDemo.orchestrator.tool;

import com.demoBank.atmDemo.common.exception.AtmException;
import lombok.Builder;
import lombok.Value;

/**
 * Result of one tool call as fed back to the model. {@code error} is set when the domain call failed.
 */
@Value
@Builder
public class ToolOutcome {
    String toolCallId;
    String toolName;
    String content;
    AtmException error;

    public boolean isFailure() {
        return error != null;
    }

    public boolean isTerminalFailure() {
        return error != null && error.isTerminal();
    }
}
