package com.demoBank.atmDemo.orchestrator.tool;

import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.demoBank.atmDemo.intent.dto.IntentView;
import lombok.Getter;
import lombok.Setter;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

/**
 * State of one chat turn shared by its tool calls.
 */
@Getter
public class ToolCallContext {

    private final String token;
    private final String sessionId;
    private String pinBlock;

    /**
     * Every number that appeared in a tool result during this turn.
     */
    private final Set<BigDecimal> groundedNumbers = new HashSet<>();

    @Setter
    private IntentView intent;

    @Setter
    private ScreenFlow flow;

    public ToolCallContext(String token, String sessionId, String pinBlock) {
        this.token = token;
        this.sessionId = sessionId;
        this.pinBlock = pinBlock;
    }

    /**
     * Hands out the keypad PIN data once; later calls get null.
     */
    public synchronized String takePinBlock() {
        String block = pinBlock;
        pinBlock = null;
        return block;
    }

    public synchronized boolean hasPinBlock() {
        return pinBlock != null;
    }
}
