package com.demoBank.atmDemo.orchestrator.tool;

import java.util.Map;

@FunctionalInterface
public interface ToolHandler {

    /**
     * @return a JSON-serializable result
     */
    Object handle(Map<String, Object> arguments, ToolCallContext context);
}
