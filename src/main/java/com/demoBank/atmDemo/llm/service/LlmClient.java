package com.demoBank.atmDemo.llm.service;

import com.demoBank.atmDemo.llm.dto.GroqApiRequest;
import com.demoBank.atmDemo.llm.dto.GroqApiResponse;

import java.util.List;

/**
 * Chat-completions model with tool calling.
 */
public interface LlmClient {

    /**
     * One completion round. Implementations do not retry.
     *
     * @throws com.demoBank.atmDemo.common.exception.AtmException LLM_UNAVAILABLE when the model cannot be reached
     */
    GroqApiResponse complete(List<GroqApiRequest.Message> messages, List<GroqApiRequest.Tool> tools);
}
