package com.demoBank.atmDemo.llm.service;

import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.llm.dto.GroqApiRequest;
import com.demoBank.atmDemo.llm.dto.GroqApiResponse;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.time.Duration;
import java.util.List;

/**
 * Client for interacting with Groq API.
 * Handles HTTP communication with Groq's chat completions endpoint.
 */
@Slf4j
@Service
public class GroqApiClient implements LlmClient {

    private final RestClient restClient;
    private final String apiKey;
    private final String model;
    private final Double temperature;
    private final Integer maxCompletionTokens;

    public GroqApiClient(RestClient.Builder restClientBuilder,
                         @Value("${groq.api.url}") String apiUrl,
                         @Value("${groq.api.key:}") String apiKey,
                         @Value("${groq.api.model:llama-3.3-70b-versatile}") String model,
                         @Value("${groq.api.temperature:0.2}") Double temperature,
                         @Value("${groq.api.max-completion-tokens:1024}") Integer maxCompletionTokens,
                         @Value("${groq.api.connect-timeout:5s}") Duration connectTimeout,
                         @Value("${groq.api.read-timeout:30s}") Duration readTimeout) {
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(connectTimeout);
        requestFactory.setReadTimeout(readTimeout);
        this.restClient = restClientBuilder
                .baseUrl(apiUrl)
                .requestFactory(requestFactory)
                .defaultHeader(HttpHeaders.CONTENT_TYPE, MediaType.APPLICATION_JSON_VALUE)
                .build();
        this.apiKey = apiKey;
        this.model = model;
        this.temperature = temperature;
        this.maxCompletionTokens = maxCompletionTokens;
    }

    /**
     * Calls Groq API with function calling support.
     *
     * @param messages full conversation window, system prompt first
     * @param tools tools the model may call
     * @return GroqApiResponse with either content or tool calls
     * @throws AtmException LLM_UNAVAILABLE if the key is missing, the call fails or times out
     */
    @Override
    public GroqApiResponse complete(List<GroqApiRequest.Message> messages, List<GroqApiRequest.Tool> tools) {
        if (apiKey == null || apiKey.isBlank()) {
            throw new AtmException(ErrorKind.LLM_UNAVAILABLE, "Assistant is not configured");
        }

        GroqApiRequest request = GroqApiRequest.builder()
                .messages(messages)
                .model(model)
                .temperature(temperature)
                .maxCompletionTokens(maxCompletionTokens)
                .topP(1.0)
                .stream(false)
                .tools(tools == null || tools.isEmpty() ? null : tools)
                .toolChoice(tools == null || tools.isEmpty() ? null : "auto")
                .build();

        try {
            log.debug("Calling Groq API with tools - model: {}, messages: {}, tools: {}",
                    model, messages.size(), tools != null ? tools.size() : 0);

            GroqApiResponse response = restClient.post()
                    .header(HttpHeaders.AUTHORIZATION, "Bearer " + apiKey)
                    .body(request)
                    .retrieve()
                    .body(GroqApiResponse.class);

            if (response == null) {
                throw new AtmException(ErrorKind.LLM_UNAVAILABLE, "Assistant returned an empty response");
            }

            log.debug("Groq API response received - model: {}, tokens used: {}, hasToolCalls: {}",
                    response.getModel(),
                    response.getUsage() != null ? response.getUsage().getTotalTokens() : "unknown",
                    response.hasToolCalls());

            return response;

        } catch (RestClientException e) {
            log.error("Error calling Groq API with tools", e);
            throw new AtmException(ErrorKind.LLM_UNAVAILABLE, "Assistant is temporarily unavailable", e);
        }
    }
}
