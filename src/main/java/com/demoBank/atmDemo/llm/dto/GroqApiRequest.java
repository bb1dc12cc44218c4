package com.demoBank.atmDemo.llm.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Request DTO for Groq API chat completions with tool calling.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class GroqApiRequest {

    @JsonProperty("messages")
    private List<Message> messages;

    @JsonProperty("model")
    private String model;

    @JsonProperty("temperature")
    private Double temperature;

    @JsonProperty("max_completion_tokens")
    private Integer maxCompletionTokens;

    @JsonProperty("top_p")
    private Double topP;

    @JsonProperty("stream")
    private Boolean stream;

    @JsonProperty("tools")
    private List<Tool> tools;

    /**
     * "none", "auto" or a specific tool object.
     */
    @JsonProperty("tool_choice")
    private Object toolChoice;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class Message {
        @JsonProperty("role")
        private String role;

        @JsonProperty("content")
        private String content;

        @JsonProperty("tool_calls")
        private List<GroqApiResponse.ToolCall> toolCalls;

        @JsonProperty("tool_call_id")
        private String toolCallId;

        @JsonProperty("name")
        private String name;

        public static Message system(String content) {
            return Message.builder().role("system").content(content).build();
        }

        public static Message user(String content) {
            return Message.builder().role("user").content(content).build();
        }

        public static Message assistant(String content) {
            return Message.builder().role("assistant").content(content).build();
        }

        public static Message assistantToolCalls(List<GroqApiResponse.ToolCall> toolCalls) {
            return Message.builder().role("assistant").toolCalls(toolCalls).build();
        }

        public static Message tool(String toolCallId, String name, String content) {
            return Message.builder().role("tool").toolCallId(toolCallId).name(name).content(content).build();
        }
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Tool {
        @JsonProperty("type")
        @Builder.Default
        private String type = "function";

        @JsonProperty("function")
        private Function function;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    public static class Function {
        @JsonProperty("name")
        private String name;

        @JsonProperty("description")
        private String description;

        @JsonProperty("parameters")
        private Map<String, Object> parameters;
    }
}
