package com.demoBank.atmDemo.intent.dto;

import com.demoBank.atmDemo.intent.model.OperationType;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Create-or-update request for an intent. Without an intent id a new intent is started.
 * Structured answers win over anything extracted from the natural-language text.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntentInput {

    private String intentId;
    private OperationType operation;

    /**
     * Field name to answer, e.g. {@code amount -> 50}. {@code pinBlock} is accepted and verified but never stored.
     */
    @Builder.Default
    private Map<String, Object> answers = new LinkedHashMap<>();

    @Size(max = 500)
    private String naturalLanguage;
}
