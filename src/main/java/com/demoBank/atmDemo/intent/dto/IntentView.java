package com.demoBank.atmDemo.intent.dto;

import com.demoBank.atmDemo.intent.model.IntentField;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class IntentView {

    private static final String HIDDEN = "****";

    private String intentId;
    private OperationType operation;
    private IntentStatus status;
    private Map<String, Object> context;
    private List<String> missingFields;
    private List<String> clarificationQuestions;
    private List<String> transactionIds;
    private Instant updatedAt;

    public static IntentView from(TransactionIntent intent, List<String> clarificationQuestions) {
        Map<String, Object> context = new LinkedHashMap<>(intent.getContext());
        context.computeIfPresent(IntentField.NEW_PIN_BLOCK.getKey(), (key, value) -> HIDDEN);
        return IntentView.builder()
                .intentId(intent.getId())
                .operation(intent.getOperation())
                .status(intent.getStatus())
                .context(context)
                .missingFields(List.copyOf(intent.getMissingFields()))
                .clarificationQuestions(clarificationQuestions)
                .transactionIds(List.copyOf(intent.getTransactionIds()))
                .updatedAt(intent.getUpdatedAt())
                .build();
    }
}
