package com.demoBank.atmDemo.intent.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Transaction request being specified. The context map is the single source of truth for
 * collected answers; typed accessors below read from it.
 * Owned by its session; immutable once COMPLETED or CANCELLED.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionIntent {

    private String id;
    private String sessionId;
    private String customerId;
    private OperationType operation;

    @Builder.Default
    private IntentStatus status = IntentStatus.PENDING_DETAILS;

    @Builder.Default
    private Map<String, Object> context = new LinkedHashMap<>();

    @Builder.Default
    private List<String> missingFields = new ArrayList<>();

    /**
     * Transactions produced by this intent, in execution order.
     */
    @Builder.Default
    private List<String> transactionIds = new ArrayList<>();

    private Instant createdAt;
    private Instant updatedAt;

    public Object get(IntentField field) {
        return context.get(field.getKey());
    }

    public boolean has(IntentField field) {
        return context.get(field.getKey()) != null;
    }

    public String getFromAccount() {
        return (String) get(IntentField.FROM_ACCOUNT);
    }

    public String getToAccount() {
        return (String) get(IntentField.TO_ACCOUNT);
    }

    public String getAccount() {
        return (String) get(IntentField.ACCOUNT);
    }

    public BigDecimal getAmount() {
        return (BigDecimal) get(IntentField.AMOUNT);
    }

    public String getCurrency() {
        return (String) get(IntentField.CURRENCY);
    }

    public ReceiptMode getReceiptPreference() {
        Object value = get(IntentField.RECEIPT_PREFERENCE);
        return value != null ? (ReceiptMode) value : ReceiptMode.NONE;
    }

    public boolean isConfirmed() {
        return Boolean.TRUE.equals(get(IntentField.CONFIRM));
    }

    public boolean isTerminal() {
        return status.isTerminal();
    }
}
