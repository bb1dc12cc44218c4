package com.demoBank.atmDemo.transaction.model;

import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.ReceiptMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.Map;

/**
 * Immutable transaction record. Written once with a terminal status.
 */
@Value
@Builder
public class Transaction {

    String id;

    /**
     * Null for structured calls that bypass the intent engine.
     */
    String intentId;

    String sessionId;
    OperationType operation;
    String fromAccountId;
    String toAccountId;
    BigDecimal amount;
    String currency;
    TransactionStatus status;
    Instant timestamp;

    @Builder.Default
    ReceiptMode receiptMode = ReceiptMode.NONE;

    String failureReason;

    @Builder.Default
    Map<String, String> metadata = Map.of();

    public boolean involves(String accountId) {
        return accountId.equals(fromAccountId) || accountId.equals(toAccountId);
    }
}
