package com.demoBank.atmDemo.transaction.model;

import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.ReceiptMode;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Map;

/**
 * Fully resolved instruction for the executor, built from a ready intent or a structured request.
 */
@Value
@Builder
public class TransactionCommand {

    OperationType operation;
    String fromAccountId;
    String toAccountId;
    BigDecimal amount;
    String currency;

    @Builder.Default
    ReceiptMode receiptMode = ReceiptMode.NONE;

    /**
     * BCrypt hash of the new PIN, PIN_CHANGE only.
     */
    String newPinHash;

    @Builder.Default
    Map<String, String> metadata = Map.of();
}
