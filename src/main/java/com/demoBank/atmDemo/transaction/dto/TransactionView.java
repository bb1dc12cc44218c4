package com.demoBank.atmDemo.transaction.dto;

import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.transaction.model.Transaction;
import com.demoBank.atmDemo.transaction.model.TransactionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionView {

    private String transactionId;
    private String intentId;
    private OperationType operation;
    private String fromAccount;
    private String toAccount;
    private BigDecimal amount;
    private String currency;
    private TransactionStatus status;
    private Instant timestamp;
    private String failureReason;

    public static TransactionView from(Transaction transaction) {
        return TransactionView.builder()
                .transactionId(transaction.getId())
                .intentId(transaction.getIntentId())
                .operation(transaction.getOperation())
                .fromAccount(transaction.getFromAccountId())
                .toAccount(transaction.getToAccountId())
                .amount(transaction.getAmount())
                .currency(transaction.getCurrency())
                .status(transaction.getStatus())
                .timestamp(transaction.getTimestamp())
                .failureReason(transaction.getFailureReason())
                .build();
    }
}
