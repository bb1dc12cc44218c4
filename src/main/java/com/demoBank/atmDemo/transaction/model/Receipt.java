package com.demoBank.atmDemo.transaction.model;

import com.demoBank.atmDemo.intent.model.ReceiptMode;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

@Value
@Builder
public class Receipt {
    String id;
    String transactionId;
    ReceiptMode mode;
    String email;
    String content;
    Instant createdAt;
}
