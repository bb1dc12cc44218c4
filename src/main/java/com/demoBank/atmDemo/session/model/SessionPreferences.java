package com.demoBank.atmDemo.session.model;

import com.demoBank.atmDemo.intent.model.ReceiptMode;
import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class SessionPreferences {
    String language;
    String email;
    ReceiptMode receiptMode;
    boolean fastCash;
}
