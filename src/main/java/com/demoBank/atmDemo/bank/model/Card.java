package com.demoBank.atmDemo.bank.model;

import lombok.Builder;
import lombok.ToString;
import lombok.Value;

import java.math.BigDecimal;
import java.time.YearMonth;

/**
 * Physical card. The full PAN never leaves the card resolver; everything else uses {@link #maskedPan}.
 */
@Value
@Builder(toBuilder = true)
public class Card {

    String id;

    @ToString.Exclude
    String pan;

    String maskedPan;

    String customerId;

    @Builder.Default
    String cardType = "DEBIT";

    @Builder.Default
    CardStatus status = CardStatus.ACTIVE;

    YearMonth expiry;

    @Builder.Default
    int minPinLength = 4;

    @Builder.Default
    int maxPinLength = 6;

    BigDecimal fastCashAmount;

    public boolean isExpiredAt(YearMonth current) {
        return expiry != null && expiry.isBefore(current);
    }
}
