package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class PreferencesResponse {
    private String responseCode;
    private String actionCode;
    private String messageSequenceNumber;
    private String customerId;
    private String sessionLanguageCode;
    private String emailAddress;
    private String receiptPreferenceCode;
    private boolean fastCashEnabled;
    private BigDecimal fastCashTransactionAmount;
    private String fastCashSourceAccountNumber;
    private String fastCashSourceProductTypeCode;
}
