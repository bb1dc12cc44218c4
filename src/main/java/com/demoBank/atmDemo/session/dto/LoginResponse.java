package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class LoginResponse {

    private String responseCode;
    private String sessionToken;
    private List<String> enabledTransactions;
    private String consumerGroup;
    private String extendedTransactionResponseCode;
    private List<String> cardDataElementEntitlements;
    private CardProductProperties cardProductProperties;
    private List<String> transactionsSupported;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class CardProductProperties {
        private int minPinLength;
        private int maxPinLength;
        private boolean fastSupported;
        private BigDecimal fastCashAmount;
    }
}
