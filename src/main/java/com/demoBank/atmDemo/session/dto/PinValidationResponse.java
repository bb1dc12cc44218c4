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
public class PinValidationResponse {

    private String responseCode;
    private String actionCode;
    private String messageSequenceNumber;
    private String primaryAccountNumber;
    private String transactionMode;
    private String breadcrumb;
    private String intendedWkstState;
    private List<AccountInfo> accounts;
    private List<String> supportedTransactions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class AccountInfo {
        private String accountId;
        private String accountNumber;
        private String accountType;
        private BigDecimal balance;
        private String currency;
    }
}
