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
public class WithdrawalAuthorizeResponse {

    private String responseCode;
    private String actionCode;
    private String messageSequenceNumber;
    private String hostTransactionNumber;
    private String transactionId;
    private BigDecimal transactionAmount;
    private String currency;
    private int fractionDigits;
    private DebitedAccount debitedAccount;
    private MoneyAmount withdrawalDailyLimits;
    private MoneyAmount accountInformation;
    private EmvAuthorizeData emvAuthorizeResponseData;
    private List<String> enabledTransactions;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class DebitedAccount {
        private String accountNumber;
        private String accountType;
    }

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class MoneyAmount {
        private BigDecimal amount;
        private String currencyCode;
        private int fractionDigits;
    }
}
