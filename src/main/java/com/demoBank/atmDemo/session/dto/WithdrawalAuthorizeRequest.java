package com.demoBank.atmDemo.session.dto;

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import lombok.ToString;

import java.math.BigDecimal;

/**
 * Phase 5 request: cash withdrawal with a re-supplied PIN block.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
public class WithdrawalAuthorizeRequest {

    @NotBlank
    private String clientId;

    @NotBlank
    private String clientRequestNumber;

    private String clientRequestTime;
    private String clientUniqueHardwareId;
    private String cardPosition;

    @NotBlank
    private String hostTransactionNumber;

    @NotBlank
    @ToString.Exclude
    private String encryptedPinData;

    private EmvAuthorizeData emvAuthorizeRequestData;
    private String cardTechnology;

    @Valid
    @NotNull
    private SourceAccount sourceAccount;

    @NotNull
    @DecimalMin(value = "0.01")
    @Digits(integer = 12, fraction = 2)
    private BigDecimal requestedAmount;

    @NotBlank
    private String currency;

    @Data
    @NoArgsConstructor
    @AllArgsConstructor
    @Builder
    @JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
    public static class SourceAccount {

        /**
         * Account id, full or masked account number.
         */
        @NotBlank
        private String number;

        private String type;
        private String subtype;
    }
}
