package com.demoBank.atmDemo.transaction.dto;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Digits;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Direct withdraw, deposit or transfer request that bypasses the intent engine.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class StructuredTransactionRequest {

    private String fromAccount;
    private String toAccount;

    @NotNull
    @DecimalMin(value = "0.01")
    @Digits(integer = 12, fraction = 2)
    private BigDecimal amount;

    private String currency;
}
