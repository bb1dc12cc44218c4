package com.demoBank.atmDemo.limits.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class RemainingLimits {
    private String accountId;
    private LocalDate date;
    private String currency;
    private BigDecimal withdrawal;
    private BigDecimal deposit;
    private BigDecimal transfer;
}
