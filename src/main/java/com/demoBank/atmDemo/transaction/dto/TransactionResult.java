package com.demoBank.atmDemo.transaction.dto;

import com.demoBank.atmDemo.bank.dto.AccountSummary;
import com.demoBank.atmDemo.limits.model.RemainingLimits;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Outcome of a committed transaction: the record, the accounts it touched and what is left of the day's limits.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class TransactionResult {

    private String responseCode;
    private TransactionView transaction;
    private List<AccountSummary> updatedAccounts;
    private RemainingLimits remainingLimits;
}
