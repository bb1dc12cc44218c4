package com.demoBank.atmDemo.bank.dto;

import com.demoBank.atmDemo.limits.model.RemainingLimits;
import com.demoBank.atmDemo.transaction.dto.TransactionView;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountDetails {

    private AccountSummary account;
    private RemainingLimits remainingLimits;

    /**
     * Most recent transactions first.
     */
    private List<TransactionView> recentTransactions;
}
