package com.demoBank.atmDemo.bank.dto;

import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.bank.model.AccountType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;

/**
 * Client-facing view of an account with its live balance. Only the masked number is exposed.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AccountSummary {

    private String accountId;
    private String accountNumber;
    private String name;
    private AccountType type;
    private String currency;
    private BigDecimal balance;

    public static AccountSummary from(Account account) {
        return AccountSummary.builder()
                .accountId(account.getId())
                .accountNumber(account.getMaskedNumber())
                .name(account.getName())
                .type(account.getType())
                .currency(account.getCurrency())
                .balance(account.getBalance())
                .build();
    }
}
