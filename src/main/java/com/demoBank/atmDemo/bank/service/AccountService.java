package com.demoBank.atmDemo.bank.service;

import com.demoBank.atmDemo.bank.dto.AccountDetails;
import com.demoBank.atmDemo.bank.dto.AccountSummary;
import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.limits.model.RemainingLimits;
import com.demoBank.atmDemo.limits.service.DailyLimitTracker;
import com.demoBank.atmDemo.repository.AccountRepository;
import com.demoBank.atmDemo.repository.TransactionRepository;
import com.demoBank.atmDemo.transaction.dto.TransactionView;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Locale;

/**
 * Read side of the account store, scoped to one customer.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class AccountService {

    private static final int RECENT_TRANSACTIONS = 10;

    private final AccountRepository accountRepository;
    private final TransactionRepository transactionRepository;
    private final DailyLimitTracker dailyLimitTracker;

    public List<AccountSummary> listAccounts(String customerId) {
        return accountRepository.findByCustomerId(customerId).stream()
                .map(AccountSummary::from)
                .toList();
    }

    /**
     * @throws AtmException VALIDATION_ERROR if the account does not exist or belongs to someone else
     */
    public Account getOwnedAccount(String customerId, String accountId) {
        return accountRepository.findById(accountId)
                .filter(account -> account.isOwnedBy(customerId))
                .orElseThrow(() -> AtmException.validation("Account " + accountId + " is not available"));
    }

    /**
     * Resolves an account reference given by a client or the assistant: the account id,
     * the full or masked account number, or the account type when the customer has exactly one of it.
     */
    public Account resolveOwnedAccount(String customerId, String reference) {
        if (reference == null || reference.isBlank()) {
            throw AtmException.validation("Account reference is required");
        }
        String ref = reference.trim();
        List<Account> owned = accountRepository.findByCustomerId(customerId);
        for (Account account : owned) {
            if (account.getId().equals(ref)
                    || ref.equals(account.getAccountNumber())
                    || ref.equals(account.getMaskedNumber())) {
                return account;
            }
        }
        String typeWord = ref.toUpperCase(Locale.ROOT);
        List<Account> byType = owned.stream()
                .filter(account -> account.getType().name().equals(typeWord))
                .toList();
        if (byType.size() == 1) {
            return byType.get(0);
        }
        throw AtmException.validation("Account " + reference + " is not available");
    }

    public AccountDetails getAccountDetails(String customerId, String accountId) {
        Account account = getOwnedAccount(customerId, accountId);
        List<TransactionView> recent = transactionRepository.findByAccountId(account.getId(), RECENT_TRANSACTIONS).stream()
                .map(TransactionView::from)
                .toList();
        return AccountDetails.builder()
                .account(AccountSummary.from(account))
                .remainingLimits(dailyLimitTracker.remainingLimits(account, dailyLimitTracker.today()))
                .recentTransactions(recent)
                .build();
    }

    public RemainingLimits getRemainingLimits(String customerId, String accountId) {
        Account account = getOwnedAccount(customerId, accountId);
        return dailyLimitTracker.remainingLimits(account, dailyLimitTracker.today());
    }
}
