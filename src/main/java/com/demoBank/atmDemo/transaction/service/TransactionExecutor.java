package com.demoBank.atmDemo.transaction.service;

import com.demoBank.atmDemo.bank.dto.AccountSummary;
import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.common.exception.ResponseCode;
import com.demoBank.atmDemo.flow.service.ScreenFlowService;
import com.demoBank.atmDemo.intent.model.IntentField;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.ReceiptMode;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import com.demoBank.atmDemo.intent.service.IntentService;
import com.demoBank.atmDemo.limits.model.LimitCategory;
import com.demoBank.atmDemo.limits.model.RemainingLimits;
import com.demoBank.atmDemo.limits.service.DailyLimitTracker;
import com.demoBank.atmDemo.repository.AccountRepository;
import com.demoBank.atmDemo.repository.CustomerRepository;
import com.demoBank.atmDemo.repository.IntentRepository;
import com.demoBank.atmDemo.repository.TransactionRepository;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.service.SessionService;
import com.demoBank.atmDemo.transaction.dto.StructuredTransactionRequest;
import com.demoBank.atmDemo.transaction.dto.TransactionResult;
import com.demoBank.atmDemo.transaction.dto.TransactionView;
import com.demoBank.atmDemo.transaction.model.Transaction;
import com.demoBank.atmDemo.transaction.model.TransactionCommand;
import com.demoBank.atmDemo.transaction.model.TransactionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;

/**
 * Transaction executor - the only writer of account balances.
 *
 * For money movement, under the locks of every account involved:
 * 1. accounts must be ACTIVE
 * 2. debited account must cover the amount, otherwise a FAILED record is written and BALANCE_ERROR raised
 * 3. daily limit must allow the amount, otherwise LIMIT_ERROR with nothing written
 * 4. all balance legs are applied in one store write
 * 5. the COMPLETED record is written
 * 6. the daily limit total is incremented
 * The caller then marks the intent COMPLETED.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TransactionExecutor {

    private final SessionService sessionService;
    private final AccountRepository accountRepository;
    private final CustomerRepository customerRepository;
    private final TransactionRepository transactionRepository;
    private final IntentRepository intentRepository;
    private final DailyLimitTracker dailyLimitTracker;
    private final AccountLockManager accountLockManager;
    private final ScreenFlowService screenFlowService;
    private final Clock clock;

    public TransactionResult executeIntent(String token, String intentId) {
        return sessionService.execute(token, session -> executeIntent(session, intentId));
    }

    /**
     * Structured withdraw, deposit or transfer, recorded without an intent.
     */
    public TransactionResult executeStructured(String token, OperationType operation, StructuredTransactionRequest request) {
        return sessionService.execute(token, session -> {
            requirePinVerified(session);
            if (operation != OperationType.WITHDRAW && operation != OperationType.DEPOSIT && operation != OperationType.TRANSFER) {
                throw AtmException.validation("Unsupported operation: " + operation);
            }
            return executeCommand(session, TransactionCommand.builder()
                    .operation(operation)
                    .fromAccountId(operation.isDebit() ? required(request.getFromAccount(), "fromAccount") : null)
                    .toAccountId(operation.isCredit() ? required(request.getToAccount(), "toAccount") : null)
                    .amount(request.getAmount())
                    .currency(request.getCurrency())
                    .receiptMode(session.getPreferences() != null && session.getPreferences().getReceiptMode() != null
                            ? session.getPreferences().getReceiptMode()
                            : ReceiptMode.NONE)
                    .build());
        });
    }

    /**
     * Executes a READY_TO_EXECUTE intent. On success the intent is COMPLETED and its flow ends with a
     * success step. On a domain failure the flow ends with an error step and the intent goes back to
     * PENDING_DETAILS without its confirmation, so a retry starts clean.
     *
     * @throws AtmException INVALID_STATE if the intent is not ready
     */
    public TransactionResult executeIntent(AtmSession session, String intentId) {
        requirePinVerified(session);
        TransactionIntent intent = intentRepository.findById(intentId)
                .filter(candidate -> session.getSessionId().equals(candidate.getSessionId()))
                .orElseThrow(() -> AtmException.validation("Intent " + intentId + " not found"));
        if (intent.getStatus() != IntentStatus.READY_TO_EXECUTE) {
            throw AtmException.invalidState("Intent " + intentId + " is " + intent.getStatus() + ", it must be confirmed first");
        }

        TransactionCommand command = toCommand(intent);
        try {
            TransactionResult result = commit(session, command, intent.getId());
            intent.getTransactionIds().add(result.getTransaction().getTransactionId());
            intent.setStatus(IntentStatus.COMPLETED);
            intent.setUpdatedAt(clock.instant());
            screenFlowService.complete(intent, true, successMessage(result));
            return result;
        } catch (AtmException e) {
            Object failedId = e.getDetails().get("transactionId");
            if (failedId != null) {
                intent.getTransactionIds().add(failedId.toString());
            }
            intent.getContext().remove(IntentField.CONFIRM.getKey());
            intent.setStatus(IntentStatus.PENDING_DETAILS);
            intent.setUpdatedAt(clock.instant());
            screenFlowService.complete(intent, false, e.getMessage());
            log.info("Intent execution failed - sessionId: {}, intentId: {}, kind: {}", session.getSessionId(), intentId, e.getKind());
            throw e;
        }
    }

    public TransactionResult executeCommand(AtmSession session, TransactionCommand command) {
        return commit(session, command, null);
    }

    private TransactionResult commit(AtmSession session, TransactionCommand command, String intentId) {
        return switch (command.getOperation()) {
            case PIN_CHANGE -> changePin(session, command, intentId);
            case BALANCE_INQUIRY -> balanceInquiry(session, command, intentId);
            default -> moveMoney(session, command, intentId);
        };
    }

    private TransactionResult moveMoney(AtmSession session, TransactionCommand command, String intentId) {
        OperationType operation = command.getOperation();
        BigDecimal amount = IntentService.normalizeAmount(command.getAmount());
        String fromId = operation.isDebit() ? command.getFromAccountId() : null;
        String toId = operation.isCredit() ? command.getToAccountId() : null;
        if (fromId != null && fromId.equals(toId)) {
            throw AtmException.validation("Source and destination accounts must be different");
        }

        List<String> involved = new ArrayList<>();
        if (fromId != null) {
            involved.add(fromId);
        }
        if (toId != null) {
            involved.add(toId);
        }

        return accountLockManager.withLocks(involved, () -> {
            Account from = fromId != null ? ownedAccount(session, fromId) : null;
            Account to = toId != null ? ownedAccount(session, toId) : null;
            requireActive(from);
            requireActive(to);
            String currency = resolveCurrency(command, from != null ? from : to);
            if (from != null && to != null && !from.getCurrency().equals(to.getCurrency())) {
                throw AtmException.validation("Accounts use different currencies");
            }

            Instant now = clock.instant();
            LocalDate today = dailyLimitTracker.today();
            String transactionId = UUID.randomUUID().toString();

            if (from != null && from.getBalance().compareTo(amount) < 0) {
                transactionRepository.insert(record(transactionId, intentId, session, command, fromId, toId, amount, currency,
                        TransactionStatus.FAILED, now, "INSUFFICIENT_FUNDS"));
                log.info("Insufficient funds - sessionId: {}, account: {}, amount: {}", session.getSessionId(), fromId, amount);
                throw new AtmException(ErrorKind.BALANCE_ERROR, null, "Insufficient funds",
                        Map.of("transactionId", transactionId, "accountId", fromId), null);
            }

            LimitCategory category = LimitCategory.of(operation).orElseThrow();
            String limitedId = DailyLimitTracker.limitedAccountId(operation, fromId, toId);
            Account limited = limitedId.equals(fromId) ? from : to;
            dailyLimitTracker.check(limited, category, amount, today);

            Map<String, BigDecimal> balances = new LinkedHashMap<>();
            if (from != null) {
                balances.put(from.getId(), from.getBalance().subtract(amount));
            }
            if (to != null) {
                balances.put(to.getId(), to.getBalance().add(amount));
            }
            List<Account> updated = accountRepository.applyBalances(balances);

            Transaction transaction = transactionRepository.insert(record(transactionId, intentId, session, command,
                    fromId, toId, amount, currency, TransactionStatus.COMPLETED, now, null));

            dailyLimitTracker.record(limited.getId(), category, amount, today);

            Account limitedAfter = updated.stream().filter(account -> account.getId().equals(limited.getId())).findFirst().orElse(limited);
            log.info("Transaction completed - sessionId: {}, transactionId: {}, operation: {}, amount: {}, from: {}, to: {}",
                    session.getSessionId(), transactionId, operation, amount, fromId, toId);
            return result(transaction, updated, dailyLimitTracker.remainingLimits(limitedAfter, today));
        });
    }

    private TransactionResult balanceInquiry(AtmSession session, TransactionCommand command, String intentId) {
        String accountId = command.getFromAccountId();
        return accountLockManager.withLocks(List.of(accountId), () -> {
            Account account = ownedAccount(session, accountId);
            requireActive(account);
            Transaction transaction = transactionRepository.insert(record(UUID.randomUUID().toString(), intentId, session,
                    command, accountId, null, BigDecimal.ZERO.setScale(2), account.getCurrency(),
                    TransactionStatus.COMPLETED, clock.instant(), null));
            log.info("Balance inquiry - sessionId: {}, account: {}", session.getSessionId(), accountId);
            return result(transaction, List.of(account), dailyLimitTracker.remainingLimits(account, dailyLimitTracker.today()));
        });
    }

    private TransactionResult changePin(AtmSession session, TransactionCommand command, String intentId) {
        if (command.getNewPinHash() == null) {
            throw AtmException.validation("A new PIN is required");
        }
        Instant now = clock.instant();
        customerRepository.update(session.getCustomerId(), customer -> customer.toBuilder()
                        .pinHash(command.getNewPinHash())
                        .pinChangeCount(customer.getPinChangeCount() + 1)
                        .lastPinChange(now)
                        .build())
                .orElseThrow(() -> new AtmException(ErrorKind.AUTH_ERROR, "Customer not found"));
        Transaction transaction = transactionRepository.insert(record(UUID.randomUUID().toString(), intentId, session,
                command, null, null, BigDecimal.ZERO.setScale(2), null, TransactionStatus.COMPLETED, now, null));
        log.info("PIN changed - sessionId: {}", session.getSessionId());
        return result(transaction, List.of(), null);
    }

    private TransactionCommand toCommand(TransactionIntent intent) {
        OperationType operation = intent.getOperation();
        Map<String, String> metadata = new LinkedHashMap<>();
        putText(metadata, intent, IntentField.PAYEE);
        putText(metadata, intent, IntentField.CHECK_NUMBER);
        putText(metadata, intent, IntentField.MEMO);

        return TransactionCommand.builder()
                .operation(operation)
                .fromAccountId(operation == OperationType.BALANCE_INQUIRY ? intent.getAccount() : intent.getFromAccount())
                .toAccountId(intent.getToAccount())
                .amount(intent.getAmount())
                .currency(intent.getCurrency())
                .receiptMode(intent.getReceiptPreference())
                .newPinHash((String) intent.get(IntentField.NEW_PIN_BLOCK))
                .metadata(metadata)
                .build();
    }

    private Transaction record(String id, String intentId, AtmSession session, TransactionCommand command,
                               String fromId, String toId, BigDecimal amount, String currency,
                               TransactionStatus status, Instant timestamp, String failureReason) {
        return Transaction.builder()
                .id(id)
                .intentId(intentId)
                .sessionId(session.getSessionId())
                .operation(command.getOperation())
                .fromAccountId(fromId)
                .toAccountId(toId)
                .amount(amount)
                .currency(currency)
                .status(status)
                .timestamp(timestamp)
                .receiptMode(command.getReceiptMode())
                .failureReason(failureReason)
                .metadata(command.getMetadata())
                .build();
    }

    private Account ownedAccount(AtmSession session, String accountId) {
        return accountRepository.findById(accountId)
                .filter(account -> account.isOwnedBy(session.getCustomerId()))
                .orElseThrow(() -> AtmException.validation("Account " + accountId + " is not available"));
    }

    private static void requireActive(Account account) {
        if (account != null && !account.isActive()) {
            throw AtmException.invalidState("Account " + account.getMaskedNumber() + " is " + account.getStatus());
        }
    }

    private static String resolveCurrency(TransactionCommand command, Account account) {
        if (command.getCurrency() != null && !command.getCurrency().equalsIgnoreCase(account.getCurrency())) {
            throw AtmException.validation("Currency " + command.getCurrency() + " is not supported for this account");
        }
        return account.getCurrency();
    }

    private static TransactionResult result(Transaction transaction, List<Account> accounts, RemainingLimits remaining) {
        return TransactionResult.builder()
                .responseCode(ResponseCode.APPROVED.getCode())
                .transaction(TransactionView.from(transaction))
                .updatedAccounts(accounts.stream().map(AccountSummary::from).toList())
                .remainingLimits(remaining)
                .build();
    }

    private static String successMessage(TransactionResult result) {
        TransactionView view = result.getTransaction();
        return switch (view.getOperation()) {
            case BALANCE_INQUIRY -> "Balance shown";
            case PIN_CHANGE -> "PIN changed";
            default -> view.getOperation().name().toLowerCase(Locale.ROOT).replace('_', ' ') + " of " + view.getAmount().toPlainString() + " completed";
        };
    }

    private static void putText(Map<String, String> metadata, TransactionIntent intent, IntentField field) {
        Object value = intent.get(field);
        if (value != null) {
            metadata.put(field.getKey(), value.toString());
        }
    }

    private static String required(String value, String name) {
        if (value == null || value.isBlank()) {
            throw AtmException.validation(name + " is required");
        }
        return value.trim();
    }

    private static void requirePinVerified(AtmSession session) {
        if (!session.isPinVerified()) {
            throw AtmException.sequence("PIN validation is required before working with transactions");
        }
    }
}
