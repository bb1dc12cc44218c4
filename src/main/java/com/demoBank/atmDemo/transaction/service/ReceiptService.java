package com.demoBank.atmDemo.transaction.service;

import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.bank.model.Customer;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.intent.model.ReceiptMode;
import com.demoBank.atmDemo.repository.AccountRepository;
import com.demoBank.atmDemo.repository.CustomerRepository;
import com.demoBank.atmDemo.repository.ReceiptRepository;
import com.demoBank.atmDemo.repository.TransactionRepository;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.model.SessionPreferences;
import com.demoBank.atmDemo.session.service.SessionService;
import com.demoBank.atmDemo.transaction.model.Receipt;
import com.demoBank.atmDemo.transaction.model.Transaction;
import com.demoBank.atmDemo.util.SensitiveDataMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Optional;
import java.util.UUID;

/**
 * Builds receipts for transactions of the session's customer.
 * Email receipts are recorded with their address; delivery happens outside this service.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ReceiptService {

    private static final DateTimeFormatter TIMESTAMP = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss 'UTC'")
            .withZone(ZoneOffset.UTC);

    private final SessionService sessionService;
    private final TransactionRepository transactionRepository;
    private final AccountRepository accountRepository;
    private final CustomerRepository customerRepository;
    private final ReceiptRepository receiptRepository;
    private final Clock clock;

    public Receipt createReceipt(String token, String transactionId, String mode, String email) {
        return sessionService.execute(token, session -> createReceipt(session, transactionId, mode, email));
    }

    public Receipt createReceipt(AtmSession session, String transactionId, String mode, String email) {
        if (!session.isPinVerified()) {
            throw AtmException.sequence("PIN validation is required before requesting receipts");
        }
        Transaction transaction = transactionRepository.findById(transactionId)
                .filter(candidate -> belongsTo(candidate, session))
                .orElseThrow(() -> AtmException.validation("Transaction " + transactionId + " not found"));

        SessionPreferences preferences = session.getPreferences();
        ReceiptMode receiptMode = mode != null ? parseMode(mode)
                : preferences != null && preferences.getReceiptMode() != null ? preferences.getReceiptMode()
                : transaction.getReceiptMode();

        String address = null;
        if (receiptMode == ReceiptMode.EMAIL) {
            address = Optional.ofNullable(email)
                    .or(() -> Optional.ofNullable(preferences).map(SessionPreferences::getEmail))
                    .or(() -> customerRepository.findById(session.getCustomerId()).map(Customer::getPrimaryEmail))
                    .orElseThrow(() -> AtmException.validation("An email address is required for email receipts"));
        }

        Receipt receipt = Receipt.builder()
                .id(UUID.randomUUID().toString())
                .transactionId(transaction.getId())
                .mode(receiptMode)
                .email(address)
                .content(receiptMode == ReceiptMode.NONE ? null : render(transaction))
                .createdAt(clock.instant())
                .build();
        receiptRepository.save(receipt);
        log.info("Receipt created - sessionId: {}, transactionId: {}, mode: {}", session.getSessionId(), transactionId, receiptMode);
        return receipt;
    }

    private boolean belongsTo(Transaction transaction, AtmSession session) {
        if (session.getSessionId().equals(transaction.getSessionId())) {
            return true;
        }
        return ownedBy(transaction.getFromAccountId(), session) || ownedBy(transaction.getToAccountId(), session);
    }

    private boolean ownedBy(String accountId, AtmSession session) {
        return accountId != null && accountRepository.findById(accountId)
                .map(account -> account.isOwnedBy(session.getCustomerId()))
                .orElse(false);
    }

    private String render(Transaction transaction) {
        StringBuilder content = new StringBuilder()
                .append("DEMO BANK ATM\n")
                .append("Date: ").append(TIMESTAMP.format(transaction.getTimestamp())).append('\n')
                .append("Transaction: ").append(transaction.getId()).append('\n')
                .append("Operation: ").append(transaction.getOperation()).append('\n');
        maskedNumber(transaction.getFromAccountId()).ifPresent(number -> content.append("From: ").append(number).append('\n'));
        maskedNumber(transaction.getToAccountId()).ifPresent(number -> content.append("To: ").append(number).append('\n'));
        if (transaction.getCurrency() != null && transaction.getAmount().signum() > 0) {
            content.append("Amount: ").append(transaction.getAmount().toPlainString()).append(' ').append(transaction.getCurrency()).append('\n');
        }
        content.append("Status: ").append(transaction.getStatus());
        return content.toString();
    }

    private Optional<String> maskedNumber(String accountId) {
        if (accountId == null) {
            return Optional.empty();
        }
        return Optional.of(accountRepository.findById(accountId)
                .map(Account::getMaskedNumber)
                .orElseGet(() -> SensitiveDataMasker.maskId(accountId)));
    }

    static ReceiptMode parseMode(String mode) {
        try {
            return ReceiptMode.valueOf(mode.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AtmException(ErrorKind.VALIDATION_ERROR, "Receipt mode must be one of PRINT, EMAIL, NONE", e);
        }
    }
}
