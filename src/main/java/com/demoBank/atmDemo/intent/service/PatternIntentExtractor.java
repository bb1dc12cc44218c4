package com.demoBank.atmDemo.intent.service;

import com.demoBank.atmDemo.bank.dto.AccountSummary;
import com.demoBank.atmDemo.bank.model.AccountType;
import com.demoBank.atmDemo.intent.model.IntentField;
import com.demoBank.atmDemo.intent.model.OperationType;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic keyword extraction for typed requests such as "transfer 50 from checking to savings".
 * Only fills what the text states; nothing is defaulted.
 */
@Slf4j
@Component
public class PatternIntentExtractor {

    private static final Pattern AMOUNT = Pattern.compile("\\$?\\s?(\\d{1,3}(?:,\\d{3})+|\\d+)(\\.\\d{1,2})?");
    private static final Pattern FROM_ACCOUNT = Pattern.compile("\\bfrom\\s+(?:my\\s+)?(checking|savings)\\b");
    private static final Pattern TO_ACCOUNT = Pattern.compile("\\b(?:to|into)\\s+(?:my\\s+)?(checking|savings)\\b");
    private static final Pattern ANY_ACCOUNT = Pattern.compile("\\b(checking|savings)\\b");
    private static final Pattern CHECK_NUMBER = Pattern.compile("\\bcheck\\s*(?:number|no\\.?|#)\\s*(\\w+)");
    private static final Pattern PAYEE = Pattern.compile("\\bpay\\s+(?:the\\s+)?([a-z][a-z .&'-]*?)(?:\\s+(?:\\$?\\d|from\\b)|$)");

    public record Extraction(OperationType operation, Map<String, Object> answers) {}

    public Extraction extract(String text, List<AccountSummary> accounts) {
        String message = text.toLowerCase(Locale.ROOT).trim();
        OperationType operation = detectOperation(message);
        Map<String, Object> answers = new LinkedHashMap<>();

        if (operation == null) {
            log.debug("No operation recognized in message");
            return new Extraction(null, answers);
        }

        String amountText = message;
        if (operation == OperationType.CHECK_DEPOSIT) {
            Matcher checkNumber = CHECK_NUMBER.matcher(message);
            if (checkNumber.find()) {
                answers.put(IntentField.CHECK_NUMBER.getKey(), checkNumber.group(1));
                amountText = message.substring(0, checkNumber.start()) + message.substring(checkNumber.end());
            }
        }

        if (operation != OperationType.BALANCE_INQUIRY && operation != OperationType.PIN_CHANGE) {
            BigDecimal amount = extractAmount(amountText);
            if (amount != null) {
                answers.put(IntentField.AMOUNT.getKey(), amount);
            }
        }

        String from = accountFor(FROM_ACCOUNT, message, accounts);
        String to = accountFor(TO_ACCOUNT, message, accounts);
        String mentioned = accountFor(ANY_ACCOUNT, message, accounts);

        switch (operation) {
            case WITHDRAW -> putIfPresent(answers, IntentField.FROM_ACCOUNT, from != null ? from : mentioned);
            case DEPOSIT, CASH_DEPOSIT, CHECK_DEPOSIT -> putIfPresent(answers, IntentField.TO_ACCOUNT, to != null ? to : mentioned);
            case TRANSFER -> {
                putIfPresent(answers, IntentField.FROM_ACCOUNT, from);
                putIfPresent(answers, IntentField.TO_ACCOUNT, to);
            }
            case PAYMENT, BILL_PAYMENT -> {
                putIfPresent(answers, IntentField.FROM_ACCOUNT, from);
                Matcher payee = PAYEE.matcher(message);
                if (payee.find() && !payee.group(1).isBlank() && !payee.group(1).trim().equals("bill")) {
                    answers.put(IntentField.PAYEE.getKey(), payee.group(1).trim());
                }
            }
            case BALANCE_INQUIRY -> putIfPresent(answers, IntentField.ACCOUNT, mentioned);
            case PIN_CHANGE -> {
                // the new PIN only ever arrives from the keypad
            }
        }

        log.debug("Message parsed - operation: {}, fields: {}", operation, answers.keySet());
        return new Extraction(operation, answers);
    }

    static OperationType detectOperation(String message) {
        if (message.contains("change") && message.contains("pin")) {
            return OperationType.PIN_CHANGE;
        }
        if (message.contains("deposit") && message.contains("check")) {
            return OperationType.CHECK_DEPOSIT;
        }
        if (message.contains("deposit")) {
            return message.contains("cash") ? OperationType.CASH_DEPOSIT : OperationType.DEPOSIT;
        }
        if (message.contains("withdraw") || message.contains("take out") || message.contains("get cash")) {
            return OperationType.WITHDRAW;
        }
        if (message.contains("transfer") || message.matches(".*\\bmove\\b.*")) {
            return OperationType.TRANSFER;
        }
        if (message.contains("bill")) {
            return OperationType.BILL_PAYMENT;
        }
        if (message.matches(".*\\bpay\\b.*")) {
            return OperationType.PAYMENT;
        }
        if (message.contains("balance") || message.contains("how much do i have")) {
            return OperationType.BALANCE_INQUIRY;
        }
        return null;
    }

    static BigDecimal extractAmount(String message) {
        Matcher matcher = AMOUNT.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        String whole = matcher.group(1).replace(",", "");
        String fraction = matcher.group(2) != null ? matcher.group(2) : "";
        return new BigDecimal(whole + fraction);
    }

    /**
     * Resolves an account type word to the customer's account id, only when the type is unambiguous.
     */
    private static String accountFor(Pattern pattern, String message, List<AccountSummary> accounts) {
        Matcher matcher = pattern.matcher(message);
        if (!matcher.find()) {
            return null;
        }
        AccountType type = AccountType.valueOf(matcher.group(1).toUpperCase(Locale.ROOT));
        List<AccountSummary> candidates = accounts.stream()
                .filter(account -> account.getType() == type)
                .toList();
        return candidates.size() == 1 ? candidates.get(0).getAccountId() : null;
    }

    private static void putIfPresent(Map<String, Object> answers, IntentField field, Object value) {
        if (value != null) {
            answers.put(field.getKey(), value);
        }
    }
}
