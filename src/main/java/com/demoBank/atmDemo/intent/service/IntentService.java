package com.demoBank.atmDemo.intent.service;

import com.demoBank.atmDemo.bank.service.AccountService;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.flow.service.ScreenFlowService;
import com.demoBank.atmDemo.intent.dto.IntentInput;
import com.demoBank.atmDemo.intent.dto.IntentView;
import com.demoBank.atmDemo.intent.model.IntentField;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.ReceiptMode;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import com.demoBank.atmDemo.repository.IntentRepository;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.service.PinService;
import com.demoBank.atmDemo.session.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Intent resolution - slot filling for transaction requests.
 *
 * Handles:
 * - Creating intents from structured answers or typed text
 * - Monotonic merging of answers (a missing or null answer never removes a stored one)
 * - Recomputing missing fields and clarification questions after every update
 * - Explicit confirmation: only a confirmed intent with no missing fields is READY_TO_EXECUTE
 * - PIN confirmation through the session's PIN counter
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class IntentService {

    /**
     * Answer key for a keypad PIN block. Verified, then dropped.
     */
    public static final String PIN_BLOCK = "pinBlock";

    private final SessionService sessionService;
    private final IntentRepository intentRepository;
    private final AccountService accountService;
    private final PinService pinService;
    private final PatternIntentExtractor patternIntentExtractor;
    private final ClarificationService clarificationService;
    private final ScreenFlowService screenFlowService;
    private final Clock clock;

    public IntentView createOrUpdate(String token, IntentInput input) {
        return sessionService.execute(token, session -> toView(createOrUpdate(session, input)));
    }

    public IntentView getIntent(String token, String intentId) {
        return sessionService.execute(token, session -> toView(findOwned(session, intentId)));
    }

    public IntentView cancelIntent(String token, String intentId) {
        return sessionService.execute(token, session -> toView(cancel(session, intentId)));
    }

    public List<IntentView> listIntents(String token) {
        return sessionService.execute(token, session -> intentRepository.findBySessionId(session.getSessionId()).stream()
                .map(this::toView)
                .toList());
    }

    public TransactionIntent createOrUpdate(AtmSession session, IntentInput input) {
        requirePinVerified(session);

        Map<String, Object> answers = new LinkedHashMap<>();
        OperationType requestedOperation = input.getOperation();
        if (input.getNaturalLanguage() != null && !input.getNaturalLanguage().isBlank()) {
            PatternIntentExtractor.Extraction extraction = patternIntentExtractor.extract(
                    input.getNaturalLanguage(), accountService.listAccounts(session.getCustomerId()));
            answers.putAll(extraction.answers());
            if (requestedOperation == null) {
                requestedOperation = extraction.operation();
            }
        }
        if (input.getAnswers() != null) {
            answers.putAll(input.getAnswers());
        }

        TransactionIntent intent;
        if (input.getIntentId() != null) {
            intent = findOwned(session, input.getIntentId());
            if (intent.isTerminal()) {
                throw AtmException.invalidState("Intent " + intent.getId() + " is " + intent.getStatus() + " and can no longer change");
            }
            if (input.getOperation() != null && input.getOperation() != intent.getOperation()) {
                throw AtmException.validation("The operation of an existing intent cannot change");
            }
        } else {
            if (requestedOperation == null) {
                throw AtmException.validation("Could not determine the operation, please say what you would like to do");
            }
            Instant now = clock.instant();
            intent = TransactionIntent.builder()
                    .id(UUID.randomUUID().toString())
                    .sessionId(session.getSessionId())
                    .customerId(session.getCustomerId())
                    .operation(requestedOperation)
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
        }

        apply(session, intent, answers);
        intentRepository.save(intent);
        return intent;
    }

    public TransactionIntent cancel(AtmSession session, String intentId) {
        TransactionIntent intent = findOwned(session, intentId);
        if (intent.isTerminal()) {
            throw AtmException.invalidState("Intent " + intentId + " is already " + intent.getStatus());
        }
        intent.setStatus(IntentStatus.CANCELLED);
        intent.getContext().remove(IntentField.CONFIRM.getKey());
        intent.setUpdatedAt(clock.instant());
        screenFlowService.interruptForIntent(intent);
        log.info("Intent cancelled - sessionId: {}, intentId: {}", session.getSessionId(), intentId);
        return intent;
    }

    /**
     * @throws AtmException VALIDATION_ERROR if the intent does not exist in this session
     */
    public TransactionIntent findOwned(AtmSession session, String intentId) {
        requirePinVerified(session);
        return intentRepository.findById(intentId)
                .filter(intent -> session.getSessionId().equals(intent.getSessionId()))
                .orElseThrow(() -> AtmException.validation("Intent " + intentId + " not found"));
    }

    public IntentView toView(TransactionIntent intent) {
        return IntentView.from(intent, clarificationService.questionsFor(intent));
    }

    /**
     * Validates every answer first so a bad answer leaves the intent untouched, then merges.
     */
    private void apply(AtmSession session, TransactionIntent intent, Map<String, Object> answers) {
        Map<IntentField, Object> normalized = new LinkedHashMap<>();
        Boolean confirm = null;
        String pinBlock = null;

        for (Map.Entry<String, Object> answer : answers.entrySet()) {
            if (PIN_BLOCK.equals(answer.getKey())) {
                pinBlock = answer.getValue() != null ? answer.getValue().toString() : null;
                continue;
            }
            IntentField field = IntentField.fromKey(answer.getKey())
                    .orElseThrow(() -> AtmException.validation("Unknown field: " + answer.getKey()));
            if (answer.getValue() == null) {
                continue;
            }
            if (field == IntentField.PIN_CONFIRMED) {
                throw AtmException.validation("pinConfirmed is set by entering the PIN on the keypad");
            }
            if (field == IntentField.CONFIRM) {
                confirm = toBoolean(field, answer.getValue());
                continue;
            }
            normalized.put(field, normalize(session, field, answer.getValue()));
        }

        validateAccounts(intent, normalized);

        if (normalized.containsKey(IntentField.NEW_PIN_BLOCK)) {
            normalized.put(IntentField.NEW_PIN_BLOCK,
                    pinService.hashNewPin(session, (String) normalized.get(IntentField.NEW_PIN_BLOCK)));
        }
        if (pinBlock != null) {
            pinService.verify(session, pinBlock);
            normalized.put(IntentField.PIN_CONFIRMED, Boolean.TRUE);
        }

        boolean wasReady = intent.getStatus() == IntentStatus.READY_TO_EXECUTE;
        boolean changed = false;
        Map<String, Object> context = intent.getContext();
        for (Map.Entry<IntentField, Object> entry : normalized.entrySet()) {
            Object previous = context.put(entry.getKey().getKey(), entry.getValue());
            if (!Objects.equals(previous, entry.getValue()) && entry.getKey() != IntentField.PIN_CONFIRMED) {
                changed = true;
            }
        }

        if (confirm != null) {
            context.put(IntentField.CONFIRM.getKey(), confirm);
        } else if (changed) {
            context.remove(IntentField.CONFIRM.getKey());
        }

        List<IntentField> missing = RequiredFieldPolicy.missingFields(intent.getOperation(), context);
        if (!missing.isEmpty()) {
            context.remove(IntentField.CONFIRM.getKey());
        }
        intent.setMissingFields(new ArrayList<>(missing.stream().map(IntentField::getKey).toList()));
        intent.setStatus(missing.isEmpty() && intent.isConfirmed() ? IntentStatus.READY_TO_EXECUTE : IntentStatus.PENDING_DETAILS);
        intent.setUpdatedAt(clock.instant());

        if (intent.getStatus() == IntentStatus.READY_TO_EXECUTE && (!wasReady || changed || confirm != null)) {
            screenFlowService.generate(intent);
        } else if (wasReady && intent.getStatus() != IntentStatus.READY_TO_EXECUTE) {
            screenFlowService.interruptForIntent(intent);
        }

        log.info("Intent updated - sessionId: {}, intentId: {}, operation: {}, status: {}, missing: {}",
                session.getSessionId(), intent.getId(), intent.getOperation(), intent.getStatus(), intent.getMissingFields());
    }

    private Object normalize(AtmSession session, IntentField field, Object value) {
        return switch (field.getValueType()) {
            case ACCOUNT -> accountService.resolveOwnedAccount(session.getCustomerId(), value.toString()).getId();
            case AMOUNT -> normalizeAmount(value);
            case BOOLEAN -> toBoolean(field, value);
            case RECEIPT -> {
                try {
                    yield ReceiptMode.valueOf(value.toString().trim().toUpperCase(Locale.ROOT));
                } catch (IllegalArgumentException e) {
                    throw new AtmException(ErrorKind.VALIDATION_ERROR, "receiptPreference must be one of PRINT, EMAIL, NONE", e);
                }
            }
            case TEXT -> normalizeText(field, value);
        };
    }

    private void validateAccounts(TransactionIntent intent, Map<IntentField, Object> normalized) {
        if (intent.getOperation() != OperationType.TRANSFER) {
            return;
        }
        Object from = normalized.getOrDefault(IntentField.FROM_ACCOUNT, intent.getFromAccount());
        Object to = normalized.getOrDefault(IntentField.TO_ACCOUNT, intent.getToAccount());
        if (from != null && from.equals(to)) {
            throw AtmException.validation("Source and destination accounts must be different");
        }
    }

    public static BigDecimal normalizeAmount(Object value) {
        BigDecimal amount;
        try {
            amount = value instanceof BigDecimal decimal ? decimal : new BigDecimal(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new AtmException(ErrorKind.VALIDATION_ERROR, "amount must be a number", e);
        }
        if (amount.signum() <= 0) {
            throw AtmException.validation("amount must be greater than zero");
        }
        amount = amount.stripTrailingZeros();
        if (amount.scale() > 2) {
            throw AtmException.validation("amount must have at most two decimal places");
        }
        return amount.setScale(2);
    }

    private static Boolean toBoolean(IntentField field, Object value) {
        if (value instanceof Boolean bool) {
            return bool;
        }
        String text = value.toString().trim().toLowerCase(Locale.ROOT);
        if (text.equals("true") || text.equals("yes")) {
            return Boolean.TRUE;
        }
        if (text.equals("false") || text.equals("no")) {
            return Boolean.FALSE;
        }
        throw AtmException.validation(field.getKey() + " must be true or false");
    }

    private static String normalizeText(IntentField field, Object value) {
        String text = value.toString().trim();
        if (text.isEmpty()) {
            throw AtmException.validation(field.getKey() + " must not be blank");
        }
        if (field == IntentField.CURRENCY) {
            if (!text.matches("[A-Za-z]{3}")) {
                throw AtmException.validation("currency must be a three-letter code");
            }
            return text.toUpperCase(Locale.ROOT);
        }
        return text;
    }

    private static void requirePinVerified(AtmSession session) {
        if (!session.isPinVerified()) {
            throw AtmException.sequence("PIN validation is required before working with transactions");
        }
    }
}
