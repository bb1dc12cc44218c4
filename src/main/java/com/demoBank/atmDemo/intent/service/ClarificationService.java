package com.demoBank.atmDemo.intent.service;

import com.demoBank.atmDemo.intent.model.IntentField;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Service for clarification questions.
 *
 * Each missing field maps to exactly one fixed question, so the question list always lines up
 * with the intent's missing fields.
 */
@Slf4j
@Service
public class ClarificationService {

    public List<String> questionsFor(TransactionIntent intent) {
        return intent.getMissingFields().stream()
                .map(key -> IntentField.fromKey(key)
                        .map(field -> questionFor(intent.getOperation(), field))
                        .orElse("Could you please provide more details about: " + key + "?"))
                .toList();
    }

    String questionFor(OperationType operation, IntentField field) {
        if (field != IntentField.AMOUNT) {
            return field.getQuestion();
        }
        return switch (operation) {
            case WITHDRAW -> "How much would you like to withdraw?";
            case DEPOSIT, CASH_DEPOSIT -> "How much would you like to deposit?";
            case CHECK_DEPOSIT -> "What is the amount on the check?";
            case TRANSFER -> "How much would you like to transfer?";
            case PAYMENT, BILL_PAYMENT -> "How much would you like to pay?";
            default -> field.getQuestion();
        };
    }
}
