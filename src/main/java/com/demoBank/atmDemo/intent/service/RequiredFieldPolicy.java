package com.demoBank.atmDemo.intent.service;

import com.demoBank.atmDemo.intent.model.IntentField;
import com.demoBank.atmDemo.intent.model.OperationType;

import java.util.List;
import java.util.Map;

/**
 * Which fields each operation needs before it can be confirmed. Order is the order questions are asked in.
 */
public final class RequiredFieldPolicy {

    private RequiredFieldPolicy() {}

    public static List<IntentField> requiredFields(OperationType operation) {
        return switch (operation) {
            case WITHDRAW -> List.of(IntentField.FROM_ACCOUNT, IntentField.AMOUNT, IntentField.PIN_CONFIRMED);
            case DEPOSIT, CASH_DEPOSIT -> List.of(IntentField.TO_ACCOUNT, IntentField.AMOUNT);
            case CHECK_DEPOSIT -> List.of(IntentField.TO_ACCOUNT, IntentField.AMOUNT, IntentField.CHECK_NUMBER);
            case TRANSFER -> List.of(IntentField.FROM_ACCOUNT, IntentField.TO_ACCOUNT, IntentField.AMOUNT);
            case PAYMENT, BILL_PAYMENT -> List.of(IntentField.FROM_ACCOUNT, IntentField.PAYEE, IntentField.AMOUNT);
            case BALANCE_INQUIRY -> List.of(IntentField.ACCOUNT);
            case PIN_CHANGE -> List.of(IntentField.NEW_PIN_BLOCK, IntentField.PIN_CONFIRMED);
        };
    }

    /**
     * Required fields with no non-null value in the context, in policy order.
     */
    public static List<IntentField> missingFields(OperationType operation, Map<String, Object> context) {
        return requiredFields(operation).stream()
                .filter(field -> context.get(field.getKey()) == null)
                .toList();
    }
}
