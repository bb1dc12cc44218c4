package com.demoBank.atmDemo.intent.model;

import java.util.Arrays;
import java.util.Optional;

/**
 * Fields an intent can collect, each with its fixed clarification question.
 */
public enum IntentField {

    FROM_ACCOUNT("fromAccount", ValueType.ACCOUNT, "Which account would you like to use as the source?"),
    TO_ACCOUNT("toAccount", ValueType.ACCOUNT, "Which account should receive the money?"),
    ACCOUNT("account", ValueType.ACCOUNT, "Which account would you like to check?"),
    AMOUNT("amount", ValueType.AMOUNT, "How much would you like to move?"),
    CURRENCY("currency", ValueType.TEXT, "Which currency should be used?"),
    PAYEE("payee", ValueType.TEXT, "Who would you like to pay?"),
    CHECK_NUMBER("checkNumber", ValueType.TEXT, "What is the number printed on the check?"),
    MEMO("memo", ValueType.TEXT, "Would you like to add a memo?"),
    RECEIPT_PREFERENCE("receiptPreference", ValueType.RECEIPT, "Would you like a printed receipt, an email receipt, or none?"),
    PIN_CONFIRMED("pinConfirmed", ValueType.BOOLEAN, "Please enter your PIN on the keypad to authorize this transaction."),
    NEW_PIN_BLOCK("newPinBlock", ValueType.TEXT, "Please enter your new PIN on the keypad."),
    CONFIRM("confirm", ValueType.BOOLEAN, "Please confirm the details above to proceed.");

    public enum ValueType {
        ACCOUNT,
        AMOUNT,
        TEXT,
        BOOLEAN,
        RECEIPT
    }

    private final String key;
    private final ValueType valueType;
    private final String question;

    IntentField(String key, ValueType valueType, String question) {
        this.key = key;
        this.valueType = valueType;
        this.question = question;
    }

    public String getKey() {
        return key;
    }

    public ValueType getValueType() {
        return valueType;
    }

    public String getQuestion() {
        return question;
    }

    public static Optional<IntentField> fromKey(String key) {
        return Arrays.stream(values())
                .filter(field -> field.key.equals(key))
                .findFirst();
    }
}
