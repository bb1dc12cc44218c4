package com.demoBank.atmDemo.orchestrator.tool;

import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.llm.dto.GroqApiRequest;

import java.util.Arrays;
import java.util.List;
import java.util.Map;

/**
 * Fixed tool catalog offered to the model. Each tool maps onto one domain operation.
 */
public final class AtmToolCatalog {

    public static final String GET_ACCOUNTS = "get_accounts";
    public static final String GET_ACCOUNT_DETAILS = "get_account_details";
    public static final String GET_DAILY_LIMITS = "get_daily_limits";
    public static final String CREATE_OR_UPDATE_INTENT = "create_or_update_intent";
    public static final String GET_INTENT = "get_intent";
    public static final String EXECUTE_INTENT = "execute_intent";
    public static final String CANCEL_INTENT = "cancel_intent";
    public static final String GET_FLOW = "get_flow";
    public static final String INTERRUPT_FLOW = "interrupt_flow";

    private static final Map<String, Object> NO_PARAMETERS = Map.of(
            "type", "object",
            "properties", Map.of()
    );

    private static final List<GroqApiRequest.Tool> TOOLS = List.of(
            tool(GET_ACCOUNTS, "Lists the customer's accounts with masked numbers and live balances.", NO_PARAMETERS),
            tool(GET_ACCOUNT_DETAILS, "Returns one account with its most recent transactions and remaining daily limits.",
                    idParameter("accountId", "Account id, account number or account type such as 'checking'")),
            tool(GET_DAILY_LIMITS, "Returns what is left of today's withdrawal, deposit and transfer limits for an account.",
                    idParameter("accountId", "Account id, account number or account type such as 'checking'")),
            tool(CREATE_OR_UPDATE_INTENT, """
                    Creates a transaction intent or adds answers to an existing one.
                    Returns the intent with its missing fields and the question to ask next.
                    Set confirm=true only after the customer agreed to a summary of the details.
                    The PIN is entered on the keypad and is never an answer you provide.
                    """, intentParameters()),
            tool(GET_INTENT, "Returns the current state of an intent.", idParameter("intentId", "Intent id")),
            tool(EXECUTE_INTENT, "Executes an intent that is READY_TO_EXECUTE and returns the transaction outcome.",
                    idParameter("intentId", "Intent id")),
            tool(CANCEL_INTENT, "Cancels an intent that has not completed.", idParameter("intentId", "Intent id")),
            tool(GET_FLOW, "Returns the screen flow of a confirmed intent.", idParameter("intentId", "Intent id")),
            tool(INTERRUPT_FLOW, "Interrupts a screen flow; the intent keeps its answers but needs confirming again.",
                    idParameter("flowId", "Flow id"))
    );

    private AtmToolCatalog() {}

    public static List<GroqApiRequest.Tool> tools() {
        return TOOLS;
    }

    private static Map<String, Object> intentParameters() {
        return Map.of(
                "type", "object",
                "properties", Map.of(
                        "intentId", Map.of(
                                "type", List.of("string", "null"),
                                "description", "Existing intent to update; omit to create a new one"
                        ),
                        "operation", Map.of(
                                "type", List.of("string", "null"),
                                "description", "Operation of a new intent",
                                "enum", Arrays.stream(OperationType.values()).map(Enum::name).toList()
                        ),
                        "answers", Map.of(
                                "type", "object",
                                "description", "Field answers: fromAccount, toAccount, account, amount, currency, payee, "
                                        + "checkNumber, memo, receiptPreference (PRINT, EMAIL, NONE), confirm",
                                "additionalProperties", true
                        ),
                        "naturalLanguage", Map.of(
                                "type", List.of("string", "null"),
                                "description", "The customer's own words, used when operation and answers are unclear"
                        )
                )
        );
    }

    private static Map<String, Object> idParameter(String name, String description) {
        return Map.of(
                "type", "object",
                "properties", Map.of(name, Map.of("type", "string", "description", description)),
                "required", List.of(name)
        );
    }

    private static GroqApiRequest.Tool tool(String name, String description, Map<String, Object> parameters) {
        return GroqApiRequest.Tool.builder()
                .function(GroqApiRequest.Function.builder()
                        .name(name)
                        .description(description.strip())
                        .parameters(parameters)
                        .build())
                .build();
    }
}
