package com.demoBank.atmDemo.orchestrator.service;

import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.bank.service.AccountService;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.config.AtmProperties;
import com.demoBank.atmDemo.flow.dto.InterruptResult;
import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.demoBank.atmDemo.flow.service.ScreenFlowService;
import com.demoBank.atmDemo.intent.dto.IntentInput;
import com.demoBank.atmDemo.intent.dto.IntentView;
import com.demoBank.atmDemo.intent.model.IntentField;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import com.demoBank.atmDemo.intent.service.IntentService;
import com.demoBank.atmDemo.llm.dto.GroqApiResponse;
import com.demoBank.atmDemo.orchestrator.tool.AtmToolCatalog;
import com.demoBank.atmDemo.orchestrator.tool.ToolCallContext;
import com.demoBank.atmDemo.orchestrator.tool.ToolHandler;
import com.demoBank.atmDemo.orchestrator.tool.ToolOutcome;
import com.demoBank.atmDemo.session.service.SessionService;
import com.demoBank.atmDemo.transaction.dto.TransactionResult;
import com.demoBank.atmDemo.transaction.service.TransactionExecutor;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Dispatch table from tool name to domain operation.
 *
 * Tools run one at a time, each bounded by the configured tool timeout. Domain failures
 * become {@code {error, message}} results for the model; a timeout fails the whole turn.
 * Keypad PIN data of the turn goes into the first intent update that still needs the PIN
 * and is never part of what the model sees.
 */
@Slf4j
@Service
public class ToolDispatcher {

    private final SessionService sessionService;
    private final AccountService accountService;
    private final IntentService intentService;
    private final TransactionExecutor transactionExecutor;
    private final ScreenFlowService screenFlowService;
    private final NumericGroundingGuard groundingGuard;
    private final ObjectMapper objectMapper;
    private final ExecutorService toolExecutor;
    private final Duration toolTimeout;
    private final Map<String, ToolHandler> handlers = new LinkedHashMap<>();

    public ToolDispatcher(SessionService sessionService,
                          AccountService accountService,
                          IntentService intentService,
                          TransactionExecutor transactionExecutor,
                          ScreenFlowService screenFlowService,
                          NumericGroundingGuard groundingGuard,
                          ObjectMapper objectMapper,
                          @Qualifier("toolExecutor") ExecutorService toolExecutor,
                          AtmProperties properties) {
        this.sessionService = sessionService;
        this.accountService = accountService;
        this.intentService = intentService;
        this.transactionExecutor = transactionExecutor;
        this.screenFlowService = screenFlowService;
        this.groundingGuard = groundingGuard;
        this.objectMapper = objectMapper;
        this.toolExecutor = toolExecutor;
        this.toolTimeout = properties.getOrchestrator().getToolTimeout();

        handlers.put(AtmToolCatalog.GET_ACCOUNTS, this::getAccounts);
        handlers.put(AtmToolCatalog.GET_ACCOUNT_DETAILS, this::getAccountDetails);
        handlers.put(AtmToolCatalog.GET_DAILY_LIMITS, this::getDailyLimits);
        handlers.put(AtmToolCatalog.CREATE_OR_UPDATE_INTENT, this::createOrUpdateIntent);
        handlers.put(AtmToolCatalog.GET_INTENT, this::getIntent);
        handlers.put(AtmToolCatalog.EXECUTE_INTENT, this::executeIntent);
        handlers.put(AtmToolCatalog.CANCEL_INTENT, this::cancelIntent);
        handlers.put(AtmToolCatalog.GET_FLOW, this::getFlow);
        handlers.put(AtmToolCatalog.INTERRUPT_FLOW, this::interruptFlow);
    }

    /**
     * Runs one tool call.
     *
     * @throws AtmException TOOL_TIMEOUT if the tool does not finish in time
     */
    public ToolOutcome dispatch(GroqApiResponse.ToolCall call, ToolCallContext context) {
        String name = call.getFunction() != null ? call.getFunction().getName() : null;
        ToolHandler handler = name != null ? handlers.get(name) : null;
        if (handler == null) {
            return failure(call, name, AtmException.validation("Unknown tool: " + name), context);
        }

        Map<String, Object> arguments;
        try {
            arguments = parseArguments(call.getFunction().getArguments());
        } catch (JsonProcessingException e) {
            return failure(call, name, new AtmException(ErrorKind.VALIDATION_ERROR, "Tool arguments are not valid JSON", e), context);
        }

        log.debug("Dispatching tool - sessionId: {}, tool: {}", context.getSessionId(), name);
        Future<Object> future = toolExecutor.submit(() -> handler.handle(arguments, context));
        try {
            Object result = future.get(toolTimeout.toMillis(), TimeUnit.MILLISECONDS);
            return success(call, name, result, context);
        } catch (TimeoutException e) {
            future.cancel(true);
            log.warn("Tool timed out - sessionId: {}, tool: {}, timeout: {}", context.getSessionId(), name, toolTimeout);
            throw new AtmException(ErrorKind.TOOL_TIMEOUT, "The " + name + " operation did not finish in time", e);
        } catch (InterruptedException e) {
            future.cancel(true);
            Thread.currentThread().interrupt();
            throw new AtmException(ErrorKind.TOOL_TIMEOUT, "Interrupted while waiting for " + name, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof AtmException atmException) {
                return failure(call, name, atmException, context);
            }
            throw new IllegalStateException("Tool " + name + " failed", e.getCause());
        }
    }

    private Object getAccounts(Map<String, Object> arguments, ToolCallContext context) {
        return sessionService.executeVerified(context.getToken(),
                session -> accountService.listAccounts(session.getCustomerId()));
    }

    private Object getAccountDetails(Map<String, Object> arguments, ToolCallContext context) {
        String reference = requiredText(arguments, "accountId");
        return sessionService.executeVerified(context.getToken(), session -> {
            Account account = accountService.resolveOwnedAccount(session.getCustomerId(), reference);
            return accountService.getAccountDetails(session.getCustomerId(), account.getId());
        });
    }

    private Object getDailyLimits(Map<String, Object> arguments, ToolCallContext context) {
        String reference = requiredText(arguments, "accountId");
        return sessionService.executeVerified(context.getToken(), session -> {
            Account account = accountService.resolveOwnedAccount(session.getCustomerId(), reference);
            return accountService.getRemainingLimits(session.getCustomerId(), account.getId());
        });
    }

    private Object createOrUpdateIntent(Map<String, Object> arguments, ToolCallContext context) {
        Map<String, Object> answers = new LinkedHashMap<>();
        if (arguments.get("answers") instanceof Map<?, ?> provided) {
            provided.forEach((key, value) -> answers.put(String.valueOf(key), value));
        }
        // PIN data only ever comes from the keypad
        answers.remove(IntentService.PIN_BLOCK);

        IntentInput input = IntentInput.builder()
                .intentId(optionalText(arguments, "intentId"))
                .operation(parseOperation(optionalText(arguments, "operation")))
                .answers(answers)
                .naturalLanguage(optionalText(arguments, "naturalLanguage"))
                .build();

        IntentView view = sessionService.execute(context.getToken(), session -> {
            TransactionIntent intent = intentService.createOrUpdate(session, input);
            context.setIntent(intentService.toView(intent));
            if (context.hasPinBlock() && intent.getMissingFields().contains(IntentField.PIN_CONFIRMED.getKey())) {
                Map<String, Object> pinAnswers = new LinkedHashMap<>();
                pinAnswers.put(IntentService.PIN_BLOCK, context.takePinBlock());
                if (answers.containsKey(IntentField.CONFIRM.getKey())) {
                    pinAnswers.put(IntentField.CONFIRM.getKey(), answers.get(IntentField.CONFIRM.getKey()));
                }
                intent = intentService.createOrUpdate(session, IntentInput.builder()
                        .intentId(intent.getId())
                        .answers(pinAnswers)
                        .build());
            }
            return intentService.toView(intent);
        });
        context.setIntent(view);
        if (view.getStatus() == IntentStatus.READY_TO_EXECUTE) {
            context.setFlow(screenFlowService.getFlowForIntent(context.getToken(), view.getIntentId()));
        }
        return view;
    }

    private Object getIntent(Map<String, Object> arguments, ToolCallContext context) {
        IntentView view = intentService.getIntent(context.getToken(), requiredText(arguments, "intentId"));
        context.setIntent(view);
        return view;
    }

    private Object executeIntent(Map<String, Object> arguments, ToolCallContext context) {
        String intentId = requiredText(arguments, "intentId");
        TransactionResult result = transactionExecutor.executeIntent(context.getToken(), intentId);
        context.setIntent(intentService.getIntent(context.getToken(), intentId));
        context.setFlow(screenFlowService.getFlowForIntent(context.getToken(), intentId));
        return result;
    }

    private Object cancelIntent(Map<String, Object> arguments, ToolCallContext context) {
        IntentView view = intentService.cancelIntent(context.getToken(), requiredText(arguments, "intentId"));
        context.setIntent(view);
        return view;
    }

    private Object getFlow(Map<String, Object> arguments, ToolCallContext context) {
        ScreenFlow flow = screenFlowService.getFlowForIntent(context.getToken(), requiredText(arguments, "intentId"));
        context.setFlow(flow);
        return flow;
    }

    private Object interruptFlow(Map<String, Object> arguments, ToolCallContext context) {
        InterruptResult result = screenFlowService.interrupt(context.getToken(), requiredText(arguments, "flowId"));
        context.setFlow(result.getFlow());
        context.setIntent(result.getIntent());
        return result;
    }

    private ToolOutcome success(GroqApiResponse.ToolCall call, String name, Object result, ToolCallContext context) {
        JsonNode tree = objectMapper.valueToTree(result);
        groundingGuard.collect(tree, context.getGroundedNumbers());
        return ToolOutcome.builder()
                .toolCallId(call.getId())
                .toolName(name)
                .content(write(tree))
                .build();
    }

    private ToolOutcome failure(GroqApiResponse.ToolCall call, String name, AtmException error, ToolCallContext context) {
        log.info("Tool failed - sessionId: {}, tool: {}, kind: {}, message: {}",
                context.getSessionId(), name, error.getKind(), error.getMessage());
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("error", error.isLockout() ? "PIN_LOCKOUT" : error.getKind().name());
        body.put("message", error.getMessage());
        if (!error.getDetails().isEmpty()) {
            body.put("details", error.getDetails());
        }
        JsonNode tree = objectMapper.valueToTree(body);
        groundingGuard.collect(tree, context.getGroundedNumbers());
        return ToolOutcome.builder()
                .toolCallId(call.getId())
                .toolName(name)
                .content(write(tree))
                .error(error)
                .build();
    }

    private Map<String, Object> parseArguments(String arguments) throws JsonProcessingException {
        if (arguments == null || arguments.isBlank()) {
            return Map.of();
        }
        Map<String, Object> parsed = objectMapper.readValue(arguments, new TypeReference<Map<String, Object>>() {});
        return parsed != null ? parsed : Map.of();
    }

    private String write(JsonNode tree) {
        try {
            return objectMapper.writeValueAsString(tree);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Could not serialize tool result", e);
        }
    }

    private static OperationType parseOperation(String operation) {
        if (operation == null) {
            return null;
        }
        try {
            return OperationType.valueOf(operation.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new AtmException(ErrorKind.VALIDATION_ERROR, "Unknown operation: " + operation, e);
        }
    }

    private static String requiredText(Map<String, Object> arguments, String name) {
        String value = optionalText(arguments, name);
        if (value == null) {
            throw AtmException.validation(name + " is required");
        }
        return value;
    }

    private static String optionalText(Map<String, Object> arguments, String name) {
        Object value = arguments.get(name);
        if (value == null || value.toString().isBlank()) {
            return null;
        }
        return value.toString().trim();
    }
}
