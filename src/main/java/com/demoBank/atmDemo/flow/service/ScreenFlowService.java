package com.demoBank.atmDemo.flow.service;

import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.flow.dto.InterruptResult;
import com.demoBank.atmDemo.flow.model.FlowStatus;
import com.demoBank.atmDemo.flow.model.FlowStep;
import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.demoBank.atmDemo.flow.model.StepType;
import com.demoBank.atmDemo.intent.dto.IntentView;
import com.demoBank.atmDemo.intent.model.IntentField;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import com.demoBank.atmDemo.intent.service.ClarificationService;
import com.demoBank.atmDemo.repository.AccountRepository;
import com.demoBank.atmDemo.repository.IntentRepository;
import com.demoBank.atmDemo.repository.ScreenFlowRepository;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.UUID;

/**
 * Screen flows: the client-visible steps of an intent's execution, plus the interrupt path.
 *
 * A flow exists only once its intent reached READY_TO_EXECUTE. Interrupting keeps every
 * collected answer except the confirmation.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScreenFlowService {

    private final SessionService sessionService;
    private final ScreenFlowRepository screenFlowRepository;
    private final IntentRepository intentRepository;
    private final AccountRepository accountRepository;
    private final ClarificationService clarificationService;
    private final Clock clock;

    public ScreenFlow getFlowForIntent(String token, String intentId) {
        return sessionService.execute(token, session -> getFlowForIntent(session, intentId));
    }

    public ScreenFlow getFlow(String token, String flowId) {
        return sessionService.execute(token, session -> getFlow(session, flowId));
    }

    public InterruptResult interrupt(String token, String flowId) {
        return sessionService.execute(token, session -> interrupt(session, flowId));
    }

    /**
     * @throws AtmException INVALID_STATE if the intent has no flow yet
     */
    public ScreenFlow getFlowForIntent(AtmSession session, String intentId) {
        TransactionIntent intent = intentRepository.findById(intentId)
                .filter(candidate -> session.getSessionId().equals(candidate.getSessionId()))
                .orElseThrow(() -> AtmException.validation("Intent " + intentId + " not found"));
        return screenFlowRepository.findByIntentId(intent.getId())
                .orElseThrow(() -> AtmException.invalidState("Intent " + intentId + " has no screen flow until it is confirmed"));
    }

    public ScreenFlow getFlow(AtmSession session, String flowId) {
        return screenFlowRepository.findById(flowId)
                .filter(flow -> session.getSessionId().equals(flow.getSessionId()))
                .orElseThrow(() -> AtmException.validation("Flow " + flowId + " not found"));
    }

    /**
     * Builds the steps for a confirmed intent, replacing any earlier flow of the same intent.
     */
    public ScreenFlow generate(TransactionIntent intent) {
        List<FlowStep> steps = new ArrayList<>();
        steps.add(step("selectOperation", "Select " + label(intent.getOperation()), StepType.SELECT));

        switch (intent.getOperation()) {
            case WITHDRAW -> steps.add(step("selectAccount", "From " + masked(intent.getFromAccount()), StepType.SELECT));
            case DEPOSIT, CASH_DEPOSIT, CHECK_DEPOSIT ->
                    steps.add(step("selectAccount", "To " + masked(intent.getToAccount()), StepType.SELECT));
            case TRANSFER -> {
                steps.add(step("selectFromAccount", "From " + masked(intent.getFromAccount()), StepType.SELECT));
                steps.add(step("selectToAccount", "To " + masked(intent.getToAccount()), StepType.SELECT));
            }
            case PAYMENT, BILL_PAYMENT -> {
                steps.add(step("selectAccount", "From " + masked(intent.getFromAccount()), StepType.SELECT));
                steps.add(step("selectPayee", "Pay " + intent.get(IntentField.PAYEE), StepType.SELECT));
            }
            case BALANCE_INQUIRY -> steps.add(step("selectAccount", "Account " + masked(intent.getAccount()), StepType.SELECT));
            case PIN_CHANGE -> {
                // no account selection
            }
        }

        if (intent.getAmount() != null) {
            steps.add(step("confirmAmount", "Confirm " + intent.getAmount().toPlainString(), StepType.CONFIRM));
        } else {
            steps.add(step("confirm", "Confirm " + label(intent.getOperation()), StepType.CONFIRM));
        }
        steps.add(step("processing", "Processing", StepType.PROCESSING));

        Instant now = clock.instant();
        ScreenFlow flow = ScreenFlow.builder()
                .id(UUID.randomUUID().toString())
                .intentId(intent.getId())
                .sessionId(intent.getSessionId())
                .steps(steps)
                .status(FlowStatus.PENDING)
                .createdAt(now)
                .updatedAt(now)
                .build();
        screenFlowRepository.save(flow);
        log.info("Screen flow generated - intentId: {}, flowId: {}, steps: {}", intent.getId(), flow.getId(), steps.size());
        return flow;
    }

    /**
     * Appends the outcome step after an execution attempt and closes the flow.
     */
    public ScreenFlow complete(TransactionIntent intent, boolean success, String message) {
        ScreenFlow flow = screenFlowRepository.findByIntentId(intent.getId())
                .orElseGet(() -> generate(intent));
        flow.getSteps().add(success
                ? step("success", message, StepType.SUCCESS)
                : step("error", message, StepType.ERROR));
        flow.setStatus(FlowStatus.COMPLETE);
        flow.setUpdatedAt(clock.instant());
        log.info("Screen flow completed - intentId: {}, flowId: {}, success: {}", intent.getId(), flow.getId(), success);
        return flow;
    }

    /**
     * Interrupts the intent's flow if one is pending. Used when the intent is edited or cancelled.
     */
    public void interruptForIntent(TransactionIntent intent) {
        screenFlowRepository.findByIntentId(intent.getId())
                .filter(flow -> flow.getStatus() == FlowStatus.PENDING)
                .ifPresent(flow -> {
                    flow.setStatus(FlowStatus.INTERRUPTED);
                    flow.setUpdatedAt(clock.instant());
                });
    }

    /**
     * Pauses a flow and sends its intent back to PENDING_DETAILS with only the confirmation cleared.
     * Interrupting an already interrupted flow returns it unchanged.
     *
     * @throws AtmException INVALID_STATE for flows of completed or cancelled intents
     */
    public InterruptResult interrupt(AtmSession session, String flowId) {
        ScreenFlow flow = getFlow(session, flowId);
        TransactionIntent intent = intentRepository.findById(flow.getIntentId())
                .orElseThrow(() -> AtmException.invalidState("Flow " + flowId + " has no intent"));

        if (flow.getStatus() == FlowStatus.INTERRUPTED) {
            return result(flow, intent);
        }
        if (intent.getStatus() == IntentStatus.COMPLETED) {
            throw AtmException.invalidState("Completed transactions cannot be interrupted");
        }
        if (flow.getStatus() == FlowStatus.COMPLETE) {
            throw AtmException.invalidState("Flow " + flowId + " has already finished");
        }
        if (intent.getStatus() == IntentStatus.CANCELLED) {
            throw AtmException.invalidState("Intent " + intent.getId() + " was cancelled");
        }

        Instant now = clock.instant();
        flow.setStatus(FlowStatus.INTERRUPTED);
        flow.setUpdatedAt(now);
        intent.getContext().remove(IntentField.CONFIRM.getKey());
        intent.setStatus(IntentStatus.PENDING_DETAILS);
        intent.setUpdatedAt(now);

        log.info("Screen flow interrupted - sessionId: {}, flowId: {}, intentId: {}", session.getSessionId(), flowId, intent.getId());
        return result(flow, intent);
    }

    private InterruptResult result(ScreenFlow flow, TransactionIntent intent) {
        return InterruptResult.builder()
                .flow(flow)
                .intent(IntentView.from(intent, clarificationService.questionsFor(intent)))
                .build();
    }

    private String masked(String accountId) {
        return accountRepository.findById(accountId)
                .map(account -> account.getName() + " " + account.getMaskedNumber())
                .orElse(accountId);
    }

    private static String label(OperationType operation) {
        return operation.name().toLowerCase(Locale.ROOT).replace('_', ' ');
    }

    private static FlowStep step(String id, String label, StepType type) {
        return FlowStep.builder().id(id).label(label).type(type).build();
    }
}
