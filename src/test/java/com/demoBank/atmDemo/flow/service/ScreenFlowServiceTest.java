package com.demoBank.atmDemo.flow.service;

import com.demoBank.atmDemo.TestFixtures;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.flow.dto.InterruptResult;
import com.demoBank.atmDemo.flow.model.FlowStatus;
import com.demoBank.atmDemo.flow.model.FlowStep;
import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.demoBank.atmDemo.intent.dto.IntentInput;
import com.demoBank.atmDemo.intent.dto.IntentView;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.demoBank.atmDemo.TestFixtures.ALICE_CHECKING;
import static com.demoBank.atmDemo.TestFixtures.ALICE_PAN;
import static com.demoBank.atmDemo.TestFixtures.ALICE_PIN;
import static com.demoBank.atmDemo.TestFixtures.ALICE_SAVINGS;
import static com.demoBank.atmDemo.TestFixtures.BOB_PAN;
import static com.demoBank.atmDemo.TestFixtures.BOB_PIN;
import static com.demoBank.atmDemo.TestFixtures.catchAtm;
import static org.assertj.core.api.Assertions.assertThat;

class ScreenFlowServiceTest {

    private TestFixtures fixtures;
    private ScreenFlowService flowService;
    private String token;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures();
        flowService = fixtures.screenFlowService;
        token = fixtures.verifiedSession(ALICE_PAN, ALICE_PIN);
    }

    @Test
    void withdrawalFlowSelectsTheAccountThenConfirmsTheAmount() {
        String intentId = ready(OperationType.WITHDRAW, Map.of(
                "fromAccount", ALICE_CHECKING, "amount", "60", "pinBlock", TestFixtures.pinBlock(ALICE_PIN)));

        ScreenFlow flow = flowService.getFlowForIntent(token, intentId);

        assertThat(flow.getSteps()).extracting(FlowStep::getId)
                .containsExactly("selectOperation", "selectAccount", "confirmAmount", "processing");
        assertThat(flow.getSteps().get(2).getLabel()).isEqualTo("Confirm 60.00");
        assertThat(flowService.getFlow(token, flow.getId())).isSameAs(flow);
    }

    @Test
    void intentWithoutFlowIsInvalidState() {
        String intentId = fixtures.intentService.createOrUpdate(token, IntentInput.builder()
                .operation(OperationType.TRANSFER).build()).getIntentId();

        AtmException error = catchAtm(() -> flowService.getFlowForIntent(token, intentId));

        assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_STATE);
    }

    @Test
    void interruptKeepsEverythingButTheConfirmation() {
        String intentId = ready(OperationType.TRANSFER,
                Map.of("fromAccount", ALICE_CHECKING, "toAccount", ALICE_SAVINGS, "amount", "75"));
        String flowId = flowService.getFlowForIntent(token, intentId).getId();

        InterruptResult result = flowService.interrupt(token, flowId);

        assertThat(result.getFlow().getStatus()).isEqualTo(FlowStatus.INTERRUPTED);
        IntentView intent = result.getIntent();
        assertThat(intent.getStatus()).isEqualTo(IntentStatus.PENDING_DETAILS);
        assertThat(intent.getContext())
                .doesNotContainKey("confirm")
                .containsEntry("fromAccount", ALICE_CHECKING)
                .containsEntry("toAccount", ALICE_SAVINGS);

        InterruptResult again = flowService.interrupt(token, flowId);
        assertThat(again.getFlow().getStatus()).isEqualTo(FlowStatus.INTERRUPTED);
    }

    @Test
    void resumedIntentGetsAFreshFlow() {
        String intentId = ready(OperationType.TRANSFER,
                Map.of("fromAccount", ALICE_CHECKING, "toAccount", ALICE_SAVINGS, "amount", "75"));
        String firstFlow = flowService.getFlowForIntent(token, intentId).getId();
        flowService.interrupt(token, firstFlow);

        fixtures.intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(intentId).answers(Map.of("confirm", true)).build());

        ScreenFlow resumed = flowService.getFlowForIntent(token, intentId);
        assertThat(resumed.getId()).isNotEqualTo(firstFlow);
        assertThat(resumed.getStatus()).isEqualTo(FlowStatus.PENDING);
    }

    @Test
    void completedTransactionCannotBeInterrupted() {
        String intentId = ready(OperationType.TRANSFER,
                Map.of("fromAccount", ALICE_CHECKING, "toAccount", ALICE_SAVINGS, "amount", "75"));
        fixtures.transactionExecutor.executeIntent(token, intentId);
        String flowId = flowService.getFlowForIntent(token, intentId).getId();

        AtmException error = catchAtm(() -> flowService.interrupt(token, flowId));

        assertThat(error.getKind()).isEqualTo(ErrorKind.INVALID_STATE);
        assertThat(error.getMessage()).isEqualTo("Completed transactions cannot be interrupted");
    }

    @Test
    void flowsOfOtherSessionsAreHidden() {
        String intentId = ready(OperationType.TRANSFER,
                Map.of("fromAccount", ALICE_CHECKING, "toAccount", ALICE_SAVINGS, "amount", "75"));
        String flowId = flowService.getFlowForIntent(token, intentId).getId();
        String bob = fixtures.verifiedSession(BOB_PAN, BOB_PIN);

        AtmException error = catchAtm(() -> flowService.interrupt(bob, flowId));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    private String ready(OperationType operation, Map<String, Object> answers) {
        String intentId = fixtures.intentService.createOrUpdate(token, IntentInput.builder()
                .operation(operation).answers(answers).build()).getIntentId();
        fixtures.intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(intentId).answers(Map.of("confirm", true)).build());
        return intentId;
    }
}
