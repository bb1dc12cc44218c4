package com.demoBank.atmDemo.intent.service;

import com.demoBank.atmDemo.TestFixtures;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.flow.model.FlowStatus;
import com.demoBank.atmDemo.flow.model.FlowStep;
import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.demoBank.atmDemo.intent.dto.IntentInput;
import com.demoBank.atmDemo.intent.dto.IntentView;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;

import static com.demoBank.atmDemo.TestFixtures.ALICE_CHECKING;
import static com.demoBank.atmDemo.TestFixtures.ALICE_PAN;
import static com.demoBank.atmDemo.TestFixtures.ALICE_PIN;
import static com.demoBank.atmDemo.TestFixtures.ALICE_SAVINGS;
import static com.demoBank.atmDemo.TestFixtures.BOB_CHECKING;
import static com.demoBank.atmDemo.TestFixtures.BOB_PAN;
import static com.demoBank.atmDemo.TestFixtures.BOB_PIN;
import static com.demoBank.atmDemo.TestFixtures.catchAtm;
import static org.assertj.core.api.Assertions.assertThat;

class IntentServiceTest {

    private TestFixtures fixtures;
    private IntentService intentService;
    private String token;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures();
        intentService = fixtures.intentService;
        token = fixtures.verifiedSession(ALICE_PAN, ALICE_PIN);
    }

    @Test
    void intentsNeedAPinValidatedSession() {
        String unverified = fixtures.login(BOB_PAN);

        AtmException error = catchAtm(() -> intentService.createOrUpdate(unverified,
                IntentInput.builder().operation(OperationType.TRANSFER).build()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.SEQUENCE_ERROR);
    }

    @Test
    void typedRequestFillsTheTransferFields() {
        IntentView view = intentService.createOrUpdate(token,
                IntentInput.builder().naturalLanguage("Please transfer $50 from checking to savings").build());

        assertThat(view.getOperation()).isEqualTo(OperationType.TRANSFER);
        assertThat(view.getContext())
                .containsEntry("fromAccount", ALICE_CHECKING)
                .containsEntry("toAccount", ALICE_SAVINGS)
                .containsEntry("amount", new BigDecimal("50.00"));
        assertThat(view.getMissingFields()).isEmpty();
        assertThat(view.getStatus()).isEqualTo(IntentStatus.PENDING_DETAILS);
    }

    @Test
    void missingFieldsComeWithOneQuestionEach() {
        IntentView view = intentService.createOrUpdate(token,
                IntentInput.builder().operation(OperationType.TRANSFER).answers(Map.of("amount", "25")).build());

        assertThat(view.getMissingFields()).containsExactly("fromAccount", "toAccount");
        assertThat(view.getClarificationQuestions()).containsExactly(
                "Which account would you like to use as the source?",
                "Which account should receive the money?");
    }

    @Test
    void confirmationMakesTheIntentReadyAndBuildsItsFlow() {
        IntentView view = intentService.createOrUpdate(token, transfer("100"));

        IntentView confirmed = confirm(view.getIntentId());

        assertThat(confirmed.getStatus()).isEqualTo(IntentStatus.READY_TO_EXECUTE);
        ScreenFlow flow = fixtures.screenFlowRepository.findByIntentId(view.getIntentId()).orElseThrow();
        assertThat(flow.getStatus()).isEqualTo(FlowStatus.PENDING);
        assertThat(flow.getSteps()).extracting(FlowStep::getId)
                .containsExactly("selectOperation", "selectFromAccount", "selectToAccount", "confirmAmount", "processing");
    }

    @Test
    void changingADetailDropsTheConfirmation() {
        String intentId = intentService.createOrUpdate(token, transfer("100")).getIntentId();
        confirm(intentId);

        IntentView changed = intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(intentId)
                .answers(Map.of("amount", "120.5"))
                .build());

        assertThat(changed.getStatus()).isEqualTo(IntentStatus.PENDING_DETAILS);
        assertThat(changed.getContext()).doesNotContainKey("confirm").containsEntry("amount", new BigDecimal("120.50"));
        assertThat(fixtures.screenFlowRepository.findByIntentId(intentId).orElseThrow().getStatus())
                .isEqualTo(FlowStatus.INTERRUPTED);
    }

    @Test
    void nullAnswerNeverRemovesAStoredValue() {
        String intentId = intentService.createOrUpdate(token, transfer("100")).getIntentId();
        Map<String, Object> answers = new HashMap<>();
        answers.put("amount", null);

        IntentView view = intentService.createOrUpdate(token, IntentInput.builder().intentId(intentId).answers(answers).build());

        assertThat(view.getContext()).containsEntry("amount", new BigDecimal("100.00"));
    }

    @Test
    void badAnswerLeavesTheIntentUntouched() {
        String intentId = intentService.createOrUpdate(token, transfer("100")).getIntentId();

        AtmException error = catchAtm(() -> intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(intentId)
                .answers(Map.of("memo", "rent", "amount", "-5"))
                .build()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(intentService.getIntent(token, intentId).getContext())
                .containsEntry("amount", new BigDecimal("100.00"))
                .doesNotContainKey("memo");
    }

    @Test
    void amountsWithMoreThanTwoDecimalsAreRejected() {
        AtmException error = catchAtm(() -> intentService.createOrUpdate(token, transfer("10.005")));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(IntentService.normalizeAmount("10.50")).isEqualTo(new BigDecimal("10.50"));
        assertThat(IntentService.normalizeAmount(new BigDecimal("7"))).isEqualTo(new BigDecimal("7.00"));
    }

    @Test
    void transferBetweenTheSameAccountIsRejected() {
        AtmException error = catchAtm(() -> intentService.createOrUpdate(token, IntentInput.builder()
                .operation(OperationType.TRANSFER)
                .answers(Map.of("fromAccount", ALICE_CHECKING, "toAccount", ALICE_CHECKING))
                .build()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    void accountsOfOtherCustomersAreRejected() {
        AtmException error = catchAtm(() -> intentService.createOrUpdate(token, IntentInput.builder()
                .operation(OperationType.WITHDRAW)
                .answers(Map.of("fromAccount", BOB_CHECKING))
                .build()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    void pinConfirmationOnlyComesFromTheKeypad() {
        IntentView view = intentService.createOrUpdate(token, IntentInput.builder()
                .operation(OperationType.WITHDRAW)
                .answers(Map.of("fromAccount", ALICE_CHECKING, "amount", "40"))
                .build());
        assertThat(view.getMissingFields()).containsExactly("pinConfirmed");

        AtmException direct = catchAtm(() -> intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(view.getIntentId())
                .answers(Map.of("pinConfirmed", true))
                .build()));
        assertThat(direct.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);

        IntentView keyed = intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(view.getIntentId())
                .answers(Map.of(IntentService.PIN_BLOCK, TestFixtures.pinBlock(ALICE_PIN)))
                .build());
        assertThat(keyed.getMissingFields()).isEmpty();
        assertThat(keyed.getContext()).containsEntry("pinConfirmed", true).doesNotContainKey(IntentService.PIN_BLOCK);
    }

    @Test
    void wrongKeypadPinCountsAsAPinAttempt() {
        String intentId = intentService.createOrUpdate(token, IntentInput.builder()
                .operation(OperationType.WITHDRAW)
                .answers(Map.of("fromAccount", ALICE_CHECKING, "amount", "40"))
                .build()).getIntentId();

        AtmException error = catchAtm(() -> intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(intentId)
                .answers(Map.of(IntentService.PIN_BLOCK, TestFixtures.pinBlock("9999")))
                .build()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.PIN_ERROR);
        assertThat(fixtures.session(token).getPinAttempts()).isEqualTo(1);
        assertThat(intentService.getIntent(token, intentId).getContext()).doesNotContainKey("pinConfirmed");
    }

    @Test
    void newPinIsNeverShownInViews() {
        IntentView view = intentService.createOrUpdate(token, IntentInput.builder()
                .operation(OperationType.PIN_CHANGE)
                .answers(Map.of("newPinBlock", TestFixtures.pinBlock("4321")))
                .build());

        assertThat(view.getContext()).containsEntry("newPinBlock", "****");
        assertThat(fixtures.intentRepository.findById(view.getIntentId()).orElseThrow().getContext().get("newPinBlock"))
                .asString()
                .isNotEqualTo(TestFixtures.pinBlock("4321"))
                .isNotEqualTo("4321");
    }

    @Test
    void operationOfAnExistingIntentIsFixed() {
        String intentId = intentService.createOrUpdate(token, transfer("100")).getIntentId();

        AtmException error = catchAtm(() -> intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(intentId)
                .operation(OperationType.WITHDRAW)
                .build()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    void cancelledIntentCannotChange() {
        String intentId = intentService.createOrUpdate(token, transfer("100")).getIntentId();

        assertThat(intentService.cancelIntent(token, intentId).getStatus()).isEqualTo(IntentStatus.CANCELLED);

        AtmException update = catchAtm(() -> intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(intentId)
                .answers(Map.of("amount", "5"))
                .build()));
        assertThat(update.getKind()).isEqualTo(ErrorKind.INVALID_STATE);
        assertThat(catchAtm(() -> intentService.cancelIntent(token, intentId)).getKind()).isEqualTo(ErrorKind.INVALID_STATE);
    }

    @Test
    void intentsAreScopedToTheirSession() {
        String intentId = intentService.createOrUpdate(token, transfer("100")).getIntentId();
        String otherToken = fixtures.verifiedSession(BOB_PAN, BOB_PIN);

        AtmException error = catchAtm(() -> intentService.getIntent(otherToken, intentId));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(intentService.listIntents(otherToken)).isEmpty();
        assertThat(intentService.listIntents(token)).extracting(IntentView::getIntentId).containsExactly(intentId);
    }

    @Test
    void unrecognizedTextWithoutOperationIsRejected() {
        AtmException error = catchAtm(() -> intentService.createOrUpdate(token,
                IntentInput.builder().naturalLanguage("hello there").build()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    private IntentView confirm(String intentId) {
        return intentService.createOrUpdate(token, IntentInput.builder()
                .intentId(intentId)
                .answers(Map.of("confirm", true))
                .build());
    }

    private static IntentInput transfer(String amount) {
        return IntentInput.builder()
                .operation(OperationType.TRANSFER)
                .answers(Map.of("fromAccount", ALICE_CHECKING, "toAccount", ALICE_SAVINGS, "amount", amount))
                .build();
    }
}
