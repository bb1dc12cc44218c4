package com.demoBank.atmDemo.session.service;

import com.demoBank.atmDemo.TestFixtures;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.intent.dto.IntentInput;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import com.demoBank.atmDemo.limits.model.LimitCategory;
import com.demoBank.atmDemo.session.dto.LoginRequest;
import com.demoBank.atmDemo.session.dto.LoginResponse;
import com.demoBank.atmDemo.session.dto.PinValidationResponse;
import com.demoBank.atmDemo.session.dto.PreferencesRequest;
import com.demoBank.atmDemo.session.dto.WithdrawalAuthorizeRequest;
import com.demoBank.atmDemo.session.dto.WithdrawalAuthorizeResponse;
import com.demoBank.atmDemo.session.model.ProtocolPhase;
import com.demoBank.atmDemo.session.model.SessionStatus;
import com.demoBank.atmDemo.transaction.model.Transaction;
import com.demoBank.atmDemo.transaction.model.TransactionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;

import static com.demoBank.atmDemo.TestFixtures.ALICE_CHECKING;
import static com.demoBank.atmDemo.TestFixtures.ALICE_PAN;
import static com.demoBank.atmDemo.TestFixtures.ALICE_PIN;
import static com.demoBank.atmDemo.TestFixtures.BOB_CHECKING;
import static com.demoBank.atmDemo.TestFixtures.BOB_PAN;
import static com.demoBank.atmDemo.TestFixtures.BOB_PIN;
import static com.demoBank.atmDemo.TestFixtures.catchAtm;
import static org.assertj.core.api.Assertions.assertThat;

class ProtocolPhaseServiceTest {

    private TestFixtures fixtures;
    private ProtocolPhaseService service;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures();
        service = fixtures.protocolPhaseService;
    }

    @Test
    void fullSessionWithdrawsAndReportsRemainingLimit() {
        LoginResponse login = service.login(TestFixtures.loginRequest(ALICE_PAN));
        assertThat(login.getResponseCode()).isEqualTo("00");
        String token = login.getSessionToken();

        service.preferences(token, TestFixtures.preferencesRequest());
        PinValidationResponse pin = service.validatePin(token, TestFixtures.pinRequest(ALICE_PIN));
        assertThat(pin.getBreadcrumb()).isEqualTo("overview");
        assertThat(pin.getAccounts()).extracting(PinValidationResponse.AccountInfo::getBalance)
                .containsExactly(new BigDecimal("2500.00"), new BigDecimal("4200.00"));

        service.finalizeOverview(token, TestFixtures.finalizeRequest("Completed"));
        WithdrawalAuthorizeResponse response = service.authorizeWithdrawal(token, withdrawal("H-1", "100.00"));

        assertThat(response.getResponseCode()).isEqualTo("00");
        assertThat(response.getAccountInformation().getAmount()).isEqualByComparingTo("2400.00");
        assertThat(response.getWithdrawalDailyLimits().getAmount()).isEqualByComparingTo("400.00");
        assertThat(fixtures.session(token).getPhase()).isEqualTo(ProtocolPhase.OVERVIEW_FINALIZED);
    }

    @Test
    void phaseOutOfOrderIsSequenceError() {
        String token = fixtures.login(ALICE_PAN);

        AtmException error = catchAtm(() -> service.validatePin(token, TestFixtures.pinRequest(ALICE_PIN)));

        assertThat(error.getKind()).isEqualTo(ErrorKind.SEQUENCE_ERROR);
        assertThat(error.isTerminal()).isTrue();
    }

    @Test
    void sequenceErrorEndsTheSessionForGood() {
        String token = fixtures.login(ALICE_PAN);
        catchAtm(() -> service.validatePin(token, TestFixtures.pinRequest(ALICE_PIN)));

        AtmException retry = catchAtm(() -> service.preferences(token, TestFixtures.preferencesRequest()));

        assertThat(retry.getKind()).isEqualTo(ErrorKind.SEQUENCE_ERROR);
        assertThat(fixtures.session(token).getStatus()).isEqualTo(SessionStatus.ENDED);
        assertThat(catchAtm(() -> service.validatePin(token, TestFixtures.pinRequest(ALICE_PIN))).getKind())
                .isEqualTo(ErrorKind.SEQUENCE_ERROR);

        service.logout(token);
        assertThat(fixtures.sessionService.findByToken(token)).isEmpty();
    }

    @Test
    void unknownCardIsAuthError() {
        AtmException error = catchAtm(() -> service.login(TestFixtures.loginRequest("4999999999999999")));

        assertThat(error.getKind()).isEqualTo(ErrorKind.AUTH_ERROR);
    }

    @Test
    void identicalLoginIsAnsweredWithTheSameSession() {
        LoginRequest request = TestFixtures.loginRequest(ALICE_PAN);

        LoginResponse first = service.login(request);
        LoginResponse second = service.login(request);

        assertThat(second.getSessionToken()).isEqualTo(first.getSessionToken());
    }

    @Test
    void identicalPhaseRequestReturnsStoredOutcome() {
        String token = fixtures.login(ALICE_PAN);
        service.preferences(token, TestFixtures.preferencesRequest());

        PinValidationResponse first = service.validatePin(token, TestFixtures.pinRequest(ALICE_PIN));
        PinValidationResponse second = service.validatePin(token, TestFixtures.pinRequest(ALICE_PIN));

        assertThat(second).isSameAs(first);
    }

    @Test
    void wrongPinCountsDownThenLocksTheSession() {
        String token = fixtures.login(ALICE_PAN);
        service.preferences(token, TestFixtures.preferencesRequest());

        AtmException first = catchAtm(() -> service.validatePin(token, TestFixtures.pinRequest("0000")));
        assertThat(first.getKind()).isEqualTo(ErrorKind.PIN_ERROR);
        assertThat(first.getResponseCode().getCode()).isEqualTo("55");
        assertThat(first.getDetails()).containsEntry("remainingAttempts", 2);

        catchAtm(() -> service.validatePin(token, TestFixtures.pinRequest("1111")));
        AtmException third = catchAtm(() -> service.validatePin(token, TestFixtures.pinRequest("2222")));
        assertThat(third.isLockout()).isTrue();
        assertThat(third.getResponseCode().getCode()).isEqualTo("75");
        assertThat(fixtures.session(token).getStatus()).isEqualTo(SessionStatus.LOCKED);

        AtmException afterLock = catchAtm(() -> service.validatePin(token, TestFixtures.pinRequest(ALICE_PIN)));
        assertThat(afterLock.isLockout()).isTrue();
        assertThat(fixtures.session(token).getPinAttempts()).isEqualTo(3);
    }

    @Test
    void emailReceiptWithoutAddressIsRejected() {
        String token = fixtures.login(ALICE_PAN);
        PreferencesRequest request = PreferencesRequest.builder()
                .clientId("ATM-01")
                .clientRequestNumber("2")
                .preferences(PreferencesRequest.Preferences.builder().language("en").receiptPreference("EMAIL").build())
                .build();

        AtmException error = catchAtm(() -> service.preferences(token, request));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
        assertThat(fixtures.session(token).getPhase()).isEqualTo(ProtocolPhase.LOGIN_OK);
    }

    @Test
    void cancelledOverviewDropsTheSnapshot() {
        String token = fixtures.verifiedSession(ALICE_PAN, ALICE_PIN);
        assertThat(fixtures.session(token).getOverview()).hasSize(2);

        service.finalizeOverview(token, TestFixtures.finalizeRequest("Cancelled"));

        assertThat(fixtures.session(token).getOverview()).isEmpty();
        assertThat(fixtures.accountRepository.findById(ALICE_CHECKING).orElseThrow().getBalance()).isEqualByComparingTo("2500.00");
    }

    @Test
    void replayedAuthorizationDebitsOnce() {
        String token = fixtures.finalizedSession(ALICE_PAN, ALICE_PIN);

        WithdrawalAuthorizeResponse first = service.authorizeWithdrawal(token, withdrawal("H-7", "60.00"));
        WithdrawalAuthorizeResponse second = service.authorizeWithdrawal(token, withdrawal("H-7", "60.00"));

        assertThat(second.getTransactionId()).isEqualTo(first.getTransactionId());
        assertThat(fixtures.accountRepository.findById(ALICE_CHECKING).orElseThrow().getBalance()).isEqualByComparingTo("2440.00");
    }

    @Test
    void reusedHostTransactionNumberWithOtherPayloadIsRejected() {
        String token = fixtures.finalizedSession(ALICE_PAN, ALICE_PIN);
        service.authorizeWithdrawal(token, withdrawal("H-8", "20.00"));

        AtmException error = catchAtm(() -> service.authorizeWithdrawal(token, withdrawal("H-8", "40.00")));

        assertThat(error.getKind()).isEqualTo(ErrorKind.VALIDATION_ERROR);
    }

    @Test
    void withdrawalOverDailyLimitFailsWithoutChangingBalance() {
        String token = fixtures.finalizedSession(ALICE_PAN, ALICE_PIN);
        service.authorizeWithdrawal(token, withdrawal("H-1", "100.00"));

        AtmException error = catchAtm(() -> service.authorizeWithdrawal(token, withdrawal("H-2", "450.00")));

        assertThat(error.getKind()).isEqualTo(ErrorKind.LIMIT_ERROR);
        assertThat(error.getResponseCode().getCode()).isEqualTo("51");
        assertThat(fixtures.accountRepository.findById(ALICE_CHECKING).orElseThrow().getBalance()).isEqualByComparingTo("2400.00");
        assertThat(fixtures.dailyLimitTracker.find(ALICE_CHECKING, fixtures.dailyLimitTracker.today()).count(
                LimitCategory.WITHDRAWAL)).isEqualTo(1);
    }

    @Test
    void insufficientFundsRecordsFailedTransaction() {
        String token = fixtures.finalizedSession(BOB_PAN, BOB_PIN);

        AtmException error = catchAtm(() -> service.authorizeWithdrawal(token, withdrawal(BOB_CHECKING, "H-3", "2000.00")));

        assertThat(error.getKind()).isEqualTo(ErrorKind.BALANCE_ERROR);
        assertThat(fixtures.accountRepository.findById(BOB_CHECKING).orElseThrow().getBalance()).isEqualByComparingTo("1800.00");
        assertThat(fixtures.transactionRepository.findByAccountId(BOB_CHECKING, 10))
                .extracting(Transaction::getStatus)
                .containsExactly(TransactionStatus.FAILED);
    }

    @Test
    void expiredSessionIsReportedAsExpired() {
        String token = fixtures.login(ALICE_PAN);
        fixtures.clock.advance(Duration.ofMinutes(31));

        AtmException error = catchAtm(() -> service.preferences(token, TestFixtures.preferencesRequest()));

        assertThat(error.getKind()).isEqualTo(ErrorKind.SESSION_EXPIRED);
        assertThat(error.isTerminal()).isTrue();
    }

    @Test
    void logoutEndsTheSession() {
        String token = fixtures.verifiedSession(ALICE_PAN, ALICE_PIN);
        String sessionId = fixtures.session(token).getSessionId();
        fixtures.intentService.createOrUpdate(token, IntentInput.builder().operation(OperationType.WITHDRAW).build());

        service.logout(token);

        assertThat(fixtures.sessionService.findByToken(token)).isEmpty();
        assertThat(fixtures.intentRepository.findBySessionId(sessionId)).isEmpty();
        assertThat(fixtures.intentRepository.findArchived(sessionId))
                .extracting(TransactionIntent::getStatus)
                .containsExactly(IntentStatus.CANCELLED);
        AtmException error = catchAtm(() -> service.finalizeOverview(token, TestFixtures.finalizeRequest("Completed")));
        assertThat(error.getKind()).isEqualTo(ErrorKind.SEQUENCE_ERROR);
    }

    private static WithdrawalAuthorizeRequest withdrawal(String hostTransactionNumber, String amount) {
        return withdrawal(ALICE_CHECKING, hostTransactionNumber, amount);
    }

    private static WithdrawalAuthorizeRequest withdrawal(String account, String hostTransactionNumber, String amount) {
        String pin = account.equals(BOB_CHECKING) ? BOB_PIN : ALICE_PIN;
        return WithdrawalAuthorizeRequest.builder()
                .clientId("ATM-01")
                .clientRequestNumber("5")
                .hostTransactionNumber(hostTransactionNumber)
                .encryptedPinData(TestFixtures.pinBlock(pin))
                .sourceAccount(WithdrawalAuthorizeRequest.SourceAccount.builder().number(account).type("CHECKING").build())
                .requestedAmount(new BigDecimal(amount))
                .currency("USD")
                .build();
    }
}
