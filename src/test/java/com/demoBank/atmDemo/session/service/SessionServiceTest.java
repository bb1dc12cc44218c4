package com.demoBank.atmDemo.session.service;

import com.demoBank.atmDemo.TestFixtures;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.intent.dto.IntentInput;
import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import com.demoBank.atmDemo.orchestrator.model.ConversationMessage;
import com.demoBank.atmDemo.orchestrator.model.MessageSender;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.model.SessionStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static com.demoBank.atmDemo.TestFixtures.ALICE_PAN;
import static com.demoBank.atmDemo.TestFixtures.ALICE_PIN;
import static com.demoBank.atmDemo.TestFixtures.catchAtm;
import static org.assertj.core.api.Assertions.assertThat;

class SessionServiceTest {

    private TestFixtures fixtures;
    private SessionService sessionService;

    @BeforeEach
    void setUp() {
        fixtures = new TestFixtures();
        fixtures.properties.getSession().setLockWait(Duration.ofMillis(50));
        sessionService = fixtures.sessionService;
    }

    @Test
    void unknownTokenIsSequenceError() {
        AtmException error = catchAtm(() -> sessionService.execute("no-such-token", AtmSession::getSessionId));

        assertThat(error.getKind()).isEqualTo(ErrorKind.SEQUENCE_ERROR);
    }

    @Test
    void everyRequestSlidesTheExpiry() {
        String token = fixtures.login(ALICE_PAN);

        fixtures.clock.advance(Duration.ofMinutes(20));
        sessionService.execute(token, AtmSession::getSessionId);
        fixtures.clock.advance(Duration.ofMinutes(20));

        assertThat(sessionService.execute(token, AtmSession::getStatus)).isEqualTo(SessionStatus.ACTIVE);
        assertThat(fixtures.session(token).getExpiresAt())
                .isEqualTo(TestFixtures.START.plus(Duration.ofMinutes(70)));
    }

    @Test
    void idleSessionExpires() {
        String token = fixtures.login(ALICE_PAN);
        fixtures.clock.advance(Duration.ofMinutes(30).plusSeconds(1));

        AtmException error = catchAtm(() -> sessionService.execute(token, AtmSession::getSessionId));

        assertThat(error.getKind()).isEqualTo(ErrorKind.SESSION_EXPIRED);
        assertThat(fixtures.session(token).getStatus()).isEqualTo(SessionStatus.EXPIRED);
    }

    @Test
    void verifiedWorkNeedsPinValidation() {
        String token = fixtures.login(ALICE_PAN);

        AtmException error = catchAtm(() -> sessionService.executeVerified(token, AtmSession::getSessionId));
        assertThat(error.getKind()).isEqualTo(ErrorKind.SEQUENCE_ERROR);

        String verified = fixtures.verifiedSession(ALICE_PAN, ALICE_PIN);
        assertThat(sessionService.executeVerified(verified, AtmSession::getCustomerId)).isEqualTo("C1001");
    }

    @Test
    void concurrentRequestOnBusySessionIsRejected() throws Exception {
        String token = fixtures.login(ALICE_PAN);
        CountDownLatch holding = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);

        CompletableFuture<String> first = CompletableFuture.supplyAsync(() -> sessionService.execute(token, session -> {
            holding.countDown();
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return session.getSessionId();
        }));
        assertThat(holding.await(5, TimeUnit.SECONDS)).isTrue();

        AtmException error = catchAtm(() -> sessionService.execute(token, AtmSession::getSessionId));
        release.countDown();

        assertThat(error.getKind()).isEqualTo(ErrorKind.CONCURRENT_REQUEST);
        assertThat(first.get(5, TimeUnit.SECONDS)).isEqualTo(fixtures.session(token).getSessionId());
    }

    @Test
    void invalidatedSessionIsGone() {
        String token = fixtures.login(ALICE_PAN);

        sessionService.invalidate(token);

        assertThat(sessionService.findByToken(token)).isEmpty();
        assertThat(sessionService.findByToken(null)).isEmpty();
    }

    @Test
    void sessionAbandonedWithoutLogoutIsArchivedOnEviction() {
        String token = fixtures.verifiedSession(ALICE_PAN, ALICE_PIN);
        String sessionId = fixtures.session(token).getSessionId();
        fixtures.intentService.createOrUpdate(token, IntentInput.builder().operation(OperationType.TRANSFER).build());
        fixtures.conversationRepository.append(ConversationMessage.builder()
                .sessionId(sessionId)
                .sender(MessageSender.USER)
                .content("hello")
                .timestamp(fixtures.clock.instant())
                .build());

        fixtures.clock.advance(Duration.ofMinutes(45));
        sessionService.evictIdleSessions();
        assertThat(fixtures.intentRepository.findBySessionId(sessionId)).hasSize(1);

        fixtures.clock.advance(Duration.ofMinutes(20));
        sessionService.evictIdleSessions();

        assertThat(sessionService.findByToken(token)).isEmpty();
        assertThat(fixtures.intentRepository.findBySessionId(sessionId)).isEmpty();
        assertThat(fixtures.intentRepository.findArchived(sessionId))
                .extracting(TransactionIntent::getStatus)
                .containsExactly(IntentStatus.CANCELLED);
        assertThat(fixtures.conversationRepository.findBySessionId(sessionId)).isEmpty();
        assertThat(fixtures.conversationRepository.findArchived(sessionId))
                .extracting(ConversationMessage::getContent)
                .containsExactly("hello");
    }

    @Test
    void protocolErrorEndsALiveSession() {
        String token = fixtures.login(ALICE_PAN);

        catchAtm(() -> sessionService.executeVerified(token, AtmSession::getSessionId));

        assertThat(fixtures.session(token).getStatus()).isEqualTo(SessionStatus.ENDED);
        assertThat(catchAtm(() -> sessionService.execute(token, AtmSession::getSessionId)).getKind())
                .isEqualTo(ErrorKind.SEQUENCE_ERROR);
    }
}
