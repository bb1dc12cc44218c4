package com.demoBank.atmDemo.session.service;

import com.demoBank.atmDemo.intent.model.IntentStatus;
import com.demoBank.atmDemo.intent.model.TransactionIntent;
import com.demoBank.atmDemo.repository.ConversationRepository;
import com.demoBank.atmDemo.repository.IntentRepository;
import com.demoBank.atmDemo.repository.ScreenFlowRepository;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.model.SessionStatus;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;

/**
 * Ordered teardown of everything a session owns: flows, then intents, then the conversation log,
 * then the session itself. Transactions belong to the ledger and stay.
 * Runs on logout and when an idle session is evicted from the session store.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SessionArchiveService {

    private final ScreenFlowRepository screenFlowRepository;
    private final IntentRepository intentRepository;
    private final ConversationRepository conversationRepository;
    private final Clock clock;

    public void archive(AtmSession session) {
        String sessionId = session.getSessionId();

        int flows = screenFlowRepository.archiveBySessionId(sessionId);

        int cancelled = 0;
        for (TransactionIntent intent : intentRepository.findBySessionId(sessionId)) {
            if (!intent.isTerminal()) {
                intent.setStatus(IntentStatus.CANCELLED);
                intent.setUpdatedAt(clock.instant());
                cancelled++;
            }
        }
        int intents = intentRepository.archiveBySessionId(sessionId);

        int messages = conversationRepository.archive(sessionId);

        session.setStatus(SessionStatus.EXPIRED);
        session.getOverview().clear();
        log.info("Session archived - sessionId: {}, flows: {}, intents: {}, cancelledIntents: {}, messages: {}",
                sessionId, flows, intents, cancelled, messages);
    }
}
