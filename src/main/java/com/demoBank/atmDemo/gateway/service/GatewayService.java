package com.demoBank.atmDemo.gateway.service;

import com.demoBank.atmDemo.bank.dto.AccountDetails;
import com.demoBank.atmDemo.bank.dto.AccountSummary;
import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.bank.service.AccountService;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.gateway.dto.ChatRequest;
import com.demoBank.atmDemo.gateway.dto.ChatResponse;
import com.demoBank.atmDemo.gateway.exception.RateLimitExceededException;
import com.demoBank.atmDemo.limits.model.RemainingLimits;
import com.demoBank.atmDemo.orchestrator.model.ConversationMessage;
import com.demoBank.atmDemo.orchestrator.service.OrchestratorService;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.service.SessionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Gateway service - edge logic shared by the controllers.
 *
 * Responsibilities:
 * - Validate the session token header
 * - Enforce the per-session chat rate limit
 * - Forward chat messages to the orchestrator
 * - Serve account reads for a PIN-validated session
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class GatewayService {

    private final SessionService sessionService;
    private final AccountService accountService;
    private final OrchestratorService orchestratorService;
    private final RateLimiter rateLimiter;

    /**
     * @throws AtmException SEQUENCE_ERROR without a session token
     * @throws RateLimitExceededException if the session sent too many messages in the last minute
     */
    public ChatResponse processChatRequest(ChatRequest request, String token, String correlationId) {
        String sessionId = sessionService.findByToken(requireToken(token))
                .map(AtmSession::getSessionId)
                .orElseThrow(() -> AtmException.sequence("No active session, login required"));

        if (!rateLimiter.isAllowed(sessionId)) {
            throw new RateLimitExceededException("Too many messages, please wait a moment");
        }

        log.info("Chat request received - correlationId: {}, sessionId: {}, hasPinData: {}",
                correlationId, sessionId, request.getEncryptedPinData() != null);
        return orchestratorService.chat(token, request.getMessageText(), request.getEncryptedPinData(), correlationId);
    }

    public List<ConversationMessage> chatHistory(String token) {
        return orchestratorService.history(requireToken(token));
    }

    public List<AccountSummary> listAccounts(String token) {
        return sessionService.executeVerified(requireToken(token), session -> accountService.listAccounts(session.getCustomerId()));
    }

    public AccountDetails getAccountDetails(String token, String accountReference) {
        return sessionService.executeVerified(requireToken(token), session -> {
            Account account = accountService.resolveOwnedAccount(session.getCustomerId(), accountReference);
            return accountService.getAccountDetails(session.getCustomerId(), account.getId());
        });
    }

    public RemainingLimits getRemainingLimits(String token, String accountReference) {
        return sessionService.executeVerified(requireToken(token), session -> {
            Account account = accountService.resolveOwnedAccount(session.getCustomerId(), accountReference);
            return accountService.getRemainingLimits(session.getCustomerId(), account.getId());
        });
    }

    public void forgetSession(String token) {
        sessionService.findByToken(token).ifPresent(session -> rateLimiter.forget(session.getSessionId()));
    }

    private static String requireToken(String token) {
        if (token == null || token.isBlank()) {
            throw AtmException.sequence("No active session, login required");
        }
        return token;
    }
}
