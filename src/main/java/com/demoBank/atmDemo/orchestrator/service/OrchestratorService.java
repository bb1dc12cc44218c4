package com.demoBank.atmDemo.orchestrator.service;

import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.config.AtmProperties;
import com.demoBank.atmDemo.gateway.dto.ChatResponse;
import com.demoBank.atmDemo.llm.dto.GroqApiRequest;
import com.demoBank.atmDemo.llm.dto.GroqApiResponse;
import com.demoBank.atmDemo.llm.service.LlmClient;
import com.demoBank.atmDemo.orchestrator.model.ConversationMessage;
import com.demoBank.atmDemo.orchestrator.model.MessageSender;
import com.demoBank.atmDemo.orchestrator.prompt.AtmAssistantPrompt;
import com.demoBank.atmDemo.orchestrator.tool.AtmToolCatalog;
import com.demoBank.atmDemo.orchestrator.tool.ToolCallContext;
import com.demoBank.atmDemo.orchestrator.tool.ToolOutcome;
import com.demoBank.atmDemo.repository.ConversationRepository;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.service.SessionService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Orchestrator service - drives one chat turn through a bounded tool-calling loop.
 *
 * Loop:
 * APPEND_USER -> (CALL_MODEL -> (tool calls ? DISPATCH each -> CALL_MODEL : ANSWER)) up to max iterations
 * -> CHECK_GROUNDING -> APPEND_ASSISTANT -> RESPOND
 *
 * The session lock is not held while waiting for the model; each tool takes it for its own call.
 * A second turn on the same session while one is running is rejected.
 */
@Slf4j
@Service
public class OrchestratorService {

    private final SessionService sessionService;
    private final ConversationRepository conversationRepository;
    private final LlmClient llmClient;
    private final ToolDispatcher toolDispatcher;
    private final NumericGroundingGuard groundingGuard;
    private final Clock clock;
    private final int maxIterations;
    private final int historyWindow;
    private final Set<String> activeTurns = ConcurrentHashMap.newKeySet();

    public OrchestratorService(SessionService sessionService,
                               ConversationRepository conversationRepository,
                               LlmClient llmClient,
                               ToolDispatcher toolDispatcher,
                               NumericGroundingGuard groundingGuard,
                               AtmProperties properties,
                               Clock clock) {
        this.sessionService = sessionService;
        this.conversationRepository = conversationRepository;
        this.llmClient = llmClient;
        this.toolDispatcher = toolDispatcher;
        this.groundingGuard = groundingGuard;
        this.clock = clock;
        this.maxIterations = properties.getOrchestrator().getMaxIterations();
        this.historyWindow = properties.getOrchestrator().getHistoryWindow();
    }

    /**
     * Processes one customer message.
     *
     * @param pinBlock keypad PIN data captured with this message, or null
     * @throws AtmException SEQUENCE_ERROR without a PIN-validated session, CONCURRENT_REQUEST while another
     *                      turn runs, LLM_UNAVAILABLE or TOOL_TIMEOUT when the turn cannot finish
     */
    public ChatResponse chat(String token, String messageText, String pinBlock, String correlationId) {
        String sessionId = sessionService.executeVerified(token, AtmSession::getSessionId);
        if (!activeTurns.add(sessionId)) {
            throw new AtmException(ErrorKind.CONCURRENT_REQUEST, "A chat message for this session is already being processed");
        }
        try {
            log.info("Chat turn started - correlationId: {}, sessionId: {}", correlationId, sessionId);
            ConversationMessage userMessage = append(sessionId, MessageSender.USER, messageText);

            ToolCallContext context = new ToolCallContext(token, sessionId, pinBlock);

            List<GroqApiRequest.Message> messages = new ArrayList<>();
            messages.add(GroqApiRequest.Message.system(AtmAssistantPrompt.SYSTEM_PROMPT));
            messages.addAll(historyWindow(sessionId));

            for (int iteration = 1; iteration <= maxIterations; iteration++) {
                GroqApiResponse response = callModel(sessionId, messages);

                if (!response.hasToolCalls()) {
                    String answer = response.getContent();
                    if (answer == null || answer.isBlank()) {
                        log.warn("Empty answer from model - correlationId: {}, iteration: {}", correlationId, iteration);
                        return respond(userMessage, context, AtmAssistantPrompt.UNABLE_TO_COMPLETE, null, correlationId);
                    }
                    if (!groundingGuard.isGrounded(answer, context.getGroundedNumbers())) {
                        audit(sessionId, "Answer replaced: it mentioned amounts not returned by any tool");
                        answer = AtmAssistantPrompt.UNGROUNDED_ANSWER;
                    }
                    log.info("Chat turn finished - correlationId: {}, sessionId: {}, iterations: {}", correlationId, sessionId, iteration);
                    return respond(userMessage, context, answer.strip(), null, correlationId);
                }

                messages.add(GroqApiRequest.Message.assistantToolCalls(response.getToolCalls()));
                for (GroqApiResponse.ToolCall call : response.getToolCalls()) {
                    ToolOutcome outcome = dispatch(sessionId, call, context);
                    if (outcome.isFailure()) {
                        audit(sessionId, outcome.getToolName() + " failed: " + errorCode(outcome.getError()) + " " + outcome.getError().getMessage());
                        if (outcome.isTerminalFailure()) {
                            log.info("Terminal tool failure - correlationId: {}, sessionId: {}, kind: {}",
                                    correlationId, sessionId, outcome.getError().getKind());
                            return respond(userMessage, context, AtmAssistantPrompt.SESSION_ENDED, outcome.getError(), correlationId);
                        }
                    }
                    messages.add(GroqApiRequest.Message.tool(call.getId(), outcome.getToolName(), outcome.getContent()));
                }
            }

            log.warn("Max iterations reached - correlationId: {}, sessionId: {}, maxIterations: {}", correlationId, sessionId, maxIterations);
            audit(sessionId, "Turn stopped after " + maxIterations + " model calls");
            return respond(userMessage, context, AtmAssistantPrompt.UNABLE_TO_COMPLETE, null, correlationId);
        } finally {
            activeTurns.remove(sessionId);
        }
    }

    /**
     * Conversation log of the session, oldest first.
     */
    public List<ConversationMessage> history(String token) {
        return sessionService.executeVerified(token, session -> conversationRepository.findBySessionId(session.getSessionId()));
    }

    private GroqApiResponse callModel(String sessionId, List<GroqApiRequest.Message> messages) {
        try {
            return llmClient.complete(messages, AtmToolCatalog.tools());
        } catch (AtmException e) {
            audit(sessionId, "Model call failed: " + e.getKind());
            throw e;
        }
    }

    private ToolOutcome dispatch(String sessionId, GroqApiResponse.ToolCall call, ToolCallContext context) {
        try {
            return toolDispatcher.dispatch(call, context);
        } catch (AtmException e) {
            audit(sessionId, "Tool call failed: " + e.getKind());
            throw e;
        }
    }

    private List<GroqApiRequest.Message> historyWindow(String sessionId) {
        List<ConversationMessage> log = conversationRepository.findBySessionId(sessionId).stream()
                .filter(message -> message.getSender() != MessageSender.SYSTEM)
                .toList();
        return log.subList(Math.max(0, log.size() - historyWindow), log.size()).stream()
                .map(message -> message.getSender() == MessageSender.USER
                        ? GroqApiRequest.Message.user(message.getContent())
                        : GroqApiRequest.Message.assistant(message.getContent()))
                .toList();
    }

    private ChatResponse respond(ConversationMessage userMessage, ToolCallContext context, String answer,
                                 AtmException error, String correlationId) {
        ConversationMessage assistantMessage = append(userMessage.getSessionId(), MessageSender.ASSISTANT, answer);
        return ChatResponse.builder()
                .answer(answer)
                .correlationId(correlationId)
                .messages(List.of(userMessage, assistantMessage))
                .intent(context.getIntent())
                .flow(context.getFlow())
                .errorKind(error != null ? errorCode(error) : null)
                .responseCode(error != null ? error.getResponseCode().getCode() : null)
                .terminal(error != null && error.isTerminal())
                .build();
    }

    private ConversationMessage append(String sessionId, MessageSender sender, String content) {
        ConversationMessage message = ConversationMessage.builder()
                .sessionId(sessionId)
                .sender(sender)
                .content(content)
                .timestamp(clock.instant())
                .build();
        conversationRepository.append(message);
        return message;
    }

    private void audit(String sessionId, String content) {
        append(sessionId, MessageSender.SYSTEM, content);
    }

    private static String errorCode(AtmException error) {
        return error.isLockout() ? error.getKind() + "(" + AtmException.LOCKOUT + ")" : error.getKind().name();
    }
}
