package com.demoBank.atmDemo.gateway.controller;

import com.demoBank.atmDemo.gateway.dto.ChatRequest;
import com.demoBank.atmDemo.gateway.dto.ChatResponse;
import com.demoBank.atmDemo.gateway.service.CorrelationIdService;
import com.demoBank.atmDemo.gateway.service.GatewayService;
import com.demoBank.atmDemo.orchestrator.model.ConversationMessage;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.demoBank.atmDemo.gateway.controller.AtmController.SESSION_TOKEN_HEADER;

/**
 * Gateway REST controller - thin HTTP layer for chat requests.
 */
@RestController
@RequestMapping("/api/v1/chat")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class GatewayController {

    private final GatewayService gatewayService;
    private final CorrelationIdService correlationIdService;

    /**
     * Handle preflight OPTIONS requests for CORS.
     */
    @RequestMapping(method = RequestMethod.OPTIONS)
    public ResponseEntity<Void> options() {
        return ResponseEntity.ok().build();
    }

    @PostMapping
    public ResponseEntity<ChatResponse> chat(
            @Valid @RequestBody ChatRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token,
            @RequestHeader(value = CorrelationIdService.HEADER, required = false) String correlationIdHeader) {
        String correlationId = correlationIdService.resolveCorrelationId(correlationIdHeader);
        return ResponseEntity.ok()
                .header(CorrelationIdService.HEADER, correlationId)
                .body(gatewayService.processChatRequest(request, token, correlationId));
    }

    @GetMapping("/history")
    public ResponseEntity<List<ConversationMessage>> history(
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(gatewayService.chatHistory(token));
    }
}
