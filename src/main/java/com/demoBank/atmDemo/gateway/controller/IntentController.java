package com.demoBank.atmDemo.gateway.controller;

import com.demoBank.atmDemo.intent.dto.IntentInput;
import com.demoBank.atmDemo.intent.dto.IntentView;
import com.demoBank.atmDemo.intent.service.IntentService;
import com.demoBank.atmDemo.transaction.dto.TransactionResult;
import com.demoBank.atmDemo.transaction.service.TransactionExecutor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.demoBank.atmDemo.gateway.controller.AtmController.SESSION_TOKEN_HEADER;

@RestController
@RequestMapping("/api/v1/intents")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class IntentController {

    private final IntentService intentService;
    private final TransactionExecutor transactionExecutor;

    /**
     * Creates an intent, or updates the one named by {@code intentId}.
     */
    @PostMapping
    public ResponseEntity<IntentView> createOrUpdate(
            @Valid @RequestBody IntentInput input,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(intentService.createOrUpdate(token, input));
    }

    @GetMapping
    public ResponseEntity<List<IntentView>> list(
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(intentService.listIntents(token));
    }

    @GetMapping("/{intentId}")
    public ResponseEntity<IntentView> get(
            @PathVariable String intentId,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(intentService.getIntent(token, intentId));
    }

    @PostMapping("/{intentId}/execute")
    public ResponseEntity<TransactionResult> execute(
            @PathVariable String intentId,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(transactionExecutor.executeIntent(token, intentId));
    }

    @PostMapping("/{intentId}/cancel")
    public ResponseEntity<IntentView> cancel(
            @PathVariable String intentId,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(intentService.cancelIntent(token, intentId));
    }
}
