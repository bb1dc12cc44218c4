package com.demoBank.atmDemo.gateway.controller;

import com.demoBank.atmDemo.flow.dto.InterruptResult;
import com.demoBank.atmDemo.flow.model.ScreenFlow;
import com.demoBank.atmDemo.flow.service.ScreenFlowService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.demoBank.atmDemo.gateway.controller.AtmController.SESSION_TOKEN_HEADER;

@RestController
@RequestMapping("/api/v1/flows")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class FlowController {

    private final ScreenFlowService screenFlowService;

    @GetMapping
    public ResponseEntity<ScreenFlow> getForIntent(
            @RequestParam String intentId,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(screenFlowService.getFlowForIntent(token, intentId));
    }

    @GetMapping("/{flowId}")
    public ResponseEntity<ScreenFlow> get(
            @PathVariable String flowId,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(screenFlowService.getFlow(token, flowId));
    }

    @PostMapping("/{flowId}/interrupt")
    public ResponseEntity<InterruptResult> interrupt(
            @PathVariable String flowId,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(screenFlowService.interrupt(token, flowId));
    }
}
