package com.demoBank.atmDemo.gateway.controller;

import com.demoBank.atmDemo.gateway.service.GatewayService;
import com.demoBank.atmDemo.session.dto.FinalizeRequest;
import com.demoBank.atmDemo.session.dto.FinalizeResponse;
import com.demoBank.atmDemo.session.dto.LoginRequest;
import com.demoBank.atmDemo.session.dto.LoginResponse;
import com.demoBank.atmDemo.session.dto.PinValidationRequest;
import com.demoBank.atmDemo.session.dto.PinValidationResponse;
import com.demoBank.atmDemo.session.dto.PreferencesRequest;
import com.demoBank.atmDemo.session.dto.PreferencesResponse;
import com.demoBank.atmDemo.session.dto.WithdrawalAuthorizeRequest;
import com.demoBank.atmDemo.session.dto.WithdrawalAuthorizeResponse;
import com.demoBank.atmDemo.session.service.ProtocolPhaseService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

/**
 * ATM protocol endpoints: login, preferences, PIN, overview finalize, withdrawal authorization and logout.
 */
@RestController
@RequestMapping("/api/v1/atm")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class AtmController {

    static final String SESSION_TOKEN_HEADER = "X-Session-Token";

    private final ProtocolPhaseService protocolPhaseService;
    private final GatewayService gatewayService;

    @PostMapping("/login")
    public ResponseEntity<LoginResponse> login(@Valid @RequestBody LoginRequest request) {
        return ResponseEntity.ok(protocolPhaseService.login(request));
    }

    @PostMapping("/preferences")
    public ResponseEntity<PreferencesResponse> preferences(
            @Valid @RequestBody PreferencesRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(protocolPhaseService.preferences(token, request));
    }

    @PostMapping("/pin")
    public ResponseEntity<PinValidationResponse> validatePin(
            @Valid @RequestBody PinValidationRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(protocolPhaseService.validatePin(token, request));
    }

    @PostMapping("/finalize")
    public ResponseEntity<FinalizeResponse> finalizeOverview(
            @Valid @RequestBody FinalizeRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(protocolPhaseService.finalizeOverview(token, request));
    }

    @PostMapping("/authorize")
    public ResponseEntity<WithdrawalAuthorizeResponse> authorize(
            @Valid @RequestBody WithdrawalAuthorizeRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(protocolPhaseService.authorizeWithdrawal(token, request));
    }

    @PostMapping("/logout")
    public ResponseEntity<Map<String, String>> logout(
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        gatewayService.forgetSession(token);
        protocolPhaseService.logout(token);
        return ResponseEntity.ok(Map.of("status", "success", "message", "Logged out successfully"));
    }
}
