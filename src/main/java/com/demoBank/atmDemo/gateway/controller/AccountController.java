package com.demoBank.atmDemo.gateway.controller;

import com.demoBank.atmDemo.bank.dto.AccountDetails;
import com.demoBank.atmDemo.bank.dto.AccountSummary;
import com.demoBank.atmDemo.gateway.service.GatewayService;
import com.demoBank.atmDemo.limits.model.RemainingLimits;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

import static com.demoBank.atmDemo.gateway.controller.AtmController.SESSION_TOKEN_HEADER;

@RestController
@RequestMapping("/api/v1/accounts")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class AccountController {

    private final GatewayService gatewayService;

    @GetMapping
    public ResponseEntity<List<AccountSummary>> list(
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(gatewayService.listAccounts(token));
    }

    @GetMapping("/{accountId}")
    public ResponseEntity<AccountDetails> details(
            @PathVariable String accountId,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(gatewayService.getAccountDetails(token, accountId));
    }

    @GetMapping("/{accountId}/limits")
    public ResponseEntity<RemainingLimits> limits(
            @PathVariable String accountId,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(gatewayService.getRemainingLimits(token, accountId));
    }
}
