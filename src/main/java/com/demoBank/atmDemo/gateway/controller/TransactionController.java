package com.demoBank.atmDemo.gateway.controller;

import com.demoBank.atmDemo.intent.model.OperationType;
import com.demoBank.atmDemo.transaction.dto.ReceiptRequest;
import com.demoBank.atmDemo.transaction.dto.StructuredTransactionRequest;
import com.demoBank.atmDemo.transaction.dto.TransactionResult;
import com.demoBank.atmDemo.transaction.model.Receipt;
import com.demoBank.atmDemo.transaction.service.ReceiptService;
import com.demoBank.atmDemo.transaction.service.TransactionExecutor;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import static com.demoBank.atmDemo.gateway.controller.AtmController.SESSION_TOKEN_HEADER;

/**
 * Structured transaction endpoints that bypass the intent engine, plus receipts.
 */
@RestController
@RequestMapping("/api/v1")
@CrossOrigin(origins = {"http://localhost:5173", "http://localhost:3000"})
@RequiredArgsConstructor
public class TransactionController {

    private final TransactionExecutor transactionExecutor;
    private final ReceiptService receiptService;

    @PostMapping("/transactions/withdraw")
    public ResponseEntity<TransactionResult> withdraw(
            @Valid @RequestBody StructuredTransactionRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(transactionExecutor.executeStructured(token, OperationType.WITHDRAW, request));
    }

    @PostMapping("/transactions/deposit")
    public ResponseEntity<TransactionResult> deposit(
            @Valid @RequestBody StructuredTransactionRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(transactionExecutor.executeStructured(token, OperationType.DEPOSIT, request));
    }

    @PostMapping("/transactions/transfer")
    public ResponseEntity<TransactionResult> transfer(
            @Valid @RequestBody StructuredTransactionRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(transactionExecutor.executeStructured(token, OperationType.TRANSFER, request));
    }

    @PostMapping("/receipts")
    public ResponseEntity<Receipt> receipt(
            @Valid @RequestBody ReceiptRequest request,
            @RequestHeader(value = SESSION_TOKEN_HEADER, required = false) String token) {
        return ResponseEntity.ok(receiptService.createReceipt(token, request.getTransactionId(), request.getMode(), request.getEmail()));
    }
}
