package com.demoBank.atmDemo.repository;

import com.demoBank.atmDemo.transaction.model.Receipt;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

@Repository
public class ReceiptRepository {

    private final Map<String, Receipt> receipts = new ConcurrentHashMap<>();

    public Receipt save(Receipt receipt) {
        receipts.put(receipt.getId(), receipt);
        return receipt;
    }

    public Optional<Receipt> findById(String id) {
        return Optional.ofNullable(receipts.get(id));
    }

    public List<Receipt> findByTransactionId(String transactionId) {
        return receipts.values().stream()
                .filter(receipt -> transactionId.equals(receipt.getTransactionId()))
                .toList();
    }
}
