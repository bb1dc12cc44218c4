package com.demoBank.atmDemo.bank.seed;

import com.demoBank.atmDemo.bank.model.Account;
import com.demoBank.atmDemo.bank.model.AccountType;
import com.demoBank.atmDemo.bank.model.Card;
import com.demoBank.atmDemo.bank.model.CardStatus;
import com.demoBank.atmDemo.bank.model.Customer;
import com.demoBank.atmDemo.config.AtmProperties;
import com.demoBank.atmDemo.repository.AccountRepository;
import com.demoBank.atmDemo.repository.CardRepository;
import com.demoBank.atmDemo.repository.CustomerRepository;
import com.demoBank.atmDemo.util.JsonFileLoader;
import com.demoBank.atmDemo.util.SensitiveDataMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.YearMonth;

/**
 * Populates the in-memory store once at process start. PINs are hashed on the way in
 * and the clear values are dropped with the seed object.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class BankSeedLoader implements ApplicationRunner {

    private final CustomerRepository customerRepository;
    private final CardRepository cardRepository;
    private final AccountRepository accountRepository;
    private final PasswordEncoder pinEncoder;
    private final AtmProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        load(properties.getSeedResource());
    }

    public void load(String resourcePath) {
        BankSeed seed;
        try {
            seed = JsonFileLoader.loadAsObject(resourcePath, BankSeed.class);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to load bank seed: " + resourcePath, e);
        }

        int cards = 0;
        int accounts = 0;
        for (BankSeed.CustomerSeed customerSeed : seed.getCustomers()) {
            customerRepository.save(Customer.builder()
                    .id(customerSeed.getId())
                    .name(customerSeed.getName())
                    .primaryEmail(customerSeed.getPrimaryEmail())
                    .preferredLanguage(customerSeed.getPreferredLanguage() != null ? customerSeed.getPreferredLanguage() : "en")
                    .pinHash(pinEncoder.encode(customerSeed.getPin()))
                    .build());

            for (BankSeed.CardSeed cardSeed : customerSeed.getCards()) {
                cardRepository.save(toCard(customerSeed.getId(), cardSeed));
                cards++;
            }
            for (BankSeed.AccountSeed accountSeed : customerSeed.getAccounts()) {
                accountRepository.save(toAccount(customerSeed.getId(), accountSeed));
                accounts++;
            }
        }
        log.info("Bank seed loaded - resource: {}, customers: {}, cards: {}, accounts: {}",
                resourcePath, seed.getCustomers().size(), cards, accounts);
    }

    private Card toCard(String customerId, BankSeed.CardSeed seed) {
        Card.CardBuilder builder = Card.builder()
                .id(seed.getId())
                .pan(seed.getPan())
                .maskedPan(SensitiveDataMasker.maskNumber(seed.getPan()))
                .customerId(customerId)
                .expiry(seed.getExpiry() != null ? YearMonth.parse(seed.getExpiry()) : null)
                .fastCashAmount(money(seed.getFastCashAmount()));
        if (seed.getCardType() != null) {
            builder.cardType(seed.getCardType());
        }
        if (seed.getStatus() != null) {
            builder.status(CardStatus.valueOf(seed.getStatus()));
        }
        if (seed.getMinPinLength() != null) {
            builder.minPinLength(seed.getMinPinLength());
        }
        if (seed.getMaxPinLength() != null) {
            builder.maxPinLength(seed.getMaxPinLength());
        }
        return builder.build();
    }

    private Account toAccount(String customerId, BankSeed.AccountSeed seed) {
        Account.AccountBuilder builder = Account.builder()
                .id(seed.getId())
                .customerId(customerId)
                .accountNumber(seed.getAccountNumber())
                .maskedNumber(SensitiveDataMasker.maskNumber(seed.getAccountNumber()))
                .name(seed.getName())
                .type(AccountType.valueOf(seed.getType()))
                .currency(seed.getCurrency() != null ? seed.getCurrency() : properties.getDefaultCurrency())
                .balance(money(seed.getBalance()));
        if (seed.getDailyWithdrawalLimit() != null) {
            builder.dailyWithdrawalLimit(money(seed.getDailyWithdrawalLimit()));
        }
        if (seed.getDailyDepositLimit() != null) {
            builder.dailyDepositLimit(money(seed.getDailyDepositLimit()));
        }
        if (seed.getDailyTransferLimit() != null) {
            builder.dailyTransferLimit(money(seed.getDailyTransferLimit()));
        }
        return builder.build();
    }

    private static BigDecimal money(BigDecimal value) {
        return value == null ? BigDecimal.ZERO.setScale(2) : value.setScale(2, RoundingMode.UNNECESSARY);
    }
}
