package com.demoBank.atmDemo.bank.seed;

import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Shape of the seed file read at startup.
 */
@Data
@NoArgsConstructor
public class BankSeed {

    private List<CustomerSeed> customers = new ArrayList<>();

    @Data
    @NoArgsConstructor
    public static class CustomerSeed {
        private String id;
        private String name;
        private String primaryEmail;
        private String preferredLanguage;
        private String pin;
        private List<CardSeed> cards = new ArrayList<>();
        private List<AccountSeed> accounts = new ArrayList<>();
    }

    @Data
    @NoArgsConstructor
    public static class CardSeed {
        private String id;
        private String pan;
        private String cardType;
        private String status;
        private String expiry; // yyyy-MM
        private Integer minPinLength;
        private Integer maxPinLength;
        private BigDecimal fastCashAmount;
    }

    @Data
    @NoArgsConstructor
    public static class AccountSeed {
        private String id;
        private String accountNumber;
        private String name;
        private String type;
        private String currency;
        private BigDecimal balance;
        private BigDecimal dailyWithdrawalLimit;
        private BigDecimal dailyDepositLimit;
        private BigDecimal dailyTransferLimit;
    }
}
