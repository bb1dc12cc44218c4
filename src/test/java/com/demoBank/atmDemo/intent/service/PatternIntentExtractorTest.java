package com.demoBank.atmDemo.intent.service;

import com.demoBank.atmDemo.bank.dto.AccountSummary;
import com.demoBank.atmDemo.bank.model.AccountType;
import com.demoBank.atmDemo.intent.model.OperationType;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class PatternIntentExtractorTest {

    private final PatternIntentExtractor extractor = new PatternIntentExtractor();

    private final List<AccountSummary> accounts = List.of(
            AccountSummary.builder().accountId("A1").type(AccountType.CHECKING).build(),
            AccountSummary.builder().accountId("A2").type(AccountType.SAVINGS).build());

    @ParameterizedTest
    @CsvSource({
            "withdraw 60 from checking, WITHDRAW",
            "I need to get cash, WITHDRAW",
            "deposit a check, CHECK_DEPOSIT",
            "deposit cash into savings, CASH_DEPOSIT",
            "move 20 to savings, TRANSFER",
            "pay my electric bill, BILL_PAYMENT",
            "pay John 40, PAYMENT",
            "what is my balance, BALANCE_INQUIRY",
            "I want to change my PIN, PIN_CHANGE"
    })
    void recognizesOperations(String text, OperationType expected) {
        assertThat(extractor.extract(text, accounts).operation()).isEqualTo(expected);
    }

    @Test
    void transferTakesBothAccountsAndTheAmount() {
        PatternIntentExtractor.Extraction extraction = extractor.extract("Transfer $1,250.5 from checking to savings", accounts);

        assertThat(extraction.answers())
                .containsEntry("fromAccount", "A1")
                .containsEntry("toAccount", "A2")
                .containsEntry("amount", new BigDecimal("1250.5"));
    }

    @Test
    void checkNumberIsNotTakenForTheAmount() {
        PatternIntentExtractor.Extraction extraction = extractor.extract("deposit check number 7781 for 300 to checking", accounts);

        assertThat(extraction.answers())
                .containsEntry("checkNumber", "7781")
                .containsEntry("amount", new BigDecimal("300"))
                .containsEntry("toAccount", "A1");
    }

    @Test
    void payeeIsCapturedBeforeTheAmount() {
        PatternIntentExtractor.Extraction extraction = extractor.extract("pay acme power 75 from checking", accounts);

        assertThat(extraction.answers())
                .containsEntry("payee", "acme power")
                .containsEntry("amount", new BigDecimal("75"))
                .containsEntry("fromAccount", "A1");
    }

    @Test
    void ambiguousAccountTypeIsLeftOpen() {
        List<AccountSummary> twoChecking = List.of(
                AccountSummary.builder().accountId("A1").type(AccountType.CHECKING).build(),
                AccountSummary.builder().accountId("A5").type(AccountType.CHECKING).build());

        PatternIntentExtractor.Extraction extraction = extractor.extract("withdraw 20 from checking", twoChecking);

        assertThat(extraction.answers()).doesNotContainKey("fromAccount").containsKey("amount");
    }

    @Test
    void nothingIsDefaulted() {
        PatternIntentExtractor.Extraction extraction = extractor.extract("transfer money", accounts);

        assertThat(extraction.operation()).isEqualTo(OperationType.TRANSFER);
        assertThat(extraction.answers()).isEmpty();
    }

    @Test
    void unknownTextHasNoOperation() {
        PatternIntentExtractor.Extraction extraction = extractor.extract("good morning", accounts);

        assertThat(extraction.operation()).isNull();
        assertThat(extraction.answers()).isEmpty();
    }
}
