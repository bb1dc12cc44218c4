package com.demoBank.atmDemo.orchestrator.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.HashSet;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;

class NumericGroundingGuardTest {

    private final NumericGroundingGuard guard = new NumericGroundingGuard();

    @Test
    void onlyMarkedOrTwoDecimalNumbersAreMoney() {
        assertThat(guard.moneyAmounts("You have 2 accounts, $1,250.50 in checking, 300 USD in savings and 12.75 pending. PIN has 4 digits."))
                .containsExactly(new BigDecimal("1250.5"), new BigDecimal("3E+2"), new BigDecimal("12.75"));
    }

    @Test
    void formattingDifferencesStillMatch() throws Exception {
        Set<BigDecimal> grounded = new HashSet<>();
        guard.collect(new ObjectMapper().readTree("{\"balance\":2500.00,\"note\":\"limit 400.0 left\"}"), grounded);

        assertThat(guard.isGrounded("Your balance is $2,500 and 400.00 dollars remain.", grounded)).isTrue();
    }

    @Test
    void unknownAmountIsNotGrounded() throws Exception {
        Set<BigDecimal> grounded = new HashSet<>();
        guard.collect(new ObjectMapper().readTree("{\"summary\":\"withdraw 60 pending\"}"), grounded);

        assertThat(guard.isGrounded("Withdrawing $60.00 now.", grounded)).isTrue();
        assertThat(guard.isGrounded("Withdrawing $65.00 now.", grounded)).isFalse();
    }

    @Test
    void answerWithoutAmountsIsGrounded() {
        assertThat(guard.isGrounded("Which account would you like to use?", Set.of())).isTrue();
        assertThat(guard.isGrounded("You have 2 accounts.", Set.of())).isTrue();
    }
}
