package com.demoBank.atmDemo.orchestrator.service;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Checks that every money amount in an assistant answer was returned by a tool during the same turn.
 * Figures the customer typed do not count.
 */
@Slf4j
@Component
public class NumericGroundingGuard {

    private static final Pattern NUMBER = Pattern.compile("\\d{1,3}(?:,\\d{3})+(?:\\.\\d+)?|\\d+(?:\\.\\d+)?");

    /**
     * A money amount: has a currency marker on either side, or exactly two decimals.
     */
    private static final Pattern MONEY = Pattern.compile(
            "(?<prefix>[$€£]\\s?|\\b(?:USD|EUR|GBP)\\s?)?"
                    + "(?<number>\\d{1,3}(?:,\\d{3})+(?:\\.\\d{1,2})?|\\d+(?:\\.\\d{1,2})?)"
                    + "(?<suffix>\\s?(?:USD|EUR|GBP|dollars?)\\b)?",
            Pattern.CASE_INSENSITIVE);

    public boolean isGrounded(String answer, Set<BigDecimal> grounded) {
        List<BigDecimal> amounts = moneyAmounts(answer);
        for (BigDecimal amount : amounts) {
            if (!grounded.contains(amount)) {
                log.warn("Ungrounded amount in assistant answer - amount: {}", amount.toPlainString());
                return false;
            }
        }
        return true;
    }

    /**
     * Money amounts mentioned in the text, normalized.
     */
    public List<BigDecimal> moneyAmounts(String text) {
        List<BigDecimal> amounts = new ArrayList<>();
        if (text == null) {
            return amounts;
        }
        Matcher matcher = MONEY.matcher(text);
        while (matcher.find()) {
            String number = matcher.group("number");
            boolean marked = matcher.group("prefix") != null || matcher.group("suffix") != null;
            boolean twoDecimals = number.matches(".*\\.\\d{2}");
            if (marked || twoDecimals) {
                amounts.add(normalize(number));
            }
        }
        return amounts;
    }

    private void collect(String text, Set<BigDecimal> grounded) {
        if (text == null) {
            return;
        }
        Matcher matcher = NUMBER.matcher(text);
        while (matcher.find()) {
            grounded.add(normalize(matcher.group()));
        }
    }

    /**
     * Adds every number found in a tool result, including numbers inside text values.
     */
    public void collect(JsonNode node, Set<BigDecimal> grounded) {
        if (node == null) {
            return;
        }
        if (node.isNumber()) {
            grounded.add(node.decimalValue().stripTrailingZeros());
        } else if (node.isTextual()) {
            collect(node.asText(), grounded);
        } else if (node.isContainerNode()) {
            for (JsonNode child : node) {
                collect(child, grounded);
            }
        }
    }

    private static BigDecimal normalize(String number) {
        return new BigDecimal(number.replace(",", "")).stripTrailingZeros();
    }
}
