package com.demoBank.atmDemo.bank.service;

import com.demoBank.atmDemo.bank.model.Card;
import com.demoBank.atmDemo.bank.model.CardStatus;
import com.demoBank.atmDemo.bank.model.Customer;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.repository.CardRepository;
import com.demoBank.atmDemo.repository.CustomerRepository;
import com.demoBank.atmDemo.util.SensitiveDataMasker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.YearMonth;
import java.util.Locale;
import java.util.Optional;

/**
 * Maps raw card data from the terminal to a usable card and its owning customer.
 * The full PAN is only handled here.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CardResolverService {

    private static final char TRACK2_SEPARATOR = '=';

    private final CardRepository cardRepository;
    private final CustomerRepository customerRepository;
    private final Clock clock;

    public record ResolvedCard(Card card, Customer customer) {}

    /**
     * Resolves Track2 data (PAN, separator, expiry and discretionary data) to an active card.
     *
     * @throws AtmException AUTH_ERROR for unknown, blocked, lost, stolen or expired cards
     */
    public ResolvedCard resolve(String track2) {
        String pan = extractPan(track2);
        Card card = cardRepository.findByPan(pan)
                .orElseThrow(() -> {
                    log.warn("Card not found - pan: {}", SensitiveDataMasker.maskNumber(pan));
                    return new AtmException(ErrorKind.AUTH_ERROR, "Card not recognized");
                });

        if (card.getStatus() != CardStatus.ACTIVE) {
            log.warn("Card rejected - card: {}, status: {}", card.getMaskedPan(), card.getStatus());
            throw new AtmException(ErrorKind.AUTH_ERROR, "Card is " + card.getStatus().name().toLowerCase(Locale.ROOT));
        }
        if (card.isExpiredAt(YearMonth.now(clock))) {
            log.warn("Card rejected - card: {}, expired: {}", card.getMaskedPan(), card.getExpiry());
            throw new AtmException(ErrorKind.AUTH_ERROR, "Card is expired");
        }

        Customer customer = customerRepository.findById(card.getCustomerId())
                .orElseThrow(() -> new AtmException(ErrorKind.AUTH_ERROR, "Card is not linked to a customer"));
        return new ResolvedCard(card, customer);
    }

    public Optional<Card> findCard(String cardId) {
        return cardRepository.findById(cardId);
    }

    static String extractPan(String track2) {
        if (track2 == null || track2.isBlank()) {
            throw AtmException.validation("Track2 is required");
        }
        String trimmed = track2.trim();
        if (trimmed.startsWith(";")) {
            trimmed = trimmed.substring(1);
        }
        int separator = trimmed.indexOf(TRACK2_SEPARATOR);
        String pan = separator >= 0 ? trimmed.substring(0, separator) : trimmed;
        if (!pan.matches("\\d{12,19}")) {
            throw AtmException.validation("Track2 does not contain a valid card number");
        }
        return pan;
    }
}
