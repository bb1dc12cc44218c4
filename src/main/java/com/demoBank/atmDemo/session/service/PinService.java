package com.demoBank.atmDemo.session.service;

import com.demoBank.atmDemo.bank.model.Card;
import com.demoBank.atmDemo.bank.model.Customer;
import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import com.demoBank.atmDemo.config.AtmProperties;
import com.demoBank.atmDemo.repository.CardRepository;
import com.demoBank.atmDemo.repository.CustomerRepository;
import com.demoBank.atmDemo.session.model.AtmSession;
import com.demoBank.atmDemo.session.model.ProtocolPhase;
import com.demoBank.atmDemo.session.model.SessionStatus;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;

import java.util.Map;

/**
 * Owns the PIN hash and the per-session attempt counter. Nothing outside this class reads the hash.
 * Callers hold the session lock.
 */
@Slf4j
@Service
public class PinService {

    private final CustomerRepository customerRepository;
    private final CardRepository cardRepository;
    private final PinBlockDecoder pinBlockDecoder;
    private final PasswordEncoder pinEncoder;
    private final int maxAttempts;

    public PinService(CustomerRepository customerRepository,
                      CardRepository cardRepository,
                      PinBlockDecoder pinBlockDecoder,
                      @Qualifier("pinEncoder") PasswordEncoder pinEncoder,
                      AtmProperties properties) {
        this.customerRepository = customerRepository;
        this.cardRepository = cardRepository;
        this.pinBlockDecoder = pinBlockDecoder;
        this.pinEncoder = pinEncoder;
        this.maxAttempts = properties.getPin().getMaxAttempts();
    }

    /**
     * Verifies a PIN block for the session's customer.
     * A locked session is rejected before the block is even decoded. Each mismatch counts;
     * the mismatch that reaches the maximum locks the session.
     *
     * @throws AtmException PIN_ERROR with the remaining attempts, or PIN_ERROR(lockout)
     */
    public void verify(AtmSession session, String pinBlock) {
        if (session.isLocked()) {
            log.warn("PIN attempt on locked session - sessionId: {}", session.getSessionId());
            throw AtmException.pinLockout("PIN tries exceeded, please login again");
        }

        String pin = pinBlockDecoder.decode(pinBlock);
        Customer customer = customerRepository.findById(session.getCustomerId())
                .orElseThrow(() -> new AtmException(ErrorKind.AUTH_ERROR, "Customer not found"));

        if (pinEncoder.matches(pin, customer.getPinHash())) {
            session.setPinAttempts(0);
            log.info("PIN verified - sessionId: {}", session.getSessionId());
            return;
        }

        int attempts = session.getPinAttempts() + 1;
        session.setPinAttempts(attempts);
        if (attempts >= maxAttempts) {
            session.setStatus(SessionStatus.LOCKED);
            session.setPhase(ProtocolPhase.LOCKED);
            log.warn("PIN tries exceeded, session locked - sessionId: {}, attempts: {}", session.getSessionId(), attempts);
            throw AtmException.pinLockout("PIN tries exceeded, please login again");
        }

        int remaining = maxAttempts - attempts;
        log.info("Incorrect PIN - sessionId: {}, attempts: {}, remaining: {}", session.getSessionId(), attempts, remaining);
        throw new AtmException(ErrorKind.PIN_ERROR, null, "Incorrect PIN",
                Map.of("remainingAttempts", remaining), null);
    }

    /**
     * Checks a new PIN block against the card's PIN length rules and returns its hash.
     */
    public String hashNewPin(AtmSession session, String newPinBlock) {
        String pin = pinBlockDecoder.decode(newPinBlock);
        Card card = cardRepository.findById(session.getCardId())
                .orElseThrow(() -> new AtmException(ErrorKind.AUTH_ERROR, "Card not found"));
        if (pin.length() < card.getMinPinLength() || pin.length() > card.getMaxPinLength()) {
            throw AtmException.validation("New PIN must have between " + card.getMinPinLength()
                    + " and " + card.getMaxPinLength() + " digits");
        }
        return pinEncoder.encode(pin);
    }
}
