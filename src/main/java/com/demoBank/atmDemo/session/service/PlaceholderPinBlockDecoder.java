package com.demoBank.atmDemo.session.service;

import com.demoBank.atmDemo.common.exception.AtmException;
import com.demoBank.atmDemo.common.exception.ErrorKind;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.Base64;

/**
 * Demo encoding: the PIN block is the Base64 of the PIN digits. Not a security boundary.
 */
@Component
public class PlaceholderPinBlockDecoder implements PinBlockDecoder {

    @Override
    public String decode(String pinBlock) {
        if (pinBlock == null || pinBlock.isBlank()) {
            throw AtmException.validation("PIN block is required");
        }
        String pin;
        try {
            pin = new String(Base64.getDecoder().decode(pinBlock.trim()), StandardCharsets.US_ASCII);
        } catch (IllegalArgumentException e) {
            throw new AtmException(ErrorKind.VALIDATION_ERROR, "PIN block is malformed", e);
        }
        if (!pin.matches("\\d+")) {
            throw AtmException.validation("PIN block is malformed");
        }
        return pin;
    }

    public static String encode(String pin) {
        return Base64.getEncoder().encodeToString(pin.getBytes(StandardCharsets.US_ASCII));
    }
}
