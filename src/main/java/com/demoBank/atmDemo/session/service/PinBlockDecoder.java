package com.demoBank.atmDemo.session.service;

/**
 * Turns the encrypted PIN block sent by the terminal into clear PIN digits.
 */
public interface PinBlockDecoder {

    /**
     * @return the PIN digits
     * @throws com.demoBank.atmDemo.common.exception.AtmException VALIDATION_ERROR if the block cannot be decoded
     */
    String decode(String pinBlock);
}
