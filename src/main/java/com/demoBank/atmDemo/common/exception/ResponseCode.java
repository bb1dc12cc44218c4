package com.demoBank.atmDemo.common.exception;

/**
 * Closed set of response codes surfaced to ATM clients.
 * Every internal {@link ErrorKind} maps onto exactly one of these at the boundary.
 */
public enum ResponseCode {

    APPROVED("00"),
    INSUFFICIENT_FUNDS("51"),
    INCORRECT_PIN("55"),
    PIN_TRIES_EXCEEDED("75"),
    ISSUER_UNAVAILABLE("91");

    private final String code;

    ResponseCode(String code) {
        this.code = code;
    }

    public String getCode() {
        return code;
    }
}
