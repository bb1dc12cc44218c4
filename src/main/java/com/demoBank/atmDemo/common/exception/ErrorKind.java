package com.demoBank.atmDemo.common.exception;

import org.springframework.http.HttpStatus;

/**
 * Internal error taxonomy. Logged verbatim; clients only see the mapped {@link ResponseCode}.
 */
public enum ErrorKind {

    AUTH_ERROR(ResponseCode.ISSUER_UNAVAILABLE, HttpStatus.UNAUTHORIZED, false),
    SEQUENCE_ERROR(ResponseCode.ISSUER_UNAVAILABLE, HttpStatus.CONFLICT, true),
    SESSION_EXPIRED(ResponseCode.ISSUER_UNAVAILABLE, HttpStatus.UNAUTHORIZED, true),
    PIN_ERROR(ResponseCode.INCORRECT_PIN, HttpStatus.UNAUTHORIZED, false),
    VALIDATION_ERROR(ResponseCode.ISSUER_UNAVAILABLE, HttpStatus.BAD_REQUEST, false),
    BALANCE_ERROR(ResponseCode.INSUFFICIENT_FUNDS, HttpStatus.UNPROCESSABLE_ENTITY, false),
    LIMIT_ERROR(ResponseCode.INSUFFICIENT_FUNDS, HttpStatus.UNPROCESSABLE_ENTITY, false),
    INVALID_STATE(ResponseCode.ISSUER_UNAVAILABLE, HttpStatus.CONFLICT, false),
    CONCURRENT_REQUEST(ResponseCode.ISSUER_UNAVAILABLE, HttpStatus.CONFLICT, false),
    LLM_UNAVAILABLE(ResponseCode.ISSUER_UNAVAILABLE, HttpStatus.SERVICE_UNAVAILABLE, false),
    TOOL_TIMEOUT(ResponseCode.ISSUER_UNAVAILABLE, HttpStatus.GATEWAY_TIMEOUT, false);

    private final ResponseCode responseCode;
    private final HttpStatus httpStatus;
    private final boolean terminal;

    ErrorKind(ResponseCode responseCode, HttpStatus httpStatus, boolean terminal) {
        this.responseCode = responseCode;
        this.httpStatus = httpStatus;
        this.terminal = terminal;
    }

    public ResponseCode getResponseCode() {
        return responseCode;
    }

    public HttpStatus getHttpStatus() {
        return httpStatus;
    }

    /**
     * Terminal kinds end the current session; the client has to log in again.
     */
    public boolean isTerminal() {
        return terminal;
    }
}
