package com.demoBank.atmDemo.common.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Typed domain failure raised by the session, intent, limit and transaction components.
 * Carries the taxonomy kind, an optional sub-kind (e.g. {@code lockout}) and
 * structured details that are safe to return to the caller.
 */
public class AtmException extends RuntimeException {

    public static final String LOCKOUT = "lockout";

    private final ErrorKind kind;
    private final String subKind;
    private final Map<String, Object> details;

    public AtmException(ErrorKind kind, String message) {
        this(kind, null, message, Map.of(), null);
    }

    public AtmException(ErrorKind kind, String subKind, String message) {
        this(kind, subKind, message, Map.of(), null);
    }

    public AtmException(ErrorKind kind, String message, Throwable cause) {
        this(kind, null, message, Map.of(), cause);
    }

    public AtmException(ErrorKind kind, String subKind, String message, Map<String, Object> details, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.subKind = subKind;
        this.details = Collections.unmodifiableMap(new LinkedHashMap<>(details));
    }

    public static AtmException pinLockout(String message) {
        return new AtmException(ErrorKind.PIN_ERROR, LOCKOUT, message);
    }

    public static AtmException validation(String message) {
        return new AtmException(ErrorKind.VALIDATION_ERROR, message);
    }

    public static AtmException invalidState(String message) {
        return new AtmException(ErrorKind.INVALID_STATE, message);
    }

    public static AtmException sequence(String message) {
        return new AtmException(ErrorKind.SEQUENCE_ERROR, message);
    }

    public ErrorKind getKind() {
        return kind;
    }

    public String getSubKind() {
        return subKind;
    }

    public Map<String, Object> getDetails() {
        return details;
    }

    public boolean isLockout() {
        return kind == ErrorKind.PIN_ERROR && LOCKOUT.equals(subKind);
    }

    public boolean isTerminal() {
        return kind.isTerminal() || isLockout();
    }

    public ResponseCode getResponseCode() {
        return isLockout() ? ResponseCode.PIN_TRIES_EXCEEDED : kind.getResponseCode();
    }
}
