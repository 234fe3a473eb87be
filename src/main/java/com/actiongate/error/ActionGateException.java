package com.actiongate.error;

/**
 * Base of the typed error taxonomy. Every subclass carries a stable machine-readable code that is
 * surfaced as {@code error_code} over HTTP.
 */
public abstract class ActionGateException extends RuntimeException {

    private final String errorCode;

    protected ActionGateException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected ActionGateException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
