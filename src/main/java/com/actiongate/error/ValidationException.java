package com.actiongate.error;

/**
 * Malformed input: bad plan, unknown adapter or action, missing fields. Never retried.
 */
public class ValidationException extends ActionGateException {

    public ValidationException(String message) {
        super("VALIDATION_ERROR", message);
    }

    public ValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
