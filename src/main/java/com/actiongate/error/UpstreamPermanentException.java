package com.actiongate.error;

/**
 * Non-retryable driver or upstream failure. The code is the driver's own when it gave one.
 */
public class UpstreamPermanentException extends ActionGateException {

    public UpstreamPermanentException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
