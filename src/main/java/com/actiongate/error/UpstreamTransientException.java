package com.actiongate.error;

/**
 * Network or rate-limit failure that persisted through every retry and endpoint rotation.
 */
public class UpstreamTransientException extends ActionGateException {

    public UpstreamTransientException(String message, Throwable cause) {
        super("UPSTREAM_TRANSIENT", message, cause);
    }

    protected UpstreamTransientException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
