package com.actiongate.error;

/**
 * A non-retried call timed out after it may already have reached the upstream. The caller cannot
 * tell whether the side effect happened.
 */
public class UpstreamOutcomeUnknownException extends UpstreamTransientException {

    public UpstreamOutcomeUnknownException(String message, Throwable cause) {
        super("UPSTREAM_OUTCOME_UNKNOWN", message, cause);
    }
}
