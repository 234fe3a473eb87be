package com.actiongate.error;

/**
 * A broken internal guarantee, such as a recomputed hash that no longer matches. Always surfaced.
 */
public class InternalInvariantException extends ActionGateException {

    public InternalInvariantException(String message) {
        super("INTERNAL_INVARIANT", message);
    }
}
