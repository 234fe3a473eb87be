package com.actiongate.failover;

public enum ErrorClass {
    /** Worth retrying on another endpoint. */
    TRANSIENT,
    PERMANENT
}
