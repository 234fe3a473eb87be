package com.actiongate.plan;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Per-node compile state. {@code BLOCKED} is a completed node whose prepare-time policy decision
 * was block; {@code CANCELLED} is a node never scheduled because compilation was cancelled.
 */
public enum NodeState {
    PENDING,
    COMPILING,
    PREPARED,
    BLOCKED,
    FAILED,
    DEP_FAILED,
    CANCELLED;

    @JsonValue
    public String getValue() {
        return name().toLowerCase(Locale.ROOT);
    }
}
