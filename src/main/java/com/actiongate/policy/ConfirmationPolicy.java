package com.actiongate.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * When amounts above {@code maxSingleAmount} are sent for confirmation instead of blocked.
 */
public enum ConfirmationPolicy {
    /** Over-limit amounts are blocked outright. */
    NEVER("never"),
    /** Over-limit amounts require confirmation. */
    LARGE("large"),
    /** Every action requires confirmation; over-limit amounts too. */
    ALWAYS("always");

    private final String value;

    ConfirmationPolicy(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConfirmationPolicy fromValue(String raw) {
        if (raw == null) {
            return LARGE;
        }
        for (ConfirmationPolicy p : values()) {
            if (p.value.equalsIgnoreCase(raw)) {
                return p;
            }
        }
        throw new IllegalArgumentException("Unknown confirmation policy: " + raw);
    }
}
