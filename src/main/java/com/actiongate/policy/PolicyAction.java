package com.actiongate.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;

/**
 * Outcome kinds of a policy evaluation, ordered by severity.
 */
public enum PolicyAction {
    ALLOW("allow"),
    WARN("warn"),
    CONFIRM("confirm"),
    BLOCK("block");

    private final String value;

    PolicyAction(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public boolean isStrongerThan(PolicyAction other) {
        return ordinal() > other.ordinal();
    }

    @JsonCreator
    public static PolicyAction fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        return Arrays.stream(values())
            .filter(v -> v.value.equalsIgnoreCase(raw))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("Unknown policy action: " + raw));
    }
}
