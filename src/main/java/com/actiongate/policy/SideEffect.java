package com.actiongate.policy;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum SideEffect {
    NONE("none"),
    BROADCAST("broadcast");

    private final String value;

    SideEffect(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static SideEffect fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        for (SideEffect s : values()) {
            if (s.value.equalsIgnoreCase(raw)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown side effect: " + raw);
    }
}
