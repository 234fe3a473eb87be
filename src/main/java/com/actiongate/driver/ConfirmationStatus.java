package com.actiongate.driver;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum ConfirmationStatus {
    CONFIRMED("confirmed"),
    FAILED("failed"),
    UNKNOWN("unknown");

    private final String value;

    ConfirmationStatus(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static ConfirmationStatus fromValue(String raw) {
        if (raw == null) {
            return null;
        }
        for (ConfirmationStatus s : values()) {
            if (s.value.equalsIgnoreCase(raw)) {
                return s;
            }
        }
        throw new IllegalArgumentException("Unknown confirmation status: " + raw);
    }
}
