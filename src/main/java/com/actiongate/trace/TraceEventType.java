package com.actiongate.trace;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

public enum TraceEventType {
    RUN_STARTED("run.started"),
    RUN_FINISHED("run.finished"),
    STEP_STARTED("step.started"),
    STEP_FINISHED("step.finished"),
    TOOL_CALLED("tool.called"),
    TOOL_RESULT("tool.result"),
    TOOL_ERROR("tool.error"),
    POLICY_DECISION("policy.decision"),
    TX_BUILT("tx.built"),
    TX_SIMULATED("tx.simulated"),
    TX_SUBMITTED("tx.submitted"),
    TX_CONFIRMED("tx.confirmed");

    private final String value;

    TraceEventType(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static TraceEventType fromValue(String raw) {
        for (TraceEventType t : values()) {
            if (t.value.equals(raw)) {
                return t;
            }
        }
        throw new IllegalArgumentException("Unknown trace event type: " + raw);
    }
}
