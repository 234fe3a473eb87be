package com.actiongate.policy;

/**
 * A named custom rule: when {@code condition} holds, {@code action} applies.
 */
public record PolicyRule(String name, String condition, PolicyAction action, String message) {

    public PolicyRule {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("rule name is required");
        }
        if (action == null) {
            throw new IllegalArgumentException("rule '" + name + "' has no action");
        }
    }
}
