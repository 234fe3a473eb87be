package com.actiongate.policy;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Result of {@link PolicyEngine#decide}. Every non-allow variant carries a stable
 * machine-readable code.
 */
public sealed interface PolicyDecision {

    PolicyAction action();

    List<String> reasons();

    /** Snapshot used in hashes, trace events and HTTP bodies. */
    Map<String, Object> toMap();

    default boolean isBlocked() {
        return action() == PolicyAction.BLOCK;
    }

    default boolean requiresApproval() {
        return action() == PolicyAction.CONFIRM;
    }

    static Allow allow(List<String> reasons) {
        return new Allow(reasons);
    }

    static Warn warn(String code, String message, String... reasons) {
        return new Warn(code, message, List.of(reasons));
    }

    static Confirm confirm(String code, String message, String confirmationKey, String... reasons) {
        return new Confirm(code, message, confirmationKey, List.of(reasons));
    }

    static Block block(String code, String message, String... reasons) {
        return new Block(code, message, List.of(reasons));
    }

    record Allow(List<String> reasons) implements PolicyDecision {
        public Allow {
            reasons = reasons == null ? List.of() : List.copyOf(reasons);
        }

        @Override
        public PolicyAction action() {
            return PolicyAction.ALLOW;
        }

        @Override
        public Map<String, Object> toMap() {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("decision", action().getValue());
            out.put("reasons", reasons);
            return out;
        }
    }

    record Warn(String code, String message, List<String> reasons) implements PolicyDecision {
        public Warn {
            reasons = reasons == null ? List.of() : List.copyOf(reasons);
        }

        @Override
        public PolicyAction action() {
            return PolicyAction.WARN;
        }

        @Override
        public Map<String, Object> toMap() {
            return coded(action(), code, message, null, reasons);
        }
    }

    record Confirm(String code, String message, String confirmationKey, List<String> reasons) implements PolicyDecision {
        public Confirm {
            reasons = reasons == null ? List.of() : List.copyOf(reasons);
        }

        @Override
        public PolicyAction action() {
            return PolicyAction.CONFIRM;
        }

        @Override
        public Map<String, Object> toMap() {
            return coded(action(), code, message, confirmationKey, reasons);
        }
    }

    record Block(String code, String message, List<String> reasons) implements PolicyDecision {
        public Block {
            reasons = reasons == null ? List.of() : List.copyOf(reasons);
        }

        @Override
        public PolicyAction action() {
            return PolicyAction.BLOCK;
        }

        @Override
        public Map<String, Object> toMap() {
            return coded(action(), code, message, null, reasons);
        }
    }

    private static Map<String, Object> coded(PolicyAction action, String code, String message,
                                             String confirmationKey, List<String> reasons) {
        Map<String, Object> out = new LinkedHashMap<>();
        out.put("decision", action.getValue());
        out.put("code", code);
        out.put("message", message);
        if (confirmationKey != null) {
            out.put("confirmationKey", confirmationKey);
        }
        out.put("reasons", reasons);
        return out;
    }
}
