package com.actiongate.driver;

import java.util.Map;

/**
 * Output of {@link ActionDriver#build}.
 *
 * @param payload opaque built transaction
 * @param meta    optional policy inputs: {@code amount}, {@code slippageBps},
 *                {@code slippageGuardDisabled}
 */
public record BuildResult(Map<String, Object> payload, Map<String, Object> meta) {

    public BuildResult {
        payload = payload == null ? Map.of() : payload;
        meta = meta == null ? Map.of() : meta;
    }

    public Double amount() {
        return meta.get("amount") instanceof Number n ? n.doubleValue() : null;
    }

    public Integer slippageBps() {
        return meta.get("slippageBps") instanceof Number n ? n.intValue() : null;
    }

    public boolean slippageGuardDisabled() {
        return Boolean.TRUE.equals(meta.get("slippageGuardDisabled"));
    }
}
