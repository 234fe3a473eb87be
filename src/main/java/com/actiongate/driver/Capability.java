package com.actiongate.driver;

import java.util.Map;

/**
 * An action a driver can build.
 *
 * @param risk         coarse risk label, e.g. "low", "medium", "high"
 * @param paramsSchema JSON-schema-like description of accepted params
 */
public record Capability(String action, String risk, Map<String, Object> paramsSchema) {

    public Capability {
        paramsSchema = paramsSchema == null ? Map.of() : Map.copyOf(paramsSchema);
    }
}
