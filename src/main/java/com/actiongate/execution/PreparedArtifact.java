package com.actiongate.execution;

import com.actiongate.audit.ArtifactHash;
import com.actiongate.driver.SideEffectIds;
import com.actiongate.driver.SimulationResult;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A built, simulated and policy-checked action awaiting explicit confirmation. Immutable; consumed
 * at most once by a successful broadcast or dropped on expiry.
 */
public record PreparedArtifact(
    String preparedId,
    Instant createdAt,
    Instant expiresAt,
    String traceId,
    String stepId,
    String chain,
    String adapter,
    String action,
    String network,
    Map<String, Object> params,
    Map<String, Object> payload,
    SimulationResult simulation,
    SideEffectIds sideEffectIds,
    Double amount,
    Integer slippageBps,
    boolean slippageGuardDisabled,
    Map<String, Object> policyDecision,
    ArtifactHash artifactHash
) {

    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt);
    }

    /**
     * The fields covered by {@link #artifactHash}.
     */
    public Map<String, Object> hashInput() {
        return hashInput(chain, adapter, action, params, payload, simulation, policyDecision, traceId, preparedId);
    }

    public static Map<String, Object> hashInput(String chain, String adapter, String action,
                                                Map<String, Object> params, Map<String, Object> payload,
                                                SimulationResult simulation, Map<String, Object> policyDecision,
                                                String traceId, String preparedId) {
        Map<String, Object> input = new LinkedHashMap<>();
        input.put("chain", chain);
        input.put("adapter", adapter);
        input.put("action", action);
        input.put("params", params);
        input.put("payload", payload);
        input.put("simulation", simulation);
        input.put("policyDecision", policyDecision);
        input.put("traceId", traceId);
        input.put("preparedId", preparedId);
        return input;
    }
}
