package com.actiongate.plan;

import com.actiongate.audit.ArtifactHash;
import com.actiongate.driver.SimulationResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * Per-node outcome of a compile.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record NodeResult(
    String id,
    boolean ok,
    NodeState state,
    String preparedId,
    boolean allowed,
    boolean requiresApproval,
    SimulationResult simulation,
    Map<String, Object> policyReport,
    ArtifactHash artifactHash,
    String expiresAt,
    NodeError error
) {

    static NodeResult failed(String id, NodeState state, String code, String message) {
        return new NodeResult(id, false, state, null, false, false, null, null, null, null,
            new NodeError(code, message));
    }
}
