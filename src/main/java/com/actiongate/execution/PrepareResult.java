package com.actiongate.execution;

import com.actiongate.audit.ArtifactHash;
import com.actiongate.driver.SimulationResult;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.Map;

/**
 * @param preparedId null when the prepare-time decision was block
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PrepareResult(
    String traceId,
    String preparedId,
    boolean allowed,
    boolean requiresApproval,
    SimulationResult simulation,
    Map<String, Object> policyReport,
    ArtifactHash artifactHash,
    String expiresAt
) {
}
