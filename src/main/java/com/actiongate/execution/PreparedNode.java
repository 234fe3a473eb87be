package com.actiongate.execution;

import com.actiongate.driver.SimulationResult;
import com.actiongate.policy.PolicyDecision;

/**
 * Result of preparing one action.
 *
 * @param artifact null when the prepare-time policy decision was block
 */
public record PreparedNode(PreparedArtifact artifact, PolicyDecision decision, SimulationResult simulation) {

    public boolean isBlocked() {
        return artifact == null;
    }
}
