package com.actiongate.policy;

import java.util.Optional;

/**
 * Blocks disabled networks and asks for approval where the network requires it.
 */
public class NetworkGatePolicy implements PolicyGate {

    @Override
    public String gateId() {
        return "network";
    }

    @Override
    public Optional<PolicyDecision> evaluate(PolicyConfig config, PolicyContext context) {
        PolicyConfig.NetworkGate gate = config.gateFor(context.network());
        if (gate == null) {
            return Optional.empty();
        }
        if (!gate.enabled()) {
            return Optional.of(PolicyDecision.block("NETWORK_DISABLED",
                "Network disabled: " + context.network(),
                "networks." + context.network() + ".enabled=false"));
        }
        if (gate.requireApproval()) {
            return Optional.of(PolicyDecision.confirm("NETWORK_APPROVAL_REQUIRED",
                "Approval required on network " + context.network(),
                "network_approval",
                "networks." + context.network() + ".requireApproval=true"));
        }
        return Optional.empty();
    }
}
