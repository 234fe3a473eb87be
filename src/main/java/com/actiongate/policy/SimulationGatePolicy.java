package com.actiongate.policy;

import java.util.Optional;

/**
 * Refuses to broadcast without a successful simulation where the network requires one.
 */
public class SimulationGatePolicy implements PolicyGate {

    @Override
    public String gateId() {
        return "simulation";
    }

    @Override
    public Optional<PolicyDecision> evaluate(PolicyConfig config, PolicyContext context) {
        PolicyConfig.NetworkGate gate = config.gateFor(context.network());
        if (gate == null || !gate.requireSimulation() || !context.isBroadcast()) {
            return Optional.empty();
        }
        if (!Boolean.TRUE.equals(context.simulationOk())) {
            return Optional.of(PolicyDecision.block("SIMULATION_REQUIRED",
                "Simulation required before broadcasting on " + context.network(),
                "networks." + context.network() + ".requireSimulation=true",
                "sideEffect=broadcast",
                "simulationOk!=true"));
        }
        return Optional.empty();
    }
}
