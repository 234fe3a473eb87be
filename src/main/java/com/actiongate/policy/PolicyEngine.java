package com.actiongate.policy;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Deterministic policy decision engine.
 *
 * Gates run in a fixed order: network, simulation, allowlist, limits, rate limit, custom rules.
 * The first block wins immediately. Otherwise the strongest non-allow decision is returned,
 * the earliest one winning a tie; with none the result is allow.
 */
public class PolicyEngine {

    private final PolicyConfig config;
    private final List<PolicyGate> gates;

    public PolicyEngine(PolicyConfig config) {
        this(config, List.of(
            new NetworkGatePolicy(),
            new SimulationGatePolicy(),
            new AllowlistGatePolicy(),
            new LimitsGatePolicy(),
            new RateLimitGatePolicy(),
            new CustomRuleGatePolicy(config.rules())
        ));
    }

    public PolicyEngine(PolicyConfig config, List<PolicyGate> gates) {
        this.config = config;
        this.gates = List.copyOf(gates);
    }

    public PolicyDecision decide(PolicyContext context) {
        List<String> reasons = new ArrayList<>();
        if (context.network() != null) {
            reasons.add("network=" + context.network());
        }
        reasons.add("sideEffect=" + context.sideEffect().getValue());

        PolicyDecision pending = null;
        for (PolicyGate gate : gates) {
            Optional<PolicyDecision> result = gate.evaluate(config, context);
            if (result.isEmpty()) {
                continue;
            }
            PolicyDecision decision = result.get();
            if (decision.isBlocked()) {
                return decision;
            }
            if (pending == null || decision.action().isStrongerThan(pending.action())) {
                pending = decision;
            }
        }

        if (pending != null && pending.action() != PolicyAction.ALLOW) {
            return pending;
        }
        return PolicyDecision.allow(reasons);
    }
}
