package com.actiongate.policy;

import java.util.Optional;

/**
 * One deterministic step of the policy evaluation. Gates are pure: no I/O, no mutation.
 */
public interface PolicyGate {

    /** Stable gate identifier, e.g. "network". */
    String gateId();

    /**
     * @return empty when the gate has nothing to say; a {@link PolicyDecision.Block} stops evaluation,
     *         any other decision is kept as pending and may be overridden by a stronger one
     */
    Optional<PolicyDecision> evaluate(PolicyConfig config, PolicyContext context);
}
