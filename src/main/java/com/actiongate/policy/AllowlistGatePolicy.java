package com.actiongate.policy;

import java.util.List;
import java.util.Optional;

/**
 * Action and side-effect identifier allowlists. Fails closed when identifiers could not be
 * extracted for a chain that has an identifier allowlist.
 */
public class AllowlistGatePolicy implements PolicyGate {

    @Override
    public String gateId() {
        return "allowlist";
    }

    @Override
    public Optional<PolicyDecision> evaluate(PolicyConfig config, PolicyContext context) {
        PolicyConfig.Allowlist allowlist = config.allowlist();

        List<String> actions = allowlist.actions();
        if (!actions.isEmpty() && !actions.contains(context.action())) {
            return Optional.of(PolicyDecision.block("ACTION_NOT_ALLOWED",
                "Action not allowed: " + context.action(),
                "allowlist.actions excludes " + context.action()));
        }

        List<String> allowedIds = context.chain() == null ? null : allowlist.identifiers().get(context.chain());
        if (allowedIds == null || allowedIds.isEmpty()) {
            return Optional.empty();
        }
        if (!context.idsKnown()) {
            return Optional.of(PolicyDecision.block("SIDE_EFFECT_IDS_UNKNOWN",
                "Cannot determine the identifiers this action touches on " + context.chain()
                    + "; refusing to proceed",
                "allowlist.identifiers." + context.chain() + " set",
                "idsKnown!=true"));
        }
        for (String id : context.sideEffectIds()) {
            if (!allowedIds.contains(id)) {
                return Optional.of(PolicyDecision.block("SIDE_EFFECT_ID_NOT_ALLOWED",
                    "Identifier not allowed on " + context.chain() + ": " + id,
                    "allowlist.identifiers." + context.chain() + " excludes " + id));
            }
        }
        return Optional.empty();
    }
}
