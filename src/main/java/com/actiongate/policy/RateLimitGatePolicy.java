package com.actiongate.policy;

import java.util.Optional;

/**
 * Broadcast cooldown and per-minute throughput, applied to broadcasts only.
 */
public class RateLimitGatePolicy implements PolicyGate {

    @Override
    public String gateId() {
        return "rate-limit";
    }

    @Override
    public Optional<PolicyDecision> evaluate(PolicyConfig config, PolicyContext context) {
        if (!context.isBroadcast()) {
            return Optional.empty();
        }
        PolicyConfig.TransactionLimits limits = config.transactions();

        Integer cooldown = limits.cooldownSeconds();
        Double since = context.secondsSinceLastBroadcast();
        if (cooldown != null && cooldown > 0 && since != null && since >= 0 && since < cooldown) {
            long wait = (long) Math.ceil(cooldown - since);
            return Optional.of(PolicyDecision.block("COOLDOWN_ACTIVE",
                "Cooldown active: wait " + wait + "s before broadcasting again",
                "transactions.cooldownSeconds=" + cooldown, "secondsSinceLastBroadcast=" + since));
        }

        Integer recent = context.broadcastsLastMinute();
        if (recent == null) {
            return Optional.empty();
        }
        Integer hardMax = limits.maxTxPerMinute();
        if (hardMax != null && hardMax > 0 && recent >= hardMax) {
            return Optional.of(PolicyDecision.block("RATE_LIMIT_EXCEEDED",
                "Rate limit exceeded: " + recent + " broadcasts in the last minute (max " + hardMax + ")",
                "transactions.maxTxPerMinute=" + hardMax, "broadcastsLastMinute=" + recent));
        }
        Integer softMax = limits.confirmTxPerMinute();
        if (softMax != null && softMax > 0 && recent >= softMax) {
            return Optional.of(PolicyDecision.confirm("RATE_LIMIT_APPROACHING",
                "High broadcast rate: " + recent + " in the last minute",
                "rate_limit_approaching",
                "transactions.confirmTxPerMinute=" + softMax, "broadcastsLastMinute=" + recent));
        }
        return Optional.empty();
    }
}
