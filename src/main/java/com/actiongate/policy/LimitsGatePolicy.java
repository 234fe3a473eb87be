package com.actiongate.policy;

import java.util.Locale;
import java.util.Optional;

/**
 * Amount, slippage and daily volume limits.
 *
 * Blocks are checked first. Simulation-derived slippage is preferred over the requested
 * figure. An action whose driver disabled its on-chain minimum-output guard is blocked unless
 * the configuration explicitly accepts that risk, in which case broadcast still requires a
 * simulated slippage figure within limits and the decision is at least a warning.
 */
public class LimitsGatePolicy implements PolicyGate {

    @Override
    public String gateId() {
        return "limits";
    }

    @Override
    public Optional<PolicyDecision> evaluate(PolicyConfig config, PolicyContext context) {
        PolicyConfig.TransactionLimits limits = config.transactions();

        Optional<PolicyDecision> slippage = checkSlippage(limits, context);
        if (slippage.isPresent()) {
            return slippage;
        }

        Double amount = context.amount();
        Double maxAmount = limits.maxSingleAmount();
        boolean overLimit = amount != null && maxAmount != null && amount > maxAmount;
        if (overLimit && limits.requireConfirmation() == ConfirmationPolicy.NEVER) {
            return Optional.of(PolicyDecision.block("AMOUNT_EXCEEDED",
                "Amount " + format(amount) + " exceeds limit " + format(maxAmount),
                "transactions.maxSingleAmount", "transactions.requireConfirmation=never"));
        }

        PolicyConfig.NetworkGate gate = config.gateFor(context.network());
        if (gate != null && gate.maxDailyVolume() != null && amount != null && context.volumeLast24h() != null) {
            double projected = context.volumeLast24h() + amount;
            if (projected > gate.maxDailyVolume()) {
                return Optional.of(PolicyDecision.block("DAILY_VOLUME_EXCEEDED",
                    "Daily volume " + format(projected) + " would exceed " + format(gate.maxDailyVolume()),
                    "networks." + context.network() + ".maxDailyVolume",
                    "volumeLast24h=" + format(context.volumeLast24h())));
            }
        }

        if (overLimit) {
            return Optional.of(PolicyDecision.confirm("AMOUNT_LARGE",
                "Large amount: " + format(amount),
                "amount_large",
                "transactions.maxSingleAmount", "amount=" + format(amount)));
        }
        if (limits.requireConfirmation() == ConfirmationPolicy.ALWAYS) {
            return Optional.of(PolicyDecision.confirm("CONFIRMATION_REQUIRED",
                "Confirmation required for every action",
                "always_confirm",
                "transactions.requireConfirmation=always"));
        }
        if (context.slippageGuardDisabled()) {
            return Optional.of(PolicyDecision.warn("SLIPPAGE_GUARD_DISABLED",
                "Minimum-output guard is disabled for this action; accepted by configuration",
                "transactions.acceptUnguardedSlippage=true"));
        }
        return Optional.empty();
    }

    private Optional<PolicyDecision> checkSlippage(PolicyConfig.TransactionLimits limits, PolicyContext context) {
        Integer simulated = context.simulatedSlippageBps();

        if (context.slippageGuardDisabled()) {
            if (!limits.acceptUnguardedSlippage()) {
                return Optional.of(PolicyDecision.block("SLIPPAGE_GUARD_DISABLED",
                    "Minimum-output guard is disabled for this action and the risk is not accepted",
                    "slippageGuardDisabled=true", "transactions.acceptUnguardedSlippage=false"));
            }
            if (context.isBroadcast() && simulated == null) {
                return Optional.of(PolicyDecision.block("UNGUARDED_SLIPPAGE_UNVERIFIED",
                    "Unguarded action requires a simulation-derived slippage figure before broadcasting",
                    "slippageGuardDisabled=true", "simulatedSlippageBps missing"));
            }
        }

        if (limits.requireSimulatedSlippage() && context.isBroadcast()
                && simulated == null && context.slippageBps() != null) {
            return Optional.of(PolicyDecision.block("SIMULATED_SLIPPAGE_REQUIRED",
                "Broadcast requires a simulation-derived slippage estimate",
                "transactions.requireSimulatedSlippage=true", "simulatedSlippageBps missing"));
        }

        Integer max = limits.maxSlippageBps();
        Integer observed = simulated != null ? simulated : context.slippageBps();
        if (max != null && observed != null && observed > max) {
            boolean fromSimulation = simulated != null;
            return Optional.of(PolicyDecision.block(
                fromSimulation ? "SIMULATED_SLIPPAGE_EXCEEDED" : "SLIPPAGE_EXCEEDED",
                (fromSimulation ? "Simulated" : "Requested") + " slippage " + observed
                    + " bps exceeds " + max + " bps",
                "transactions.maxSlippageBps=" + max,
                (fromSimulation ? "simulatedSlippageBps=" : "slippageBps=") + observed));
        }
        return Optional.empty();
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }
}
