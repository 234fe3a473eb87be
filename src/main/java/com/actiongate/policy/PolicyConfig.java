package com.actiongate.policy;

import java.util.List;
import java.util.Map;

/**
 * Immutable policy configuration handed to the {@link PolicyEngine}.
 */
public record PolicyConfig(
    Map<String, NetworkGate> networks,
    TransactionLimits transactions,
    Allowlist allowlist,
    List<PolicyRule> rules
) {

    public static final String MAINNET = "mainnet";

    public PolicyConfig {
        networks = networks == null ? Map.of() : Map.copyOf(networks);
        transactions = transactions == null ? TransactionLimits.unlimited() : transactions;
        allowlist = allowlist == null ? Allowlist.open() : allowlist;
        rules = rules == null ? List.of() : List.copyOf(rules);
    }

    /**
     * Gate for the named network. Unknown names fall back to the mainnet gate so that an
     * unrecognized network is treated as mainnet-like.
     */
    public NetworkGate gateFor(String network) {
        NetworkGate gate = network == null ? null : networks.get(network);
        if (gate == null) {
            gate = networks.get(MAINNET);
        }
        return gate;
    }

    public record NetworkGate(
        boolean enabled,
        boolean requireApproval,
        boolean requireSimulation,
        Double maxDailyVolume
    ) {}

    public record TransactionLimits(
        Double maxSingleAmount,
        Integer maxSlippageBps,
        ConfirmationPolicy requireConfirmation,
        Integer cooldownSeconds,
        Integer maxTxPerMinute,
        Integer confirmTxPerMinute,
        boolean requireSimulatedSlippage,
        boolean acceptUnguardedSlippage
    ) {
        public TransactionLimits {
            requireConfirmation = requireConfirmation == null ? ConfirmationPolicy.LARGE : requireConfirmation;
        }

        public static TransactionLimits unlimited() {
            return new TransactionLimits(null, null, ConfirmationPolicy.LARGE, null, null, null, false, false);
        }
    }

    /**
     * @param actions     allowed action verbs; empty means any
     * @param identifiers per-chain allowed side-effect identifiers (program ids, contract addresses);
     *                    a chain absent from the map is not checked
     */
    public record Allowlist(List<String> actions, Map<String, List<String>> identifiers) {
        public Allowlist {
            actions = actions == null ? List.of() : List.copyOf(actions);
            identifiers = identifiers == null ? Map.of() : Map.copyOf(identifiers);
        }

        public static Allowlist open() {
            return new Allowlist(List.of(), Map.of());
        }
    }
}
