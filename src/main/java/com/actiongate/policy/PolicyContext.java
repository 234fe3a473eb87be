package com.actiongate.policy;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Inputs of one policy evaluation. Built fresh per call and never persisted.
 */
public record PolicyContext(
    String chain,
    String network,
    String action,
    SideEffect sideEffect,
    Boolean simulationOk,
    Double amount,
    Integer slippageBps,
    Integer simulatedSlippageBps,
    boolean slippageGuardDisabled,
    List<String> sideEffectIds,
    boolean idsKnown,
    Double secondsSinceLastBroadcast,
    Integer broadcastsLastMinute,
    Double volumeLast24h,
    Map<String, Object> attributes
) {

    public PolicyContext {
        sideEffect = sideEffect == null ? SideEffect.NONE : sideEffect;
        sideEffectIds = sideEffectIds == null ? List.of() : List.copyOf(sideEffectIds);
        attributes = attributes == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public boolean isBroadcast() {
        return sideEffect == SideEffect.BROADCAST;
    }

    /**
     * Flat view used as the custom-rule evaluation context. Extra attributes are merged in
     * without overriding the named fields; the whole view is also reachable under {@code ctx}.
     */
    public Map<String, Object> toRuleContext() {
        Map<String, Object> view = new LinkedHashMap<>(attributes);
        view.put("chain", chain);
        view.put("network", network);
        view.put("action", action);
        view.put("sideEffect", sideEffect.getValue());
        view.put("simulationOk", simulationOk);
        view.put("amount", amount);
        view.put("slippageBps", slippageBps);
        view.put("simulatedSlippageBps", simulatedSlippageBps);
        view.put("slippageGuardDisabled", slippageGuardDisabled);
        view.put("sideEffectIds", sideEffectIds);
        view.put("idsKnown", idsKnown);
        view.put("secondsSinceLastBroadcast", secondsSinceLastBroadcast);
        view.put("broadcastsLastMinute", broadcastsLastMinute);
        view.put("volumeLast24h", volumeLast24h);
        Map<String, Object> withAlias = new LinkedHashMap<>(view);
        withAlias.put("ctx", view);
        return withAlias;
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String chain;
        private String network;
        private String action;
        private SideEffect sideEffect = SideEffect.NONE;
        private Boolean simulationOk;
        private Double amount;
        private Integer slippageBps;
        private Integer simulatedSlippageBps;
        private boolean slippageGuardDisabled;
        private List<String> sideEffectIds;
        private boolean idsKnown;
        private Double secondsSinceLastBroadcast;
        private Integer broadcastsLastMinute;
        private Double volumeLast24h;
        private Map<String, Object> attributes;

        public Builder chain(String chain) { this.chain = chain; return this; }
        public Builder network(String network) { this.network = network; return this; }
        public Builder action(String action) { this.action = action; return this; }
        public Builder sideEffect(SideEffect sideEffect) { this.sideEffect = sideEffect; return this; }
        public Builder simulationOk(Boolean simulationOk) { this.simulationOk = simulationOk; return this; }
        public Builder amount(Double amount) { this.amount = amount; return this; }
        public Builder slippageBps(Integer slippageBps) { this.slippageBps = slippageBps; return this; }
        public Builder simulatedSlippageBps(Integer bps) { this.simulatedSlippageBps = bps; return this; }
        public Builder slippageGuardDisabled(boolean disabled) { this.slippageGuardDisabled = disabled; return this; }
        public Builder sideEffectIds(List<String> ids) { this.sideEffectIds = ids; return this; }
        public Builder idsKnown(boolean known) { this.idsKnown = known; return this; }
        public Builder secondsSinceLastBroadcast(Double seconds) { this.secondsSinceLastBroadcast = seconds; return this; }
        public Builder broadcastsLastMinute(Integer count) { this.broadcastsLastMinute = count; return this; }
        public Builder volumeLast24h(Double volume) { this.volumeLast24h = volume; return this; }
        public Builder attributes(Map<String, Object> attributes) { this.attributes = attributes; return this; }

        public PolicyContext build() {
            return new PolicyContext(chain, network, action, sideEffect, simulationOk, amount, slippageBps,
                simulatedSlippageBps, slippageGuardDisabled, sideEffectIds, idsKnown,
                secondsSinceLastBroadcast, broadcastsLastMinute, volumeLast24h, attributes);
        }
    }
}
