package com.actiongate.execution;

import com.actiongate.audit.ArtifactHash;
import com.actiongate.audit.ArtifactHasher;
import com.actiongate.audit.ReplayVerifier;
import com.actiongate.driver.ActionDriver;
import com.actiongate.driver.BuildResult;
import com.actiongate.driver.DriverContext;
import com.actiongate.driver.DriverRegistry;
import com.actiongate.driver.SideEffectIds;
import com.actiongate.driver.SimulationResult;
import com.actiongate.error.ValidationException;
import com.actiongate.failover.BroadcastHistoryStore;
import com.actiongate.failover.FailoverStateStore;
import com.actiongate.failover.UpstreamCaller;
import com.actiongate.plan.ActionNode;
import com.actiongate.policy.PolicyContext;
import com.actiongate.policy.PolicyDecision;
import com.actiongate.policy.PolicyEngine;
import com.actiongate.policy.SideEffect;
import com.actiongate.trace.ArtifactRef;
import com.actiongate.trace.TraceEvent;
import com.actiongate.trace.TraceEventType;
import com.actiongate.trace.TraceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.security.SecureRandom;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HexFormat;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Builds, simulates, identifies and policy-checks one action, then commits a
 * {@link PreparedArtifact}. The artifact is stored only after every field and its hash are
 * computed, so a failure or timeout on the way leaves nothing behind.
 */
public class ArtifactPreparer {

    private static final Logger log = LoggerFactory.getLogger(ArtifactPreparer.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final DriverRegistry drivers;
    private final UpstreamCaller upstream;
    private final FailoverStateStore failoverState;
    private final PolicyEngine policyEngine;
    private final BroadcastHistoryStore broadcastHistory;
    private final ArtifactHasher hasher;
    private final TraceStore traceStore;
    private final PreparedArtifactStore preparedStore;
    private final Clock clock;
    private final Duration ttl;

    public ArtifactPreparer(DriverRegistry drivers,
                            UpstreamCaller upstream,
                            FailoverStateStore failoverState,
                            PolicyEngine policyEngine,
                            BroadcastHistoryStore broadcastHistory,
                            ArtifactHasher hasher,
                            TraceStore traceStore,
                            PreparedArtifactStore preparedStore,
                            Clock clock,
                            Duration ttl) {
        this.drivers = drivers;
        this.upstream = upstream;
        this.failoverState = failoverState;
        this.policyEngine = policyEngine;
        this.broadcastHistory = broadcastHistory;
        this.hasher = hasher;
        this.traceStore = traceStore;
        this.preparedStore = preparedStore;
        this.clock = clock;
        this.ttl = ttl;
    }

    /**
     * Resolves the driver for a node, rejecting unknown adapters, unknown actions and chain
     * mismatches.
     */
    public ActionDriver resolve(ActionNode node) {
        ActionDriver driver = drivers.require(node.adapter(), node.action());
        if (node.chain() != null && !node.chain().equals(driver.chain())) {
            throw new ValidationException("CHAIN_MISMATCH",
                "action " + node.id() + " declares chain " + node.chain() + " but adapter "
                    + node.adapter() + " serves " + driver.chain());
        }
        return driver;
    }

    public PreparedNode prepare(String traceId, ActionNode node, String network) {
        ActionDriver driver = resolve(node);
        String pool = driver.upstreamPool();
        String preparedId = newPreparedId();
        DriverContext context = new DriverContext(traceId, node.id(), driver.chain(), network,
            failoverState.activeEndpoint(pool).orElse(null));

        BuildResult built = callTool(traceId, node.id(), pool, "build",
            () -> driver.build(node.action(), node.params(), context));
        ArtifactRef payloadRef = traceStore.writeArtifact(traceId, "payload-" + preparedId, built.payload());
        emit(TraceEvent.builder(TraceEventType.TX_BUILT, traceId)
            .step(node.id())
            .data("payloadHash", hasher.hash(built.payload()).hash())
            .data("meta", built.meta())
            .artifacts(List.of(payloadRef)));

        SimulationResult simulation = callTool(traceId, node.id(), pool, "simulate",
            () -> driver.simulate(built.payload(), context));
        ArtifactRef simulationRef = traceStore.writeArtifact(traceId, "simulation-" + preparedId, simulation);
        emit(TraceEvent.builder(TraceEventType.TX_SIMULATED, traceId)
            .step(node.id())
            .data("ok", simulation.ok())
            .data("unitsConsumed", simulation.unitsConsumed())
            .data("slippageBps", simulation.slippageBps())
            .artifacts(List.of(simulationRef)));

        SideEffectIds ids = callTool(traceId, node.id(), pool, "extractSideEffectIds",
            () -> driver.extractSideEffectIds(built.payload(), context));

        Instant now = clock.instant();
        PolicyContext policyContext = PolicyContext.builder()
            .chain(driver.chain())
            .network(network)
            .action(node.action())
            .sideEffect(SideEffect.NONE)
            .simulationOk(simulation.ok())
            .amount(built.amount())
            .slippageBps(built.slippageBps())
            .simulatedSlippageBps(simulation.slippageBps())
            .slippageGuardDisabled(built.slippageGuardDisabled())
            .sideEffectIds(ids.ids())
            .idsKnown(ids.known())
            .volumeLast24h(broadcastHistory.signals(now).volumeLast24h())
            .attributes(node.params())
            .build();
        PolicyDecision decision = policyEngine.decide(policyContext);
        Map<String, Object> decisionSnapshot = decision.toMap();
        emit(TraceEvent.builder(TraceEventType.POLICY_DECISION, traceId)
            .step(node.id())
            .data("stage", "prepare")
            .data("decision", decision.action().getValue())
            .data("report", decisionSnapshot));

        if (decision.isBlocked()) {
            log.warn("Prepare blocked by policy trace={} step={} decision={}", traceId, node.id(), decisionSnapshot);
            return new PreparedNode(null, decision, simulation);
        }

        Map<String, Object> hashInput = PreparedArtifact.hashInput(driver.chain(), node.adapter(), node.action(),
            node.params(), built.payload(), simulation, decisionSnapshot, traceId, preparedId);
        ArtifactHash hash = hasher.hash(hashInput);
        PreparedArtifact artifact = new PreparedArtifact(
            preparedId,
            now,
            now.plus(ttl),
            traceId,
            node.id(),
            driver.chain(),
            node.adapter(),
            node.action(),
            network,
            node.params(),
            built.payload(),
            simulation,
            ids,
            built.amount(),
            built.slippageBps(),
            built.slippageGuardDisabled(),
            decisionSnapshot,
            hash
        );

        Map<String, Object> snapshot = new LinkedHashMap<>();
        snapshot.put("hashInput", hasher.canonicalJson().normalize(hashInput));
        snapshot.put("artifactHash", hash);
        snapshot.put("createdAt", artifact.createdAt().toString());
        snapshot.put("expiresAt", artifact.expiresAt().toString());
        traceStore.writeArtifact(traceId, ReplayVerifier.PREPARED_ARTIFACT_PREFIX + preparedId, snapshot);

        preparedStore.put(artifact);
        log.info("Prepared artifact id={} trace={} step={} action={} decision={}",
            preparedId, traceId, node.id(), node.action(), decision.action().getValue());
        return new PreparedNode(artifact, decision, simulation);
    }

    private <T> T callTool(String traceId, String stepId, String pool, String tool, Callable<T> call) {
        emit(TraceEvent.builder(TraceEventType.TOOL_CALLED, traceId).step(stepId).tool(tool));
        try {
            T result = upstream.call(pool, tool, call);
            emit(TraceEvent.builder(TraceEventType.TOOL_RESULT, traceId).step(stepId).tool(tool));
            return result;
        } catch (RuntimeException ex) {
            emit(TraceEvent.builder(TraceEventType.TOOL_ERROR, traceId)
                .step(stepId)
                .tool(tool)
                .data("message", ex.getMessage()));
            throw ex;
        }
    }

    private void emit(TraceEvent.Builder event) {
        traceStore.emit(event.at(clock.instant()).build());
    }

    static String newPreparedId() {
        byte[] bytes = new byte[24];
        RANDOM.nextBytes(bytes);
        return "prep_" + HexFormat.of().formatHex(bytes);
    }
}
