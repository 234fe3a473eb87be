package com.actiongate.plan;

import com.actiongate.audit.ArtifactHasher;
import com.actiongate.audit.MemoryRecordWriter;
import com.actiongate.driver.ActionDriver;
import com.actiongate.error.ActionGateException;
import com.actiongate.execution.ArtifactPreparer;
import com.actiongate.execution.PreparedArtifact;
import com.actiongate.execution.PreparedNode;
import com.actiongate.policy.PolicyAction;
import com.actiongate.trace.TraceEvent;
import com.actiongate.trace.TraceEventType;
import com.actiongate.trace.TraceStore;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.UUID;
import java.util.concurrent.CancellationException;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Compiles a plan into prepared artifacts.
 *
 * Nodes are processed one at a time in the validator's id-ordered topological order, so traces and
 * artifact enumeration are reproducible. A node whose dependency did not prepare is marked
 * {@link NodeState#DEP_FAILED} without calling its driver. Failures stay local to the failing
 * node and its dependents; independent branches still prepare. An interrupted thread stops
 * scheduling and leaves the remaining nodes {@link NodeState#CANCELLED}.
 */
public class PlanCompiler {

    private static final Logger log = LoggerFactory.getLogger(PlanCompiler.class);

    private final PlanValidator validator;
    private final ArtifactPreparer preparer;
    private final TraceStore traceStore;
    private final ArtifactHasher hasher;
    private final MemoryRecordWriter memoryRecords;
    private final Clock clock;
    private final String defaultNetwork;

    public PlanCompiler(PlanValidator validator,
                        ArtifactPreparer preparer,
                        TraceStore traceStore,
                        ArtifactHasher hasher,
                        MemoryRecordWriter memoryRecords,
                        Clock clock,
                        String defaultNetwork) {
        this.validator = validator;
        this.preparer = preparer;
        this.traceStore = traceStore;
        this.hasher = hasher;
        this.memoryRecords = memoryRecords;
        this.clock = clock;
        this.defaultNetwork = defaultNetwork;
    }

    public CompileResult compile(Plan plan) {
        List<String> order = validator.order(plan);
        Map<String, ActionNode> byId = plan.actions().stream()
            .collect(Collectors.toMap(ActionNode::id, Function.identity()));
        return run(plan, order, byId).result();
    }

    /**
     * Prepares a single action through the same path as a one-node plan. Driver and upstream
     * failures are rethrown instead of being reported per node.
     */
    public CompileResult prepareSingle(ActionNode node, String network) {
        Plan plan = new Plan(List.of(node), network);
        List<String> order = validator.order(plan);
        Run run = run(plan, order, Map.of(node.id(), node));
        if (run.failure() != null) {
            throw run.failure();
        }
        return run.result();
    }

    private Run run(Plan plan, List<String> order, Map<String, ActionNode> byId) {
        String network = plan.network() != null ? plan.network() : defaultNetwork;

        TreeSet<String> chains = new TreeSet<>();
        for (String id : order) {
            ActionDriver driver = preparer.resolve(byId.get(id));
            chains.add(driver.chain());
        }

        String traceId = "run_" + UUID.randomUUID().toString().replace("-", "");
        JsonNode declared = hasher.canonicalJson().normalize(plan);
        String reasoningHash = hasher.hash(declared).hash();
        emit(TraceEvent.builder(TraceEventType.RUN_STARTED, traceId)
            .data("plan", declared)
            .data("reasoningHash", reasoningHash)
            .data("order", order)
            .data("network", network)
            .data("chains", new ArrayList<>(chains)));
        log.info("Compile started trace={} nodes={} network={}", traceId, order.size(), network);

        Map<String, NodeState> states = new HashMap<>();
        order.forEach(id -> states.put(id, NodeState.PENDING));
        List<NodeResult> results = new ArrayList<>();
        List<String> artifactHashes = new ArrayList<>();
        PolicyAction strongest = PolicyAction.ALLOW;
        ActionGateException firstFailure = null;
        boolean cancelled = false;

        for (String id : order) {
            ActionNode node = byId.get(id);
            if (cancelled || Thread.currentThread().isInterrupted()) {
                cancelled = true;
                states.put(id, NodeState.CANCELLED);
                results.add(NodeResult.failed(id, NodeState.CANCELLED, "CANCELLED", "compilation cancelled"));
                continue;
            }

            String blockingDep = node.dependsOn().stream()
                .filter(dep -> states.get(dep) != NodeState.PREPARED)
                .findFirst()
                .orElse(null);
            if (blockingDep != null) {
                states.put(id, NodeState.DEP_FAILED);
                NodeResult depFailed = NodeResult.failed(id, NodeState.DEP_FAILED, "DEP_FAILED",
                    "dependency " + blockingDep + " did not prepare (" + states.get(blockingDep).getValue() + ")");
                results.add(depFailed);
                emitStepFinished(traceId, depFailed);
                continue;
            }

            states.put(id, NodeState.COMPILING);
            emit(TraceEvent.builder(TraceEventType.STEP_STARTED, traceId)
                .step(id)
                .data("adapter", node.adapter())
                .data("action", node.action()));

            NodeResult result;
            try {
                PreparedNode prepared = preparer.prepare(traceId, node, network);
                result = toResult(id, prepared);
                if (prepared.decision().action().isStrongerThan(strongest)) {
                    strongest = prepared.decision().action();
                }
                if (!prepared.isBlocked()) {
                    artifactHashes.add(prepared.artifact().artifactHash().hash());
                }
            } catch (ActionGateException ex) {
                log.warn("Step failed trace={} step={} code={}: {}", traceId, id, ex.getErrorCode(), ex.getMessage());
                result = NodeResult.failed(id, NodeState.FAILED, ex.getErrorCode(), ex.getMessage());
                if (firstFailure == null) {
                    firstFailure = ex;
                }
            } catch (CancellationException ex) {
                cancelled = true;
                result = NodeResult.failed(id, NodeState.CANCELLED, "CANCELLED", "compilation cancelled");
            }
            states.put(id, result.state());
            results.add(result);
            emitStepFinished(traceId, result);
        }

        boolean ok = results.stream().allMatch(NodeResult::ok);
        long prepared = results.stream().filter(r -> r.state() == NodeState.PREPARED).count();
        emit(TraceEvent.builder(TraceEventType.RUN_FINISHED, traceId)
            .data("ok", ok)
            .data("prepared", prepared)
            .data("failed", results.size() - prepared)
            .data("cancelled", cancelled ? Boolean.TRUE : null));

        String outcome = cancelled ? "cancelled" : ok ? "prepared" : prepared > 0 ? "partial" : "failed";
        Map<String, Object> decision = new LinkedHashMap<>();
        decision.put("decision", strongest.getValue());
        memoryRecords.write(traceId, declared, artifactHashes, decision, outcome, clock.instant());
        log.info("Compile finished trace={} outcome={} prepared={}/{}", traceId, outcome, prepared, results.size());

        return new Run(new CompileResult(traceId, order, List.copyOf(results)), firstFailure);
    }

    private NodeResult toResult(String id, PreparedNode prepared) {
        PreparedArtifact artifact = prepared.artifact();
        if (prepared.isBlocked()) {
            return new NodeResult(id, true, NodeState.BLOCKED, null, false, false,
                prepared.simulation(), prepared.decision().toMap(), null, null, null);
        }
        return new NodeResult(id, true, NodeState.PREPARED, artifact.preparedId(), true,
            prepared.decision().requiresApproval(), prepared.simulation(), artifact.policyDecision(),
            artifact.artifactHash(), artifact.expiresAt().toString(), null);
    }

    private void emitStepFinished(String traceId, NodeResult result) {
        TraceEvent.Builder event = TraceEvent.builder(TraceEventType.STEP_FINISHED, traceId)
            .step(result.id())
            .data("state", result.state().getValue())
            .data("ok", result.ok())
            .data("preparedId", result.preparedId())
            .data("artifactHash", result.artifactHash())
            .data("policyDecision", result.policyReport());
        if (result.simulation() != null) {
            Map<String, Object> summary = new LinkedHashMap<>();
            summary.put("ok", result.simulation().ok());
            if (result.simulation().unitsConsumed() != null) {
                summary.put("unitsConsumed", result.simulation().unitsConsumed());
            }
            event.data("simulation", summary);
        }
        if (result.error() != null) {
            event.data("error", result.error());
        }
        emit(event);
    }

    private void emit(TraceEvent.Builder event) {
        traceStore.emit(event.at(clock.instant()).build());
    }

    private record Run(CompileResult result, ActionGateException failure) {}
}
