package com.actiongate.execution;

import com.actiongate.audit.ArtifactHasher;
import com.actiongate.driver.ActionDriver;
import com.actiongate.driver.BroadcastReceipt;
import com.actiongate.driver.ConfirmationStatus;
import com.actiongate.driver.DriverContext;
import com.actiongate.driver.DriverRegistry;
import com.actiongate.error.ApprovalRequiredException;
import com.actiongate.error.InternalInvariantException;
import com.actiongate.error.NotFoundOrExpiredException;
import com.actiongate.error.PolicyBlockException;
import com.actiongate.error.UpstreamOutcomeUnknownException;
import com.actiongate.error.ValidationException;
import com.actiongate.failover.BroadcastHistoryStore;
import com.actiongate.failover.BroadcastSignals;
import com.actiongate.failover.FailoverStateStore;
import com.actiongate.failover.UpstreamCaller;
import com.actiongate.plan.ActionNode;
import com.actiongate.plan.CompileResult;
import com.actiongate.plan.NodeResult;
import com.actiongate.plan.PlanCompiler;
import com.actiongate.policy.PolicyContext;
import com.actiongate.policy.PolicyDecision;
import com.actiongate.policy.PolicyEngine;
import com.actiongate.policy.SideEffect;
import com.actiongate.trace.TraceEvent;
import com.actiongate.trace.TraceEventType;
import com.actiongate.trace.TraceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Prepare and execute for single actions.
 *
 * Execute holds the lock stripe of its prepared id and checks the executed store first, so
 * concurrent or repeated executes of one id broadcast at most once and later calls return the
 * stored result. Stripes are never released, so every caller of one id contends on the same monitor.
 *
 * A broadcast that times out is recorded with {@link ConfirmationStatus#UNKNOWN} and no receipt.
 * The id is then treated as executed and is never broadcast again.
 */
public class ActionExecutor {

    private static final Logger log = LoggerFactory.getLogger(ActionExecutor.class);
    private static final String SINGLE_STEP = "action";
    private static final int LOCK_STRIPES = 64;

    private final PlanCompiler planCompiler;
    private final PreparedArtifactStore preparedStore;
    private final ExecutedRecordStore executedStore;
    private final DriverRegistry drivers;
    private final UpstreamCaller upstream;
    private final FailoverStateStore failoverState;
    private final PolicyEngine policyEngine;
    private final BroadcastHistoryStore broadcastHistory;
    private final ArtifactHasher hasher;
    private final TraceStore traceStore;
    private final Clock clock;
    private final Map<String, List<String>> signers;
    private final Object[] locks = new Object[LOCK_STRIPES];

    public ActionExecutor(PlanCompiler planCompiler,
                          PreparedArtifactStore preparedStore,
                          ExecutedRecordStore executedStore,
                          DriverRegistry drivers,
                          UpstreamCaller upstream,
                          FailoverStateStore failoverState,
                          PolicyEngine policyEngine,
                          BroadcastHistoryStore broadcastHistory,
                          ArtifactHasher hasher,
                          TraceStore traceStore,
                          Clock clock,
                          Map<String, List<String>> signers) {
        this.planCompiler = planCompiler;
        this.preparedStore = preparedStore;
        this.executedStore = executedStore;
        this.drivers = drivers;
        this.upstream = upstream;
        this.failoverState = failoverState;
        this.policyEngine = policyEngine;
        this.broadcastHistory = broadcastHistory;
        this.hasher = hasher;
        this.traceStore = traceStore;
        this.clock = clock;
        this.signers = signers == null ? Map.of() : Map.copyOf(signers);
        for (int i = 0; i < locks.length; i++) {
            locks[i] = new Object();
        }
    }

    public PrepareResult prepare(PrepareRequest request) {
        if (request == null || request.adapter() == null || request.action() == null) {
            throw new ValidationException("adapter and action are required");
        }
        ActionNode node = new ActionNode(SINGLE_STEP, List.of(), request.chain(), request.adapter(),
            request.action(), request.params());
        CompileResult compiled = planCompiler.prepareSingle(node, request.network());
        NodeResult result = compiled.results().get(0);
        return new PrepareResult(compiled.traceId(), result.preparedId(), result.allowed(), result.requiresApproval(),
            result.simulation(), result.policyReport(), result.artifactHash(), result.expiresAt());
    }

    public ExecuteResult execute(String preparedId, boolean confirm, boolean waitForConfirmation) {
        if (preparedId == null || preparedId.isBlank()) {
            throw new ValidationException("preparedId is required");
        }
        synchronized (lockFor(preparedId)) {
            return executeLocked(preparedId, confirm, waitForConfirmation);
        }
    }

    private Object lockFor(String preparedId) {
        return locks[Math.floorMod(preparedId.hashCode(), locks.length)];
    }

    private ExecuteResult executeLocked(String preparedId, boolean confirm, boolean waitForConfirmation) {
        var executed = executedStore.find(preparedId);
        if (executed.isPresent()) {
            log.info("Execute replay for preparedId={} returns stored receipt", preparedId);
            return ExecuteResult.from(executed.get(), true);
        }

        Instant now = clock.instant();
        PreparedArtifact artifact = preparedStore.get(preparedId).orElse(null);
        if (artifact == null || artifact.isExpired(now)) {
            preparedStore.remove(preparedId);
            throw new NotFoundOrExpiredException(preparedId);
        }
        if (!confirm) {
            throw new ApprovalRequiredException(preparedId, artifact.policyDecision());
        }

        String recomputed = hasher.hash(artifact.hashInput()).hash();
        if (!recomputed.equals(artifact.artifactHash().hash())) {
            log.error("Prepared artifact {} hash mismatch: stored={} recomputed={}",
                preparedId, artifact.artifactHash().hash(), recomputed);
            throw new InternalInvariantException("prepared artifact hash mismatch for " + preparedId);
        }

        BroadcastSignals signals = broadcastHistory.signals(now);
        PolicyContext context = PolicyContext.builder()
            .chain(artifact.chain())
            .network(artifact.network())
            .action(artifact.action())
            .sideEffect(SideEffect.BROADCAST)
            .simulationOk(artifact.simulation().ok())
            .amount(artifact.amount())
            .slippageBps(artifact.slippageBps())
            .simulatedSlippageBps(artifact.simulation().slippageBps())
            .slippageGuardDisabled(artifact.slippageGuardDisabled())
            .sideEffectIds(artifact.sideEffectIds().ids())
            .idsKnown(artifact.sideEffectIds().known())
            .secondsSinceLastBroadcast(signals.secondsSinceLastBroadcast())
            .broadcastsLastMinute(signals.broadcastsLastMinute())
            .volumeLast24h(signals.volumeLast24h())
            .attributes(artifact.params())
            .build();
        PolicyDecision decision = policyEngine.decide(context);
        Map<String, Object> report = decision.toMap();
        emit(TraceEvent.builder(TraceEventType.POLICY_DECISION, artifact.traceId())
            .step(artifact.stepId())
            .data("stage", "broadcast")
            .data("preparedId", preparedId)
            .data("decision", decision.action().getValue())
            .data("report", report));
        if (decision.isBlocked()) {
            log.warn("Broadcast blocked by policy preparedId={} report={}", preparedId, report);
            throw new PolicyBlockException("broadcast blocked by policy: " + report.get("code"), report);
        }

        ActionDriver driver = drivers.require(artifact.adapter());
        String pool = driver.upstreamPool();
        DriverContext driverContext = new DriverContext(artifact.traceId(), artifact.stepId(), artifact.chain(),
            artifact.network(), failoverState.activeEndpoint(pool).orElse(null));
        List<String> chainSigners = signers.getOrDefault(artifact.chain(), List.of());

        BroadcastReceipt receipt;
        try {
            receipt = upstream.callOnce(pool, "broadcast",
                () -> driver.broadcast(artifact.payload(), chainSigners, driverContext));
        } catch (UpstreamOutcomeUnknownException ex) {
            recordUnknownOutcome(artifact, now);
            throw ex;
        }
        if (receipt == null || receipt.receiptId() == null) {
            throw new InternalInvariantException("driver " + driver.id() + " returned no receipt for " + preparedId);
        }

        ExecutedRecord record = new ExecutedRecord(preparedId, receipt.receiptId(), clock.instant().toString(),
            artifact.traceId(), artifact.chain(), artifact.adapter(), artifact.action(), null);
        executedStore.put(record);
        broadcastHistory.record(now, artifact.amount());
        emit(TraceEvent.builder(TraceEventType.TX_SUBMITTED, artifact.traceId())
            .step(artifact.stepId())
            .data("preparedId", preparedId)
            .data("receiptId", receipt.receiptId()));
        log.info("Broadcast preparedId={} receipt={} trace={}", preparedId, receipt.receiptId(), artifact.traceId());

        if (!waitForConfirmation) {
            preparedStore.remove(preparedId);
            return ExecuteResult.from(record, false);
        }

        ConfirmationStatus status = awaitConfirmation(driver, pool, receipt.receiptId(), driverContext);
        ExecutedRecord confirmed = executedStore.updateConfirmation(preparedId, status);
        emit(TraceEvent.builder(TraceEventType.TX_CONFIRMED, artifact.traceId())
            .step(artifact.stepId())
            .data("preparedId", preparedId)
            .data("receiptId", receipt.receiptId())
            .data("status", status.getValue()));
        preparedStore.remove(preparedId);
        return ExecuteResult.from(confirmed, false);
    }

    private void recordUnknownOutcome(PreparedArtifact artifact, Instant now) {
        String preparedId = artifact.preparedId();
        ExecutedRecord record = new ExecutedRecord(preparedId, null, clock.instant().toString(),
            artifact.traceId(), artifact.chain(), artifact.adapter(), artifact.action(), ConfirmationStatus.UNKNOWN);
        executedStore.put(record);
        broadcastHistory.record(now, artifact.amount());
        preparedStore.remove(preparedId);
        emit(TraceEvent.builder(TraceEventType.TX_SUBMITTED, artifact.traceId())
            .step(artifact.stepId())
            .data("preparedId", preparedId)
            .data("outcome", ConfirmationStatus.UNKNOWN.getValue()));
        log.error("Broadcast of preparedId={} timed out; outcome unknown, id will not be broadcast again "
            + "(trace={})", preparedId, artifact.traceId());
    }

    /**
     * The broadcast already happened; a failed confirmation lookup is recorded as
     * {@link ConfirmationStatus#UNKNOWN} rather than failing the execute.
     */
    private ConfirmationStatus awaitConfirmation(ActionDriver driver, String pool, String receiptId,
                                                 DriverContext context) {
        try {
            ConfirmationStatus status = upstream.call(pool, "awaitConfirmation",
                () -> driver.awaitConfirmation(receiptId, context));
            return status == null ? ConfirmationStatus.UNKNOWN : status;
        } catch (RuntimeException ex) {
            log.warn("Confirmation lookup failed for receipt={}: {}", receiptId, ex.getMessage());
            return ConfirmationStatus.UNKNOWN;
        }
    }

    private void emit(TraceEvent.Builder event) {
        traceStore.emit(event.at(clock.instant()).build());
    }
}
