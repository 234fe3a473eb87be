package com.actiongate.config;

import com.actiongate.audit.ArtifactHasher;
import com.actiongate.audit.AuditReportService;
import com.actiongate.audit.CanonicalJson;
import com.actiongate.audit.MemoryRecordWriter;
import com.actiongate.audit.ReplayVerifier;
import com.actiongate.driver.DriverRegistry;
import com.actiongate.execution.ActionExecutor;
import com.actiongate.execution.ArtifactPreparer;
import com.actiongate.execution.ExecutedRecordStore;
import com.actiongate.execution.ExpiredArtifactSweeper;
import com.actiongate.execution.FileExecutedRecordStore;
import com.actiongate.execution.InMemoryPreparedArtifactStore;
import com.actiongate.execution.PreparedArtifactStore;
import com.actiongate.failover.BroadcastHistoryStore;
import com.actiongate.failover.FailoverStateStore;
import com.actiongate.failover.UpstreamCaller;
import com.actiongate.plan.PlanCompiler;
import com.actiongate.plan.PlanValidator;
import com.actiongate.policy.PolicyEngine;
import com.actiongate.trace.FileTraceStore;
import com.actiongate.trace.TraceStore;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.nio.file.Path;
import java.time.Clock;

/**
 * Wires the stores, the policy engine, the compiler and the executor. Every store is rooted at
 * {@code actiongate.state-dir}.
 */
@Configuration
public class ActionGateConfiguration {

    private static final Logger log = LoggerFactory.getLogger(ActionGateConfiguration.class);

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public Path stateDir(ActionGateProperties properties) {
        Path dir = Path.of(properties.getStateDir()).toAbsolutePath().normalize();
        log.info("Action gate state directory: {}", dir);
        return dir;
    }

    @Bean
    public CanonicalJson canonicalJson(ObjectMapper objectMapper) {
        return new CanonicalJson(objectMapper);
    }

    @Bean
    public ArtifactHasher artifactHasher(CanonicalJson canonicalJson) {
        return new ArtifactHasher(canonicalJson);
    }

    @Bean
    public PolicyEngine policyEngine(ActionGateProperties properties) {
        return new PolicyEngine(properties.getPolicy().toPolicyConfig());
    }

    @Bean
    public TraceStore traceStore(Path stateDir, ObjectMapper objectMapper) {
        return new FileTraceStore(stateDir, objectMapper);
    }

    @Bean
    public MemoryRecordWriter memoryRecordWriter(Path stateDir, ObjectMapper objectMapper, ArtifactHasher hasher) {
        return new MemoryRecordWriter(stateDir, objectMapper, hasher);
    }

    @Bean
    public ReplayVerifier replayVerifier(TraceStore traceStore, ArtifactHasher hasher, MemoryRecordWriter memoryRecords) {
        return new ReplayVerifier(traceStore, hasher, memoryRecords);
    }

    @Bean
    public AuditReportService auditReportService(TraceStore traceStore) {
        return new AuditReportService(traceStore);
    }

    @Bean
    public BroadcastHistoryStore broadcastHistoryStore(Path stateDir, ObjectMapper objectMapper) {
        return new BroadcastHistoryStore(stateDir, objectMapper);
    }

    @Bean
    public PreparedArtifactStore preparedArtifactStore() {
        return new InMemoryPreparedArtifactStore();
    }

    @Bean
    public ExecutedRecordStore executedRecordStore(Path stateDir, ObjectMapper objectMapper) {
        return new FileExecutedRecordStore(stateDir, objectMapper);
    }

    @Bean
    public ExpiredArtifactSweeper expiredArtifactSweeper(PreparedArtifactStore preparedStore, Clock clock) {
        return new ExpiredArtifactSweeper(preparedStore, clock);
    }

    @Bean
    public ArtifactPreparer artifactPreparer(DriverRegistry drivers,
                                             UpstreamCaller upstreamCaller,
                                             FailoverStateStore failoverState,
                                             PolicyEngine policyEngine,
                                             BroadcastHistoryStore broadcastHistory,
                                             ArtifactHasher hasher,
                                             TraceStore traceStore,
                                             PreparedArtifactStore preparedStore,
                                             Clock clock,
                                             ActionGateProperties properties) {
        return new ArtifactPreparer(drivers, upstreamCaller, failoverState, policyEngine, broadcastHistory,
            hasher, traceStore, preparedStore, clock, properties.getPreparedTtl());
    }

    @Bean
    public PlanCompiler planCompiler(ArtifactPreparer preparer,
                                     TraceStore traceStore,
                                     ArtifactHasher hasher,
                                     MemoryRecordWriter memoryRecords,
                                     Clock clock,
                                     ActionGateProperties properties) {
        return new PlanCompiler(new PlanValidator(), preparer, traceStore, hasher, memoryRecords, clock,
            properties.getDefaultNetwork());
    }

    @Bean
    public ActionExecutor actionExecutor(PlanCompiler planCompiler,
                                         PreparedArtifactStore preparedStore,
                                         ExecutedRecordStore executedStore,
                                         DriverRegistry drivers,
                                         UpstreamCaller upstreamCaller,
                                         FailoverStateStore failoverState,
                                         PolicyEngine policyEngine,
                                         BroadcastHistoryStore broadcastHistory,
                                         ArtifactHasher hasher,
                                         TraceStore traceStore,
                                         Clock clock,
                                         ActionGateProperties properties) {
        return new ActionExecutor(planCompiler, preparedStore, executedStore, drivers, upstreamCaller,
            failoverState, policyEngine, broadcastHistory, hasher, traceStore, clock, properties.getSigners());
    }
}
