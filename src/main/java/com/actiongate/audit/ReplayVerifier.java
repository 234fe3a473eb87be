package com.actiongate.audit;

import com.actiongate.error.RunNotFoundException;
import com.actiongate.trace.TraceEvent;
import com.actiongate.trace.TraceEventType;
import com.actiongate.trace.TraceStore;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Re-derives a run's hashes purely from the event log and artifact files. Never calls a driver.
 *
 * Checked: the plan reasoning hash recorded on {@code run.started}, every prepared artifact hash
 * (file content against its recorded hash, and against the hash reported on {@code step.finished}),
 * and the memory record's artifacts hash and idempotency key when a memory record exists.
 */
public class ReplayVerifier {

    public static final String PREPARED_ARTIFACT_PREFIX = "prepared-";

    private final TraceStore traceStore;
    private final ArtifactHasher hasher;
    private final MemoryRecordWriter memoryRecords;

    public ReplayVerifier(TraceStore traceStore, ArtifactHasher hasher, MemoryRecordWriter memoryRecords) {
        this.traceStore = traceStore;
        this.hasher = hasher;
        this.memoryRecords = memoryRecords;
    }

    public ReplayReport verify(String runId) {
        if (!traceStore.runExists(runId)) {
            throw new RunNotFoundException(runId);
        }
        List<TraceEvent> events = traceStore.loadRunEvents(runId);
        List<String> mismatches = new ArrayList<>();
        int checked = 0;

        String recomputedReasoning = null;
        for (TraceEvent event : events) {
            if (event.type() == TraceEventType.RUN_STARTED && event.data() != null
                    && event.data().containsKey("plan")) {
                recomputedReasoning = hasher.hash(event.data().get("plan")).hash();
                Object recorded = event.data().get("reasoningHash");
                checked++;
                if (!recomputedReasoning.equals(recorded)) {
                    mismatches.add("reasoningHash: recorded=" + recorded + " recomputed=" + recomputedReasoning);
                }
                break;
            }
        }

        List<String> artifactHashes = new ArrayList<>();
        for (TraceEvent event : events) {
            if (event.type() != TraceEventType.STEP_FINISHED || event.data() == null) {
                continue;
            }
            Object preparedId = event.data().get("preparedId");
            if (preparedId == null) {
                continue;
            }
            Object reported = event.data().get("artifactHash");
            Optional<JsonNode> artifact = traceStore.loadArtifact(runId, PREPARED_ARTIFACT_PREFIX + preparedId);
            if (artifact.isEmpty()) {
                mismatches.add("artifact missing for preparedId=" + preparedId);
                continue;
            }
            JsonNode node = artifact.get();
            String recomputed = hasher.hash(node.path("hashInput")).hash();
            String recorded = node.path("artifactHash").path("hash").asText(null);
            checked++;
            if (!recomputed.equals(recorded)) {
                mismatches.add("artifact " + preparedId + ": recorded=" + recorded + " recomputed=" + recomputed);
            }
            if (reported instanceof Map<?, ?> reportedHash && !recomputed.equals(reportedHash.get("hash"))) {
                mismatches.add("step " + event.stepId() + ": reported=" + reportedHash.get("hash")
                    + " recomputed=" + recomputed);
            }
            artifactHashes.add(recomputed);
        }

        Optional<MemoryRecord> memory = memoryRecords.load(runId);
        if (memory.isPresent()) {
            MemoryRecord record = memory.get();
            String artifactsHash = memoryRecords.artifactsHash(artifactHashes);
            checked++;
            if (!artifactsHash.equals(record.artifactsHash())) {
                mismatches.add("artifacts_hash: recorded=" + record.artifactsHash() + " recomputed=" + artifactsHash);
            }
            if (recomputedReasoning != null) {
                checked++;
                String key = MemoryRecordWriter.idempotencyKey(runId, recomputedReasoning, artifactsHash);
                if (!key.equals(record.idempotencyKey())) {
                    mismatches.add("idempotency_key: recorded=" + record.idempotencyKey() + " recomputed=" + key);
                }
            }
        }

        return new ReplayReport(runId, mismatches.isEmpty(), checked, List.copyOf(mismatches));
    }
}
