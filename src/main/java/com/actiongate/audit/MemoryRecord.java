package com.actiongate.audit;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Provenance record of one run, written to {@code memory_records/<runId>.json}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record MemoryRecord(
    @JsonProperty("run_id") String runId,
    @JsonProperty("reasoning_hash") String reasoningHash,
    @JsonProperty("artifacts_hash") String artifactsHash,
    @JsonProperty("policy_decision") Map<String, Object> policyDecision,
    @JsonProperty("outcome") String outcome,
    @JsonProperty("ts") String ts,
    @JsonProperty("idempotency_key") String idempotencyKey,
    @JsonProperty("schema_version") String schemaVersion,
    @JsonProperty("hash_alg") String hashAlg
) {
}
