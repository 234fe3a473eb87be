package com.actiongate.trace;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * One line of a run's append-only event log.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TraceEvent(
    String ts,
    TraceEventType type,
    String runId,
    String stepId,
    String tool,
    Map<String, Object> data,
    List<ArtifactRef> artifactRefs
) {

    public static Builder builder(TraceEventType type, String runId) {
        return new Builder(type, runId);
    }

    public static final class Builder {
        private final TraceEventType type;
        private final String runId;
        private Instant ts;
        private String stepId;
        private String tool;
        private final Map<String, Object> data = new LinkedHashMap<>();
        private List<ArtifactRef> artifactRefs;

        private Builder(TraceEventType type, String runId) {
            this.type = type;
            this.runId = runId;
        }

        public Builder at(Instant ts) {
            this.ts = ts;
            return this;
        }

        public Builder step(String stepId) {
            this.stepId = stepId;
            return this;
        }

        public Builder tool(String tool) {
            this.tool = tool;
            return this;
        }

        public Builder data(String key, Object value) {
            if (value != null) {
                data.put(key, value);
            }
            return this;
        }

        public Builder artifacts(List<ArtifactRef> refs) {
            this.artifactRefs = refs == null || refs.isEmpty() ? null : List.copyOf(refs);
            return this;
        }

        public TraceEvent build() {
            Instant at = ts != null ? ts : Instant.now();
            return new TraceEvent(at.toString(), type, runId, stepId, tool,
                data.isEmpty() ? null : data, artifactRefs);
        }
    }
}
