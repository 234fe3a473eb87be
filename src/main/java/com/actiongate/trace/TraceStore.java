package com.actiongate.trace;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;
import java.util.Optional;

/**
 * Append-only per-run event log plus artifact snapshot directory.
 */
public interface TraceStore {

    void emit(TraceEvent event);

    /**
     * Writes {@code content} as {@code runs/<runId>/artifacts/<name>.json}.
     */
    ArtifactRef writeArtifact(String runId, String name, Object content);

    boolean runExists(String runId);

    /** Events of the run in append order; empty for an unknown run. */
    List<TraceEvent> loadRunEvents(String runId);

    /** Run ids, newest first. */
    List<String> listRuns();

    Optional<JsonNode> loadArtifact(String runId, String name);

    List<String> listArtifacts(String runId);
}
