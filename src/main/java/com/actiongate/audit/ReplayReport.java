package com.actiongate.audit;

import java.util.List;

/**
 * Outcome of re-deriving a run's hashes from its persisted trace.
 *
 * @param checked number of hashes recomputed
 */
public record ReplayReport(String runId, boolean ok, int checked, List<String> mismatches) {
}
