package com.actiongate.api;

import com.actiongate.audit.ReplayReport;
import com.actiongate.audit.ReplayVerifier;
import com.actiongate.error.RunNotFoundException;
import com.actiongate.trace.TraceEvent;
import com.actiongate.trace.TraceStore;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/traces")
public class TraceController {

    private final TraceStore traceStore;
    private final ReplayVerifier replayVerifier;

    public TraceController(TraceStore traceStore, ReplayVerifier replayVerifier) {
        this.traceStore = traceStore;
        this.replayVerifier = replayVerifier;
    }

    @GetMapping
    public Map<String, Object> list(@RequestParam(defaultValue = "50") int limit) {
        List<String> runs = traceStore.listRuns();
        return Map.of("traces", runs.subList(0, Math.max(0, Math.min(Math.min(limit, 1000), runs.size()))));
    }

    @GetMapping("/{traceId}")
    public Map<String, Object> get(@PathVariable String traceId) {
        if (!traceStore.runExists(traceId)) {
            throw new RunNotFoundException(traceId);
        }
        List<TraceEvent> events = traceStore.loadRunEvents(traceId);
        return Map.of(
            "traceId", traceId,
            "events", events,
            "artifacts", traceStore.listArtifacts(traceId)
        );
    }

    @GetMapping("/{traceId}/verify")
    public ReplayReport verify(@PathVariable String traceId) {
        return replayVerifier.verify(traceId);
    }
}
