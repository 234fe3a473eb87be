package com.actiongate.audit;

import com.actiongate.trace.TraceEvent;
import com.actiongate.trace.TraceEventType;
import com.actiongate.trace.TraceStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Summarizes runs whose {@code run.started} falls inside a time window.
 */
public class AuditReportService {

    private static final Logger log = LoggerFactory.getLogger(AuditReportService.class);

    private final TraceStore traceStore;

    public AuditReportService(TraceStore traceStore) {
        this.traceStore = traceStore;
    }

    public AuditReport report(Instant from, Instant to) {
        int runs = 0;
        int successful = 0;
        int blocked = 0;
        int submitted = 0;
        int confirmed = 0;
        TreeSet<String> chains = new TreeSet<>();

        for (String runId : traceStore.listRuns()) {
            List<TraceEvent> events = traceStore.loadRunEvents(runId);
            if (events.isEmpty() || !inWindow(events.get(0), from, to)) {
                continue;
            }
            runs++;
            for (TraceEvent event : events) {
                Map<String, Object> data = event.data() == null ? Map.of() : event.data();
                switch (event.type()) {
                    case RUN_STARTED -> collectChains(data.get("chains"), chains);
                    case RUN_FINISHED -> {
                        if (Boolean.TRUE.equals(data.get("ok"))) {
                            successful++;
                        }
                    }
                    case POLICY_DECISION -> {
                        if ("block".equals(data.get("decision"))) {
                            blocked++;
                        }
                    }
                    case TX_SUBMITTED -> submitted++;
                    case TX_CONFIRMED -> confirmed++;
                    default -> {
                    }
                }
            }
        }
        return new AuditReport(from.toString(), to.toString(), runs, successful, blocked,
            submitted, confirmed, new ArrayList<>(chains));
    }

    private static boolean inWindow(TraceEvent first, Instant from, Instant to) {
        if (first.type() != TraceEventType.RUN_STARTED) {
            return false;
        }
        try {
            Instant ts = Instant.parse(first.ts());
            return !ts.isBefore(from) && !ts.isAfter(to);
        } catch (DateTimeParseException ex) {
            log.warn("Run {} has an unparseable start time '{}'", first.runId(), first.ts());
            return false;
        }
    }

    private static void collectChains(Object raw, TreeSet<String> chains) {
        if (raw instanceof Collection<?> values) {
            for (Object v : values) {
                if (v != null) {
                    chains.add(v.toString());
                }
            }
        }
    }
}
