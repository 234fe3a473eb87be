package com.actiongate.api;

import com.actiongate.audit.AuditReport;
import com.actiongate.audit.AuditReportService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

@RestController
@RequestMapping("/audit")
public class AuditController {

    private final AuditReportService auditReportService;
    private final Clock clock;

    public AuditController(AuditReportService auditReportService, Clock clock) {
        this.auditReportService = auditReportService;
        this.clock = clock;
    }

    /**
     * Defaults to the last 24 hours.
     */
    @GetMapping("/report")
    public AuditReport report(@RequestParam(required = false) Instant fromTs,
                              @RequestParam(required = false) Instant toTs) {
        Instant to = toTs != null ? toTs : clock.instant();
        Instant from = fromTs != null ? fromTs : to.minus(Duration.ofHours(24));
        if (from.isAfter(to)) {
            throw new IllegalArgumentException("fromTs must not be after toTs");
        }
        return auditReportService.report(from, to);
    }
}
