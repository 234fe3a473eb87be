package com.actiongate.audit;

import java.util.List;

public record AuditReport(
    String fromTs,
    String toTs,
    int runs,
    int successfulRuns,
    int blockedDecisions,
    int submittedTransactions,
    int confirmedTransactions,
    List<String> chains
) {
}
