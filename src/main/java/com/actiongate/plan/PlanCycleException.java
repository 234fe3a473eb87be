package com.actiongate.plan;

import java.util.List;

/**
 * The dependency graph has a cycle. Raised before any driver is called.
 */
public class PlanCycleException extends PlanValidationException {

    private final List<String> cycleNodes;

    public PlanCycleException(List<String> cycleNodes) {
        super("PLAN_CYCLE", "plan contains a dependency cycle among: " + String.join(", ", cycleNodes));
        this.cycleNodes = List.copyOf(cycleNodes);
    }

    public List<String> getCycleNodes() {
        return cycleNodes;
    }
}
