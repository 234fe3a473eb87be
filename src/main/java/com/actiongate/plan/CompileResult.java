package com.actiongate.plan;

import java.util.List;

public record CompileResult(String traceId, List<String> order, List<NodeResult> results) {

    public boolean allOk() {
        return results.stream().allMatch(NodeResult::ok);
    }
}
