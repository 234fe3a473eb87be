package com.actiongate.plan;

import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;
import java.util.Map;

/**
 * One declared action of a plan.
 *
 * @param chain optional; when given it must match the adapter's chain
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ActionNode(
    String id,
    List<String> dependsOn,
    String chain,
    String adapter,
    String action,
    Map<String, Object> params
) {

    public ActionNode {
        dependsOn = dependsOn == null ? List.of() : List.copyOf(dependsOn);
        params = params == null ? Map.of() : params;
    }
}
