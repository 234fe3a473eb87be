package com.actiongate.plan;

import java.util.List;

/**
 * A dependency graph of actions. Well-formed iff every dependency resolves within the plan and the
 * graph is acyclic.
 *
 * @param network target network for every node; null means the configured default
 */
public record Plan(List<ActionNode> actions, String network) {

    public Plan {
        actions = actions == null ? List.of() : List.copyOf(actions);
    }
}
