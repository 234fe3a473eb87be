package com.actiongate.plan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.PriorityQueue;
import java.util.Set;

/**
 * Validates plan structure and computes the compile order.
 *
 * Order is Kahn's algorithm with the ready set kept in a min-heap on node id, so identical plans
 * always produce identical orders regardless of declaration order.
 */
public class PlanValidator {

    public List<String> order(Plan plan) {
        if (plan == null || plan.actions().isEmpty()) {
            throw new PlanValidationException("INVALID_PLAN", "plan has no actions");
        }

        Map<String, ActionNode> byId = new HashMap<>();
        for (ActionNode node : plan.actions()) {
            if (node == null || node.id() == null || node.id().isBlank()) {
                throw new PlanValidationException("INVALID_PLAN", "every action needs an id");
            }
            if (node.adapter() == null || node.adapter().isBlank()
                    || node.action() == null || node.action().isBlank()) {
                throw new PlanValidationException("INVALID_PLAN",
                    "action " + node.id() + " needs an adapter and an action");
            }
            if (byId.putIfAbsent(node.id(), node) != null) {
                throw new PlanValidationException("INVALID_PLAN", "duplicate action id: " + node.id());
            }
        }

        Map<String, Integer> inDegree = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (ActionNode node : plan.actions()) {
            Set<String> deps = new LinkedHashSet<>(node.dependsOn());
            for (String dep : deps) {
                if (!byId.containsKey(dep)) {
                    throw new PlanValidationException("MISSING_DEPENDENCY",
                        "action " + node.id() + " depends on unknown action: " + dep);
                }
                dependents.computeIfAbsent(dep, k -> new ArrayList<>()).add(node.id());
            }
            inDegree.put(node.id(), deps.size());
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        inDegree.forEach((id, degree) -> {
            if (degree == 0) {
                ready.add(id);
            }
        });

        List<String> order = new ArrayList<>(byId.size());
        Set<String> done = new HashSet<>();
        while (!ready.isEmpty()) {
            String id = ready.poll();
            order.add(id);
            done.add(id);
            for (String next : dependents.getOrDefault(id, List.of())) {
                int remaining = inDegree.merge(next, -1, Integer::sum);
                if (remaining == 0) {
                    ready.add(next);
                }
            }
        }

        if (order.size() != byId.size()) {
            List<String> cycle = new ArrayList<>();
            for (String id : byId.keySet()) {
                if (!done.contains(id)) {
                    cycle.add(id);
                }
            }
            cycle.sort(null);
            throw new PlanCycleException(cycle);
        }
        return order;
    }
}
