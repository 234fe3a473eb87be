package com.actiongate.plan;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PlanValidatorTest {

    private final PlanValidator validator = new PlanValidator();

    private static ActionNode node(String id, String... deps) {
        return new ActionNode(id, List.of(deps), null, "sandbox", "noop", null);
    }

    @Nested
    @DisplayName("Ordering")
    class Ordering {

        @Test
        void dependenciesComeFirst() {
            List<String> order = validator.order(new Plan(List.of(node("c", "b"), node("b", "a"), node("a")), null));
            assertEquals(List.of("a", "b", "c"), order);
        }

        @Test
        @DisplayName("independent nodes are ordered by id regardless of declaration order")
        void tiesBreakById() {
            List<String> forward = validator.order(new Plan(List.of(node("x"), node("m"), node("b", "x")), null));
            List<String> reversed = validator.order(new Plan(List.of(node("b", "x"), node("m"), node("x")), null));

            assertEquals(List.of("m", "x", "b"), forward);
            assertEquals(forward, reversed);
        }

        @Test
        void diamond() {
            List<String> order = validator.order(new Plan(List.of(
                node("d", "b", "c"), node("c", "a"), node("b", "a"), node("a")), null));
            assertEquals(List.of("a", "b", "c", "d"), order);
        }

        @Test
        void repeatedDependencyCountsOnce() {
            assertEquals(List.of("a", "b"), validator.order(new Plan(List.of(node("b", "a", "a"), node("a")), null)));
        }
    }

    @Nested
    @DisplayName("Rejection")
    class Rejection {

        @Test
        void cycleNamesItsNodes() {
            PlanCycleException ex = assertThrows(PlanCycleException.class, () -> validator.order(new Plan(List.of(
                node("a"), node("b", "c"), node("c", "b"), node("d", "c")), null)));

            assertEquals("PLAN_CYCLE", ex.getErrorCode());
            assertEquals(List.of("b", "c", "d"), ex.getCycleNodes());
        }

        @Test
        void selfDependencyIsACycle() {
            assertThrows(PlanCycleException.class, () -> validator.order(new Plan(List.of(node("a", "a")), null)));
        }

        @Test
        void missingDependency() {
            PlanValidationException ex = assertThrows(PlanValidationException.class,
                () -> validator.order(new Plan(List.of(node("a", "ghost")), null)));
            assertEquals("MISSING_DEPENDENCY", ex.getErrorCode());
        }

        @Test
        void duplicateIds() {
            PlanValidationException ex = assertThrows(PlanValidationException.class,
                () -> validator.order(new Plan(List.of(node("a"), node("a")), null)));
            assertEquals("INVALID_PLAN", ex.getErrorCode());
        }

        @Test
        void emptyPlan() {
            assertThrows(PlanValidationException.class, () -> validator.order(new Plan(List.of(), null)));
        }

        @Test
        void nodeWithoutAdapter() {
            ActionNode bad = new ActionNode("a", null, null, null, "noop", null);
            assertThrows(PlanValidationException.class, () -> validator.order(new Plan(List.of(bad), null)));
        }
    }
}
