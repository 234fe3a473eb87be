package com.actiongate.rules;

import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class RuleEvaluatorTest {

    private final RuleEvaluator evaluator = new RuleEvaluator();

    private boolean eval(String condition, Map<String, ?> context) {
        return evaluator.evaluateCondition(condition, context);
    }

    @Nested
    class Comparisons {

        @Test
        void numericComparisonAcrossTypes() {
            assertTrue(eval("amount > 500", Map.of("amount", 600)));
            assertFalse(eval("amount > 500", Map.of("amount", 100)));
            assertTrue(eval("amount == 100", Map.of("amount", 100.0)));
            assertTrue(eval("amount <= 100", Map.of("amount", 100L)));
        }

        @Test
        void stringEquality() {
            assertTrue(eval("network == 'mainnet'", Map.of("network", "mainnet")));
            assertTrue(eval("network != \"devnet\"", Map.of("network", "mainnet")));
        }

        @Test
        void numericStringsAreCoercedForOrdering() {
            assertTrue(eval("amount > 10", Map.of("amount", "12.5")));
            assertFalse(eval("amount > 10", Map.of("amount", "lots")));
        }

        @Test
        void missingPathComparesAsNull() {
            assertFalse(eval("missing > 0", Map.of()));
            assertTrue(eval("missing == other", Map.of()));
            assertFalse(eval("missing == 0", Map.of()));
        }
    }

    @Nested
    class Paths {

        @Test
        void dottedPathWalksNestedMaps() {
            Map<String, Object> ctx = Map.of("ctx", Map.of("quote", Map.of("impact", 3)));
            assertTrue(eval("ctx.quote.impact >= 3", ctx));
        }

        @Test
        void pathThroughNonMapIsUndefined() {
            assertNull(PathResolver.resolve(Map.of("a", 5), "a.b"));
            assertNull(PathResolver.resolve(Map.of("a", Map.of()), "a.b.c"));
        }

        @Test
        void nullValuesResolveToNull() {
            Map<String, Object> ctx = new HashMap<>();
            ctx.put("a", null);
            assertNull(PathResolver.resolve(ctx, "a"));
            assertFalse(eval("a", ctx));
        }
    }

    @Nested
    class Logic {

        @Test
        void bareValuesCoerceToBoolean() {
            assertTrue(eval("flag", Map.of("flag", true)));
            assertFalse(eval("count", Map.of("count", 0)));
            assertFalse(eval("name", Map.of("name", "")));
            assertTrue(eval("name", Map.of("name", "x")));
        }

        @Test
        void symbolicAndWordOperatorsAgree() {
            Map<String, Object> ctx = Map.of("a", true, "b", false);
            assertEquals(eval("a && !b", ctx), eval("a and not b", ctx));
            assertTrue(eval("a || b", ctx));
            assertFalse(eval("a AND b", ctx));
        }
    }

    @Test
    void malformedConditionEvaluatesToFalse() {
        assertFalse(eval("amount >", Map.of("amount", 1)));
        assertFalse(eval("(a", Map.of("a", true)));
        assertFalse(eval("a $ b", Map.of()));
    }
}
