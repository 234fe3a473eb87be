package com.actiongate.rules;

import java.util.Map;

/**
 * Typed AST of a rule condition. Evaluation never throws for missing context values:
 * a path that does not resolve yields {@code null}.
 */
public sealed interface RuleExpression {

    /** Evaluates this node to a raw value (Boolean for logical and comparison nodes). */
    Object evaluate(Map<String, ?> context);

    record Literal(Object value) implements RuleExpression {
        @Override
        public Object evaluate(Map<String, ?> context) {
            return value;
        }
    }

    record Path(String path) implements RuleExpression {
        @Override
        public Object evaluate(Map<String, ?> context) {
            return PathResolver.resolve(context, path);
        }
    }

    record Not(RuleExpression operand) implements RuleExpression {
        @Override
        public Object evaluate(Map<String, ?> context) {
            return !RuleValues.truthy(operand.evaluate(context));
        }
    }

    record Compare(RuleExpression left, ComparisonOperator operator, RuleExpression right) implements RuleExpression {
        @Override
        public Object evaluate(Map<String, ?> context) {
            return RuleValues.compare(left.evaluate(context), operator, right.evaluate(context));
        }
    }

    record And(RuleExpression left, RuleExpression right) implements RuleExpression {
        @Override
        public Object evaluate(Map<String, ?> context) {
            return RuleValues.truthy(left.evaluate(context)) && RuleValues.truthy(right.evaluate(context));
        }
    }

    record Or(RuleExpression left, RuleExpression right) implements RuleExpression {
        @Override
        public Object evaluate(Map<String, ?> context) {
            return RuleValues.truthy(left.evaluate(context)) || RuleValues.truthy(right.evaluate(context));
        }
    }
}
