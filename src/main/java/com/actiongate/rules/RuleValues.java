package com.actiongate.rules;

import java.util.Objects;

/**
 * Value semantics shared by the evaluator: truthiness and comparison coercion.
 */
final class RuleValues {

    private RuleValues() {
    }

    static boolean truthy(Object value) {
        if (value == null) {
            return false;
        }
        if (value instanceof Boolean b) {
            return b;
        }
        if (value instanceof Number num) {
            double d = num.doubleValue();
            return d != 0 && !Double.isNaN(d);
        }
        if (value instanceof String s) {
            return !s.isEmpty();
        }
        return true;
    }

    static boolean compare(Object left, ComparisonOperator operator, Object right) {
        return switch (operator) {
            case EQ -> equal(left, right);
            case NE -> !equal(left, right);
            case GT, GE, LT, LE -> ordered(left, operator, right);
        };
    }

    private static boolean equal(Object left, Object right) {
        if (left instanceof Number l && right instanceof Number r) {
            return l.doubleValue() == r.doubleValue();
        }
        return Objects.equals(left, right);
    }

    private static boolean ordered(Object left, ComparisonOperator operator, Object right) {
        Double l = toNumber(left);
        Double r = toNumber(right);
        if (l == null || r == null) {
            return false;
        }
        return switch (operator) {
            case GT -> l > r;
            case GE -> l >= r;
            case LT -> l < r;
            case LE -> l <= r;
            default -> false;
        };
    }

    private static Double toNumber(Object value) {
        if (value instanceof Number num) {
            double d = num.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        if (value instanceof Boolean b) {
            return b ? 1.0 : 0.0;
        }
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException ex) {
                return null;
            }
        }
        return null;
    }
}
