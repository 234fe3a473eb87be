package com.actiongate.rules;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Evaluates rule conditions against a plain mapping. Has no side effects.
 */
public class RuleEvaluator {

    private static final Logger log = LoggerFactory.getLogger(RuleEvaluator.class);

    private final RuleParser parser = new RuleParser();

    public boolean evaluate(RuleExpression expression, Map<String, ?> context) {
        return RuleValues.truthy(expression.evaluate(context));
    }

    /**
     * Parses and evaluates in one step. A malformed condition evaluates to false.
     */
    public boolean evaluateCondition(String condition, Map<String, ?> context) {
        try {
            return evaluate(parser.parse(condition), context);
        } catch (RuleSyntaxException ex) {
            log.debug("Condition '{}' is malformed: {}", condition, ex.getMessage());
            return false;
        }
    }
}
