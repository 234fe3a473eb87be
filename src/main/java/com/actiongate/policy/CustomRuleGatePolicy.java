package com.actiongate.policy;

import com.actiongate.rules.RuleEvaluator;
import com.actiongate.rules.RuleExpression;
import com.actiongate.rules.RuleParser;
import com.actiongate.rules.RuleSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Evaluates the configured custom rules in order. The first matching rule whose action is not
 * {@code allow} decides. Conditions are parsed once; a malformed condition never matches.
 */
public class CustomRuleGatePolicy implements PolicyGate {

    private static final Logger log = LoggerFactory.getLogger(CustomRuleGatePolicy.class);

    private final List<CompiledRule> compiled;
    private final RuleEvaluator evaluator = new RuleEvaluator();

    public CustomRuleGatePolicy(List<PolicyRule> rules) {
        RuleParser parser = new RuleParser();
        List<CompiledRule> out = new ArrayList<>();
        for (PolicyRule rule : rules) {
            RuleExpression expression = null;
            try {
                expression = parser.parse(rule.condition());
            } catch (RuleSyntaxException ex) {
                log.warn("Policy rule '{}' has a malformed condition and will never match: {}",
                    rule.name(), ex.getMessage());
            }
            out.add(new CompiledRule(rule, expression));
        }
        this.compiled = List.copyOf(out);
    }

    @Override
    public String gateId() {
        return "custom-rules";
    }

    @Override
    public Optional<PolicyDecision> evaluate(PolicyConfig config, PolicyContext context) {
        if (compiled.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Object> ruleContext = context.toRuleContext();
        for (CompiledRule entry : compiled) {
            PolicyRule rule = entry.rule();
            if (entry.expression() == null || rule.action() == PolicyAction.ALLOW) {
                continue;
            }
            if (evaluator.evaluate(entry.expression(), ruleContext)) {
                return Optional.of(toDecision(rule));
            }
        }
        return Optional.empty();
    }

    private PolicyDecision toDecision(PolicyRule rule) {
        String code = "RULE_" + rule.name().toUpperCase(Locale.ROOT);
        String message = rule.message() != null ? rule.message() : "Rule matched: " + rule.name();
        String reason = "rule:" + rule.name();
        return switch (rule.action()) {
            case BLOCK -> PolicyDecision.block(code, message, reason);
            case CONFIRM -> PolicyDecision.confirm(code, message, "rule_" + rule.name(), reason);
            case WARN -> PolicyDecision.warn(code, message, reason);
            case ALLOW -> PolicyDecision.allow(List.of(reason));
        };
    }

    private record CompiledRule(PolicyRule rule, RuleExpression expression) {}
}
