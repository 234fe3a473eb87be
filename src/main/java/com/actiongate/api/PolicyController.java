package com.actiongate.api;

import com.actiongate.policy.PolicyContext;
import com.actiongate.policy.PolicyEngine;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/**
 * Evaluates an ad-hoc context against the loaded policy. No side effects.
 */
@RestController
@RequestMapping("/policy")
public class PolicyController {

    private final PolicyEngine policyEngine;

    public PolicyController(PolicyEngine policyEngine) {
        this.policyEngine = policyEngine;
    }

    @PostMapping("/decide")
    public Map<String, Object> decide(@RequestBody PolicyContext context) {
        return policyEngine.decide(context).toMap();
    }
}
