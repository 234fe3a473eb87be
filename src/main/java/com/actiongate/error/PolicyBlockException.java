package com.actiongate.error;

import java.util.Map;

public class PolicyBlockException extends ActionGateException {

    private final Map<String, Object> policyReport;

    public PolicyBlockException(String message, Map<String, Object> policyReport) {
        super("POLICY_BLOCK", message);
        this.policyReport = policyReport;
    }

    public Map<String, Object> getPolicyReport() {
        return policyReport;
    }
}
