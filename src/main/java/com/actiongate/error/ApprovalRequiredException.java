package com.actiongate.error;

import java.util.Map;

/**
 * The caller has not confirmed yet. Not a failure: the same request with {@code confirm=true}
 * proceeds.
 */
public class ApprovalRequiredException extends ActionGateException {

    private final String preparedId;
    private final Map<String, Object> policyReport;

    public ApprovalRequiredException(String preparedId, Map<String, Object> policyReport) {
        super("APPROVAL_REQUIRED", "explicit confirmation is required to execute " + preparedId);
        this.preparedId = preparedId;
        this.policyReport = policyReport;
    }

    public String getPreparedId() {
        return preparedId;
    }

    public Map<String, Object> getPolicyReport() {
        return policyReport;
    }
}
