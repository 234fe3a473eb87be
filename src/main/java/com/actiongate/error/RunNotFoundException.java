package com.actiongate.error;

public class RunNotFoundException extends ActionGateException {

    public RunNotFoundException(String runId) {
        super("TRACE_NOT_FOUND", "no trace recorded for run " + runId);
    }
}
