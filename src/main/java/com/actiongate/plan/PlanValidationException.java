package com.actiongate.plan;

import com.actiongate.error.ValidationException;

public class PlanValidationException extends ValidationException {

    public PlanValidationException(String errorCode, String message) {
        super(errorCode, message);
    }
}
