package com.actiongate.driver;

import com.actiongate.error.ActionGateException;

/**
 * Driver-side failure with a driver-specific code, e.g. {@code BUILD_ERROR} on invalid params.
 * Treated as permanent unless its message marks it as a network or rate-limit failure.
 */
public class DriverException extends ActionGateException {

    public DriverException(String errorCode, String message) {
        super(errorCode, message);
    }

    public DriverException(String errorCode, String message, Throwable cause) {
        super(errorCode, message, cause);
    }
}
