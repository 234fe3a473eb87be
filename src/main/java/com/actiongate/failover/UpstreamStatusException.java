package com.actiongate.failover;

/**
 * Thrown by drivers to report an HTTP-style status from an upstream endpoint.
 */
public class UpstreamStatusException extends RuntimeException {

    private final int statusCode;

    public UpstreamStatusException(int statusCode, String message) {
        super(message);
        this.statusCode = statusCode;
    }

    public int getStatusCode() {
        return statusCode;
    }
}
