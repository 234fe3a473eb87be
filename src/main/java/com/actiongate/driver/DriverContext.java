package com.actiongate.driver;

/**
 * Per-call context handed to drivers.
 *
 * @param endpoint currently active endpoint of the driver's upstream pool, null when none is configured
 */
public record DriverContext(String traceId, String stepId, String chain, String network, String endpoint) {
}
