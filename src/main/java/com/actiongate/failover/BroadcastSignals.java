package com.actiongate.failover;

/**
 * Rate signals fed to the policy engine.
 *
 * @param secondsSinceLastBroadcast null when nothing was broadcast in the retention window
 */
public record BroadcastSignals(Double secondsSinceLastBroadcast, int broadcastsLastMinute, double volumeLast24h) {
}
