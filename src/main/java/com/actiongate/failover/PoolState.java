package com.actiongate.failover;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Rotation position and last error of one upstream endpoint pool.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record PoolState(int currentIndex, String lastErrorAt, String lastError) {

    public static PoolState initial() {
        return new PoolState(0, null, null);
    }
}
