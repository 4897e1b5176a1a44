package com.unwind.backend.modules.database.domain;

/**
 * Point-in-time figures for the executor's connection pool.
 */
public record PoolStatsSnapshot(
        String poolName,
        int maxPoolSize,
        int minIdle,
        int activeConnections,
        int idleConnections,
        int totalConnections,
        int threadsAwaitingConnection
) {
}
