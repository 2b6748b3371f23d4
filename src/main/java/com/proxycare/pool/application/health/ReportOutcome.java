package com.proxycare.pool.application.health;

/**
 * Result of one {@link HealthTracker#report(Long, Integer)} call.
 *
 * @param counter        running count for this (proxy, status) pair after the report
 * @param blocked        whether the proxy is blocked after the report
 * @param blockedByReport whether this report caused the transition to blocked
 */
public record ReportOutcome(
        Long proxyId,
        int statusCode,
        long counter,
        boolean blocked,
        boolean blockedByReport,
        BlockReason reason,
        double failureRatio
) {
}
