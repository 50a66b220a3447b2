package com.arielplatform.common.health;

/**
 * Thresholds of the diagnostic engine.
 *
 * @param errorLogCapacity     ring-buffer size of the error log
 * @param criticalThreshold    gauges below this value raise a critical issue
 * @param recurringMinCount    unhealed occurrences of one type that make it recurring
 * @param maxIssuesPerHeal     issues addressed per {@code heal()} call, by severity
 */
public record HealthConfig(
    int    errorLogCapacity,
    double criticalThreshold,
    int    recurringMinCount,
    int    maxIssuesPerHeal
) {

    public static HealthConfig defaults() {
        return new HealthConfig(100, 50.0, 3, 3);
    }
}
