package com.arielplatform.common.health;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * The five subsystem gauges, each in [0, 100], with the error types that erode it.
 */
public enum HealthMetric {
    MEMORY_INTEGRITY         (List.of("memory_corruption", "memory_leak")),
    EMOTIONAL_BALANCE        (List.of("emotional_instability", "emotional_deadlock")),
    RESOURCE_EFFICIENCY      (List.of("resource_depletion", "resource_contention")),
    DECISION_QUALITY         (List.of("decision_paralysis", "decision_oscillation")),
    COMMUNICATION_RELIABILITY(List.of("communication_failure", "protocol_violation"));

    public static final double MIN = 0.0;
    public static final double MAX = 100.0;

    private final List<String> errorTypes;

    HealthMetric(List<String> errorTypes) {
        this.errorTypes = errorTypes;
    }

    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public List<String> errorTypes() {
        return errorTypes;
    }

    /** Gauge eroded by an error type; empty for types outside the table. */
    public static Optional<HealthMetric> forErrorType(String errorType) {
        for (HealthMetric m : values()) {
            if (m.errorTypes.contains(errorType)) return Optional.of(m);
        }
        return Optional.empty();
    }
}
