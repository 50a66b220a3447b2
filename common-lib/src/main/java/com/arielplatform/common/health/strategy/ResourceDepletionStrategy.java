package com.arielplatform.common.health.strategy;

import com.arielplatform.common.health.HealthMetric;
import com.arielplatform.common.health.RecoveryContext;
import com.arielplatform.common.health.RecoveryOutcome;
import com.arielplatform.common.health.RecoveryStrategy;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Models resource cleanup as a short suspension; longer when severity exceeds 5.
 * Mutates nothing beyond its gauge.
 */
public class ResourceDepletionStrategy implements RecoveryStrategy {

    public static final String KEY = "resource_depletion";

    private static final double   MAJOR_SEVERITY = 5.0;
    private static final Duration MAJOR_CLEANUP  = Duration.ofMillis(10);
    private static final Duration MINOR_CLEANUP  = Duration.ofMillis(5);

    private final Scheduler scheduler;

    public ResourceDepletionStrategy(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public HealthMetric metric() {
        return HealthMetric.RESOURCE_EFFICIENCY;
    }

    @Override
    public Mono<RecoveryOutcome> apply(double severity, RecoveryContext context) {
        if (severity > MAJOR_SEVERITY) {
            return Mono.delay(MAJOR_CLEANUP, scheduler)
                .thenReturn(new RecoveryOutcome("Major resource reallocation performed", Math.min(20, severity * 2)));
        }
        return Mono.delay(MINOR_CLEANUP, scheduler)
            .thenReturn(new RecoveryOutcome("Resource usage optimization performed", Math.min(10, severity)));
    }
}
