package com.arielplatform.common.health.strategy;

import com.arielplatform.common.health.HealthMetric;
import com.arielplatform.common.health.RecoveryContext;
import com.arielplatform.common.health.RecoveryOutcome;
import com.arielplatform.common.health.RecoveryStrategy;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Duration;

/**
 * Models protocol reinitialisation as a short suspension.
 */
public class CommunicationFailureStrategy implements RecoveryStrategy {

    public static final String KEY = "communication_failure";

    private static final Duration PROTOCOL_RESET = Duration.ofMillis(20);

    private final Scheduler scheduler;

    public CommunicationFailureStrategy(Scheduler scheduler) {
        this.scheduler = scheduler;
    }

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public HealthMetric metric() {
        return HealthMetric.COMMUNICATION_RELIABILITY;
    }

    @Override
    public Mono<RecoveryOutcome> apply(double severity, RecoveryContext context) {
        return Mono.delay(PROTOCOL_RESET, scheduler)
            .thenReturn(new RecoveryOutcome("Communication protocols reset and reinitialized",
                Math.min(25, severity * 2.5)));
    }
}
