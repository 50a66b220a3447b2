package com.arielplatform.common.health;

import reactor.core.publisher.Mono;

/**
 * A named remediation procedure.
 *
 * <p>Strategies are stateless with respect to the agent: everything they mutate
 * comes in through the {@link RecoveryContext}. The returned {@link Mono} performs
 * the work on subscription and may suspend to model remediation latency. A strategy
 * that cannot act still emits a benign outcome.
 */
public interface RecoveryStrategy {

    /**
     * Matching key; selected for an issue when the key is a substring of the
     * issue's subject.
     */
    String key();

    /** Gauge raised by {@link RecoveryOutcome#metricGain()}. */
    HealthMetric metric();

    Mono<RecoveryOutcome> apply(double severity, RecoveryContext context);
}
