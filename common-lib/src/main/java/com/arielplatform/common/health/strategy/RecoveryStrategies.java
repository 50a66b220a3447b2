package com.arielplatform.common.health.strategy;

import com.arielplatform.common.health.StrategyRegistry;
import reactor.core.scheduler.Scheduler;

import java.util.Random;

/**
 * Builds the standard strategy table in its fixed selection order.
 */
public final class RecoveryStrategies {

    private RecoveryStrategies() {}

    public static StrategyRegistry standard(Random random, Scheduler scheduler) {
        StrategyRegistry registry = new StrategyRegistry();
        registry.registerAll(
            new MemoryCorruptionStrategy(random),
            new EmotionalInstabilityStrategy(),
            new ResourceDepletionStrategy(scheduler),
            new DecisionParalysisStrategy(),
            new CommunicationFailureStrategy(scheduler));
        return registry;
    }
}
