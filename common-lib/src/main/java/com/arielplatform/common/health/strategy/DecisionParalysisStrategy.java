package com.arielplatform.common.health.strategy;

import com.arielplatform.common.decision.DecisionParameters;
import com.arielplatform.common.health.HealthMetric;
import com.arielplatform.common.health.RecoveryContext;
import com.arielplatform.common.health.RecoveryOutcome;
import com.arielplatform.common.health.RecoveryStrategy;
import reactor.core.publisher.Mono;

/**
 * Resets the decision threshold; above severity 6 also raises the exploration
 * rate by {@code severity / 20}, capped at 0.3.
 */
public class DecisionParalysisStrategy implements RecoveryStrategy {

    public static final String KEY = "decision_paralysis";

    private static final double SEVERE_SEVERITY      = 6.0;
    private static final double MAX_EXPLORATION_RATE = 0.3;

    @Override
    public String key() {
        return KEY;
    }

    @Override
    public HealthMetric metric() {
        return HealthMetric.DECISION_QUALITY;
    }

    @Override
    public Mono<RecoveryOutcome> apply(double severity, RecoveryContext context) {
        return Mono.fromCallable(() -> {
            DecisionParameters params = context.decisionParameters();
            params.resetDecisionThreshold();

            if (severity > SEVERE_SEVERITY) {
                params.setExplorationRate(Math.min(MAX_EXPLORATION_RATE, params.explorationRate() + severity / 20));
                return new RecoveryOutcome("Decision system reset with increased exploration", Math.min(30, severity * 3));
            }
            return new RecoveryOutcome("Decision thresholds reset", Math.min(15, severity * 1.5));
        });
    }
}
