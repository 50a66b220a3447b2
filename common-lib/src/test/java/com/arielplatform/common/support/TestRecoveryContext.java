package com.arielplatform.common.support;

import com.arielplatform.common.decision.DecisionParameters;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.health.RecoveryContext;
import com.arielplatform.common.memory.ProbabilisticMemoryStore;

public record TestRecoveryContext(
    EmotionalState emotionalState,
    ProbabilisticMemoryStore memory,
    DecisionParameters decisionParameters
) implements RecoveryContext {

    public static TestRecoveryContext fresh() {
        return new TestRecoveryContext(new EmotionalState(), new ArrayMemoryStore(10), new DecisionParameters());
    }
}
