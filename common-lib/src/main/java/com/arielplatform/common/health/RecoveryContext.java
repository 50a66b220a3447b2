package com.arielplatform.common.health;

import com.arielplatform.common.decision.DecisionParameters;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.memory.ProbabilisticMemoryStore;

/**
 * The parts of the agent a recovery strategy is allowed to touch.
 */
public interface RecoveryContext {

    EmotionalState emotionalState();

    ProbabilisticMemoryStore memory();

    DecisionParameters decisionParameters();
}
