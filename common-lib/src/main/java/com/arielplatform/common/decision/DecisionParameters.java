package com.arielplatform.common.decision;

/**
 * Decision tuning owned by the host agent and rewritten by the
 * decision-paralysis recovery strategy.
 */
public class DecisionParameters {

    public static final double DEFAULT_DECISION_THRESHOLD = 0.6;
    public static final double DEFAULT_EXPLORATION_RATE   = 0.1;

    private double decisionThreshold = DEFAULT_DECISION_THRESHOLD;
    private double explorationRate   = DEFAULT_EXPLORATION_RATE;

    public double decisionThreshold() {
        return decisionThreshold;
    }

    public void setDecisionThreshold(double decisionThreshold) {
        this.decisionThreshold = decisionThreshold;
    }

    public double explorationRate() {
        return explorationRate;
    }

    public void setExplorationRate(double explorationRate) {
        this.explorationRate = explorationRate;
    }

    public void resetDecisionThreshold() {
        this.decisionThreshold = DEFAULT_DECISION_THRESHOLD;
    }
}
