package com.arielplatform.common.incentive;

import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.exception.InvalidArgumentException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Reward and penalty bookkeeping coupled to an {@link EmotionalState}.
 *
 * <p>{@code scaled = baseWeight(category) x magnitude x scaling}, where scaling is the
 * reward or the penalty factor depending on the category kind. Every event is appended
 * to an unbounded history and applied to the emotional state through the category's
 * two-emotion rule.
 *
 * <p>{@link #adaptIncentives(double)} is a slow homeostatic controller: improving
 * performance makes rewards cheaper and penalties harsher, declining performance
 * the reverse, always within the configured scaling bounds.
 */
public class IncentiveSystem {

    private static final double TREND_DEADBAND = 0.2;
    private static final double SCALE_DOWN     = 0.95;
    private static final double SCALE_UP       = 1.05;

    private final IncentiveConfig config;
    private final Clock clock;
    private final List<RewardRecord> history = new ArrayList<>();

    private double rewardScaling  = 1.0;
    private double penaltyScaling = 1.0;

    public IncentiveSystem(IncentiveConfig config, Clock clock) {
        this.config = config;
        this.clock  = clock;
    }

    public double applyReward(IncentiveCategory category, double magnitude, EmotionalState emotionalState) {
        requireKind(category, IncentiveKind.REWARD);
        requireFinite("Magnitude", magnitude);
        double scaled = config.weight(category) * magnitude * rewardScaling;
        requireFinite("Scaled value", scaled);
        record(category, scaled);
        emotionalState.updateEmotion(category.primaryEmotion(), scaled * category.primaryFactor());
        emotionalState.updateEmotion(category.secondaryEmotion(), scaled * category.secondaryFactor());
        return scaled;
    }

    public double applyPenalty(IncentiveCategory category, double magnitude, EmotionalState emotionalState) {
        requireKind(category, IncentiveKind.PENALTY);
        requireFinite("Magnitude", magnitude);
        double scaled = config.weight(category) * magnitude * penaltyScaling;
        requireFinite("Scaled value", scaled);
        record(category, scaled);
        emotionalState.updateEmotion(category.primaryEmotion(), -scaled * category.primaryFactor());
        emotionalState.updateEmotion(category.secondaryEmotion(), -scaled * category.secondaryFactor());
        return scaled;
    }

    /**
     * Records whose age is at most {@code window}. History is not modified.
     */
    public List<RewardRecord> getRecentRewards(Duration window) {
        Instant now = clock.instant();
        List<RewardRecord> recent = new ArrayList<>();
        for (RewardRecord r : history) {
            if (Duration.between(r.timestamp(), now).compareTo(window) <= 0) {
                recent.add(r);
            }
        }
        return recent;
    }

    public double getTotalReward() {
        return history.stream().mapToDouble(RewardRecord::signedValue).sum();
    }

    public void adaptIncentives(double performanceTrend) {
        if (performanceTrend > TREND_DEADBAND) {
            rewardScaling  = Math.max(config.minScaling(), rewardScaling * SCALE_DOWN);
            penaltyScaling = Math.min(config.maxScaling(), penaltyScaling * SCALE_UP);
        } else if (performanceTrend < -TREND_DEADBAND) {
            rewardScaling  = Math.min(config.maxScaling(), rewardScaling * SCALE_UP);
            penaltyScaling = Math.max(config.minScaling(), penaltyScaling * SCALE_DOWN);
        }
    }

    public List<RewardRecord> history() {
        return Collections.unmodifiableList(history);
    }

    public double rewardScaling() {
        return rewardScaling;
    }

    public double penaltyScaling() {
        return penaltyScaling;
    }

    private void record(IncentiveCategory category, double scaled) {
        history.add(new RewardRecord(category, scaled, clock.instant()));
    }

    private static void requireFinite(String what, double value) {
        if (!Double.isFinite(value)) {
            throw new InvalidArgumentException("incentive", what + " must be finite: " + value);
        }
    }

    private static void requireKind(IncentiveCategory category, IncentiveKind kind) {
        if (category == null || category.kind() != kind) {
            throw new InvalidArgumentException("incentive",
                "Expected a " + kind.name().toLowerCase() + " category, got " + category);
        }
    }
}
