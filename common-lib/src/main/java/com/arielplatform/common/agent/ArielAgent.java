package com.arielplatform.common.agent;

import com.arielplatform.common.decision.DecisionParameters;
import com.arielplatform.common.emotion.Emotion;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.health.ErrorRecord;
import com.arielplatform.common.health.HealingReport;
import com.arielplatform.common.health.HealthDiagnosticEngine;
import com.arielplatform.common.health.Issue;
import com.arielplatform.common.health.RecoveryContext;
import com.arielplatform.common.incentive.IncentiveCategory;
import com.arielplatform.common.incentive.IncentiveSystem;
import com.arielplatform.common.memory.ProbabilisticMemoryStore;
import com.arielplatform.common.performance.PerformanceTracker;
import com.arielplatform.common.warp.ResourceSample;
import com.arielplatform.common.warp.TickResult;
import com.arielplatform.common.warp.WarpProcessResult;
import com.arielplatform.common.warp.WarpSystem;
import reactor.core.publisher.Mono;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * One agent's control loop: phase orchestration, health and emotional feedback
 * sharing a single owner. Also the {@link RecoveryContext} its own strategies act on.
 *
 * <p>String-typed emotion and category names are parsed here; everything below works
 * on enums.
 */
public class ArielAgent implements RecoveryContext {

    private final String id;
    private final WarpSystem warp;
    private final HealthDiagnosticEngine health;
    private final EmotionalState emotions;
    private final IncentiveSystem incentives;
    private final PerformanceTracker performance;
    private final ProbabilisticMemoryStore memory;
    private final DecisionParameters decisionParameters;

    public ArielAgent(String id,
                      WarpSystem warp,
                      HealthDiagnosticEngine health,
                      EmotionalState emotions,
                      IncentiveSystem incentives,
                      PerformanceTracker performance,
                      ProbabilisticMemoryStore memory,
                      DecisionParameters decisionParameters) {
        this.id                 = id;
        this.warp               = warp;
        this.health             = health;
        this.emotions           = emotions;
        this.incentives         = incentives;
        this.performance        = performance;
        this.memory             = memory;
        this.decisionParameters = decisionParameters;
    }

    // ── phase orchestration ──────────────────────────────────────────────────

    /**
     * One phase-loop step; the stability signal is the health engine's unhealed-error rate.
     */
    public TickResult tick(ResourceSample sample, Instant now) {
        return warp.tick(sample, health.unhealedErrorRate(), now);
    }

    public WarpProcessResult processWithWarp(double[] input) {
        return warp.processWithWarp(input);
    }

    // ── health ───────────────────────────────────────────────────────────────

    public ErrorRecord logError(String type, double severity, Map<String, Object> details) {
        return health.logError(type, severity, details);
    }

    public List<Issue> diagnose() {
        return health.diagnose();
    }

    public Mono<HealingReport> heal() {
        return health.heal(this);
    }

    // ── emotion and incentives ───────────────────────────────────────────────

    public void updateEmotion(String name, double delta, Double decay) {
        Emotion emotion = Emotion.fromName(name);
        if (decay == null) {
            emotions.updateEmotion(emotion, delta);
        } else {
            emotions.updateEmotion(emotion, delta, decay);
        }
    }

    public double applyReward(String category, double magnitude) {
        return incentives.applyReward(IncentiveCategory.reward(category), magnitude, emotions);
    }

    public double applyPenalty(String category, double magnitude) {
        return incentives.applyPenalty(IncentiveCategory.penalty(category), magnitude, emotions);
    }

    public OptionalDouble recordPerformance(double value) {
        return performance.record(value);
    }

    // ── accessors ────────────────────────────────────────────────────────────

    public String id() {
        return id;
    }

    public WarpSystem warp() {
        return warp;
    }

    public HealthDiagnosticEngine health() {
        return health;
    }

    public IncentiveSystem incentives() {
        return incentives;
    }

    public PerformanceTracker performance() {
        return performance;
    }

    @Override
    public EmotionalState emotionalState() {
        return emotions;
    }

    @Override
    public ProbabilisticMemoryStore memory() {
        return memory;
    }

    @Override
    public DecisionParameters decisionParameters() {
        return decisionParameters;
    }
}
