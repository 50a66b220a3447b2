package com.arielplatform.orchestrator.service;

import com.arielplatform.common.agent.ArielAgent;
import com.arielplatform.common.emotion.EmotionSnapshot;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.exception.InvalidArgumentException;
import com.arielplatform.common.health.ErrorRecord;
import com.arielplatform.common.health.HealingReport;
import com.arielplatform.common.health.HealthMetric;
import com.arielplatform.common.health.Issue;
import com.arielplatform.common.incentive.IncentiveSystem;
import com.arielplatform.common.incentive.RewardRecord;
import com.arielplatform.common.trace.AgentContextUtil;
import com.arielplatform.common.warp.Phase;
import com.arielplatform.common.warp.TeamStatus;
import com.arielplatform.common.warp.WarpProcessResult;
import com.arielplatform.orchestrator.dto.AgentStatusResponse;
import com.arielplatform.orchestrator.dto.EmotionalDistanceResponse;
import com.arielplatform.orchestrator.dto.ErrorReportRequest;
import com.arielplatform.orchestrator.dto.IncentiveResponse;
import com.arielplatform.orchestrator.dto.PerformanceResponse;
import com.arielplatform.orchestrator.dto.RecentRewardsResponse;
import com.arielplatform.orchestrator.dto.WarpCommandResponse;
import com.arielplatform.orchestrator.event.ControlLoopEvent;
import com.arielplatform.orchestrator.event.ControlLoopEventBus;
import com.arielplatform.orchestrator.event.ControlLoopEventType;
import com.arielplatform.orchestrator.logger.ControlLoopFlowLogger;
import com.arielplatform.orchestrator.loop.WarpSequenceRunner;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.scheduler.Scheduler;

import java.time.Clock;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;
import java.util.concurrent.Callable;

/**
 * Host-facing operations on the agent. Every call that reads or mutates agent state
 * is shifted onto the agent scheduler, so the agent itself needs no locking.
 */
@Service
public class AgentControlService {

    private static final Logger log = LoggerFactory.getLogger(AgentControlService.class);

    private final ArielAgent agent;
    private final WarpSequenceRunner runner;
    private final Scheduler scheduler;
    private final ControlLoopEventBus eventBus;
    private final ControlLoopFlowLogger flowLogger;
    private final Clock clock;

    public AgentControlService(ArielAgent agent,
                               WarpSequenceRunner runner,
                               @Qualifier("agentScheduler") Scheduler scheduler,
                               ControlLoopEventBus eventBus,
                               ControlLoopFlowLogger flowLogger,
                               Clock clock) {
        this.agent      = agent;
        this.runner     = runner;
        this.scheduler  = scheduler;
        this.eventBus   = eventBus;
        this.flowLogger = flowLogger;
        this.clock      = clock;
    }

    // ── status ────────────────────────────────────────────────────────────────

    public Mono<AgentStatusResponse> status() {
        return onAgent(() -> {
            Map<String, Double> health = new LinkedHashMap<>();
            for (Map.Entry<HealthMetric, Double> e : agent.health().metrics().entrySet()) {
                health.put(e.getKey().key(), e.getValue());
            }
            IncentiveSystem incentives = agent.incentives();
            return new AgentStatusResponse(
                agent.id(),
                runner.isRunning(),
                agent.warp().status(),
                health,
                agent.health().unhealedErrorRate(),
                agent.emotionalState().snapshot(),
                incentives.rewardScaling(),
                incentives.penaltyScaling(),
                incentives.getTotalReward(),
                agent.decisionParameters().decisionThreshold(),
                agent.decisionParameters().explorationRate());
        });
    }

    // ── warp sequence ─────────────────────────────────────────────────────────

    public Mono<WarpCommandResponse> startWarp() {
        return Mono.fromCallable(() -> {
            boolean accepted = runner.start();
            log.info("Warp start requested. accepted={} agentId={}", accepted, agent.id());
            return accepted;
        }).flatMap(accepted -> onAgent(() ->
            new WarpCommandResponse(accepted, runner.isRunning(), agent.warp().phase())));
    }

    public Mono<WarpCommandResponse> stopWarp() {
        return Mono.fromRunnable(runner::stop)
            .then(onAgent(() -> new WarpCommandResponse(true, runner.isRunning(), agent.warp().phase())));
    }

    public Mono<WarpCommandResponse> restartWarp() {
        return Mono.fromRunnable(runner::restart)
            .then(onAgent(() -> new WarpCommandResponse(true, runner.isRunning(), agent.warp().phase())));
    }

    public Mono<WarpProcessResult> process(double[] input) {
        return onAgent(() -> {
            WarpProcessResult result = agent.processWithWarp(input);
            if (result.lowDiversity()) {
                log.warn("Low task diversity detected. Potential overfitting risk. agentId={}", agent.id());
                publish(ControlLoopEventType.LOW_DIVERSITY, "teams=" + result.teamCount());
            }
            return result;
        });
    }

    public Mono<TeamStatus> setTeamEfficiency(String phaseName, double efficiency) {
        return onAgent(() -> {
            Phase phase = Phase.fromName(phaseName);
            agent.warp().setTeamEfficiency(phase, efficiency);
            return agent.warp().status().teams().get(phase.ordinal());
        });
    }

    // ── health ────────────────────────────────────────────────────────────────

    public Mono<ErrorRecord> logError(ErrorReportRequest request) {
        return onAgent(() -> {
            ErrorRecord record = agent.logError(request.type(), request.severity(), request.details());
            log.info("Error logged. type={} severity={} id={} agentId={}",
                     record.type(), record.severity(), record.id(), agent.id());
            return record;
        });
    }

    public Mono<List<Issue>> diagnose() {
        return onAgent(agent::diagnose);
    }

    public Mono<HealingReport> heal() {
        Mono<HealingReport> healing = Mono.defer(agent::heal)
            .subscribeOn(scheduler)
            .doOnEach(flowLogger.stage(ControlLoopFlowLogger.HEALING_COMPLETED))
            .doOnNext(report -> publish(ControlLoopEventType.HEALING_COMPLETED,
                                        report.status() + " actions=" + report.actionsTaken().size()))
            .doOnError(e -> log.error("Healing failed. agentId={}", agent.id(), e));
        return AgentContextUtil.withAgentId(healing, agent.id());
    }

    // ── emotion and incentives ────────────────────────────────────────────────

    public Mono<EmotionSnapshot> updateEmotion(String name, double delta, Double decay) {
        return onAgent(() -> {
            agent.updateEmotion(name, delta, decay);
            return agent.emotionalState().snapshot();
        });
    }

    public Mono<EmotionalDistanceResponse> emotionalDistance(List<Double> intensities) {
        return onAgent(() -> {
            if (intensities == null) {
                throw new InvalidArgumentException("emotion", "Intensities are required");
            }
            EmotionalState other = EmotionalState.of(intensities.stream().mapToDouble(Double::doubleValue).toArray());
            EmotionalState own = agent.emotionalState();
            return new EmotionalDistanceResponse(own.emotionalDistance(other), own.emotionalVector());
        });
    }

    public Mono<IncentiveResponse> applyReward(String category, double magnitude) {
        return onAgent(() -> {
            double scaled = agent.applyReward(category, magnitude);
            return incentiveResponse(category, scaled);
        });
    }

    public Mono<IncentiveResponse> applyPenalty(String category, double magnitude) {
        return onAgent(() -> {
            double scaled = agent.applyPenalty(category, magnitude);
            return incentiveResponse(category, scaled);
        });
    }

    public Mono<RecentRewardsResponse> recentRewards(long windowSeconds) {
        return onAgent(() -> {
            if (windowSeconds < 0) {
                throw new InvalidArgumentException("incentive", "Window must be >= 0 seconds: " + windowSeconds);
            }
            List<RewardRecord> recent = agent.incentives().getRecentRewards(Duration.ofSeconds(windowSeconds));
            double recentTotal = recent.stream().mapToDouble(RewardRecord::signedValue).sum();
            return new RecentRewardsResponse(windowSeconds, recent, recentTotal, agent.incentives().getTotalReward());
        });
    }

    public Mono<PerformanceResponse> recordPerformance(double value) {
        return onAgent(() -> {
            OptionalDouble trend = agent.recordPerformance(value);
            IncentiveSystem incentives = agent.incentives();
            if (trend.isPresent()) {
                log.info("Incentives adapted. trend={} rewardScaling={} penaltyScaling={} agentId={}",
                         trend.getAsDouble(), incentives.rewardScaling(), incentives.penaltyScaling(), agent.id());
                publish(ControlLoopEventType.INCENTIVES_ADAPTED, "trend=" + trend.getAsDouble());
            }
            return new PerformanceResponse(
                agent.performance().history().size(),
                trend.isPresent() ? trend.getAsDouble() : null,
                incentives.rewardScaling(),
                incentives.penaltyScaling());
        });
    }

    // ── events ────────────────────────────────────────────────────────────────

    public Flux<ControlLoopEvent> events() {
        return eventBus.stream();
    }

    private IncentiveResponse incentiveResponse(String category, double scaled) {
        return new IncentiveResponse(category, scaled,
            agent.incentives().getTotalReward(), agent.emotionalState().snapshot());
    }

    private void publish(ControlLoopEventType type, String detail) {
        eventBus.publish(new ControlLoopEvent(type, agent.id(), agent.warp().phase(), detail, clock.instant()));
    }

    private <T> Mono<T> onAgent(Callable<T> action) {
        return Mono.fromCallable(action).subscribeOn(scheduler);
    }
}
