package com.arielplatform.orchestrator.config;

import com.arielplatform.common.agent.ArielAgent;
import com.arielplatform.common.decision.DecisionParameters;
import com.arielplatform.common.emotion.EmotionalState;
import com.arielplatform.common.health.HealthConfig;
import com.arielplatform.common.health.HealthDiagnosticEngine;
import com.arielplatform.common.health.StrategyRegistry;
import com.arielplatform.common.health.strategy.RecoveryStrategies;
import com.arielplatform.common.incentive.IncentiveConfig;
import com.arielplatform.common.incentive.IncentiveSystem;
import com.arielplatform.common.performance.PerformanceTracker;
import com.arielplatform.common.warp.WarpConfig;
import com.arielplatform.common.warp.WarpSystem;
import com.arielplatform.orchestrator.memory.ClassicalMemoryBank;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import reactor.core.scheduler.Scheduler;
import reactor.core.scheduler.Schedulers;

import java.time.Clock;
import java.time.Duration;
import java.util.Map;
import java.util.Random;

@Configuration
public class OrchestratorConfig {

    @Value("${agent.id:ariel-1}")
    private String agentId;

    @Value("${agent.resources.cpu-threshold:90}")
    private double cpuThreshold;

    @Value("${agent.resources.memory-threshold:90}")
    private double memoryThreshold;

    @Value("${agent.warp.efficiency-threshold:0.8}")
    private double efficiencyThreshold;

    @Value("${agent.warp.sustain-duration:3s}")
    private Duration sustainDuration;

    @Value("${agent.warp.stability-check-interval:10s}")
    private Duration stabilityCheckInterval;

    @Value("${agent.warp.max-error-rate:0.1}")
    private double maxErrorRate;

    @Value("${agent.warp.max-complexity:100}")
    private int maxComplexity;

    @Value("${agent.warp.throttle-backoff:1s}")
    private Duration throttleBackoff;

    @Value("${agent.warp.poll-interval:100ms}")
    private Duration pollInterval;

    @Value("${agent.warp.diversity-window:100}")
    private int diversityWindow;

    @Value("${agent.warp.diversity-threshold:0.6}")
    private double diversityThreshold;

    @Value("${agent.health.error-log-capacity:100}")
    private int errorLogCapacity;

    @Value("${agent.emotion.decay-factor:0.9}")
    private double decayFactor;

    @Value("${agent.incentive.min-scaling:0.5}")
    private double minScaling;

    @Value("${agent.incentive.max-scaling:1.5}")
    private double maxScaling;

    @Value("${agent.memory.size:10}")
    private int memorySize;

    @Value("${agent.performance.adaptation-window:100}")
    private int adaptationWindow;

    @Bean
    public WarpConfig warpConfig() {
        return new WarpConfig(cpuThreshold, memoryThreshold, efficiencyThreshold,
            sustainDuration, stabilityCheckInterval, maxErrorRate, maxComplexity, 10,
            throttleBackoff, pollInterval, diversityWindow, diversityThreshold);
    }

    @Bean
    public HealthConfig healthConfig() {
        HealthConfig defaults = HealthConfig.defaults();
        return new HealthConfig(errorLogCapacity, defaults.criticalThreshold(),
            defaults.recurringMinCount(), defaults.maxIssuesPerHeal());
    }

    @Bean
    public IncentiveConfig incentiveConfig() {
        return new IncentiveConfig(Map.of(), minScaling, maxScaling);
    }

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    /**
     * Single thread that owns every mutation of the agent.
     */
    @Bean(destroyMethod = "dispose")
    public Scheduler agentScheduler() {
        return Schedulers.newSingle("ariel-agent");
    }

    @Bean
    public ClassicalMemoryBank memoryBank() {
        return new ClassicalMemoryBank(memorySize, new Random());
    }

    @Bean
    public StrategyRegistry strategyRegistry(@Qualifier("agentScheduler") Scheduler agentScheduler) {
        return RecoveryStrategies.standard(new Random(), agentScheduler);
    }

    @Bean
    public ArielAgent arielAgent(WarpConfig warpConfig,
                                 HealthConfig healthConfig,
                                 IncentiveConfig incentiveConfig,
                                 StrategyRegistry strategyRegistry,
                                 ClassicalMemoryBank memoryBank,
                                 Clock clock) {
        IncentiveSystem incentives = new IncentiveSystem(incentiveConfig, clock);
        return new ArielAgent(agentId,
            new WarpSystem(warpConfig),
            new HealthDiagnosticEngine(healthConfig, strategyRegistry, clock),
            new EmotionalState(decayFactor),
            incentives,
            new PerformanceTracker(adaptationWindow, incentives),
            memoryBank,
            new DecisionParameters());
    }

    @Bean
    public ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        return mapper;
    }
}
