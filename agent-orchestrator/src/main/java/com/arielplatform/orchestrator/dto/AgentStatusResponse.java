package com.arielplatform.orchestrator.dto;

import com.arielplatform.common.emotion.EmotionSnapshot;
import com.arielplatform.common.warp.WarpStatus;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Full snapshot of one agent, taken on the agent scheduler.
 */
public record AgentStatusResponse(
    @JsonProperty("agentId")           String agentId,
    @JsonProperty("running")           boolean running,
    @JsonProperty("warp")              WarpStatus warp,
    @JsonProperty("health")            Map<String, Double> health,
    @JsonProperty("unhealedErrorRate") double unhealedErrorRate,
    @JsonProperty("emotions")          EmotionSnapshot emotions,
    @JsonProperty("rewardScaling")     double rewardScaling,
    @JsonProperty("penaltyScaling")    double penaltyScaling,
    @JsonProperty("totalReward")       double totalReward,
    @JsonProperty("decisionThreshold") double decisionThreshold,
    @JsonProperty("explorationRate")   double explorationRate
) {}
