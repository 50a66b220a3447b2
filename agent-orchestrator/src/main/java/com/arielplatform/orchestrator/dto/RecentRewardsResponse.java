package com.arielplatform.orchestrator.dto;

import com.arielplatform.common.incentive.RewardRecord;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record RecentRewardsResponse(
    @JsonProperty("windowSeconds") long windowSeconds,
    @JsonProperty("records")       List<RewardRecord> records,
    @JsonProperty("recentTotal")   double recentTotal,
    @JsonProperty("totalReward")   double totalReward
) {}
