package com.arielplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param trend set only when this sample completed an adaptation window
 */
public record PerformanceResponse(
    @JsonProperty("samples")        int samples,
    @JsonProperty("trend")          Double trend,
    @JsonProperty("rewardScaling")  double rewardScaling,
    @JsonProperty("penaltyScaling") double penaltyScaling
) {}
