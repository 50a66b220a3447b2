package com.arielplatform.orchestrator.dto;

import com.arielplatform.common.emotion.EmotionSnapshot;
import com.fasterxml.jackson.annotation.JsonProperty;

public record IncentiveResponse(
    @JsonProperty("category")    String category,
    @JsonProperty("scaledValue") double scaledValue,
    @JsonProperty("totalReward") double totalReward,
    @JsonProperty("emotions")    EmotionSnapshot emotions
) {}
