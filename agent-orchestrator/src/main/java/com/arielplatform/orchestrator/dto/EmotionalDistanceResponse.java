package com.arielplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EmotionalDistanceResponse(
    @JsonProperty("distance")        double distance,
    @JsonProperty("emotionalVector") double[] emotionalVector
) {}
