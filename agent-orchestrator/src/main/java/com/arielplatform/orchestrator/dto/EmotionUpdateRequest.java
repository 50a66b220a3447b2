package com.arielplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param decay multiplier for the other emotions; the configured default when absent
 */
public record EmotionUpdateRequest(
    @JsonProperty("delta") double delta,
    @JsonProperty("decay") Double decay
) {}
