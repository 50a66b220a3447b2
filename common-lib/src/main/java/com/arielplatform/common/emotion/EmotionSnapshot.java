package com.arielplatform.common.emotion;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Read-only view of an {@link EmotionalState}, keyed by lower-case emotion name.
 */
public record EmotionSnapshot(
    @JsonProperty("intensities")        Map<String, Double> intensities,
    @JsonProperty("stability")          double stability,
    @JsonProperty("adaptability")       double adaptability,
    @JsonProperty("socialAlignment")    double socialAlignment,
    @JsonProperty("dominantEmotion")    String dominantEmotion,
    @JsonProperty("dominantIntensity")  double dominantIntensity
) {}
