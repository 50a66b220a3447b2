package com.arielplatform.common.incentive;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One applied reward (positive) or penalty (negative).
 */
public record RewardRecord(
    @JsonProperty("category")     IncentiveCategory category,
    @JsonProperty("signedValue")  double signedValue,
    @JsonProperty("timestamp")    Instant timestamp
) {}
