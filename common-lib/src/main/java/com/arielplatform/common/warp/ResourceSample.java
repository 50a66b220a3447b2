package com.arielplatform.common.warp;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Point-in-time host load, both values in percent.
 */
public record ResourceSample(
    @JsonProperty("cpuPercent") double cpuPercent,
    @JsonProperty("memoryPercent") double memoryPercent
) {

    public static ResourceSample idle() {
        return new ResourceSample(0.0, 0.0);
    }

    public boolean isOverloaded(double cpuThreshold, double memoryThreshold) {
        return cpuPercent > cpuThreshold || memoryPercent > memoryThreshold;
    }
}
