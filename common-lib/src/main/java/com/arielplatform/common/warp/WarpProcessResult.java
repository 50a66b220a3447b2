package com.arielplatform.common.warp;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param output       combined team output
 * @param teamCount    number of teams that processed the input
 * @param lowDiversity whether recent inputs have become repetitive
 */
public record WarpProcessResult(
    @JsonProperty("output") double[] output,
    @JsonProperty("teamCount") int teamCount,
    @JsonProperty("lowDiversity") boolean lowDiversity
) {}
