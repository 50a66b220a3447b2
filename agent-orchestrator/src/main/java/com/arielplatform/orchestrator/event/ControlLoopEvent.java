package com.arielplatform.orchestrator.event;

import com.arielplatform.common.warp.Phase;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One notable control-loop transition, pushed to {@code /events} subscribers.
 */
public record ControlLoopEvent(
    @JsonProperty("type")      ControlLoopEventType type,
    @JsonProperty("agentId")   String agentId,
    @JsonProperty("phase")     Phase phase,
    @JsonProperty("detail")    String detail,
    @JsonProperty("timestamp") Instant timestamp
) {}
