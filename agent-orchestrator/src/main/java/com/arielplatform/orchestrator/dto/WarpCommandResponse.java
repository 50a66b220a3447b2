package com.arielplatform.orchestrator.dto;

import com.arielplatform.common.warp.Phase;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param accepted false when a start was ignored because the loop was already running
 */
public record WarpCommandResponse(
    @JsonProperty("accepted") boolean accepted,
    @JsonProperty("running")  boolean running,
    @JsonProperty("phase")    Phase phase
) {}
