package com.arielplatform.common.warp;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

public record WarpStatus(
    @JsonProperty("phase") Phase phase,
    @JsonProperty("phaseLevel") int phaseLevel,
    @JsonProperty("phaseStartedAt") Instant phaseStartedAt,
    @JsonProperty("complexity") int complexity,
    @JsonProperty("lightSpeed") boolean lightSpeed,
    @JsonProperty("halted") boolean halted,
    @JsonProperty("diversity") double diversity,
    @JsonProperty("teams") List<TeamStatus> teams
) {}
