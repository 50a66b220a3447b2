package com.arielplatform.common.warp;

import com.fasterxml.jackson.annotation.JsonProperty;

public record TeamStatus(
    @JsonProperty("name") String name,
    @JsonProperty("phase") Phase phase,
    @JsonProperty("active") boolean active,
    @JsonProperty("efficiency") double efficiency
) {

    static TeamStatus of(Team team) {
        return new TeamStatus(team.name(), team.phase(), team.isActive(), team.efficiency());
    }
}
