package com.arielplatform.common.health;

import com.fasterxml.jackson.annotation.JsonProperty;

public record HealingAction(
    @JsonProperty("issue")    String issue,
    @JsonProperty("strategy") String strategy,
    @JsonProperty("result")   String result
) {}
