package com.arielplatform.common.health;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record HealingReport(
    @JsonProperty("status")        HealingStatus status,
    @JsonProperty("actionsTaken")  List<HealingAction> actionsTaken
) {

    public static HealingReport healthy() {
        return new HealingReport(HealingStatus.HEALTHY, List.of());
    }
}
