package com.arielplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record EfficiencyRequest(@JsonProperty("efficiency") double efficiency) {}
