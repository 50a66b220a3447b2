package com.arielplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record PerformanceRequest(@JsonProperty("value") double value) {}
