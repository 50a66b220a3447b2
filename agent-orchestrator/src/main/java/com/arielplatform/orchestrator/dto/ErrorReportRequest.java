package com.arielplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

public record ErrorReportRequest(
    @JsonProperty("type")     String type,
    @JsonProperty("severity") double severity,
    @JsonProperty("details")  Map<String, Object> details
) {}
