package com.arielplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record IncentiveRequest(@JsonProperty("magnitude") double magnitude) {}
