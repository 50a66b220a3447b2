package com.arielplatform.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ProcessRequest(@JsonProperty("input") double[] input) {}
