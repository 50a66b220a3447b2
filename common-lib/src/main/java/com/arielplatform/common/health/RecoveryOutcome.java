package com.arielplatform.common.health;

/**
 * What a strategy did, and how much its gauge should recover.
 */
public record RecoveryOutcome(String description, double metricGain) {}
