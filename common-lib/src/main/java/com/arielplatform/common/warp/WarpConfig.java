package com.arielplatform.common.warp;

import java.time.Duration;

/**
 * Tuning for the phase loop and its safeguards.
 *
 * @param cpuThreshold           admission limit for CPU usage, percent
 * @param memoryThreshold        admission limit for memory usage, percent
 * @param efficiencyThreshold    team efficiency needed to advance
 * @param sustainDuration        how long the efficiency must hold
 * @param stabilityCheckInterval time in a phase before stability is checked
 * @param maxErrorRate           error rate above which the phase is reverted
 * @param maxComplexity          complexity above which a warning is raised
 * @param complexityStep         complexity added per advance, removed per revert
 * @param throttleBackoff        wait after a throttled tick
 * @param pollInterval           wait after an idle or advancing tick
 * @param diversityWindow        number of recent inputs kept for diversity tracking
 * @param diversityThreshold     distinct/window ratio below which diversity is low
 */
public record WarpConfig(
    double cpuThreshold,
    double memoryThreshold,
    double efficiencyThreshold,
    Duration sustainDuration,
    Duration stabilityCheckInterval,
    double maxErrorRate,
    int maxComplexity,
    int complexityStep,
    Duration throttleBackoff,
    Duration pollInterval,
    int diversityWindow,
    double diversityThreshold
) {

    public static WarpConfig defaults() {
        return new WarpConfig(90.0, 90.0, 0.8,
            Duration.ofSeconds(3), Duration.ofSeconds(10),
            0.1, 100, 10,
            Duration.ofSeconds(1), Duration.ofMillis(100),
            100, 0.6);
    }
}
